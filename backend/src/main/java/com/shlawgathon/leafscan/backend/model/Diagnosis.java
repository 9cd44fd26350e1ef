package com.shlawgathon.leafscan.backend.model;

import lombok.Builder;
import lombok.Value;

/**
 * Full single-image answer: vote outcome, revocation risk and recommendation.
 */
@Value
@Builder
public class Diagnosis {
    FeatureVector features;
    DiagnosisResult result;
    RiskAssessment risk;
    Recommendation recommendation;

    /**
     * Id under which the query image was indexed, or null when it was not stored.
     */
    String indexedRecordId;
}
