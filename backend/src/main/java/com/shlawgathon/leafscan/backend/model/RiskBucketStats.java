package com.shlawgathon.leafscan.backend.model;

import lombok.Builder;
import lombok.Value;

/**
 * Accuracy of the predictions that fell into one risk level.
 */
@Value
@Builder
public class RiskBucketStats {
    RiskLevel level;
    long count;
    long correct;
    double accuracy;
    double meanConfidence;
    double meanRiskScore;
}
