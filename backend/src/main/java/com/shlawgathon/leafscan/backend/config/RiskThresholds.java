package com.shlawgathon.leafscan.backend.config;

import lombok.Builder;
import lombok.Value;

/**
 * Trigger points of the revocation risk policy.
 *
 * @see com.shlawgathon.leafscan.backend.service.RiskPredictionService
 */
@Value
@Builder
public class RiskThresholds {

    /**
     * Confidence (percent) below which a diagnosis counts as low confidence.
     */
    @Builder.Default
    double lowConfidence = 60;

    /**
     * Confidence (percent) below which a diagnosis counts as moderate confidence.
     */
    @Builder.Default
    double moderateConfidence = 80;

    /**
     * Category agreement ratio below which neighbors count as inconsistent. Strict comparison.
     */
    @Builder.Default
    double minAgreement = 0.6;

    /**
     * Max minus min neighbor similarity above which the neighborhood counts as spread out.
     */
    @Builder.Default
    double similarityGap = 0.25;

    /**
     * Shape-band variability above which neighbors count as dissimilar in shape.
     */
    @Builder.Default
    double featureVariability = 0.15;

    public static RiskThresholds defaults() {
        return builder().build();
    }
}
