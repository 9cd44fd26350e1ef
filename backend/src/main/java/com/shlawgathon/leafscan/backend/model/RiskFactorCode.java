package com.shlawgathon.leafscan.backend.model;

/**
 * Conditions that raise the revocation risk of a diagnosis, in evaluation order.
 */
public enum RiskFactorCode {
    LOW_CONFIDENCE("low confidence"),
    MODERATE_CONFIDENCE("moderate confidence"),
    LOW_CATEGORY_CONSISTENCY("low category consistency"),
    HIGH_SIMILARITY_VARIANCE("high similarity variance"),
    HIGH_FEATURE_VARIABILITY("high feature variability");

    private final String label;

    RiskFactorCode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
