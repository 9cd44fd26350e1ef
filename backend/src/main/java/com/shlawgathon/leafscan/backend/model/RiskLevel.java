package com.shlawgathon.leafscan.backend.model;

/**
 * Revocation risk band of a diagnosis.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static RiskLevel fromScore(double score) {
        if (score >= 0.7) {
            return HIGH;
        }
        if (score >= 0.4) {
            return MEDIUM;
        }
        return LOW;
    }
}
