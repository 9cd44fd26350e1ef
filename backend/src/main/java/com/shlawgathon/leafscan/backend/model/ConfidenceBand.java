package com.shlawgathon.leafscan.backend.model;

/**
 * Coarse confidence ranges used in evaluation summaries.
 */
public enum ConfidenceBand {
    HIGH,   // >= 80
    MEDIUM, // [60, 80)
    LOW;    // < 60

    public static ConfidenceBand of(double confidence) {
        if (confidence >= 80) {
            return HIGH;
        }
        if (confidence >= 60) {
            return MEDIUM;
        }
        return LOW;
    }
}
