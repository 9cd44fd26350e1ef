package com.shlawgathon.leafscan.backend.model;

/**
 * How far a single diagnosis can be trusted before a specialist looks at the plant.
 */
public enum Recommendation {
    RELIABLE, // high confidence, confirm and look up treatment
    PROBABLE, // inspect the plant and take more photos
    UNCERTAIN // retake photos with better light and focus
}
