package com.shlawgathon.leafscan.backend.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DiagnosisSettings {

    /**
     * Neighbors retrieved per query.
     */
    @Builder.Default
    int k = 5;

    /**
     * Added to every distance before inverting it into a vote weight, so exact matches stay finite.
     */
    @Builder.Default
    double distanceEpsilon = 1e-6;

    public static DiagnosisSettings defaults() {
        return builder().build();
    }
}
