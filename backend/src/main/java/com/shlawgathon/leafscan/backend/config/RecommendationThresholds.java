package com.shlawgathon.leafscan.backend.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecommendationThresholds {

    @Builder.Default
    double reliable = 80;

    @Builder.Default
    double probable = 50;

    public static RecommendationThresholds defaults() {
        return builder().build();
    }
}
