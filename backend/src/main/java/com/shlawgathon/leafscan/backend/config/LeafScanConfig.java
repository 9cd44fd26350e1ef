package com.shlawgathon.leafscan.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the {@code leafscan.*} properties into the settings objects the pipeline is built from.
 */
@Configuration
public class LeafScanConfig {

    @Value("${leafscan.features.min-width:16}")
    private int minWidth;

    @Value("${leafscan.features.min-height:16}")
    private int minHeight;

    @Value("${leafscan.features.lesion.baseline-hue-min:35}")
    private int baselineHueMin;

    @Value("${leafscan.features.lesion.baseline-hue-max:85}")
    private int baselineHueMax;

    @Value("${leafscan.features.lesion.min-saturation:40}")
    private int minSaturation;

    @Value("${leafscan.features.lesion.min-value:40}")
    private int minValue;

    @Value("${leafscan.features.lesion.min-blob-area:4}")
    private int minBlobArea;

    @Value("${leafscan.diagnosis.k:5}")
    private int k;

    @Value("${leafscan.diagnosis.distance-epsilon:1e-6}")
    private double distanceEpsilon;

    @Value("${leafscan.risk.low-confidence:60}")
    private double lowConfidence;

    @Value("${leafscan.risk.moderate-confidence:80}")
    private double moderateConfidence;

    @Value("${leafscan.risk.min-agreement:0.6}")
    private double minAgreement;

    @Value("${leafscan.risk.similarity-gap:0.25}")
    private double similarityGap;

    @Value("${leafscan.risk.feature-variability:0.15}")
    private double featureVariability;

    @Value("${leafscan.recommendation.reliable:80}")
    private double reliable;

    @Value("${leafscan.recommendation.probable:50}")
    private double probable;

    @Bean
    public FeatureExtractionSettings featureExtractionSettings() {
        if (baselineHueMin > baselineHueMax) {
            throw new IllegalStateException("leafscan.features.lesion.baseline-hue-min must not exceed baseline-hue-max");
        }
        return FeatureExtractionSettings.builder()
                .minWidth(minWidth)
                .minHeight(minHeight)
                .baselineHueMin(baselineHueMin)
                .baselineHueMax(baselineHueMax)
                .minSaturation(minSaturation)
                .minValue(minValue)
                .minBlobArea(minBlobArea)
                .build();
    }

    @Bean
    public DiagnosisSettings diagnosisSettings() {
        if (k < 1) {
            throw new IllegalStateException("leafscan.diagnosis.k must be at least 1, got " + k);
        }
        return DiagnosisSettings.builder()
                .k(k)
                .distanceEpsilon(distanceEpsilon)
                .build();
    }

    @Bean
    public RiskThresholds riskThresholds() {
        if (similarityGap <= 0 || featureVariability <= 0) {
            throw new IllegalStateException("leafscan.risk.similarity-gap and feature-variability must be positive");
        }
        return RiskThresholds.builder()
                .lowConfidence(lowConfidence)
                .moderateConfidence(moderateConfidence)
                .minAgreement(minAgreement)
                .similarityGap(similarityGap)
                .featureVariability(featureVariability)
                .build();
    }

    @Bean
    public RecommendationThresholds recommendationThresholds() {
        return RecommendationThresholds.builder()
                .reliable(reliable)
                .probable(probable)
                .build();
    }
}
