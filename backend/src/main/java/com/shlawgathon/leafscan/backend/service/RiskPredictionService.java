package com.shlawgathon.leafscan.backend.service;

import com.shlawgathon.leafscan.backend.config.RiskThresholds;
import com.shlawgathon.leafscan.backend.model.DiagnosisResult;
import com.shlawgathon.leafscan.backend.model.NeighborStatistics;
import com.shlawgathon.leafscan.backend.model.RiskAssessment;
import com.shlawgathon.leafscan.backend.model.RiskFactor;
import com.shlawgathon.leafscan.backend.model.RiskFactorCode;
import com.shlawgathon.leafscan.backend.model.RiskLevel;
import org.springframework.stereotype.Service;

/**
 * Scores how likely a diagnosis is to be revoked on review.
 * <p>
 * Conditions are checked in a fixed order and each adds its delta independently:
 * <pre>
 *   confidence &lt; lowConfidence                       +0.40  low confidence
 *   lowConfidence &lt;= confidence &lt; moderateConfidence  +0.20  moderate confidence
 *   agreement &lt; minAgreement                         +0.25  low category consistency
 *   similarity gap &gt; similarityGap                   +0.20  high similarity variance
 *   shape variability &gt; featureVariability           +0.15  high feature variability
 * </pre>
 * The sum is clipped to [0, 1]; below 0.4 is LOW, below 0.7 MEDIUM, otherwise HIGH.
 */
@Service
public class RiskPredictionService {

    static final double LOW_CONFIDENCE_DELTA = 0.40;
    static final double MODERATE_CONFIDENCE_DELTA = 0.20;
    static final double LOW_CONSISTENCY_DELTA = 0.25;
    static final double SIMILARITY_VARIANCE_DELTA = 0.20;
    static final double FEATURE_VARIABILITY_DELTA = 0.15;

    private final RiskThresholds thresholds;

    public RiskPredictionService(RiskThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public RiskAssessment assess(DiagnosisResult diagnosis) {
        double confidence = diagnosis.getConfidence();
        NeighborStatistics stats = diagnosis.getStatistics();
        RiskAssessment.RiskAssessmentBuilder builder = RiskAssessment.builder();
        double score = 0;

        if (confidence < thresholds.getLowConfidence()) {
            score += LOW_CONFIDENCE_DELTA;
            builder.factor(new RiskFactor(RiskFactorCode.LOW_CONFIDENCE, LOW_CONFIDENCE_DELTA,
                    String.format("confidence %.1f%% is below %.1f%%", confidence, thresholds.getLowConfidence())));
        } else if (confidence < thresholds.getModerateConfidence()) {
            score += MODERATE_CONFIDENCE_DELTA;
            builder.factor(new RiskFactor(RiskFactorCode.MODERATE_CONFIDENCE, MODERATE_CONFIDENCE_DELTA,
                    String.format("confidence %.1f%% is below %.1f%%", confidence,
                            thresholds.getModerateConfidence())));
        }

        if (stats.getAgreementRatio() < thresholds.getMinAgreement()) {
            score += LOW_CONSISTENCY_DELTA;
            builder.factor(new RiskFactor(RiskFactorCode.LOW_CATEGORY_CONSISTENCY, LOW_CONSISTENCY_DELTA,
                    String.format("only %.0f%% of neighbors agree with %s (minimum %.0f%%)",
                            100 * stats.getAgreementRatio(), diagnosis.getCategory(),
                            100 * thresholds.getMinAgreement())));
        }

        if (stats.getSimilarityGap() > thresholds.getSimilarityGap()) {
            score += SIMILARITY_VARIANCE_DELTA;
            builder.factor(new RiskFactor(RiskFactorCode.HIGH_SIMILARITY_VARIANCE, SIMILARITY_VARIANCE_DELTA,
                    String.format("neighbor similarity spans %.3f (limit %.3f)",
                            stats.getSimilarityGap(), thresholds.getSimilarityGap())));
        }

        if (stats.getShapeVariability() > thresholds.getFeatureVariability()) {
            score += FEATURE_VARIABILITY_DELTA;
            builder.factor(new RiskFactor(RiskFactorCode.HIGH_FEATURE_VARIABILITY, FEATURE_VARIABILITY_DELTA,
                    String.format("shape features of neighbors vary by %.3f (limit %.3f)",
                            stats.getShapeVariability(), thresholds.getFeatureVariability())));
        }

        // deltas are decimal fractions; round away binary noise before banding
        score = Math.round(Math.max(0, Math.min(1, score)) * 1e6) / 1e6;
        return builder
                .score(score)
                .level(RiskLevel.fromScore(score))
                .build();
    }
}
