package com.shlawgathon.leafscan.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Revocation risk of one diagnosis.
 */
@Value
@Builder
public class RiskAssessment {

    RiskLevel level;

    /**
     * Sum of triggered deltas clipped to [0, 1].
     */
    double score;

    @Singular
    List<RiskFactor> factors;

    public boolean hasFactor(RiskFactorCode code) {
        return factors.stream().anyMatch(f -> f.getCode() == code);
    }
}
