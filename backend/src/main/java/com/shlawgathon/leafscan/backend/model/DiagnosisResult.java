package com.shlawgathon.leafscan.backend.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of an inverse-distance-weighted vote over one query's neighbors.
 */
@Value
@Builder
public class DiagnosisResult {

    @NonNull
    Category category;

    /**
     * Winning share of the weighted vote, in [0, 100].
     */
    double confidence;

    @Singular
    List<NeighborMatch> matches;

    /**
     * Weighted-vote share of every competing category in percent, highest first.
     */
    @Singular("categoryShare")
    Map<Category, Double> categoryDistribution;

    @NonNull
    NeighborStatistics statistics;
}
