package com.shlawgathon.leafscan.backend.model;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregates over the neighbor list a diagnosis was built from.
 */
@Value
@Builder
public class NeighborStatistics {

    int neighborCount;

    /**
     * Fraction of neighbors whose category equals the winning category.
     */
    double agreementRatio;

    double nearestDistance;
    double maxSimilarity;
    double minSimilarity;
    double meanSimilarity;
    double stdSimilarity;

    /**
     * maxSimilarity - minSimilarity.
     */
    double similarityGap;

    /**
     * Root-mean-square distance of the neighbors' shape bands to their centroid, in [0, 1].
     */
    double shapeVariability;
}
