package com.shlawgathon.leafscan.backend.model;

import lombok.Value;

import java.util.Comparator;

/**
 * One result of a similarity query: a snapshot of the stored record and its Euclidean distance to the query.
 */
@Value
public class NeighborMatch {

    public static final Comparator<NeighborMatch> BY_DISTANCE = Comparator
            .comparingDouble(NeighborMatch::getDistance)
            .thenComparing(m -> m.getRecord().getId());

    ImageRecord record;
    double distance;

    public Category getCategory() {
        return record.getCategory();
    }

    /**
     * Similarity in (0, 1], 1 at zero distance.
     */
    public double getSimilarity() {
        return 1.0 / (1.0 + distance);
    }
}
