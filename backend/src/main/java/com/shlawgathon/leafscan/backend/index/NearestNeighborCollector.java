package com.shlawgathon.leafscan.backend.index;

import com.shlawgathon.leafscan.backend.model.FeatureVector;
import com.shlawgathon.leafscan.backend.model.ImageRecord;
import com.shlawgathon.leafscan.backend.model.NeighborMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Keeps the {@code k} closest records seen so far in a bounded max-heap.
 */
class NearestNeighborCollector {

    private final FeatureVector query;
    private final int k;
    private final PriorityQueue<NeighborMatch> heap;

    NearestNeighborCollector(FeatureVector query, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, got " + k);
        }
        this.query = query;
        this.k = k;
        this.heap = new PriorityQueue<>(k + 1, NeighborMatch.BY_DISTANCE.reversed());
    }

    void offer(ImageRecord record) {
        heap.offer(new NeighborMatch(record, query.distanceTo(record.getFeatures())));
        if (heap.size() > k) {
            heap.poll();
        }
    }

    List<NeighborMatch> toSortedList() {
        List<NeighborMatch> matches = new ArrayList<>(heap);
        matches.sort(NeighborMatch.BY_DISTANCE);
        return matches;
    }
}
