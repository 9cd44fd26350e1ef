package com.shlawgathon.leafscan.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Per-category counts of one corpus indexing pass.
 */
@Value
@Builder
public class IndexingSummary {

    @Singular("processed")
    Map<Category, Integer> processedByCategory;

    @Singular("failed")
    Map<Category, Integer> failedByCategory;

    public int getTotalProcessed() {
        return processedByCategory.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getTotalFailed() {
        return failedByCategory.values().stream().mapToInt(Integer::intValue).sum();
    }

    public double getSuccessRate() {
        int total = getTotalProcessed() + getTotalFailed();
        return total == 0 ? 0 : 100.0 * getTotalProcessed() / total;
    }
}
