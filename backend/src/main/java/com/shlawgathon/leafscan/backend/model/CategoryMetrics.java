package com.shlawgathon.leafscan.backend.model;

import lombok.Builder;
import lombok.Value;

/**
 * One-vs-rest scores of a single category.
 */
@Value
@Builder
public class CategoryMetrics {
    Category category;
    long truePositives;
    long falsePositives;
    long falseNegatives;

    /**
     * Number of items whose true category is this one.
     */
    long support;

    double precision;
    double recall;
    double f1;

    /**
     * True when precision or recall had a zero denominator and was reported as 0.
     */
    boolean unsupported;
}
