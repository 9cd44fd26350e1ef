package com.shlawgathon.leafscan.backend.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Actual-by-predicted count table over a sorted category list.
 */
public final class ConfusionMatrix {

    private final List<Category> categories;
    private final long[][] counts;

    public ConfusionMatrix(Collection<Category> categories) {
        this.categories = Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(categories)));
        this.counts = new long[this.categories.size()][this.categories.size()];
    }

    public void record(Category actual, Category predicted) {
        counts[indexOf(actual)][indexOf(predicted)]++;
    }

    public List<Category> getCategories() {
        return categories;
    }

    public long count(Category actual, Category predicted) {
        return counts[indexOf(actual)][indexOf(predicted)];
    }

    public long truePositives(Category category) {
        int i = indexOf(category);
        return counts[i][i];
    }

    /**
     * Items predicted as the category that belong elsewhere.
     */
    public long falsePositives(Category category) {
        int column = indexOf(category);
        long sum = 0;
        for (int row = 0; row < counts.length; row++) {
            if (row != column) {
                sum += counts[row][column];
            }
        }
        return sum;
    }

    /**
     * Items of the category predicted as something else.
     */
    public long falseNegatives(Category category) {
        int row = indexOf(category);
        long sum = 0;
        for (int column = 0; column < counts.length; column++) {
            if (column != row) {
                sum += counts[row][column];
            }
        }
        return sum;
    }

    public long total() {
        long sum = 0;
        for (long[] row : counts) {
            for (long c : row) {
                sum += c;
            }
        }
        return sum;
    }

    public long correct() {
        long sum = 0;
        for (int i = 0; i < counts.length; i++) {
            sum += counts[i][i];
        }
        return sum;
    }

    /**
     * Copy of the raw table, rows are actual categories and columns predicted ones.
     */
    public long[][] toArray() {
        long[][] copy = new long[counts.length][];
        for (int i = 0; i < counts.length; i++) {
            copy[i] = counts[i].clone();
        }
        return copy;
    }

    private int indexOf(Category category) {
        int index = categories.indexOf(category);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown category: " + category);
        }
        return index;
    }
}
