package com.shlawgathon.leafscan.backend.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Locale;

/**
 * Diagnosis label. The label set is open: any dataset folder name is a category.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Category implements Comparable<Category> {

    public static final Category HEALTHY = new Category("leaf_healthy");
    public static final Category DISEASED = new Category("leaf_with_disease");

    private final String label;

    public static Category of(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Category label must not be blank");
        }
        return new Category(label.trim());
    }

    public boolean isHealthy() {
        return label.toLowerCase(Locale.ROOT).contains("healthy");
    }

    /**
     * Maps this label onto the two-class healthy / diseased scheme.
     */
    public Category collapseToBinary() {
        return isHealthy() ? HEALTHY : DISEASED;
    }

    @Override
    public int compareTo(Category other) {
        return label.compareTo(other.label);
    }

    @Override
    public String toString() {
        return label;
    }
}
