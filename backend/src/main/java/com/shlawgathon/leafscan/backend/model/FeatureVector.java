package com.shlawgathon.leafscan.backend.model;

import com.shlawgathon.leafscan.backend.exception.DegenerateFeatureException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-length visual summary of a leaf image.
 * <p>
 * Layout, in order:
 * <ul>
 * <li>[0, 96) color band: 32-bin hue, saturation and value histograms, each summing to 1</li>
 * <li>[96, 102) texture band: mean and std dev of the local variance map for windows 3, 5, 7, each square-rooted
 * and divided by 127.5</li>
 * <li>[102, 106) shape band: saturating blob count {@code n / (n + 5)}, mean blob area / leaf area, blob area std
 * dev / leaf area, largest blob / leaf area</li>
 * </ul>
 * All values lie in [0, 1]. Distances between vectors are unweighted Euclidean (L2) over all 106 values, so the
 * color band contributes at most {@code sqrt(6)}, the texture band {@code sqrt(6)} and the shape band {@code 2}.
 */
public final class FeatureVector {

    public static final int BINS_PER_CHANNEL = 32;
    public static final int COLOR_BAND_SIZE = 3 * BINS_PER_CHANNEL;
    public static final int TEXTURE_OFFSET = COLOR_BAND_SIZE;
    public static final int TEXTURE_BAND_SIZE = 6;
    public static final int SHAPE_OFFSET = TEXTURE_OFFSET + TEXTURE_BAND_SIZE;
    public static final int SHAPE_BAND_SIZE = 4;
    public static final int LENGTH = SHAPE_OFFSET + SHAPE_BAND_SIZE;

    public static final int BLOB_COUNT = SHAPE_OFFSET;
    public static final int MEAN_BLOB_AREA = SHAPE_OFFSET + 1;
    public static final int BLOB_AREA_STD = SHAPE_OFFSET + 2;
    public static final int LARGEST_BLOB_RATIO = SHAPE_OFFSET + 3;

    private static final List<String> NAMES = buildNames();

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    /**
     * Wraps a copy of the given values.
     *
     * @throws IllegalArgumentException   if the length is not {@link #LENGTH}
     * @throws DegenerateFeatureException if any value is NaN or infinite
     */
    public static FeatureVector of(double[] values) {
        if (values == null || values.length != LENGTH) {
            throw new IllegalArgumentException("Feature vector must have " + LENGTH + " values, got "
                    + (values == null ? "null" : values.length));
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new DegenerateFeatureException(
                        "Non-finite value " + values[i] + " at " + i + " (" + NAMES.get(i) + ")");
            }
        }
        return new FeatureVector(values.clone());
    }

    public static FeatureVector fromList(List<Double> values) {
        if (values == null) {
            throw new IllegalArgumentException("Feature vector values must not be null");
        }
        double[] raw = new double[values.size()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = values.get(i);
        }
        return of(raw);
    }

    public double get(int index) {
        return values[index];
    }

    public int length() {
        return values.length;
    }

    public double[] toArray() {
        return values.clone();
    }

    public List<Double> toList() {
        List<Double> list = new ArrayList<>(values.length);
        for (double value : values) {
            list.add(value);
        }
        return list;
    }

    public double[] colorBand() {
        return Arrays.copyOfRange(values, 0, COLOR_BAND_SIZE);
    }

    public double[] textureBand() {
        return Arrays.copyOfRange(values, TEXTURE_OFFSET, SHAPE_OFFSET);
    }

    public double[] shapeBand() {
        return Arrays.copyOfRange(values, SHAPE_OFFSET, LENGTH);
    }

    /**
     * Euclidean distance to another vector.
     */
    public double distanceTo(FeatureVector other) {
        double sum = 0;
        for (int i = 0; i < LENGTH; i++) {
            double d = values[i] - other.values[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    /**
     * Human-readable name of the value at the given position, e.g. {@code hue_bin_07} or {@code texture_k5_std}.
     */
    public static String featureName(int index) {
        return NAMES.get(index);
    }

    public static List<String> featureNames() {
        return NAMES;
    }

    private static List<String> buildNames() {
        List<String> names = new ArrayList<>(LENGTH);
        for (String channel : List.of("hue", "saturation", "value")) {
            for (int bin = 0; bin < BINS_PER_CHANNEL; bin++) {
                names.add(String.format("%s_bin_%02d", channel, bin));
            }
        }
        for (int window : List.of(3, 5, 7)) {
            names.add("texture_k" + window + "_mean");
            names.add("texture_k" + window + "_std");
        }
        names.add("blob_count");
        names.add("blob_area_mean");
        names.add("blob_area_std");
        names.add("largest_blob_ratio");
        return Collections.unmodifiableList(names);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureVector)) {
            return false;
        }
        return Arrays.equals(values, ((FeatureVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
