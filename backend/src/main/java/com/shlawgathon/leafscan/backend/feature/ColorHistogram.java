package com.shlawgathon.leafscan.backend.feature;

/**
 * Normalized per-channel histograms of an {@link HsvImage}.
 */
public final class ColorHistogram {

    private ColorHistogram() {
    }

    /**
     * Concatenated hue, saturation and value histograms, {@code bins} values each, every channel summing to 1.
     */
    public static double[] hsv(HsvImage image, int bins) {
        double[] out = new double[3 * bins];
        fill(image.hueChannel(), HsvImage.HUE_RANGE, bins, out, 0);
        fill(image.saturationChannel(), HsvImage.SATURATION_RANGE, bins, out, bins);
        fill(image.valueChannel(), HsvImage.VALUE_RANGE, bins, out, 2 * bins);
        return out;
    }

    static void fill(int[] channel, int range, int bins, double[] out, int offset) {
        long[] counts = new long[bins];
        for (int sample : channel) {
            int bin = (int) ((long) sample * bins / range);
            counts[Math.min(bin, bins - 1)]++;
        }
        double total = channel.length;
        for (int i = 0; i < bins; i++) {
            out[offset + i] = counts[i] / total;
        }
    }
}
