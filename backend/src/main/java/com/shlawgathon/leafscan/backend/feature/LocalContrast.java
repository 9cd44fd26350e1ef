package com.shlawgathon.leafscan.backend.feature;

import com.shlawgathon.leafscan.backend.model.PixelGrid;

/**
 * Local variance of grayscale intensity over square windows.
 * <p>
 * Windows are clipped at the image border, so edge pixels use only the in-bounds part of their window.
 */
public final class LocalContrast {

    public static final int[] WINDOW_SIZES = {3, 5, 7};

    private LocalContrast() {
    }

    /**
     * BT.601 luma, rounded to the 0-255 integer scale.
     */
    public static double[] grayscale(PixelGrid grid) {
        double[] gray = new double[grid.pixelCount()];
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                gray[y * grid.getWidth() + x] = Math.round(
                        0.299 * grid.red(x, y) + 0.587 * grid.green(x, y) + 0.114 * grid.blue(x, y));
            }
        }
        return gray;
    }

    /**
     * Mean and standard deviation of the variance map for each of {@link #WINDOW_SIZES}, interleaved.
     */
    public static double[] summarize(double[] gray, int width, int height) {
        double[] sum = integral(gray, width, height, false);
        double[] sumSq = integral(gray, width, height, true);
        double[] out = new double[2 * WINDOW_SIZES.length];
        for (int w = 0; w < WINDOW_SIZES.length; w++) {
            double[] variance = varianceMap(sum, sumSq, width, height, WINDOW_SIZES[w] / 2);
            double mean = 0;
            for (double v : variance) {
                mean += v;
            }
            mean /= variance.length;
            double squares = 0;
            for (double v : variance) {
                squares += (v - mean) * (v - mean);
            }
            out[2 * w] = mean;
            out[2 * w + 1] = Math.sqrt(squares / variance.length);
        }
        return out;
    }

    private static double[] varianceMap(double[] sum, double[] sumSq, int width, int height, int radius) {
        double[] map = new double[width * height];
        for (int y = 0; y < height; y++) {
            int y0 = Math.max(0, y - radius);
            int y1 = Math.min(height - 1, y + radius);
            for (int x = 0; x < width; x++) {
                int x0 = Math.max(0, x - radius);
                int x1 = Math.min(width - 1, x + radius);
                double n = (double) (x1 - x0 + 1) * (y1 - y0 + 1);
                double mean = boxSum(sum, width, x0, y0, x1, y1) / n;
                double meanSq = boxSum(sumSq, width, x0, y0, x1, y1) / n;
                // rounding can push E[x^2] - E[x]^2 slightly below zero on flat areas
                map[y * width + x] = Math.max(0, meanSq - mean * mean);
            }
        }
        return map;
    }

    /**
     * Summed-area table with one row and column of zero padding.
     */
    private static double[] integral(double[] gray, int width, int height, boolean squared) {
        int stride = width + 1;
        double[] table = new double[stride * (height + 1)];
        for (int y = 0; y < height; y++) {
            double row = 0;
            for (int x = 0; x < width; x++) {
                double g = gray[y * width + x];
                row += squared ? g * g : g;
                table[(y + 1) * stride + x + 1] = table[y * stride + x + 1] + row;
            }
        }
        return table;
    }

    private static double boxSum(double[] table, int width, int x0, int y0, int x1, int y1) {
        int stride = width + 1;
        return table[(y1 + 1) * stride + x1 + 1]
                - table[y0 * stride + x1 + 1]
                - table[(y1 + 1) * stride + x0]
                + table[y0 * stride + x0];
    }
}
