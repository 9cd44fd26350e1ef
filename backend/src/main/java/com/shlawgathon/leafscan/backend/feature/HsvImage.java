package com.shlawgathon.leafscan.backend.feature;

import com.shlawgathon.leafscan.backend.model.PixelGrid;

/**
 * Per-pixel hue, saturation and value on the 8-bit OpenCV scales: hue in [0, 180), saturation and value in [0, 256).
 */
public final class HsvImage {

    public static final int HUE_RANGE = 180;
    public static final int SATURATION_RANGE = 256;
    public static final int VALUE_RANGE = 256;

    private final int width;
    private final int height;
    private final int[] hue;
    private final int[] saturation;
    private final int[] value;

    private HsvImage(int width, int height, int[] hue, int[] saturation, int[] value) {
        this.width = width;
        this.height = height;
        this.hue = hue;
        this.saturation = saturation;
        this.value = value;
    }

    public static HsvImage of(PixelGrid grid) {
        int n = grid.pixelCount();
        int[] h = new int[n];
        int[] s = new int[n];
        int[] v = new int[n];
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                int i = y * grid.getWidth() + x;
                int r = grid.red(x, y);
                int g = grid.green(x, y);
                int b = grid.blue(x, y);
                int max = Math.max(r, Math.max(g, b));
                int min = Math.min(r, Math.min(g, b));
                int delta = max - min;

                v[i] = max;
                s[i] = max == 0 ? 0 : (int) Math.round(255.0 * delta / max);

                double degrees;
                if (delta == 0) {
                    degrees = 0;
                } else if (max == r) {
                    degrees = 60.0 * (g - b) / delta;
                } else if (max == g) {
                    degrees = 120.0 + 60.0 * (b - r) / delta;
                } else {
                    degrees = 240.0 + 60.0 * (r - g) / delta;
                }
                if (degrees < 0) {
                    degrees += 360;
                }
                h[i] = (int) Math.round(degrees / 2) % HUE_RANGE;
            }
        }
        return new HsvImage(grid.getWidth(), grid.getHeight(), h, s, v);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int hue(int index) {
        return hue[index];
    }

    public int saturation(int index) {
        return saturation[index];
    }

    public int value(int index) {
        return value[index];
    }

    int[] hueChannel() {
        return hue;
    }

    int[] saturationChannel() {
        return saturation;
    }

    int[] valueChannel() {
        return value;
    }
}
