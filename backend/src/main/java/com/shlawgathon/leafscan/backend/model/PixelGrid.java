package com.shlawgathon.leafscan.backend.model;

import com.shlawgathon.leafscan.backend.exception.InvalidImageException;
import lombok.Getter;

/**
 * Decoded image as interleaved 8-bit samples. The first three channels are red, green and blue.
 */
@Getter
public final class PixelGrid {

    private final int width;
    private final int height;
    private final int channels;
    private final int[] samples;

    public PixelGrid(int width, int height, int channels, int[] samples) {
        if (width <= 0 || height <= 0 || channels <= 0) {
            throw new InvalidImageException(
                    "Invalid image dimensions: " + width + "x" + height + "x" + channels);
        }
        if (samples == null || samples.length != width * height * channels) {
            throw new InvalidImageException("Sample buffer does not match " + width + "x" + height
                    + "x" + channels + " image");
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.samples = samples.clone();
    }

    /**
     * Builds a three-channel grid from packed 0xAARRGGBB pixels in row-major order,
     * as returned by {@code BufferedImage.getRGB}.
     */
    public static PixelGrid fromPackedRgb(int width, int height, int[] argb) {
        if (argb == null || argb.length != width * height) {
            throw new InvalidImageException("Pixel buffer does not match " + width + "x" + height + " image");
        }
        int[] samples = new int[argb.length * 3];
        for (int i = 0; i < argb.length; i++) {
            samples[i * 3] = (argb[i] >> 16) & 0xFF;
            samples[i * 3 + 1] = (argb[i] >> 8) & 0xFF;
            samples[i * 3 + 2] = argb[i] & 0xFF;
        }
        return new PixelGrid(width, height, 3, samples);
    }

    public int red(int x, int y) {
        return sample(x, y, 0);
    }

    public int green(int x, int y) {
        return sample(x, y, 1);
    }

    public int blue(int x, int y) {
        return sample(x, y, 2);
    }

    public int sample(int x, int y, int channel) {
        return samples[(y * width + x) * channels + channel];
    }

    public int pixelCount() {
        return width * height;
    }
}
