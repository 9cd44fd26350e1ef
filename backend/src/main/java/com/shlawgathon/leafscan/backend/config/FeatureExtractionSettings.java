package com.shlawgathon.leafscan.backend.config;

import lombok.Builder;
import lombok.Value;

/**
 * Input limits and the lesion thresholding rule of the feature extractor.
 * <p>
 * A pixel belongs to the leaf when its saturation is at least {@code minSaturation} and its value at least
 * {@code minValue}. A leaf pixel is a lesion pixel when its hue (OpenCV scale, 0-179) lies outside
 * {@code [baselineHueMin, baselineHueMax]}. Lesion blobs are 8-connected and smaller blobs than
 * {@code minBlobArea} pixels are discarded as noise.
 */
@Value
@Builder
public class FeatureExtractionSettings {

    @Builder.Default
    int minWidth = 16;

    @Builder.Default
    int minHeight = 16;

    @Builder.Default
    int baselineHueMin = 35;

    @Builder.Default
    int baselineHueMax = 85;

    @Builder.Default
    int minSaturation = 40;

    @Builder.Default
    int minValue = 40;

    @Builder.Default
    int minBlobArea = 4;

    public static FeatureExtractionSettings defaults() {
        return builder().build();
    }
}
