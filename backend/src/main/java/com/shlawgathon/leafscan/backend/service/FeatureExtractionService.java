package com.shlawgathon.leafscan.backend.service;

import com.shlawgathon.leafscan.backend.config.FeatureExtractionSettings;
import com.shlawgathon.leafscan.backend.exception.InvalidImageException;
import com.shlawgathon.leafscan.backend.feature.BlobStatistics;
import com.shlawgathon.leafscan.backend.feature.ColorHistogram;
import com.shlawgathon.leafscan.backend.feature.HsvImage;
import com.shlawgathon.leafscan.backend.feature.LesionBlobAnalyzer;
import com.shlawgathon.leafscan.backend.feature.LocalContrast;
import com.shlawgathon.leafscan.backend.model.FeatureVector;
import com.shlawgathon.leafscan.backend.model.PixelGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a decoded leaf image into its 106-value {@link FeatureVector}.
 * <p>
 * Every band is brought to a unit scale before it is stored, so the plain Euclidean distance weighs color, texture
 * and shape comparably. Texture statistics are square-rooted back to intensity units and divided by
 * {@link #MAX_GRAY_STD}. Blob areas are fractions of the leaf area and the blob count saturates as
 * {@code n / (n + BLOB_COUNT_HALF_SATURATION)}.
 */
@Service
public class FeatureExtractionService {

    private static final Logger log = LoggerFactory.getLogger(FeatureExtractionService.class);

    /** Largest standard deviation an 8-bit channel can reach. */
    static final double MAX_GRAY_STD = 127.5;

    /** Blob count that maps to 0.5. */
    static final double BLOB_COUNT_HALF_SATURATION = 5.0;

    private final FeatureExtractionSettings settings;
    private final LesionBlobAnalyzer blobAnalyzer;

    public FeatureExtractionService(FeatureExtractionSettings settings) {
        this.settings = settings;
        this.blobAnalyzer = new LesionBlobAnalyzer(settings);
    }

    /**
     * Extract color, texture and shape bands.
     *
     * @throws InvalidImageException if the image has fewer than three channels or is below the minimum size
     * @throws com.shlawgathon.leafscan.backend.exception.DegenerateFeatureException if any value is not finite
     */
    public FeatureVector extract(PixelGrid grid) {
        validate(grid);

        HsvImage hsv = HsvImage.of(grid);
        double[] values = new double[FeatureVector.LENGTH];

        double[] color = ColorHistogram.hsv(hsv, FeatureVector.BINS_PER_CHANNEL);
        System.arraycopy(color, 0, values, 0, FeatureVector.COLOR_BAND_SIZE);

        double[] texture = LocalContrast.summarize(
                LocalContrast.grayscale(grid), grid.getWidth(), grid.getHeight());
        for (int i = 0; i < FeatureVector.TEXTURE_BAND_SIZE; i++) {
            values[FeatureVector.TEXTURE_OFFSET + i] = Math.sqrt(texture[i]) / MAX_GRAY_STD;
        }

        BlobStatistics blobs = blobAnalyzer.analyze(hsv);
        values[FeatureVector.BLOB_COUNT] = scaledBlobCount(blobs.getBlobCount());
        values[FeatureVector.MEAN_BLOB_AREA] = leafFraction(blobs.getMeanArea(), blobs.getLeafArea());
        values[FeatureVector.BLOB_AREA_STD] = leafFraction(blobs.getAreaStdDev(), blobs.getLeafArea());
        values[FeatureVector.LARGEST_BLOB_RATIO] = blobs.getLargestToLeafRatio();

        log.debug("Extracted features from {}x{} image: {} lesion blobs over {} leaf pixels",
                grid.getWidth(), grid.getHeight(), blobs.getBlobCount(), blobs.getLeafArea());

        return FeatureVector.of(values);
    }

    private static double scaledBlobCount(int count) {
        return count / (count + BLOB_COUNT_HALF_SATURATION);
    }

    private static double leafFraction(double pixels, long leafArea) {
        return leafArea == 0 ? 0 : pixels / leafArea;
    }

    private void validate(PixelGrid grid) {
        if (grid == null) {
            throw new InvalidImageException("Image is missing");
        }
        if (grid.getChannels() < 3) {
            throw new InvalidImageException("Image needs at least 3 color channels, got " + grid.getChannels());
        }
        if (grid.getWidth() < settings.getMinWidth() || grid.getHeight() < settings.getMinHeight()) {
            throw new InvalidImageException("Image " + grid.getWidth() + "x" + grid.getHeight()
                    + " is smaller than the minimum " + settings.getMinWidth() + "x" + settings.getMinHeight());
        }
    }
}
