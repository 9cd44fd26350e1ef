package com.shlawgathon.leafscan.backend.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.function.Supplier;

/**
 * Corpus item with its ground-truth category. Pixels are decoded on demand so that a bad
 * file fails only its own item.
 */
@Value
@Builder
public class LabeledImage {

    /**
     * Record id if the image is (or will be) indexed.
     */
    String id;

    @NonNull
    Category category;

    String sourceReference;

    @NonNull
    Supplier<PixelGrid> pixels;

    public static LabeledImage of(String id, Category category, PixelGrid grid) {
        return LabeledImage.builder()
                .id(id)
                .category(category)
                .sourceReference(id)
                .pixels(() -> grid)
                .build();
    }

    public PixelGrid load() {
        return pixels.get();
    }
}
