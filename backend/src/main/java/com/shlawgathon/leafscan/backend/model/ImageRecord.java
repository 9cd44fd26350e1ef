package com.shlawgathon.leafscan.backend.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Indexed reference image. Once handed to the similarity index, the store owns it.
 */
@Value
@Builder(toBuilder = true)
public class ImageRecord {

    @NonNull
    String id;

    @NonNull
    Category category;

    @NonNull
    FeatureVector features;

    /**
     * Where the image came from, usually a file path.
     */
    String sourceReference;
}
