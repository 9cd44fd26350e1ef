package com.shlawgathon.leafscan.backend.dataset;

import com.shlawgathon.leafscan.backend.model.LabeledImage;

import java.util.List;

/**
 * Supplies a labeled corpus for indexing or evaluation.
 */
public interface LabeledImageSource {

    /**
     * List every image of the corpus. Pixels are decoded lazily per item.
     *
     * @throws com.shlawgathon.leafscan.backend.exception.CorpusAccessException if the corpus cannot be listed
     */
    List<LabeledImage> images();
}
