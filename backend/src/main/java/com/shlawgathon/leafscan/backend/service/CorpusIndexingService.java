package com.shlawgathon.leafscan.backend.service;

import com.shlawgathon.leafscan.backend.exception.DegenerateFeatureException;
import com.shlawgathon.leafscan.backend.exception.InvalidImageException;
import com.shlawgathon.leafscan.backend.index.SimilarityIndex;
import com.shlawgathon.leafscan.backend.model.Category;
import com.shlawgathon.leafscan.backend.model.ImageRecord;
import com.shlawgathon.leafscan.backend.model.IndexingSummary;
import com.shlawgathon.leafscan.backend.model.LabeledImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Builds the reference corpus: extracts every labeled image and upserts it into the similarity index.
 */
@Service
public class CorpusIndexingService {

    private static final Logger log = LoggerFactory.getLogger(CorpusIndexingService.class);

    private final FeatureExtractionService featureExtractionService;
    private final SimilarityIndex similarityIndex;

    public CorpusIndexingService(FeatureExtractionService featureExtractionService,
            SimilarityIndex similarityIndex) {
        this.featureExtractionService = featureExtractionService;
        this.similarityIndex = similarityIndex;
    }

    /**
     * Index one image under its label.
     */
    public ImageRecord indexImage(LabeledImage image) {
        ImageRecord record = ImageRecord.builder()
                .id(recordId(image))
                .category(image.getCategory())
                .features(featureExtractionService.extract(image.load()))
                .sourceReference(image.getSourceReference())
                .build();
        similarityIndex.index(record);
        return record;
    }

    /**
     * Index a whole corpus. Unusable images are counted as failures and skipped; a storage failure aborts the run.
     */
    public IndexingSummary indexCorpus(Iterable<LabeledImage> images) {
        Map<Category, Integer> processed = new TreeMap<>();
        Map<Category, Integer> failed = new TreeMap<>();

        for (LabeledImage image : images) {
            Category category = image.getCategory();
            try {
                indexImage(image);
                int count = processed.merge(category, 1, Integer::sum);
                if (count % 10 == 0) {
                    log.info("Indexed {} images in {}", count, category);
                }
            } catch (InvalidImageException | DegenerateFeatureException e) {
                log.warn("Skipping {}: {}", image.getSourceReference(), e.getMessage());
                failed.merge(category, 1, Integer::sum);
            }
        }

        IndexingSummary summary = IndexingSummary.builder()
                .processedByCategory(processed)
                .failedByCategory(failed)
                .build();
        log.info("Indexing finished: {} processed, {} failed ({}% success)",
                summary.getTotalProcessed(), summary.getTotalFailed(),
                String.format("%.1f", summary.getSuccessRate()));
        return summary;
    }

    /**
     * Id for an image: its explicit id, else its source reference, else a random UUID.
     */
    static String recordId(LabeledImage image) {
        if (image.getId() != null && !image.getId().isBlank()) {
            return image.getId();
        }
        if (image.getSourceReference() != null && !image.getSourceReference().isBlank()) {
            return image.getSourceReference();
        }
        return UUID.randomUUID().toString();
    }
}
