package com.shlawgathon.leafscan.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Stored form of an {@link ImageRecord}, keyed by image id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = LeafImageDocument.COLLECTION)
public class LeafImageDocument {

    public static final String COLLECTION = "leaf_images";

    @Id
    private String id;

    @Indexed
    private String category;

    private String sourceReference;

    /**
     * 106-value feature vector.
     */
    private List<Double> embedding;

    @LastModifiedDate
    private Instant indexedAt;

    public static LeafImageDocument fromRecord(ImageRecord record) {
        return LeafImageDocument.builder()
                .id(record.getId())
                .category(record.getCategory().getLabel())
                .sourceReference(record.getSourceReference())
                .embedding(record.getFeatures().toList())
                .build();
    }

    public ImageRecord toRecord() {
        return ImageRecord.builder()
                .id(id)
                .category(Category.of(category))
                .features(FeatureVector.fromList(embedding))
                .sourceReference(sourceReference)
                .build();
    }
}
