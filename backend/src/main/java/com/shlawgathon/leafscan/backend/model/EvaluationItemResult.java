package com.shlawgathon.leafscan.backend.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one evaluated corpus item. Skipped items carry a reason and no prediction.
 */
@Value
@Builder
public class EvaluationItemResult {
    String imageId;
    String sourceReference;
    Category trueCategory;
    Category predictedCategory;
    double confidence;
    RiskLevel riskLevel;
    double riskScore;
    boolean skipped;
    String skipReason;

    public static EvaluationItemResult skipped(LabeledImage image, String reason) {
        return EvaluationItemResult.builder()
                .imageId(image.getId())
                .sourceReference(image.getSourceReference())
                .trueCategory(image.getCategory())
                .skipped(true)
                .skipReason(reason)
                .build();
    }

    public boolean isCorrect() {
        return !skipped && trueCategory.equals(predictedCategory);
    }
}
