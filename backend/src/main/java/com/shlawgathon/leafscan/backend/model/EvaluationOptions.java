package com.shlawgathon.leafscan.backend.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EvaluationOptions {

    /**
     * Score on healthy / diseased only, mapping every label through {@link Category#collapseToBinary()}.
     */
    @Builder.Default
    boolean collapseToBinary = false;

    /**
     * Keep an item's own record out of its neighbor list when the corpus is already indexed.
     */
    @Builder.Default
    boolean excludeOwnRecord = true;

    public static EvaluationOptions defaults() {
        return builder().build();
    }
}
