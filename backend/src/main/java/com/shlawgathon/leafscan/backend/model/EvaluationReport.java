package com.shlawgathon.leafscan.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregated result of one evaluation run. Rendering it to files is left to the caller.
 */
@Value
@Builder
public class EvaluationReport {

    ConfusionMatrix confusionMatrix;

    /**
     * correct / evaluated, 0 when nothing was evaluated.
     */
    double accuracy;

    @Singular("categoryMetrics")
    Map<Category, CategoryMetrics> perCategory;

    double macroPrecision;
    double macroRecall;
    double macroF1;

    /**
     * Averages weighted by category support.
     */
    double weightedPrecision;
    double weightedRecall;
    double weightedF1;

    @Singular("riskBucket")
    Map<RiskLevel, RiskBucketStats> riskBuckets;

    @Singular("confidenceBand")
    Map<ConfidenceBand, ConfidenceBandStats> confidenceBands;

    double meanConfidence;
    double stdConfidence;
    double meanRiskScore;

    int totalItems;
    int evaluatedItems;

    @Singular
    List<EvaluationItemResult> results;

    /**
     * True when the run was stopped before the corpus was exhausted.
     */
    boolean terminatedEarly;

    public List<EvaluationItemResult> getSkippedResults() {
        return results.stream().filter(EvaluationItemResult::isSkipped).collect(Collectors.toList());
    }

    /**
     * Whether low-risk predictions were at least as accurate as high-risk ones. True when either bucket is empty.
     */
    public boolean isRiskCalibrated() {
        RiskBucketStats low = riskBuckets.get(RiskLevel.LOW);
        RiskBucketStats high = riskBuckets.get(RiskLevel.HIGH);
        if (low == null || high == null || low.getCount() == 0 || high.getCount() == 0) {
            return true;
        }
        return low.getAccuracy() >= high.getAccuracy();
    }
}
