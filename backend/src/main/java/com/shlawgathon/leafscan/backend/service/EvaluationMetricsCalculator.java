package com.shlawgathon.leafscan.backend.service;

import com.shlawgathon.leafscan.backend.model.Category;
import com.shlawgathon.leafscan.backend.model.CategoryMetrics;
import com.shlawgathon.leafscan.backend.model.ConfidenceBand;
import com.shlawgathon.leafscan.backend.model.ConfidenceBandStats;
import com.shlawgathon.leafscan.backend.model.ConfusionMatrix;
import com.shlawgathon.leafscan.backend.model.EvaluationItemResult;
import com.shlawgathon.leafscan.backend.model.EvaluationReport;
import com.shlawgathon.leafscan.backend.model.RiskBucketStats;
import com.shlawgathon.leafscan.backend.model.RiskLevel;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Aggregates per-item evaluation outcomes into an {@link EvaluationReport}.
 * <p>
 * Precision and recall are one-vs-rest per category. A zero denominator yields 0 and marks the category
 * unsupported.
 */
public final class EvaluationMetricsCalculator {

    private EvaluationMetricsCalculator() {
    }

    public static EvaluationReport calculate(List<EvaluationItemResult> results, boolean terminatedEarly) {
        List<EvaluationItemResult> evaluated = results.stream()
                .filter(r -> !r.isSkipped())
                .collect(Collectors.toList());

        Set<Category> categories = new TreeSet<>();
        for (EvaluationItemResult r : evaluated) {
            categories.add(r.getTrueCategory());
            categories.add(r.getPredictedCategory());
        }
        ConfusionMatrix matrix = new ConfusionMatrix(categories);
        evaluated.forEach(r -> matrix.record(r.getTrueCategory(), r.getPredictedCategory()));

        EvaluationReport.EvaluationReportBuilder report = EvaluationReport.builder()
                .confusionMatrix(matrix)
                .accuracy(ratio(matrix.correct(), matrix.total()))
                .results(results)
                .totalItems(results.size())
                .evaluatedItems(evaluated.size())
                .terminatedEarly(terminatedEarly);

        double sumP = 0;
        double sumR = 0;
        double sumF = 0;
        double weightedP = 0;
        double weightedR = 0;
        double weightedF = 0;
        long totalSupport = 0;
        for (Category category : matrix.getCategories()) {
            CategoryMetrics metrics = categoryMetrics(matrix, category);
            report.categoryMetrics(category, metrics);
            sumP += metrics.getPrecision();
            sumR += metrics.getRecall();
            sumF += metrics.getF1();
            weightedP += metrics.getPrecision() * metrics.getSupport();
            weightedR += metrics.getRecall() * metrics.getSupport();
            weightedF += metrics.getF1() * metrics.getSupport();
            totalSupport += metrics.getSupport();
        }
        int n = matrix.getCategories().size();
        report.macroPrecision(n == 0 ? 0 : sumP / n)
                .macroRecall(n == 0 ? 0 : sumR / n)
                .macroF1(n == 0 ? 0 : sumF / n)
                .weightedPrecision(totalSupport == 0 ? 0 : weightedP / totalSupport)
                .weightedRecall(totalSupport == 0 ? 0 : weightedR / totalSupport)
                .weightedF1(totalSupport == 0 ? 0 : weightedF / totalSupport);

        for (RiskLevel level : RiskLevel.values()) {
            report.riskBucket(level, riskBucket(evaluated, level));
        }
        for (ConfidenceBand band : ConfidenceBand.values()) {
            List<EvaluationItemResult> inBand = evaluated.stream()
                    .filter(r -> ConfidenceBand.of(r.getConfidence()) == band)
                    .collect(Collectors.toList());
            report.confidenceBand(band, new ConfidenceBandStats(band, inBand.size(), accuracy(inBand)));
        }

        double meanConfidence = evaluated.stream().mapToDouble(EvaluationItemResult::getConfidence).average().orElse(0);
        double confidenceSquares = evaluated.stream()
                .mapToDouble(r -> Math.pow(r.getConfidence() - meanConfidence, 2))
                .sum();
        return report
                .meanConfidence(meanConfidence)
                .stdConfidence(evaluated.isEmpty() ? 0 : Math.sqrt(confidenceSquares / evaluated.size()))
                .meanRiskScore(evaluated.stream().mapToDouble(EvaluationItemResult::getRiskScore).average().orElse(0))
                .build();
    }

    static CategoryMetrics categoryMetrics(ConfusionMatrix matrix, Category category) {
        long tp = matrix.truePositives(category);
        long fp = matrix.falsePositives(category);
        long fn = matrix.falseNegatives(category);
        boolean unsupported = tp + fp == 0 || tp + fn == 0;
        double precision = ratio(tp, tp + fp);
        double recall = ratio(tp, tp + fn);
        double f1 = precision + recall == 0 ? 0 : 2 * precision * recall / (precision + recall);
        return CategoryMetrics.builder()
                .category(category)
                .truePositives(tp)
                .falsePositives(fp)
                .falseNegatives(fn)
                .support(tp + fn)
                .precision(precision)
                .recall(recall)
                .f1(f1)
                .unsupported(unsupported)
                .build();
    }

    private static RiskBucketStats riskBucket(List<EvaluationItemResult> evaluated, RiskLevel level) {
        List<EvaluationItemResult> bucket = evaluated.stream()
                .filter(r -> r.getRiskLevel() == level)
                .collect(Collectors.toList());
        return RiskBucketStats.builder()
                .level(level)
                .count(bucket.size())
                .correct(bucket.stream().filter(EvaluationItemResult::isCorrect).count())
                .accuracy(accuracy(bucket))
                .meanConfidence(bucket.stream().mapToDouble(EvaluationItemResult::getConfidence).average().orElse(0))
                .meanRiskScore(bucket.stream().mapToDouble(EvaluationItemResult::getRiskScore).average().orElse(0))
                .build();
    }

    private static double accuracy(List<EvaluationItemResult> items) {
        return ratio(items.stream().filter(EvaluationItemResult::isCorrect).count(), items.size());
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0 : (double) numerator / denominator;
    }
}
