package com.shlawgathon.leafscan.backend.service;

import com.shlawgathon.leafscan.backend.model.Category;
import com.shlawgathon.leafscan.backend.model.CategoryMetrics;
import com.shlawgathon.leafscan.backend.model.ConfidenceBand;
import com.shlawgathon.leafscan.backend.model.ConfusionMatrix;
import com.shlawgathon.leafscan.backend.model.EvaluationItemResult;
import com.shlawgathon.leafscan.backend.model.EvaluationReport;
import com.shlawgathon.leafscan.backend.model.LabeledImage;
import com.shlawgathon.leafscan.backend.model.RiskLevel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EvaluationMetricsCalculatorTest {

    private static final Category HEALTHY = Category.HEALTHY;
    private static final Category DISEASED = Category.DISEASED;

    @Test
    void shouldScoreBinaryRun() {
        // Given: 4 healthy (3 right), 6 diseased (4 right)
        List<EvaluationItemResult> results = new ArrayList<>();
        add(results, 3, HEALTHY, HEALTHY, 90, RiskLevel.LOW);
        add(results, 1, HEALTHY, DISEASED, 55, RiskLevel.HIGH);
        add(results, 4, DISEASED, DISEASED, 70, RiskLevel.MEDIUM);
        add(results, 2, DISEASED, HEALTHY, 55, RiskLevel.HIGH);

        // When
        EvaluationReport report = EvaluationMetricsCalculator.calculate(results, false);

        // Then
        assertThat(report.getAccuracy()).isEqualTo(0.7);
        assertThat(report.getTotalItems()).isEqualTo(10);
        assertThat(report.getEvaluatedItems()).isEqualTo(10);
        assertThat(report.getConfusionMatrix().getCategories()).containsExactly(HEALTHY, DISEASED);
        assertThat(report.getConfusionMatrix().toArray()).isEqualTo(new long[][]{{3, 1}, {2, 4}});

        CategoryMetrics healthy = report.getPerCategory().get(HEALTHY);
        assertThat(healthy.getPrecision()).isCloseTo(0.6, within(1e-12));
        assertThat(healthy.getRecall()).isCloseTo(0.75, within(1e-12));
        assertThat(healthy.getF1()).isCloseTo(2 * 0.6 * 0.75 / 1.35, within(1e-12));
        assertThat(healthy.getSupport()).isEqualTo(4);

        CategoryMetrics diseased = report.getPerCategory().get(DISEASED);
        assertThat(diseased.getPrecision()).isCloseTo(0.8, within(1e-12));
        assertThat(diseased.getRecall()).isCloseTo(4.0 / 6, within(1e-12));

        assertThat(report.getMacroPrecision()).isCloseTo(0.7, within(1e-12));
        assertThat(report.getWeightedRecall()).isCloseTo(0.7, within(1e-12));

        assertThat(report.getRiskBuckets()).containsOnlyKeys(RiskLevel.values());
        assertThat(report.getRiskBuckets().get(RiskLevel.LOW).getAccuracy()).isEqualTo(1.0);
        assertThat(report.getRiskBuckets().get(RiskLevel.HIGH).getCount()).isEqualTo(3);
        assertThat(report.getRiskBuckets().get(RiskLevel.HIGH).getAccuracy()).isZero();
        assertThat(report.isRiskCalibrated()).isTrue();

        assertThat(report.getConfidenceBands().get(ConfidenceBand.HIGH).getCount()).isEqualTo(3);
        assertThat(report.getConfidenceBands().get(ConfidenceBand.MEDIUM).getCount()).isEqualTo(4);
        assertThat(report.getConfidenceBands().get(ConfidenceBand.LOW).getCount()).isEqualTo(3);
        assertThat(report.getMeanConfidence()).isCloseTo(71.5, within(1e-9));
    }

    @Test
    void shouldMarkUnpredictedCategoryUnsupported() {
        List<EvaluationItemResult> results = new ArrayList<>();
        add(results, 2, HEALTHY, DISEASED, 90, RiskLevel.LOW);
        add(results, 2, DISEASED, DISEASED, 90, RiskLevel.LOW);

        EvaluationReport report = EvaluationMetricsCalculator.calculate(results, false);

        CategoryMetrics healthy = report.getPerCategory().get(HEALTHY);
        assertThat(healthy.isUnsupported()).isTrue();
        assertThat(healthy.getPrecision()).isZero();
        assertThat(healthy.getF1()).isZero();
        assertThat(report.getPerCategory().get(DISEASED).isUnsupported()).isFalse();
        assertThat(report.isRiskCalibrated()).isTrue();
    }

    @Test
    void shouldLeaveSkippedItemsOutOfMetrics() {
        List<EvaluationItemResult> results = new ArrayList<>();
        add(results, 2, HEALTHY, HEALTHY, 100, RiskLevel.LOW);
        results.add(EvaluationItemResult.skipped(
                LabeledImage.builder().id("bad").category(DISEASED).pixels(() -> null).build(), "corrupt"));

        EvaluationReport report = EvaluationMetricsCalculator.calculate(results, true);

        assertThat(report.getTotalItems()).isEqualTo(3);
        assertThat(report.getEvaluatedItems()).isEqualTo(2);
        assertThat(report.getAccuracy()).isEqualTo(1.0);
        assertThat(report.getConfusionMatrix().getCategories()).containsExactly(HEALTHY);
        assertThat(report.getSkippedResults()).extracting(EvaluationItemResult::getSkipReason)
                .containsExactly("corrupt");
        assertThat(report.isTerminatedEarly()).isTrue();
    }

    @Test
    void shouldScoreAllWrongRunAsZero() {
        List<EvaluationItemResult> results = new ArrayList<>();
        add(results, 3, HEALTHY, DISEASED, 70, RiskLevel.MEDIUM);
        add(results, 3, DISEASED, HEALTHY, 70, RiskLevel.MEDIUM);

        EvaluationReport report = EvaluationMetricsCalculator.calculate(results, false);

        assertThat(report.getAccuracy()).isZero();
        assertThat(report.getPerCategory().values()).allSatisfy(m -> {
            assertThat(m.getF1()).isZero();
            assertThat(m.isUnsupported()).isFalse();
        });
    }

    @Test
    void shouldReportZerosForEmptyRun() {
        EvaluationReport report = EvaluationMetricsCalculator.calculate(List.of(), false);

        assertThat(report.getAccuracy()).isZero();
        assertThat(report.getMacroF1()).isZero();
        assertThat(report.getPerCategory()).isEmpty();
        assertThat(report.getRiskBuckets()).hasSize(3);
        assertThat(report.getConfidenceBands()).hasSize(3);
    }

    @Test
    void shouldRejectUnknownCategoryInMatrix() {
        ConfusionMatrix matrix = new ConfusionMatrix(List.of(HEALTHY));

        assertThrows(IllegalArgumentException.class, () -> matrix.record(HEALTHY, DISEASED));
    }

    private static void add(List<EvaluationItemResult> results, int times, Category truth, Category predicted,
            double confidence, RiskLevel risk) {
        for (int i = 0; i < times; i++) {
            results.add(EvaluationItemResult.builder()
                    .imageId(truth + "-" + results.size())
                    .trueCategory(truth)
                    .predictedCategory(predicted)
                    .confidence(confidence)
                    .riskLevel(risk)
                    .riskScore(risk == RiskLevel.LOW ? 0.0 : 0.5)
                    .build());
        }
    }
}
