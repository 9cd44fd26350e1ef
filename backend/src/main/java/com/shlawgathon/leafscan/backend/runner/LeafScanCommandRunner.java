package com.shlawgathon.leafscan.backend.runner;

import com.shlawgathon.leafscan.backend.dataset.DatasetDirectoryImageSource;
import com.shlawgathon.leafscan.backend.index.SimilarityIndex;
import com.shlawgathon.leafscan.backend.model.Category;
import com.shlawgathon.leafscan.backend.model.CategoryMetrics;
import com.shlawgathon.leafscan.backend.model.Diagnosis;
import com.shlawgathon.leafscan.backend.model.DiagnosisResult;
import com.shlawgathon.leafscan.backend.model.EvaluationOptions;
import com.shlawgathon.leafscan.backend.model.EvaluationReport;
import com.shlawgathon.leafscan.backend.model.IndexStatistics;
import com.shlawgathon.leafscan.backend.model.IndexingSummary;
import com.shlawgathon.leafscan.backend.model.NeighborMatch;
import com.shlawgathon.leafscan.backend.model.RiskBucketStats;
import com.shlawgathon.leafscan.backend.model.RiskFactor;
import com.shlawgathon.leafscan.backend.service.CorpusIndexingService;
import com.shlawgathon.leafscan.backend.service.EvaluationService;
import com.shlawgathon.leafscan.backend.service.LeafDiagnosisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batch entry point, enabled with {@code leafscan.runner.enabled=true}.
 * <p>
 * Modes: {@code index} (index {@code leafscan.runner.dataset}, optionally clearing first), {@code evaluate}
 * (evaluate {@code leafscan.runner.test-dataset} against the index), {@code diagnose} (diagnose the single image at
 * {@code leafscan.runner.query}), {@code stats} and {@code clear}.
 */
@Component
@ConditionalOnProperty(name = "leafscan.runner.enabled", havingValue = "true")
public class LeafScanCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(LeafScanCommandRunner.class);

    private final SimilarityIndex similarityIndex;
    private final CorpusIndexingService corpusIndexingService;
    private final EvaluationService evaluationService;
    private final LeafDiagnosisService leafDiagnosisService;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    @Value("${leafscan.runner.mode:stats}")
    private String mode;

    @Value("${leafscan.runner.dataset:image/dataset}")
    private String dataset;

    @Value("${leafscan.runner.test-dataset:image/test_dataset}")
    private String testDataset;

    @Value("${leafscan.runner.query:}")
    private String query;

    @Value("${leafscan.runner.clear-first:false}")
    private boolean clearFirst;

    @Value("${leafscan.runner.collapse-to-binary:false}")
    private boolean collapseToBinary;

    public LeafScanCommandRunner(SimilarityIndex similarityIndex,
            CorpusIndexingService corpusIndexingService,
            EvaluationService evaluationService,
            LeafDiagnosisService leafDiagnosisService) {
        this.similarityIndex = similarityIndex;
        this.corpusIndexingService = corpusIndexingService;
        this.evaluationService = evaluationService;
        this.leafDiagnosisService = leafDiagnosisService;
    }

    @Override
    public void run(ApplicationArguments args) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> stopRequested.set(true)));

        switch (mode.toLowerCase(Locale.ROOT)) {
            case "index" -> index();
            case "evaluate" -> evaluate();
            case "diagnose" -> diagnose();
            case "stats" -> logStatistics(similarityIndex.statistics());
            case "clear" -> similarityIndex.clear();
            default -> throw new IllegalArgumentException("Unknown leafscan.runner.mode: " + mode);
        }
    }

    private void index() {
        if (clearFirst) {
            similarityIndex.clear();
        }
        IndexingSummary summary = corpusIndexingService.indexCorpus(
                new DatasetDirectoryImageSource(Path.of(dataset)).images());
        for (Map.Entry<Category, Integer> entry : summary.getProcessedByCategory().entrySet()) {
            log.info("{}: {} processed, {} failed", entry.getKey(), entry.getValue(),
                    summary.getFailedByCategory().getOrDefault(entry.getKey(), 0));
        }
        logStatistics(similarityIndex.statistics());
    }

    private void evaluate() {
        EvaluationOptions options = EvaluationOptions.builder()
                .collapseToBinary(collapseToBinary)
                .build();
        EvaluationReport report = evaluationService.evaluate(
                new DatasetDirectoryImageSource(Path.of(testDataset)).images(), options, stopRequested::get);

        log.info("Accuracy {} | weighted precision {} | weighted recall {} | weighted F1 {}",
                format(report.getAccuracy()), format(report.getWeightedPrecision()),
                format(report.getWeightedRecall()), format(report.getWeightedF1()));
        for (CategoryMetrics metrics : report.getPerCategory().values()) {
            log.info("{}: precision {} recall {} F1 {} support {}{}", metrics.getCategory(),
                    format(metrics.getPrecision()), format(metrics.getRecall()), format(metrics.getF1()),
                    metrics.getSupport(), metrics.isUnsupported() ? " (unsupported)" : "");
        }
        for (RiskBucketStats bucket : report.getRiskBuckets().values()) {
            log.info("Risk {}: {} items, accuracy {}, mean confidence {}%", bucket.getLevel(), bucket.getCount(),
                    format(bucket.getAccuracy()), String.format("%.1f", bucket.getMeanConfidence()));
        }
        if (!report.isRiskCalibrated()) {
            log.warn("Low-risk predictions were less accurate than high-risk ones");
        }
    }

    private void diagnose() {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("leafscan.runner.query must name an image file in diagnose mode");
        }
        Diagnosis diagnosis = leafDiagnosisService.diagnose(DatasetDirectoryImageSource.decode(Path.of(query)));
        DiagnosisResult result = diagnosis.getResult();

        log.info("{}: {} with {}% confidence", query, result.getCategory(),
                String.format("%.1f", result.getConfidence()));
        result.getCategoryDistribution().forEach((category, share) ->
                log.info("- {}: {}%", category, String.format("%.1f", share)));
        int rank = 1;
        for (NeighborMatch match : result.getMatches()) {
            log.info("#{} {} ({}) similarity {}", rank++, match.getRecord().getId(), match.getCategory(),
                    format(match.getSimilarity()));
        }
        log.info("Revocation risk {} (score {})", diagnosis.getRisk().getLevel(),
                format(diagnosis.getRisk().getScore()));
        for (RiskFactor factor : diagnosis.getRisk().getFactors()) {
            log.info("- {}: {}", factor.getCode(), factor.getExplanation());
        }
        log.info("Recommendation: {}", diagnosis.getRecommendation());
    }

    private void logStatistics(IndexStatistics statistics) {
        log.info("Index holds {} images", statistics.getTotalRecords());
        statistics.getRecordsByCategory().forEach((category, count) -> log.info("- {}: {} images", category, count));
    }

    private static String format(double value) {
        return String.format("%.3f", value);
    }
}
