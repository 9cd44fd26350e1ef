package com.shlawgathon.leafscan.backend.service;

import com.shlawgathon.leafscan.backend.config.DiagnosisSettings;
import com.shlawgathon.leafscan.backend.exception.DegenerateFeatureException;
import com.shlawgathon.leafscan.backend.exception.InvalidImageException;
import com.shlawgathon.leafscan.backend.index.SimilarityIndex;
import com.shlawgathon.leafscan.backend.model.Category;
import com.shlawgathon.leafscan.backend.model.DiagnosisResult;
import com.shlawgathon.leafscan.backend.model.EvaluationItemResult;
import com.shlawgathon.leafscan.backend.model.EvaluationOptions;
import com.shlawgathon.leafscan.backend.model.EvaluationReport;
import com.shlawgathon.leafscan.backend.model.FeatureVector;
import com.shlawgathon.leafscan.backend.model.LabeledImage;
import com.shlawgathon.leafscan.backend.model.NeighborMatch;
import com.shlawgathon.leafscan.backend.model.RiskAssessment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Runs the diagnosis pipeline over a labeled test corpus and scores it.
 * <p>
 * A bad image is recorded as skipped and the run goes on. Store or corpus failures
 * ({@link com.shlawgathon.leafscan.backend.exception.StorageException},
 * {@link com.shlawgathon.leafscan.backend.exception.EmptyIndexException},
 * {@link com.shlawgathon.leafscan.backend.exception.CorpusAccessException}) abort it.
 * Items are processed sequentially; the index must not be written to while a run is in progress.
 */
@Service
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

    private final FeatureExtractionService featureExtractionService;
    private final SimilarityIndex similarityIndex;
    private final DiagnosisService diagnosisService;
    private final RiskPredictionService riskPredictionService;
    private final DiagnosisSettings diagnosisSettings;

    public EvaluationService(FeatureExtractionService featureExtractionService,
            SimilarityIndex similarityIndex,
            DiagnosisService diagnosisService,
            RiskPredictionService riskPredictionService,
            DiagnosisSettings diagnosisSettings) {
        this.featureExtractionService = featureExtractionService;
        this.similarityIndex = similarityIndex;
        this.diagnosisService = diagnosisService;
        this.riskPredictionService = riskPredictionService;
        this.diagnosisSettings = diagnosisSettings;
    }

    public EvaluationReport evaluate(Iterable<LabeledImage> corpus) {
        return evaluate(corpus, EvaluationOptions.defaults(), () -> false);
    }

    /**
     * Evaluate the corpus, checking {@code stopRequested} before each item. When it returns true the run
     * stops and the report covers the items processed so far.
     */
    public EvaluationReport evaluate(Iterable<LabeledImage> corpus, EvaluationOptions options,
            BooleanSupplier stopRequested) {
        log.info("Starting evaluation against {} indexed records (k={})",
                similarityIndex.count(), diagnosisSettings.getK());

        List<EvaluationItemResult> results = new ArrayList<>();
        boolean terminatedEarly = false;
        for (LabeledImage image : corpus) {
            if (stopRequested.getAsBoolean()) {
                log.info("Evaluation stopped after {} items", results.size());
                terminatedEarly = true;
                break;
            }
            results.add(evaluateItem(image, options));
        }

        EvaluationReport report = EvaluationMetricsCalculator.calculate(results, terminatedEarly);
        log.info("Evaluation finished: {} evaluated, {} skipped, accuracy {}",
                report.getEvaluatedItems(), report.getTotalItems() - report.getEvaluatedItems(),
                String.format("%.3f", report.getAccuracy()));
        return report;
    }

    EvaluationItemResult evaluateItem(LabeledImage image, EvaluationOptions options) {
        try {
            FeatureVector features = featureExtractionService.extract(image.load());
            Set<String> excluded = options.isExcludeOwnRecord() && image.getId() != null
                    ? Set.of(image.getId())
                    : Set.of();

            List<NeighborMatch> neighbors = similarityIndex.query(features, diagnosisSettings.getK(), excluded);
            if (neighbors.isEmpty()) {
                log.warn("Skipping {}: no reference records besides its own", image.getSourceReference());
                return EvaluationItemResult.skipped(image, "no reference records besides its own");
            }

            DiagnosisResult diagnosis = diagnosisService.diagnose(neighbors);
            RiskAssessment risk = riskPredictionService.assess(diagnosis);

            Category truth = label(image.getCategory(), options);
            Category predicted = label(diagnosis.getCategory(), options);
            log.debug("{}: {} -> {} ({}%, risk {})", image.getSourceReference(), truth, predicted,
                    String.format("%.1f", diagnosis.getConfidence()), risk.getLevel());

            return EvaluationItemResult.builder()
                    .imageId(image.getId())
                    .sourceReference(image.getSourceReference())
                    .trueCategory(truth)
                    .predictedCategory(predicted)
                    .confidence(diagnosis.getConfidence())
                    .riskLevel(risk.getLevel())
                    .riskScore(risk.getScore())
                    .build();
        } catch (InvalidImageException | DegenerateFeatureException e) {
            log.warn("Skipping {}: {}", image.getSourceReference(), e.getMessage());
            return EvaluationItemResult.skipped(image, e.getMessage());
        }
    }

    private static Category label(Category category, EvaluationOptions options) {
        return options.isCollapseToBinary() ? category.collapseToBinary() : category;
    }
}
