package com.shlawgathon.leafscan.backend.service;

import com.shlawgathon.leafscan.backend.config.DiagnosisSettings;
import com.shlawgathon.leafscan.backend.config.RecommendationThresholds;
import com.shlawgathon.leafscan.backend.exception.EmptyIndexException;
import com.shlawgathon.leafscan.backend.index.SimilarityIndex;
import com.shlawgathon.leafscan.backend.model.Diagnosis;
import com.shlawgathon.leafscan.backend.model.DiagnosisResult;
import com.shlawgathon.leafscan.backend.model.FeatureVector;
import com.shlawgathon.leafscan.backend.model.ImageRecord;
import com.shlawgathon.leafscan.backend.model.LabeledImage;
import com.shlawgathon.leafscan.backend.model.NeighborMatch;
import com.shlawgathon.leafscan.backend.model.PixelGrid;
import com.shlawgathon.leafscan.backend.model.Recommendation;
import com.shlawgathon.leafscan.backend.model.RiskAssessment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Single-image diagnosis: extract, retrieve neighbors, vote, assess risk and recommend.
 */
@Service
public class LeafDiagnosisService {

    private static final Logger log = LoggerFactory.getLogger(LeafDiagnosisService.class);

    private final FeatureExtractionService featureExtractionService;
    private final SimilarityIndex similarityIndex;
    private final DiagnosisService diagnosisService;
    private final RiskPredictionService riskPredictionService;
    private final DiagnosisSettings diagnosisSettings;
    private final RecommendationThresholds recommendationThresholds;

    public LeafDiagnosisService(FeatureExtractionService featureExtractionService,
            SimilarityIndex similarityIndex,
            DiagnosisService diagnosisService,
            RiskPredictionService riskPredictionService,
            DiagnosisSettings diagnosisSettings,
            RecommendationThresholds recommendationThresholds) {
        this.featureExtractionService = featureExtractionService;
        this.similarityIndex = similarityIndex;
        this.diagnosisService = diagnosisService;
        this.riskPredictionService = riskPredictionService;
        this.diagnosisSettings = diagnosisSettings;
        this.recommendationThresholds = recommendationThresholds;
    }

    public Diagnosis diagnose(PixelGrid image) {
        return diagnose(featureExtractionService.extract(image), Set.of());
    }

    /**
     * Diagnose an already extracted vector, ignoring the given record ids.
     *
     * @throws EmptyIndexException if the index is empty or holds only excluded records
     */
    public Diagnosis diagnose(FeatureVector features, Set<String> excludedIds) {
        List<NeighborMatch> neighbors = similarityIndex.query(features, diagnosisSettings.getK(), excludedIds);
        if (neighbors.isEmpty()) {
            throw new EmptyIndexException("No reference records left after excluding " + excludedIds);
        }
        DiagnosisResult result = diagnosisService.diagnose(neighbors);
        RiskAssessment risk = riskPredictionService.assess(result);

        log.info("Diagnosed {} with {}% confidence, revocation risk {} ({})",
                result.getCategory(), String.format("%.1f", result.getConfidence()),
                risk.getLevel(), String.format("%.2f", risk.getScore()));

        return Diagnosis.builder()
                .features(features)
                .result(result)
                .risk(risk)
                .recommendation(recommend(result.getConfidence()))
                .build();
    }

    /**
     * Diagnose a labeled image against the rest of the corpus, then add it to the index under its own label.
     */
    public Diagnosis diagnoseAndIndex(LabeledImage image) {
        FeatureVector features = featureExtractionService.extract(image.load());
        String id = CorpusIndexingService.recordId(image);
        Diagnosis diagnosis = diagnose(features, Set.of(id));

        similarityIndex.index(ImageRecord.builder()
                .id(id)
                .category(image.getCategory())
                .features(features)
                .sourceReference(image.getSourceReference())
                .build());

        return Diagnosis.builder()
                .features(features)
                .result(diagnosis.getResult())
                .risk(diagnosis.getRisk())
                .recommendation(diagnosis.getRecommendation())
                .indexedRecordId(id)
                .build();
    }

    public Recommendation recommend(double confidence) {
        if (confidence >= recommendationThresholds.getReliable()) {
            return Recommendation.RELIABLE;
        }
        if (confidence >= recommendationThresholds.getProbable()) {
            return Recommendation.PROBABLE;
        }
        return Recommendation.UNCERTAIN;
    }
}
