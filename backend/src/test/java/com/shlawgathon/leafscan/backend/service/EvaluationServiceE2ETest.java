package com.shlawgathon.leafscan.backend.service;

import com.shlawgathon.leafscan.backend.BaseE2ETest;
import com.shlawgathon.leafscan.backend.TestImages;
import com.shlawgathon.leafscan.backend.index.SimilarityIndex;
import com.shlawgathon.leafscan.backend.model.Category;
import com.shlawgathon.leafscan.backend.model.Diagnosis;
import com.shlawgathon.leafscan.backend.model.EvaluationReport;
import com.shlawgathon.leafscan.backend.model.IndexingSummary;
import com.shlawgathon.leafscan.backend.model.LabeledImage;
import com.shlawgathon.leafscan.backend.model.RiskLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class EvaluationServiceE2ETest extends BaseE2ETest {

    @Autowired
    private CorpusIndexingService corpusIndexingService;

    @Autowired
    private EvaluationService evaluationService;

    @Autowired
    private LeafDiagnosisService leafDiagnosisService;

    @Autowired
    private SimilarityIndex similarityIndex;

    @BeforeEach
    void setUp() {
        similarityIndex.clear();
    }

    @Test
    void shouldIndexAndEvaluateCorpus() {
        // Given
        List<LabeledImage> corpus = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            corpus.add(LabeledImage.of("leaf_healthy/" + i + ".png", Category.HEALTHY, TestImages.healthyLeaf()));
            corpus.add(LabeledImage.of("leaf_with_disease/" + i + ".png", Category.DISEASED,
                    TestImages.diseasedVariant(i)));
        }

        // When
        IndexingSummary summary = corpusIndexingService.indexCorpus(corpus);
        EvaluationReport report = evaluationService.evaluate(corpus);

        // Then
        assertEquals(20, summary.getTotalProcessed());
        assertEquals(20, similarityIndex.count());
        assertEquals(1.0, report.getAccuracy());
        assertEquals(20, report.getRiskBuckets().get(RiskLevel.LOW).getCount());
        assertThat(report.getSkippedResults()).isEmpty();
    }

    @Test
    void shouldDiagnoseNewLeafFromStoredCorpus() {
        for (int i = 0; i < 5; i++) {
            corpusIndexingService.indexImage(LabeledImage.of("h-" + i, Category.HEALTHY, TestImages.healthyLeaf()));
            corpusIndexingService.indexImage(
                    LabeledImage.of("d-" + i, Category.DISEASED, TestImages.diseasedVariant(i)));
        }

        Diagnosis diagnosis = leafDiagnosisService.diagnose(TestImages.healthyLeaf());

        assertEquals(Category.HEALTHY, diagnosis.getResult().getCategory());
        assertEquals(RiskLevel.LOW, diagnosis.getRisk().getLevel());
    }
}
