package com.shlawgathon.leafscan.backend.runner;

import com.shlawgathon.leafscan.backend.TestImages;
import com.shlawgathon.leafscan.backend.config.DiagnosisSettings;
import com.shlawgathon.leafscan.backend.config.RiskThresholds;
import com.shlawgathon.leafscan.backend.index.SimilarityIndex;
import com.shlawgathon.leafscan.backend.model.Category;
import com.shlawgathon.leafscan.backend.model.Diagnosis;
import com.shlawgathon.leafscan.backend.model.DiagnosisResult;
import com.shlawgathon.leafscan.backend.model.EvaluationOptions;
import com.shlawgathon.leafscan.backend.model.IndexStatistics;
import com.shlawgathon.leafscan.backend.model.IndexingSummary;
import com.shlawgathon.leafscan.backend.model.PixelGrid;
import com.shlawgathon.leafscan.backend.model.Recommendation;
import com.shlawgathon.leafscan.backend.service.CorpusIndexingService;
import com.shlawgathon.leafscan.backend.service.DiagnosisService;
import com.shlawgathon.leafscan.backend.service.EvaluationMetricsCalculator;
import com.shlawgathon.leafscan.backend.service.EvaluationService;
import com.shlawgathon.leafscan.backend.service.LeafDiagnosisService;
import com.shlawgathon.leafscan.backend.service.RiskPredictionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LeafScanCommandRunnerTest {

    @TempDir
    Path dataset;

    private SimilarityIndex similarityIndex;
    private CorpusIndexingService corpusIndexingService;
    private EvaluationService evaluationService;
    private LeafDiagnosisService leafDiagnosisService;
    private LeafScanCommandRunner runner;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(dataset.resolve("leaf_healthy"));
        similarityIndex = mock(SimilarityIndex.class);
        corpusIndexingService = mock(CorpusIndexingService.class);
        evaluationService = mock(EvaluationService.class);
        leafDiagnosisService = mock(LeafDiagnosisService.class);
        when(similarityIndex.statistics()).thenReturn(IndexStatistics.builder().totalRecords(0).build());
        runner = new LeafScanCommandRunner(similarityIndex, corpusIndexingService, evaluationService,
                leafDiagnosisService);
        ReflectionTestUtils.setField(runner, "dataset", dataset.toString());
        ReflectionTestUtils.setField(runner, "testDataset", dataset.toString());
    }

    @Test
    void shouldClearBeforeIndexingWhenAsked() {
        // Given
        ReflectionTestUtils.setField(runner, "mode", "INDEX");
        ReflectionTestUtils.setField(runner, "clearFirst", true);
        when(corpusIndexingService.indexCorpus(anyList())).thenReturn(IndexingSummary.builder().build());

        // When
        runner.run(new DefaultApplicationArguments());

        // Then
        var order = inOrder(similarityIndex, corpusIndexingService);
        order.verify(similarityIndex).clear();
        order.verify(corpusIndexingService).indexCorpus(anyList());
    }

    @Test
    void shouldPassBinaryOptionToEvaluation() {
        ReflectionTestUtils.setField(runner, "mode", "evaluate");
        ReflectionTestUtils.setField(runner, "collapseToBinary", true);
        when(evaluationService.evaluate(anyList(), any(), any()))
                .thenReturn(EvaluationMetricsCalculator.calculate(List.of(), false));

        runner.run(new DefaultApplicationArguments());

        ArgumentCaptor<EvaluationOptions> options = ArgumentCaptor.forClass(EvaluationOptions.class);
        verify(evaluationService).evaluate(anyList(), options.capture(), any());
        assertThat(options.getValue().isCollapseToBinary()).isTrue();
        assertThat(options.getValue().isExcludeOwnRecord()).isTrue();
        verify(similarityIndex, never()).clear();
    }

    @Test
    void shouldDiagnoseQueryImage() throws Exception {
        // Given
        Path query = dataset.resolve("query.png");
        BufferedImage image = new BufferedImage(20, 20, BufferedImage.TYPE_INT_RGB);
        image.setRGB(3, 4, 0x28942A);
        ImageIO.write(image, "png", query.toFile());
        ReflectionTestUtils.setField(runner, "mode", "diagnose");
        ReflectionTestUtils.setField(runner, "query", query.toString());
        DiagnosisResult result = new DiagnosisService(DiagnosisSettings.defaults()).diagnose(List.of(
                TestImages.match("d1", Category.DISEASED, 0.1),
                TestImages.match("h1", Category.HEALTHY, 0.4)));
        when(leafDiagnosisService.diagnose(any(PixelGrid.class))).thenReturn(Diagnosis.builder()
                .result(result)
                .risk(new RiskPredictionService(RiskThresholds.defaults()).assess(result))
                .recommendation(Recommendation.PROBABLE)
                .build());

        // When
        runner.run(new DefaultApplicationArguments());

        // Then
        ArgumentCaptor<PixelGrid> decoded = ArgumentCaptor.forClass(PixelGrid.class);
        verify(leafDiagnosisService).diagnose(decoded.capture());
        assertThat(decoded.getValue().getWidth()).isEqualTo(20);
        assertThat(decoded.getValue().getChannels()).isEqualTo(3);
        assertThat(decoded.getValue().green(3, 4)).isEqualTo(0x94);
    }

    @Test
    void shouldRequireQueryInDiagnoseMode() {
        ReflectionTestUtils.setField(runner, "mode", "diagnose");
        ReflectionTestUtils.setField(runner, "query", "");

        assertThrows(IllegalArgumentException.class, () -> runner.run(new DefaultApplicationArguments()));
        verify(leafDiagnosisService, never()).diagnose(any(PixelGrid.class));
    }

    @Test
    void shouldReportStatistics() {
        ReflectionTestUtils.setField(runner, "mode", "stats");

        runner.run(new DefaultApplicationArguments());

        verify(similarityIndex).statistics();
    }

    @Test
    void shouldRejectUnknownMode() {
        ReflectionTestUtils.setField(runner, "mode", "train");

        assertThrows(IllegalArgumentException.class, () -> runner.run(new DefaultApplicationArguments()));
    }
}
