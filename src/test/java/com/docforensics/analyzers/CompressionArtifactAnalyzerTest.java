package com.docforensics.analyzers;

import com.docforensics.config.ForensicsConfig;
import com.docforensics.imaging.TestImages;
import com.docforensics.models.Finding;
import com.docforensics.models.SignalName;
import com.docforensics.models.SignalResult;
import com.docforensics.models.SignalStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Mat;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompressionArtifactAnalyzerTest {

    @TempDir
    Path tempDir;

    private ForensicsConfig config;
    private CompressionArtifactAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        config = ForensicsConfig.defaults();
        analyzer = new CompressionArtifactAnalyzer(config);
    }

    @Test
    void uniformImageHasNoArtifacts() {
        SignalResult result = analyzer.analyze(AnalysisInput.builder()
            .documentId("blank")
            .image(TestImages.uniform(64, 64, Color.WHITE))
            .build());

        assertEquals(SignalStatus.COMPLETED, result.getStatus());
        assertEquals(SignalName.ELA, result.getSignal());
        assertTrue(result.getFindings().isEmpty(), "Однородное изображение не должно давать областей");
        assertTrue(result.getOverallConfidence() < 1.0);
        assertFalse(result.getDetails().containsKey("heatmap_path"), "Без каталога визуализаций карта не строится");
    }

    @Test
    void singleStrongRegionIsReportedAndSpeckIgnored() {
        Mat map = TestImages.blankMap(100, 100);
        TestImages.paint(map, 40, 10, 20, 20, 200);
        TestImages.paint(map, 80, 80, 5, 5, 250);

        SignalResult result = analyzer.evaluate(map);

        assertEquals(1, result.getFindingsCount(), "Область 5x5 меньше минимальной площади");
        Finding region = result.getFindings().get(0);
        assertEquals("compression_artifact", region.getKind());
        assertEquals(78.43, region.getConfidence(), 1e-9);
        assertEquals(40, region.getBbox().getX());
        assertEquals(10, region.getBbox().getY());
        assertEquals(20, region.getBbox().getWidth());
        assertEquals(20, region.getBbox().getHeight());
        assertEquals(400, region.getDetails().get("area"));
        assertEquals(8.0, result.getOverallConfidence(), 1e-9);
        assertEquals("1 potential tampering regions detected. Further verification recommended.",
            result.getSummary());
    }

    @Test
    void weakRegionBelowMinimumConfidenceIsDropped() {
        Mat map = TestImages.paint(TestImages.blankMap(50, 50), 0, 0, 20, 20, 40);

        SignalResult result = analyzer.evaluate(map);

        assertTrue(result.getFindings().isEmpty(), "Интенсивность 40 дает уверенность ниже 20");
        assertEquals(0.0, result.getOverallConfidence(), 1e-9);
    }

    @Test
    void largeAreaSaturatesAtHundred() {
        Mat map = TestImages.paint(TestImages.blankMap(20, 20), 0, 0, 20, 20, 255);

        SignalResult result = analyzer.evaluate(map);

        assertEquals(100.0, result.getOverallConfidence(), 1e-9);
        assertEquals(100.0, result.getFindings().get(0).getConfidence(), 1e-9);
    }

    @Test
    void confidenceJustBelowFloorIsDroppedBeforeRounding() {
        // среднее 50.99 дает 19.996%, что округляется до 20.00, но порог 20 не пройден
        Mat map = TestImages.paint(TestImages.blankMap(40, 40), 0, 0, 10, 10, 51);
        map.put(5, 5, new byte[]{50});

        SignalResult result = analyzer.evaluate(map);

        assertTrue(result.getFindings().isEmpty(), "Находки: " + result.getFindings());
        assertEquals(0, result.getDetails().get("regions_found"));
    }

    @Test
    void confidenceExactlyAtFloorIsKept() {
        // 51 / 255 = ровно 20%
        Mat map = TestImages.paint(TestImages.blankMap(40, 40), 0, 0, 10, 10, 51);

        SignalResult result = analyzer.evaluate(map);

        assertEquals(1, result.getFindingsCount());
        assertEquals(20.0, result.getFindings().get(0).getConfidence(), 1e-9);
    }

    @Test
    void heatmapIsWrittenWhenVisualizationEnabled() throws Exception {
        Path visualDir = tempDir.resolve("visual");
        config.getVisualization().setOutputDir(visualDir.toString());
        analyzer = new CompressionArtifactAnalyzer(config);

        SignalResult result = analyzer.analyze(AnalysisInput.builder()
            .documentId("scan-7")
            .image(TestImages.noise(48, 32, 3L))
            .build());

        assertEquals(SignalStatus.COMPLETED, result.getStatus());
        Object heatmapPath = result.getDetails().get("heatmap_path");
        assertNotNull(heatmapPath, "Путь к тепловой карте в details");
        Path heatmap = Paths.get(heatmapPath.toString());
        assertEquals(visualDir.resolve("scan-7_ela_heatmap.png"), heatmap);
        BufferedImage written = ImageIO.read(heatmap.toFile());
        assertEquals(48, written.getWidth());
        assertEquals(32, written.getHeight());
    }

    @Test
    void heatmapWriteFailureKeepsSignalCompleted() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        config.getVisualization().setOutputDir(blocker.toString());
        analyzer = new CompressionArtifactAnalyzer(config);

        SignalResult result = analyzer.analyze(AnalysisInput.builder()
            .documentId("scan-8")
            .image(TestImages.noise(16, 16, 4L))
            .build());

        assertEquals(SignalStatus.COMPLETED, result.getStatus());
        assertFalse(result.getDetails().containsKey("heatmap_path"));
    }

    @Test
    void missingImageProducesErrorStatus() {
        SignalResult result = analyzer.analyze(AnalysisInput.builder()
            .documentId("none")
            .imagePath(tempDir.resolve("missing.png"))
            .build());

        assertEquals(SignalStatus.ERROR, result.getStatus());
        assertEquals(0.0, result.getOverallConfidence(), 1e-9);
        assertTrue(result.getFindings().isEmpty());
        assertTrue(result.getError().startsWith("Could not read image"));
    }

    @Test
    void summaryLadder() {
        assertEquals("No significant tampering detected. Document appears authentic.",
            CompressionArtifactAnalyzer.summarize(List.of(), 0));
        assertEquals("High confidence tampering detected in 2 regions. Document shows clear signs of manipulation.",
            CompressionArtifactAnalyzer.summarize(List.of(region(90), region(75)), 30));
        assertEquals("Suspicious editing detected. 1 high confidence and 1 medium confidence regions found.",
            CompressionArtifactAnalyzer.summarize(List.of(region(90), region(50)), 30));
        assertEquals("Multiple suspicious regions detected (2 regions). Document may have been altered.",
            CompressionArtifactAnalyzer.summarize(List.of(region(45), region(50)), 30));
        assertEquals("Minor anomalies detected in 3 regions. Could be compression artifacts or minor edits.",
            CompressionArtifactAnalyzer.summarize(List.of(region(25), region(30), region(35)), 10));
    }

    private static Finding region(double confidence) {
        return Finding.builder()
            .kind(CompressionArtifactAnalyzer.KIND)
            .source(SignalName.ELA)
            .confidence(confidence)
            .build();
    }
}
