package com.docforensics.core;

import com.docforensics.config.ForensicsConfig;
import com.docforensics.heuristics.RecommendationEngine;
import com.docforensics.imaging.TestImages;
import com.docforensics.models.Finding;
import com.docforensics.models.FusionResult;
import com.docforensics.models.ProcessingStats;
import com.docforensics.models.SignalName;
import com.docforensics.models.SignalStatus;
import com.docforensics.models.Verdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.docforensics.core.FakeAnalyzer.finding;
import static org.junit.jupiter.api.Assertions.*;

class ForensicPipelineTest {

    @TempDir
    Path tempDir;

    private ForensicsConfig config;
    private Path image;

    @BeforeEach
    void setUp() throws Exception {
        config = ForensicsConfig.load("forensics-config-fast.yaml");
        image = TestImages.writePng(TestImages.noise(32, 32, 11L), tempDir.resolve("doc.png"));
    }

    @Test
    void fusesThreeSignals() {
        ForensicPipeline pipeline = pipeline(
            FakeAnalyzer.completed(SignalName.ELA, 60, finding(SignalName.ELA, "compression_artifact", 78.43)),
            FakeAnalyzer.completed(SignalName.OCR, 30),
            FakeAnalyzer.completed(SignalName.METADATA, 30, finding(SignalName.METADATA, "missing_exif", 60)));

        FusionResult result = pipeline.process("doc-a", image);

        assertEquals("doc-a", result.getDocumentId());
        assertEquals(42.0, result.getOverallConfidence(), 1e-9);
        assertEquals(58.0, result.getUncertainty(), 1e-9);
        assertEquals(Verdict.MODERATELY_SUSPICIOUS, result.getVerdict());
        assertEquals(2, result.getCombinedFindings().size());
        assertEquals("compression_artifact", result.getCombinedFindings().get(0).getKind());
        assertTrue(result.getRecommendations().contains("Review highlighted regions carefully"));
        assertFalse(result.hasErrors());
        assertNotNull(result.getAnalyzedAt());
        assertEquals(List.of(SignalName.ELA, SignalName.OCR, SignalName.METADATA),
            new ArrayList<>(result.getPerSignal().keySet()));
    }

    @Test
    void repeatedRequestReturnsCachedResult() {
        FakeAnalyzer ela = FakeAnalyzer.completed(SignalName.ELA, 10);
        FakeAnalyzer ocr = FakeAnalyzer.completed(SignalName.OCR, 10);
        FakeAnalyzer metadata = FakeAnalyzer.completed(SignalName.METADATA, 10);
        ForensicPipeline pipeline = pipeline(ela, ocr, metadata);

        FusionResult first = pipeline.process("doc-b", image);
        FusionResult second = pipeline.process("doc-b", image);

        assertSame(first, second);
        assertEquals(1, ela.getCalls());
        assertEquals(1, ocr.getCalls());
        assertEquals(1, metadata.getCalls());
        assertSame(first, pipeline.getCachedResult("doc-b"));
    }

    @Test
    void slowSignalTimesOutWithoutBlockingOthers() throws Exception {
        FakeAnalyzer slowEla = FakeAnalyzer.slow(SignalName.ELA, 5_000, 99);
        ForensicPipeline pipeline = pipeline(
            slowEla,
            FakeAnalyzer.completed(SignalName.OCR, 50),
            FakeAnalyzer.completed(SignalName.METADATA, 50));

        long start = System.nanoTime();
        FusionResult result = pipeline.process("doc-c", image);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMs < 3_000, "Конвейер не должен ждать медленный сигнал: " + elapsedMs + " мс");
        assertEquals(SignalStatus.TIMEOUT, result.getSignal(SignalName.ELA).getStatus());
        assertEquals(0.0, result.getSignal(SignalName.ELA).getOverallConfidence(), 1e-9);
        assertTrue(result.getErrors().contains("ELA analysis timeout"));
        assertEquals(SignalStatus.COMPLETED, result.getSignal(SignalName.OCR).getStatus());
        assertEquals(30.0, result.getOverallConfidence(), 1e-9);
        assertEquals(Verdict.SLIGHTLY_SUSPICIOUS, result.getVerdict());

        Thread.sleep(200);
        assertTrue(slowEla.wasInterrupted(), "Задача после таймаута отменяется");
        assertEquals(SignalStatus.TIMEOUT, pipeline.getCachedResult("doc-c").getSignal(SignalName.ELA).getStatus(),
            "Поздний результат не попадает в итог");
    }

    @Test
    void throwingAnalyzerIsIsolated() {
        ForensicPipeline pipeline = pipeline(
            FakeAnalyzer.completed(SignalName.ELA, 50),
            FakeAnalyzer.throwing(SignalName.OCR, "boom"),
            FakeAnalyzer.completed(SignalName.METADATA, 50));

        FusionResult result = pipeline.process("doc-d", image);

        assertEquals(SignalStatus.ERROR, result.getSignal(SignalName.OCR).getStatus());
        assertTrue(result.getErrors().contains("OCR error: boom"), "Ошибки: " + result.getErrors());
        assertEquals(35.0, result.getOverallConfidence(), 1e-9);
    }

    @Test
    void analyzerReportedErrorIsCollected() {
        ForensicPipeline pipeline = pipeline(
            FakeAnalyzer.completed(SignalName.ELA, 50),
            FakeAnalyzer.completed(SignalName.OCR, 50),
            FakeAnalyzer.failing(SignalName.METADATA, "file vanished"));

        FusionResult result = pipeline.process("doc-e", image);

        assertEquals(List.of("Metadata error: file vanished"), result.getErrors());
        assertEquals("Analysis failed: file vanished", result.getSignal(SignalName.METADATA).getSummary());
    }

    @Test
    void allSignalsFailedIsProcessingError() {
        ForensicPipeline pipeline = pipeline(
            FakeAnalyzer.failing(SignalName.ELA, "a"),
            FakeAnalyzer.failing(SignalName.OCR, "b"),
            FakeAnalyzer.failing(SignalName.METADATA, "c"));

        FusionResult result = pipeline.process("doc-f", image);

        assertEquals(Verdict.PROCESSING_ERROR, result.getVerdict());
        assertEquals(0.0, result.getOverallConfidence(), 1e-9);
        assertEquals(100.0, result.getUncertainty(), 1e-9);
        assertEquals(Set.of(RecommendationEngine.PROCESSING_FAILED), result.getRecommendations());
        assertEquals(3, result.getErrors().size());
    }

    @Test
    void unreadableImageIsProcessingError() throws Exception {
        Path notImage = tempDir.resolve("not-image.png");
        Files.writeString(notImage, "definitely not a png");
        FakeAnalyzer ela = FakeAnalyzer.completed(SignalName.ELA, 90);
        ForensicPipeline pipeline = pipeline(ela,
            FakeAnalyzer.completed(SignalName.OCR, 90),
            FakeAnalyzer.completed(SignalName.METADATA, 90));

        FusionResult result = pipeline.process("doc-g", notImage);

        assertEquals(Verdict.PROCESSING_ERROR, result.getVerdict());
        assertEquals(100.0, result.getUncertainty(), 1e-9);
        assertEquals(Set.of(RecommendationEngine.PROCESSING_FAILED), result.getRecommendations());
        assertTrue(result.getErrors().get(0).startsWith("Could not read image"));
        for (SignalName name : SignalName.values()) {
            assertEquals(SignalStatus.ERROR, result.getSignal(name).getStatus());
        }
        assertEquals(0, ela.getCalls(), "Анализаторы не запускаются без растра");
    }

    @Test
    void missingImageIsProcessingError() {
        ForensicPipeline pipeline = pipeline(FakeAnalyzer.completed(SignalName.ELA, 90));

        FusionResult result = pipeline.process("doc-h", tempDir.resolve("missing.png"));

        assertEquals(Verdict.PROCESSING_ERROR, result.getVerdict());
        assertTrue(result.getCombinedFindings().isEmpty());
    }

    @Test
    void missingAnalyzerIsReportedAsError() {
        ForensicPipeline pipeline = pipeline(FakeAnalyzer.completed(SignalName.ELA, 50));

        FusionResult result = pipeline.process("doc-i", image);

        assertEquals(20.0, result.getOverallConfidence(), 1e-9);
        assertEquals(SignalStatus.ERROR, result.getSignal(SignalName.OCR).getStatus());
        assertTrue(result.getErrors().contains("OCR error: analyzer not configured"));
        assertTrue(result.getErrors().contains("Metadata error: analyzer not configured"));
    }

    @Test
    void findingsAreCappedAtTen() {
        Finding[] many = new Finding[12];
        for (int i = 0; i < many.length; i++) {
            many[i] = finding(SignalName.ELA, "compression_artifact", 30 + i);
        }
        ForensicPipeline pipeline = pipeline(
            FakeAnalyzer.completed(SignalName.ELA, 40, many),
            FakeAnalyzer.completed(SignalName.OCR, 40),
            FakeAnalyzer.completed(SignalName.METADATA, 40));

        FusionResult result = pipeline.process("doc-j", image);

        assertEquals(10, result.getCombinedFindings().size());
        assertEquals(41.0, result.getCombinedFindings().get(0).getConfidence(), 1e-9);
        assertEquals(12, result.getSignal(SignalName.ELA).getFindingsCount(), "Сигнал хранит все свои находки");
    }

    @Test
    void concurrentRequestsForSameDocumentRunOnce() throws Exception {
        FakeAnalyzer ela = FakeAnalyzer.slow(SignalName.ELA, 100, 20);
        ForensicPipeline pipeline = pipeline(ela,
            FakeAnalyzer.completed(SignalName.OCR, 20),
            FakeAnalyzer.completed(SignalName.METADATA, 20));

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Future<FusionResult>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return pipeline.process("doc-k", image);
                }));
            }
            start.countDown();
            FusionResult expected = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<FusionResult> future : futures) {
                assertSame(expected, future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, ela.getCalls());
    }

    @Test
    void statsAndCacheReset() {
        FakeAnalyzer ela = FakeAnalyzer.completed(SignalName.ELA, 20);
        ForensicPipeline pipeline = pipeline(ela,
            FakeAnalyzer.completed(SignalName.OCR, 20),
            FakeAnalyzer.completed(SignalName.METADATA, 20));

        pipeline.process("one", image);
        pipeline.process("two", image);
        pipeline.process("one", image);

        ProcessingStats stats = pipeline.getProcessingStats();
        assertEquals(2, stats.getDocumentsProcessed());
        assertEquals(2, stats.getCacheSize());
        assertTrue(stats.getAverageProcessingTime() >= 0);

        pipeline.clearCache();
        assertEquals(0, pipeline.getProcessingStats().getDocumentsProcessed());
        assertEquals(0, pipeline.getProcessingStats().getCacheSize());
        assertNull(pipeline.getCachedResult("one"));

        pipeline.process("one", image);
        assertEquals(3, ela.getCalls(), "После сброса кэша документ анализируется заново");
    }

    @Test
    void cacheResetDuringAnalysisDoesNotStartSecondComputation() throws Exception {
        FakeAnalyzer ela = FakeAnalyzer.slow(SignalName.ELA, 200, 20);
        ForensicPipeline pipeline = pipeline(ela,
            FakeAnalyzer.completed(SignalName.OCR, 20),
            FakeAnalyzer.completed(SignalName.METADATA, 20));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<FusionResult> first = pool.submit(() -> pipeline.process("doc-x", image));
            Thread.sleep(50);
            pipeline.clearCache();

            FusionResult second = pipeline.process("doc-x", image);

            assertSame(first.get(5, TimeUnit.SECONDS), second, "Второй запрос ждет идущее вычисление");
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, ela.getCalls(), "Сброс кэша не должен запускать второе вычисление");
        ProcessingStats stats = pipeline.getProcessingStats();
        assertEquals(1, stats.getDocumentsProcessed());
        assertEquals(stats.getCacheSize(), stats.getDocumentsProcessed());
    }

    @Test
    void interruptedCallerIsNotCachedAsProcessingError() {
        FakeAnalyzer ela = FakeAnalyzer.slow(SignalName.ELA, 100, 20);
        ForensicPipeline pipeline = pipeline(ela,
            FakeAnalyzer.slow(SignalName.OCR, 100, 20),
            FakeAnalyzer.slow(SignalName.METADATA, 100, 20));

        Thread.currentThread().interrupt();
        try {
            assertThrows(AnalysisInterruptedException.class, () -> pipeline.process("doc-y", image));
        } finally {
            assertTrue(Thread.interrupted(), "Флаг прерывания восстанавливается для вызывающего");
        }
        assertNull(pipeline.getCachedResult("doc-y"));
        assertEquals(0, pipeline.getProcessingStats().getDocumentsProcessed());

        FusionResult retry = pipeline.process("doc-y", image);

        assertEquals(Verdict.SLIGHTLY_SUSPICIOUS, retry.getVerdict());
        assertFalse(retry.hasErrors(), "Ошибки: " + retry.getErrors());
        assertSame(retry, pipeline.getCachedResult("doc-y"));
    }

    @Test
    void highElaRecommendationHasItsOwnThreshold() {
        config.getFusion().setHighElaThreshold(50.0);
        ForensicPipeline pipeline = pipeline(
            FakeAnalyzer.completed(SignalName.ELA, 60),
            FakeAnalyzer.completed(SignalName.OCR, 10),
            FakeAnalyzer.completed(SignalName.METADATA, 10));

        FusionResult result = pipeline.process("doc-z", image);

        assertEquals(30.0, result.getOverallConfidence(), 1e-9);
        assertTrue(result.getRecommendations().contains(RecommendationEngine.HIGH_ELA),
            "Рекомендации: " + result.getRecommendations());
        assertEquals(Verdict.SLIGHTLY_SUSPICIOUS, result.getVerdict(),
            "Порог NEEDS_REVIEW не зависит от порога рекомендации ELA");
    }

    @Test
    void invalidConfigurationFailsFast() {
        ForensicsConfig broken = ForensicsConfig.defaults();
        broken.getFusion().getWeights().setOcr(0.9);

        assertThrows(IllegalStateException.class,
            () -> new ForensicPipeline(broken, List.of(FakeAnalyzer.completed(SignalName.ELA, 1))));
    }

    @Test
    void analyzersAreRequired() {
        assertThrows(IllegalArgumentException.class, () -> new ForensicPipeline(config, List.of()));
    }

    private ForensicPipeline pipeline(FakeAnalyzer... analyzers) {
        return new ForensicPipeline(config, List.of(analyzers));
    }
}
