package com.docforensics.core;

import com.docforensics.analyzers.AnalysisInput;
import com.docforensics.analyzers.CompressionArtifactAnalyzer;
import com.docforensics.analyzers.ForensicAnalyzer;
import com.docforensics.analyzers.MetadataAnomalyAnalyzer;
import com.docforensics.analyzers.TextLayoutAnalyzer;
import com.docforensics.config.ForensicsConfig;
import com.docforensics.heuristics.ConfidenceCalculator;
import com.docforensics.heuristics.FindingAggregator;
import com.docforensics.heuristics.RecommendationEngine;
import com.docforensics.models.FusionResult;
import com.docforensics.models.ProcessingStats;
import com.docforensics.models.SignalName;
import com.docforensics.models.SignalResult;
import com.docforensics.models.SignalStatus;
import com.docforensics.models.Verdict;
import com.docforensics.ocr.TesseractOcrEngine;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Конвейер слияния сигналов.
 * Запускает анализаторы параллельно, у каждого свой таймаут; сбой одного сигнала
 * не влияет на остальные. Результат кэшируется по идентификатору документа.
 */
@Slf4j
public class ForensicPipeline {

    private final ForensicsConfig config;
    private final List<ForensicAnalyzer> analyzers;
    private final ConfidenceCalculator confidenceCalculator;
    private final FindingAggregator findingAggregator;
    private final RecommendationEngine recommendationEngine;
    private final ResultCache cache = new ResultCache();

    public ForensicPipeline(ForensicsConfig config) {
        this(config, defaultAnalyzers(config));
    }

    public ForensicPipeline(ForensicsConfig config, List<ForensicAnalyzer> analyzers) {
        this.config = Objects.requireNonNull(config, "config");
        // КРИТИЧНО: некорректная конфигурация должна падать до первого документа
        config.validate();
        if (analyzers == null || analyzers.isEmpty()) {
            throw new IllegalArgumentException("Нужен хотя бы один анализатор");
        }
        this.analyzers = List.copyOf(analyzers);
        ForensicsConfig.Fusion fusion = config.getFusion();
        this.confidenceCalculator = new ConfidenceCalculator(fusion);
        this.findingAggregator = new FindingAggregator(fusion.getMaxFindings());
        this.recommendationEngine = new RecommendationEngine(fusion.getMaxRecommendations(),
            fusion.getHighElaThreshold());
        log.info("Конвейер инициализирован: {} анализаторов, таймаут сигнала {} мс",
            this.analyzers.size(), config.getPipeline().getSignalTimeoutMs());
    }

    public static List<ForensicAnalyzer> defaultAnalyzers(ForensicsConfig config) {
        return List.of(
            new CompressionArtifactAnalyzer(config),
            new TextLayoutAnalyzer(config, new TesseractOcrEngine(config.getOcr())),
            new MetadataAnomalyAnalyzer(config)
        );
    }

    public FusionResult process(String documentId, Path imagePath) {
        return process(documentId, imagePath, null);
    }

    /**
     * Проанализировать документ. Фатальная ошибка дает результат с вердиктом PROCESSING_ERROR.
     * Исключение выбрасывается только при прерывании вызывающего потока; такой вызов не кэшируется.
     *
     * @param documentId идентификатор документа (ключ кэша)
     * @param imagePath растровое изображение документа
     * @param sourcePath исходный загруженный файл для анализа метаданных (может быть null)
     * @throws AnalysisInterruptedException если поток прерван во время ожидания сигналов
     */
    public FusionResult process(String documentId, Path imagePath, Path sourcePath) {
        Objects.requireNonNull(documentId, "documentId");
        return cache.getOrCompute(documentId, id -> analyze(id, imagePath, sourcePath));
    }

    private FusionResult analyze(String documentId, Path imagePath, Path sourcePath) {
        long start = System.nanoTime();
        log.info("=== Начало анализа документа {} ===", documentId);

        FusionResult result;
        try {
            BufferedImage image = decode(imagePath);
            AnalysisInput input = AnalysisInput.builder()
                .documentId(documentId)
                .imagePath(imagePath)
                .sourcePath(sourcePath)
                .image(image)
                .build();

            List<String> errors = new ArrayList<>();
            Map<SignalName, SignalResult> perSignal = runAnalyzers(input, errors);
            result = fuse(documentId, perSignal, errors, elapsedSeconds(start));
        } catch (AnalysisInterruptedException e) {
            log.warn("Анализ документа {} прерван вызывающим потоком", documentId);
            throw e;
        } catch (RuntimeException e) {
            log.error("Ошибка обработки документа {}: {}", documentId, e.getMessage());
            log.debug("Детали ошибки конвейера", e);
            result = errorResult(documentId, e.getMessage(), elapsedSeconds(start));
        }

        long deadlineMs = config.getPipeline().getOverallDeadlineMs();
        if (result.getProcessingTimeSeconds() * 1000 > deadlineMs) {
            log.warn("Документ {} обрабатывался {} с, дольше общего дедлайна {} мс",
                documentId, String.format(Locale.ROOT, "%.2f", result.getProcessingTimeSeconds()), deadlineMs);
        }

        log.info("=== Анализ {} завершен: {} ({}%), {} с ===", documentId, result.getVerdict(),
            result.getOverallConfidence(), String.format(Locale.ROOT, "%.2f", result.getProcessingTimeSeconds()));
        return result;
    }

    private BufferedImage decode(Path imagePath) {
        if (imagePath == null || !Files.isRegularFile(imagePath)) {
            throw new PipelineFailureException("Could not read image: " + imagePath);
        }
        try {
            BufferedImage image = ImageIO.read(imagePath.toFile());
            if (image == null) {
                throw new PipelineFailureException("Could not read image: " + imagePath);
            }
            return image;
        } catch (IOException e) {
            throw new PipelineFailureException("Could not read image: " + e.getMessage(), e);
        }
    }

    /**
     * Параллельный запуск анализаторов на отдельном пуле документа.
     * Результат сигнала после таймаута отменяется и больше не читается.
     */
    Map<SignalName, SignalResult> runAnalyzers(AnalysisInput input, List<String> errors) {
        long timeoutMs = config.getPipeline().getSignalTimeoutMs();
        Map<SignalName, SignalResult> perSignal = new EnumMap<>(SignalName.class);
        ExecutorService executor = Executors.newFixedThreadPool(analyzers.size(),
            threadFactory(input.getDocumentId()));
        try {
            Map<ForensicAnalyzer, Future<SignalResult>> futures = new LinkedHashMap<>();
            long submittedAt = System.nanoTime();
            for (ForensicAnalyzer analyzer : analyzers) {
                futures.put(analyzer, executor.submit(() -> analyzer.analyze(input)));
            }

            for (Map.Entry<ForensicAnalyzer, Future<SignalResult>> entry : futures.entrySet()) {
                SignalName signal = entry.getKey().getSignal();
                long remainingMs = timeoutMs - TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - submittedAt);
                SignalResult signalResult;
                try {
                    signalResult = await(signal, entry.getValue(), Math.max(0, remainingMs), timeoutMs);
                    if (!signalResult.isCompleted()) {
                        errors.add(signal.getLabel() + " error: " + signalResult.getError());
                    }
                } catch (AnalyzerTimeoutException e) {
                    log.warn("Сигнал {} превысил таймаут {} мс", signal, timeoutMs);
                    errors.add(e.getMessage());
                    signalResult = SignalResult.degraded(signal, SignalStatus.TIMEOUT, e.getMessage());
                } catch (AnalyzerFailureException e) {
                    log.warn("Сигнал {} завершился ошибкой: {}", signal, e.getMessage());
                    errors.add(e.getMessage());
                    signalResult = SignalResult.failed(signal, e.getMessage());
                } catch (InterruptedException e) {
                    // КРИТИЧНО: прерывание вызывающего потока - не сбой анализатора
                    Thread.currentThread().interrupt();
                    futures.values().forEach(f -> f.cancel(true));
                    throw new AnalysisInterruptedException(input.getDocumentId(), e);
                }
                perSignal.put(signal, signalResult);
            }
        } finally {
            executor.shutdownNow();
        }

        for (SignalName signal : SignalName.values()) {
            if (!perSignal.containsKey(signal)) {
                String message = signal.getLabel() + " error: analyzer not configured";
                errors.add(message);
                perSignal.put(signal, SignalResult.failed(signal, message));
            }
        }
        return perSignal;
    }

    private static SignalResult await(SignalName signal, Future<SignalResult> future,
                                      long waitMs, long timeoutMs) throws InterruptedException {
        try {
            SignalResult result = future.get(waitMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new AnalyzerFailureException(signal, "analyzer returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AnalyzerTimeoutException(signal, timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AnalyzerFailureException(signal, String.valueOf(cause.getMessage()), cause);
        }
    }

    private FusionResult fuse(String documentId, Map<SignalName, SignalResult> perSignal,
                              List<String> errors, double processingTime) {
        double overall = confidenceCalculator.fuse(perSignal);
        Verdict verdict = confidenceCalculator.determineVerdict(overall, perSignal);
        Set<String> recommendations = recommendationEngine.generate(verdict, perSignal);

        if (!errors.isEmpty()) {
            log.warn("Документ {}: деградировавших сигналов {}", documentId, errors.size());
        }

        return FusionResult.builder()
            .documentId(documentId)
            .overallConfidence(overall)
            .uncertainty(ConfidenceCalculator.uncertainty(overall))
            .verdict(verdict)
            .perSignal(Collections.unmodifiableMap(perSignal))
            .combinedFindings(findingAggregator.combine(perSignal))
            .recommendations(recommendations)
            .errors(List.copyOf(errors))
            .processingTimeSeconds(processingTime)
            .analyzedAt(LocalDateTime.now())
            .build();
    }

    private FusionResult errorResult(String documentId, String message, double processingTime) {
        String reason = message != null ? message : "unknown error";
        Map<SignalName, SignalResult> perSignal = new EnumMap<>(SignalName.class);
        for (SignalName signal : SignalName.values()) {
            perSignal.put(signal, SignalResult.failed(signal, reason));
        }
        return FusionResult.builder()
            .documentId(documentId)
            .overallConfidence(0.0)
            .uncertainty(100.0)
            .verdict(Verdict.PROCESSING_ERROR)
            .perSignal(Collections.unmodifiableMap(perSignal))
            .combinedFindings(List.of())
            .recommendations(Set.of(RecommendationEngine.PROCESSING_FAILED))
            .errors(List.of(reason))
            .processingTimeSeconds(processingTime)
            .analyzedAt(LocalDateTime.now())
            .build();
    }

    /**
     * Статистика по готовым результатам в кэше: после сброса кэша счетчики обнуляются вместе с ним
     */
    public ProcessingStats getProcessingStats() {
        List<FusionResult> completed = cache.completedResults();
        double totalProcessingTime = completed.stream()
            .mapToDouble(FusionResult::getProcessingTimeSeconds)
            .sum();
        return ProcessingStats.builder()
            .documentsProcessed(completed.size())
            .averageProcessingTime(completed.isEmpty()
                ? 0.0 : ConfidenceCalculator.round2(totalProcessingTime / completed.size()))
            .cacheSize(completed.size())
            .build();
    }

    /**
     * Административный сброс кэша и статистики. Идущие вычисления не прерываются и
     * попадают в кэш по завершении.
     */
    public void clearCache() {
        int inFlight = cache.clear();
        log.info("Кэш результатов очищен, вычислений в работе: {}", inFlight);
    }

    public FusionResult getCachedResult(String documentId) {
        return cache.getIfPresent(documentId);
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static ThreadFactory threadFactory(String documentId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "forensics-" + documentId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
