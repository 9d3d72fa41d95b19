package com.docforensics.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Конфигурация конвейера из YAML файла.
 * Все пороги и веса эвристик собраны здесь, а не в анализаторах.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ForensicsConfig {

    public static final String DEFAULT_RESOURCE = "forensics-config.yaml";

    private Pipeline pipeline;
    private Compression compression;
    private Layout layout;
    private Ocr ocr;
    private Metadata metadata;
    private Fusion fusion;
    private Report report;
    private Visualization visualization;

    private static ForensicsConfig instance;

    /**
     * Загрузить конфигурацию из classpath (кэшируется)
     */
    public static synchronized ForensicsConfig load() {
        if (instance == null) {
            instance = load(DEFAULT_RESOURCE);
        }
        return instance;
    }

    /**
     * Загрузить конфигурацию из указанного ресурса classpath (без кэширования)
     */
    public static ForensicsConfig load(String resource) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = ForensicsConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " не найден в classpath");
            }
            ForensicsConfig config = mapper.readValue(is, ForensicsConfig.class);
            config.ensureDefaults();
            config.validate();
            return config;
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    /**
     * Конфигурация со значениями по умолчанию, без чтения файла
     */
    public static ForensicsConfig defaults() {
        ForensicsConfig config = new ForensicsConfig();
        config.ensureDefaults();
        config.validate();
        return config;
    }

    public void ensureDefaults() {
        if (pipeline == null) {
            pipeline = new Pipeline();
        }
        pipeline.ensureDefaults();
        if (compression == null) {
            compression = new Compression();
        }
        compression.ensureDefaults();
        if (layout == null) {
            layout = new Layout();
        }
        layout.ensureDefaults();
        if (ocr == null) {
            ocr = new Ocr();
        }
        ocr.ensureDefaults();
        if (metadata == null) {
            metadata = new Metadata();
        }
        metadata.ensureDefaults();
        if (fusion == null) {
            fusion = new Fusion();
        }
        fusion.ensureDefaults();
        if (report == null) {
            report = new Report();
        }
        report.ensureDefaults();
        if (visualization == null) {
            visualization = new Visualization();
        }
    }

    /**
     * Проверить согласованность значений.
     * @throws IllegalStateException при некорректной конфигурации
     */
    public void validate() {
        if (compression.getJpegQuality() < 1 || compression.getJpegQuality() > 100) {
            throw new IllegalStateException("compression.jpegQuality должен быть в диапазоне 1-100");
        }
        if (compression.getDifferenceThreshold() < 0 || compression.getDifferenceThreshold() > 255) {
            throw new IllegalStateException("compression.differenceThreshold должен быть в диапазоне 0-255");
        }
        Weights weights = fusion.getWeights();
        double sum = weights.getEla() + weights.getOcr() + weights.getMetadata();
        if (weights.getEla() < 0 || weights.getOcr() < 0 || weights.getMetadata() < 0) {
            throw new IllegalStateException("fusion.weights не могут быть отрицательными");
        }
        if (Math.abs(sum - 1.0) > 1e-6) {
            throw new IllegalStateException(String.format(Locale.ROOT,
                "Сумма fusion.weights должна быть 1.0, получено %.4f", sum));
        }
        VerdictThresholds t = fusion.getVerdictThresholds();
        if (!(t.getHighlySuspicious() > t.getSuspicious()
            && t.getSuspicious() > t.getModeratelySuspicious()
            && t.getModeratelySuspicious() > t.getSlightlySuspicious()
            && t.getSlightlySuspicious() > 0)) {
            throw new IllegalStateException("fusion.verdictThresholds должны строго убывать и быть > 0");
        }
        if (pipeline.getSignalTimeoutMs() <= 0) {
            throw new IllegalStateException("pipeline.signalTimeoutMs должен быть > 0");
        }
    }

    @Data
    public static class Pipeline {
        private Long signalTimeoutMs;
        private Long overallDeadlineMs;

        void ensureDefaults() {
            if (signalTimeoutMs == null || signalTimeoutMs <= 0) {
                signalTimeoutMs = 15_000L;
            }
            if (overallDeadlineMs == null || overallDeadlineMs <= 0) {
                overallDeadlineMs = 20_000L;
            }
        }
    }

    @Data
    public static class Compression {
        private Integer jpegQuality;
        private Integer differenceThreshold;
        private Integer minRegionArea;
        private Double minRegionConfidence;
        private Double areaRatioScale;

        void ensureDefaults() {
            if (jpegQuality == null) {
                jpegQuality = 95;
            }
            if (differenceThreshold == null) {
                differenceThreshold = 10;
            }
            if (minRegionArea == null || minRegionArea < 1) {
                minRegionArea = 100;
            }
            if (minRegionConfidence == null || minRegionConfidence < 0) {
                minRegionConfidence = 20.0;
            }
            if (areaRatioScale == null || areaRatioScale <= 0) {
                areaRatioScale = 200.0;
            }
        }
    }

    @Data
    public static class Layout {
        private Double minOcrConfidence;
        private Integer minRegionSize;
        private Integer lineTolerancePx;
        private Double fontSizeVariationRatio;
        private Integer alignmentTolerancePx;
        private Integer spacingGapPx;

        void ensureDefaults() {
            if (minOcrConfidence == null || minOcrConfidence < 0) {
                minOcrConfidence = 30.0;
            }
            if (minRegionSize == null || minRegionSize < 0) {
                minRegionSize = 10;
            }
            if (lineTolerancePx == null || lineTolerancePx < 0) {
                lineTolerancePx = 10;
            }
            if (fontSizeVariationRatio == null || fontSizeVariationRatio <= 0) {
                fontSizeVariationRatio = 0.2;
            }
            if (alignmentTolerancePx == null || alignmentTolerancePx < 0) {
                alignmentTolerancePx = 20;
            }
            if (spacingGapPx == null || spacingGapPx < 0) {
                spacingGapPx = 100;
            }
        }
    }

    @Data
    public static class Ocr {
        private String language;
        private Integer pageSegmentationMode;
        private Integer ocrEngineMode;
        /** Путь к tessdata (null - переменная окружения TESSDATA_PREFIX) */
        private String dataPath;

        void ensureDefaults() {
            if (language == null || language.isBlank()) {
                language = "eng";
            }
            if (pageSegmentationMode == null) {
                pageSegmentationMode = 6;
            }
            if (ocrEngineMode == null) {
                ocrEngineMode = 3;
            }
            if (dataPath == null || dataPath.isBlank()) {
                dataPath = System.getenv("TESSDATA_PREFIX");
            }
        }
    }

    @Data
    public static class Metadata {
        private List<String> editorSoftware;
        private List<String> geographicHints;
        private Double minBytesPerPixel;
        private Double minFileSizeRatio;

        void ensureDefaults() {
            if (editorSoftware == null || editorSoftware.isEmpty()) {
                editorSoftware = new ArrayList<>(List.of("photoshop", "gimp", "paint", "editor", "adobe"));
            }
            if (geographicHints == null || geographicHints.isEmpty()) {
                geographicHints = new ArrayList<>(List.of("map", "location", "geo"));
            }
            if (minBytesPerPixel == null || minBytesPerPixel <= 0) {
                minBytesPerPixel = 0.1;
            }
            if (minFileSizeRatio == null || minFileSizeRatio <= 0) {
                minFileSizeRatio = 0.01;
            }
        }
    }

    @Data
    public static class Fusion {
        private Weights weights;
        private VerdictThresholds verdictThresholds;
        private Double needsReviewSignalThreshold;
        /** Уверенность ELA, начиная с которой рекомендуется проверить подсвеченные области */
        private Double highElaThreshold;
        private Integer maxFindings;
        private Integer maxRecommendations;

        void ensureDefaults() {
            if (weights == null) {
                weights = new Weights();
            }
            weights.ensureDefaults();
            if (verdictThresholds == null) {
                verdictThresholds = new VerdictThresholds();
            }
            verdictThresholds.ensureDefaults();
            if (needsReviewSignalThreshold == null) {
                needsReviewSignalThreshold = 70.0;
            }
            if (highElaThreshold == null || highElaThreshold < 0) {
                highElaThreshold = 70.0;
            }
            if (maxFindings == null || maxFindings < 1) {
                maxFindings = 10;
            }
            if (maxRecommendations == null || maxRecommendations < 1) {
                maxRecommendations = 5;
            }
        }
    }

    @Data
    public static class Weights {
        private Double ela;
        private Double ocr;
        private Double metadata;

        void ensureDefaults() {
            if (ela == null) {
                ela = 0.4;
            }
            if (ocr == null) {
                ocr = 0.3;
            }
            if (metadata == null) {
                metadata = 0.3;
            }
        }
    }

    @Data
    public static class VerdictThresholds {
        private Double highlySuspicious;
        private Double suspicious;
        private Double moderatelySuspicious;
        private Double slightlySuspicious;

        void ensureDefaults() {
            if (highlySuspicious == null) {
                highlySuspicious = 80.0;
            }
            if (suspicious == null) {
                suspicious = 60.0;
            }
            if (moderatelySuspicious == null) {
                moderatelySuspicious = 40.0;
            }
            if (slightlySuspicious == null) {
                slightlySuspicious = 20.0;
            }
        }
    }

    @Data
    public static class Report {
        private String analysisVersion;
        private String outputDir;

        void ensureDefaults() {
            if (analysisVersion == null || analysisVersion.isBlank()) {
                analysisVersion = "1.0";
            }
            if (outputDir == null || outputDir.isBlank()) {
                outputDir = "./reports";
            }
        }
    }

    /**
     * Тепловая карта ELA и рамки OCR. Без outputDir визуализации не строятся.
     */
    @Data
    public static class Visualization {
        private String outputDir;

        public boolean isEnabled() {
            return outputDir != null && !outputDir.isBlank();
        }
    }
}
