package com.docforensics.analyzers;

import com.docforensics.config.ForensicsConfig;
import com.docforensics.heuristics.ConfidenceCalculator;
import com.docforensics.imaging.ConnectedComponents;
import com.docforensics.imaging.ConnectedComponents.Component;
import com.docforensics.imaging.Overlays;
import com.docforensics.imaging.RasterOps;
import com.docforensics.models.Finding;
import com.docforensics.models.SignalName;
import com.docforensics.models.SignalResult;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Mat;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Error Level Analysis: пересжатие JPEG и поиск областей с аномальной ошибкой сжатия.
 * Отредактированные участки пересжимаются иначе, чем остальной документ.
 */
@Slf4j
public class CompressionArtifactAnalyzer implements ForensicAnalyzer {

    static final String KIND = "compression_artifact";
    static final String HEATMAP_SUFFIX = "ela_heatmap";

    private final ForensicsConfig.Compression settings;
    private final ForensicsConfig.Visualization visualization;

    public CompressionArtifactAnalyzer(ForensicsConfig config) {
        this.settings = config.getCompression();
        this.visualization = config.getVisualization();
    }

    @Override
    public SignalName getSignal() {
        return SignalName.ELA;
    }

    @Override
    public SignalResult analyze(AnalysisInput input) {
        Mat original = null;
        Mat resaved = null;
        Mat errorLevels = null;
        try {
            BufferedImage image = input != null ? input.getImage() : null;
            if (image == null) {
                throw new IllegalArgumentException("Could not read image: "
                    + (input != null ? input.getImagePath() : null));
            }
            original = RasterOps.toBgr(image);
            resaved = RasterOps.jpegRoundTrip(original, settings.getJpegQuality());
            errorLevels = RasterOps.errorLevels(original, resaved);

            SignalResult result = evaluate(errorLevels);
            if (visualization != null && visualization.isEnabled()) {
                result = withHeatmap(result, input.getDocumentId(), original, errorLevels);
            }
            return result;
        } catch (Exception e) {
            log.warn("ELA анализ не выполнен: {}", e.getMessage());
            log.debug("Детали ошибки ELA", e);
            return SignalResult.failed(SignalName.ELA, e.getMessage());
        } finally {
            release(original);
            release(resaved);
            release(errorLevels);
        }
    }

    /**
     * Оценка по нормализованной карте ошибок (CV_8UC1, 0-255)
     */
    SignalResult evaluate(Mat errorLevels) {
        long totalPixels = errorLevels.total();
        List<Component> components;
        Mat mask = RasterOps.threshold(errorLevels, settings.getDifferenceThreshold());
        try {
            components = ConnectedComponents.label(mask, errorLevels);
        } finally {
            mask.release();
        }

        List<Finding> regions = new ArrayList<>();
        long suspiciousArea = 0;
        for (Component component : components) {
            if (component.getArea() < settings.getMinRegionArea()) {
                continue;
            }
            double intensity = component.getMeanIntensity();
            double rawConfidence = ConfidenceCalculator.clamp(intensity / 255.0 * 100.0);
            // порог сравнивается с неокругленным значением
            if (rawConfidence < settings.getMinRegionConfidence()) {
                continue;
            }
            double confidence = ConfidenceCalculator.round2(rawConfidence);
            regions.add(Finding.builder()
                .kind(KIND)
                .source(SignalName.ELA)
                .confidence(confidence)
                .description(String.format(Locale.ROOT,
                    "Editing artifacts detected (confidence: %.2f%%)", confidence))
                .bbox(component.getBbox())
                .detail("area", component.getArea())
                .detail("intensity", ConfidenceCalculator.round2(intensity))
                .build());
            suspiciousArea += component.getArea();
        }

        double ratio = totalPixels > 0 ? (double) suspiciousArea / totalPixels : 0.0;
        double overall = ConfidenceCalculator.round2(
            ConfidenceCalculator.clamp(ratio * settings.getAreaRatioScale()));

        log.debug("ELA: компонент {}, подозрительных областей {}, доля {}",
            components.size(), regions.size(), ratio);

        return SignalResult.builder()
            .signal(SignalName.ELA)
            .overallConfidence(overall)
            .findings(regions)
            .summary(summarize(regions, overall))
            .detail("suspicious_ratio", ConfidenceCalculator.round2(ratio * 100))
            .detail("regions_found", regions.size())
            .build();
    }

    /**
     * Сохранить тепловую карту и добавить путь в details.
     * Ошибка записи не делает сигнал неуспешным: карта просто не попадает в результат.
     */
    private SignalResult withHeatmap(SignalResult result, String documentId, Mat original, Mat errorLevels) {
        List<Overlays.Box> boxes = result.getFindings().stream()
            .map(f -> new Overlays.Box(f.getBbox(), f.getConfidence(),
                String.format(Locale.ROOT, "%.0f%%", f.getConfidence())))
            .collect(Collectors.toList());
        Mat heatmap = Overlays.errorLevelHeatmap(original, errorLevels, boxes);
        try {
            Path target = Paths.get(visualization.getOutputDir())
                .resolve(Overlays.fileName(documentId, HEATMAP_SUFFIX));
            Overlays.writePng(heatmap, target);
            log.debug("Тепловая карта ELA сохранена: {}", target);
            return result.toBuilder().detail("heatmap_path", target.toString()).build();
        } catch (Exception e) {
            log.warn("Не удалось сохранить тепловую карту ELA: {}", e.getMessage());
            return result;
        } finally {
            heatmap.release();
        }
    }

    static String summarize(List<Finding> regions, double overall) {
        if (regions.isEmpty()) {
            if (overall < 20) {
                return "No significant tampering detected. Document appears authentic.";
            }
            return "Low confidence findings. Document likely authentic with minor compression artifacts.";
        }

        long high = regions.stream().filter(r -> r.getConfidence() >= 70).count();
        long medium = regions.stream().filter(r -> r.getConfidence() >= 40 && r.getConfidence() < 70).count();
        long low = regions.stream().filter(r -> r.getConfidence() < 40).count();

        if (high >= 2) {
            return "High confidence tampering detected in " + high
                + " regions. Document shows clear signs of manipulation.";
        }
        if (high == 1 && medium >= 1) {
            return "Suspicious editing detected. " + high + " high confidence and " + medium
                + " medium confidence regions found.";
        }
        if (medium >= 2) {
            return "Multiple suspicious regions detected (" + medium + " regions). Document may have been altered.";
        }
        if (low >= 3) {
            return "Minor anomalies detected in " + regions.size()
                + " regions. Could be compression artifacts or minor edits.";
        }
        return regions.size() + " potential tampering regions detected. Further verification recommended.";
    }

    private static void release(Mat mat) {
        if (mat != null) {
            mat.release();
        }
    }
}
