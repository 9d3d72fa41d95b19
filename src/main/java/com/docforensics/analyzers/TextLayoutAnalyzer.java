package com.docforensics.analyzers;

import com.docforensics.config.ForensicsConfig;
import com.docforensics.imaging.Overlays;
import com.docforensics.imaging.RasterOps;
import com.docforensics.models.Finding;
import com.docforensics.models.SignalName;
import com.docforensics.models.SignalResult;
import com.docforensics.ocr.OcrEngine;
import com.docforensics.ocr.OcrOptions;
import com.docforensics.ocr.OcrPreprocessor;
import com.docforensics.ocr.OcrWord;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Mat;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Анализ текстовой разметки: OCR и поиск несогласованностей шрифта, выравнивания и интервалов
 */
@Slf4j
public class TextLayoutAnalyzer implements ForensicAnalyzer {

    static final String OVERLAY_SUFFIX = "ocr_regions";
    private static final int LABEL_LENGTH = 15;

    private final OcrEngine ocrEngine;
    private final OcrOptions options;
    private final LayoutInconsistencyDetector detector;
    private final ForensicsConfig.Visualization visualization;

    public TextLayoutAnalyzer(ForensicsConfig config, OcrEngine ocrEngine) {
        this.ocrEngine = ocrEngine;
        this.visualization = config.getVisualization();
        this.options = OcrOptions.from(config.getOcr());
        this.detector = new LayoutInconsistencyDetector(config.getLayout());
    }

    @Override
    public SignalName getSignal() {
        return SignalName.OCR;
    }

    @Override
    public SignalResult analyze(AnalysisInput input) {
        try {
            BufferedImage image = input != null ? input.getImage() : null;
            if (image == null) {
                throw new IllegalArgumentException("Could not read image: "
                    + (input != null ? input.getImagePath() : null));
            }
            BufferedImage prepared = OcrPreprocessor.prepare(image);
            List<OcrWord> words = ocrEngine.detect(prepared, options);

            List<TextRegion> regions = detector.filter(words);
            List<Finding> findings = detector.detect(regions);
            double overall = LayoutInconsistencyDetector.calculateConfidence(findings, regions.size());

            log.debug("OCR: слов {}, областей после фильтрации {}, находок {}",
                words != null ? words.size() : 0, regions.size(), findings.size());

            SignalResult result = SignalResult.builder()
                .signal(SignalName.OCR)
                .overallConfidence(overall)
                .findings(findings)
                .summary(LayoutInconsistencyDetector.summarize(findings, overall))
                .detail("text_blocks_found", regions.size())
                .detail("total_characters", regions.stream().mapToInt(r -> r.getText().length()).sum())
                .build();
            if (visualization != null && visualization.isEnabled()) {
                result = withOverlay(result, input.getDocumentId(), image, regions);
            }
            return result;
        } catch (Exception e) {
            log.warn("OCR анализ не выполнен: {}", e.getMessage());
            log.debug("Детали ошибки OCR", e);
            return SignalResult.failed(SignalName.OCR, e.getMessage());
        }
    }

    /**
     * Сохранить рамки текстовых областей поверх исходного изображения и добавить путь в details
     */
    private SignalResult withOverlay(SignalResult result, String documentId, BufferedImage image,
                                     List<TextRegion> regions) {
        List<Overlays.Box> boxes = regions.stream()
            .map(r -> new Overlays.Box(r.getBbox(), r.getConfidence(), r.preview(LABEL_LENGTH)))
            .collect(Collectors.toList());
        Mat original = null;
        Mat overlay = null;
        try {
            original = RasterOps.toBgr(image);
            overlay = Overlays.textRegions(original, boxes);
            Path target = Paths.get(visualization.getOutputDir())
                .resolve(Overlays.fileName(documentId, OVERLAY_SUFFIX));
            Overlays.writePng(overlay, target);
            log.debug("Разметка OCR сохранена: {}", target);
            return result.toBuilder().detail("overlay_path", target.toString()).build();
        } catch (Exception e) {
            log.warn("Не удалось сохранить разметку OCR: {}", e.getMessage());
            return result;
        } finally {
            if (original != null) {
                original.release();
            }
            if (overlay != null) {
                overlay.release();
            }
        }
    }
}
