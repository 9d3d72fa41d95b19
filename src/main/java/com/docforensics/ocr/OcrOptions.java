package com.docforensics.ocr;

import com.docforensics.config.ForensicsConfig;
import lombok.Builder;
import lombok.Value;

/**
 * Параметры OCR: режим сегментации страницы, режим движка, язык
 */
@Value
@Builder
public class OcrOptions {
    @Builder.Default
    int pageSegmentationMode = 6;
    @Builder.Default
    int ocrEngineMode = 3;
    @Builder.Default
    String language = "eng";

    public static OcrOptions from(ForensicsConfig.Ocr config) {
        return OcrOptions.builder()
            .pageSegmentationMode(config.getPageSegmentationMode())
            .ocrEngineMode(config.getOcrEngineMode())
            .language(config.getLanguage())
            .build();
    }
}
