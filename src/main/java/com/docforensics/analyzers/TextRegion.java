package com.docforensics.analyzers;

import com.docforensics.models.BoundingBox;
import com.docforensics.ocr.OcrWord;
import lombok.Value;

/**
 * Текстовая область после фильтрации с геометрическими признаками
 */
@Value
public class TextRegion {
    BoundingBox bbox;
    String text;
    double confidence;
    int lineId;
    int blockId;

    static TextRegion of(OcrWord word) {
        return new TextRegion(word.getBbox(), word.getText().strip(), word.getConfidence(),
            word.getLineId(), word.getBlockId());
    }

    /** Высота рамки как оценка кегля */
    public int getFontSizeEstimate() {
        return bbox.getHeight();
    }

    public double getAspectRatio() {
        return bbox.getHeight() > 0 ? (double) bbox.getWidth() / bbox.getHeight() : 0.0;
    }

    String preview(int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }
}
