package com.docforensics.ocr;

import com.docforensics.models.BoundingBox;
import lombok.Value;

/**
 * Слово, распознанное OCR движком
 */
@Value
public class OcrWord {
    BoundingBox bbox;
    String text;
    /** Уверенность распознавания 0-100 */
    double confidence;
    int lineId;
    int blockId;
}
