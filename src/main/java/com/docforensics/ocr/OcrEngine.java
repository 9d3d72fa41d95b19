package com.docforensics.ocr;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Внешний OCR движок, используется как черный ящик
 */
public interface OcrEngine {

    /**
     * Распознать слова на изображении
     *
     * @param image подготовленное (бинаризованное) изображение
     * @param options параметры распознавания
     * @return распознанные слова с рамками, уверенностью и номерами строки/блока
     * @throws OcrException если движок не смог обработать изображение
     */
    List<OcrWord> detect(BufferedImage image, OcrOptions options);
}
