package com.docforensics.analyzers;

import lombok.Builder;
import lombok.Value;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Входные данные анализаторов для одного документа.
 * Общий декодированный растр только читается анализаторами.
 */
@Value
@Builder
public class AnalysisInput {
    String documentId;

    /** Путь к растровому изображению (PDF уже растеризован вызывающей стороной) */
    Path imagePath;

    /** Исходный загруженный файл; если не задан, совпадает с imagePath */
    Path sourcePath;

    BufferedImage image;

    public Path getMetadataPath() {
        return sourcePath != null ? sourcePath : imagePath;
    }
}
