package com.docforensics.analyzers;

import com.docforensics.config.ForensicsConfig;
import com.docforensics.metadata.FileHasher;
import com.docforensics.metadata.ImageMetadata;
import com.docforensics.metadata.ImageMetadataExtractor;
import com.docforensics.metadata.MediaTypeDetector;
import com.docforensics.metadata.MetadataRules;
import com.docforensics.metadata.MetadataScoring;
import com.docforensics.metadata.PdfMetadata;
import com.docforensics.metadata.PdfMetadataExtractor;
import com.docforensics.models.Finding;
import com.docforensics.models.SignalName;
import com.docforensics.models.SignalResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Анализ метаданных исходного файла: EXIF для изображений, словарь Info и страницы для PDF.
 * Работает по исходному загруженному файлу, а не по растру.
 */
@Slf4j
public class MetadataAnomalyAnalyzer implements ForensicAnalyzer {

    private final MetadataRules rules;
    private final ImageMetadataExtractor imageExtractor;
    private final PdfMetadataExtractor pdfExtractor;

    public MetadataAnomalyAnalyzer(ForensicsConfig config) {
        this(config, new ImageMetadataExtractor(), new PdfMetadataExtractor());
    }

    MetadataAnomalyAnalyzer(ForensicsConfig config, ImageMetadataExtractor imageExtractor,
                            PdfMetadataExtractor pdfExtractor) {
        this.rules = new MetadataRules(config.getMetadata());
        this.imageExtractor = imageExtractor;
        this.pdfExtractor = pdfExtractor;
    }

    @Override
    public SignalName getSignal() {
        return SignalName.METADATA;
    }

    @Override
    public SignalResult analyze(AnalysisInput input) {
        try {
            Path path = input != null ? input.getMetadataPath() : null;
            if (path == null || !Files.isRegularFile(path)) {
                throw new NoSuchFileException(String.valueOf(path));
            }
            return analyzeFile(path);
        } catch (Exception e) {
            log.warn("Анализ метаданных не выполнен: {}", e.getMessage());
            log.debug("Детали ошибки метаданных", e);
            return SignalResult.failed(SignalName.METADATA, e.getMessage());
        }
    }

    private SignalResult analyzeFile(Path path) throws IOException {
        long fileSize = Files.size(path);
        LocalDateTime modified = LocalDateTime.ofInstant(
            Files.getLastModifiedTime(path).toInstant(), ZoneId.systemDefault());
        String mediaType = MediaTypeDetector.detect(path);

        List<Finding> findings = new ArrayList<>();
        Map<String, Object> fields = new LinkedHashMap<>();
        int fieldCount = 0;
        ImageMetadata image = null;

        if (MediaTypeDetector.isImage(mediaType)) {
            try {
                image = imageExtractor.extract(path);
                findings.addAll(rules.imageRules(image, path, fileSize, modified));
                fields.putAll(image.toFieldMap());
                fieldCount = image.getFieldCount();
            } catch (IOException | RuntimeException e) {
                log.warn("Не удалось извлечь метаданные изображения {}: {}", path.getFileName(), e.getMessage());
                findings.add(rules.extractionError("image", e));
            }
        } else if (MediaTypeDetector.isPdf(mediaType)) {
            try {
                PdfMetadata pdf = pdfExtractor.extract(path);
                findings.addAll(rules.pdfRules(pdf));
                fields.putAll(pdf.toFieldMap());
                fieldCount = pdf.getFieldCount();
            } catch (IOException | RuntimeException e) {
                log.warn("Не удалось извлечь метаданные PDF {}: {}", path.getFileName(), e.getMessage());
                findings.add(rules.extractionError("pdf", e));
            }
        } else {
            log.debug("Тип {} не поддерживает подробный анализ метаданных", mediaType);
        }

        findings.addAll(rules.crossTypeRules(path, mediaType, fileSize, image));

        double overall = MetadataScoring.confidence(findings, fieldCount);
        log.debug("Метаданные {}: тип {}, полей {}, аномалий {}",
            path.getFileName(), mediaType, fieldCount, findings.size());

        return SignalResult.builder()
            .signal(SignalName.METADATA)
            .overallConfidence(overall)
            .findings(findings)
            .summary(MetadataScoring.summarize(findings, overall))
            .detail("file_hash", FileHasher.sha256(path))
            .detail("hash_algorithm", FileHasher.ALGORITHM)
            .detail("media_type", mediaType)
            .detail("file_size", fileSize)
            .detail("metadata_field_count", fieldCount)
            .detail("metadata_extracted", fields)
            .build();
    }
}
