package com.docforensics.metadata;

import com.drew.imaging.FileType;
import com.drew.imaging.FileTypeDetector;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * Определение типа файла по содержимому (сигнатуре), с откатом на расширение
 */
@Slf4j
public final class MediaTypeDetector {

    public static final String PDF = "application/pdf";
    public static final String JPEG = "image/jpeg";
    public static final String PNG = "image/png";
    public static final String UNKNOWN = "application/octet-stream";

    /** Ожидаемый тип для известных расширений */
    static final Map<String, String> EXPECTED_BY_EXTENSION = Map.of(
        ".jpg", JPEG,
        ".jpeg", JPEG,
        ".png", PNG,
        ".pdf", PDF
    );

    private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);

    private MediaTypeDetector() {
    }

    public static String detect(Path path) {
        try (InputStream raw = Files.newInputStream(path);
             BufferedInputStream in = new BufferedInputStream(raw)) {
            in.mark(PDF_MAGIC.length);
            byte[] head = in.readNBytes(PDF_MAGIC.length);
            in.reset();
            if (Arrays.equals(head, PDF_MAGIC)) {
                return PDF;
            }
            FileType type = FileTypeDetector.detectFileType(in);
            if (type != null && type != FileType.Unknown && type.getMimeType() != null) {
                return type.getMimeType();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Не удалось определить тип по содержимому {}: {}", path, e.getMessage());
        }
        return byExtension(path);
    }

    /**
     * Тип по расширению файла (для неизвестных - application/octet-stream)
     */
    public static String byExtension(Path path) {
        return EXPECTED_BY_EXTENSION.getOrDefault(extensionOf(path), UNKNOWN);
    }

    /**
     * Расширение в нижнем регистре с точкой, либо пустая строка
     */
    public static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }

    public static boolean isImage(String mediaType) {
        return mediaType != null && mediaType.startsWith("image/");
    }

    public static boolean isPdf(String mediaType) {
        return PDF.equals(mediaType);
    }
}
