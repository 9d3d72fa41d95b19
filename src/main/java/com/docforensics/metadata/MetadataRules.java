package com.docforensics.metadata;

import com.docforensics.config.ForensicsConfig;
import com.docforensics.heuristics.ConfidenceCalculator;
import com.docforensics.models.Finding;
import com.docforensics.models.SignalName;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Правила аномалий метаданных: общие для всех типов, для изображений и для PDF.
 * Правила не читают файлы сами, работают по уже извлеченным данным.
 */
public class MetadataRules {

    static final String MIME_MISMATCH = "mime_mismatch";
    static final String SUSPICIOUS_FILE_SIZE = "suspicious_file_size";
    static final String MISSING_EXIF = "missing_exif";
    static final String DATE_ANOMALY = "date_anomaly";
    static final String DATE_FORMAT_ERROR = "date_format_error";
    static final String EDITING_SOFTWARE = "editing_software";
    static final String UNEXPECTED_GPS = "unexpected_gps";
    static final String COMPRESSION_ANOMALY = "compression_anomaly";
    static final String PDF_MODIFIED = "pdf_modified";
    static final String FORM_FIELDS = "form_fields";
    static final String INCONSISTENT_PAGE_SIZES = "inconsistent_page_sizes";
    static final String EXTRACTION_ERROR = "metadata_extraction_error";

    static final DateTimeFormatter EXIF_DATE_TIME =
        DateTimeFormatter.ofPattern("uuuu:MM:dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

    private final ForensicsConfig.Metadata settings;

    public MetadataRules(ForensicsConfig.Metadata settings) {
        this.settings = settings;
    }

    /**
     * Правила для любого типа: расширение против фактического типа, размер файла изображения
     *
     * @param image метаданные изображения, null если файл не изображение или их не удалось извлечь
     */
    public List<Finding> crossTypeRules(Path path, String mediaType, long fileSize, ImageMetadata image) {
        List<Finding> findings = new ArrayList<>();

        String extension = MediaTypeDetector.extensionOf(path);
        String expected = MediaTypeDetector.EXPECTED_BY_EXTENSION.get(extension);
        if (expected != null && !expected.equals(mediaType)) {
            findings.add(finding(MIME_MISMATCH, 80,
                "File extension (" + extension + ") doesn't match actual type (" + mediaType + ")")
                .detail("extension", extension)
                .detail("expected_mime", expected)
                .detail("actual_mime", mediaType)
                .build());
        }

        if (MediaTypeDetector.isImage(mediaType) && image != null && image.getPixelCount() > 0) {
            double minimumSize = image.getPixelCount() * settings.getMinFileSizeRatio();
            if (fileSize < minimumSize) {
                findings.add(finding(SUSPICIOUS_FILE_SIZE, 65, String.format(Locale.ROOT,
                    "Image file size (%,d bytes) suspiciously small for %dx%d resolution",
                    fileSize, image.getWidth(), image.getHeight()))
                    .detail("file_size", fileSize)
                    .detail("dimensions", image.getWidth() + "x" + image.getHeight())
                    .detail("expected_min_size", (long) minimumSize)
                    .build());
            }
        }
        return findings;
    }

    public List<Finding> imageRules(ImageMetadata image, Path path, long fileSize, LocalDateTime fileModified) {
        List<Finding> findings = new ArrayList<>();

        List<String> missing = new ArrayList<>();
        addIfMissing(missing, "DateTime", image.getDateTime());
        addIfMissing(missing, "Make", image.getMake());
        addIfMissing(missing, "Model", image.getModel());
        addIfMissing(missing, "Software", image.getSoftware());
        if (missing.size() >= 2) {
            findings.add(finding(MISSING_EXIF, 60,
                "Missing essential EXIF tags: " + String.join(", ", missing))
                .detail("missing_tags", missing)
                .build());
        }

        String dateTime = image.getDateTime();
        if (dateTime != null) {
            checkExifDate(dateTime.trim(), fileModified, findings);
        }

        String software = image.getSoftware();
        if (software != null) {
            String lower = software.toLowerCase(Locale.ROOT);
            boolean editor = settings.getEditorSoftware().stream()
                .anyMatch(name -> lower.contains(name.toLowerCase(Locale.ROOT)));
            if (editor) {
                findings.add(finding(EDITING_SOFTWARE, 70, "Document created/edited with: " + software)
                    .detail("software", software)
                    .build());
            }
        }

        if (image.hasGps()) {
            String fileName = path.getFileName() != null
                ? path.getFileName().toString().toLowerCase(Locale.ROOT) : "";
            boolean geographic = settings.getGeographicHints().stream()
                .anyMatch(hint -> fileName.contains(hint.toLowerCase(Locale.ROOT)));
            if (!geographic) {
                findings.add(finding(UNEXPECTED_GPS, 55, "GPS data found in non-geographic document")
                    .detail("gps_tags_found", image.getGpsTags())
                    .build());
            }
        }

        if (image.getPixelCount() > 0) {
            double bytesPerPixel = (double) fileSize / image.getPixelCount();
            if (bytesPerPixel < settings.getMinBytesPerPixel()) {
                findings.add(finding(COMPRESSION_ANOMALY, 65, String.format(Locale.ROOT,
                    "Unusually high compression (%.4f bytes/pixel)", bytesPerPixel))
                    .detail("file_size_bytes", fileSize)
                    .detail("dimensions", image.getWidth() + "x" + image.getHeight())
                    .detail("bytes_per_pixel", bytesPerPixel)
                    .build());
            }
        }
        return findings;
    }

    private void checkExifDate(String dateTime, LocalDateTime fileModified, List<Finding> findings) {
        LocalDateTime exifDate;
        try {
            exifDate = LocalDateTime.parse(dateTime, EXIF_DATE_TIME);
        } catch (DateTimeParseException e) {
            // Некорректный формат даты сам по себе признак правки EXIF
            findings.add(finding(DATE_FORMAT_ERROR, 50,
                "Invalid or tampered EXIF DateTime format: " + dateTime)
                .detail("error", e.getMessage())
                .build());
            return;
        }
        if (fileModified != null && exifDate.isAfter(fileModified)) {
            double hours = Duration.between(fileModified, exifDate).toSeconds() / 3600.0;
            findings.add(finding(DATE_ANOMALY, 85,
                "EXIF DateTime (" + exifDate + ") is after file modification time (" + fileModified + ")")
                .detail("exif_date", exifDate.toString())
                .detail("file_mtime", fileModified.toString())
                .detail("difference_hours", ConfidenceCalculator.round2(hours))
                .build());
        }
    }

    public List<Finding> pdfRules(PdfMetadata pdf) {
        List<Finding> findings = new ArrayList<>();

        String created = pdf.getCreationDate();
        String modified = pdf.getModDate();
        if (isPresent(created) && isPresent(modified) && !created.equals(modified)) {
            findings.add(finding(PDF_MODIFIED, 75, "PDF has been modified since creation")
                .detail("creation_date", created)
                .detail("modification_date", modified)
                .build());
        }

        if (!pdf.getFormFieldTypes().isEmpty()) {
            Set<String> types = new LinkedHashSet<>(pdf.getFormFieldTypes());
            findings.add(finding(FORM_FIELDS, 60,
                "PDF contains " + pdf.getFormFieldTypes().size() + " form field(s) - could be editable")
                .detail("field_types", List.copyOf(types))
                .build());
        }

        List<PdfMetadata.PageSize> pages = pdf.getPageSizes();
        if (pages.size() > 1) {
            PdfMetadata.PageSize first = pages.get(0);
            List<Integer> inconsistent = new ArrayList<>();
            for (PdfMetadata.PageSize page : pages.subList(1, pages.size())) {
                if (!page.sameAs(first)) {
                    inconsistent.add(page.getPage());
                }
            }
            if (!inconsistent.isEmpty()) {
                findings.add(finding(INCONSISTENT_PAGE_SIZES, 70,
                    "Inconsistent page sizes on pages: " + inconsistent)
                    .detail("expected_size", List.of(first.getWidth(), first.getHeight()))
                    .detail("inconsistent_pages", inconsistent)
                    .build());
            }
        }
        return findings;
    }

    /**
     * Ошибка извлечения метаданных конкретного типа не роняет сигнал, а становится находкой
     */
    public Finding extractionError(String fileType, Exception error) {
        return finding(EXTRACTION_ERROR, 30,
            fileType + " metadata extraction failed: " + error.getMessage())
            .detail("file_type", fileType)
            .build();
    }

    private static Finding.FindingBuilder finding(String kind, double confidence, String description) {
        return Finding.builder()
            .kind(kind)
            .source(SignalName.METADATA)
            .confidence(confidence)
            .description(description);
    }

    private static void addIfMissing(List<String> missing, String tag, String value) {
        if (!isPresent(value)) {
            missing.add(tag);
        }
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
