package com.docforensics.metadata;

import com.itextpdf.kernel.exceptions.PdfException;
import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfString;
import com.itextpdf.kernel.pdf.annot.PdfAnnotation;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Чтение метаданных PDF через iText kernel (только чтение, документ не изменяется)
 */
@Slf4j
public class PdfMetadataExtractor {

    public PdfMetadata extract(Path path) throws IOException {
        PdfMetadata.PdfMetadataBuilder builder = PdfMetadata.builder();
        try (PdfDocument pdf = new PdfDocument(new PdfReader(path.toFile()))) {

            PdfDictionary info = pdf.getTrailer().getAsDictionary(PdfName.Info);
            if (info != null) {
                for (PdfName key : info.keySet()) {
                    builder.info(key.getValue(), asText(info.get(key)));
                }
            }

            for (int i = 1; i <= pdf.getNumberOfPages(); i++) {
                PdfPage page = pdf.getPage(i);
                Rectangle size = page.getPageSize();
                builder.pageSize(new PdfMetadata.PageSize(i, size.getWidth(), size.getHeight()));
                for (PdfAnnotation annotation : page.getAnnotations()) {
                    PdfName fieldType = annotation.getPdfObject().getAsName(PdfName.FT);
                    if (fieldType != null) {
                        builder.formFieldType(fieldType.getValue());
                    }
                }
            }
        } catch (PdfException e) {
            throw new IOException("Не удалось прочитать PDF: " + e.getMessage(), e);
        }
        PdfMetadata result = builder.build();
        log.debug("PDF {}: страниц {}, полей Info {}", path.getFileName(),
            result.getPageCount(), result.getDocumentInfo().size());
        return result;
    }

    private static String asText(PdfObject value) {
        if (value == null) {
            return "";
        }
        if (value instanceof PdfString) {
            return ((PdfString) value).toUnicodeString();
        }
        return value.toString();
    }
}
