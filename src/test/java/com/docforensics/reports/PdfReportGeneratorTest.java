package com.docforensics.reports;

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PdfReportGeneratorTest {

    @TempDir
    Path tempDir;

    private final PdfReportGenerator generator = new PdfReportGenerator(new ForensicReportFormatter("1.0"));

    @Test
    void writesReadablePdf() throws Exception {
        Path output = tempDir.resolve("report.pdf");

        generator.generate(ReportFixtures.suspicious(), output);

        byte[] bytes = Files.readAllBytes(output);
        assertTrue(bytes.length > 0);
        assertEquals("%PDF", new String(bytes, 0, 4, StandardCharsets.US_ASCII));
        PdfDocument pdf = new PdfDocument(new PdfReader(output.toString()));
        try {
            assertTrue(pdf.getNumberOfPages() >= 1);
        } finally {
            pdf.close();
        }
    }

    @Test
    void processingErrorReportIsGenerated() throws Exception {
        Path output = tempDir.resolve("broken.pdf");

        generator.generate(ReportFixtures.failed(), output);

        assertTrue(Files.size(output) > 0);
        assertEquals("pdf", generator.getFileExtension());
    }

    @Test
    void unwritableTargetIsIoError() {
        Path output = tempDir.resolve("no-such-dir").resolve("report.pdf");

        assertThrows(java.io.IOException.class, () -> generator.generate(ReportFixtures.suspicious(), output));
    }
}
