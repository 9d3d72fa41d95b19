package com.docforensics.reports;

import com.docforensics.models.Finding;
import com.docforensics.models.FusionResult;
import com.docforensics.models.SignalName;
import com.docforensics.models.SignalResult;
import com.docforensics.models.Verdict;
import com.itextpdf.kernel.colors.DeviceRgb;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.layout.Document;
import com.itextpdf.layout.element.Cell;
import com.itextpdf.layout.element.List;
import com.itextpdf.layout.element.Paragraph;
import com.itextpdf.layout.element.Table;
import com.itextpdf.layout.element.Text;
import com.itextpdf.layout.properties.TextAlignment;
import com.itextpdf.layout.properties.UnitValue;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Генератор PDF отчета: итоговая оценка, таблица сигналов, главные находки, рекомендации
 */
@Slf4j
public class PdfReportGenerator implements ReportGenerator {

    private final ForensicReportFormatter formatter;

    public PdfReportGenerator(ForensicReportFormatter formatter) {
        this.formatter = formatter;
    }

    @Override
    public void generate(FusionResult result, Path outputPath) throws IOException {
        log.info("Генерация PDF отчета: {}", outputPath);

        // КРИТИЧНО: Защита от NPE
        if (result == null) {
            throw new IllegalArgumentException("FusionResult не может быть null");
        }
        ForensicReport.Body report = formatter.format(result).getDocumentForensicsReport();

        try {
            PdfWriter writer = new PdfWriter(outputPath.toString());
            PdfDocument pdf = new PdfDocument(writer);
            Document document = new Document(pdf);

            addTitle(document, report);
            addOverallAssessment(document, result, report);
            addSignalTable(document, result);
            addTopFindings(document, result);
            addRecommendations(document, report);

            document.close();
            log.info("PDF отчет сохранен: {}", outputPath);
        } catch (Exception e) {
            throw new IOException("Ошибка генерации PDF: " + e.getMessage(), e);
        }
    }

    private void addTitle(Document document, ForensicReport.Body report) {
        document.add(new Paragraph("Document Forensics Report")
            .setFontSize(24)
            .setBold()
            .setTextAlignment(TextAlignment.CENTER));

        ForensicReport.Metadata metadata = report.getMetadata();
        document.add(new Paragraph("Document: " + metadata.getDocumentId())
            .setFontSize(14)
            .setTextAlignment(TextAlignment.CENTER));
        document.add(new Paragraph("Generated: " + metadata.getGeneratedAt()
                + "  |  Analysis version " + metadata.getAnalysisVersion())
            .setFontSize(10)
            .setTextAlignment(TextAlignment.CENTER)
            .setMarginBottom(20));
    }

    private void addOverallAssessment(Document document, FusionResult result, ForensicReport.Body report) {
        document.add(sectionHeader("Overall Assessment"));

        ForensicReport.OverallAssessment assessment = report.getOverallAssessment();
        document.add(new Paragraph(assessment.getVerdict())
            .setFontSize(28)
            .setBold()
            .setFontColor(verdictColor(result.getVerdict()))
            .setTextAlignment(TextAlignment.CENTER));

        Table table = new Table(UnitValue.createPercentArray(new float[]{1, 1}));
        table.setWidth(UnitValue.createPercentValue(100));
        table.addCell(createCell("Confidence", percent(assessment.getConfidence())));
        table.addCell(createCell("Uncertainty", percent(assessment.getUncertainty())));
        table.addCell(createCell("Processing time", assessment.getProcessingTime() + " s"));
        table.addCell(createCell("Findings", String.valueOf(result.getCombinedFindings().size())));
        document.add(table);

        if (result.hasErrors()) {
            Paragraph errors = new Paragraph().add(new Text("Degraded signals: ").setBold());
            errors.add(String.join("; ", result.getErrors()));
            document.add(errors.setMarginTop(10));
        }
    }

    private void addSignalTable(Document document, FusionResult result) {
        document.add(sectionHeader("Signal Analysis"));

        Table table = new Table(UnitValue.createPercentArray(new float[]{2, 1, 1, 1, 4}));
        table.setWidth(UnitValue.createPercentValue(100));
        for (String header : new String[]{"Signal", "Confidence", "Findings", "Status", "Summary"}) {
            table.addHeaderCell(new Cell().add(new Paragraph(header).setBold()).setPadding(5));
        }
        for (SignalName name : SignalName.values()) {
            SignalResult signal = result.getSignal(name);
            if (signal == null) {
                continue;
            }
            table.addCell(plainCell(name.getDisplayName()));
            table.addCell(plainCell(percent(signal.getOverallConfidence())));
            table.addCell(plainCell(String.valueOf(signal.getFindingsCount())));
            table.addCell(plainCell(signal.getStatus().getValue()));
            table.addCell(plainCell(signal.getSummary() != null ? signal.getSummary() : ""));
        }
        document.add(table);
    }

    private void addTopFindings(Document document, FusionResult result) {
        document.add(sectionHeader("Top Findings"));

        if (result.getCombinedFindings().isEmpty()) {
            document.add(new Paragraph("No findings").setMarginBottom(10));
            return;
        }
        for (Finding finding : result.getCombinedFindings()) {
            Paragraph paragraph = new Paragraph()
                .add(new Text(percent(finding.getConfidence()))
                    .setFontColor(findingColor(finding.getConfidence()))
                    .setBold())
                .add(" [" + finding.getSource().getLabel() + "] " + finding.getKind() + "\n")
                .add(finding.getDescription() != null ? finding.getDescription() : "");
            if (finding.hasBoundingBox()) {
                paragraph.add("\n").add(new Text("Region: ").setBold()).add(finding.getBbox().toList().toString());
            }
            document.add(paragraph.setMarginBottom(8));
        }
    }

    private void addRecommendations(Document document, ForensicReport.Body report) {
        document.add(sectionHeader("Recommendations"));

        List list = new List()
            .setSymbolIndent(12)
            .setMarginLeft(20);
        report.getRecommendations().forEach(list::add);
        document.add(list);
    }

    private static Paragraph sectionHeader(String text) {
        return new Paragraph(text)
            .setFontSize(18)
            .setBold()
            .setMarginTop(20);
    }

    private static DeviceRgb verdictColor(Verdict verdict) {
        return switch (verdict) {
            case HIGHLY_SUSPICIOUS, SUSPICIOUS -> new DeviceRgb(231, 76, 60);                      // красный
            case MODERATELY_SUSPICIOUS, SLIGHTLY_SUSPICIOUS, NEEDS_REVIEW -> new DeviceRgb(243, 156, 18); // оранжевый
            case LIKELY_AUTHENTIC -> new DeviceRgb(39, 174, 96);                                   // зеленый
            case PROCESSING_ERROR -> new DeviceRgb(127, 140, 141);                                 // серый
        };
    }

    private static DeviceRgb findingColor(double confidence) {
        if (confidence >= 70) {
            return new DeviceRgb(231, 76, 60);
        }
        if (confidence >= 40) {
            return new DeviceRgb(230, 126, 34);
        }
        return new DeviceRgb(127, 140, 141);
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.2f%%", value);
    }

    private Cell createCell(String label, String value) {
        Paragraph p = new Paragraph()
            .add(new Text(label + ": ").setBold())
            .add(value);
        return new Cell().add(p).setPadding(5);
    }

    private static Cell plainCell(String value) {
        return new Cell().add(new Paragraph(value).setFontSize(10)).setPadding(4);
    }

    @Override
    public String getFileExtension() {
        return "pdf";
    }
}
