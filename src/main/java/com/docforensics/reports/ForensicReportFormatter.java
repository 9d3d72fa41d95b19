package com.docforensics.reports;

import com.docforensics.config.ForensicsConfig;
import com.docforensics.heuristics.ConfidenceCalculator;
import com.docforensics.models.Finding;
import com.docforensics.models.FusionResult;
import com.docforensics.models.SignalName;
import com.docforensics.models.SignalResult;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Преобразование результата слияния в каноническую структуру отчета
 */
public class ForensicReportFormatter {

    public static final DateTimeFormatter GENERATED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String analysisVersion;

    public ForensicReportFormatter(ForensicsConfig.Report config) {
        this(config.getAnalysisVersion());
    }

    public ForensicReportFormatter(String analysisVersion) {
        this.analysisVersion = analysisVersion;
    }

    public ForensicReport format(FusionResult result) {
        if (result == null) {
            throw new IllegalArgumentException("FusionResult не может быть null");
        }
        LocalDateTime generatedAt = result.getAnalyzedAt() != null ? result.getAnalyzedAt() : LocalDateTime.now();

        ForensicReport.Body body = ForensicReport.Body.builder()
            .metadata(ForensicReport.Metadata.builder()
                .generatedAt(generatedAt.format(GENERATED_AT_FORMAT))
                .documentId(result.getDocumentId())
                .analysisVersion(analysisVersion)
                .build())
            .overallAssessment(ForensicReport.OverallAssessment.builder()
                .confidence(ConfidenceCalculator.round2(result.getOverallConfidence()))
                .uncertainty(ConfidenceCalculator.round2(result.getUncertainty()))
                .verdict(result.getVerdict().name())
                .processingTime(ConfidenceCalculator.round2(result.getProcessingTimeSeconds()))
                .build())
            .signalAnalysis(signalAnalysis(result))
            .detailedFindings(detailedFindings(result.getCombinedFindings()))
            .recommendations(new ArrayList<>(result.getRecommendations()))
            .build();

        return ForensicReport.builder().documentForensicsReport(body).build();
    }

    private static Map<String, ForensicReport.SignalSummary> signalAnalysis(FusionResult result) {
        Map<String, ForensicReport.SignalSummary> signals = new LinkedHashMap<>();
        for (SignalName name : SignalName.values()) {
            SignalResult signal = result.getSignal(name);
            if (signal == null) {
                continue;
            }
            signals.put(name.getKey(), ForensicReport.SignalSummary.builder()
                .confidence(ConfidenceCalculator.round2(signal.getOverallConfidence()))
                .summary(signal.getSummary())
                .findingsCount(signal.getFindingsCount())
                .status(signal.getStatus().getValue())
                .build());
        }
        return signals;
    }

    private static List<ForensicReport.DetailedFinding> detailedFindings(List<Finding> findings) {
        List<ForensicReport.DetailedFinding> detailed = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            detailed.add(ForensicReport.DetailedFinding.builder()
                .type(finding.getKind())
                .signal(finding.getSource().getKey())
                .confidence(finding.getConfidence())
                .description(finding.getDescription())
                .bbox(finding.hasBoundingBox() ? finding.getBbox().toList() : null)
                .details(finding.getDetails())
                .build());
        }
        return detailed;
    }
}
