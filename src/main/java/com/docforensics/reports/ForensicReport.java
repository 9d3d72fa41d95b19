package com.docforensics.reports;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Каноническая структура отчета. Имена полей и вложенность - внешний контракт.
 */
@Value
@Builder
public class ForensicReport {

    @JsonProperty("document_forensics_report")
    Body documentForensicsReport;

    @Value
    @Builder
    @JsonPropertyOrder({"metadata", "overall_assessment", "signal_analysis", "detailed_findings", "recommendations"})
    public static class Body {
        @JsonProperty("metadata")
        Metadata metadata;

        @JsonProperty("overall_assessment")
        OverallAssessment overallAssessment;

        /** Ключи ela, ocr, metadata в этом порядке */
        @JsonProperty("signal_analysis")
        Map<String, SignalSummary> signalAnalysis;

        @JsonProperty("detailed_findings")
        List<DetailedFinding> detailedFindings;

        @JsonProperty("recommendations")
        List<String> recommendations;
    }

    @Value
    @Builder
    @JsonPropertyOrder({"generated_at", "document_id", "analysis_version"})
    public static class Metadata {
        @JsonProperty("generated_at")
        String generatedAt;

        @JsonProperty("document_id")
        String documentId;

        @JsonProperty("analysis_version")
        String analysisVersion;
    }

    @Value
    @Builder
    @JsonPropertyOrder({"confidence", "uncertainty", "verdict", "processing_time"})
    public static class OverallAssessment {
        @JsonProperty("confidence")
        double confidence;

        @JsonProperty("uncertainty")
        double uncertainty;

        @JsonProperty("verdict")
        String verdict;

        @JsonProperty("processing_time")
        double processingTime;
    }

    @Value
    @Builder
    @JsonPropertyOrder({"confidence", "summary", "findings_count", "status"})
    public static class SignalSummary {
        @JsonProperty("confidence")
        double confidence;

        @JsonProperty("summary")
        String summary;

        @JsonProperty("findings_count")
        int findingsCount;

        @JsonProperty("status")
        String status;
    }

    @Value
    @Builder
    @JsonPropertyOrder({"type", "signal", "confidence", "description", "bbox", "details"})
    public static class DetailedFinding {
        @JsonProperty("type")
        String type;

        @JsonProperty("signal")
        String signal;

        @JsonProperty("confidence")
        double confidence;

        @JsonProperty("description")
        String description;

        /** [x, y, ширина, высота]; отсутствует у находок без области */
        @JsonProperty("bbox")
        @JsonInclude(JsonInclude.Include.NON_NULL)
        List<Integer> bbox;

        @JsonProperty("details")
        Map<String, Object> details;
    }
}
