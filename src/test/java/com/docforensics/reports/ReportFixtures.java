package com.docforensics.reports;

import com.docforensics.heuristics.RecommendationEngine;
import com.docforensics.models.BoundingBox;
import com.docforensics.models.Finding;
import com.docforensics.models.FusionResult;
import com.docforensics.models.SignalName;
import com.docforensics.models.SignalResult;
import com.docforensics.models.SignalStatus;
import com.docforensics.models.Verdict;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class ReportFixtures {

    private ReportFixtures() {
    }

    static FusionResult suspicious() {
        Finding region = Finding.builder()
            .kind("compression_artifact")
            .source(SignalName.ELA)
            .confidence(78.43)
            .description("Editing artifacts detected (confidence: 78.43%)")
            .bbox(BoundingBox.of(40, 10, 20, 20))
            .detail("area", 400)
            .build();
        Finding date = Finding.builder()
            .kind("date_anomaly")
            .source(SignalName.METADATA)
            .confidence(85)
            .description("EXIF DateTime is after file modification time")
            .build();

        Map<SignalName, SignalResult> perSignal = new EnumMap<>(SignalName.class);
        perSignal.put(SignalName.ELA, SignalResult.builder().signal(SignalName.ELA)
            .overallConfidence(8.0).finding(region).summary("1 potential tampering regions detected.").build());
        perSignal.put(SignalName.OCR, SignalResult.degraded(SignalName.OCR, SignalStatus.TIMEOUT, "OCR analysis timeout"));
        perSignal.put(SignalName.METADATA, SignalResult.builder().signal(SignalName.METADATA)
            .overallConfidence(64.6).finding(date).summary("Date anomaly detected.").build());

        Set<String> recommendations = new LinkedHashSet<>(List.of(
            "Review highlighted regions carefully", "Date anomalies: Verify creation and modification dates"));

        return FusionResult.builder()
            .documentId("invoice-42")
            .overallConfidence(22.58)
            .uncertainty(77.42)
            .verdict(Verdict.SLIGHTLY_SUSPICIOUS)
            .perSignal(perSignal)
            .combinedFindings(List.of(date, region))
            .recommendations(recommendations)
            .errors(List.of("OCR analysis timeout"))
            .processingTimeSeconds(1.23456)
            .analyzedAt(LocalDateTime.of(2024, 3, 5, 14, 7, 9))
            .build();
    }

    static FusionResult failed() {
        Map<SignalName, SignalResult> perSignal = new EnumMap<>(SignalName.class);
        for (SignalName name : SignalName.values()) {
            perSignal.put(name, SignalResult.failed(name, "Could not read image: x.png"));
        }
        return FusionResult.builder()
            .documentId("broken")
            .overallConfidence(0)
            .uncertainty(100)
            .verdict(Verdict.PROCESSING_ERROR)
            .perSignal(perSignal)
            .combinedFindings(List.of())
            .recommendations(Set.of(RecommendationEngine.PROCESSING_FAILED))
            .errors(List.of("Could not read image: x.png"))
            .processingTimeSeconds(0.01)
            .analyzedAt(LocalDateTime.of(2024, 3, 5, 14, 7, 9))
            .build();
    }
}
