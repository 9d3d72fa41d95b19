package com.docforensics.heuristics;

import com.docforensics.models.Finding;
import com.docforensics.models.SignalName;
import com.docforensics.models.SignalResult;
import com.docforensics.models.Verdict;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Рекомендации по итогам анализа: базовые по вердикту + специфичные для сигналов.
 * Порядок добавления сохраняется, дубликаты отбрасываются.
 */
public class RecommendationEngine {

    public static final String PROCESSING_FAILED =
        "Processing failed. Please try again or upload a different document.";

    public static final String HIGH_ELA = "High ELA confidence: Document shows clear editing artifacts";
    static final String MANY_TEXT_ISSUES = "Multiple text inconsistencies: Verify font and formatting";
    static final String DATE_ANOMALIES = "Date anomalies: Verify creation and modification dates";

    private static final Map<Verdict, List<String>> BASELINE = Map.of(
        Verdict.HIGHLY_SUSPICIOUS, List.of(
            "Verify document with issuing authority",
            "Cross-check dates and amounts with original records",
            "Request certified copy for comparison"),
        Verdict.SUSPICIOUS, List.of(
            "Verify document with issuing authority",
            "Cross-check dates and amounts with original records",
            "Request certified copy for comparison"),
        Verdict.MODERATELY_SUSPICIOUS, List.of(
            "Review highlighted regions carefully",
            "Check for supporting documentation",
            "Consider digital signature verification"),
        Verdict.SLIGHTLY_SUSPICIOUS, List.of(
            "Minor anomalies detected - review if critical document",
            "Check for scanning artifacts",
            "Verify metadata consistency"),
        Verdict.NEEDS_REVIEW, List.of(
            "Manual review recommended: a single signal shows strong anomalies",
            "Review highlighted regions carefully"),
        Verdict.LIKELY_AUTHENTIC, List.of(
            "Document appears authentic. No immediate action required."),
        Verdict.PROCESSING_ERROR, List.of(PROCESSING_FAILED)
    );

    private final int maxRecommendations;
    private final double highElaThreshold;

    public RecommendationEngine(int maxRecommendations, double highElaThreshold) {
        this.maxRecommendations = maxRecommendations;
        this.highElaThreshold = highElaThreshold;
    }

    public Set<String> generate(Verdict verdict, Map<SignalName, SignalResult> perSignal) {
        Set<String> recommendations = new LinkedHashSet<>(BASELINE.getOrDefault(verdict, List.of()));

        SignalResult ela = completed(perSignal, SignalName.ELA);
        if (ela != null && ela.getOverallConfidence() > highElaThreshold) {
            recommendations.add(HIGH_ELA);
        }

        SignalResult ocr = completed(perSignal, SignalName.OCR);
        if (ocr != null && ocr.getFindingsCount() >= 3) {
            recommendations.add(MANY_TEXT_ISSUES);
        }

        SignalResult metadata = completed(perSignal, SignalName.METADATA);
        if (metadata != null && hasDateFinding(metadata.getFindings())) {
            recommendations.add(DATE_ANOMALIES);
        }

        return cap(recommendations);
    }

    private Set<String> cap(Set<String> recommendations) {
        Set<String> capped = new LinkedHashSet<>();
        for (String recommendation : recommendations) {
            if (capped.size() >= maxRecommendations) {
                break;
            }
            capped.add(recommendation);
        }
        return Collections.unmodifiableSet(capped);
    }

    private static boolean hasDateFinding(List<Finding> findings) {
        return findings.stream().anyMatch(f -> f.getKind() != null && f.getKind().contains("date"));
    }

    private static SignalResult completed(Map<SignalName, SignalResult> perSignal, SignalName name) {
        SignalResult result = perSignal.get(name);
        return result != null && result.isCompleted() ? result : null;
    }
}
