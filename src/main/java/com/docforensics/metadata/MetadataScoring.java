package com.docforensics.metadata;

import com.docforensics.heuristics.ConfidenceCalculator;
import com.docforensics.models.Finding;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Итоговая уверенность и краткий вывод по аномалиям метаданных
 */
public final class MetadataScoring {

    private MetadataScoring() {
    }

    /**
     * Без аномалий: богатые метаданные снижают подозрение, их отсутствие дает 50.
     * С аномалиями: взвешенное среднее (даты x1.5, тип файла x1.3) с поправкой на количество.
     */
    public static double confidence(List<Finding> findings, int fieldCount) {
        if (findings.isEmpty()) {
            if (fieldCount > 0) {
                return ConfidenceCalculator.round2(Math.max(0, 100 - fieldCount * 0.5));
            }
            return 50.0;
        }
        double totalScore = 0;
        double weightSum = 0;
        for (Finding finding : findings) {
            double weight = weightOf(finding.getKind());
            totalScore += finding.getConfidence() * weight;
            weightSum += weight;
        }
        double average = weightSum > 0 ? totalScore / weightSum : 0;
        double countFactor = Math.min(1.0, findings.size() / 5.0);
        double score = average * (0.7 + 0.3 * countFactor);
        return ConfidenceCalculator.round2(ConfidenceCalculator.clamp(score));
    }

    static double weightOf(String kind) {
        if (kind == null) {
            return 1.0;
        }
        if (kind.contains("date")) {
            return 1.5;
        }
        if (kind.contains("mime")) {
            return 1.3;
        }
        return 1.0;
    }

    public static String summarize(List<Finding> findings, double confidence) {
        if (findings.isEmpty()) {
            if (confidence < 30) {
                return "No metadata anomalies detected. Document metadata appears authentic.";
            }
            return "Limited metadata available. Document may have been stripped of metadata.";
        }
        int total = findings.size();
        if (total >= 3) {
            return "Multiple metadata anomalies detected (" + total
                + " issues). Strong evidence of document tampering.";
        }
        if (total == 2) {
            Set<String> kinds = new LinkedHashSet<>();
            findings.forEach(f -> kinds.add(f.getKind()));
            return "Two metadata anomalies detected (" + String.join(", ", kinds)
                + "). Document likely manipulated.";
        }
        String kind = findings.get(0).getKind();
        if (kind.contains("date")) {
            return "Date anomaly detected. Document creation/modification times inconsistent.";
        }
        if (kind.contains("mime")) {
            return "File type mismatch detected. Actual file type doesn't match extension.";
        }
        if (kind.contains("software")) {
            return "Editing software signature detected. Document was created/edited with image software.";
        }
        return "Metadata anomaly detected. Document may have been altered.";
    }
}
