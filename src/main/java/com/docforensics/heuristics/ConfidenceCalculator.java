package com.docforensics.heuristics;

import com.docforensics.config.ForensicsConfig;
import com.docforensics.models.SignalName;
import com.docforensics.models.SignalResult;
import com.docforensics.models.Verdict;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Калькулятор итоговой уверенности в подделке (0-100) и вердикта.
 * Взвешенное слияние сигналов + лестница порогов.
 */
@Slf4j
public class ConfidenceCalculator {

    private final ForensicsConfig.Weights weights;
    private final ForensicsConfig.VerdictThresholds thresholds;
    private final double needsReviewThreshold;

    public ConfidenceCalculator(ForensicsConfig.Fusion fusion) {
        this.weights = fusion.getWeights();
        this.thresholds = fusion.getVerdictThresholds();
        this.needsReviewThreshold = fusion.getNeedsReviewSignalThreshold();
    }

    /**
     * Ограничить значение диапазоном 0-100
     */
    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.min(100.0, Math.max(0.0, value));
    }

    /**
     * Округление до 2 знаков (половина вверх)
     */
    public static double round2(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Взвешенная уверенность по трем сигналам.
     * Отсутствующий или деградированный сигнал дает 0.
     */
    public double fuse(Map<SignalName, SignalResult> perSignal) {
        double score = weights.getEla() * confidenceOf(perSignal, SignalName.ELA)
            + weights.getOcr() * confidenceOf(perSignal, SignalName.OCR)
            + weights.getMetadata() * confidenceOf(perSignal, SignalName.METADATA);
        return round2(clamp(score));
    }

    /**
     * Неопределенность = 100 - уверенность
     */
    public static double uncertainty(double overallConfidence) {
        return round2(100.0 - overallConfidence);
    }

    /**
     * Вердикт по лестнице порогов.
     * Ниже нижнего порога - NEEDS_REVIEW, если хотя бы один сигнал сам по себе превысил 70.
     * Если ни один сигнал не завершился - PROCESSING_ERROR.
     */
    public Verdict determineVerdict(double overallConfidence, Map<SignalName, SignalResult> perSignal) {
        boolean anyCompleted = perSignal.values().stream().anyMatch(SignalResult::isCompleted);
        if (!anyCompleted) {
            return Verdict.PROCESSING_ERROR;
        }
        if (overallConfidence >= thresholds.getHighlySuspicious()) {
            return Verdict.HIGHLY_SUSPICIOUS;
        }
        if (overallConfidence >= thresholds.getSuspicious()) {
            return Verdict.SUSPICIOUS;
        }
        if (overallConfidence >= thresholds.getModeratelySuspicious()) {
            return Verdict.MODERATELY_SUSPICIOUS;
        }
        if (overallConfidence >= thresholds.getSlightlySuspicious()) {
            return Verdict.SLIGHTLY_SUSPICIOUS;
        }
        // КРИТИЧНО: один сильный сигнал не должен растворяться в двух спокойных
        for (SignalResult result : perSignal.values()) {
            if (exceedsReviewThreshold(result)) {
                log.debug("Сигнал {} превысил порог {} при низкой общей уверенности {}",
                    result.getSignal(), needsReviewThreshold, overallConfidence);
                return Verdict.NEEDS_REVIEW;
            }
        }
        return Verdict.LIKELY_AUTHENTIC;
    }

    private boolean exceedsReviewThreshold(SignalResult result) {
        if (!result.isCompleted()) {
            return false;
        }
        return result.getOverallConfidence() > needsReviewThreshold
            || result.getMaxFindingConfidence() > needsReviewThreshold;
    }

    private static double confidenceOf(Map<SignalName, SignalResult> perSignal, SignalName name) {
        SignalResult result = perSignal.get(name);
        if (result == null || !result.isCompleted()) {
            return 0.0;
        }
        return clamp(result.getOverallConfidence());
    }
}
