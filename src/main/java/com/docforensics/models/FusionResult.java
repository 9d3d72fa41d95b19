package com.docforensics.models;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Итог анализа одного документа: слияние трех сигналов.
 * Экземпляр кэшируется и не изменяется после создания.
 */
@Value
@Builder
public class FusionResult {

    String documentId;

    /** Взвешенная уверенность в подделке 0-100 */
    double overallConfidence;

    /** Ровно 100 - overallConfidence */
    double uncertainty;

    Verdict verdict;

    /** Результаты по сигналам в порядке ELA, OCR, Metadata */
    Map<SignalName, SignalResult> perSignal;

    /** Не более 10 находок, по убыванию уверенности */
    List<Finding> combinedFindings;

    /** Не более 5 уникальных рекомендаций в порядке добавления */
    Set<String> recommendations;

    List<String> errors;

    double processingTimeSeconds;

    LocalDateTime analyzedAt;

    public SignalResult getSignal(SignalName name) {
        return perSignal.get(name);
    }

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
