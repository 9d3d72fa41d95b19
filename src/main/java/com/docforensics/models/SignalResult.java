package com.docforensics.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Результат одного анализатора.
 * Для статусов timeout/error уверенность всегда 0 и список находок пуст.
 */
@Value
@Builder(toBuilder = true)
public class SignalResult {

    SignalName signal;

    @Builder.Default
    SignalStatus status = SignalStatus.COMPLETED;

    /** Уверенность в подделке 0-100 */
    double overallConfidence;

    @Singular
    List<Finding> findings;

    String summary;

    /** Текст ошибки для статусов timeout/error */
    String error;

    /** Служебные данные анализатора (хеш файла, счетчики, извлеченные поля) */
    @Singular
    Map<String, Object> details;

    public boolean isCompleted() {
        return status == SignalStatus.COMPLETED;
    }

    public int getFindingsCount() {
        return findings.size();
    }

    /**
     * Максимальная уверенность среди собственных находок (0 если находок нет)
     */
    public double getMaxFindingConfidence() {
        return findings.stream().mapToDouble(Finding::getConfidence).max().orElse(0.0);
    }

    /**
     * Деградированный результат: сигнал не отработал (ошибка или timeout)
     */
    public static SignalResult degraded(SignalName signal, SignalStatus status, String error) {
        if (status == SignalStatus.COMPLETED) {
            throw new IllegalArgumentException("Деградированный результат не может иметь статус completed");
        }
        String reason = error != null ? error : "unknown error";
        return SignalResult.builder()
            .signal(signal)
            .status(status)
            .overallConfidence(0.0)
            .summary("Analysis failed: " + reason)
            .error(reason)
            .build();
    }

    public static SignalResult failed(SignalName signal, String error) {
        return degraded(signal, SignalStatus.ERROR, error);
    }
}
