package com.docforensics.analyzers;

import com.docforensics.models.SignalName;
import com.docforensics.models.SignalResult;

/**
 * Контракт криминалистического анализатора.
 * Реализации не должны выбрасывать исключения наружу: ошибка возвращается
 * как {@link SignalResult} со статусом error.
 */
public interface ForensicAnalyzer {

    /**
     * Сигнал, который вычисляет анализатор
     */
    SignalName getSignal();

    /**
     * Проанализировать документ
     *
     * @param input подготовленный документ (растр и путь к исходному файлу)
     * @return результат сигнала, никогда не null
     */
    SignalResult analyze(AnalysisInput input);
}
