package com.docforensics.models;

/**
 * Итоговый вердикт по документу, упорядочен по убыванию серьезности
 */
public enum Verdict {
    HIGHLY_SUSPICIOUS("Высокая вероятность подделки", 6),
    SUSPICIOUS("Подозрительный", 5),
    MODERATELY_SUSPICIOUS("Умеренно подозрительный", 4),
    SLIGHTLY_SUSPICIOUS("Слабые признаки подделки", 3),
    NEEDS_REVIEW("Требуется ручная проверка", 2),
    LIKELY_AUTHENTIC("Вероятно подлинный", 1),
    PROCESSING_ERROR("Ошибка обработки", 0);

    private final String russianName;
    private final int severity;

    Verdict(String russianName, int severity) {
        this.russianName = russianName;
        this.severity = severity;
    }

    public String getRussianName() {
        return russianName;
    }

    public int getSeverity() {
        return severity;
    }

    /**
     * Вердикты, при которых документ стоит отправить на проверку в источник
     */
    public boolean isAlarming() {
        return this == HIGHLY_SUSPICIOUS || this == SUSPICIOUS;
    }
}
