package com.docforensics.models;

/**
 * Три независимых криминалистических сигнала.
 * Порядок объявления задает порядок при слиянии находок (ELA, OCR, Metadata).
 */
public enum SignalName {
    ELA("ela", "ELA", "Error Level Analysis"),
    OCR("ocr", "OCR", "Text Inconsistency"),
    METADATA("metadata", "Metadata", "Metadata Forensics");

    private final String key;
    private final String label;
    private final String displayName;

    SignalName(String key, String label, String displayName) {
        this.key = key;
        this.label = label;
        this.displayName = displayName;
    }

    /**
     * Короткое имя для сообщений об ошибках ("ELA analysis timeout")
     */
    public String getLabel() {
        return label;
    }

    /**
     * Ключ сигнала в JSON отчете
     */
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }
}
