package com.docforensics.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Одна находка (аномалия), обнаруженная анализатором.
 * Неизменяема после создания.
 */
@Value
@Builder
public class Finding {

    /** Тип находки, например compression_artifact, font_size_inconsistency, date_anomaly */
    String kind;

    /** Сигнал-источник */
    SignalName source;

    /** Уверенность 0-100 */
    double confidence;

    String description;

    /** Может быть null для находок без привязки к области изображения */
    BoundingBox bbox;

    @Singular
    Map<String, Object> details;

    public boolean hasBoundingBox() {
        return bbox != null;
    }
}
