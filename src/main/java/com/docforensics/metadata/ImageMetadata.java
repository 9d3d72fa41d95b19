package com.docforensics.metadata;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Извлеченные метаданные изображения: ключевые EXIF теги, GPS, размеры
 */
@Value
@Builder
public class ImageMetadata {

    /** Значение EXIF DateTime как есть (формат yyyy:MM:dd HH:mm:ss), null если тега нет */
    String dateTime;
    String make;
    String model;
    String software;

    /** Имена найденных GPS тегов */
    @Singular
    List<String> gpsTags;

    /** Общее число EXIF тегов (IFD0, SubIFD, GPS) */
    int exifTagCount;

    String format;
    int width;
    int height;

    public boolean hasGps() {
        return !gpsTags.isEmpty();
    }

    public long getPixelCount() {
        return (long) width * height;
    }

    /**
     * Число извлеченных полей: EXIF теги плюс формат и размеры
     */
    public int getFieldCount() {
        return exifTagCount + 3;
    }

    public Map<String, Object> toFieldMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("format", format);
        fields.put("width", width);
        fields.put("height", height);
        fields.put("exif_tag_count", exifTagCount);
        putIfPresent(fields, "DateTime", dateTime);
        putIfPresent(fields, "Make", make);
        putIfPresent(fields, "Model", model);
        putIfPresent(fields, "Software", software);
        if (hasGps()) {
            fields.put("gps_tags", gpsTags);
        }
        return fields;
    }

    private static void putIfPresent(Map<String, Object> fields, String key, String value) {
        if (value != null) {
            fields.put(key, value);
        }
    }
}
