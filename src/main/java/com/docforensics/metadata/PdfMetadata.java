package com.docforensics.metadata;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Извлеченные метаданные PDF: словарь Info, размеры страниц, типы полей форм
 */
@Value
@Builder
public class PdfMetadata {

    @Value
    public static class PageSize {
        int page;
        float width;
        float height;

        boolean sameAs(PageSize other) {
            return Float.compare(width, other.width) == 0 && Float.compare(height, other.height) == 0;
        }
    }

    /** Словарь Info: ключ без слеша -> строковое значение */
    @Singular("info")
    Map<String, String> documentInfo;

    @Singular
    List<PageSize> pageSizes;

    /** Значения /FT аннотаций (Tx, Btn, Ch, Sig) */
    @Singular
    List<String> formFieldTypes;

    public int getPageCount() {
        return pageSizes.size();
    }

    public String getCreationDate() {
        return documentInfo.get("CreationDate");
    }

    public String getModDate() {
        return documentInfo.get("ModDate");
    }

    public int getFieldCount() {
        return documentInfo.size() + 1;
    }

    public Map<String, Object> toFieldMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("page_count", getPageCount());
        fields.put("document_info", documentInfo);
        return fields;
    }
}
