package com.docforensics.models;

import lombok.Builder;
import lombok.Data;

/**
 * Статистика работы конвейера
 */
@Data
@Builder
public class ProcessingStats {
    private int documentsProcessed;
    private double averageProcessingTime;
    private int cacheSize;
}
