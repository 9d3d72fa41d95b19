package com.docforensics.core;

/**
 * Нарушено предусловие до запуска сигналов (например, изображение не открывается).
 * Превращается в результат PROCESSING_ERROR на границе конвейера.
 */
public class PipelineFailureException extends ForensicsException {

    public PipelineFailureException(String message) {
        super(message);
    }

    public PipelineFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
