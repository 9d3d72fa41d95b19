package com.docforensics.core;

/**
 * Базовое исключение конвейера анализа
 */
public class ForensicsException extends RuntimeException {

    public ForensicsException(String message) {
        super(message);
    }

    public ForensicsException(String message, Throwable cause) {
        super(message, cause);
    }
}
