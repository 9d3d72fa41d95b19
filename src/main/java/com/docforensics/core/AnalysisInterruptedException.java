package com.docforensics.core;

/**
 * Вызывающий поток прерван во время ожидания сигналов.
 * Не превращается в PROCESSING_ERROR и не кэшируется: вызов можно повторить.
 */
public class AnalysisInterruptedException extends ForensicsException {

    public AnalysisInterruptedException(String documentId, Throwable cause) {
        super("Analysis of " + documentId + " interrupted", cause);
    }
}
