package com.docforensics.core;

import com.docforensics.models.SignalName;

/**
 * Анализатор упал во время вычисления. Деградирует только этот сигнал.
 */
public class AnalyzerFailureException extends ForensicsException {

    private final SignalName signal;

    public AnalyzerFailureException(SignalName signal, String reason) {
        this(signal, reason, null);
    }

    public AnalyzerFailureException(SignalName signal, String reason, Throwable cause) {
        super(signal.getLabel() + " error: " + reason, cause);
        this.signal = signal;
    }

    public SignalName getSignal() {
        return signal;
    }
}
