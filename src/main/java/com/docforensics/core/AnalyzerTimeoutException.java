package com.docforensics.core;

import com.docforensics.models.SignalName;

/**
 * Сигнал не уложился в свой таймаут. Деградирует только этот сигнал.
 */
public class AnalyzerTimeoutException extends ForensicsException {

    private final SignalName signal;
    private final long timeoutMs;

    public AnalyzerTimeoutException(SignalName signal, long timeoutMs) {
        super(signal.getLabel() + " analysis timeout");
        this.signal = signal;
        this.timeoutMs = timeoutMs;
    }

    public SignalName getSignal() {
        return signal;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
