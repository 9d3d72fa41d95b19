package com.docforensics.models;

public enum SignalStatus {
    COMPLETED("completed"),
    TIMEOUT("timeout"),
    ERROR("error");

    private final String value;

    SignalStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
