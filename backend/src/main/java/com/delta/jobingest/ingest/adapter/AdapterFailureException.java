package com.delta.jobingest.ingest.adapter;

public class AdapterFailureException extends RuntimeException {
    private final String sourceName;

    public AdapterFailureException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    public AdapterFailureException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
