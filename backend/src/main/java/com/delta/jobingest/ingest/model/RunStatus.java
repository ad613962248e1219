package com.delta.jobingest.ingest.model;

import java.util.Locale;

public enum RunStatus {
    RUNNING,
    SUCCESS,
    FAILURE;

    public static RunStatus from(String value) {
        if (value == null || value.isBlank()) {
            return FAILURE;
        }
        try {
            return RunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FAILURE;
        }
    }
}
