package com.delta.jobingest.ingest.model;

public enum UpsertFailureReason {
    MISSING_IDENTITY,
    PERSISTENT_CONFLICT,
    STORE_ERROR
}
