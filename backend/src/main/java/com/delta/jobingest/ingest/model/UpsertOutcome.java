package com.delta.jobingest.ingest.model;

public enum UpsertOutcome {
    CREATED,
    UPDATED,
    DUPLICATE_SKIPPED,
    FAILED
}
