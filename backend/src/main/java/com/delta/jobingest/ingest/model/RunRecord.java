package com.delta.jobingest.ingest.model;

import java.time.Instant;

public record RunRecord(
    long id,
    String sourceName,
    Long passId,
    Instant startTime,
    Instant endTime,
    RunStatus status,
    int postingsAdded,
    int postingsUpdated,
    int postingsExpired,
    int duplicatesSkipped,
    int postingsFailed,
    String errorMessage
) {
    public boolean succeeded() {
        return status == RunStatus.SUCCESS;
    }
}
