package com.delta.jobingest.ingest.model;

import java.time.Instant;

public record PipelinePassRecord(
    long id,
    String trigger,
    Instant startedAt,
    Instant finishedAt,
    String status,
    CycleStatsSnapshot stats
) {}
