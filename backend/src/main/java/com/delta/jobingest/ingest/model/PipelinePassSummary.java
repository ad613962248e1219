package com.delta.jobingest.ingest.model;

import java.time.Instant;
import java.util.List;

public record PipelinePassSummary(
    long passId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    CycleStatsSnapshot stats,
    List<RunRecord> runs
) {}
