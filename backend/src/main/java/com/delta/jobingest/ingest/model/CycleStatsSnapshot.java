package com.delta.jobingest.ingest.model;

public record CycleStatsSnapshot(
    int postingsAdded,
    int postingsUpdated,
    int postingsExpired,
    int sourcesRun,
    int sourcesFailed
) {
    public int sourcesSucceeded() {
        return Math.max(0, sourcesRun - sourcesFailed);
    }

    public double successRate() {
        if (sourcesRun <= 0) {
            return 0.0;
        }
        return (sourcesSucceeded() * 100.0) / sourcesRun;
    }
}
