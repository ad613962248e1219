package com.delta.jobingest.ingest.service;

import com.delta.jobingest.ingest.model.CycleStatsSnapshot;
import com.delta.jobingest.ingest.model.RunRecord;
import org.springframework.stereotype.Component;

/**
 * Process-wide counters for the pipeline pass in progress. Postings written by a run that later
 * failed still count, since those rows were committed.
 */
@Component
public class CycleStats {
    private int postingsAdded;
    private int postingsUpdated;
    private int postingsExpired;
    private int sourcesRun;
    private int sourcesFailed;

    public synchronized void reset() {
        postingsAdded = 0;
        postingsUpdated = 0;
        postingsExpired = 0;
        sourcesRun = 0;
        sourcesFailed = 0;
    }

    public synchronized void record(RunRecord run) {
        sourcesRun++;
        if (run == null) {
            sourcesFailed++;
            return;
        }
        if (!run.succeeded()) {
            sourcesFailed++;
        }
        postingsAdded += run.postingsAdded();
        postingsUpdated += run.postingsUpdated();
        postingsExpired += run.postingsExpired();
    }

    public synchronized CycleStatsSnapshot snapshot() {
        return new CycleStatsSnapshot(postingsAdded, postingsUpdated, postingsExpired, sourcesRun, sourcesFailed);
    }
}
