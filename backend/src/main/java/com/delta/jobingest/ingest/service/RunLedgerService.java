package com.delta.jobingest.ingest.service;

import com.delta.jobingest.ingest.model.CycleStatsSnapshot;
import com.delta.jobingest.ingest.model.PassTrigger;
import com.delta.jobingest.ingest.model.PipelinePassRecord;
import com.delta.jobingest.ingest.model.PipelinePassSummary;
import com.delta.jobingest.ingest.model.RunRecord;
import com.delta.jobingest.ingest.model.RunStatus;
import com.delta.jobingest.ingest.model.SourceRunCounts;
import com.delta.jobingest.ingest.persistence.RunLedgerJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Writes and reads run records and pipeline passes.
 */
@Service
public class RunLedgerService {
    private static final Logger log = LoggerFactory.getLogger(RunLedgerService.class);
    static final int MAX_ERROR_LENGTH = 500;

    private final RunLedgerJdbcRepository repository;

    public RunLedgerService(RunLedgerJdbcRepository repository) {
        this.repository = repository;
    }

    public RunRecord openRun(String sourceName, Long passId) {
        long runId = repository.insertRun(sourceName, passId, Instant.now());
        log.info("Run {} started for source {}", runId, sourceName);
        return repository.findRun(runId);
    }

    public RunRecord completeRun(long runId, SourceRunCounts counts) {
        return finalizeRun(runId, RunStatus.SUCCESS, counts, null);
    }

    public RunRecord failRun(long runId, SourceRunCounts counts, String errorMessage) {
        return finalizeRun(runId, RunStatus.FAILURE, counts, truncate(errorMessage));
    }

    public long openPass(PassTrigger trigger) {
        return repository.insertPass(trigger.name(), Instant.now());
    }

    public PipelinePassRecord completePass(long passId, String status, CycleStatsSnapshot stats) {
        int updated = repository.completePass(passId, Instant.now(), status, stats);
        if (updated == 0) {
            log.warn("Pipeline pass {} was already finalized; leaving it unchanged", passId);
        }
        return repository.findPass(passId);
    }

    public RunRecord findRun(long runId) {
        return repository.findRun(runId);
    }

    public List<RunRecord> recentRuns(String sourceName, int limit) {
        return repository.findRecentRuns(sourceName, limit);
    }

    public List<PipelinePassRecord> recentPasses(int limit) {
        return repository.findRecentPasses(limit);
    }

    public PipelinePassRecord latestPass() {
        return repository.findLatestPass();
    }

    public PipelinePassSummary passSummary(long passId) {
        PipelinePassRecord pass = repository.findPass(passId);
        if (pass == null) {
            return null;
        }
        return new PipelinePassSummary(
            pass.id(),
            pass.startedAt(),
            pass.finishedAt(),
            pass.status(),
            pass.stats(),
            repository.findRunsForPass(passId)
        );
    }

    /**
     * Finalizes runs and passes left RUNNING before {@code cutoff}, typically by a process that
     * died mid-pass. Returns the number of run records closed.
     */
    public int abortStaleRuns(Instant cutoff, String reason) {
        int aborted = 0;
        for (RunRecord run : repository.findRunningRunsStartedBefore(cutoff)) {
            if (repository.completeRun(run.id(), Instant.now(), RunStatus.FAILURE, SourceRunCounts.empty(), reason) > 0) {
                aborted++;
                log.info("Aborted stale run {} for {} startedAt={}", run.id(), run.sourceName(), run.startTime());
            }
        }
        for (PipelinePassRecord pass : repository.findRunningPassesStartedBefore(cutoff)) {
            CycleStatsSnapshot stats = pass.stats() == null ? new CycleStatsSnapshot(0, 0, 0, 0, 0) : pass.stats();
            if (repository.completePass(pass.id(), Instant.now(), "FAILED", stats) > 0) {
                log.info("Aborted stale pipeline pass {} startedAt={}", pass.id(), pass.startedAt());
            }
        }
        return aborted;
    }

    private RunRecord finalizeRun(long runId, RunStatus status, SourceRunCounts counts, String errorMessage) {
        int updated = repository.completeRun(runId, Instant.now(), status, counts, errorMessage);
        if (updated == 0) {
            log.warn("Run {} was already finalized; ignoring {} result", runId, status);
        }
        return repository.findRun(runId);
    }

    static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
