package com.delta.jobingest.ingest.service;

import com.delta.jobingest.config.IngestProperties;
import com.delta.jobingest.ingest.model.CycleStatsSnapshot;
import com.delta.jobingest.ingest.model.PassTrigger;
import com.delta.jobingest.ingest.model.PipelinePassSummary;
import com.delta.jobingest.ingest.model.RunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Runs every enabled source once, one after another, and records the pass. At most one pass
 * runs per process, and never alongside a single-source run; a trigger that arrives while either
 * is active gets {@link ActivePipelinePassException}.
 */
@Service
public class PipelinePassService {
    private static final Logger log = LoggerFactory.getLogger(PipelinePassService.class);
    private static final String FRAME = "=".repeat(60);

    static final String STATUS_COMPLETED = "COMPLETED";
    static final String STATUS_COMPLETED_WITH_ERRORS = "COMPLETED_WITH_ERRORS";
    static final String STATUS_FAILED = "FAILED";

    private final IngestProperties properties;
    private final SourceIngestionService sourceIngestionService;
    private final RunLedgerService runLedgerService;
    private final CycleStats cycleStats;
    private final ExecutorService pipelinePassExecutor;
    private final AtomicBoolean passActive = new AtomicBoolean(false);

    public PipelinePassService(
        IngestProperties properties,
        SourceIngestionService sourceIngestionService,
        RunLedgerService runLedgerService,
        CycleStats cycleStats,
        @Qualifier("pipelinePassExecutor") ExecutorService pipelinePassExecutor
    ) {
        this.properties = properties;
        this.sourceIngestionService = sourceIngestionService;
        this.runLedgerService = runLedgerService;
        this.cycleStats = cycleStats;
        this.pipelinePassExecutor = pipelinePassExecutor;
    }

    public PipelinePassSummary runPass(PassTrigger trigger) {
        return runPass(trigger, List.of());
    }

    /**
     * Runs a pass on the calling thread. A non-empty {@code sourceNames} restricts the pass to
     * those sources.
     */
    public PipelinePassSummary runPass(PassTrigger trigger, Collection<String> sourceNames) {
        acquire(trigger);
        try {
            long passId = runLedgerService.openPass(trigger);
            return execute(passId, trigger, sourceNames);
        } finally {
            passActive.set(false);
        }
    }

    /**
     * Runs one source on the calling thread outside any pass. It holds the same guard as a pass,
     * so a company never has two writers in this process and the run stays out of pass totals.
     */
    public RunRecord runSingleSource(IngestProperties.Source source) {
        acquire("run of source " + source.getName());
        try {
            return sourceIngestionService.runConfiguredSource(source, null);
        } finally {
            passActive.set(false);
        }
    }

    /**
     * Starts a pass on the pipeline executor and returns its id immediately.
     */
    public long startAsync(PassTrigger trigger) {
        acquire(trigger);
        long passId;
        try {
            passId = runLedgerService.openPass(trigger);
        } catch (RuntimeException e) {
            passActive.set(false);
            throw e;
        }
        try {
            pipelinePassExecutor.submit(() -> {
                try {
                    execute(passId, trigger, List.of());
                } catch (Exception e) {
                    log.error("Pipeline pass {} failed", passId, e);
                } finally {
                    passActive.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            passActive.set(false);
            runLedgerService.completePass(passId, STATUS_FAILED, cycleStats.snapshot());
            throw e;
        }
        return passId;
    }

    public boolean isPassActive() {
        return passActive.get();
    }

    private void acquire(PassTrigger trigger) {
        acquire(trigger + " trigger");
    }

    private void acquire(String request) {
        if (!passActive.compareAndSet(false, true)) {
            throw new ActivePipelinePassException("An ingestion run is already active; " + request + " rejected");
        }
    }

    private PipelinePassSummary execute(long passId, PassTrigger trigger, Collection<String> sourceNames) {
        cycleStats.reset();
        List<IngestProperties.Source> sources = selectSources(sourceNames);
        log.info("Pipeline pass {} started (trigger={}, sources={})", passId, trigger, sources.size());
        for (IngestProperties.Source source : sources) {
            try {
                sourceIngestionService.runConfiguredSource(source, passId);
            } catch (Exception e) {
                log.error("Source {} aborted in pipeline pass {}", source.getName(), passId, e);
                cycleStats.record(null);
            }
        }
        CycleStatsSnapshot stats = cycleStats.snapshot();
        String status = stats.sourcesFailed() == 0 ? STATUS_COMPLETED : STATUS_COMPLETED_WITH_ERRORS;
        logSummary(passId, stats);
        runLedgerService.completePass(passId, status, stats);
        cycleStats.reset();
        return runLedgerService.passSummary(passId);
    }

    private List<IngestProperties.Source> selectSources(Collection<String> sourceNames) {
        Set<String> wanted = sourceNames == null
            ? Set.of()
            : sourceNames.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<IngestProperties.Source> selected = new ArrayList<>();
        for (IngestProperties.Source source : properties.getSources()) {
            if (!source.isEnabled() || source.getName() == null || source.getName().isBlank()) {
                continue;
            }
            if (!wanted.isEmpty() && !wanted.contains(source.getName().trim().toLowerCase(Locale.ROOT))) {
                continue;
            }
            selected.add(source);
        }
        return selected;
    }

    private void logSummary(long passId, CycleStatsSnapshot stats) {
        log.info(FRAME);
        log.info("PIPELINE PASS {} SUMMARY", passId);
        log.info(FRAME);
        log.info("Sources run:      {}", stats.sourcesRun());
        log.info(
            "Successful:       {} ({})",
            stats.sourcesSucceeded(),
            String.format(Locale.ROOT, "%.1f%%", stats.successRate())
        );
        log.info("Failed:           {}", stats.sourcesFailed());
        log.info("Postings added:   {}", stats.postingsAdded());
        log.info("Postings updated: {}", stats.postingsUpdated());
        log.info("Postings expired: {}", stats.postingsExpired());
        log.info(FRAME);
    }
}
