package com.delta.jobingest.ingest.service;

import com.delta.jobingest.config.IngestProperties;
import com.delta.jobingest.ingest.adapter.JobSourceAdapter;
import com.delta.jobingest.ingest.adapter.JobSourceRegistry;
import com.delta.jobingest.ingest.model.RawJobRecord;
import com.delta.jobingest.ingest.model.RoleRecord;
import com.delta.jobingest.ingest.model.RunRecord;
import com.delta.jobingest.ingest.model.SourceRunCounts;
import com.delta.jobingest.ingest.model.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs one ingestion cycle for a single source: fetch, classify, upsert, then expire whatever the
 * source no longer lists. All store writes for the source happen on the calling thread. Runs that
 * belong to a pipeline pass are also added to {@link CycleStats}.
 */
@Service
public class SourceIngestionService {
    private static final Logger log = LoggerFactory.getLogger(SourceIngestionService.class);

    private final IngestProperties properties;
    private final JobSourceRegistry registry;
    private final RoleClassifierService roleClassifier;
    private final PostingUpsertService upsertService;
    private final PostingLifecycleService lifecycleService;
    private final RunLedgerService runLedgerService;
    private final CycleStats cycleStats;

    public SourceIngestionService(
        IngestProperties properties,
        JobSourceRegistry registry,
        RoleClassifierService roleClassifier,
        PostingUpsertService upsertService,
        PostingLifecycleService lifecycleService,
        RunLedgerService runLedgerService,
        CycleStats cycleStats
    ) {
        this.properties = properties;
        this.registry = registry;
        this.roleClassifier = roleClassifier;
        this.upsertService = upsertService;
        this.lifecycleService = lifecycleService;
        this.runLedgerService = runLedgerService;
        this.cycleStats = cycleStats;
    }

    public RunRecord runSource(String sourceName, List<String> roleQueries, int lookbackDays) {
        return runSource(sourceName, roleQueries, lookbackDays, null);
    }

    /**
     * Runs a configured source with its own role queries and lookback, or the global defaults.
     */
    public RunRecord runConfiguredSource(IngestProperties.Source source, Long passId) {
        return runSource(
            source.getName(),
            properties.roleQueriesFor(source),
            properties.lookbackDaysFor(source),
            passId
        );
    }

    public RunRecord runSource(String sourceName, List<String> roleQueries, int lookbackDays, Long passId) {
        RunRecord run = runLedgerService.openRun(sourceName, passId);
        IngestProperties.Source source = properties.findSource(sourceName);
        if (source == null) {
            return finishFailed(run, passId, SourceRunCounts.empty(), "unknown source " + sourceName);
        }
        Optional<JobSourceAdapter> adapter = registry.resolve(source);
        if (adapter.isEmpty()) {
            return finishFailed(run, passId, SourceRunCounts.empty(), "no adapter configured for source " + sourceName);
        }
        String company = source.getCompany();

        Map<String, List<RawJobRecord>> fetched;
        try {
            fetched = adapter.get().fetch(roleQueries, lookbackDays);
        } catch (Exception e) {
            log.warn("Adapter for {} failed: {}", sourceName, e.getMessage(), e);
            return finishFailed(run, passId, SourceRunCounts.empty(), errorMessage(e));
        }

        int added = 0;
        int updated = 0;
        int duplicates = 0;
        int failed = 0;
        Set<String> counted = new HashSet<>();
        Set<String> activeIds = new LinkedHashSet<>();
        if (fetched != null) {
            for (Map.Entry<String, List<RawJobRecord>> entry : fetched.entrySet()) {
                RoleRecord role = classify(entry.getKey());
                List<RawJobRecord> records = entry.getValue() == null ? List.of() : entry.getValue();
                for (RawJobRecord record : records) {
                    if (record == null) {
                        continue;
                    }
                    String externalId = record.hasIdentity() ? record.externalId().trim() : null;
                    if (externalId != null) {
                        activeIds.add(externalId);
                    }
                    boolean firstSighting = externalId == null || counted.add(externalId);

                    UpsertResult result;
                    try {
                        result = upsertService.upsert(record, company, role);
                    } catch (Exception e) {
                        log.warn("Unexpected error upserting job {} for {}", externalId, company, e);
                        if (firstSighting) {
                            failed++;
                        }
                        continue;
                    }
                    if (!firstSighting) {
                        continue;
                    }
                    switch (result.outcome()) {
                        case CREATED -> added++;
                        case UPDATED -> updated++;
                        case DUPLICATE_SKIPPED -> duplicates++;
                        case FAILED -> failed++;
                    }
                }
            }
        }

        int expired;
        try {
            expired = lifecycleService.expireStale(company, activeIds);
        } catch (Exception e) {
            log.warn("Stale posting expiry failed for {}", company, e);
            SourceRunCounts partial = new SourceRunCounts(added, updated, 0, duplicates, failed);
            return finishFailed(run, passId, partial, "stale expiry failed: " + errorMessage(e));
        }

        SourceRunCounts counts = new SourceRunCounts(added, updated, expired, duplicates, failed);
        RunRecord finished = runLedgerService.completeRun(run.id(), counts);
        recordInPass(passId, finished);
        log.info(
            "Run {} for {} finished: added={} updated={} expired={} duplicates={} failed={}",
            run.id(),
            sourceName,
            added,
            updated,
            expired,
            duplicates,
            failed
        );
        return finished;
    }

    private RoleRecord classify(String roleQuery) {
        try {
            return roleClassifier.canonicalize(roleQuery);
        } catch (Exception e) {
            log.warn("Unable to classify role query '{}'; postings stored without a role", roleQuery, e);
            return null;
        }
    }

    private RunRecord finishFailed(RunRecord run, Long passId, SourceRunCounts counts, String errorMessage) {
        RunRecord finished = runLedgerService.failRun(run.id(), counts, errorMessage);
        recordInPass(passId, finished);
        log.warn("Run {} for {} failed: {}", run.id(), run.sourceName(), errorMessage);
        return finished;
    }

    // Standalone runs have no pass to report into.
    private void recordInPass(Long passId, RunRecord finished) {
        if (passId != null) {
            cycleStats.record(finished);
        }
    }

    private static String errorMessage(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }
}
