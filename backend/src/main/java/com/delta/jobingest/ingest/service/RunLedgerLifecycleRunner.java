package com.delta.jobingest.ingest.service;

import com.delta.jobingest.config.IngestProperties;
import com.delta.jobingest.ingest.model.DatabaseStatistics;
import com.delta.jobingest.ingest.persistence.PostingJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RunLedgerLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(RunLedgerLifecycleRunner.class);
    static final String ABORT_REASON = "aborted_on_startup";

    private final PostingJdbcRepository postingRepository;
    private final RunLedgerService runLedgerService;
    private final IngestProperties properties;

    public RunLedgerLifecycleRunner(
        PostingJdbcRepository postingRepository,
        RunLedgerService runLedgerService,
        IngestProperties properties
    ) {
        this.postingRepository = postingRepository;
        this.runLedgerService = runLedgerService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = postingRepository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping run ledger cleanup because database is unreachable");
            return;
        }

        Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getStaleRunMinutes()));
        int aborted = runLedgerService.abortStaleRuns(cutoff, ABORT_REASON);
        if (aborted > 0) {
            log.info("Aborted {} stale run record(s) left RUNNING before {}", aborted, cutoff);
        }

        DatabaseStatistics stats = postingRepository.databaseStatistics();
        log.info(
            "Database statistics: active postings={}, total postings={}, companies={}, roles={}",
            stats.activePostings(),
            stats.totalPostings(),
            stats.companies(),
            stats.roles()
        );
    }
}
