package com.delta.jobingest.ingest.service;

import com.delta.jobingest.ingest.model.LivenessAudit;
import com.delta.jobingest.ingest.persistence.PostingJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only count of live and expired postings.
 */
@Service
public class LivenessAuditService {
    private static final Logger log = LoggerFactory.getLogger(LivenessAuditService.class);

    private final PostingJdbcRepository repository;

    public LivenessAuditService(PostingJdbcRepository repository) {
        this.repository = repository;
    }

    public LivenessAudit audit() {
        long active = repository.countPostings(true);
        long inactive = repository.countPostings(false);
        Map<String, Long> byCompany = repository.countActivePostingsByCompany();
        log.info("Liveness audit: {} active postings, {} inactive postings", active, inactive);
        byCompany.forEach((company, count) -> log.info("  {}: {} active", company, count));
        return new LivenessAudit(active, inactive, byCompany, Instant.now());
    }
}
