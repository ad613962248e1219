package com.delta.jobingest.ingest.service;

import com.delta.jobingest.ingest.persistence.PostingJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
public class PostingLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(PostingLifecycleService.class);
    private static final int EXAMPLE_TITLE_LIMIT = 5;

    private final PostingJdbcRepository repository;
    private final StoreRetryPolicy storeRetryPolicy;

    public PostingLifecycleService(PostingJdbcRepository repository, StoreRetryPolicy storeRetryPolicy) {
        this.repository = repository;
        this.storeRetryPolicy = storeRetryPolicy;
    }

    /**
     * Deactivates every active posting of {@code company} whose external id is not in
     * {@code currentlyActiveIds}. The set must come from a complete, successful cycle; an empty
     * set is treated as a failed scrape and changes nothing.
     *
     * @return number of postings moved to inactive
     */
    public int expireStale(String company, Set<String> currentlyActiveIds) {
        if (currentlyActiveIds == null || currentlyActiveIds.isEmpty()) {
            log.warn("No active job ids reported for {}; skipping stale posting expiry", company);
            return 0;
        }
        Set<String> ids = new LinkedHashSet<>();
        for (String id : currentlyActiveIds) {
            if (id != null && !id.isBlank()) {
                ids.add(id.trim());
            }
        }
        if (ids.isEmpty()) {
            log.warn("Only blank job ids reported for {}; skipping stale posting expiry", company);
            return 0;
        }

        int activeBefore = storeRetryPolicy.execute("count active postings", () -> repository.countActivePostings(company));
        List<String> examples = storeRetryPolicy.execute(
            "sample stale postings",
            () -> repository.findActiveTitlesNotIn(company, ids, EXAMPLE_TITLE_LIMIT)
        );
        log.info(
            "{}: {} active postings, {} still listed; expiring e.g. {}",
            company,
            activeBefore,
            ids.size(),
            examples
        );

        int expired = storeRetryPolicy.execute(
            "expire stale postings",
            () -> repository.deactivatePostingsNotIn(company, ids)
        );
        int activeAfter = storeRetryPolicy.execute("count active postings", () -> repository.countActivePostings(company));
        log.info("{}: expired {} stale postings, {} remain active", company, expired, activeAfter);
        return expired;
    }
}
