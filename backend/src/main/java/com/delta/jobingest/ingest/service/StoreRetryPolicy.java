package com.delta.jobingest.ingest.service;

import com.delta.jobingest.config.IngestProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Bounded retry for store calls. Transient and recoverable data-access errors are retried with
 * exponential backoff and jitter; anything else, and the last transient error once attempts run
 * out, is rethrown to the caller.
 */
@Component
public class StoreRetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(StoreRetryPolicy.class);

    private final IngestProperties properties;

    public StoreRetryPolicy(IngestProperties properties) {
        this.properties = properties;
    }

    public <T> T execute(String operation, Supplier<T> action) {
        int maxAttempts = properties.getStoreRetry().getMaxAttempts();
        DataAccessException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (TransientDataAccessException | RecoverableDataAccessException e) {
                last = e;
                if (attempt >= maxAttempts) {
                    break;
                }
                log.warn(
                    "Transient store error during {} (attempt {}/{}): {}",
                    operation,
                    attempt,
                    maxAttempts,
                    e.getMessage()
                );
                if (!sleepBackoff(attempt)) {
                    break;
                }
            }
        }
        log.warn("Store operation {} failed after {} attempt(s)", operation, maxAttempts);
        throw last;
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    long backoffDelayMs(int attempt) {
        IngestProperties.StoreRetry retry = properties.getStoreRetry();
        long delay = (long) retry.getBaseDelayMs() * (1L << Math.min(20, Math.max(0, attempt - 1)));
        if (retry.getMaxDelayMs() > 0) {
            delay = Math.min(delay, retry.getMaxDelayMs());
        }
        return delay;
    }

    private boolean sleepBackoff(int attempt) {
        long delay = backoffDelayMs(attempt);
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
