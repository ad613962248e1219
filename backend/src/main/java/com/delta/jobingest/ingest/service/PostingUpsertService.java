package com.delta.jobingest.ingest.service;

import com.delta.jobingest.ingest.model.PostingRecord;
import com.delta.jobingest.ingest.model.RawJobRecord;
import com.delta.jobingest.ingest.model.RoleRecord;
import com.delta.jobingest.ingest.model.UpsertFailureReason;
import com.delta.jobingest.ingest.model.UpsertResult;
import com.delta.jobingest.ingest.persistence.PostingJdbcRepository;
import com.delta.jobingest.ingest.persistence.PostingJdbcRepository.PostingWrite;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Idempotent create-or-update of postings keyed on {@code (externalId, company)}. Every failure
 * is reported through {@link UpsertResult}; nothing is thrown to the caller.
 */
@Service
public class PostingUpsertService {
    private static final Logger log = LoggerFactory.getLogger(PostingUpsertService.class);

    private final PostingJdbcRepository repository;
    private final StoreRetryPolicy storeRetryPolicy;
    private final ObjectMapper objectMapper;

    public PostingUpsertService(
        PostingJdbcRepository repository,
        StoreRetryPolicy storeRetryPolicy,
        ObjectMapper objectMapper
    ) {
        this.repository = repository;
        this.storeRetryPolicy = storeRetryPolicy;
        this.objectMapper = objectMapper;
    }

    public UpsertResult upsert(RawJobRecord raw, String company, RoleRecord role) {
        if (raw == null || !raw.hasIdentity()) {
            log.warn(
                "Skipping posting without external id for {} (title={})",
                company,
                raw == null ? null : raw.title()
            );
            return UpsertResult.failed(UpsertFailureReason.MISSING_IDENTITY);
        }

        String externalId = raw.externalId().trim();
        PostingWrite write = new PostingWrite(
            externalId,
            company,
            emptyIfNull(raw.title()),
            emptyIfNull(raw.location()),
            raw.url(),
            parseDatePosted(raw, company),
            raw.employmentType(),
            raw.description(),
            toRawPayload(raw),
            Instant.now()
        );

        try {
            PostingRecord existing = storeRetryPolicy.execute(
                "find posting",
                () -> repository.findPosting(externalId, company)
            );
            if (existing != null) {
                return updateExisting(existing.id(), write, role);
            }

            PostingRecord duplicate = storeRetryPolicy.execute(
                "find duplicate posting",
                () -> repository.findActiveDuplicate(company, write.title(), write.location())
            );
            if (duplicate != null) {
                attachRole(duplicate.id(), role);
                log.debug(
                    "Posting {} for {} duplicates active posting {} ({} @ {}); skipped",
                    externalId,
                    company,
                    duplicate.externalId(),
                    write.title(),
                    write.location()
                );
                return UpsertResult.duplicateSkipped(duplicate);
            }

            boolean inserted;
            try {
                inserted = storeRetryPolicy.execute("insert posting", () -> repository.insertOrUpdatePosting(write));
            } catch (DuplicateKeyException e) {
                return resolveConflict(write, role);
            }
            PostingRecord stored = storeRetryPolicy.execute(
                "read posting",
                () -> repository.findPosting(externalId, company)
            );
            if (stored == null) {
                log.warn("Posting {} for {} missing right after write", externalId, company);
                return UpsertResult.failed(UpsertFailureReason.STORE_ERROR);
            }
            attachRole(stored.id(), role);
            return inserted ? UpsertResult.created(stored) : UpsertResult.updated(stored);
        } catch (DataAccessException e) {
            log.warn("Store error while upserting posting {} for {}: {}", externalId, company, e.getMessage());
            return UpsertResult.failed(UpsertFailureReason.STORE_ERROR);
        }
    }

    private UpsertResult resolveConflict(PostingWrite write, RoleRecord role) {
        log.info(
            "Posting {} for {} was inserted concurrently; retrying as update",
            write.externalId(),
            write.company()
        );
        try {
            PostingRecord current = storeRetryPolicy.execute(
                "re-read conflicting posting",
                () -> repository.findPosting(write.externalId(), write.company())
            );
            if (current == null) {
                log.warn(
                    "Conflicting posting {} for {} not found on re-read",
                    write.externalId(),
                    write.company()
                );
                return UpsertResult.failed(UpsertFailureReason.PERSISTENT_CONFLICT);
            }
            return updateExisting(current.id(), write, role);
        } catch (DataAccessException e) {
            log.warn(
                "Update retry failed for posting {} for {}: {}",
                write.externalId(),
                write.company(),
                e.getMessage()
            );
            return UpsertResult.failed(UpsertFailureReason.PERSISTENT_CONFLICT);
        }
    }

    private UpsertResult updateExisting(long postingId, PostingWrite write, RoleRecord role) {
        storeRetryPolicy.execute("update posting", () -> repository.updatePosting(postingId, write));
        attachRole(postingId, role);
        PostingRecord updated = storeRetryPolicy.execute(
            "read posting",
            () -> repository.findPosting(write.externalId(), write.company())
        );
        return UpsertResult.updated(updated);
    }

    private void attachRole(long postingId, RoleRecord role) {
        if (role == null) {
            return;
        }
        storeRetryPolicy.execute("attach role", () -> repository.attachRole(postingId, role.id()));
    }

    private LocalDate parseDatePosted(RawJobRecord raw, String company) {
        String value = raw.datePosted();
        if (value != null && !value.isBlank()) {
            String trimmed = value.trim();
            try {
                return LocalDate.parse(trimmed);
            } catch (DateTimeParseException e) {
                if (trimmed.length() > 10 && trimmed.charAt(10) == 'T') {
                    try {
                        return LocalDate.parse(trimmed.substring(0, 10));
                    } catch (DateTimeParseException ignored) {
                        log.debug("Date prefix of '{}' is not an ISO date either", trimmed);
                    }
                }
            }
        }
        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        log.warn(
            "Invalid date_posted '{}' for posting {} ({}); using {}",
            value,
            raw.externalId(),
            company,
            today
        );
        return today;
    }

    private String toRawPayload(RawJobRecord raw) {
        try {
            return objectMapper.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            log.debug("Unable to serialize raw payload for posting {}", raw.externalId(), e);
            return null;
        }
    }

    private static String emptyIfNull(String value) {
        return value == null ? "" : value.trim();
    }
}
