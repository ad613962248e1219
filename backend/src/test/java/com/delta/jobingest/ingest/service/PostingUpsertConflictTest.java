package com.delta.jobingest.ingest.service;

import com.delta.jobingest.config.IngestProperties;
import com.delta.jobingest.ingest.model.PostingRecord;
import com.delta.jobingest.ingest.model.RawJobRecord;
import com.delta.jobingest.ingest.model.RoleRecord;
import com.delta.jobingest.ingest.model.UpsertFailureReason;
import com.delta.jobingest.ingest.model.UpsertOutcome;
import com.delta.jobingest.ingest.model.UpsertResult;
import com.delta.jobingest.ingest.persistence.PostingJdbcRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PostingUpsertConflictTest {

    @Mock
    private PostingJdbcRepository repository;

    private PostingUpsertService service;
    private final RoleRecord role = new RoleRecord(3L, "Data Scientist");
    private final RawJobRecord job = new RawJobRecord(
        "J-1",
        "Data Scientist",
        "Austin, TX",
        "https://example.com/jobs/J-1",
        "2024-05-01",
        "Full-time",
        "Build models"
    );

    @BeforeEach
    void setUp() {
        IngestProperties properties = new IngestProperties();
        properties.getStoreRetry().setMaxAttempts(3);
        properties.getStoreRetry().setBaseDelayMs(0);
        service = new PostingUpsertService(repository, new StoreRetryPolicy(properties), new ObjectMapper());
    }

    @Test
    void lostInsertRaceIsRetriedAsUpdate() {
        PostingRecord winner = posting(41L);
        when(repository.findPosting("J-1", "Acme")).thenReturn(null, winner, winner);
        when(repository.findActiveDuplicate("Acme", "Data Scientist", "Austin, TX")).thenReturn(null);
        when(repository.insertOrUpdatePosting(any())).thenThrow(new DuplicateKeyException("uq_postings_external_id_company"));
        when(repository.updatePosting(eq(41L), any())).thenReturn(1);

        UpsertResult result = service.upsert(job, "Acme", role);

        assertThat(result.outcome()).isEqualTo(UpsertOutcome.UPDATED);
        assertThat(result.posting().id()).isEqualTo(41L);
        verify(repository, times(1)).insertOrUpdatePosting(any());
        verify(repository).updatePosting(eq(41L), any());
        verify(repository).attachRole(41L, 3L);
    }

    @Test
    void conflictWithoutVisibleRowIsPersistentConflict() {
        when(repository.findPosting("J-1", "Acme")).thenReturn(null);
        when(repository.findActiveDuplicate("Acme", "Data Scientist", "Austin, TX")).thenReturn(null);
        when(repository.insertOrUpdatePosting(any())).thenThrow(new DuplicateKeyException("uq_postings_external_id_company"));

        UpsertResult result = service.upsert(job, "Acme", role);

        assertThat(result.outcome()).isEqualTo(UpsertOutcome.FAILED);
        assertThat(result.failureReason()).isEqualTo(UpsertFailureReason.PERSISTENT_CONFLICT);
        verify(repository, never()).updatePosting(anyLong(), any());
    }

    @Test
    void oversizedValueIsStoreErrorNotConflict() {
        when(repository.findPosting("J-1", "Acme")).thenReturn(null);
        when(repository.findActiveDuplicate("Acme", "Data Scientist", "Austin, TX")).thenReturn(null);
        when(repository.insertOrUpdatePosting(any()))
            .thenThrow(new DataIntegrityViolationException("value too long for column external_id"));

        UpsertResult result = service.upsert(job, "Acme", role);

        assertThat(result.outcome()).isEqualTo(UpsertOutcome.FAILED);
        assertThat(result.failureReason()).isEqualTo(UpsertFailureReason.STORE_ERROR);
        verify(repository, times(1)).findPosting("J-1", "Acme");
        verify(repository, never()).updatePosting(anyLong(), any());
    }

    @Test
    void exhaustedStoreRetriesReportStoreError() {
        when(repository.findPosting(anyString(), anyString())).thenThrow(new QueryTimeoutException("statement timeout"));

        UpsertResult result = service.upsert(job, "Acme", role);

        assertThat(result.outcome()).isEqualTo(UpsertOutcome.FAILED);
        assertThat(result.failureReason()).isEqualTo(UpsertFailureReason.STORE_ERROR);
        verify(repository, times(3)).findPosting("J-1", "Acme");
    }

    @Test
    void transientErrorIsRetriedTransparently() {
        PostingRecord stored = posting(7L);
        when(repository.findPosting("J-1", "Acme"))
            .thenThrow(new QueryTimeoutException("statement timeout"))
            .thenReturn(null)
            .thenReturn(stored);
        when(repository.findActiveDuplicate("Acme", "Data Scientist", "Austin, TX")).thenReturn(null);
        when(repository.insertOrUpdatePosting(any())).thenReturn(true);

        UpsertResult result = service.upsert(job, "Acme", role);

        assertThat(result.outcome()).isEqualTo(UpsertOutcome.CREATED);
        verify(repository).attachRole(7L, 3L);
    }

    private PostingRecord posting(long id) {
        Instant now = Instant.now();
        return new PostingRecord(
            id,
            "J-1",
            "Acme",
            "Data Scientist",
            "Austin, TX",
            "https://example.com/jobs/J-1",
            LocalDate.of(2024, 5, 1),
            "Full-time",
            "Build models",
            now,
            now,
            true
        );
    }
}
