package com.delta.jobingest.ingest.service;

import com.delta.jobingest.config.IngestProperties;
import com.delta.jobingest.ingest.adapter.JobSourceAdapter;
import com.delta.jobingest.ingest.model.PostingRecord;
import com.delta.jobingest.ingest.model.RawJobRecord;
import com.delta.jobingest.ingest.model.RunRecord;
import com.delta.jobingest.ingest.model.RunStatus;
import com.delta.jobingest.ingest.persistence.PostingJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class AcmeIngestionScenarioTest {

    @Autowired
    private SourceIngestionService sourceIngestionService;

    @Autowired
    private IngestProperties properties;

    @Autowired
    private PostingJdbcRepository repository;

    @Autowired
    private RunLedgerService runLedgerService;

    @Autowired
    private StubAcmeAdapter adapter;

    @Test
    void secondCycleUpdatesCreatesAndExpires() {
        IngestProperties.Source acme = properties.findSource("acme");

        adapter.setJobs(List.of(
            job("J1", "Data Scientist", "Austin, TX"),
            job("J2", "Senior Data Scientist", "Remote")
        ));
        RunRecord first = sourceIngestionService.runConfiguredSource(acme, null);

        assertEquals(RunStatus.SUCCESS, first.status());
        assertEquals(2, first.postingsAdded());
        assertEquals(0, first.postingsUpdated());
        assertEquals(0, first.postingsExpired());

        adapter.setJobs(List.of(
            job("J1", "Data Scientist", "Austin, TX"),
            job("J3", "Staff Data Scientist", "New York, NY")
        ));
        RunRecord second = sourceIngestionService.runConfiguredSource(acme, null);

        assertEquals(RunStatus.SUCCESS, second.status());
        assertEquals(1, second.postingsAdded());
        assertEquals(1, second.postingsUpdated());
        assertEquals(1, second.postingsExpired());

        assertTrue(repository.findPosting("J1", "Acme").isActive());
        assertFalse(repository.findPosting("J2", "Acme").isActive());
        assertTrue(repository.findPosting("J3", "Acme").isActive());

        PostingRecord j1 = repository.findPosting("J1", "Acme");
        assertThat(repository.findRoleNamesForPosting(j1.id())).containsExactly("Data Scientist");
        assertThat(adapter.lastQueries()).containsExactly("Data Scientist");
        assertThat(runLedgerService.recentRuns("acme", 10))
            .extracting(RunRecord::id)
            .contains(first.id(), second.id());
    }

    @Test
    void sourceWithoutAdapterFailsWithoutTouchingPostings() {
        RunRecord run = sourceIngestionService.runConfiguredSource(properties.findSource("globex"), null);

        assertEquals(RunStatus.FAILURE, run.status());
        assertEquals("no adapter configured for source globex", run.errorMessage());
        assertThat(run.endTime()).isNotNull();
        assertEquals(0, repository.countActivePostings("Globex"));
    }

    private static RawJobRecord job(String id, String title, String location) {
        return new RawJobRecord(
            id,
            title,
            location,
            "https://acme.example.com/jobs/" + id,
            LocalDate.now(ZoneOffset.UTC).toString(),
            "Full-time",
            "Role " + id
        );
    }

    static class StubAcmeAdapter implements JobSourceAdapter {
        private volatile List<RawJobRecord> jobs = List.of();
        private volatile List<String> lastQueries = List.of();

        void setJobs(List<RawJobRecord> jobs) {
            this.jobs = jobs;
        }

        List<String> lastQueries() {
            return lastQueries;
        }

        @Override
        public String sourceName() {
            return "acme";
        }

        @Override
        public Map<String, List<RawJobRecord>> fetch(List<String> roleQueries, int lookbackDays) {
            lastQueries = List.copyOf(roleQueries);
            Map<String, List<RawJobRecord>> results = new LinkedHashMap<>();
            for (String query : roleQueries) {
                results.put(query, jobs);
            }
            return results;
        }
    }

    @TestConfiguration
    static class StubAdapterConfig {

        @Bean
        StubAcmeAdapter stubAcmeAdapter() {
            return new StubAcmeAdapter();
        }
    }
}
