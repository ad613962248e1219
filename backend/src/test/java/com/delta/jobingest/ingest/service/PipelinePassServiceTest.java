package com.delta.jobingest.ingest.service;

import com.delta.jobingest.config.IngestProperties;
import com.delta.jobingest.ingest.model.CycleStatsSnapshot;
import com.delta.jobingest.ingest.model.PassTrigger;
import com.delta.jobingest.ingest.model.PipelinePassSummary;
import com.delta.jobingest.ingest.model.RunRecord;
import com.delta.jobingest.ingest.model.RunStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelinePassServiceTest {

    @Mock
    private SourceIngestionService sourceIngestionService;
    @Mock
    private RunLedgerService runLedgerService;

    private final CycleStats cycleStats = new CycleStats();
    private final ExecutorService passExecutor = Executors.newSingleThreadExecutor();
    private IngestProperties properties;
    private PipelinePassService service;
    private IngestProperties.Source acme;
    private IngestProperties.Source globex;
    private IngestProperties.Source initech;

    @BeforeEach
    void setUp() {
        properties = new IngestProperties();
        acme = source("acme", true);
        globex = source("globex", true);
        initech = source("initech", true);
        IngestProperties.Source disabled = source("hooli", false);
        properties.setSources(List.of(acme, globex, initech, disabled));
        service = new PipelinePassService(properties, sourceIngestionService, runLedgerService, cycleStats, passExecutor);

        lenient().when(runLedgerService.openPass(any())).thenReturn(7L);
        lenient().when(runLedgerService.passSummary(7L)).thenAnswer(invocation ->
            new PipelinePassSummary(7L, Instant.now(), Instant.now(), "COMPLETED", cycleStats.snapshot(), List.of())
        );
    }

    @AfterEach
    void tearDown() {
        passExecutor.shutdownNow();
    }

    @Test
    void runsEnabledSourcesSequentiallyAndToleratesFailures() {
        when(sourceIngestionService.runConfiguredSource(acme, 7L)).thenAnswer(invocation -> record("acme", RunStatus.SUCCESS, 2, 1, 0));
        when(sourceIngestionService.runConfiguredSource(globex, 7L)).thenThrow(new IllegalStateException("db down"));
        when(sourceIngestionService.runConfiguredSource(initech, 7L)).thenAnswer(invocation -> record("initech", RunStatus.SUCCESS, 1, 0, 3));

        service.runPass(PassTrigger.SCHEDULED);

        InOrder order = inOrder(sourceIngestionService);
        order.verify(sourceIngestionService).runConfiguredSource(acme, 7L);
        order.verify(sourceIngestionService).runConfiguredSource(globex, 7L);
        order.verify(sourceIngestionService).runConfiguredSource(initech, 7L);

        ArgumentCaptor<CycleStatsSnapshot> stats = ArgumentCaptor.forClass(CycleStatsSnapshot.class);
        verify(runLedgerService).completePass(eq(7L), eq("COMPLETED_WITH_ERRORS"), stats.capture());
        assertThat(stats.getValue()).isEqualTo(new CycleStatsSnapshot(3, 1, 3, 3, 1));
        assertThat(cycleStats.snapshot()).isEqualTo(new CycleStatsSnapshot(0, 0, 0, 0, 0));
        assertThat(service.isPassActive()).isFalse();
    }

    @Test
    void cleanPassIsCompleted() {
        when(sourceIngestionService.runConfiguredSource(any(), eq(7L))).thenAnswer(invocation -> {
            IngestProperties.Source source = invocation.getArgument(0);
            return record(source.getName(), RunStatus.SUCCESS, 0, 1, 0);
        });

        service.runPass(PassTrigger.CLI);

        verify(runLedgerService).completePass(eq(7L), eq("COMPLETED"), eq(new CycleStatsSnapshot(0, 3, 0, 3, 0)));
    }

    @Test
    void sourceFilterRestrictsThePass() {
        when(sourceIngestionService.runConfiguredSource(globex, 7L)).thenAnswer(invocation -> record("globex", RunStatus.SUCCESS, 0, 0, 0));

        service.runPass(PassTrigger.CLI, List.of(" GLOBEX ", "hooli"));

        verify(sourceIngestionService).runConfiguredSource(globex, 7L);
        verify(sourceIngestionService, never()).runConfiguredSource(eq(acme), any());
        verify(sourceIngestionService, never()).runConfiguredSource(eq(initech), any());
    }

    @Test
    void overlappingPassIsRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(sourceIngestionService.runConfiguredSource(any(), anyLong())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            IngestProperties.Source source = invocation.getArgument(0);
            return record(source.getName(), RunStatus.SUCCESS, 0, 0, 0);
        });

        long passId = service.startAsync(PassTrigger.MANUAL);
        assertThat(passId).isEqualTo(7L);
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> service.runPass(PassTrigger.SCHEDULED))
            .isInstanceOf(ActivePipelinePassException.class);
        assertThatThrownBy(() -> service.startAsync(PassTrigger.MANUAL))
            .isInstanceOf(ActivePipelinePassException.class);

        release.countDown();
        verify(runLedgerService, timeout(5000)).completePass(eq(7L), eq("COMPLETED"), any());
        long deadline = System.currentTimeMillis() + 5000;
        while (service.isPassActive() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(service.isPassActive()).isFalse();
    }

    @Test
    void singleSourceRunDuringPassIsRejectedAndPassCountsOnlyItsSources() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(sourceIngestionService.runConfiguredSource(any(), eq(7L))).thenAnswer(invocation -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            IngestProperties.Source source = invocation.getArgument(0);
            return record(source.getName(), RunStatus.SUCCESS, 1, 0, 0);
        });

        service.startAsync(PassTrigger.MANUAL);
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> service.runSingleSource(globex))
            .isInstanceOf(ActivePipelinePassException.class)
            .hasMessageContaining("globex");

        release.countDown();
        verify(runLedgerService, timeout(5000))
            .completePass(eq(7L), eq("COMPLETED"), eq(new CycleStatsSnapshot(3, 0, 0, 3, 0)));
        verify(sourceIngestionService, never()).runConfiguredSource(any(), isNull());
    }

    @Test
    void passIsRejectedWhileSingleSourceRunIsActive() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(sourceIngestionService.runConfiguredSource(eq(acme), isNull())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            return new RunRecord(3L, "acme", null, Instant.now(), Instant.now(), RunStatus.SUCCESS, 2, 0, 0, 0, 0, null);
        });

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<RunRecord> single = caller.submit(() -> service.runSingleSource(acme));
            assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> service.runPass(PassTrigger.SCHEDULED))
                .isInstanceOf(ActivePipelinePassException.class);
            assertThatThrownBy(() -> service.startAsync(PassTrigger.MANUAL))
                .isInstanceOf(ActivePipelinePassException.class);

            release.countDown();
            RunRecord run = single.get(10, TimeUnit.SECONDS);
            assertThat(run.passId()).isNull();
            assertThat(service.isPassActive()).isFalse();
            assertThat(cycleStats.snapshot()).isEqualTo(new CycleStatsSnapshot(0, 0, 0, 0, 0));
            verify(runLedgerService, never()).openPass(any());
        } finally {
            caller.shutdownNow();
        }
    }

    private RunRecord record(String name, RunStatus status, int added, int updated, int expired) {
        RunRecord run = new RunRecord(1L, name, 7L, Instant.now(), Instant.now(), status, added, updated, expired, 0, 0, null);
        cycleStats.record(run);
        return run;
    }

    private static IngestProperties.Source source(String name, boolean enabled) {
        IngestProperties.Source source = new IngestProperties.Source();
        source.setName(name);
        source.setEnabled(enabled);
        return source;
    }
}
