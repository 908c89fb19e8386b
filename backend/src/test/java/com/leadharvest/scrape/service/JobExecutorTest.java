package com.leadharvest.scrape.service;

import com.leadharvest.config.HarvestProperties;
import com.leadharvest.scrape.dedup.LeadFingerprinter;
import com.leadharvest.scrape.model.Area;
import com.leadharvest.scrape.model.AreaTier;
import com.leadharvest.scrape.model.Checkpoint;
import com.leadharvest.scrape.model.JobErrorEntry;
import com.leadharvest.scrape.model.JobErrorKind;
import com.leadharvest.scrape.model.JobRunResult;
import com.leadharvest.scrape.model.JobStatus;
import com.leadharvest.scrape.model.PlannedArea;
import com.leadharvest.scrape.model.ScrapeJob;
import com.leadharvest.scrape.persistence.ScrapeJobJdbcRepository;
import com.leadharvest.scrape.persistence.StorageWriteException;
import com.leadharvest.scrape.provider.SearchProviderException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobExecutorTest {
    private static final String JOB_ID = "job-1";

    @Mock
    private ScrapeJobJdbcRepository repository;

    private HarvestProperties properties;
    private InMemoryLeadSink leadSink;
    private InMemoryCheckpointStore checkpointStore;
    private ScriptedSearchProvider provider;

    @BeforeEach
    void setUp() {
        properties = new HarvestProperties();
        properties.getRetry().setBaseDelayMs(1);
        properties.getRetry().setMaxDelayMs(2);
        properties.getRetry().setMaxAttempts(3);
        properties.getStorage().setMaxAttempts(3);
        properties.getStorage().setRetryDelayMs(0);
        leadSink = new InMemoryLeadSink();
        checkpointStore = new InMemoryCheckpointStore();
        provider = new ScriptedSearchProvider();
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void happyPathCompletesWithCommittedLeadsAndAreas() {
        stubJob(1_000, highAreas("Alpha", "Bravo", "Charlie"));
        provider.page("Alpha", 1, 10, false)
            .page("Bravo", 1, 8, false)
            .page("Charlie", 1, 0, false);

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals(18, result.leadsFound());
        assertEquals(3, result.areasCompleted());
        assertEquals(List.of("Alpha#1", "Bravo#1", "Charlie#1"), provider.calls());
        assertEquals(18, leadSink.size());
        Checkpoint last = checkpointStore.load(JOB_ID).orElseThrow();
        assertEquals(3, last.currentAreaIndex());
        assertEquals(18, last.leadsFound());
        verify(repository).finishRun(eq(JOB_ID), eq(JobStatus.COMPLETED), isNull(), any(Instant.class));
    }

    @Test
    void earlyExitStopsAreaWhenPageIsThinAndShort() {
        stubJob(1_000, highAreas("Alpha", "Bravo"));
        provider.page("Alpha", 1, 20, true)
            .page("Alpha", 2, 4, true)
            .page("Bravo", 1, 12, true)
            .page("Bravo", 2, 0, true);

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals(List.of("Alpha#1", "Alpha#2", "Bravo#1", "Bravo#2"), provider.calls());
        assertEquals(36, result.leadsFound());
        assertEquals(2, result.areasCompleted());
    }

    @Test
    void areaStopsAtItsPageBudget() {
        Area low = new Area("Lowtown", "FR", null, 8_000L, AreaTier.LOW);
        stubJob(1_000, List.of(new PlannedArea(0, low, low.pageBudget())));
        provider.page("Lowtown", 1, 20, true)
            .page("Lowtown", 2, 20, true)
            .page("Lowtown", 3, 20, true);

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals(List.of("Lowtown#1", "Lowtown#2"), provider.calls());
        assertEquals(40, result.leadsFound());
    }

    @Test
    void leadsAreCommittedBeforeTheCheckpointThatCoversThem() {
        stubJob(1_000, highAreas("Alpha"));
        provider.page("Alpha", 1, 20, true).page("Alpha", 2, 7, true);

        executor().run(JOB_ID, new AtomicBoolean(false));

        for (Checkpoint checkpoint : checkpointStore.history()) {
            assertThat(leadSink.size()).isGreaterThanOrEqualTo(checkpoint.leadsFound());
        }
        assertThat(checkpointStore.history()).extracting(Checkpoint::leadsFound).contains(0, 20, 27);
    }

    @Test
    void stopsAsSoonAsTargetIsReached() {
        stubJob(15, highAreas("Alpha", "Bravo"));
        provider.page("Alpha", 1, 20, true);

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals(20, result.leadsFound());
        assertEquals(List.of("Alpha#1"), provider.calls());
    }

    @Test
    void resumeAfterPauseSkipsCompletedAreasAndAddsNoDuplicates() {
        List<PlannedArea> plan = highAreas("Alpha", "Bravo", "Charlie");
        stubJob(1_000, plan);
        AtomicBoolean cancel = new AtomicBoolean(false);
        provider.page("Alpha", 1, 10, false)
            .page("Bravo", 1, 6, false)
            .page("Charlie", 1, 3, false)
            .onCall(callNumber -> cancel.set(true));

        JobExecutor executor = executor();
        JobRunResult first = executor.run(JOB_ID, cancel);

        assertEquals(JobStatus.PAUSED, first.status());
        Checkpoint paused = checkpointStore.load(JOB_ID).orElseThrow();
        assertEquals(1, paused.currentAreaIndex());
        assertEquals(10, paused.leadsFound());

        provider.onCall(callNumber -> {
        });
        JobRunResult resumed = executor.run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.COMPLETED, resumed.status());
        assertEquals(19, resumed.leadsFound());
        assertEquals(3, resumed.areasCompleted());
        assertEquals(1, provider.callsFor("Alpha"));
        assertEquals(List.of("Alpha#1", "Bravo#1", "Charlie#1"), provider.calls());
        assertEquals(10, leadSink.countForArea("Alpha"));
        assertEquals(19, leadSink.size());
    }

    @Test
    void resumingFromStoredCheckpointOnlySearchesRemainingAreas() {
        stubJob(1_000, highAreas("Alpha", "Bravo", "Charlie"));
        checkpointStore.save(JOB_ID, new Checkpoint(JOB_ID, 1, 0, 10, 1, Instant.now()));
        provider.page("Bravo", 1, 5, false).page("Charlie", 1, 2, false);

        JobExecutor executor = executor();
        JobRunResult pausedAgain = executor.run(JOB_ID, new AtomicBoolean(true));
        JobRunResult result = executor.run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.PAUSED, pausedAgain.status());
        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals(List.of("Bravo#1", "Charlie#1"), provider.calls());
        assertEquals(17, result.leadsFound());
        assertEquals(0, leadSink.countForArea("Alpha"));
    }

    @Test
    void replayingTheInFlightPageAfterRestartInsertsNothingTwice() {
        stubJob(1_000, highAreas("Alpha"));
        provider.page("Alpha", 1, 20, true)
            .page("Alpha", 1, 20, true)
            .page("Alpha", 2, 3, true);
        AtomicBoolean cancel = new AtomicBoolean(false);
        provider.onCall(callNumber -> cancel.set(true));

        JobExecutor executor = executor();
        assertEquals(JobStatus.PAUSED, executor.run(JOB_ID, cancel).status());
        assertEquals(1, checkpointStore.load(JOB_ID).orElseThrow().currentPage());

        provider.onCall(callNumber -> {
        });
        JobRunResult result = executor.run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals(List.of("Alpha#1", "Alpha#1", "Alpha#2"), provider.calls());
        assertEquals(23, result.leadsFound());
        assertEquals(23, leadSink.size());
    }

    @Test
    void continuesAfterInFlightPageWhenRestartIsDisabled() {
        properties.getJobs().setRestartInFlightArea(false);
        stubJob(1_000, highAreas("Alpha"));
        checkpointStore.save(JOB_ID, new Checkpoint(JOB_ID, 0, 2, 40, 0, Instant.now()));
        provider.page("Alpha", 3, 1, true);

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(List.of("Alpha#3"), provider.calls());
        assertEquals(41, result.leadsFound());
    }

    @Test
    void transientErrorsAreRetriedWithBackoff() {
        stubJob(1_000, highAreas("Alpha"));
        provider.fail("Alpha", 1, SearchProviderException.Kind.TRANSIENT)
            .fail("Alpha", 1, SearchProviderException.Kind.TRANSIENT)
            .page("Alpha", 1, 3, false);

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals(2, result.retries());
        assertEquals(3, result.leadsFound());
        assertEquals(3, provider.calls().size());
        verify(repository, atLeastOnce()).updateProgress(eq(JOB_ID), any(Checkpoint.class), eq("Alpha"), eq(3), eq(2));
        verify(repository, never()).finishRun(eq(JOB_ID), eq(JobStatus.FAILED), any(), any(Instant.class));
    }

    @Test
    void exhaustedTransientRetriesFailTheJobAndKeepCheckpoint() {
        stubJob(1_000, highAreas("Alpha"));
        provider.page("Alpha", 1, 20, true);
        for (int i = 0; i < 3; i++) {
            provider.fail("Alpha", 2, SearchProviderException.Kind.TRANSIENT);
        }

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.FAILED, result.status());
        assertThat(result.lastError()).contains("transient retries exhausted");
        Checkpoint checkpoint = checkpointStore.load(JOB_ID).orElseThrow();
        assertEquals(0, checkpoint.currentAreaIndex());
        assertEquals(1, checkpoint.currentPage());
        assertEquals(20, checkpoint.leadsFound());
        verify(repository).finishRun(eq(JOB_ID), eq(JobStatus.FAILED), contains("transient retries exhausted"), any(Instant.class));
    }

    @Test
    void fatalProviderErrorFailsImmediately() {
        stubJob(1_000, highAreas("Alpha", "Bravo"));
        provider.fail("Alpha", 1, SearchProviderException.Kind.FATAL);

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.FAILED, result.status());
        assertEquals(List.of("Alpha#1"), provider.calls());
        assertThat(result.lastError()).startsWith("provider:");
        ArgumentCaptor<JobErrorEntry> errors = ArgumentCaptor.forClass(JobErrorEntry.class);
        verify(repository).insertError(errors.capture());
        assertEquals(JobErrorKind.FATAL, errors.getValue().kind());
    }

    @Test
    void pauseTakesEffectAtNextPageBoundary() {
        stubJob(1_000, highAreas("Alpha", "Bravo"));
        AtomicBoolean cancel = new AtomicBoolean(false);
        for (int page = 1; page <= 10; page++) {
            provider.page("Alpha", page, 20, true);
        }
        provider.onCall(callNumber -> {
            if (callNumber == 2) {
                cancel.set(true);
            }
        });

        JobRunResult result = executor().run(JOB_ID, cancel);

        assertEquals(JobStatus.PAUSED, result.status());
        assertEquals(List.of("Alpha#1", "Alpha#2"), provider.calls());
        assertEquals(40, result.leadsFound());
        Checkpoint checkpoint = checkpointStore.load(JOB_ID).orElseThrow();
        assertEquals(2, checkpoint.currentPage());
        verify(repository).finishRun(eq(JOB_ID), eq(JobStatus.PAUSED), isNull(), any(Instant.class));
    }

    @Test
    void areaWithMissingDataIsSkippedWithWarning() {
        List<PlannedArea> plan = new ArrayList<>(highAreas("Alpha"));
        plan.add(new PlannedArea(1, new Area(" ", "FR", null, 200_000L, AreaTier.HIGH), 10));
        plan.add(new PlannedArea(2, new Area("Charlie", "FR", null, 150_000L, AreaTier.HIGH), 10));
        stubJob(1_000, plan);
        provider.page("Alpha", 1, 2, false).page("Charlie", 1, 4, false);

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals(3, result.areasCompleted());
        assertEquals(6, result.leadsFound());
        assertEquals(List.of("Alpha#1", "Charlie#1"), provider.calls());
        ArgumentCaptor<JobErrorEntry> errors = ArgumentCaptor.forClass(JobErrorEntry.class);
        verify(repository).insertError(errors.capture());
        assertEquals(JobErrorKind.AREA_DATA, errors.getValue().kind());
    }

    @Test
    void storageFailureIsRetriedThenRecovers() {
        stubJob(1_000, highAreas("Alpha"));
        provider.page("Alpha", 1, 5, false);
        leadSink.failNext(2);

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals(5, result.leadsFound());
        assertEquals(3, leadSink.batchAttempts());
    }

    @Test
    void persistentStorageFailureFailsJob() {
        stubJob(1_000, highAreas("Alpha"));
        provider.page("Alpha", 1, 5, false);
        leadSink.failNext(10);

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.FAILED, result.status());
        assertThat(result.lastError()).startsWith("storage:");
        assertEquals(3, leadSink.batchAttempts());
        assertEquals(0, checkpointStore.load(JOB_ID).orElseThrow().leadsFound());
        verify(repository).finishRun(eq(JOB_ID), eq(JobStatus.FAILED), contains("db down"), any(Instant.class));
    }

    @Test
    void completionSurvivesABriefStatusWriteFailure() {
        stubJob(1_000, highAreas("Alpha"));
        provider.page("Alpha", 1, 3, false);
        doThrow(new StorageWriteException("status update failed", new IllegalStateException("blip")))
            .doNothing()
            .when(repository).finishRun(eq(JOB_ID), eq(JobStatus.COMPLETED), isNull(), any(Instant.class));

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals(3, result.leadsFound());
        verify(repository, times(2)).finishRun(eq(JOB_ID), eq(JobStatus.COMPLETED), isNull(), any(Instant.class));
        verify(repository, never()).finishRun(eq(JOB_ID), eq(JobStatus.FAILED), any(), any(Instant.class));
    }

    @Test
    void pauseSurvivesABriefStatusWriteFailure() {
        stubJob(1_000, highAreas("Alpha"));
        provider.page("Alpha", 1, 20, true);
        AtomicBoolean cancel = new AtomicBoolean(false);
        provider.onCall(callNumber -> cancel.set(true));
        doThrow(new StorageWriteException("status update failed", new IllegalStateException("blip")))
            .doNothing()
            .when(repository).finishRun(eq(JOB_ID), eq(JobStatus.PAUSED), isNull(), any(Instant.class));

        JobRunResult result = executor().run(JOB_ID, cancel);

        assertEquals(JobStatus.PAUSED, result.status());
        assertEquals(20, result.leadsFound());
        verify(repository, times(2)).finishRun(eq(JOB_ID), eq(JobStatus.PAUSED), isNull(), any(Instant.class));
    }

    @Test
    void interruptDuringTransientBackoffPausesTheJob() throws Exception {
        properties.getRetry().setBaseDelayMs(10_000);
        properties.getRetry().setMaxDelayMs(10_000);
        stubJob(1_000, highAreas("Alpha"));
        provider.fail("Alpha", 1, SearchProviderException.Kind.TRANSIENT).page("Alpha", 1, 20, false);
        Thread runner = Thread.currentThread();
        Thread interrupter = new Thread(() -> {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (runner.getState() != Thread.State.TIMED_WAITING && System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            runner.interrupt();
        });
        provider.onCall(callNumber -> interrupter.start());

        long started = System.nanoTime();
        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        interrupter.join();

        assertEquals(JobStatus.PAUSED, result.status());
        assertEquals(1, result.retries());
        assertEquals(List.of("Alpha#1"), provider.calls());
        assertThat(elapsedMs).isLessThan(5_000L);
        assertTrue(Thread.interrupted());
        verify(repository).finishRun(eq(JOB_ID), eq(JobStatus.PAUSED), isNull(), any(Instant.class));
    }

    @Test
    void interruptDuringProviderCallPausesAtTheNextBoundary() {
        stubJob(1_000, highAreas("Alpha"));
        provider.page("Alpha", 1, 20, true).page("Alpha", 2, 20, true);
        provider.onCall(callNumber -> Thread.currentThread().interrupt());

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.PAUSED, result.status());
        assertEquals(20, result.leadsFound());
        assertEquals(List.of("Alpha#1"), provider.calls());
        assertEquals(1, checkpointStore.load(JOB_ID).orElseThrow().currentPage());
        assertTrue(Thread.interrupted());
    }

    @Test
    void failedCheckpointWriteReportsTheLastCommittedPosition() {
        stubJob(1_000, highAreas("Alpha"));
        provider.page("Alpha", 1, 20, true);
        provider.onCall(callNumber -> checkpointStore.failNext(10));

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.FAILED, result.status());
        assertEquals("storage: checkpoint store down", result.lastError());
        assertEquals(0, result.leadsFound());
        assertEquals(20, leadSink.size());
        ArgumentCaptor<Checkpoint> reported = ArgumentCaptor.forClass(Checkpoint.class);
        verify(repository).updateProgress(eq(JOB_ID), reported.capture(), any(), anyInt(), anyInt());
        assertEquals(0, reported.getValue().currentPage());
        assertEquals(0, reported.getValue().leadsFound());
        assertEquals(0, checkpointStore.load(JOB_ID).orElseThrow().currentPage());
    }

    @Test
    void unexpectedErrorsNeverEscape() {
        stubJob(1_000, highAreas("Alpha"));
        provider.answer("Alpha", 1, new IllegalStateException("boom"));

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.FAILED, result.status());
        assertEquals("unexpected: IllegalStateException: boom", result.lastError());
    }

    @Test
    void unclaimableJobIsLeftUntouched() {
        when(repository.claimForRun(eq(JOB_ID), any(Instant.class))).thenReturn(false);
        when(repository.findJob(JOB_ID)).thenReturn(Optional.of(job(1_000, JobStatus.COMPLETED)));

        JobRunResult result = executor().run(JOB_ID, new AtomicBoolean(false));

        assertEquals(JobStatus.COMPLETED, result.status());
        assertThat(provider.calls()).isEmpty();
        verify(repository, never()).finishRun(anyString(), any(JobStatus.class), any(), any(Instant.class));
        verify(repository, never()).updateProgress(anyString(), any(Checkpoint.class), any(), anyInt(), anyInt());
    }

    private JobExecutor executor() {
        return new JobExecutor(repository, checkpointStore, leadSink, provider, new LeadFingerprinter(), properties);
    }

    private void stubJob(int target, List<PlannedArea> plan) {
        when(repository.claimForRun(eq(JOB_ID), any(Instant.class))).thenReturn(true);
        when(repository.findJob(JOB_ID)).thenReturn(Optional.of(job(target, JobStatus.RUNNING)));
        when(repository.findPlannedAreas(JOB_ID)).thenReturn(plan);
    }

    private ScrapeJob job(int target, JobStatus status) {
        Instant now = Instant.now();
        return new ScrapeJob(
            JOB_ID, "client-a", "plombier", "FR", 0, 3, target, status,
            0, 0, null, 0, 0, 3, 0.0, 0, 0, 0, 0.0, null,
            now, now, now, null
        );
    }

    private List<PlannedArea> highAreas(String... names) {
        List<PlannedArea> plan = new ArrayList<>();
        long population = 900_000L;
        for (String name : names) {
            Area area = new Area(name, "FR", null, population, AreaTier.HIGH);
            plan.add(new PlannedArea(plan.size(), area, area.pageBudget()));
            population -= 10_000L;
        }
        return plan;
    }
}
