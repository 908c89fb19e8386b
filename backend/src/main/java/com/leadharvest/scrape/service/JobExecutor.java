package com.leadharvest.scrape.service;

import com.leadharvest.config.HarvestProperties;
import com.leadharvest.scrape.dedup.LeadFingerprinter;
import com.leadharvest.scrape.model.Area;
import com.leadharvest.scrape.model.Checkpoint;
import com.leadharvest.scrape.model.JobErrorEntry;
import com.leadharvest.scrape.model.JobErrorKind;
import com.leadharvest.scrape.model.JobRunResult;
import com.leadharvest.scrape.model.JobStatus;
import com.leadharvest.scrape.model.Lead;
import com.leadharvest.scrape.model.PlannedArea;
import com.leadharvest.scrape.model.RawListing;
import com.leadharvest.scrape.model.ScrapeJob;
import com.leadharvest.scrape.model.SearchPage;
import com.leadharvest.scrape.persistence.CheckpointStore;
import com.leadharvest.scrape.persistence.LeadSink;
import com.leadharvest.scrape.persistence.ScrapeJobJdbcRepository;
import com.leadharvest.scrape.persistence.StorageWriteException;
import com.leadharvest.scrape.provider.SearchProvider;
import com.leadharvest.scrape.provider.SearchProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Drives one job through its plan, area by area and page by page.
 *
 * <p>After every page the leads are committed first and the checkpoint second,
 * so a crash can only lose the position of work that is already stored and a
 * resume re-inserts nothing thanks to fingerprint uniqueness. The cancel flag is
 * polled at page boundaries. No exception escapes {@link #run}; every outcome is
 * reported through the job row and the returned {@link JobRunResult}.
 */
@Service
public class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final ScrapeJobJdbcRepository jobRepository;
    private final CheckpointStore checkpointStore;
    private final LeadSink leadSink;
    private final SearchProvider searchProvider;
    private final LeadFingerprinter fingerprinter;
    private final HarvestProperties properties;

    public JobExecutor(
        ScrapeJobJdbcRepository jobRepository,
        CheckpointStore checkpointStore,
        LeadSink leadSink,
        SearchProvider searchProvider,
        LeadFingerprinter fingerprinter,
        HarvestProperties properties
    ) {
        this.jobRepository = jobRepository;
        this.checkpointStore = checkpointStore;
        this.leadSink = leadSink;
        this.searchProvider = searchProvider;
        this.fingerprinter = fingerprinter;
        this.properties = properties;
    }

    public JobRunResult run(String jobId, AtomicBoolean cancelRequested) {
        RunState state = null;
        try {
            if (!jobRepository.claimForRun(jobId, Instant.now())) {
                JobStatus current = jobRepository.findJob(jobId).map(ScrapeJob::status).orElse(null);
                log.info("Job {} not claimable in status {}", jobId, current);
                return JobRunResult.notClaimed(jobId, current);
            }
            ScrapeJob job = jobRepository.findJob(jobId)
                .orElseThrow(() -> new IllegalStateException("job row vanished after claim: " + jobId));
            List<PlannedArea> plan = jobRepository.findPlannedAreas(jobId);
            Checkpoint checkpoint = startingCheckpoint(job);
            state = new RunState(job, plan, checkpoint);
            log.info(
                "Job {} running from area {}/{} page {} with {} leads",
                jobId,
                checkpoint.currentAreaIndex(),
                plan.size(),
                checkpoint.currentPage(),
                checkpoint.leadsFound()
            );
            return execute(state, cancelRequested);
        } catch (StorageWriteException e) {
            log.error("Job {} failed on storage", jobId, e);
            return fail(state, jobId, JobErrorKind.STORAGE, "storage: " + rootMessage(e));
        } catch (RuntimeException e) {
            log.error("Job {} failed unexpectedly", jobId, e);
            return fail(state, jobId, JobErrorKind.UNEXPECTED,
                "unexpected: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private JobRunResult execute(RunState state, AtomicBoolean cancelRequested) {
        int target = state.job.targetLeadCount();
        int earlyExit = properties.getPagination().getEarlyExitThreshold();
        int pageSize = searchProvider.pageSize();

        while (state.checkpoint.currentAreaIndex() < state.plan.size()) {
            if (state.checkpoint.leadsFound() >= target) {
                return complete(state, "target reached");
            }
            PlannedArea planned = state.plan.get(state.checkpoint.currentAreaIndex());
            Area area = planned.area();
            state.currentArea = area.name();

            if (!isUsable(planned)) {
                String message = "area at index " + planned.position() + " is missing required data";
                log.warn("Job {} skipping {}: {}", state.jobId(), area.name(), message);
                recordError(state, area.name(), null, JobErrorKind.AREA_DATA, message);
                state.checkpoint = state.checkpoint.nextArea(state.checkpoint.leadsFound());
                commitCheckpoint(state);
                continue;
            }

            int budget = planned.pageBudget();
            if (state.checkpoint.currentPage() >= budget) {
                state.checkpoint = state.checkpoint.nextArea(state.checkpoint.leadsFound());
                commitCheckpoint(state);
                continue;
            }

            for (int page = state.checkpoint.currentPage() + 1; page <= budget; page++) {
                if (cancelRequested.get() || Thread.currentThread().isInterrupted()) {
                    return pause(state);
                }

                SearchPage result;
                try {
                    result = searchWithRetry(state, area, page, cancelRequested);
                } catch (RunInterrupted e) {
                    return pause(state);
                } catch (SearchProviderException e) {
                    String message = "provider: " + e.getMessage();
                    log.error("Job {} provider failure on {} page {}: {}", state.jobId(), area.name(), page, e.getMessage());
                    recordError(state, area.name(), page, JobErrorKind.FATAL, e.getMessage());
                    return fail(state, state.jobId(), null, message);
                }
                state.pagesFetched++;

                List<Lead> leads = toLeads(state, area, result.results());
                int inserted = withStorageRetry(state, "lead write", () -> leadSink.upsertMany(leads));
                int leadsFound = state.checkpoint.leadsFound() + inserted;

                int n = result.size();
                boolean areaDone = n == 0
                    || (n < earlyExit && n < pageSize)
                    || !result.hasMore()
                    || page >= budget;
                state.checkpoint = areaDone
                    ? state.checkpoint.nextArea(leadsFound)
                    : state.checkpoint.atPage(page, leadsFound);
                commitCheckpoint(state);

                log.info(
                    "Job {} {} page {}/{}: {} results, {} new, {} total{}",
                    state.jobId(),
                    area.name(),
                    page,
                    budget,
                    n,
                    inserted,
                    leadsFound,
                    areaDone ? ", area done" : ""
                );
                if (leadsFound >= target) {
                    return complete(state, "target reached");
                }
                if (areaDone) {
                    break;
                }
            }
        }
        return complete(state, "plan exhausted");
    }

    private SearchPage searchWithRetry(RunState state, Area area, int page, AtomicBoolean cancelRequested)
        throws SearchProviderException, RunInterrupted {
        int maxAttempts = properties.getRetry().getMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            state.apiCalls++;
            try {
                return searchProvider.search(state.job.query(), area, page);
            } catch (SearchProviderException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new RunInterrupted();
                }
                if (!e.isTransient()) {
                    throw e;
                }
                recordError(state, area.name(), page, JobErrorKind.TRANSIENT, e.getMessage());
                if (attempt >= maxAttempts) {
                    throw new SearchProviderException(
                        SearchProviderException.Kind.FATAL,
                        "transient retries exhausted after " + attempt + " attempts: " + e.getMessage(),
                        e.httpStatus(),
                        e
                    );
                }
                if (cancelRequested.get()) {
                    throw new RunInterrupted();
                }
                state.retryCount++;
                log.warn(
                    "Job {} transient provider error on {} page {} (attempt {}/{}): {}",
                    state.jobId(),
                    area.name(),
                    page,
                    attempt,
                    maxAttempts,
                    e.getMessage()
                );
                if (!sleepBackoff(attempt)) {
                    throw new RunInterrupted();
                }
            }
        }
    }

    private List<Lead> toLeads(RunState state, Area area, List<RawListing> listings) {
        List<Lead> leads = new ArrayList<>(listings.size());
        String source = searchProvider.sourceName();
        for (RawListing listing : listings) {
            Lead lead = fingerprinter.toLead(
                listing,
                area,
                state.job.clientId(),
                state.jobId(),
                state.job.query(),
                source
            );
            if (lead == null) {
                state.rejectedListings++;
                log.debug("Job {} dropped listing without company name in {}", state.jobId(), area.name());
                continue;
            }
            leads.add(lead);
        }
        return leads;
    }

    private Checkpoint startingCheckpoint(ScrapeJob job) {
        Optional<Checkpoint> stored = checkpointStore.load(job.jobId());
        if (stored.isEmpty()) {
            Checkpoint initial = Checkpoint.initial(job.jobId());
            withStorageRetry(null, "initial checkpoint", () -> {
                checkpointStore.save(job.jobId(), initial);
                return null;
            });
            return initial;
        }
        Checkpoint checkpoint = stored.get();
        if (checkpoint.currentPage() > 0 && properties.getJobs().isRestartInFlightArea()) {
            return checkpoint.restartArea();
        }
        return checkpoint;
    }

    private void commitCheckpoint(RunState state) {
        withStorageRetry(state, "checkpoint", () -> {
            checkpointStore.save(state.jobId(), state.checkpoint);
            return null;
        });
        state.committed = state.checkpoint;
        withStorageRetry(state, "progress", () -> {
            jobRepository.updateProgress(
                state.jobId(),
                state.committed,
                state.currentArea,
                state.apiCalls,
                state.retryCount
            );
            return null;
        });
    }

    private <T> T withStorageRetry(RunState state, String what, Supplier<T> action) {
        int maxAttempts = properties.getStorage().getMaxAttempts();
        long delayMs = properties.getStorage().getRetryDelayMs();
        StorageWriteException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (StorageWriteException e) {
                last = e;
                log.warn(
                    "Job {} {} failed (attempt {}/{}): {}",
                    state == null ? "-" : state.jobId(),
                    what,
                    attempt,
                    maxAttempts,
                    rootMessage(e)
                );
                if (attempt < maxAttempts && !sleepQuietly(delayMs)) {
                    break;
                }
            }
        }
        throw last;
    }

    private JobRunResult complete(RunState state, String reason) {
        log.info(
            "Job {} completed ({}): {} leads, {} areas, {} pages fetched, {} listings rejected",
            state.jobId(),
            reason,
            state.checkpoint.leadsFound(),
            state.checkpoint.areasCompleted(),
            state.pagesFetched,
            state.rejectedListings
        );
        commitCheckpoint(state);
        finishRun(state, JobStatus.COMPLETED);
        return state.result(JobStatus.COMPLETED, null);
    }

    private JobRunResult pause(RunState state) {
        boolean interrupted = Thread.interrupted();
        try {
            commitCheckpoint(state);
            finishRun(state, JobStatus.PAUSED);
            log.info(
                "Job {} paused at area {} page {} with {} leads",
                state.jobId(),
                state.checkpoint.currentAreaIndex(),
                state.checkpoint.currentPage(),
                state.checkpoint.leadsFound()
            );
            return state.result(JobStatus.PAUSED, null);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void finishRun(RunState state, JobStatus status) {
        withStorageRetry(state, "status " + status, () -> {
            jobRepository.finishRun(state.jobId(), status, null, Instant.now());
            return null;
        });
    }

    private JobRunResult fail(RunState state, String jobId, JobErrorKind kind, String message) {
        boolean interrupted = Thread.interrupted();
        try {
            if (kind != null && state != null) {
                recordError(state, state.currentArea, null, kind, message);
            }
            if (state != null) {
                // report the durable position, not one whose checkpoint write failed
                state.checkpoint = state.committed;
                try {
                    jobRepository.updateProgress(jobId, state.checkpoint, state.currentArea, state.apiCalls, state.retryCount);
                } catch (RuntimeException e) {
                    log.warn("Job {} progress not saved while failing", jobId, e);
                }
            }
            try {
                jobRepository.finishRun(jobId, JobStatus.FAILED, message, Instant.now());
            } catch (RuntimeException e) {
                log.error("Job {} could not be marked FAILED: {}", jobId, message, e);
            }
            log.warn("Job {} failed: {}", jobId, message);
            if (state == null) {
                return new JobRunResult(jobId, JobStatus.FAILED, 0, 0, 0, 0, message);
            }
            return state.result(JobStatus.FAILED, message);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void recordError(RunState state, String areaName, Integer page, JobErrorKind kind, String message) {
        try {
            jobRepository.insertError(new JobErrorEntry(state.jobId(), areaName, page, kind, message, Instant.now()));
        } catch (DataAccessException e) {
            log.warn("Job {} error trail write failed", state.jobId(), e);
        }
    }

    private boolean isUsable(PlannedArea planned) {
        Area area = planned.area();
        return area != null
            && area.name() != null && !area.name().isBlank()
            && area.country() != null && !area.country().isBlank()
            && planned.pageBudget() > 0;
    }

    private boolean sleepBackoff(int attempt) {
        long base = properties.getRetry().getBaseDelayMs();
        long max = properties.getRetry().getMaxDelayMs();
        long delay = Math.min(max, base * (1L << Math.min(20, attempt - 1)));
        long jitter = delay <= 1 ? 0 : ThreadLocalRandom.current().nextLong(delay / 2 + 1);
        return sleepQuietly(delay / 2 + jitter);
    }

    private boolean sleepQuietly(long millis) {
        if (millis <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.toString() : current.getMessage();
    }

    private static final class RunInterrupted extends Exception {
        private RunInterrupted() {
            super(null, null, false, false);
        }
    }

    private static final class RunState {
        private final ScrapeJob job;
        private final List<PlannedArea> plan;
        private Checkpoint checkpoint;
        private Checkpoint committed;
        private String currentArea;
        private int apiCalls;
        private int retryCount;
        private int pagesFetched;
        private int rejectedListings;

        private RunState(ScrapeJob job, List<PlannedArea> plan, Checkpoint checkpoint) {
            this.job = job;
            this.plan = plan;
            this.checkpoint = checkpoint;
            this.committed = checkpoint;
            this.currentArea = job.currentArea();
            this.apiCalls = job.apiCalls();
            this.retryCount = job.retryCount();
        }

        private String jobId() {
            return job.jobId();
        }

        private JobRunResult result(JobStatus status, String lastError) {
            return new JobRunResult(
                job.jobId(),
                status,
                checkpoint.leadsFound(),
                checkpoint.areasCompleted(),
                pagesFetched,
                retryCount,
                lastError
            );
        }
    }
}
