package com.leadharvest.scrape.service;

import com.leadharvest.config.HarvestProperties;
import com.leadharvest.scrape.model.JobErrorEntry;
import com.leadharvest.scrape.model.JobRunResult;
import com.leadharvest.scrape.model.JobStatus;
import com.leadharvest.scrape.model.LeadCount;
import com.leadharvest.scrape.model.PlannedArea;
import com.leadharvest.scrape.model.ScrapeJob;
import com.leadharvest.scrape.model.ScrapeJobPlan;
import com.leadharvest.scrape.model.ScrapeJobRequest;
import com.leadharvest.scrape.persistence.LeadJdbcRepository;
import com.leadharvest.scrape.persistence.ScrapeJobJdbcRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Control surface for scrape jobs: submit, status, pause, resume and list.
 * Runs are dispatched onto the {@code scrapeJobExecutor}; at most one run per job
 * is in flight in this process.
 */
@Service
public class ScrapeJobService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeJobService.class);

    private final JobPlanner planner;
    private final JobExecutor executor;
    private final ScrapeJobJdbcRepository repository;
    private final LeadJdbcRepository leadRepository;
    private final HarvestProperties properties;
    private final ExecutorService jobExecutor;
    private final Map<String, AtomicBoolean> activeRuns = new ConcurrentHashMap<>();

    public ScrapeJobService(
        JobPlanner planner,
        JobExecutor executor,
        ScrapeJobJdbcRepository repository,
        LeadJdbcRepository leadRepository,
        HarvestProperties properties,
        @Qualifier("scrapeJobExecutor") ExecutorService jobExecutor
    ) {
        this.planner = planner;
        this.executor = executor;
        this.repository = repository;
        this.leadRepository = leadRepository;
        this.properties = properties;
        this.jobExecutor = jobExecutor;
    }

    public ScrapeJobPlan preview(ScrapeJobRequest request) {
        return planner.plan(
            request.query(),
            request.country(),
            request.minPopulation(),
            request.maxPriority(),
            request.targetLeadCount()
        );
    }

    public ScrapeJob submit(ScrapeJobRequest request) {
        ScrapeJobPlan plan = preview(request);
        String jobId = UUID.randomUUID().toString();
        ScrapeJobRequest normalized = new ScrapeJobRequest(
            request.query().trim(),
            request.country().trim(),
            Math.max(0, request.minPopulation()),
            request.maxPriority(),
            request.targetLeadCount(),
            HarvestProperties.normalizeClientId(
                request.clientId() == null ? properties.getJobs().getDefaultClientId() : request.clientId()
            ),
            request.start()
        );
        repository.insertJob(jobId, normalized, plan, Instant.now());
        log.info(
            "Submitted job {} for client {}: '{}' in {} over {} areas, target {}",
            jobId,
            normalized.clientId(),
            normalized.query(),
            normalized.country(),
            plan.areas().size(),
            normalized.targetLeadCount()
        );
        if (request.start()) {
            dispatch(jobId);
        }
        return status(jobId);
    }

    public ScrapeJob status(String jobId) {
        return repository.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<ScrapeJob> list(JobStatus status, String clientId, Integer limit) {
        int safeLimit = limit == null ? properties.getJobs().getListDefaultLimit() : Math.max(1, Math.min(limit, 500));
        return repository.findJobs(status, clientId, safeLimit);
    }

    public List<PlannedArea> plannedAreas(String jobId) {
        status(jobId);
        return repository.findPlannedAreas(jobId);
    }

    public List<JobErrorEntry> errors(String jobId, Integer limit) {
        status(jobId);
        int safeLimit = limit == null ? properties.getJobs().getErrorListLimit() : Math.max(1, limit);
        return repository.findErrors(jobId, safeLimit);
    }

    public LeadCount leadCount(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId is required");
        }
        String normalized = HarvestProperties.normalizeClientId(clientId);
        return new LeadCount(normalized, null, leadRepository.countByClient(normalized));
    }

    public LeadCount jobLeadCount(String jobId) {
        ScrapeJob job = status(jobId);
        return new LeadCount(job.clientId(), jobId, leadRepository.countByJob(jobId));
    }

    /**
     * Requests a cooperative pause. The job reaches PAUSED at its next page boundary.
     */
    public ScrapeJob pause(String jobId) {
        ScrapeJob job = status(jobId);
        AtomicBoolean cancel = activeRuns.get(jobId);
        if (cancel == null) {
            throw new JobStateException("job " + jobId + " is " + job.status() + " and not running in this process");
        }
        cancel.set(true);
        log.info("Pause requested for job {}", jobId);
        return status(jobId);
    }

    public ScrapeJob resume(String jobId) {
        ScrapeJob job = status(jobId);
        if (!job.status().isResumable()) {
            throw new JobStateException("job " + jobId + " is " + job.status() + " and cannot be resumed");
        }
        if (activeRuns.containsKey(jobId)) {
            throw new JobStateException("job " + jobId + " already has a run in progress");
        }
        dispatch(jobId);
        log.info("Resume dispatched for job {}", jobId);
        return status(jobId);
    }

    public boolean isActive(String jobId) {
        return activeRuns.containsKey(jobId);
    }

    @PreDestroy
    public void pauseAllOnShutdown() {
        for (Map.Entry<String, AtomicBoolean> entry : activeRuns.entrySet()) {
            entry.getValue().set(true);
            log.info("Shutdown requested pause for job {}", entry.getKey());
        }
    }

    private void dispatch(String jobId) {
        AtomicBoolean cancel = new AtomicBoolean(false);
        if (activeRuns.putIfAbsent(jobId, cancel) != null) {
            throw new JobStateException("job " + jobId + " already has a run in progress");
        }
        try {
            jobExecutor.submit(() -> runAndRelease(jobId, cancel));
        } catch (RejectedExecutionException e) {
            activeRuns.remove(jobId, cancel);
            throw new JobStateException("job executor is not accepting work: " + e.getMessage());
        }
    }

    private void runAndRelease(String jobId, AtomicBoolean cancel) {
        try {
            JobRunResult result = executor.run(jobId, cancel);
            log.info(
                "Job {} run ended {}: leads={}, areas={}, pages={}, retries={}",
                result.jobId(),
                result.status(),
                result.leadsFound(),
                result.areasCompleted(),
                result.pagesFetched(),
                result.retries()
            );
        } finally {
            activeRuns.remove(jobId, cancel);
        }
    }
}
