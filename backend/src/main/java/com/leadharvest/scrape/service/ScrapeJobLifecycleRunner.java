package com.leadharvest.scrape.service;

import com.leadharvest.config.HarvestProperties;
import com.leadharvest.scrape.persistence.ScrapeJobJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Jobs left RUNNING by a previous process have no owner after a restart. They
 * are parked as PAUSED so an operator (or auto-resume) can pick them up from
 * their last checkpoint.
 */
@Component
@Order(10)
public class ScrapeJobLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeJobLifecycleRunner.class);
    static final String RESTART_REASON = "interrupted_by_restart";

    private final ScrapeJobJdbcRepository repository;
    private final ScrapeJobService jobService;
    private final HarvestProperties properties;

    public ScrapeJobLifecycleRunner(
        ScrapeJobJdbcRepository repository,
        ScrapeJobService jobService,
        HarvestProperties properties
    ) {
        this.repository = repository;
        this.jobService = jobService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database check failed during startup", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping scrape job recovery because database is unreachable");
            return;
        }
        recoverInterruptedJobs();
    }

    public List<String> recoverInterruptedJobs() {
        List<String> paused = repository.pauseRunningJobs(RESTART_REASON, Instant.now());
        for (String jobId : paused) {
            log.info("Paused job {} left running by a previous process", jobId);
        }
        if (!properties.getJobs().isAutoResumeOnStartup()) {
            return paused;
        }
        for (String jobId : paused) {
            try {
                jobService.resume(jobId);
            } catch (JobStateException e) {
                log.warn("Auto-resume skipped for job {}: {}", jobId, e.getMessage());
            }
        }
        return paused;
    }
}
