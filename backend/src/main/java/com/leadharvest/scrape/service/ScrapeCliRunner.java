package com.leadharvest.scrape.service;

import com.leadharvest.config.HarvestProperties;
import com.leadharvest.scrape.model.ScrapeJob;
import com.leadharvest.scrape.model.ScrapeJobRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(20)
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final HarvestProperties properties;
    private final ScrapeJobService jobService;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        HarvestProperties properties,
        ScrapeJobService jobService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.jobService = jobService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        HarvestProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        ScrapeJobRequest request = new ScrapeJobRequest(
            cli.getQuery(),
            cli.getCountry(),
            cli.getMinPopulation(),
            cli.getMaxPriority(),
            cli.getTargetLeadCount(),
            cli.getClientId(),
            true
        );
        ScrapeJob job = jobService.submit(request);
        log.info("CLI job {} submitted over {} areas, estimated cost {}", job.jobId(), job.areasTotal(), job.costEstimate());

        while (jobService.isActive(job.jobId())) {
            Thread.sleep(cli.getPollIntervalMs());
            job = jobService.status(job.jobId());
            log.info(
                "CLI job {} {}: {}% leads={} areas={}/{}",
                job.jobId(),
                job.status(),
                job.progressPct(),
                job.leadsFound(),
                job.areasCompleted(),
                job.areasTotal()
            );
        }
        job = jobService.status(job.jobId());
        log.info(
            "CLI job {} finished with status {}: leads={}, apiCalls={}, retries={}, lastError={}",
            job.jobId(),
            job.status(),
            job.leadsFound(),
            job.apiCalls(),
            job.retryCount(),
            job.lastError()
        );

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
