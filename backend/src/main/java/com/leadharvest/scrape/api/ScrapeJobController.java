package com.leadharvest.scrape.api;

import com.leadharvest.config.HarvestProperties;
import com.leadharvest.scrape.catalog.AreaCatalog;
import com.leadharvest.scrape.catalog.AreaCatalogBootstrap;
import com.leadharvest.scrape.model.AreaLoadSummary;
import com.leadharvest.scrape.model.CatalogSummary;
import com.leadharvest.scrape.model.JobErrorEntry;
import com.leadharvest.scrape.model.JobStatus;
import com.leadharvest.scrape.model.LeadCount;
import com.leadharvest.scrape.model.PlannedArea;
import com.leadharvest.scrape.model.ScrapeJob;
import com.leadharvest.scrape.model.ScrapeJobPlan;
import com.leadharvest.scrape.model.ScrapeJobRequest;
import com.leadharvest.scrape.service.ScrapeJobService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.SERVICE_UNAVAILABLE;

@RestController
@RequestMapping("/api")
public class ScrapeJobController {
    private final ScrapeJobService jobService;
    private final AreaCatalog areaCatalog;
    private final AreaCatalogBootstrap catalogBootstrap;
    private final HarvestProperties properties;

    public ScrapeJobController(
        ScrapeJobService jobService,
        AreaCatalog areaCatalog,
        AreaCatalogBootstrap catalogBootstrap,
        HarvestProperties properties
    ) {
        this.jobService = jobService;
        this.areaCatalog = areaCatalog;
        this.catalogBootstrap = catalogBootstrap;
        this.properties = properties;
    }

    @PostMapping("/jobs")
    @ResponseStatus(HttpStatus.CREATED)
    public ScrapeJob submit(@RequestBody ScrapeApiJobRequest request) {
        return jobService.submit(toRequest(request));
    }

    @PostMapping("/jobs/preview")
    public ScrapeJobPlan preview(@RequestBody ScrapeApiJobRequest request) {
        return jobService.preview(toRequest(request));
    }

    @GetMapping("/jobs")
    public List<ScrapeJob> list(
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "clientId", required = false) String clientId,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return jobService.list(parseStatus(status), clientId, limit);
    }

    @GetMapping("/jobs/{jobId}")
    public ScrapeJob status(@PathVariable("jobId") String jobId) {
        return jobService.status(jobId);
    }

    @GetMapping("/jobs/{jobId}/areas")
    public List<PlannedArea> areas(@PathVariable("jobId") String jobId) {
        return jobService.plannedAreas(jobId);
    }

    @GetMapping("/jobs/{jobId}/errors")
    public List<JobErrorEntry> errors(
        @PathVariable("jobId") String jobId,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return jobService.errors(jobId, limit);
    }

    @GetMapping("/jobs/{jobId}/leads/count")
    public LeadCount jobLeadCount(@PathVariable("jobId") String jobId) {
        return jobService.jobLeadCount(jobId);
    }

    @GetMapping("/leads/count")
    public LeadCount leadCount(@RequestParam(name = "clientId", required = false) String clientId) {
        return jobService.leadCount(clientId);
    }

    @PostMapping("/jobs/{jobId}/pause")
    public ScrapeJob pause(@PathVariable("jobId") String jobId) {
        return jobService.pause(jobId);
    }

    @PostMapping("/jobs/{jobId}/resume")
    public ScrapeJob resume(@PathVariable("jobId") String jobId) {
        return jobService.resume(jobId);
    }

    @GetMapping("/catalog")
    public CatalogSummary catalog() {
        return areaCatalog.summary();
    }

    @PostMapping("/catalog/reload")
    public AreaLoadSummary reloadCatalog() {
        try {
            return catalogBootstrap.reload();
        } catch (IOException e) {
            throw new ResponseStatusException(SERVICE_UNAVAILABLE, "area catalog reload failed: " + e.getMessage(), e);
        }
    }

    private ScrapeJobRequest toRequest(ScrapeApiJobRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "request body is required");
        }
        return new ScrapeJobRequest(
            request.query(),
            request.country(),
            request.minPopulation() == null ? 0 : Math.max(0, request.minPopulation()),
            request.maxPriority() == null ? 3 : request.maxPriority(),
            request.targetLeadCount() == null ? 0 : request.targetLeadCount(),
            request.clientId(),
            request.start() == null ? properties.getJobs().isAutoStart() : request.start()
        );
    }

    private JobStatus parseStatus(String raw) {
        try {
            return JobStatus.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, "unknown status: " + raw);
        }
    }
}
