package com.leadharvest.scrape.service;

import com.leadharvest.config.HarvestProperties;
import com.leadharvest.scrape.catalog.AreaCatalog;
import com.leadharvest.scrape.model.Area;
import com.leadharvest.scrape.model.PlannedArea;
import com.leadharvest.scrape.model.ScrapeJobPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a job request into an ordered list of areas with page budgets.
 *
 * <p>Areas are taken in catalog order while the projected yield
 * (pages x leads per page) stays within {@code target x safetyFactor}. The first
 * area is always taken so a non-empty selection never yields an empty plan.
 * Identical inputs over the same catalog snapshot produce identical plans.
 */
@Service
public class JobPlanner {
    private static final Logger log = LoggerFactory.getLogger(JobPlanner.class);

    private final AreaCatalog catalog;
    private final HarvestProperties properties;

    public JobPlanner(AreaCatalog catalog, HarvestProperties properties) {
        this.catalog = catalog;
        this.properties = properties;
    }

    public ScrapeJobPlan plan(String query, String country, int minPopulation, int maxPriority, int targetLeadCount) {
        validate(query, country, maxPriority, targetLeadCount);

        int leadsPerPage = properties.getPlanner().getLeadsPerPage();
        double ceiling = targetLeadCount * properties.getPlanner().getSafetyFactor();
        List<Area> candidates = catalog.select(country, Math.max(0, minPopulation), maxPriority);

        List<PlannedArea> planned = new ArrayList<>();
        long projected = 0;
        int totalPages = 0;
        boolean truncated = false;
        for (Area area : candidates) {
            int budget = area.pageBudget();
            long next = projected + (long) budget * leadsPerPage;
            if (!planned.isEmpty() && next > ceiling) {
                truncated = true;
                break;
            }
            planned.add(new PlannedArea(planned.size(), area, budget));
            projected = next;
            totalPages += budget;
        }

        int estimatedLeads = totalPages * leadsPerPage;
        double estimatedCost = totalPages * properties.getPlanner().getCostPerPage();
        log.info(
            "Planned '{}' in {}: {} of {} candidate areas, {} pages, ~{} leads, cost {}",
            query,
            country,
            planned.size(),
            candidates.size(),
            totalPages,
            estimatedLeads,
            String.format(java.util.Locale.ROOT, "%.4f", estimatedCost)
        );
        return new ScrapeJobPlan(planned, candidates.size(), totalPages, estimatedLeads, estimatedCost, truncated);
    }

    private void validate(String query, String country, int maxPriority, int targetLeadCount) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        if (country == null || country.isBlank()) {
            throw new IllegalArgumentException("country is required");
        }
        if (maxPriority < 1 || maxPriority > 3) {
            throw new IllegalArgumentException("maxPriority must be between 1 and 3");
        }
        if (targetLeadCount < 1) {
            throw new IllegalArgumentException("targetLeadCount must be positive");
        }
    }
}
