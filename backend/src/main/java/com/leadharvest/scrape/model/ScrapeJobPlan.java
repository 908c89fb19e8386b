package com.leadharvest.scrape.model;

import java.util.List;

public record ScrapeJobPlan(
    List<PlannedArea> areas,
    int candidateAreas,
    int totalPages,
    int estimatedLeads,
    double estimatedCost,
    boolean truncated
) {
    public ScrapeJobPlan {
        areas = areas == null ? List.of() : List.copyOf(areas);
    }

    public boolean isEmpty() {
        return areas.isEmpty();
    }
}
