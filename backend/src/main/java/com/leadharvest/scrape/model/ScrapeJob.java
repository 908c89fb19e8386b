package com.leadharvest.scrape.model;

import java.time.Instant;

public record ScrapeJob(
    String jobId,
    String clientId,
    String query,
    String country,
    int minPopulation,
    int maxPriority,
    int targetLeadCount,
    JobStatus status,
    int currentAreaIndex,
    int currentPage,
    String currentArea,
    int leadsFound,
    int areasCompleted,
    int areasTotal,
    double progressPct,
    int apiCalls,
    int retryCount,
    int estimatedLeads,
    double costEstimate,
    String lastError,
    Instant createdAt,
    Instant updatedAt,
    Instant startedAt,
    Instant finishedAt
) {
    public static double progressOf(JobStatus status, int areasCompleted, int areasTotal, int leadsFound, int target) {
        if (status == JobStatus.COMPLETED) {
            return 100.0;
        }
        double byAreas = areasTotal <= 0 ? 0.0 : (areasCompleted * 100.0) / areasTotal;
        double byLeads = target <= 0 ? 0.0 : (leadsFound * 100.0) / target;
        double pct = Math.min(100.0, Math.max(byAreas, byLeads));
        return Math.round(pct * 10.0) / 10.0;
    }
}
