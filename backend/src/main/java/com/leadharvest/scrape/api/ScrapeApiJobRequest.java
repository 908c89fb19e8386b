package com.leadharvest.scrape.api;

public record ScrapeApiJobRequest(
    String query,
    String country,
    Integer minPopulation,
    Integer maxPriority,
    Integer targetLeadCount,
    String clientId,
    Boolean start
) {
}
