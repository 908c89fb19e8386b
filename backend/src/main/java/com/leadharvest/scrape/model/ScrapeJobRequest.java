package com.leadharvest.scrape.model;

public record ScrapeJobRequest(
    String query,
    String country,
    int minPopulation,
    int maxPriority,
    int targetLeadCount,
    String clientId,
    boolean start
) {
}
