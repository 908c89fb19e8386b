package com.leadharvest.scrape.model;

public record LeadCount(String clientId, String jobId, long count) {
}
