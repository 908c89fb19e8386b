package com.leadharvest.scrape.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CatalogSummary(
    int areaCount,
    List<String> countries,
    Map<AreaTier, Integer> tierCounts,
    Instant loadedAt
) {
}
