package com.leadharvest.scrape.model;

import java.time.Instant;

public record JobErrorEntry(
    String jobId,
    String areaName,
    Integer page,
    JobErrorKind kind,
    String message,
    Instant observedAt
) {
}
