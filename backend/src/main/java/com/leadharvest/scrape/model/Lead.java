package com.leadharvest.scrape.model;

import java.time.Instant;

public record Lead(
    String fingerprint,
    String clientId,
    String jobId,
    String companyName,
    String areaName,
    String country,
    String address,
    String phone,
    String website,
    Double rating,
    Integer reviewsCount,
    String externalId,
    String sourceQuery,
    String source,
    String rawPayload,
    Instant createdAt
) {
}
