package com.leadharvest.scrape.model;

public record RawListing(
    String companyName,
    String address,
    String phone,
    String website,
    Double rating,
    Integer reviewsCount,
    String externalId,
    String rawPayload
) {
}
