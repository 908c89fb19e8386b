package com.leadharvest.scrape.model;

public record Area(
    String name,
    String country,
    String region,
    Long population,
    AreaTier tier
) {
    public int pageBudget() {
        return tier == null ? 0 : tier.pageBudget();
    }

    public Area withTier(AreaTier resolved) {
        return new Area(name, country, region, population, resolved);
    }

    public boolean hasRequiredFields() {
        return name != null && !name.isBlank()
            && country != null && !country.isBlank()
            && pageBudget() > 0;
    }
}
