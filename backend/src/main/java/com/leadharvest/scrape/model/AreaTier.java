package com.leadharvest.scrape.model;

/**
 * Population bands that drive how deep an area is paginated.
 * Lower priority values are visited first; SKIP areas are never planned.
 */
public enum AreaTier {
    HIGH(1, 10, 100_001L),
    MEDIUM(2, 5, 20_000L),
    LOW(3, 2, 5_000L),
    SKIP(4, 0, 0L);

    private final int priority;
    private final int pageBudget;
    private final long minPopulation;

    AreaTier(int priority, int pageBudget, long minPopulation) {
        this.priority = priority;
        this.pageBudget = pageBudget;
        this.minPopulation = minPopulation;
    }

    public int priority() {
        return priority;
    }

    public int pageBudget() {
        return pageBudget;
    }

    /**
     * Smallest population that falls inside this band. Used as the effective
     * population of areas whose population is unknown.
     */
    public long minPopulation() {
        return minPopulation;
    }

    public static AreaTier forPopulation(long population) {
        if (population > 100_000L) {
            return HIGH;
        }
        if (population >= 20_000L) {
            return MEDIUM;
        }
        if (population >= 5_000L) {
            return LOW;
        }
        return SKIP;
    }

    public static AreaTier parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return AreaTier.valueOf(raw.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
