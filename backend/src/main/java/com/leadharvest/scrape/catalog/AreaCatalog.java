package com.leadharvest.scrape.catalog;

import com.leadharvest.config.HarvestProperties;
import com.leadharvest.scrape.model.Area;
import com.leadharvest.scrape.model.AreaTier;
import com.leadharvest.scrape.model.CatalogSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * In-memory snapshot of the areas that can be planned. The snapshot is replaced
 * wholesale on {@link #refresh(Collection)} so readers never observe a partial load.
 */
@Component
public class AreaCatalog {
    private static final Logger log = LoggerFactory.getLogger(AreaCatalog.class);

    static final Comparator<Area> PLAN_ORDER = Comparator
        .comparing((Area area) -> area.population() == null)
        .thenComparing((Area area) -> area.population() == null ? 0L : area.population(), Comparator.<Long>reverseOrder())
        .thenComparing((Area area) -> area.name() == null ? "" : area.name(), String.CASE_INSENSITIVE_ORDER)
        .thenComparing((Area area) -> area.name() == null ? "" : area.name());

    private final HarvestProperties properties;
    private volatile Snapshot snapshot = new Snapshot(List.of(), null);

    public AreaCatalog(HarvestProperties properties) {
        this.properties = properties;
    }

    public AreaTier tier(Long population) {
        if (population == null) {
            return properties.getCatalog().getUnknownPopulationTier();
        }
        return AreaTier.forPopulation(population);
    }

    public AreaTier tierOf(Area area) {
        if (area.tier() != null) {
            return area.tier();
        }
        return tier(area.population());
    }

    public void refresh(Collection<Area> areas) {
        List<Area> resolved = new ArrayList<>(areas.size());
        for (Area area : areas) {
            resolved.add(area.withTier(tierOf(area)));
        }
        snapshot = new Snapshot(List.copyOf(resolved), Instant.now());
        log.info("Area catalog refreshed with {} areas", resolved.size());
    }

    /**
     * Areas of {@code country} eligible for planning, in plan order: population
     * descending with unknown populations last, then name ascending.
     */
    public List<Area> select(String country, long minPopulation, int maxPriority) {
        if (country == null || country.isBlank()) {
            return List.of();
        }
        String wanted = country.trim().toLowerCase(Locale.ROOT);
        List<Area> matches = new ArrayList<>();
        for (Area area : snapshot.areas()) {
            if (area.country() == null || !area.country().trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                continue;
            }
            AreaTier tier = area.tier();
            if (tier == null || tier == AreaTier.SKIP || tier.priority() > maxPriority) {
                continue;
            }
            if (effectivePopulation(area) < minPopulation) {
                continue;
            }
            matches.add(area);
        }
        matches.sort(PLAN_ORDER);
        return matches;
    }

    public int size() {
        return snapshot.areas().size();
    }

    public List<String> countries() {
        return summary().countries();
    }

    public CatalogSummary summary() {
        Snapshot current = snapshot;
        TreeSet<String> countries = new TreeSet<>();
        Map<AreaTier, Integer> tiers = new EnumMap<>(AreaTier.class);
        for (Area area : current.areas()) {
            if (area.country() != null && !area.country().isBlank()) {
                countries.add(area.country().trim());
            }
            tiers.merge(area.tier(), 1, Integer::sum);
        }
        return new CatalogSummary(current.areas().size(), List.copyOf(countries), tiers, current.loadedAt());
    }

    private long effectivePopulation(Area area) {
        if (area.population() != null) {
            return area.population();
        }
        return area.tier().minPopulation();
    }

    private record Snapshot(List<Area> areas, Instant loadedAt) {
    }
}
