package com.leadharvest.scrape.catalog;

import com.leadharvest.scrape.model.Area;
import com.leadharvest.scrape.model.AreaLoadSummary;
import com.leadharvest.scrape.model.AreaTier;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads area reference data from a CSV with a header row. Recognised columns are
 * {@code name} (or {@code city}), {@code country}, {@code region}, {@code population}
 * and an optional {@code tier} override.
 */
@Component
public class AreaCsvLoader {
    private static final Logger log = LoggerFactory.getLogger(AreaCsvLoader.class);
    private static final int MAX_SAMPLE_ERRORS = 20;

    private final ResourceLoader resourceLoader;

    public AreaCsvLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public LoadedAreas load(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IOException("area csv not found at " + location);
        }
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            return parse(location, reader);
        }
    }

    LoadedAreas parse(String location, Reader reader) throws IOException {
        List<Area> areas = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int rows = 0;
        int errorCount = 0;
        try (CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                rows++;
                String name = getColumn(record, "name", "city");
                String country = getColumn(record, "country");
                if (name == null || country == null) {
                    errorCount++;
                    if (errors.size() < MAX_SAMPLE_ERRORS) {
                        errors.add("csv row " + record.getRecordNumber() + " missing name or country");
                    }
                    continue;
                }
                areas.add(new Area(
                    name,
                    country,
                    getColumn(record, "region", "department"),
                    parsePopulation(getColumn(record, "population")),
                    AreaTier.parse(getColumn(record, "tier"))
                ));
            }
        }
        if (errorCount > 0) {
            log.warn("Area csv {} had {} rejected rows, first: {}", location, errorCount, errors.get(0));
        }
        return new LoadedAreas(
            areas,
            new AreaLoadSummary(location, rows, areas.size(), errorCount, List.copyOf(errors))
        );
    }

    private Long parsePopulation(String raw) {
        if (raw == null) {
            return null;
        }
        String digits = raw.replace("_", "").replace(",", "").replace(" ", "");
        try {
            long value = Long.parseLong(digits);
            return value < 0 ? null : value;
        } catch (NumberFormatException e) {
            log.debug("Unparsable population '{}' treated as unknown", raw);
            return null;
        }
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header == null) {
                    continue;
                }
                if (header.trim().equalsIgnoreCase(name)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    public record LoadedAreas(List<Area> areas, AreaLoadSummary summary) {
    }
}
