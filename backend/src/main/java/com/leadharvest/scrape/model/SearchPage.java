package com.leadharvest.scrape.model;

import java.util.List;

public record SearchPage(List<RawListing> results, boolean hasMore) {
    public SearchPage {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public int size() {
        return results.size();
    }

    public static SearchPage empty() {
        return new SearchPage(List.of(), false);
    }
}
