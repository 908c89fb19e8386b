package com.leadharvest.scrape.model;

import java.util.List;

public record AreaLoadSummary(
    String location,
    int rowsRead,
    int areasLoaded,
    int errorsCount,
    List<String> sampleErrors
) {
}
