package com.leadharvest.scrape.catalog;

import com.leadharvest.config.HarvestProperties;
import com.leadharvest.scrape.model.AreaLoadSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
@Order(0)
public class AreaCatalogBootstrap implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(AreaCatalogBootstrap.class);

    private final AreaCsvLoader loader;
    private final AreaCatalog catalog;
    private final HarvestProperties properties;

    public AreaCatalogBootstrap(AreaCsvLoader loader, AreaCatalog catalog, HarvestProperties properties) {
        this.loader = loader;
        this.catalog = catalog;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCatalog().isLoadOnStartup()) {
            return;
        }
        try {
            reload();
        } catch (IOException e) {
            log.warn("Area catalog not loaded from {}; planning will find no areas",
                properties.getCatalog().getCsvPath(), e);
        }
    }

    public AreaLoadSummary reload() throws IOException {
        String location = properties.getCatalog().getCsvPath();
        AreaCsvLoader.LoadedAreas loaded = loader.load(location);
        catalog.refresh(loaded.areas());
        AreaLoadSummary summary = loaded.summary();
        log.info("Loaded {} areas from {} ({} rows, {} rejected)",
            summary.areasLoaded(), location, summary.rowsRead(), summary.errorsCount());
        return summary;
    }
}
