package com.leadharvest.scrape.provider;

import com.leadharvest.scrape.model.Area;
import com.leadharvest.scrape.model.SearchPage;

/**
 * Paginated places search. Pages are 1-based; a page past the available data
 * returns an empty result rather than an error.
 */
public interface SearchProvider {

    SearchPage search(String query, Area area, int page) throws SearchProviderException;

    /** Maximum results a single page can carry. */
    int pageSize();

    /** Value stored as the lead source and mixed into fingerprints. */
    String sourceName();
}
