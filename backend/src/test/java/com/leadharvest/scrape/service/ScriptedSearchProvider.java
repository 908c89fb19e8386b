package com.leadharvest.scrape.service;

import com.leadharvest.scrape.model.Area;
import com.leadharvest.scrape.model.RawListing;
import com.leadharvest.scrape.model.SearchPage;
import com.leadharvest.scrape.provider.SearchProvider;
import com.leadharvest.scrape.provider.SearchProviderException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.IntConsumer;

/**
 * Search provider whose answers are queued per (area, page). Unscripted pages
 * return an empty result.
 */
class ScriptedSearchProvider implements SearchProvider {
    private final Map<String, Deque<Object>> script = new ConcurrentHashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final int pageSize;
    private volatile IntConsumer onCall = callNumber -> {
    };

    ScriptedSearchProvider() {
        this(20);
    }

    ScriptedSearchProvider(int pageSize) {
        this.pageSize = pageSize;
    }

    ScriptedSearchProvider page(String area, int page, int results, boolean hasMore) {
        return answer(area, page, new SearchPage(listings(area, page, results), hasMore));
    }

    ScriptedSearchProvider fail(String area, int page, SearchProviderException.Kind kind) {
        return answer(area, page, new SearchProviderException(kind, kind.name().toLowerCase() + " on " + area));
    }

    ScriptedSearchProvider answer(String area, int page, Object answer) {
        script.computeIfAbsent(key(area, page), ignored -> new ArrayDeque<>()).add(answer);
        return this;
    }

    ScriptedSearchProvider onCall(IntConsumer hook) {
        this.onCall = hook;
        return this;
    }

    void reset() {
        script.clear();
        calls.clear();
        onCall = callNumber -> {
        };
    }

    List<String> calls() {
        return List.copyOf(calls);
    }

    long callsFor(String area) {
        return calls.stream().filter(call -> call.startsWith(area + "#")).count();
    }

    static List<RawListing> listings(String area, int page, int count) {
        List<RawListing> listings = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String name = area + " shop p" + page + "-" + i;
            listings.add(new RawListing(name, i + " main st", null, null, 4.0, 10, area + "-" + page + "-" + i, "{}"));
        }
        return listings;
    }

    @Override
    public SearchPage search(String query, Area area, int page) throws SearchProviderException {
        String key = key(area.name(), page);
        calls.add(key);
        onCall.accept(calls.size());
        Deque<Object> answers = script.get(key);
        Object next = answers == null ? null : answers.poll();
        if (next == null) {
            return SearchPage.empty();
        }
        if (next instanceof SearchProviderException e) {
            throw e;
        }
        if (next instanceof RuntimeException e) {
            throw e;
        }
        return (SearchPage) next;
    }

    @Override
    public int pageSize() {
        return pageSize;
    }

    @Override
    public String sourceName() {
        return "test_source";
    }

    private static String key(String area, int page) {
        return area + "#" + page;
    }
}
