package com.leadharvest.scrape.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadharvest.config.HarvestProperties;
import com.leadharvest.scrape.model.Area;
import com.leadharvest.scrape.model.RawListing;
import com.leadharvest.scrape.model.SearchPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Places search over the RapidAPI Google Maps extractor. Every request passes
 * through the shared {@link SearchRateLimiter}; retrying is left to the caller.
 */
@Service
public class RapidApiPlacesSearchProvider implements SearchProvider {
    private static final Logger log = LoggerFactory.getLogger(RapidApiPlacesSearchProvider.class);
    private static final int MAX_ERROR_BODY = 300;

    private final HarvestProperties properties;
    private final SearchRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public RapidApiPlacesSearchProvider(
        HarvestProperties properties,
        SearchRateLimiter rateLimiter,
        ObjectMapper objectMapper,
        @Qualifier("providerHttpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getProvider().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public int pageSize() {
        return properties.getProvider().getPageSize();
    }

    @Override
    public String sourceName() {
        return properties.getProvider().getSource();
    }

    @Override
    public SearchPage search(String query, Area area, int page) throws SearchProviderException {
        HarvestProperties.Provider config = properties.getProvider();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw SearchProviderException.fatal("provider api key is not configured");
        }
        URI uri = buildUri(config, query, area, page);
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
            .header("Accept", "application/json")
            .header("X-RapidAPI-Key", config.getApiKey())
            .header("X-RapidAPI-Host", config.getHost())
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchProviderException(SearchProviderException.Kind.TRANSIENT, "interrupted", null, e);
        }
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new SearchProviderException(SearchProviderException.Kind.TRANSIENT, "timeout", null, e);
        } catch (IOException e) {
            throw new SearchProviderException(SearchProviderException.Kind.TRANSIENT,
                "io_error: " + e.getMessage(), null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchProviderException(SearchProviderException.Kind.TRANSIENT, "interrupted", null, e);
        } finally {
            rateLimiter.release();
        }

        int status = response.statusCode();
        if (status == 429) {
            rateLimiter.extendBackoff(Duration.ofSeconds(config.getRateLimitBackoffSeconds()));
        }
        if (status < 200 || status >= 300) {
            throw classify(status, response.body());
        }
        SearchPage result = parse(response.body());
        log.debug("Search '{}' in {} page {} returned {} results", query, area.name(), page, result.size());
        return result;
    }

    SearchPage parse(String body) throws SearchProviderException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new SearchProviderException(SearchProviderException.Kind.FATAL,
                "unparsable provider response", null, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return SearchPage.empty();
        }
        JsonNode data = root.path("data");
        if (!data.isArray()) {
            if (data.isMissingNode() || data.isNull()) {
                return SearchPage.empty();
            }
            throw SearchProviderException.fatal("provider response 'data' is not an array");
        }
        List<RawListing> listings = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            listings.add(toListing(item));
        }
        boolean hasMore;
        JsonNode hasMoreNode = root.has("has_more") ? root.get("has_more") : root.get("hasMore");
        if (hasMoreNode != null && hasMoreNode.isBoolean()) {
            hasMore = hasMoreNode.asBoolean();
        } else {
            hasMore = listings.size() >= pageSize();
        }
        return new SearchPage(listings, hasMore);
    }

    private RawListing toListing(JsonNode item) {
        return new RawListing(
            text(item, "business_name", "name", "title"),
            text(item, "full_address", "address"),
            text(item, "phone_number", "phone"),
            text(item, "website", "site"),
            number(item, "rating"),
            integer(item, "reviews_count", "review_count", "reviews"),
            text(item, "place_id", "business_id", "id"),
            item.toString()
        );
    }

    private URI buildUri(HarvestProperties.Provider config, String query, Area area, int page) {
        StringBuilder location = new StringBuilder(area.name());
        if (area.country() != null && !area.country().isBlank()) {
            location.append(' ').append(area.country());
        }
        String searchQuery = query.trim() + " " + location;
        String base = config.getBaseUrl().endsWith("/")
            ? config.getBaseUrl().substring(0, config.getBaseUrl().length() - 1)
            : config.getBaseUrl();
        return URI.create(base + "/search"
            + "?query=" + URLEncoder.encode(searchQuery, StandardCharsets.UTF_8)
            + "&page=" + page
            + "&lang=" + URLEncoder.encode(config.getLanguage(), StandardCharsets.UTF_8));
    }

    private SearchProviderException classify(int status, String body) {
        String detail = "http_" + status + bodySnippet(body);
        boolean transientStatus = status == 408 || status == 429 || status >= 500;
        SearchProviderException.Kind kind = transientStatus
            ? SearchProviderException.Kind.TRANSIENT
            : SearchProviderException.Kind.FATAL;
        if (status == 401 || status == 403) {
            log.error("Provider rejected credentials with status {}", status);
        }
        return new SearchProviderException(kind, detail, status, null);
    }

    private String bodySnippet(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > MAX_ERROR_BODY ? trimmed.substring(0, MAX_ERROR_BODY) : trimmed);
    }

    private String text(JsonNode item, String... fields) {
        for (String field : fields) {
            JsonNode node = item.get(field);
            if (node != null && !node.isNull() && node.isValueNode()) {
                String value = node.asText().trim();
                if (!value.isEmpty()) {
                    return value;
                }
            }
        }
        return null;
    }

    private Double number(JsonNode item, String field) {
        JsonNode node = item.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Integer integer(JsonNode item, String... fields) {
        for (String field : fields) {
            JsonNode node = item.get(field);
            if (node != null && node.isNumber()) {
                return node.asInt();
            }
        }
        return null;
    }
}
