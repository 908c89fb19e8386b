package com.leadharvest.scrape.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadharvest.config.HarvestProperties;
import com.leadharvest.scrape.model.Area;
import com.leadharvest.scrape.model.AreaTier;
import com.leadharvest.scrape.model.RawListing;
import com.leadharvest.scrape.model.SearchPage;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RapidApiPlacesSearchProviderTest {
    private static final Area PARIS = new Area("Paris", "FR", "Ile-de-France", 2_133_111L, AreaTier.HIGH);

    private MockWebServer server;
    private ExecutorService executor;
    private HarvestProperties properties;
    private SearchRateLimiter rateLimiter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        properties = new HarvestProperties();
        properties.getProvider().setBaseUrl(server.url("/").toString());
        properties.getProvider().setApiKey("secret-key");
        properties.getProvider().setHost("maps.example.test");
        properties.getProvider().setRequestTimeoutSeconds(5);
        properties.getProvider().setMinIntervalMs(0);
        properties.getProvider().setRateLimitBackoffSeconds(30);
        rateLimiter = new SearchRateLimiter(properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void parsesListingsAndSendsCredentials() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("""
            {
              "has_more": true,
              "data": [
                {"business_name": "Plomberie Martin", "full_address": "1 rue de Rivoli", "phone_number": "+33 1 23",
                 "website": "https://martin.example", "rating": 4.6, "reviews_count": 31, "place_id": "p-1"},
                {"name": "Chez Paul", "address": "2 rue Cler", "rating": "3.9", "review_count": 4, "id": "p-2"}
              ]
            }
            """));

        SearchPage page = provider().search("plombier", PARIS, 2);

        assertEquals(2, page.size());
        assertTrue(page.hasMore());
        RawListing first = page.results().get(0);
        assertEquals("Plomberie Martin", first.companyName());
        assertEquals("1 rue de Rivoli", first.address());
        assertEquals("+33 1 23", first.phone());
        assertEquals("https://martin.example", first.website());
        assertThat(first.rating()).isEqualTo(4.6);
        assertThat(first.reviewsCount()).isEqualTo(31);
        assertEquals("p-1", first.externalId());
        RawListing second = page.results().get(1);
        assertEquals("Chez Paul", second.companyName());
        assertThat(second.rating()).isEqualTo(3.9);
        assertThat(second.reviewsCount()).isEqualTo(4);
        assertNull(second.website());

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertEquals("secret-key", request.getHeader("X-RapidAPI-Key"));
        assertEquals("maps.example.test", request.getHeader("X-RapidAPI-Host"));
        assertThat(request.getPath())
            .startsWith("/search?")
            .contains("query=plombier+Paris+FR")
            .contains("page=2")
            .contains("lang=en");
    }

    @Test
    void hasMoreFallsBackToFullPageHeuristic() throws Exception {
        properties.getProvider().setPageSize(2);
        server.enqueue(new MockResponse().setResponseCode(200)
            .setBody("{\"data\":[{\"name\":\"A\"},{\"name\":\"B\"}]}"));
        server.enqueue(new MockResponse().setResponseCode(200)
            .setBody("{\"data\":[{\"name\":\"C\"}]}"));

        RapidApiPlacesSearchProvider provider = provider();

        assertTrue(provider.search("bakery", PARIS, 1).hasMore());
        assertFalse(provider.search("bakery", PARIS, 2).hasMore());
    }

    @Test
    void missingDataIsAnEmptyPage() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"status\":\"OK\"}"));

        SearchPage page = provider().search("plombier", PARIS, 1);

        assertEquals(0, page.size());
        assertFalse(page.hasMore());
    }

    @Test
    void rateLimitIsTransientAndDefersNextRequest() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));

        SearchProviderException error = assertThrows(
            SearchProviderException.class,
            () -> provider().search("plombier", PARIS, 1)
        );

        assertTrue(error.isTransient());
        assertThat(error.httpStatus()).isEqualTo(429);
        assertThat(error.getMessage()).isEqualTo("http_429: slow down");
        assertThat(rateLimiter.nextAllowedAt()).isAfter(Instant.now().plusSeconds(20));
    }

    @Test
    void serverErrorIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(503));

        SearchProviderException error = assertThrows(
            SearchProviderException.class,
            () -> provider().search("plombier", PARIS, 1)
        );

        assertTrue(error.isTransient());
        assertThat(error.httpStatus()).isEqualTo(503);
    }

    @Test
    void rejectedCredentialsAreFatal() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"message\":\"invalid key\"}"));

        SearchProviderException error = assertThrows(
            SearchProviderException.class,
            () -> provider().search("plombier", PARIS, 1)
        );

        assertFalse(error.isTransient());
        assertThat(error.getMessage()).startsWith("http_401").contains("invalid key");
    }

    @Test
    void malformedBodyIsFatal() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>oops</html>"));

        SearchProviderException error = assertThrows(
            SearchProviderException.class,
            () -> provider().search("plombier", PARIS, 1)
        );

        assertEquals(SearchProviderException.Kind.FATAL, error.kind());
    }

    @Test
    void nonArrayDataIsFatal() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"data\":{\"name\":\"x\"}}"));

        SearchProviderException error = assertThrows(
            SearchProviderException.class,
            () -> provider().search("plombier", PARIS, 1)
        );

        assertEquals(SearchProviderException.Kind.FATAL, error.kind());
    }

    @Test
    void missingApiKeyFailsWithoutCallingProvider() {
        properties.getProvider().setApiKey(" ");

        SearchProviderException error = assertThrows(
            SearchProviderException.class,
            () -> provider().search("plombier", PARIS, 1)
        );

        assertEquals(SearchProviderException.Kind.FATAL, error.kind());
        assertEquals(0, server.getRequestCount());
    }

    private RapidApiPlacesSearchProvider provider() {
        return new RapidApiPlacesSearchProvider(properties, rateLimiter, new ObjectMapper(), executor);
    }
}
