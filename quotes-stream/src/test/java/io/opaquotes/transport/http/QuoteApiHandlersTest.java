package io.opaquotes.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opaquotes.domain.data.CapacityScore;
import io.opaquotes.infrastructure.metrics.StreamMetrics;
import io.opaquotes.service.CapacityScoreCache;
import io.opaquotes.service.LatestQuoteCache;
import io.opaquotes.stream.ConcurrentSubscriptionRegistry;
import io.opaquotes.stream.SessionLifecycleController;
import io.opaquotes.upstream.UpstreamState;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static io.opaquotes.domain.data.QuoteFixtures.fullQuote;
import static io.opaquotes.domain.data.QuoteFixtures.quote;
import static org.junit.jupiter.api.Assertions.*;

class QuoteApiHandlersTest {

    private static final int TEST_PORT = 19092;
    private static final ObjectMapper READER = new ObjectMapper();

    private Undertow server;
    private HttpClient httpClient;
    private LatestQuoteCache quotes;
    private CapacityScoreCache capacity;
    private SessionLifecycleController sessions;

    @BeforeEach
    void setUp() {
        quotes = new LatestQuoteCache();
        capacity = new CapacityScoreCache();
        sessions = new SessionLifecycleController(new ConcurrentSubscriptionRegistry(8), Duration.ofSeconds(1),
            StreamMetrics.NOOP);
        QuoteApiHandlers api = new QuoteApiHandlers("9.9.9", quotes, capacity, sessions,
            "quotes.realtime", () -> UpstreamState.CONNECTED);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(QuoteApiHandlers.cors(Handlers.routing()
                .get("/health", api::health)
                .get("/v1/quotes/latest", api::latestQuotes)
                .get("/v1/quotes/{ticker}/latest", api::latestQuote)))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        sessions.shutdown(Duration.ofMillis(100));
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        JsonNode body = READER.readTree(response.body());
        assertEquals("ok", body.get("status").asText());
        assertEquals("9.9.9", body.get("version").asText());
        assertEquals("opa-quotes-api", body.get("repository").asText());
        assertEquals(0, body.get("connections").asInt());
        assertEquals("quotes.realtime", body.get("upstream").get("channel").asText());
        assertEquals("CONNECTED", body.get("upstream").get("state").asText());
    }

    @Test
    void testLatestQuoteFound() throws Exception {
        quotes.onQuote(fullQuote());

        HttpResponse<String> response = get("/v1/quotes/aapl/latest");

        assertEquals(200, response.statusCode());
        JsonNode body = READER.readTree(response.body());
        assertEquals("AAPL", body.get("ticker").asText());
        assertEquals("2026-01-21T10:30:00.123000Z", body.get("timestamp").asText());
        assertFalse(body.has("capacity_context"));
    }

    @Test
    void testLatestQuoteEnrichedWithCapacity() throws Exception {
        quotes.onQuote(fullQuote());
        capacity.put(new CapacityScore("AAPL", 0.85, 0.92, Instant.parse("2026-02-10T13:00:00Z"), "1.0.0"));

        JsonNode body = READER.readTree(get("/v1/quotes/AAPL/latest").body());

        JsonNode ctx = body.get("capacity_context");
        assertNotNull(ctx);
        assertEquals(0.85, ctx.get("score").asDouble(), 1e-9);
        assertEquals(0.92, ctx.get("confidence").asDouble(), 1e-9);
        assertEquals("2026-02-10T13:00:00Z", ctx.get("last_updated").asText());
        assertEquals("1.0.0", ctx.get("model_version").asText());
    }

    @Test
    void testLatestQuoteNotFound() throws Exception {
        HttpResponse<String> response = get("/v1/quotes/NVDA/latest");

        assertEquals(404, response.statusCode());
        assertTrue(READER.readTree(response.body()).get("error").asText().contains("NVDA"));
    }

    @Test
    void testLatestQuotesBatch() throws Exception {
        quotes.onQuote(quote("AAPL", "1"));
        quotes.onQuote(quote("MSFT", "2"));

        HttpResponse<String> response = get("/v1/quotes/latest?tickers=msft,NVDA,aapl");

        assertEquals(200, response.statusCode());
        JsonNode body = READER.readTree(response.body());
        assertEquals(2, body.get("quotes").size());
        assertEquals("MSFT", body.get("quotes").get(0).get("ticker").asText());
        assertEquals("AAPL", body.get("quotes").get(1).get("ticker").asText());
        assertEquals(1, body.get("missing").size());
        assertEquals("NVDA", body.get("missing").get(0).asText());
    }

    @Test
    void testLatestQuotesValidation() throws Exception {
        assertEquals(400, get("/v1/quotes/latest").statusCode());
        assertEquals(400, get("/v1/quotes/latest?tickers=,,").statusCode());

        String tooMany = IntStream.rangeClosed(1, 101).mapToObj(i -> "T" + i).collect(Collectors.joining(","));
        assertEquals(400, get("/v1/quotes/latest?tickers=" + tooMany).statusCode());
    }

    @Test
    void testCorsHeadersAndPreflight() throws Exception {
        HttpResponse<String> health = get("/health");
        assertEquals("*", health.headers().firstValue("Access-Control-Allow-Origin").orElse(null));

        HttpResponse<String> preflight = httpClient.send(HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/v1/quotes/latest"))
            .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
            .build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(200, preflight.statusCode());
        assertTrue(preflight.headers().firstValue("Access-Control-Allow-Methods").orElse("").contains("GET"));
    }
}
