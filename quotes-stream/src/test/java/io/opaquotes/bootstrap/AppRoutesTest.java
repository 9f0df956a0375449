package io.opaquotes.bootstrap;

import io.opaquotes.infrastructure.metrics.StreamMetrics;
import io.opaquotes.service.CapacityScoreCache;
import io.opaquotes.service.LatestQuoteCache;
import io.opaquotes.stream.ConcurrentSubscriptionRegistry;
import io.opaquotes.stream.SessionLifecycleController;
import io.opaquotes.transport.http.QuoteApiHandlers;
import io.opaquotes.transport.ws.QuoteStreamEndpoint;
import io.opaquotes.upstream.UpstreamState;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static io.opaquotes.Eventually.await;
import static org.junit.jupiter.api.Assertions.*;

class AppRoutesTest {

    private static final int TEST_PORT = 19094;

    private Undertow server;
    private ConcurrentSubscriptionRegistry registry;
    private SessionLifecycleController controller;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        registry = new ConcurrentSubscriptionRegistry(16);
        controller = new SessionLifecycleController(registry, Duration.ofSeconds(1), StreamMetrics.NOOP);
        QuoteApiHandlers api = new QuoteApiHandlers("0.1.0", new LatestQuoteCache(), new CapacityScoreCache(),
            controller, "quotes.realtime", () -> UpstreamState.CONNECTING);

        server = App.buildServer(
            StartupConfigValidatorTest.config(TEST_PORT, 16, "redis://localhost", "q", "c",
                Duration.ofSeconds(1), Duration.ofSeconds(30)),
            App.routes(new QuoteStreamEndpoint(controller), api,
                exchange -> exchange.getResponseSender().send("metrics")));
        server.start();

        httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            controller.shutdown(Duration.ofSeconds(1));
            server.stop();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testEveryWebSocketAliasAcceptsConnections() throws Exception {
        int expected = 0;
        for (String path : App.WS_PATHS) {
            httpClient.newWebSocketBuilder()
                .buildAsync(URI.create("ws://localhost:" + TEST_PORT + path + "?tickers=AAPL"),
                    new WebSocket.Listener() {})
                .get(5, TimeUnit.SECONDS);
            expected++;
            int target = expected;
            await("session on " + path, () -> registry.size() == target);
        }
        assertEquals(App.WS_PATHS.size(), controller.getActiveSessionCount());
    }

    @Test
    void testHttpRoutes() throws Exception {
        HttpResponse<String> health = get("/health");
        assertEquals(200, health.statusCode());
        assertTrue(health.body().contains("\"CONNECTING\""));

        assertEquals("metrics", get("/metrics").body());

        HttpResponse<String> missing = get("/does-not-exist");
        assertEquals(404, missing.statusCode());
        assertTrue(missing.body().contains("Not found"));
        assertEquals("*", missing.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
    }

    @Test
    void testShutdownSendsNormalClosureBeforeListenerStops() throws Exception {
        AtomicInteger closeCode = new AtomicInteger(-1);
        AtomicBoolean upstreamReleased = new AtomicBoolean();
        httpClient.newWebSocketBuilder()
            .buildAsync(URI.create("ws://localhost:" + TEST_PORT + "/ws/quotes?tickers=AAPL"),
                new WebSocket.Listener() {
                    @Override
                    public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
                        closeCode.set(statusCode);
                        return null;
                    }
                })
            .get(5, TimeUnit.SECONDS);
        await("session registered", () -> registry.size() == 1);

        App.shutdown(List.of(), controller, Duration.ofSeconds(2), server, () -> upstreamReleased.set(true));
        server = null;

        await("client saw close frame", () -> closeCode.get() != -1);
        assertEquals(1000, closeCode.get());
        assertEquals(0, controller.getActiveSessionCount());
        assertFalse(controller.isAccepting());
        assertTrue(upstreamReleased.get());
    }
}
