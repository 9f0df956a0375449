package io.opaquotes.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opaquotes.domain.stream.OverflowPolicy;
import io.opaquotes.infrastructure.metrics.StreamMetrics;
import io.opaquotes.stream.ConcurrentSubscriptionRegistry;
import io.opaquotes.stream.FanOutRouter;
import io.opaquotes.stream.SessionLifecycleController;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static io.opaquotes.Eventually.await;
import static io.opaquotes.domain.data.QuoteFixtures.quote;
import static org.junit.jupiter.api.Assertions.*;

class QuoteStreamEndpointTest {

    private static final int TEST_PORT = 19093;
    private static final ObjectMapper READER = new ObjectMapper();

    private Undertow server;
    private ConcurrentSubscriptionRegistry registry;
    private SessionLifecycleController controller;
    private FanOutRouter router;

    @BeforeEach
    void setUp() {
        registry = new ConcurrentSubscriptionRegistry(100);
        controller = new SessionLifecycleController(registry, Duration.ofSeconds(2), StreamMetrics.NOOP);
        router = new FanOutRouter(registry, OverflowPolicy.DROP_OLDEST, StreamMetrics.NOOP);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path().addExactPath("/ws/quotes", new QuoteStreamEndpoint(controller).handler()))
            .build();
        server.start();
    }

    @AfterEach
    void tearDown() {
        controller.shutdown(Duration.ofSeconds(1));
        server.stop();
    }

    /** Collects complete text messages. */
    private static final class CollectingListener implements WebSocket.Listener {
        final List<String> messages = new CopyOnWriteArrayList<>();
        private final StringBuilder partial = new StringBuilder();
        volatile boolean closedByServer;

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                messages.add(partial.toString());
                partial.setLength(0);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            closedByServer = true;
            return null;
        }
    }

    private WebSocket connect(String query, CollectingListener listener) throws Exception {
        return HttpClient.newHttpClient().newWebSocketBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .buildAsync(URI.create("ws://localhost:" + TEST_PORT + "/ws/quotes" + query), listener)
            .get(5, TimeUnit.SECONDS);
    }

    @Test
    void testFilteredStreamAndClientClose() throws Exception {
        CollectingListener listener = new CollectingListener();
        WebSocket ws = connect("?tickers=aapl", listener);

        await("session registered", () -> registry.size() == 1);

        router.route(quote("AAPL", "150.25"));
        router.route(quote("MSFT", "410.00"));
        router.route(quote("AAPL", "150.35"));

        await("two frames", () -> listener.messages.size() >= 2);
        Thread.sleep(100);
        assertEquals(2, listener.messages.size());

        JsonNode first = READER.readTree(listener.messages.get(0));
        JsonNode second = READER.readTree(listener.messages.get(1));
        assertEquals("AAPL", first.get("ticker").asText());
        assertEquals("150.25", first.get("close").asText());
        assertEquals("150.35", second.get("close").asText());

        ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(5, TimeUnit.SECONDS);

        await("session released", () -> controller.getActiveSessionCount() == 0);
        assertEquals(0, registry.size());
    }

    @Test
    void testNoFilterReceivesEveryTicker() throws Exception {
        CollectingListener listener = new CollectingListener();
        connect("", listener);

        await("session registered", () -> registry.size() == 1);

        router.route(quote("AAPL", "1"));
        router.route(quote("MSFT", "2"));

        await("two frames", () -> listener.messages.size() == 2);
        assertEquals("MSFT", READER.readTree(listener.messages.get(1)).get("ticker").asText());
    }

    @Test
    void testServerShutdownClosesClients() throws Exception {
        CollectingListener listener = new CollectingListener();
        connect("?tickers=AAPL", listener);

        await("session registered", () -> registry.size() == 1);

        controller.shutdown(Duration.ofSeconds(2));

        await("close frame received", () -> listener.closedByServer);
        assertEquals(0, controller.getActiveSessionCount());
        assertFalse(controller.isAccepting());
    }

    @Test
    void testParseQuery() {
        Map<String, String> q = QuoteStreamEndpoint.parseQuery("/ws/quotes?tickers=AAPL%2CMSFT&x=&tickers=NVDA");
        assertEquals("NVDA", q.get("tickers"));
        assertEquals("", q.get("x"));

        assertTrue(QuoteStreamEndpoint.parseQuery("/ws/quotes").isEmpty());
        assertTrue(QuoteStreamEndpoint.parseQuery("/ws/quotes?").isEmpty());
        assertTrue(QuoteStreamEndpoint.parseQuery(null).isEmpty());
        assertEquals("AAPL,MSFT", QuoteStreamEndpoint.parseQuery("/ws?tickers=AAPL%2CMSFT").get("tickers"));
    }
}
