package io.opaquotes.bootstrap;

import io.opaquotes.config.StreamConfig;
import io.opaquotes.infrastructure.metrics.PrometheusMetricsHandler;
import io.opaquotes.infrastructure.metrics.PrometheusStreamMetrics;
import io.opaquotes.service.CapacityScoreCache;
import io.opaquotes.service.LatestQuoteCache;
import io.opaquotes.stream.CompositeQuoteListener;
import io.opaquotes.stream.ConcurrentSubscriptionRegistry;
import io.opaquotes.stream.FanOutRouter;
import io.opaquotes.stream.SessionLifecycleController;
import io.opaquotes.transport.http.QuoteApiHandlers;
import io.opaquotes.transport.ws.QuoteStreamEndpoint;
import io.opaquotes.upstream.CapacityScoreHandler;
import io.opaquotes.upstream.QuoteMessageDecoder;
import io.opaquotes.upstream.QuoteMessageHandler;
import io.opaquotes.upstream.ReconnectionPolicy;
import io.opaquotes.upstream.RedisPubSubConnector;
import io.opaquotes.upstream.Sleeper;
import io.opaquotes.upstream.UpstreamChannelAdapter;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Quote stream service entry point.
 *
 * Wiring, upstream to clients:
 * Redis channel -> UpstreamChannelAdapter -> QuoteMessageHandler -> FanOutRouter
 *   -> per-connection queue -> DeliveryWorker -> WebSocket
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final List<String> WS_PATHS = List.of("/ws/quotes", "/ws", "/v1/ws/quotes", "/v1/ws");

    public static void main(String[] args) {
        StreamConfig config = StreamConfig.fromEnv();
        StartupConfigValidator.validate(config);

        PrometheusStreamMetrics metrics = new PrometheusStreamMetrics();

        // ═══════════════════════════════════════════════════════════════
        // Stream core
        // ═══════════════════════════════════════════════════════════════
        ConcurrentSubscriptionRegistry registry = new ConcurrentSubscriptionRegistry(config.queueCapacity());
        SessionLifecycleController controller =
            new SessionLifecycleController(registry, config.writeTimeout(), metrics);
        FanOutRouter router = new FanOutRouter(registry, config.overflowPolicy(), metrics);
        LatestQuoteCache latestQuotes = new LatestQuoteCache();
        CapacityScoreCache capacityScores = new CapacityScoreCache(config.capacityScoreTtl(), Clock.systemUTC());
        log.info("✓ Stream core ready (queue={}, policy={})", config.queueCapacity(), config.overflowPolicy());

        // ═══════════════════════════════════════════════════════════════
        // Upstream
        // ═══════════════════════════════════════════════════════════════
        RedisPubSubConnector connector = new RedisPubSubConnector(config.redisUrl());
        UpstreamChannelAdapter quoteAdapter = new UpstreamChannelAdapter(
            config.quotesChannel(),
            connector,
            new QuoteMessageHandler(new QuoteMessageDecoder(),
                new CompositeQuoteListener(List.of(latestQuotes, router)), metrics),
            ReconnectionPolicy.forUpstreamChannel(config.backoffInitial(), config.backoffMax()),
            Sleeper.system(),
            metrics);

        UpstreamChannelAdapter capacityAdapter = null;
        if (config.capacityEnabled()) {
            capacityAdapter = new UpstreamChannelAdapter(
                config.capacityChannel(),
                connector,
                new CapacityScoreHandler(capacityScores),
                ReconnectionPolicy.forUpstreamChannel(config.backoffInitial(), config.backoffMax()),
                Sleeper.system(),
                metrics);
        }

        // ═══════════════════════════════════════════════════════════════
        // HTTP + WebSocket
        // ═══════════════════════════════════════════════════════════════
        QuoteStreamEndpoint endpoint = new QuoteStreamEndpoint(controller);
        QuoteApiHandlers api = new QuoteApiHandlers(config.version(), latestQuotes, capacityScores, controller,
            config.quotesChannel(), quoteAdapter::getState);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        Undertow server = buildServer(config, routes(endpoint, api, metricsHandler));
        server.start();
        log.info("✓ Quote stream listening on ws://{}:{}{} (aliases {})",
            config.host(), config.port(), WS_PATHS.get(0), WS_PATHS.subList(1, WS_PATHS.size()));

        quoteAdapter.start();
        if (capacityAdapter != null) {
            capacityAdapter.start();
        }

        ScheduledExecutorService housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "capacity-purge");
            t.setDaemon(true);
            return t;
        });
        housekeeping.scheduleAtFixedRate(capacityScores::purgeExpired, 1, 1, TimeUnit.MINUTES);

        List<UpstreamChannelAdapter> adapters = capacityAdapter != null
            ? List.of(quoteAdapter, capacityAdapter)
            : List.of(quoteAdapter);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(adapters, controller,
            config.shutdownTimeout(), server, () -> {
                housekeeping.shutdownNow();
                connector.close();
            }), "shutdown"));

        log.info("OPA quotes stream {} started", config.version());
    }

    /**
     * Shutdown sequence. Sessions drain before the listener stops: stopping
     * Undertow tears down the XNIO worker that owns every open channel.
     *
     * 1. stop the upstream adapters (no new quotes)
     * 2. drain and close sessions (new connections are refused from here on)
     * 3. stop the HTTP listener
     * 4. release upstream resources
     */
    static void shutdown(List<UpstreamChannelAdapter> adapters, SessionLifecycleController controller,
                         Duration drainTimeout, Undertow server, Runnable releaseUpstream) {
        log.info("Shutdown requested");
        for (UpstreamChannelAdapter adapter : adapters) {
            adapter.stop();
        }
        controller.shutdown(drainTimeout);
        server.stop();
        releaseUpstream.run();
        log.info("Shutdown complete");
    }

    /**
     * Route table: WebSocket aliases, REST API and metrics, behind CORS.
     */
    static HttpHandler routes(QuoteStreamEndpoint endpoint, QuoteApiHandlers api, HttpHandler metricsHandler) {
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/health", api::health)
            .get("/v1/quotes/latest", api::latestQuotes)
            .get("/v1/quotes/{ticker}/latest", api::latestQuote);
        for (String path : WS_PATHS) {
            routes.get(path, endpoint.handler());
        }
        routes.setFallbackHandler(exchange -> {
            exchange.setStatusCode(StatusCodes.NOT_FOUND);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
            exchange.getResponseSender().send("{\"error\":\"Not found\"}");
        });
        return QuoteApiHandlers.cors(routes);
    }

    /**
     * Undertow listener; the handshake timeout bounds how long an upgrade request may take.
     */
    static Undertow buildServer(StreamConfig config, HttpHandler handler) {
        int handshakeMs = (int) Math.min(Integer.MAX_VALUE, config.handshakeTimeout().toMillis());
        return Undertow.builder()
            .addHttpListener(config.port(), config.host())
            .setServerOption(UndertowOptions.REQUEST_PARSE_TIMEOUT, handshakeMs)
            .setHandler(handler)
            .build();
    }
}
