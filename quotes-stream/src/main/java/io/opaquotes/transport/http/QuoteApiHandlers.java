package io.opaquotes.transport.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.opaquotes.domain.data.CapacityScore;
import io.opaquotes.domain.data.Quote;
import io.opaquotes.service.CapacityScoreCache;
import io.opaquotes.service.LatestQuoteCache;
import io.opaquotes.stream.QuoteJsonMapper;
import io.opaquotes.stream.SessionLifecycleController;
import io.opaquotes.upstream.UpstreamState;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * HTTP API: health and latest-quote lookups served from the in-memory caches.
 */
public final class QuoteApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(QuoteApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    static final String REPOSITORY = "opa-quotes-api";
    static final int MAX_TICKERS = 100;

    private static final String JSON_ERROR = "error";
    private static final String CONTENT_JSON = "application/json; charset=utf-8";

    private final String version;
    private final LatestQuoteCache quotes;
    private final CapacityScoreCache capacity;
    private final SessionLifecycleController sessions;
    private final String upstreamChannel;
    private final Supplier<UpstreamState> upstreamState;

    public QuoteApiHandlers(String version, LatestQuoteCache quotes, CapacityScoreCache capacity,
                            SessionLifecycleController sessions,
                            String upstreamChannel, Supplier<UpstreamState> upstreamState) {
        this.version = version;
        this.quotes = quotes;
        this.capacity = capacity;
        this.sessions = sessions;
        this.upstreamChannel = upstreamChannel;
        this.upstreamState = upstreamState;
    }

    /**
     * GET /health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("version", version);
        health.put("repository", REPOSITORY);
        health.put("ts", Instant.now().toString());
        health.put("connections", sessions.getActiveSessionCount());

        ObjectNode upstream = health.putObject("upstream");
        upstream.put("channel", upstreamChannel);
        upstream.put("state", upstreamState.get().name());

        send(exchange, StatusCodes.OK, health);
    }

    /**
     * GET /v1/quotes/{ticker}/latest
     */
    public void latestQuote(HttpServerExchange exchange) {
        String ticker = param(exchange, "ticker");
        if (ticker == null || ticker.isBlank()) {
            error(exchange, StatusCodes.BAD_REQUEST, "Ticker is required");
            return;
        }
        String symbol = ticker.trim().toUpperCase(Locale.ROOT);

        Quote quote = quotes.get(symbol).orElse(null);
        if (quote == null) {
            error(exchange, StatusCodes.NOT_FOUND, "No quote found for ticker " + symbol);
            return;
        }
        send(exchange, StatusCodes.OK, quoteNode(quote));
    }

    /**
     * GET /v1/quotes/latest?tickers=AAPL,MSFT
     */
    public void latestQuotes(HttpServerExchange exchange) {
        String raw = param(exchange, "tickers");
        if (raw == null || raw.isBlank()) {
            error(exchange, StatusCodes.BAD_REQUEST, "Query parameter 'tickers' is required");
            return;
        }

        Set<String> requested = new LinkedHashSet<>();
        for (String t : raw.split(",")) {
            String s = t.trim().toUpperCase(Locale.ROOT);
            if (!s.isEmpty()) requested.add(s);
        }
        if (requested.isEmpty()) {
            error(exchange, StatusCodes.BAD_REQUEST, "Query parameter 'tickers' is required");
            return;
        }
        if (requested.size() > MAX_TICKERS) {
            error(exchange, StatusCodes.BAD_REQUEST, "At most " + MAX_TICKERS + " tickers per request");
            return;
        }

        Map<String, Quote> found = quotes.getLatest(requested);
        ObjectNode response = MAPPER.createObjectNode();
        ArrayNode list = response.putArray("quotes");
        List<String> missing = new ArrayList<>();
        for (String s : requested) {
            Quote q = found.get(s);
            if (q != null) {
                list.add(quoteNode(q));
            } else {
                missing.add(s);
            }
        }
        ArrayNode missingNode = response.putArray("missing");
        missing.forEach(missingNode::add);

        send(exchange, StatusCodes.OK, response);
    }

    /**
     * Adds CORS headers to every response and answers preflight requests.
     */
    public static HttpHandler cors(HttpHandler next) {
        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (Methods.OPTIONS.equals(exchange.getRequestMethod())) {
                exchange.setStatusCode(StatusCodes.OK);
                exchange.endExchange();
            } else {
                next.handleRequest(exchange);
            }
        };
    }

    private ObjectNode quoteNode(Quote q) {
        ObjectNode node = QuoteJsonMapper.toNode(q);
        capacity.get(q.ticker()).ifPresent(score -> node.set("capacity_context", MAPPER.valueToTree(CapacityContext.of(score))));
        return node;
    }

    private static String param(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null ? null : values.peekFirst();
    }

    private static void error(HttpServerExchange exchange, int status, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put(JSON_ERROR, message);
        send(exchange, status, body);
    }

    private static void send(HttpServerExchange exchange, int status, ObjectNode body) {
        String json;
        int code = status;
        try {
            json = MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.error("[HTTP] Failed to serialize response for {}", exchange.getRequestPath(), e);
            code = StatusCodes.INTERNAL_SERVER_ERROR;
            json = "{\"error\":\"internal error\"}";
        }
        exchange.setStatusCode(code);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_JSON);
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    public record CapacityContext(
        double score,
        double confidence,
        @JsonProperty("last_updated") Instant lastUpdated,
        @JsonProperty("model_version") String modelVersion
    ) {
        static CapacityContext of(CapacityScore s) {
            return new CapacityContext(s.score(), s.confidence(), s.lastUpdated(), s.modelVersion());
        }
    }
}
