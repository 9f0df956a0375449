package io.opaquotes.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import io.opaquotes.domain.data.CapacityScore;
import io.opaquotes.service.CapacityScoreCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Capacity channel handler. Expected payload:
 * <pre>
 * {"ticker":"AAPL","score":0.85,"confidence":0.92,
 *  "timestamp":"2026-02-10T13:00:00Z","model_version":"1.0.0"}
 * </pre>
 * All five fields are required; incomplete or invalid messages are logged and ignored.
 */
public final class CapacityScoreHandler implements UpstreamMessageHandler {
    private static final Logger log = LoggerFactory.getLogger(CapacityScoreHandler.class);

    static final List<String> REQUIRED_FIELDS = List.of("ticker", "score", "confidence", "timestamp", "model_version");

    private final CapacityScoreCache cache;

    public CapacityScoreHandler(CapacityScoreCache cache) {
        this.cache = cache;
    }

    @Override
    public void onMessage(String channel, String payload) {
        CapacityScore score;
        try {
            score = decode(payload);
        } catch (MalformedQuoteException e) {
            log.warn("[UPSTREAM] Ignoring capacity message on {}: {}", channel, e.getMessage());
            return;
        }
        cache.put(score);
        log.info("[UPSTREAM] Cached capacity score for {}: score={} confidence={}",
            score.ticker(), String.format("%.2f", score.score()), String.format("%.2f", score.confidence()));
    }

    CapacityScore decode(String payload) {
        JsonNode root = QuoteMessageDecoder.readObject(payload);
        for (String field : REQUIRED_FIELDS) {
            JsonNode node = root.get(field);
            if (node == null || node.isNull()) {
                throw new MalformedQuoteException("incomplete capacity message, missing '" + field + "'");
            }
        }
        JsonNode score = root.get("score");
        JsonNode confidence = root.get("confidence");
        if (!score.isNumber() || !confidence.isNumber()) {
            throw new MalformedQuoteException("score and confidence must be numbers");
        }

        try {
            return new CapacityScore(
                QuoteMessageDecoder.requireText(root, "ticker").toUpperCase(Locale.ROOT),
                score.doubleValue(),
                confidence.doubleValue(),
                QuoteMessageDecoder.readTimestamp(root, "timestamp"),
                root.get("model_version").asText());
        } catch (IllegalArgumentException e) {
            throw new MalformedQuoteException(e.getMessage(), e);
        }
    }
}
