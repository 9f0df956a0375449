package io.opaquotes.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.opaquotes.domain.data.Quote;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Outbound wire format: one JSON object per quote.
 *
 * Prices are plain JSON numbers (scale preserved, never exponent notation),
 * bid/ask are omitted when absent, the timestamp is ISO-8601 UTC with
 * microsecond precision.
 */
public final class QuoteJsonMapper {

    private static final JsonMapper MAPPER = JsonMapper.builder()
        .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
        .build();

    static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private QuoteJsonMapper() {}

    public static String toJson(Quote q) {
        try {
            return MAPPER.writeValueAsString(toNode(q));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize quote for " + q.ticker(), e);
        }
    }

    public static ObjectNode toNode(Quote q) {
        ObjectNode o = MAPPER.createObjectNode();

        o.put("ticker", q.ticker());
        o.put("timestamp", formatTimestamp(q.timestamp()));

        o.put("open", q.open());
        o.put("high", q.high());
        o.put("low", q.low());
        o.put("close", q.close());

        o.put("volume", q.volume());

        putDecimal(o, "bid", q.bid());
        putDecimal(o, "ask", q.ask());

        return o;
    }

    public static String formatTimestamp(Instant ts) {
        return TIMESTAMP_FORMAT.format(ts);
    }

    private static void putDecimal(ObjectNode o, String key, BigDecimal v) {
        if (v == null) return;
        o.put(key, v);
    }
}
