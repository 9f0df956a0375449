package io.opaquotes.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.opaquotes.domain.data.Quote;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Decodes upstream quote payloads.
 *
 * Accepted input:
 * <pre>
 * {"ticker":"aapl","timestamp":"2026-01-21T10:30:00.123Z","open":"150.25",
 *  "high":151.1,"low":150.05,"close":150.9,"volume":1000000,"bid":150.88,"ask":150.92}
 * </pre>
 * Prices may be JSON numbers or numeric strings. A timestamp without a zone is
 * read as UTC; a bare integer is epoch milliseconds. {@code volume} defaults to
 * 0, {@code open/high/low} default to {@code close}, {@code bid/ask} are optional.
 */
public final class QuoteMessageDecoder {

    static final JsonMapper MAPPER = JsonMapper.builder()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
        .build();

    public Quote decode(String payload) {
        JsonNode root = readObject(payload);

        String ticker = requireText(root, "ticker");
        Instant timestamp = readTimestamp(root, "timestamp");
        BigDecimal close = decimal(root, "close");
        if (close == null) {
            throw new MalformedQuoteException("missing field 'close'");
        }
        BigDecimal open = orElse(decimal(root, "open"), close);
        BigDecimal high = orElse(decimal(root, "high"), close);
        BigDecimal low = orElse(decimal(root, "low"), close);
        long volume = volume(root);

        try {
            return new Quote(ticker, timestamp, open, high, low, close, volume,
                decimal(root, "bid"), decimal(root, "ask"));
        } catch (IllegalArgumentException e) {
            throw new MalformedQuoteException(e.getMessage(), e);
        }
    }

    static JsonNode readObject(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedQuoteException("empty payload");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedQuoteException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedQuoteException("payload is not a JSON object");
        }
        return root;
    }

    static String requireText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isTextual() || node.asText().isBlank()) {
            throw new MalformedQuoteException("missing or non-text field '" + field + "'");
        }
        return node.asText().trim();
    }

    static Instant readTimestamp(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new MalformedQuoteException("missing field '" + field + "'");
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new MalformedQuoteException("field '" + field + "' is out of range: " + node.asText());
            }
            return Instant.ofEpochMilli(node.longValue());
        }
        if (!node.isTextual()) {
            throw new MalformedQuoteException("field '" + field + "' is not a timestamp");
        }
        return parseInstant(node.asText());
    }

    /**
     * ISO-8601 with or without offset (no offset means UTC), or epoch millis.
     */
    public static Instant parseInstant(String raw) {
        String text = raw.trim();
        if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw new MalformedQuoteException("timestamp out of range '" + raw + "'", e);
            }
        }
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException withOffset) {
            try {
                return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new MalformedQuoteException("unparseable timestamp '" + raw + "'", e);
            }
        }
    }

    private static BigDecimal decimal(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedQuoteException("field '" + field + "' is not numeric: " + node.asText(), e);
            }
        }
        throw new MalformedQuoteException("field '" + field + "' is not numeric");
    }

    private static long volume(JsonNode root) {
        BigDecimal v = decimal(root, "volume");
        if (v == null) {
            return 0L;
        }
        try {
            return v.longValueExact();
        } catch (ArithmeticException e) {
            throw new MalformedQuoteException("volume is not a whole number: " + v.toPlainString(), e);
        }
    }

    private static BigDecimal orElse(BigDecimal v, BigDecimal fallback) {
        return v != null ? v : fallback;
    }
}
