package io.opaquotes.domain.data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

/**
 * One market update for a ticker at an instant.
 * The timestamp is assigned upstream; bid/ask are null when not quoted.
 */
public record Quote(
    String ticker,
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    long volume,
    BigDecimal bid,
    BigDecimal ask
) {
    public Quote {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("ticker cannot be blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (open == null || high == null || low == null || close == null) {
            throw new IllegalArgumentException("open/high/low/close cannot be null");
        }
        if (volume < 0) {
            throw new IllegalArgumentException("volume cannot be negative: " + volume);
        }
        ticker = ticker.trim().toUpperCase(Locale.ROOT);
    }
}
