package io.opaquotes.stream;

import io.opaquotes.domain.stream.TickerFilter;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Parses the {@code tickers} connection parameter.
 *
 * Absent, blank, or containing the {@code *} token means every ticker;
 * otherwise a comma-separated list, trimmed and uppercased here so that
 * matching never has to normalize.
 */
public final class TickerFilterParser {

    public static final String WILDCARD = "*";

    private TickerFilterParser() {}

    public static TickerFilter parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return TickerFilter.all();
        }

        Set<String> symbols = new LinkedHashSet<>();
        for (String part : raw.split(",")) {
            String symbol = part.trim();
            if (symbol.isEmpty()) continue;
            if (WILDCARD.equals(symbol)) {
                return TickerFilter.all();
            }
            symbols.add(symbol.toUpperCase(Locale.ROOT));
        }

        return symbols.isEmpty() ? TickerFilter.all() : TickerFilter.tickers(symbols);
    }
}
