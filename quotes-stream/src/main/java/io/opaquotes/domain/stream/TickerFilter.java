package io.opaquotes.domain.stream;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A subscription's interest set: every ticker, or an explicit set of symbols.
 * Resolved once when the connection is set up; symbols are stored uppercase.
 */
public sealed interface TickerFilter permits TickerFilter.All, TickerFilter.Tickers {

    boolean matches(String ticker);

    static TickerFilter all() {
        return All.INSTANCE;
    }

    static TickerFilter tickers(Set<String> symbols) {
        return new Tickers(symbols);
    }

    record All() implements TickerFilter {
        private static final All INSTANCE = new All();

        @Override
        public boolean matches(String ticker) {
            return true;
        }

        @Override
        public String toString() {
            return "ALL";
        }
    }

    record Tickers(Set<String> symbols) implements TickerFilter {
        public Tickers {
            if (symbols == null || symbols.isEmpty()) {
                throw new IllegalArgumentException("ticker set cannot be empty, use TickerFilter.all()");
            }
            symbols = symbols.stream()
                .map(s -> s.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        }

        @Override
        public boolean matches(String ticker) {
            return ticker != null && symbols.contains(ticker);
        }

        @Override
        public String toString() {
            return symbols.stream().sorted().collect(Collectors.joining(",", "[", "]"));
        }
    }
}
