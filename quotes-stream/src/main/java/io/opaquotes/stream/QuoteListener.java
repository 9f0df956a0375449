package io.opaquotes.stream;

import io.opaquotes.domain.data.Quote;

/**
 * Receives every successfully decoded upstream quote.
 * Implementations must not block the caller.
 */
@FunctionalInterface
public interface QuoteListener {
    void onQuote(Quote quote);
}
