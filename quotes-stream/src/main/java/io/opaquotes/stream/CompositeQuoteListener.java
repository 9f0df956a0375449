package io.opaquotes.stream;

import io.opaquotes.domain.data.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Dispatches each quote to several listeners in order; a failing listener does
 * not stop the others.
 */
public final class CompositeQuoteListener implements QuoteListener {
    private static final Logger log = LoggerFactory.getLogger(CompositeQuoteListener.class);

    private final List<QuoteListener> listeners;

    public CompositeQuoteListener(List<QuoteListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    @Override
    public void onQuote(Quote quote) {
        for (QuoteListener l : listeners) {
            try {
                l.onQuote(quote);
            } catch (RuntimeException e) {
                log.warn("[ROUTER] Quote listener {} failed for {}: {}",
                    l.getClass().getSimpleName(), quote.ticker(), e.getMessage(), e);
            }
        }
    }
}
