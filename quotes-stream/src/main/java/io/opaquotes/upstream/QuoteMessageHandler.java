package io.opaquotes.upstream;

import io.opaquotes.domain.data.Quote;
import io.opaquotes.infrastructure.metrics.StreamMetrics;
import io.opaquotes.stream.QuoteListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Quote channel handler: decode, then hand the quote to the listener.
 * Malformed payloads are counted and dropped; nothing thrown escapes to the
 * connector thread.
 */
public final class QuoteMessageHandler implements UpstreamMessageHandler {
    private static final Logger log = LoggerFactory.getLogger(QuoteMessageHandler.class);

    private final QuoteMessageDecoder decoder;
    private final QuoteListener listener;
    private final StreamMetrics metrics;

    public QuoteMessageHandler(QuoteMessageDecoder decoder, QuoteListener listener, StreamMetrics metrics) {
        this.decoder = decoder;
        this.listener = listener;
        this.metrics = metrics;
    }

    @Override
    public void onMessage(String channel, String payload) {
        Quote quote;
        try {
            quote = decoder.decode(payload);
        } catch (MalformedQuoteException e) {
            metrics.recordQuoteMalformed();
            log.warn("[UPSTREAM] Discarding malformed message on {}: {}", channel, e.getMessage());
            return;
        } catch (RuntimeException e) {
            metrics.recordQuoteMalformed();
            log.error("[UPSTREAM] Decoder failed on message from {}, discarding", channel, e);
            return;
        }

        metrics.recordQuoteReceived();
        try {
            listener.onQuote(quote);
        } catch (RuntimeException e) {
            log.error("[UPSTREAM] Listener failed for {} quote", quote.ticker(), e);
        }
    }
}
