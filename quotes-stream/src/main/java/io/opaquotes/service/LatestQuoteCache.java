package io.opaquotes.service;

import io.opaquotes.domain.data.Quote;
import io.opaquotes.stream.QuoteListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last quote seen on the stream per ticker.
 * Backs the "latest quote" REST endpoints without a round trip to storage.
 */
public final class LatestQuoteCache implements QuoteListener {
    private static final Logger log = LoggerFactory.getLogger(LatestQuoteCache.class);

    private final ConcurrentHashMap<String, Quote> latest = new ConcurrentHashMap<>();

    /**
     * Keep the quote unless a newer one for the same ticker is already cached.
     */
    @Override
    public void onQuote(Quote quote) {
        latest.merge(quote.ticker(), quote,
            (current, incoming) -> incoming.timestamp().isBefore(current.timestamp()) ? current : incoming);
        log.trace("Latest quote cache: {} @ {}", quote.ticker(), quote.timestamp());
    }

    public Optional<Quote> get(String ticker) {
        if (ticker == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(latest.get(ticker.trim().toUpperCase(Locale.ROOT)));
    }

    /**
     * Latest quotes for the given tickers, in request order. Unknown tickers are absent.
     */
    public Map<String, Quote> getLatest(Iterable<String> tickers) {
        Map<String, Quote> result = new LinkedHashMap<>();
        for (String ticker : tickers) {
            get(ticker).ifPresent(q -> result.put(q.ticker(), q));
        }
        return result;
    }

    public int size() {
        return latest.size();
    }

    public void clear() {
        latest.clear();
        log.info("Latest quote cache cleared");
    }
}
