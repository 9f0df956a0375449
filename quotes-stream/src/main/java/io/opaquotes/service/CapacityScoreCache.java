package io.opaquotes.service;

import io.opaquotes.domain.data.CapacityScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capacity scores per ticker with a fixed time-to-live from the moment of receipt.
 */
public final class CapacityScoreCache {
    private static final Logger log = LoggerFactory.getLogger(CapacityScoreCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentHashMap<String, Entry> scores = new ConcurrentHashMap<>();

    public CapacityScoreCache() {
        this(DEFAULT_TTL, Clock.systemUTC());
    }

    public CapacityScoreCache(Duration ttl, Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    public void put(CapacityScore score) {
        scores.put(key(score.ticker()), new Entry(score, clock.instant().plus(ttl)));
    }

    /**
     * @return the cached score, or empty when none was received or it has expired
     */
    public Optional<CapacityScore> get(String ticker) {
        if (ticker == null) {
            return Optional.empty();
        }
        String k = key(ticker);
        Entry e = scores.get(k);
        if (e == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(e.expiresAt())) {
            scores.remove(k, e);
            return Optional.empty();
        }
        return Optional.of(e.score());
    }

    /**
     * Drop expired entries.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = scores.size();
        scores.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt()));
        int removed = before - scores.size();
        if (removed > 0) {
            log.debug("Purged {} expired capacity scores", removed);
        }
        return removed;
    }

    public int size() {
        return scores.size();
    }

    public Duration getTtl() {
        return ttl;
    }

    private static String key(String ticker) {
        return ticker.trim().toUpperCase(Locale.ROOT);
    }

    private record Entry(CapacityScore score, Instant expiresAt) {}
}
