package io.opaquotes.config;

import io.opaquotes.domain.stream.OverflowPolicy;
import io.opaquotes.util.Env;

import java.time.Duration;

/**
 * Process configuration, read once at startup.
 */
public record StreamConfig(
    String host,
    int port,
    String version,
    String redisUrl,
    String quotesChannel,
    String capacityChannel,
    boolean capacityEnabled,
    int queueCapacity,
    OverflowPolicy overflowPolicy,
    Duration writeTimeout,
    Duration handshakeTimeout,
    Duration backoffInitial,
    Duration backoffMax,
    Duration shutdownTimeout,
    Duration capacityScoreTtl
) {
    public static final String DEFAULT_QUOTES_CHANNEL = "quotes.realtime";
    public static final String DEFAULT_CAPACITY_CHANNEL = "capacity.scoring";

    public static StreamConfig fromEnv() {
        return new StreamConfig(
            Env.get("HOST", "0.0.0.0"),
            Env.getInt("PORT", 8000),
            Env.get("APP_VERSION", "0.1.0"),
            Env.get("REDIS_URL", "redis://localhost:6379/0"),
            Env.get("QUOTES_CHANNEL", DEFAULT_QUOTES_CHANNEL),
            Env.get("CAPACITY_CHANNEL", DEFAULT_CAPACITY_CHANNEL),
            Env.getBool("CAPACITY_ENABLED", true),
            Env.getInt("WS_QUEUE_CAPACITY", 1000),
            Env.getEnum("WS_OVERFLOW_POLICY", OverflowPolicy.class, OverflowPolicy.DROP_OLDEST),
            Env.getMillis("WS_WRITE_TIMEOUT_MS", 10_000),
            Env.getMillis("WS_HANDSHAKE_TIMEOUT_MS", 30_000),
            Env.getMillis("UPSTREAM_BACKOFF_INITIAL_MS", 1_000),
            Env.getMillis("UPSTREAM_BACKOFF_MAX_MS", 30_000),
            Env.getMillis("SHUTDOWN_TIMEOUT_MS", 10_000),
            Env.getMillis("CAPACITY_SCORE_TTL_MS", 3_600_000)
        );
    }
}
