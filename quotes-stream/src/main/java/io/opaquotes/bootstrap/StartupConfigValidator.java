package io.opaquotes.bootstrap;

import io.opaquotes.config.StreamConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. An invalid configuration throws
 * IllegalStateException and the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {}

    /**
     * @throws IllegalStateException if any setting is out of range
     */
    public static void validate(StreamConfig config) {
        log.info("Running startup config validation...");

        if (config.port() < 1 || config.port() > 65535) {
            throw invalid("PORT must be within 1..65535, got " + config.port());
        }
        if (config.queueCapacity() <= 0) {
            throw invalid("WS_QUEUE_CAPACITY must be positive, got " + config.queueCapacity());
        }
        if (config.overflowPolicy() == null) {
            throw invalid("WS_OVERFLOW_POLICY must be DROP_OLDEST or DISCONNECT");
        }
        requirePositive("WS_WRITE_TIMEOUT_MS", config.writeTimeout());
        requirePositive("WS_HANDSHAKE_TIMEOUT_MS", config.handshakeTimeout());
        requirePositive("UPSTREAM_BACKOFF_INITIAL_MS", config.backoffInitial());
        requirePositive("UPSTREAM_BACKOFF_MAX_MS", config.backoffMax());
        requirePositive("SHUTDOWN_TIMEOUT_MS", config.shutdownTimeout());
        requirePositive("CAPACITY_SCORE_TTL_MS", config.capacityScoreTtl());
        if (config.backoffInitial().compareTo(config.backoffMax()) > 0) {
            throw invalid("UPSTREAM_BACKOFF_INITIAL_MS cannot exceed UPSTREAM_BACKOFF_MAX_MS");
        }

        requireChannel("QUOTES_CHANNEL", config.quotesChannel());
        if (config.capacityEnabled()) {
            requireChannel("CAPACITY_CHANNEL", config.capacityChannel());
            if (config.capacityChannel().equals(config.quotesChannel())) {
                throw invalid("CAPACITY_CHANNEL must differ from QUOTES_CHANNEL");
            }
        }
        validateRedisUrl(config.redisUrl());

        log.info("✓ Listening on {}:{}, queue capacity {}, overflow policy {}",
            config.host(), config.port(), config.queueCapacity(), config.overflowPolicy());
        log.info("✓ Upstream channels: quotes={} capacity={}",
            config.quotesChannel(), config.capacityEnabled() ? config.capacityChannel() : "disabled");
        log.info("Startup config validation passed");
    }

    private static void validateRedisUrl(String url) {
        if (url == null || url.isBlank()) {
            throw invalid("REDIS_URL is required");
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (!"redis".equals(scheme) && !"rediss".equals(scheme)) {
                throw invalid("REDIS_URL must use redis:// or rediss://, got " + url);
            }
            if (uri.getHost() == null) {
                throw invalid("REDIS_URL has no host: " + url);
            }
        } catch (URISyntaxException e) {
            throw new IllegalStateException("INVALID CONFIG: REDIS_URL is not a valid URI: " + e.getMessage(), e);
        }
    }

    private static void requirePositive(String key, Duration d) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw invalid(key + " must be positive");
        }
    }

    private static void requireChannel(String key, String channel) {
        if (channel == null || channel.isBlank()) {
            throw invalid(key + " cannot be blank");
        }
    }

    private static IllegalStateException invalid(String message) {
        return new IllegalStateException("INVALID CONFIG: " + message + "\nSystem refuses to start.");
    }
}
