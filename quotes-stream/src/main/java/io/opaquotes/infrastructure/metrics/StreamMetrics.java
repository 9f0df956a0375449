package io.opaquotes.infrastructure.metrics;

import io.opaquotes.domain.stream.CloseReason;
import io.opaquotes.domain.stream.OverflowPolicy;

import java.time.Duration;

/**
 * Stream metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Active connections and connection outcomes
 * - Quotes received / malformed
 * - Frames enqueued and dropped by the overflow policy
 * - Disconnects by reason
 * - Upstream channel state and reconnects
 * - Routing latency
 */
public interface StreamMetrics {

    /**
     * Record a connection that reached ACTIVE.
     */
    void recordConnectionOpened();

    /**
     * Record a connection that never reached ACTIVE.
     *
     * @param outcome short label (rejected, duplicate_id, ...)
     */
    void recordConnectionRefused(String outcome);

    /**
     * Record a session teardown.
     */
    void recordConnectionClosed(CloseReason reason);

    void recordQuoteReceived();

    void recordQuoteMalformed();

    /**
     * Record one routed quote.
     *
     * @param enqueued number of subscriptions the frame was enqueued to
     * @param latency time spent in the router
     */
    void recordRouted(int enqueued, Duration latency);

    void recordFrameDropped(OverflowPolicy policy);

    void recordUpstreamConnected(String channel, boolean connected);

    void recordUpstreamReconnect(String channel);

    /**
     * Metrics that do nothing. Used where no registry is wired (tests, tools).
     */
    StreamMetrics NOOP = new StreamMetrics() {
        @Override public void recordConnectionOpened() {}
        @Override public void recordConnectionRefused(String outcome) {}
        @Override public void recordConnectionClosed(CloseReason reason) {}
        @Override public void recordQuoteReceived() {}
        @Override public void recordQuoteMalformed() {}
        @Override public void recordRouted(int enqueued, Duration latency) {}
        @Override public void recordFrameDropped(OverflowPolicy policy) {}
        @Override public void recordUpstreamConnected(String channel, boolean connected) {}
        @Override public void recordUpstreamReconnect(String channel) {}
    };
}
