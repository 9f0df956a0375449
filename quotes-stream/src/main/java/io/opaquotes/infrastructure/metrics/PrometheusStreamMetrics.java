package io.opaquotes.infrastructure.metrics;

import io.opaquotes.domain.stream.CloseReason;
import io.opaquotes.domain.stream.OverflowPolicy;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;
import java.util.Locale;

/**
 * Prometheus implementation of StreamMetrics.
 *
 * Metrics are exposed at /metrics by {@link PrometheusMetricsHandler}.
 *
 * Key Metrics:
 * - quotes_stream_active_connections - Live WebSocket sessions
 * - quotes_stream_connections_total{outcome} - opened / rejected / duplicate_id
 * - quotes_stream_disconnects_total{reason} - Teardowns by close reason
 * - quotes_stream_quotes_received_total / quotes_stream_quotes_malformed_total
 * - quotes_stream_frames_enqueued_total / quotes_stream_frames_dropped_total{policy}
 * - quotes_stream_route_latency_seconds - Time to fan one quote out
 * - quotes_stream_upstream_connected{channel} - 1=subscribed, 0=down
 * - quotes_stream_upstream_reconnects_total{channel}
 */
public class PrometheusStreamMetrics implements StreamMetrics {

    private final CollectorRegistry registry;

    private final Gauge activeConnections;
    private final Counter connections;
    private final Counter disconnects;
    private final Counter quotesReceived;
    private final Counter quotesMalformed;
    private final Counter framesEnqueued;
    private final Counter framesDropped;
    private final Histogram routeLatency;
    private final Gauge upstreamConnected;
    private final Counter upstreamReconnects;

    public PrometheusStreamMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusStreamMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.activeConnections = Gauge.build()
            .name("quotes_stream_active_connections")
            .help("Number of active WebSocket quote subscriptions")
            .register(registry);

        this.connections = Counter.build()
            .name("quotes_stream_connections_total")
            .help("Connection attempts by outcome")
            .labelNames("outcome")
            .register(registry);

        this.disconnects = Counter.build()
            .name("quotes_stream_disconnects_total")
            .help("Session teardowns by close reason")
            .labelNames("reason")
            .register(registry);

        this.quotesReceived = Counter.build()
            .name("quotes_stream_quotes_received_total")
            .help("Quotes decoded from the upstream channel")
            .register(registry);

        this.quotesMalformed = Counter.build()
            .name("quotes_stream_quotes_malformed_total")
            .help("Upstream payloads discarded as malformed")
            .register(registry);

        this.framesEnqueued = Counter.build()
            .name("quotes_stream_frames_enqueued_total")
            .help("Frames enqueued onto subscriber queues")
            .register(registry);

        this.framesDropped = Counter.build()
            .name("quotes_stream_frames_dropped_total")
            .help("Frames dropped because a subscriber queue was full")
            .labelNames("policy")
            .register(registry);

        this.routeLatency = Histogram.build()
            .name("quotes_stream_route_latency_seconds")
            .help("Time to fan one quote out to matching subscribers")
            .buckets(0.00001, 0.00005, 0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05)
            .register(registry);

        this.upstreamConnected = Gauge.build()
            .name("quotes_stream_upstream_connected")
            .help("Upstream channel subscription status (1=connected, 0=down)")
            .labelNames("channel")
            .register(registry);

        this.upstreamReconnects = Counter.build()
            .name("quotes_stream_upstream_reconnects_total")
            .help("Upstream reconnection attempts")
            .labelNames("channel")
            .register(registry);
    }

    @Override
    public void recordConnectionOpened() {
        connections.labels("opened").inc();
        activeConnections.inc();
    }

    @Override
    public void recordConnectionRefused(String outcome) {
        connections.labels(outcome).inc();
    }

    @Override
    public void recordConnectionClosed(CloseReason reason) {
        disconnects.labels(reason.name().toLowerCase(Locale.ROOT)).inc();
        activeConnections.dec();
    }

    @Override
    public void recordQuoteReceived() {
        quotesReceived.inc();
    }

    @Override
    public void recordQuoteMalformed() {
        quotesMalformed.inc();
    }

    @Override
    public void recordRouted(int enqueued, Duration latency) {
        if (enqueued > 0) {
            framesEnqueued.inc(enqueued);
        }
        routeLatency.observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordFrameDropped(OverflowPolicy policy) {
        framesDropped.labels(policy.name().toLowerCase(Locale.ROOT)).inc();
    }

    @Override
    public void recordUpstreamConnected(String channel, boolean connected) {
        upstreamConnected.labels(channel).set(connected ? 1 : 0);
    }

    @Override
    public void recordUpstreamReconnect(String channel) {
        upstreamReconnects.labels(channel).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
