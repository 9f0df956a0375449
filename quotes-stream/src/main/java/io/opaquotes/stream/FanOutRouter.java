package io.opaquotes.stream;

import io.opaquotes.domain.data.Quote;
import io.opaquotes.domain.stream.OverflowPolicy;
import io.opaquotes.infrastructure.metrics.StreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Fans each quote out to the subscriptions whose filter matches its ticker.
 *
 * Never blocks on a consumer: every enqueue is non-blocking and a full queue is
 * handled by the configured {@link OverflowPolicy}. Each subscription is handled
 * independently, so a full queue or a failure on one does not affect the rest.
 */
public final class FanOutRouter implements QuoteListener {
    private static final Logger log = LoggerFactory.getLogger(FanOutRouter.class);

    // Log the first drop per subscription, then every Nth
    private static final long DROP_LOG_EVERY = 1000;

    private final SubscriptionRegistry registry;
    private final OverflowPolicy policy;
    private final StreamMetrics metrics;

    public FanOutRouter(SubscriptionRegistry registry, OverflowPolicy policy, StreamMetrics metrics) {
        this.registry = registry;
        this.policy = policy;
        this.metrics = metrics;
    }

    @Override
    public void onQuote(Quote quote) {
        route(quote);
    }

    /**
     * Route one quote.
     *
     * @return number of subscriptions the quote was enqueued to
     */
    public int route(Quote quote) {
        long start = System.nanoTime();

        List<Subscription> targets = registry.snapshotMatching(quote.ticker());
        if (targets.isEmpty()) {
            metrics.recordRouted(0, Duration.ofNanos(System.nanoTime() - start));
            return 0;
        }

        // Serialize once, share the frame across every matching queue
        String frame = QuoteJsonMapper.toJson(quote);

        int enqueued = 0;
        for (Subscription sub : targets) {
            try {
                switch (sub.offer(frame, policy)) {
                    case ENQUEUED -> enqueued++;
                    case ENQUEUED_DROPPED_OLDEST -> {
                        enqueued++;
                        metrics.recordFrameDropped(policy);
                        long dropped = sub.getDroppedCount();
                        if (dropped == 1 || dropped % DROP_LOG_EVERY == 0) {
                            log.warn("[ROUTER] Slow consumer {}: queue full ({}), dropped oldest (total dropped={})",
                                sub.getConnectionId(), sub.getCapacity(), dropped);
                        }
                    }
                    case REJECTED_DISCONNECT -> {
                        metrics.recordFrameDropped(policy);
                        log.warn("[ROUTER] Slow consumer {}: queue full ({}), marked for disconnect",
                            sub.getConnectionId(), sub.getCapacity());
                    }
                    case CLOSED -> log.trace("[ROUTER] Skipping closing subscription {}", sub.getConnectionId());
                }
            } catch (RuntimeException e) {
                log.warn("[ROUTER] Enqueue failed for {} ({}): {}", sub.getConnectionId(), quote.ticker(), e.getMessage(), e);
            }
        }

        metrics.recordRouted(enqueued, Duration.ofNanos(System.nanoTime() - start));
        return enqueued;
    }

    public OverflowPolicy getPolicy() {
        return policy;
    }
}
