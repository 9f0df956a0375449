package io.opaquotes.upstream;

import io.opaquotes.infrastructure.metrics.StreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one upstream channel subscribed, reconnecting with capped exponential
 * backoff whenever the subscription fails or is lost.
 *
 * State machine: DISCONNECTED -> CONNECTING -> CONNECTED -> (DISCONNECTED | STOPPED).
 * Nothing is buffered while disconnected. The loop runs on its own daemon
 * thread; {@link #stop()} is terminal.
 */
public final class UpstreamChannelAdapter {
    private static final Logger log = LoggerFactory.getLogger(UpstreamChannelAdapter.class);

    private final String channel;
    private final UpstreamConnector connector;
    private final UpstreamMessageHandler handler;
    private final ReconnectionPolicy policy;
    private final Sleeper sleeper;
    private final StreamMetrics metrics;

    private final AtomicReference<UpstreamState> state = new AtomicReference<>(UpstreamState.DISCONNECTED);
    private volatile boolean running = false;
    private volatile UpstreamSubscription current;
    private volatile Thread loopThread;

    public UpstreamChannelAdapter(String channel, UpstreamConnector connector, UpstreamMessageHandler handler,
                                  ReconnectionPolicy policy, Sleeper sleeper, StreamMetrics metrics) {
        this.channel = channel;
        this.connector = connector;
        this.handler = handler;
        this.policy = policy;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * Start the subscribe loop. Returns immediately.
     */
    public synchronized void start() {
        if (loopThread != null) {
            throw new IllegalStateException("Adapter for " + channel + " already started");
        }
        running = true;
        Thread t = new Thread(this::runLoop, "upstream-" + channel);
        t.setDaemon(true);
        loopThread = t;
        t.start();
        log.info("[UPSTREAM] Adapter started for channel {}", channel);
    }

    /**
     * Stop for good: close the live subscription and end the loop.
     */
    public void stop() {
        running = false;
        state.set(UpstreamState.STOPPED);

        UpstreamSubscription sub = current;
        if (sub != null) {
            sub.close();
        }

        Thread t = loopThread;
        if (t != null) {
            t.interrupt();
            try {
                t.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        metrics.recordUpstreamConnected(channel, false);
        log.info("[UPSTREAM] Adapter stopped for channel {}", channel);
    }

    public UpstreamState getState() {
        return state.get();
    }

    public String getChannel() {
        return channel;
    }

    /**
     * Failed subscribe attempts plus lost subscriptions since start.
     */
    public long getReconnectCount() {
        return policy.getTotalFailures();
    }

    private void runLoop() {
        while (running) {
            transition(UpstreamState.CONNECTING);
            CountDownLatch lost = new CountDownLatch(1);

            UpstreamSubscription sub;
            try {
                sub = connector.subscribe(channel, handler, lost::countDown);
            } catch (RuntimeException e) {
                if (!running) {
                    break;
                }
                transition(UpstreamState.DISCONNECTED);
                Duration wait = policy.getNextDelay();
                policy.recordFailure();
                log.warn("[UPSTREAM] Subscribe to {} failed (attempt {}): {}. Retrying in {}ms",
                    channel, policy.getAttemptCount(), e.getMessage(), wait.toMillis());
                if (!backoff(wait)) {
                    break;
                }
                continue;
            }

            current = sub;
            if (!running) {
                sub.close();
                break;
            }
            policy.recordSuccess();
            transition(UpstreamState.CONNECTED);
            metrics.recordUpstreamConnected(channel, true);
            log.info("[UPSTREAM] Subscribed to {}", channel);

            try {
                lost.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } finally {
                sub.close();
                current = null;
            }

            metrics.recordUpstreamConnected(channel, false);
            if (!running) {
                break;
            }
            transition(UpstreamState.DISCONNECTED);
            Duration wait = policy.getNextDelay();
            policy.recordFailure();
            log.warn("[UPSTREAM] Lost subscription to {}, reconnecting in {}ms", channel, wait.toMillis());
            if (!backoff(wait)) {
                break;
            }
        }
        state.set(UpstreamState.STOPPED);
        log.debug("[UPSTREAM] Loop for {} exited", channel);
    }

    private boolean backoff(Duration wait) {
        metrics.recordUpstreamReconnect(channel);
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return running;
    }

    // STOPPED is terminal; a late transition from the loop thread must not undo it
    private void transition(UpstreamState next) {
        state.updateAndGet(s -> s == UpstreamState.STOPPED ? s : next);
    }
}
