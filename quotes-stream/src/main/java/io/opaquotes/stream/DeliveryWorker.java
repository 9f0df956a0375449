package io.opaquotes.stream;

import io.opaquotes.domain.stream.CloseReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drains one subscription's queue onto its transport, oldest frame first.
 *
 * Runs until the subscription is closed by someone else, the transport fails,
 * the router marks it for forced disconnect, or a drain request has emptied
 * the queue. Every exit other than an external close goes through
 * {@link Teardown} so the lifecycle controller stays the single place that
 * releases the connection.
 */
public final class DeliveryWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(DeliveryWorker.class);

    static final long WAKE_INTERVAL_MS = 50;

    /**
     * Callback into the lifecycle controller.
     */
    @FunctionalInterface
    public interface Teardown {
        void close(String connectionId, CloseReason reason);
    }

    private final Subscription subscription;
    private final Duration writeTimeout;
    private final Teardown teardown;

    private final AtomicLong written = new AtomicLong();

    public DeliveryWorker(Subscription subscription, Duration writeTimeout, Teardown teardown) {
        this.subscription = subscription;
        this.writeTimeout = writeTimeout;
        this.teardown = teardown;
    }

    @Override
    public void run() {
        String id = subscription.getConnectionId();
        log.debug("[DELIVERY] Worker started for {}", id);

        try {
            while (true) {
                if (subscription.isForcedDisconnect()) {
                    teardown.close(id, CloseReason.SLOW_CONSUMER);
                    return;
                }
                if (subscription.isClosing()) {
                    return;
                }

                String frame = subscription.poll(WAKE_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (frame == null) {
                    if (subscription.isDraining()) {
                        teardown.close(id, CloseReason.SERVER_SHUTDOWN);
                        return;
                    }
                    continue;
                }

                // Write everything already queued before waiting again
                do {
                    if (subscription.isClosing()) {
                        return;
                    }
                    subscription.getTransport().sendText(frame, writeTimeout);
                    written.incrementAndGet();
                } while ((frame = subscription.pollNow()) != null);
            }
        } catch (TransportException e) {
            log.info("[DELIVERY] Write failed for {}, closing: {}", id, e.getMessage());
            teardown.close(id, CloseReason.TRANSPORT_ERROR);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            teardown.close(id, CloseReason.SERVER_SHUTDOWN);
        } catch (RuntimeException e) {
            log.error("[DELIVERY] Worker for {} failed unexpectedly", id, e);
            teardown.close(id, CloseReason.INTERNAL_ERROR);
        } finally {
            log.debug("[DELIVERY] Worker for {} exiting after {} frames", id, written.get());
        }
    }

    /**
     * Frames written so far; safe to read from any thread.
     */
    public long getWrittenCount() {
        return written.get();
    }
}
