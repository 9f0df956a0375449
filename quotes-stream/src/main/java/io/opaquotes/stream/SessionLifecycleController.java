package io.opaquotes.stream;

import io.opaquotes.domain.stream.CloseReason;
import io.opaquotes.domain.stream.TickerFilter;
import io.opaquotes.infrastructure.metrics.StreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Owns the accept -> register -> stream -> unregister -> release sequence of
 * every connection.
 *
 * - open(): parse the filter, register, start the delivery worker (CONNECTING -> ACTIVE)
 * - close(): unregister and release the transport exactly once (ACTIVE -> CLOSING)
 * - shutdown(): refuse new connections, drain every worker, bounded wait
 */
public final class SessionLifecycleController {
    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleController.class);

    private final SubscriptionRegistry registry;
    private final Duration writeTimeout;
    private final StreamMetrics metrics;
    private final ExecutorService deliveryExecutor;
    private final Supplier<String> idGenerator;

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
    private volatile boolean accepting = true;

    public SessionLifecycleController(SubscriptionRegistry registry, Duration writeTimeout, StreamMetrics metrics) {
        this(registry, writeTimeout, metrics, newDeliveryExecutor(), () -> UUID.randomUUID().toString());
    }

    public SessionLifecycleController(SubscriptionRegistry registry, Duration writeTimeout, StreamMetrics metrics,
                                      ExecutorService deliveryExecutor, Supplier<String> idGenerator) {
        this.registry = registry;
        this.writeTimeout = writeTimeout;
        this.metrics = metrics;
        this.deliveryExecutor = deliveryExecutor;
        this.idGenerator = idGenerator;
    }

    /**
     * One thread per connection; daemon so a stuck write never blocks JVM exit.
     */
    public static ExecutorService newDeliveryExecutor() {
        AtomicLong seq = new AtomicLong();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "quote-delivery-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Set up a newly accepted connection.
     *
     * @param tickersParam raw {@code tickers} parameter, may be null
     * @return the active session, or empty if the connection was refused (its
     *         transport has already been closed)
     */
    public Optional<Session> open(String tickersParam, SessionTransport transport) {
        String connectionId = idGenerator.get();
        TickerFilter filter = TickerFilterParser.parse(tickersParam);
        Session session = new Session(connectionId, filter, transport);

        if (!accepting) {
            log.info("[SESSION] Refusing connection from {}: shutting down", transport.remoteAddress());
            release(connectionId, transport, CloseReason.REJECTED);
            metrics.recordConnectionRefused("rejected");
            return Optional.empty();
        }

        Subscription subscription;
        try {
            subscription = registry.register(connectionId, filter, transport);
        } catch (DuplicateConnectionException e) {
            log.error("[SESSION] Setup failed for connection from {}: {}", transport.remoteAddress(), e.getMessage());
            release(connectionId, transport, CloseReason.INTERNAL_ERROR);
            metrics.recordConnectionRefused("duplicate_id");
            return Optional.empty();
        }

        session.activate(subscription);
        sessions.put(connectionId, session);
        metrics.recordConnectionOpened();

        try {
            deliveryExecutor.execute(new DeliveryWorker(subscription, writeTimeout, this::close));
        } catch (RejectedExecutionException e) {
            log.warn("[SESSION] Delivery executor rejected {}, closing", connectionId);
            close(connectionId, CloseReason.REJECTED);
            return Optional.empty();
        }

        log.info("[SESSION] Connected {} from {} filter={} (active: {})",
            connectionId, transport.remoteAddress(), filter, sessions.size());

        // shutdown() may have taken its snapshot before this session was added
        if (!accepting) {
            close(connectionId, CloseReason.SERVER_SHUTDOWN);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    /**
     * Tear a session down. Safe to call any number of times from any thread;
     * only the first call unregisters and releases the transport.
     *
     * @return true if this call performed the teardown
     */
    public boolean close(String connectionId, CloseReason reason) {
        Session session = sessions.get(connectionId);
        if (session == null || !session.beginClosing()) {
            return false;
        }

        Subscription subscription = session.getSubscription();
        try {
            registry.unregister(connectionId);
            subscription.markClosing();
            release(connectionId, session.getTransport(), reason);
        } finally {
            sessions.remove(connectionId);
            session.markReleased();
        }

        metrics.recordConnectionClosed(reason);
        log.info("[SESSION] Closed {} reason={} enqueued={} dropped={} (active: {})",
            connectionId, reason, subscription.getEnqueuedCount(), subscription.getDroppedCount(), sessions.size());
        return true;
    }

    /**
     * Graceful shutdown: stop accepting, ask every worker to drain and close,
     * wait up to {@code timeout}, then force-close whatever is left.
     */
    public void shutdown(Duration timeout) {
        accepting = false;

        List<Session> active = new ArrayList<>(sessions.values());
        log.info("[SESSION] Shutting down, draining {} sessions (timeout {}ms)", active.size(), timeout.toMillis());

        for (Session s : active) {
            s.getSubscription().requestDrain();
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            for (Session s : active) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) break;
                s.awaitReleased(Duration.ofNanos(remaining));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        for (Session s : new ArrayList<>(sessions.values())) {
            log.warn("[SESSION] {} did not drain in time, forcing close", s.getConnectionId());
            close(s.getConnectionId(), CloseReason.SERVER_SHUTDOWN);
        }

        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("[SESSION] Shutdown complete");
    }

    public boolean isAccepting() {
        return accepting;
    }

    public Optional<Session> getSession(String connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }

    private void release(String connectionId, SessionTransport transport, CloseReason reason) {
        try {
            switch (reason.release()) {
                case NONE -> { }
                case CLOSE_FRAME -> transport.close(reason.code(), reason.text());
                case ABORT -> transport.abort();
            }
        } catch (RuntimeException e) {
            log.debug("[SESSION] Releasing transport of {} failed: {}", connectionId, e.getMessage());
        }
    }
}
