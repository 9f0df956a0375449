package io.opaquotes.stream;

import io.opaquotes.domain.stream.SessionState;
import io.opaquotes.domain.stream.TickerFilter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One client connection as seen by the lifecycle controller.
 */
public final class Session {
    private final String connectionId;
    private final TickerFilter filter;
    private final SessionTransport transport;
    private final Instant connectedAt;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private final CountDownLatch released = new CountDownLatch(1);
    private volatile Subscription subscription;

    Session(String connectionId, TickerFilter filter, SessionTransport transport) {
        this.connectionId = connectionId;
        this.filter = filter;
        this.transport = transport;
        this.connectedAt = Instant.now();
    }

    public String getConnectionId() {
        return connectionId;
    }

    public TickerFilter getFilter() {
        return filter;
    }

    public SessionTransport getTransport() {
        return transport;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public SessionState getState() {
        return state.get();
    }

    public Subscription getSubscription() {
        return subscription;
    }

    boolean activate(Subscription subscription) {
        this.subscription = subscription;
        return state.compareAndSet(SessionState.CONNECTING, SessionState.ACTIVE);
    }

    /**
     * Move to CLOSING. Only the first caller wins.
     */
    boolean beginClosing() {
        return state.compareAndSet(SessionState.ACTIVE, SessionState.CLOSING);
    }

    void markReleased() {
        released.countDown();
    }

    /**
     * Wait for teardown to complete.
     *
     * @return true if the session was released within the timeout
     */
    boolean awaitReleased(Duration timeout) throws InterruptedException {
        return released.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
