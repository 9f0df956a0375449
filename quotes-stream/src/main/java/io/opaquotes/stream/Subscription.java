package io.opaquotes.stream;

import io.opaquotes.domain.stream.OverflowPolicy;
import io.opaquotes.domain.stream.TickerFilter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live state of one client connection: its filter, its bounded outbound queue
 * and its transport.
 *
 * The queue has one writer (the fan-out router) and one reader (the delivery
 * worker); the queue itself is the only synchronization between them.
 */
public final class Subscription {

    /** Outcome of a non-blocking enqueue. */
    public enum OfferResult {
        ENQUEUED,
        /** Enqueued after evicting the oldest frame. */
        ENQUEUED_DROPPED_OLDEST,
        /** Queue full under {@link OverflowPolicy#DISCONNECT}; the connection is marked for closing. */
        REJECTED_DISCONNECT,
        /** Subscription is closing or already marked for disconnect; nothing enqueued. */
        CLOSED
    }

    private final String connectionId;
    private final TickerFilter filter;
    private final SessionTransport transport;
    private final int capacity;
    private final BlockingQueue<String> outboundQueue;

    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    private volatile boolean closing = false;
    private volatile boolean draining = false;
    private volatile boolean forcedDisconnect = false;

    public Subscription(String connectionId, TickerFilter filter, SessionTransport transport, int capacity) {
        if (connectionId == null || connectionId.isEmpty()) {
            throw new IllegalArgumentException("connectionId cannot be empty");
        }
        if (filter == null || transport == null) {
            throw new IllegalArgumentException("filter and transport cannot be null");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive");
        }
        this.connectionId = connectionId;
        this.filter = filter;
        this.transport = transport;
        this.capacity = capacity;
        this.outboundQueue = new ArrayBlockingQueue<>(capacity);
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

    public int getCapacity() {
        return capacity;
    }

    public boolean matches(String ticker) {
        return filter.matches(ticker);
    }

    /**
     * Enqueue a serialized frame without blocking.
     */
    public OfferResult offer(String frame, OverflowPolicy policy) {
        if (closing || forcedDisconnect) {
            return OfferResult.CLOSED;
        }
        if (outboundQueue.offer(frame)) {
            enqueued.incrementAndGet();
            return OfferResult.ENQUEUED;
        }
        if (policy == OverflowPolicy.DISCONNECT) {
            forcedDisconnect = true;
            return OfferResult.REJECTED_DISCONNECT;
        }

        // The worker may be draining at the same time, so retry until the frame fits.
        boolean evicted = false;
        while (!outboundQueue.offer(frame)) {
            if (outboundQueue.poll() != null) {
                dropped.incrementAndGet();
                evicted = true;
            }
        }
        enqueued.incrementAndGet();
        return evicted ? OfferResult.ENQUEUED_DROPPED_OLDEST : OfferResult.ENQUEUED;
    }

    /**
     * Wait up to {@code timeout} for the next frame; null if none arrived.
     */
    String poll(long timeout, TimeUnit unit) throws InterruptedException {
        return outboundQueue.poll(timeout, unit);
    }

    String pollNow() {
        return outboundQueue.poll();
    }

    /**
     * Copy of what is currently queued, oldest first. Does not consume.
     */
    public List<String> pendingFrames() {
        return new ArrayList<>(outboundQueue);
    }

    public int queuedCount() {
        return outboundQueue.size();
    }

    public long getEnqueuedCount() {
        return enqueued.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    /**
     * Stop accepting frames; the worker exits without writing what is left.
     */
    void markClosing() {
        closing = true;
    }

    public boolean isClosing() {
        return closing;
    }

    /**
     * Ask the worker to write what is queued and then close normally.
     */
    void requestDrain() {
        draining = true;
    }

    public boolean isDraining() {
        return draining;
    }

    public boolean isForcedDisconnect() {
        return forcedDisconnect;
    }

    @Override
    public String toString() {
        return "Subscription{" + connectionId + ", filter=" + filter + ", queued=" + outboundQueue.size()
            + "/" + capacity + ", dropped=" + dropped.get() + "}";
    }
}
