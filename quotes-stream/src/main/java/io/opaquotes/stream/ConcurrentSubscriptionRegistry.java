package io.opaquotes.stream;

import io.opaquotes.domain.stream.TickerFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Read-write locked registry with a ticker index.
 *
 * Layout:
 * - byId: connection id -> subscription (primary)
 * - byTicker: ticker -> subscriptions filtering on that ticker
 * - wildcard: subscriptions with an ALL filter
 *
 * A snapshot costs O(matches) under the read lock; register/unregister touch
 * one map entry per listed ticker under the write lock.
 */
public final class ConcurrentSubscriptionRegistry implements SubscriptionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConcurrentSubscriptionRegistry.class);

    private final int queueCapacity;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock readLock = lock.readLock();
    private final Lock writeLock = lock.writeLock();

    private final Map<String, Subscription> byId = new HashMap<>();
    private final Map<String, Set<Subscription>> byTicker = new HashMap<>();
    private final Set<Subscription> wildcard = new LinkedHashSet<>();

    public ConcurrentSubscriptionRegistry(int queueCapacity) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive");
        }
        this.queueCapacity = queueCapacity;
    }

    @Override
    public Subscription register(String connectionId, TickerFilter filter, SessionTransport transport) {
        Subscription subscription = new Subscription(connectionId, filter, transport, queueCapacity);

        writeLock.lock();
        try {
            if (byId.containsKey(connectionId)) {
                throw new DuplicateConnectionException(connectionId);
            }
            byId.put(connectionId, subscription);
            if (filter instanceof TickerFilter.Tickers tickers) {
                for (String symbol : tickers.symbols()) {
                    byTicker.computeIfAbsent(symbol, k -> new LinkedHashSet<>()).add(subscription);
                }
            } else {
                wildcard.add(subscription);
            }
        } finally {
            writeLock.unlock();
        }

        log.debug("[REGISTRY] Registered {} filter={}", connectionId, filter);
        return subscription;
    }

    @Override
    public Optional<Subscription> unregister(String connectionId) {
        Subscription removed;

        writeLock.lock();
        try {
            removed = byId.remove(connectionId);
            if (removed == null) {
                return Optional.empty();
            }
            if (removed.getFilter() instanceof TickerFilter.Tickers tickers) {
                for (String symbol : tickers.symbols()) {
                    Set<Subscription> subs = byTicker.get(symbol);
                    if (subs != null) {
                        subs.remove(removed);
                        if (subs.isEmpty()) {
                            byTicker.remove(symbol);
                        }
                    }
                }
            } else {
                wildcard.remove(removed);
            }
        } finally {
            writeLock.unlock();
        }

        log.debug("[REGISTRY] Unregistered {}", connectionId);
        return Optional.of(removed);
    }

    @Override
    public List<Subscription> snapshotMatching(String ticker) {
        readLock.lock();
        try {
            Set<Subscription> byThisTicker = ticker == null ? null : byTicker.get(ticker);
            int size = wildcard.size() + (byThisTicker == null ? 0 : byThisTicker.size());
            if (size == 0) {
                return List.of();
            }
            List<Subscription> result = new ArrayList<>(size);
            result.addAll(wildcard);
            if (byThisTicker != null) {
                result.addAll(byThisTicker);
            }
            return result;
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<Subscription> snapshotAll() {
        readLock.lock();
        try {
            return new ArrayList<>(byId.values());
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Optional<Subscription> get(String connectionId) {
        readLock.lock();
        try {
            return Optional.ofNullable(byId.get(connectionId));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int size() {
        readLock.lock();
        try {
            return byId.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Number of distinct tickers with at least one explicit subscriber.
     */
    public int indexedTickerCount() {
        readLock.lock();
        try {
            return byTicker.size();
        } finally {
            readLock.unlock();
        }
    }
}
