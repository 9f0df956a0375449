package io.opaquotes.stream;

import io.opaquotes.domain.stream.TickerFilter;

import java.util.List;
import java.util.Optional;

/**
 * Process-wide registry of live subscriptions, keyed by connection id.
 *
 * Snapshot reads vastly outnumber register/unregister calls; implementations
 * must let concurrent snapshots proceed without contending with each other.
 */
public interface SubscriptionRegistry {

    /**
     * Register a connection. The new subscription is visible to the very next
     * {@link #snapshotMatching(String)} call.
     *
     * @throws DuplicateConnectionException if the id is already registered
     */
    Subscription register(String connectionId, TickerFilter filter, SessionTransport transport);

    /**
     * Remove a connection. Unknown ids are a no-op.
     *
     * @return the removed subscription, or empty if it was not registered
     */
    Optional<Subscription> unregister(String connectionId);

    /**
     * Every subscription whose filter is ALL or contains {@code ticker}, as of the call.
     */
    List<Subscription> snapshotMatching(String ticker);

    List<Subscription> snapshotAll();

    Optional<Subscription> get(String connectionId);

    int size();
}
