package io.opaquotes.upstream;

/**
 * Opens pub/sub subscriptions on the upstream broker.
 */
public interface UpstreamConnector extends AutoCloseable {

    /**
     * Subscribe to {@code channel}.
     *
     * @param handler receives every message published on the channel
     * @param onDisconnect invoked at most once when the subscription is lost
     *                     for any reason other than {@link UpstreamSubscription#close()}
     * @throws UpstreamConnectionException if the connection or subscribe fails
     */
    UpstreamSubscription subscribe(String channel, UpstreamMessageHandler handler, Runnable onDisconnect);

    /**
     * Release client resources. Open subscriptions are closed.
     */
    @Override
    void close();
}
