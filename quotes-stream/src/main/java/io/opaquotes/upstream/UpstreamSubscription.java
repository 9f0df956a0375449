package io.opaquotes.upstream;

/**
 * Handle on a live channel subscription returned by {@link UpstreamConnector}.
 */
public interface UpstreamSubscription extends AutoCloseable {

    boolean isOpen();

    /**
     * Unsubscribe and release the underlying connection. Idempotent.
     */
    @Override
    void close();
}
