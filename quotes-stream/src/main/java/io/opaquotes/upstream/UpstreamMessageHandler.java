package io.opaquotes.upstream;

/**
 * Handles one raw message received on an upstream channel.
 * Called on the connector's I/O thread, so it must not block.
 */
@FunctionalInterface
public interface UpstreamMessageHandler {
    void onMessage(String channel, String payload);
}
