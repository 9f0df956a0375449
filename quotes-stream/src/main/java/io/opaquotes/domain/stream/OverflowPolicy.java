package io.opaquotes.domain.stream;

/**
 * What happens when a connection's outbound queue is full.
 */
public enum OverflowPolicy {
    /** Evict the oldest queued frame to make room ("freshest wins"). */
    DROP_OLDEST,
    /** Close the connection with an internal-error close frame. */
    DISCONNECT
}
