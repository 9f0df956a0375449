package io.opaquotes.upstream;

/**
 * Connection state of an upstream channel adapter.
 */
public enum UpstreamState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    STOPPED
}
