package io.opaquotes.domain.stream;

/**
 * Per-connection lifecycle. Transitions only move forward:
 * CONNECTING -> ACTIVE -> CLOSING.
 */
public enum SessionState {
    CONNECTING,
    ACTIVE,
    CLOSING
}
