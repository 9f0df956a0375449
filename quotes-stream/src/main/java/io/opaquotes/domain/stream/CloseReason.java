package io.opaquotes.domain.stream;

/**
 * Why a session ended, and how its transport is released.
 */
public enum CloseReason {
    CLIENT_CLOSED(1000, "client closed", Release.NONE),
    SERVER_SHUTDOWN(1000, "server shutdown", Release.CLOSE_FRAME),
    REJECTED(1001, "server shutting down", Release.CLOSE_FRAME),
    SLOW_CONSUMER(1011, "slow consumer", Release.CLOSE_FRAME),
    INTERNAL_ERROR(1011, "internal server error", Release.CLOSE_FRAME),
    TRANSPORT_ERROR(1011, "transport error", Release.ABORT);

    /** How the transport handle is given back. */
    public enum Release {
        /** Peer already started the close handshake; the server echo is automatic. */
        NONE,
        CLOSE_FRAME,
        /** Channel is broken: drop it without a close frame. */
        ABORT
    }

    private final int code;
    private final String text;
    private final Release release;

    CloseReason(int code, String text, Release release) {
        this.code = code;
        this.text = text;
        this.release = release;
    }

    public int code() {
        return code;
    }

    public String text() {
        return text;
    }

    public Release release() {
        return release;
    }
}
