package io.opaquotes.stream;

import java.time.Duration;

/**
 * Write side of one client connection. Owned by exactly one {@link Subscription}.
 */
public interface SessionTransport {

    /**
     * Write one text frame, blocking until it is flushed or the timeout elapses.
     *
     * @throws TransportException if the frame could not be written in time; the
     *         connection must be treated as terminated
     */
    void sendText(String frame, Duration timeout);

    /**
     * Start the close handshake with the given close code.
     */
    void close(int code, String reason);

    /**
     * Drop the connection without a close handshake.
     */
    void abort();

    boolean isOpen();

    String remoteAddress();
}
