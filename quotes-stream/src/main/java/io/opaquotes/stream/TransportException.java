package io.opaquotes.stream;

/**
 * Write or close failure on a single client transport.
 * Local to that connection: it triggers teardown of that connection only.
 */
public class TransportException extends RuntimeException {

    private final String remoteAddress;

    public TransportException(String remoteAddress, String message) {
        super(String.format("[%s] %s", remoteAddress, message));
        this.remoteAddress = remoteAddress;
    }

    public TransportException(String remoteAddress, String message, Throwable cause) {
        super(String.format("[%s] %s", remoteAddress, message), cause);
        this.remoteAddress = remoteAddress;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }
}
