package io.opaquotes.upstream;

/**
 * Connecting or subscribing to an upstream channel failed.
 * Caught by the channel adapter, which backs off and retries.
 */
public class UpstreamConnectionException extends RuntimeException {

    private final String channel;

    public UpstreamConnectionException(String channel, String message) {
        super(String.format("[%s] %s", channel, message));
        this.channel = channel;
    }

    public UpstreamConnectionException(String channel, String message, Throwable cause) {
        super(String.format("[%s] %s", channel, message), cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
