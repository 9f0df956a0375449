package io.opaquotes.stream;

/**
 * A connection id was registered twice. Ids are generated per accept and never
 * reused, so this is an invariant violation; it is fatal to that connection's
 * setup only.
 */
public class DuplicateConnectionException extends RuntimeException {

    private final String connectionId;

    public DuplicateConnectionException(String connectionId) {
        super("Connection already registered: " + connectionId);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
