package io.opaquotes.upstream;

/**
 * An upstream payload could not be turned into a domain value.
 * The message is discarded; the channel subscription is unaffected.
 */
public class MalformedQuoteException extends RuntimeException {

    public MalformedQuoteException(String message) {
        super(message);
    }

    public MalformedQuoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
