package org.cobbzilla.swifts3mirror;

/**
 * A failure reported by the source or destination object store.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
