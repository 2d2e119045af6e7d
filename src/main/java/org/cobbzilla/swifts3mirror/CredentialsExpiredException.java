package org.cobbzilla.swifts3mirror;

/**
 * The destination rejected a request because the session credentials have expired.
 */
public class CredentialsExpiredException extends StoreException {

    public CredentialsExpiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
