package org.cobbzilla.swifts3mirror;

/**
 * Supplies new destination credentials once the current ones have expired.
 */
public interface CredentialRefresher {

    /**
     * @throws StoreException if no credentials could be obtained
     */
    MirrorCredentials refresh();
}
