package org.cobbzilla.swifts3mirror;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the destination client and rebuilds it when its credentials expire. However many workers
 * hit the expiry at the same time, the operator is asked for new credentials once: the first worker
 * to observe a client generation refreshes it, the others wait on the lock and retry with the new client.
 * Dispatch of new work is held back while a refresh is in progress, see {@link #awaitDispatch()}.
 */
@Slf4j
public class DestinationSession {

    public static final int MAX_CONSECUTIVE_REFRESHES = 3;

    private final DestinationStoreFactory factory;
    private final CredentialRefresher refresher;
    private final MirrorStats stats;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private DestinationStore store;
    private int generation = 0;

    public DestinationSession(DestinationStoreFactory factory, MirrorCredentials credentials,
                              CredentialRefresher refresher, MirrorStats stats) {
        this.factory = factory;
        this.refresher = refresher;
        this.stats = stats;
        this.store = factory.create(credentials);
    }

    /**
     * Runs the call against the current client. An expiry does not surface to the caller unless
     * {@link #MAX_CONSECUTIVE_REFRESHES} refreshes in a row did not help.
     */
    public <T, E extends Exception> T call(DestinationCall<T, E> call) throws E {
        int refreshes = 0;
        while (true) {
            final int observed;
            final DestinationStore current;
            lock.readLock().lock();
            try {
                observed = generation;
                current = store;
            } finally {
                lock.readLock().unlock();
            }

            try {
                return call.call(current);
            } catch (CredentialsExpiredException e) {
                if (++refreshes > MAX_CONSECUTIVE_REFRESHES) {
                    log.error("Credentials still expired after {} refreshes.", MAX_CONSECUTIVE_REFRESHES);
                    throw e;
                }
                log.warn("AWS session expired. Requesting new credentials.");
                refresh(observed);
            }
        }
    }

    /**
     * Blocks while a credential refresh is in progress.
     */
    public void awaitDispatch() {
        lock.readLock().lock();
        lock.readLock().unlock();
    }

    public int getGeneration() {
        lock.readLock().lock();
        try {
            return generation;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void refresh(int observedGeneration) {
        lock.writeLock().lock();
        try {
            if (generation != observedGeneration) {
                log.info("Credentials were already refreshed by another worker, retrying.");
                return;
            }
            final MirrorCredentials credentials = refresher.refresh();
            store = factory.create(credentials);
            generation++;
            stats.credentialRefreshes.incrementAndGet();
            log.info("Destination client rebuilt with new credentials (generation {}).", generation);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
