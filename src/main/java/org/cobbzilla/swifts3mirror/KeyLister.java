package org.cobbzilla.swifts3mirror;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Takes a snapshot of every key in a container or bucket, page by page. Listing errors are not
 * retried: they abort the run before any transfer starts.
 */
@Slf4j
public abstract class KeyLister {

    protected final MirrorContext context;

    protected KeyLister(MirrorContext context) {
        this.context = context;
    }

    public abstract boolean isDone();

    /**
     * Fetches the next page. Returns an empty list once {@link #isDone()}.
     */
    public abstract List<KeyObjectSummary> getNextBatch();

    protected abstract String getName();

    public List<KeyObjectSummary> listAll() {
        final boolean verbose = context.getOptions().isVerbose();
        final List<KeyObjectSummary> all = new ArrayList<KeyObjectSummary>();
        int pages = 0;
        while (!isDone()) {
            final List<KeyObjectSummary> batch = getNextBatch();
            all.addAll(batch);
            pages++;
            if (verbose) log.info("Got {} keys from {} (page {}, total now {}).", batch.size(), getName(), pages, all.size());
        }
        log.debug("Retrieved {} objects from {}.", all.size(), getName());
        return all;
    }
}
