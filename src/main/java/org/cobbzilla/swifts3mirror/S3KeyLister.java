package org.cobbzilla.swifts3mirror;

import java.util.Collections;
import java.util.List;

/**
 * Pages through an S3 bucket following continuation tokens until a page is no longer truncated.
 */
public class S3KeyLister extends KeyLister {

    private final String bucket;
    private String continuationToken = null;
    private boolean done = false;

    public S3KeyLister(MirrorContext context, String bucket) {
        super(context);
        this.bucket = bucket;
    }

    @Override
    public boolean isDone() { return done; }

    @Override
    public List<KeyObjectSummary> getNextBatch() {
        if (done) return Collections.emptyList();

        final String token = continuationToken;
        final KeyListing listing = context.getDestination().call(store -> store.listObjects(bucket, token));
        if (listing.isTruncated()) {
            continuationToken = listing.getNextContinuationToken();
        } else {
            done = true;
        }
        return listing.getSummaries();
    }

    @Override
    protected String getName() { return "S3 bucket '" + bucket + "'"; }
}
