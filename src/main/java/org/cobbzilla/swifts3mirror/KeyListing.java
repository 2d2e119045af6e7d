package org.cobbzilla.swifts3mirror;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * One page of a destination bucket listing.
 */
@AllArgsConstructor
public class KeyListing {

    @Getter private final List<KeyObjectSummary> summaries;
    /** Null when no further page exists. */
    @Getter private final String nextContinuationToken;

    public boolean isTruncated() { return nextContinuationToken != null; }
}
