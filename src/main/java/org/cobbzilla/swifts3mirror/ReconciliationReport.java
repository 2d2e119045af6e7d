package org.cobbzilla.swifts3mirror;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

/**
 * Compares the number of objects in source and destination after a run. Equal counts are a sanity
 * signal only: diverging content or renamed keys go unnoticed.
 */
@Slf4j @AllArgsConstructor @ToString
public class ReconciliationReport {

    public enum Status { MATCHED, MISMATCHED }

    @Getter private final int sourceCount;
    @Getter private final int destinationCount;
    @Getter private final Status status;

    public static ReconciliationReport compare(int sourceCount, int destinationCount) {
        return new ReconciliationReport(sourceCount, destinationCount,
                sourceCount == destinationCount ? Status.MATCHED : Status.MISMATCHED);
    }

    public boolean isMatched() { return status == Status.MATCHED; }

    public void log(String container, String bucket) {
        log.info("Total objects in OpenStack container '{}': {}", container, sourceCount);
        log.info("Total objects in S3 bucket '{}': {}", bucket, destinationCount);
        if (isMatched()) {
            log.info("Object count matches between OpenStack container and S3 bucket.");
        } else {
            log.warn("Object count mismatch between OpenStack container and S3 bucket.");
        }
    }
}
