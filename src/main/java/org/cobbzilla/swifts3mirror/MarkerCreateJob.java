package org.cobbzilla.swifts3mirror;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;

/**
 * Recreates a directory marker (a key ending in "/") as a zero-byte object. Nothing is downloaded.
 */
@Slf4j
public class MarkerCreateJob extends KeyJob {

    public MarkerCreateJob(MirrorContext context, KeyObjectSummary summary, KeyUploader uploader, TransferSummary results) {
        super(context, summary, uploader, results);
    }

    @Override public Logger getLog() { return log; }

    @Override
    protected TransferOutcome transfer() {
        final String key = summary.getKey();
        log.info("Creating directory structure {} in S3.", key);
        if (uploader.createMarker(key) == UploadResult.SUCCESS) {
            return TransferOutcome.MARKER_CREATED;
        }
        log.error("Failed to create directory marker {}.", key);
        return fail("marker creation retries exhausted");
    }
}
