package org.cobbzilla.swifts3mirror;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Downloads a key from the source container into the staging area, compares its digest with the
 * destination's ETag and uploads it when the destination is missing or different.
 */
@Slf4j
public class KeyTransferJob extends KeyJob {

    public KeyTransferJob(MirrorContext context, KeyObjectSummary summary, KeyUploader uploader, TransferSummary results) {
        super(context, summary, uploader, results);
    }

    @Override public Logger getLog() { return log; }

    @Override
    protected TransferOutcome transfer() throws IOException {
        final MirrorOptions options = context.getOptions();
        final String key = summary.getKey();
        final String container = options.getOpenStackContainer();
        final String bucket = options.getS3Bucket();

        final Path staged;
        try {
            staged = createStagedFile(key);
        } catch (IllegalArgumentException e) {
            log.error("Refusing to stage {}: {}", key, e.getMessage());
            return fail(e.getMessage());
        }
        stagedFile = staged;

        try {
            context.getStats().swiftGetCount.incrementAndGet();
            context.getSource().download(container, key, staged);
        } catch (IOException | StoreException e) {
            log.error("Failed to download {} from container {}.", key, container, e);
            return fail("download failed: " + e.getMessage());
        }
        if (options.isVerbose()) log.info("Downloaded {} to {}.", key, staged);

        final String localDigest = ObjectDigest.localDigest(staged);

        String remoteETag;
        try {
            context.getStats().s3headCount.incrementAndGet();
            remoteETag = context.getDestination().call(store -> store.getObjectETag(bucket, key));
        } catch (ObjectNotFoundException e) {
            remoteETag = null;
        } catch (StoreException e) {
            log.error("Failed to access object {} in bucket {}.", key, bucket, e);
            return fail("destination metadata probe failed: " + e.getMessage());
        }

        if (ObjectDigest.decide(localDigest, remoteETag) == DigestComparison.UP_TO_DATE) {
            log.info("{} is up to date in S3. Skipping upload.", key);
            return TransferOutcome.SKIPPED_UP_TO_DATE;
        }

        if (remoteETag == null) {
            log.info("{} does not exist in S3. Uploading {}...", key, key);
        } else {
            log.info("{} exists but has changed. Overwriting {}...", key, key);
        }

        final long size = Files.size(staged);
        if (uploader.upload(key, staged) == UploadResult.SUCCESS) {
            context.getStats().bytesUploaded.addAndGet(size);
            return TransferOutcome.UPLOADED;
        }
        log.error("Failed to upload {}.", key);
        return fail("upload retries exhausted");
    }
}
