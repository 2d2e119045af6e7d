package org.cobbzilla.swifts3mirror;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * Puts one object into the destination with bounded retries. Generic failures consume an attempt
 * and back off exponentially; expired credentials are refreshed by the {@link DestinationSession}
 * without consuming one. Exhaustion is reported as a result, never thrown.
 */
@Slf4j
public class KeyUploader {

    private final MirrorContext context;

    public KeyUploader(MirrorContext context) {
        this.context = context;
    }

    public UploadResult upload(String key, Path file) {
        final String bucket = context.getOptions().getS3Bucket();
        final BandwidthThrottle throttle = context.getThrottle();
        return withRetries(key, store -> {
            store.upload(bucket, key, file, throttle);
            return null;
        });
    }

    public UploadResult createMarker(String key) {
        final String bucket = context.getOptions().getS3Bucket();
        return withRetries(key, store -> {
            store.createMarker(bucket, key);
            return null;
        });
    }

    private UploadResult withRetries(String key, DestinationCall<Void, RuntimeException> put) {
        final MirrorOptions options = context.getOptions();
        final MirrorStats stats = context.getStats();
        final Backoff backoff = context.getBackoff();
        final int maxAttempts = options.getMaxRetries();
        final long deadline = System.currentTimeMillis() + options.getMaxObjectMillis();

        int attempt = 0;
        while (attempt < maxAttempts) {
            try {
                stats.s3putCount.incrementAndGet();
                context.getDestination().call(put);
                log.info("{} uploaded successfully on attempt {}.", key, attempt + 1);
                return UploadResult.SUCCESS;

            } catch (StoreException e) {
                attempt++;
                log.error("Failed to upload {} (attempt {}/{}).", key, attempt, maxAttempts, e);
            }

            if (attempt < maxAttempts) {
                final long delay = backoff.delayMillis(attempt);
                if (System.currentTimeMillis() + delay > deadline) {
                    log.error("Not retrying {}: waiting {} ms would exceed the {} second limit per object.",
                            key, delay, options.getMaxObjectSeconds());
                    break;
                }
                if (backoff.sleep(attempt)) break;
            }
        }

        log.error("Giving up on uploading {} after {} attempts.", key, attempt);
        return UploadResult.EXHAUSTED;
    }
}
