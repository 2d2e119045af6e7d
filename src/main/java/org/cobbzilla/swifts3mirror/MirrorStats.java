package org.cobbzilla.swifts3mirror;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;

@Slf4j
public class MirrorStats {

    private static final long MB = 1024L * 1024L;

    private final long start = System.currentTimeMillis();

    public final AtomicLong objectsRead = new AtomicLong(0);
    public final AtomicLong objectsUploaded = new AtomicLong(0);
    public final AtomicLong objectsSkipped = new AtomicLong(0);
    public final AtomicLong markersCreated = new AtomicLong(0);
    public final AtomicLong transferErrors = new AtomicLong(0);
    public final AtomicLong bytesUploaded = new AtomicLong(0);

    public final AtomicLong swiftGetCount = new AtomicLong(0);
    public final AtomicLong s3headCount = new AtomicLong(0);
    public final AtomicLong s3putCount = new AtomicLong(0);
    public final AtomicLong credentialRefreshes = new AtomicLong(0);

    public Thread getShutdownHook() {
        return new Thread(this::logStats, "stats-shutdown-hook");
    }

    public void logStats() {
        log.info("STATS BEGIN\n" + this + "\nSTATS END");
    }

    @Override
    public String toString() {
        final long durationMillis = System.currentTimeMillis() - start;
        final double durationSeconds = durationMillis / 1000.0;
        final double mbUploaded = bytesUploaded.get() / (double) MB;
        final double rate = durationSeconds > 0 ? mbUploaded / durationSeconds : 0;
        return "read: " + objectsRead + "\n"
                + "uploaded: " + objectsUploaded + "\n"
                + "up to date: " + objectsSkipped + "\n"
                + "markers created: " + markersCreated + "\n"
                + "errors: " + transferErrors + "\n"
                + String.format("uploaded: %.2f MB (%.2f MB/s)", mbUploaded, rate) + "\n"
                + "swift GETs: " + swiftGetCount + "\n"
                + "s3 HEADs: " + s3headCount + "\n"
                + "s3 PUTs: " + s3putCount + "\n"
                + "credential refreshes: " + credentialRefreshes + "\n"
                + String.format("duration: %.1f seconds", durationSeconds);
    }
}
