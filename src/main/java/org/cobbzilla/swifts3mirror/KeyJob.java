package org.cobbzilla.swifts3mirror;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Handles a single key from the source listing and records exactly one {@link TransferResult} for it.
 * Whatever happens, the staged copy of the object is removed before the job finishes.
 */
@Slf4j
public abstract class KeyJob implements Runnable {

    public static final String STAGED_FILE_PREFIX = "staged-";
    public static final String STAGED_FILE_SUFFIX = ".part";

    protected final MirrorContext context;
    protected final KeyObjectSummary summary;
    protected final KeyUploader uploader;
    private final TransferSummary results;

    protected Path stagedFile = null;
    private String failureReason = null;

    public KeyJob(MirrorContext context, KeyObjectSummary summary, KeyUploader uploader, TransferSummary results) {
        this.context = context;
        this.summary = summary;
        this.uploader = uploader;
        this.results = results;
    }

    public abstract Logger getLog();

    /**
     * Runs the job's state machine up to a terminal outcome.
     */
    protected abstract TransferOutcome transfer() throws Exception;

    @Override public String toString() { return summary.getKey(); }

    @Override
    public void run() {
        final String key = summary.getKey();
        TransferOutcome outcome = TransferOutcome.FAILED;
        try {
            outcome = transfer();
        } catch (Exception e) {
            getLog().error("Error transferring key {}.", key, e);
            failureReason = e.toString();
            outcome = TransferOutcome.FAILED;
        } finally {
            removeStagedFile();
            record(key, outcome);
            if (context.getOptions().isVerbose()) getLog().info("Done with {}.", key);
        }
    }

    protected TransferOutcome fail(String reason) {
        failureReason = reason;
        return TransferOutcome.FAILED;
    }

    /**
     * Creates the file the key is staged in: a new file of its own, inside the directory that mirrors
     * the key's parent path. Keys that normalize to the same path (a/b, a//b, a/./b) or that are a
     * path prefix of another key (a, a/b) never share a file.
     *
     * @throws IllegalArgumentException if the key would escape the staging root
     */
    protected Path createStagedFile(String key) throws IOException {
        final Path root = context.getStagingRoot();
        final Path path = root.resolve(key).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IllegalArgumentException("Key " + key + " cannot be staged below " + root);
        }
        final Path directory = Files.createDirectories(path.getParent());
        return Files.createTempFile(directory, STAGED_FILE_PREFIX, STAGED_FILE_SUFFIX);
    }

    private void removeStagedFile() {
        if (stagedFile == null) return;
        try {
            Files.deleteIfExists(stagedFile);
        } catch (IOException e) {
            getLog().warn("Could not remove staged file {}.", stagedFile, e);
        }
    }

    private void record(String key, TransferOutcome outcome) {
        final MirrorStats stats = context.getStats();
        switch (outcome) {
            case UPLOADED:
                stats.objectsUploaded.incrementAndGet();
                break;
            case SKIPPED_UP_TO_DATE:
                stats.objectsSkipped.incrementAndGet();
                break;
            case MARKER_CREATED:
                stats.markersCreated.incrementAndGet();
                break;
            case FAILED:
                stats.transferErrors.incrementAndGet();
                break;
        }
        results.record(outcome == TransferOutcome.FAILED
                ? TransferResult.failed(key, failureReason)
                : TransferResult.of(key, outcome));
    }
}
