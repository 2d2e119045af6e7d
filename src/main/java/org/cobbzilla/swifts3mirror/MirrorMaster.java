package org.cobbzilla.swifts3mirror;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one mirror pass: checks the bucket, lists the container, transfers every key through the
 * {@link TransferMaster}, then compares object counts. Objects are staged in a subdirectory created
 * for the run below the configured staging directory.
 */
@Slf4j
public class MirrorMaster {

    private final MirrorContext context;

    @Getter private TransferSummary summary;

    public MirrorMaster(MirrorContext context) {
        this.context = context;
    }

    /**
     * @return the count comparison, or null when the container was empty and nothing was transferred
     * @throws IllegalStateException if the bucket does not exist
     * @throws StoreException if either store cannot be listed
     */
    public ReconciliationReport mirror() throws IOException {
        final MirrorOptions options = context.getOptions();
        final String container = options.getOpenStackContainer();
        final String bucket = options.getS3Bucket();

        log.info("Starting OpenStack to S3 transfer from container '{}' to bucket '{}'.", container, bucket);
        ensureBucketExists(bucket);

        // only the run's own subdirectory is removed afterwards, never the staging directory itself
        final Path stagingRoot = Files.createTempDirectory(
                Files.createDirectories(context.getStagingRoot()), bucket + "-");
        final MirrorContext runContext = context.withStagingRoot(stagingRoot);
        log.info("Staging objects in {}.", stagingRoot);
        try {
            final List<KeyObjectSummary> sourceKeys = new SwiftKeyLister(runContext, container).listAll();
            if (sourceKeys.isEmpty()) {
                log.warn("No objects found in OpenStack container '{}'.", container);
                return null;
            }
            summary = new TransferMaster(runContext).run(sourceKeys);
            for (TransferResult failure : summary.getFailures()) {
                log.warn("Not transferred: {} ({}).", failure.getKey(), failure.getReason());
            }

            final List<KeyObjectSummary> destinationKeys = new S3KeyLister(runContext, bucket).listAll();
            final ReconciliationReport report = ReconciliationReport.compare(sourceKeys.size(), destinationKeys.size());
            report.log(container, bucket);
            log.info("OpenStack to S3 transfer process completed.");
            return report;

        } finally {
            removeStagingRoot(stagingRoot);
            context.getStats().logStats();
        }
    }

    private void ensureBucketExists(String bucket) {
        final boolean exists = context.getDestination().call(store -> store.bucketExists(bucket));
        if (!exists) {
            log.error("Bucket {} does not exist. Exiting.", bucket);
            throw new IllegalStateException("S3 bucket '" + bucket + "' does not exist.");
        }
    }

    private void removeStagingRoot(Path stagingRoot) {
        try {
            FileUtils.deleteDirectory(stagingRoot.toFile());
            log.info("Temporary files have been removed.");
        } catch (IOException e) {
            log.warn("Could not remove staging directory {}.", stagingRoot, e);
        }
    }
}
