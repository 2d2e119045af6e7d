package org.cobbzilla.swifts3mirror;

import lombok.Getter;
import lombok.Setter;
import org.kohsuke.args4j.Option;

import java.nio.file.Path;
import java.nio.file.Paths;

public class MirrorOptions {

    public static final String USAGE_CONTAINER = "Name of the OpenStack container";
    public static final String OPT_CONTAINER = "--openStackContainer";
    @Option(name=OPT_CONTAINER, required=true, usage=USAGE_CONTAINER)
    @Getter @Setter private String openStackContainer;

    public static final String USAGE_BUCKET = "Name of the S3 bucket";
    public static final String OPT_BUCKET = "--s3Bucket";
    @Option(name=OPT_BUCKET, required=true, usage=USAGE_BUCKET)
    @Getter @Setter private String s3Bucket;

    public static final String USAGE_MAX_WORKERS = "Number of workers for concurrent uploads (Minimum: 1)";
    public static final String OPT_MAX_WORKERS = "--maxWorkers";
    @Option(name=OPT_MAX_WORKERS, required=true, usage=USAGE_MAX_WORKERS)
    @Getter @Setter private int maxWorkers;

    public static final String USAGE_REGION = "AWS region name";
    public static final String OPT_REGION = "--regionName";
    @Option(name=OPT_REGION, required=true, usage=USAGE_REGION)
    @Getter @Setter private String regionName;

    public static final String USAGE_BANDWIDTH = "Maximum bandwidth in MB/s for S3 uploads, shared by all workers (Minimum: 1)";
    public static final String OPT_BANDWIDTH = "--bandwidthLimitMb";
    @Option(name=OPT_BANDWIDTH, required=true, usage=USAGE_BANDWIDTH)
    @Getter @Setter private int bandwidthLimitMb;

    public static final String USAGE_VERBOSE = "Verbose output";
    public static final String OPT_VERBOSE = "-v";
    public static final String LONGOPT_VERBOSE = "--verbose";
    @Option(name=OPT_VERBOSE, aliases=LONGOPT_VERBOSE, usage=USAGE_VERBOSE)
    @Getter @Setter private boolean verbose = false;

    public static final String USAGE_MAX_RETRIES = "Maximum number of upload attempts per object (default 3)";
    public static final String OPT_MAX_RETRIES = "-r";
    public static final String LONGOPT_MAX_RETRIES = "--max-retries";
    @Option(name=OPT_MAX_RETRIES, aliases=LONGOPT_MAX_RETRIES, usage=USAGE_MAX_RETRIES)
    @Getter @Setter private int maxRetries = 3;

    public static final String USAGE_STAGING_DIR = "Local directory in which each run creates (and afterwards removes) its own staging subdirectory (default <tmpdir>)";
    public static final String LONGOPT_STAGING_DIR = "--staging-dir";
    @Option(name=LONGOPT_STAGING_DIR, usage=USAGE_STAGING_DIR)
    @Getter @Setter private String stagingDir = null;

    public static final String USAGE_MAX_BACKOFF = "Upper bound in seconds for the delay between upload attempts (default 60)";
    public static final String LONGOPT_MAX_BACKOFF = "--max-backoff-seconds";
    @Option(name=LONGOPT_MAX_BACKOFF, usage=USAGE_MAX_BACKOFF)
    @Getter @Setter private int maxBackoffSeconds = 60;

    public static final String USAGE_MAX_OBJECT_TIME = "Time in seconds after which no further upload attempt of an object is started (default 3600)";
    public static final String LONGOPT_MAX_OBJECT_TIME = "--max-object-seconds";
    @Option(name=LONGOPT_MAX_OBJECT_TIME, usage=USAGE_MAX_OBJECT_TIME)
    @Getter @Setter private int maxObjectSeconds = 3600;

    public static final String USAGE_REQUEST_TIMEOUT = "Connect and socket timeout in seconds for Swift and S3 requests (default 300)";
    public static final String LONGOPT_REQUEST_TIMEOUT = "--request-timeout-seconds";
    @Option(name=LONGOPT_REQUEST_TIMEOUT, usage=USAGE_REQUEST_TIMEOUT)
    @Getter @Setter private int requestTimeoutSeconds = 300;

    /** Delay unit of the upload backoff; attempt n waits 2^n units. */
    @Getter @Setter private long backoffUnitMillis = 1000L;

    public long getBandwidthLimitBytes() { return bandwidthLimitMb * BandwidthThrottle.MB; }

    public long getMaxBackoffMillis() { return maxBackoffSeconds * 1000L; }

    public long getMaxObjectMillis() { return maxObjectSeconds * 1000L; }

    public int getRequestTimeoutMillis() { return (int) Math.min(requestTimeoutSeconds * 1000L, Integer.MAX_VALUE); }

    public Path getStagingDirectory() {
        final Path directory = stagingDir != null
                ? Paths.get(stagingDir)
                : Paths.get(System.getProperty("java.io.tmpdir"));
        return directory.toAbsolutePath().normalize();
    }

    public void initDerivedFields() {
        openStackContainer = scrub(openStackContainer, OPT_CONTAINER);
        s3Bucket = scrub(s3Bucket, OPT_BUCKET);
        regionName = scrub(regionName, OPT_REGION);

        requireAtLeastOne(maxWorkers, OPT_MAX_WORKERS);
        requireAtLeastOne(bandwidthLimitMb, OPT_BANDWIDTH);
        requireAtLeastOne(maxRetries, LONGOPT_MAX_RETRIES);
        requireAtLeastOne(maxBackoffSeconds, LONGOPT_MAX_BACKOFF);
        requireAtLeastOne(maxObjectSeconds, LONGOPT_MAX_OBJECT_TIME);
        requireAtLeastOne(requestTimeoutSeconds, LONGOPT_REQUEST_TIMEOUT);
    }

    private static String scrub(String value, String option) {
        if (value == null || value.trim().isEmpty()) throw new IllegalArgumentException(option + " must not be empty");
        return value.trim();
    }

    private static void requireAtLeastOne(int value, String option) {
        if (value < 1) throw new IllegalArgumentException(option + " must be at least 1, got " + value);
    }
}
