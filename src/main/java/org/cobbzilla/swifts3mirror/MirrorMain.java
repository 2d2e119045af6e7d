package org.cobbzilla.swifts3mirror;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.kohsuke.args4j.CmdLineParser;

import java.io.IOException;
import java.util.Map;

/**
 * Provides the "main" method. Responsible for parsing options, building the store clients and
 * setting up the MirrorMaster to manage the transfer.
 */
@Slf4j
public class MirrorMain {

    @Getter @Setter private String[] args;

    @Getter private final MirrorOptions options = new MirrorOptions();

    private final CmdLineParser parser = new CmdLineParser(options);

    private final Thread.UncaughtExceptionHandler uncaughtExceptionHandler = new Thread.UncaughtExceptionHandler() {
        @Override public void uncaughtException(Thread t, Throwable e) {
            log.error("Uncaught Exception (thread "+t.getName()+"): "+e, e);
        }
    };

    @Getter private SwiftSourceStore source;
    @Getter private MirrorContext context;
    @Getter private MirrorMaster master;

    public MirrorMain(String[] args) { this.args = args; }

    public static void main (String[] args) {
        MirrorMain main = new MirrorMain(args);
        main.init();
        System.exit(main.run());
    }

    /**
     * @return the process exit status: 0 once the run completed (failed keys and count mismatches
     * are reported in the log), 1 if it was aborted during setup or listing
     */
    public int run() {
        try {
            master.mirror();
            return 0;
        } catch (Exception e) {
            log.error("Transfer aborted: {}", e.getMessage(), e);
            return 1;
        } finally {
            closeSource();
        }
    }

    public void init() {
        try {
            parseArguments();
        } catch (Exception e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
            System.exit(1);
        }

        final Map<String, String> env = System.getenv();
        final SwiftCredentials swiftCredentials = SwiftCredentials.fromEnvironment(env);
        if (!swiftCredentials.isComplete()) {
            System.err.println("Missing OpenStack credentials: set " + SwiftCredentials.ENV_AUTH_URL + ", "
                    + SwiftCredentials.ENV_CREDENTIAL_ID + " and " + SwiftCredentials.ENV_CREDENTIAL_SECRET);
            System.exit(1);
        }
        final MirrorCredentials awsCredentials = MirrorCredentials.fromEnvironment(env);
        if (!awsCredentials.isComplete()) {
            System.err.println("Missing AWS credentials: set " + MirrorCredentials.ENV_ACCESS_KEY_ID + " and "
                    + MirrorCredentials.ENV_SECRET_ACCESS_KEY);
            System.exit(1);
        }

        final MirrorStats stats = new MirrorStats();
        source = SwiftSourceStore.create(swiftCredentials, options);
        final DestinationSession destination = new DestinationSession(S3DestinationStore.factory(options),
                awsCredentials, new ConsoleCredentialRefresher(), stats);

        context = new MirrorContext(options, source, destination,
                new BandwidthThrottle(options.getBandwidthLimitBytes()),
                new Backoff(options.getBackoffUnitMillis(), options.getMaxBackoffMillis()),
                options.getStagingDirectory(), stats);
        master = new MirrorMaster(context);

        Runtime.getRuntime().addShutdownHook(stats.getShutdownHook());
        Thread.setDefaultUncaughtExceptionHandler(uncaughtExceptionHandler);
    }

    protected void parseArguments() throws Exception {
        parser.parseArgument(args);
        options.initDerivedFields();
    }

    private void closeSource() {
        if (source == null) return;
        try {
            source.close();
        } catch (IOException e) {
            log.warn("Error closing Swift client.", e);
        }
    }
}
