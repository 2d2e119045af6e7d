package org.cobbzilla.swifts3mirror;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;

@AllArgsConstructor
public class MirrorContext {

    @Getter private final MirrorOptions options;
    @Getter private final SourceStore source;
    @Getter private final DestinationSession destination;
    @Getter private final BandwidthThrottle throttle;
    @Getter private final Backoff backoff;
    /** Directory objects are staged below. {@link MirrorMaster} stages each run in a new subdirectory of it. */
    @Getter private final Path stagingRoot;
    @Getter private final MirrorStats stats;

    /**
     * @return a copy of this context whose jobs stage objects below {@code runStagingRoot}
     */
    public MirrorContext withStagingRoot(Path runStagingRoot) {
        return new MirrorContext(options, source, destination, throttle, backoff, runStagingRoot, stats);
    }
}
