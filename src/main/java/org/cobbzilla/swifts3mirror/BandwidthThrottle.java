package org.cobbzilla.swifts3mirror;

import com.google.common.util.concurrent.RateLimiter;

import java.io.InputStream;

/**
 * A single byte-rate ceiling shared by every upload of a run.
 */
public class BandwidthThrottle {

    public static final long MB = 1024L * 1024L;

    private final RateLimiter limiter;

    public BandwidthThrottle(long bytesPerSecond) {
        if (bytesPerSecond < 1) throw new IllegalArgumentException("bytesPerSecond must be at least 1: " + bytesPerSecond);
        this.limiter = RateLimiter.create(bytesPerSecond);
    }

    public static BandwidthThrottle ofMegabytes(int megabytesPerSecond) {
        return new BandwidthThrottle(megabytesPerSecond * MB);
    }

    public void acquire(int bytes) {
        if (bytes > 0) limiter.acquire(bytes);
    }

    public InputStream throttle(InputStream in) {
        return new ThrottledInputStream(in, this);
    }
}
