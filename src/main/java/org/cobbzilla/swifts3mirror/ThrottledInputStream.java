package org.cobbzilla.swifts3mirror;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

public class ThrottledInputStream extends FilterInputStream {

    private final BandwidthThrottle throttle;

    public ThrottledInputStream(InputStream in, BandwidthThrottle throttle) {
        super(in);
        this.throttle = throttle;
    }

    public int read() throws IOException {
        int b = this.in.read();
        if (b != -1) {
            throttle.acquire(1);
        }

        return b;
    }

    public int read(byte[] buf, int off, int len) throws IOException {
        len = this.in.read(buf, off, len);
        if (len != -1) {
            throttle.acquire(len);
        }

        return len;
    }

    public long skip(long n) throws IOException {
        byte[] buf = new byte[8192];

        long total;
        long len;
        for (total = 0L; total < n; total += len) {
            len = n - total;
            len = (long) this.read(buf, 0, len < (long) buf.length ? (int) len : buf.length);
            if (len == -1L) {
                return total;
            }
        }

        return total;
    }
}
