package org.cobbzilla.swifts3mirror;

/**
 * Exponential delay between upload attempts: {@code 2^attempt} units, capped at a maximum delay.
 */
public class Backoff {

    public interface Sleeper {
        /** @return true if the sleep was interrupted */
        boolean sleep(long millis);
    }

    private final long unitMillis;
    private final long maxDelayMillis;
    private final Sleeper sleeper;

    public Backoff(long unitMillis, long maxDelayMillis) {
        this(unitMillis, maxDelayMillis, Sleep::sleep);
    }

    public Backoff(long unitMillis, long maxDelayMillis, Sleeper sleeper) {
        this.unitMillis = unitMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.sleeper = sleeper;
    }

    public long delayMillis(int attempt) {
        final double delay = Math.pow(2, attempt) * unitMillis;
        return (long) Math.min(delay, maxDelayMillis);
    }

    /**
     * @return true if the sleep was interrupted
     */
    public boolean sleep(int attempt) {
        return sleeper.sleep(delayMillis(attempt));
    }
}
