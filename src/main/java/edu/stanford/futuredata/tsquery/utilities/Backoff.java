package edu.stanford.futuredata.tsquery.utilities;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff. Each delay is drawn from [ceiling/2, ceiling] where the ceiling
 * doubles per attempt from the initial value up to the cap. Not thread-safe.
 */
public class Backoff {

    private final long initialMillis;
    private final long maxMillis;
    private long ceiling;

    public Backoff(long initialMillis, long maxMillis) {
        assert(initialMillis > 0 && maxMillis >= initialMillis);
        this.initialMillis = initialMillis;
        this.maxMillis = maxMillis;
        this.ceiling = initialMillis;
    }

    public long nextDelayMillis() {
        long current = ceiling;
        ceiling = Math.min(maxMillis, ceiling * 2);
        long half = current / 2;
        return half + ThreadLocalRandom.current().nextLong(current - half + 1);
    }

    public void reset() {
        ceiling = initialMillis;
    }

    public long getMaxMillis() {
        return maxMillis;
    }
}
