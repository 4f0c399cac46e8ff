package edu.stanford.futuredata.tsquery.utilities;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BackoffTest {

    @Test
    public void testDelaysGrowWithinBoundsUpToCap() {
        Backoff backoff = new Backoff(100, 1_000);
        long ceiling = 100;
        for (int i = 0; i < 20; i++) {
            long delay = backoff.nextDelayMillis();
            assertTrue(delay >= ceiling / 2 && delay <= ceiling, "delay " + delay + " ceiling " + ceiling);
            ceiling = Math.min(1_000, ceiling * 2);
        }
    }

    @Test
    public void testResetRestartsFromInitial() {
        Backoff backoff = new Backoff(10, 10_000);
        for (int i = 0; i < 8; i++) {
            backoff.nextDelayMillis();
        }
        backoff.reset();
        long delay = backoff.nextDelayMillis();
        assertTrue(delay >= 5 && delay <= 10);
    }
}
