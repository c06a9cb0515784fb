package io.archivemirror.agent;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class BandwidthThrottleTest {

    @Test
    void acquiringAheadOfEachChunkHoldsTheConfiguredRate() throws Exception {
        long started = System.nanoTime();
        BandwidthThrottle throttle = new BandwidthThrottle(100_000L);
        int chunk = throttle.chunkSize();
        Assertions.assertEquals(5_000, chunk);

        int remaining = 250_000;
        while (remaining > 0) {
            int n = Math.min(chunk, remaining);
            throttle.acquire(n);
            long elapsedNanos = System.nanoTime() - started;
            long allowed = 100_000L * elapsedNanos / 1_000_000_000L + 1L;
            Assertions.assertTrue(throttle.bytesSent() <= allowed,
                    throttle.bytesSent() + " bytes released after " + elapsedNanos / 1_000_000L + " ms");
            remaining -= n;
        }
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        Assertions.assertEquals(250_000L, throttle.bytesSent());
        Assertions.assertTrue(elapsedMs >= 2_490L, "took only " + elapsedMs + " ms");
    }

    @Test
    void zeroRateIsUnlimited() throws Exception {
        BandwidthThrottle throttle = BandwidthThrottle.unlimited();
        Assertions.assertTrue(throttle.isUnlimited());
        long started = System.nanoTime();
        for (int i = 0; i < 1_000; i++) {
            throttle.acquire(64 * 1024);
        }
        Assertions.assertTrue((System.nanoTime() - started) / 1_000_000L < 1_000L);
        Assertions.assertEquals(64 * 1024, throttle.chunkSize());
    }

    @Test
    void chunkSizeFollowsRate() {
        Assertions.assertEquals(100, new BandwidthThrottle(2_000L).chunkSize());
        Assertions.assertEquals(1, new BandwidthThrottle(10L).chunkSize());
        Assertions.assertEquals(64 * 1024, new BandwidthThrottle(100L * 1024L * 1024L).chunkSize());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new BandwidthThrottle(-1L));
    }
}
