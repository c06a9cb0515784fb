package io.archivemirror.agent;

import java.util.concurrent.TimeUnit;

/**
 * Paces one connection to a byte rate. Callers acquire each chunk before writing it, so the
 * bytes handed to the connection by any instant never exceed the rate times the elapsed time.
 * Not thread-safe: one instance per connection.
 */
public final class BandwidthThrottle {
    private final long bytesPerSecond;
    private final long startNanos;
    private long sent;

    public BandwidthThrottle(long bytesPerSecond) {
        if (bytesPerSecond < 0L) {
            throw new IllegalArgumentException("bytesPerSecond must be >= 0");
        }
        this.bytesPerSecond = bytesPerSecond;
        this.startNanos = System.nanoTime();
    }

    public static BandwidthThrottle unlimited() {
        return new BandwidthThrottle(0L);
    }

    public boolean isUnlimited() {
        return bytesPerSecond == 0L;
    }

    public long bytesSent() {
        return sent;
    }

    /**
     * Blocks until {@code bytes} more may be written, then accounts for them.
     */
    public void acquire(int bytes) throws InterruptedException {
        if (bytes <= 0) {
            return;
        }
        sent += bytes;
        if (isUnlimited()) {
            return;
        }
        long dueNanos = startNanos + (long) ((double) sent * TimeUnit.SECONDS.toNanos(1) / bytesPerSecond);
        long waitNanos = dueNanos - System.nanoTime();
        if (waitNanos > 0L) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    /**
     * Chunk size that keeps each sleep short relative to one second of transfer.
     */
    public int chunkSize() {
        if (isUnlimited()) {
            return 64 * 1024;
        }
        long perTick = bytesPerSecond / 20L;
        return (int) Math.max(1L, Math.min(64L * 1024L, perTick));
    }
}
