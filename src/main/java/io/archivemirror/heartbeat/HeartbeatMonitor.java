package io.archivemirror.heartbeat;

import io.archivemirror.model.MirrorStatus;
import io.archivemirror.pairing.PairingService;
import io.archivemirror.storage.MirrorStore;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Tracks mirror liveness. Heartbeats bring tracked mirrors ONLINE; the periodic sweep moves
 * ONLINE mirrors that went quiet to OFFLINE.
 */
public final class HeartbeatMonitor implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(HeartbeatMonitor.class);

    private final MirrorStore store;
    private final PairingService pairing;
    private final long intervalMs;
    private final long timeoutMs;
    private final List<Consumer<String>> onlineListeners = new CopyOnWriteArrayList<>();
    private ScheduledExecutorService scheduler;

    public HeartbeatMonitor(MirrorStore store, PairingService pairing, long intervalMs, int timeoutMultiplier) {
        if (intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (timeoutMultiplier < 1) {
            throw new IllegalArgumentException("timeoutMultiplier must be >= 1");
        }
        this.store = store;
        this.pairing = pairing;
        this.intervalMs = intervalMs;
        this.timeoutMs = intervalMs * timeoutMultiplier;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    /**
     * Called with the mirror id whenever a heartbeat moves a mirror to ONLINE from another status.
     */
    public void addOnlineListener(Consumer<String> listener) {
        if (listener != null) {
            onlineListeners.add(listener);
        }
    }

    public MirrorStore.HeartbeatOutcome recordHeartbeat(String mirrorId, HeartbeatReport report, long nowMs) {
        HeartbeatReport safe = report == null ? HeartbeatReport.empty() : report;
        MirrorStore.HeartbeatOutcome outcome = store.recordHeartbeat(mirrorId, nowMs, safe.fileCount(), safe.totalBytes());
        if (!outcome.tracked()) {
            LOG.debugf("Ignored heartbeat from mirror %s in status %s", mirrorId,
                    outcome.previous() == null ? "unknown" : outcome.previous().wireName());
            return outcome;
        }
        if (outcome.cameOnline()) {
            LOG.infof("Mirror %s is online (was %s)", mirrorId, outcome.previous().wireName());
            for (Consumer<String> listener : onlineListeners) {
                listener.accept(mirrorId);
            }
        }
        return outcome;
    }

    /**
     * One liveness pass: ONLINE mirrors silent for longer than the timeout become OFFLINE.
     * APPROVED mirrors that never sent a heartbeat are left alone.
     */
    public List<String> sweep(long nowMs) {
        List<String> offline = store.markStaleOffline(nowMs - timeoutMs, nowMs);
        for (String mirrorId : offline) {
            LOG.warnf("Mirror %s missed heartbeats for %d ms, marking %s", mirrorId, timeoutMs, MirrorStatus.OFFLINE.wireName());
        }
        if (pairing != null) {
            pairing.purgeExpired(nowMs);
        }
        return offline;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-sweep");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOG.infof("Heartbeat sweep every %d ms, timeout %d ms", intervalMs, timeoutMs);
    }

    private void sweepSafely() {
        try {
            sweep(System.currentTimeMillis());
        } catch (RuntimeException e) {
            LOG.error("Heartbeat sweep failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
