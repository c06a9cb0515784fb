package io.archivemirror.sync;

import io.archivemirror.model.CatalogEntry;
import io.archivemirror.model.Mirror;
import io.archivemirror.model.SyncAction;
import io.archivemirror.model.SyncInstruction;
import io.archivemirror.model.SyncLogEntry;
import io.archivemirror.model.SyncReport;
import io.archivemirror.policy.PriorityPolicy;
import io.archivemirror.storage.CatalogSource;
import io.archivemirror.storage.MirrorFileStore;
import io.archivemirror.storage.MirrorStore;
import io.archivemirror.storage.SyncLogStore;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Computes what each mirror should hold, sends it the difference, and records what the
 * mirror reports back.
 *
 * <p>Passes for different mirrors run in parallel on a bounded pool; at most one pass per
 * mirror is in flight at any time.
 */
public final class SyncOrchestrator implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(SyncOrchestrator.class);
    static final long DEFAULT_DEBOUNCE_MS = 2_000L;

    private final MirrorStore mirrors;
    private final CatalogSource catalog;
    private final MirrorFileStore mirrorFiles;
    private final SyncLogStore syncLog;
    private final SyncTransport transport;
    private final ExecutorService workers;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean passScheduled = new AtomicBoolean(false);
    private final long debounceMs;
    private ScheduledExecutorService scheduler;

    public SyncOrchestrator(
            MirrorStore mirrors,
            CatalogSource catalog,
            MirrorFileStore mirrorFiles,
            SyncLogStore syncLog,
            SyncTransport transport,
            int workerCount
    ) {
        this(mirrors, catalog, mirrorFiles, syncLog, transport, workerCount, DEFAULT_DEBOUNCE_MS);
    }

    public SyncOrchestrator(
            MirrorStore mirrors,
            CatalogSource catalog,
            MirrorFileStore mirrorFiles,
            SyncLogStore syncLog,
            SyncTransport transport,
            int workerCount,
            long debounceMs
    ) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        this.mirrors = mirrors;
        this.catalog = catalog;
        this.mirrorFiles = mirrorFiles;
        this.syncLog = syncLog;
        this.transport = transport;
        this.debounceMs = Math.max(0L, debounceMs);
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "sync-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * D = top {@code capacity} approved entries, S = verified holdings;
     * fetch D - S in rank order, evict S - D.
     */
    public SyncPlan plan(Mirror mirror) {
        List<CatalogEntry> desired = PriorityPolicy.select(catalog.approvedEntries(), mirror.capacity());
        Set<String> desiredIds = desired.stream()
                .map(CatalogEntry::entryId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Set<String> current = mirrorFiles.verifiedEntryIds(mirror.mirrorId());
        List<CatalogEntry> toFetch = desired.stream()
                .filter(e -> !current.contains(e.entryId()))
                .toList();
        List<String> toEvict = current.stream()
                .filter(id -> !desiredIds.contains(id))
                .sorted()
                .toList();
        return new SyncPlan(mirror.mirrorId(), toFetch, toEvict, desiredIds, current);
    }

    public SyncResult syncMirror(String mirrorId) {
        if (!inFlight.add(mirrorId)) {
            LOG.debugf("Sync for mirror %s already in flight, coalescing", mirrorId);
            return SyncResult.of(mirrorId, SyncResult.Outcome.SKIPPED_IN_FLIGHT, "pass already running");
        }
        try {
            return runPass(mirrorId);
        } finally {
            inFlight.remove(mirrorId);
        }
    }

    public boolean isInFlight(String mirrorId) {
        return inFlight.contains(mirrorId);
    }

    private SyncResult runPass(String mirrorId) {
        Optional<Mirror> found = mirrors.findMirror(mirrorId);
        if (found.isEmpty()) {
            return SyncResult.of(mirrorId, SyncResult.Outcome.UNKNOWN_MIRROR, "no such mirror");
        }
        Mirror mirror = found.get();
        if (!mirror.status().isSyncTarget()) {
            return SyncResult.of(mirrorId, SyncResult.Outcome.SKIPPED_NOT_TARGET, "status " + mirror.status().wireName());
        }
        SyncPlan plan = plan(mirror);
        long startedAt = System.currentTimeMillis();
        if (!plan.hasWork()) {
            mirrors.markSynced(mirrorId, startedAt);
            return SyncResult.of(mirrorId, SyncResult.Outcome.NOTHING_TO_DO, "");
        }
        SyncInstruction instruction = new SyncInstruction(mirrorId, plan.toFetch(), plan.toEvict(), startedAt);
        SyncReport report;
        try {
            report = transport.deliver(mirror, instruction);
        } catch (MirrorUnreachableException e) {
            return recordUnreachable(mirror, plan, e);
        }
        SyncResult result = applyReport(mirror, plan, report);
        LOG.infof("Sync pass for mirror %s: pushed=%d evicted=%d verify-fail=%d fetch-fail=%d",
                mirrorId, result.pushed(), result.evicted(), result.verifyFailed(), result.fetchFailed());
        return result;
    }

    private SyncResult recordUnreachable(Mirror mirror, SyncPlan plan, MirrorUnreachableException e) {
        long nowMs = System.currentTimeMillis();
        String detail = "unreachable: " + e.getMessage();
        List<SyncLogEntry> entries = new ArrayList<>();
        for (CatalogEntry entry : plan.toFetch()) {
            entries.add(SyncLogEntry.of(mirror.mirrorId(), entry.entryId(), SyncAction.FETCH_FAIL, nowMs, detail));
        }
        syncLog.appendAll(entries);
        LOG.warnf("Mirror %s unreachable, %d fetches deferred: %s", mirror.mirrorId(), entries.size(), e.getMessage());
        return new SyncResult(mirror.mirrorId(), SyncResult.Outcome.UNREACHABLE, 0, 0, 0, entries.size(), detail);
    }

    /**
     * PUSH is accepted only for entries this pass asked for; the final holdings are trusted
     * only for entries the origin already knew about or that were just pushed.
     */
    private SyncResult applyReport(Mirror mirror, SyncPlan plan, SyncReport report) {
        long nowMs = System.currentTimeMillis();
        Set<String> requested = plan.toFetch().stream().map(CatalogEntry::entryId).collect(Collectors.toSet());
        List<String> pushed = new ArrayList<>();
        List<String> evicted = new ArrayList<>();
        List<SyncLogEntry> entries = new ArrayList<>();
        int verifyFailed = 0;
        int fetchFailed = 0;
        for (SyncReport.ItemOutcome outcome : report.outcomes()) {
            if (outcome == null || outcome.action() == null || outcome.entryId() == null) {
                continue;
            }
            switch (outcome.action()) {
                case PUSH -> {
                    if (!requested.contains(outcome.entryId())) {
                        LOG.warnf("Mirror %s reported unrequested push of %s, ignoring", mirror.mirrorId(), outcome.entryId());
                        continue;
                    }
                    pushed.add(outcome.entryId());
                }
                case EVICT -> evicted.add(outcome.entryId());
                case VERIFY_FAIL -> verifyFailed++;
                case FETCH_FAIL -> fetchFailed++;
                default -> {
                    continue;
                }
            }
            entries.add(SyncLogEntry.of(mirror.mirrorId(), outcome.entryId(), outcome.action(), nowMs, outcome.detail()));
        }
        Set<String> known = new HashSet<>(plan.current());
        known.addAll(pushed);
        List<String> holdings = report.holdings().stream().filter(known::contains).toList();

        mirrorFiles.applyReport(mirror.mirrorId(), pushed, evicted, holdings, nowMs);
        syncLog.appendAll(entries);
        mirrors.markSynced(mirror.mirrorId(), nowMs);
        return new SyncResult(mirror.mirrorId(), SyncResult.Outcome.COMPLETED,
                pushed.size(), evicted.size(), verifyFailed, fetchFailed, "");
    }

    /**
     * One pass over every APPROVED or ONLINE mirror, in parallel on the worker pool.
     */
    public List<SyncResult> syncAll() {
        List<Mirror> targets = mirrors.listMirrors().stream()
                .filter(m -> m.status().isSyncTarget())
                .toList();
        List<Future<SyncResult>> futures = new ArrayList<>();
        for (Mirror mirror : targets) {
            Callable<SyncResult> task = () -> syncMirror(mirror.mirrorId());
            futures.add(workers.submit(task));
        }
        List<SyncResult> out = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String mirrorId = targets.get(i).mirrorId();
            try {
                out.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                out.add(SyncResult.of(mirrorId, SyncResult.Outcome.FAILED, "interrupted"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                LOG.errorf(cause, "Sync pass for mirror %s failed", mirrorId);
                out.add(SyncResult.of(mirrorId, SyncResult.Outcome.FAILED, String.valueOf(cause.getMessage())));
            }
        }
        return out;
    }

    /**
     * Schedules an out-of-cycle pass. Requests arriving before it starts collapse into it.
     */
    public void requestSync() {
        ScheduledExecutorService s;
        synchronized (this) {
            s = scheduler;
        }
        if (s == null) {
            return;
        }
        if (passScheduled.compareAndSet(false, true)) {
            s.schedule(() -> {
                passScheduled.set(false);
                runAllSafely("catalog change");
            }, debounceMs, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Queues a pass for one mirror on the worker pool without waiting for it.
     */
    public void requestSync(String mirrorId) {
        workers.submit(() -> {
            try {
                syncMirror(mirrorId);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Sync pass for mirror %s failed", mirrorId);
            }
        });
    }

    public synchronized void start(long intervalMs) {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sync-scheduler");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(() -> runAllSafely("interval"), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOG.infof("Sync passes every %d ms", intervalMs);
    }

    private void runAllSafely(String reason) {
        try {
            List<SyncResult> results = syncAll();
            LOG.debugf("Sync pass (%s) covered %d mirrors", reason, results.size());
        } catch (RuntimeException e) {
            LOG.error("Sync pass failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        workers.shutdownNow();
    }
}
