package io.archivemirror.agent;

import io.archivemirror.config.MirrorSettings;
import io.archivemirror.config.MirrorSyncConfig;
import io.archivemirror.heartbeat.HeartbeatReport;
import io.archivemirror.model.CatalogEntry;
import io.archivemirror.model.SyncAction;
import io.archivemirror.model.SyncInstruction;
import io.archivemirror.model.SyncLogEntry;
import io.archivemirror.model.SyncReport;
import io.archivemirror.model.VerificationState;
import io.archivemirror.pairing.PairingService;
import io.archivemirror.policy.PriorityPolicy;
import io.archivemirror.storage.ContentStore;
import io.archivemirror.storage.Database;
import io.archivemirror.storage.LocalFileIndex;
import io.archivemirror.storage.SyncLogStore;
import io.archivemirror.util.Hashing;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mirror-side half of replication: applies sync instructions, keeps local storage within
 * capacity, serves verified files at a capped rate, and reports liveness to the origin.
 *
 * <p>Storage mutations (moving a verified file into place, evicting, recording either in the
 * local index) happen under one lock; downloads only read.
 */
public final class MirrorAgent implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(MirrorAgent.class);
    static final String CAPACITY_DETAIL = "capacity";

    private final MirrorSettings settings;
    private final Path partialDir;
    private final LocalFileIndex index;
    private final ContentStore storage;
    private final SyncLogStore localLog;
    private final OriginClient origin;
    private final ReentrantLock storageLock = new ReentrantLock();
    private final ReentrantLock syncLock = new ReentrantLock();
    private final AtomicInteger activeDownloads = new AtomicInteger();
    private final AtomicLong servedDownloads = new AtomicLong();
    private final Map<SyncAction, AtomicLong> outcomeCounters = new EnumMap<>(SyncAction.class);
    private ScheduledExecutorService scheduler;

    public MirrorAgent(MirrorSyncConfig config, LocalFileIndex index, SyncLogStore localLog, OriginClient origin) {
        this.settings = config.settings();
        this.partialDir = config.partialDir();
        this.index = index;
        this.storage = new ContentStore(config.storageDir());
        this.localLog = localLog;
        this.origin = origin;
        for (SyncAction action : SyncAction.values()) {
            outcomeCounters.put(action, new AtomicLong());
        }
    }

    /**
     * Validates mirror settings, opens the mirror's database and recovers local storage.
     */
    public static MirrorAgent open(MirrorSyncConfig config) {
        config.validateMirror();
        Database database = new Database(config);
        database.init();
        MirrorSettings s = config.settings();
        OriginClient origin = new OriginClient(s.originUrl(), s.httpConnectTimeoutMs(), s.httpRequestTimeoutMs(), s.syncRequestTimeoutMs());
        MirrorAgent agent = new MirrorAgent(config, new LocalFileIndex(database), new SyncLogStore(database), origin);
        agent.recover();
        return agent;
    }

    public boolean isPaired() {
        return credential().isPresent() && mirrorId().isPresent();
    }

    public Optional<String> mirrorId() {
        return index.getState(LocalFileIndex.KEY_MIRROR_ID).filter(v -> !v.isBlank());
    }

    public Optional<String> credential() {
        return index.getState(LocalFileIndex.KEY_CREDENTIAL).filter(v -> !v.isBlank());
    }

    /**
     * Checks a bearer token presented by the origin against the stored credential.
     */
    public boolean acceptsCredential(String token) {
        Optional<String> own = credential();
        return own.isPresent() && token != null && Hashing.constantTimeEquals(own.get(), token.trim());
    }

    public HealthSnapshot health() {
        LocalFileIndex.Totals totals = index.totals();
        long lastSync = index.getState(LocalFileIndex.KEY_LAST_SYNC_MS).map(Long::parseLong).orElse(0L);
        return new HealthSnapshot(
                "online",
                settings.mirrorName(),
                isPaired(),
                mirrorId().orElse(null),
                totals.fileCount(),
                totals.totalBytes(),
                settings.maxFiles(),
                activeDownloads.get(),
                servedDownloads.get(),
                lastSync,
                settings.downloadBytesPerSecond()
        );
    }

    /**
     * Redeems {@code code} at the origin and stores the resulting identity.
     */
    public PairingService.Redemption pair(String code, String directUrl, String tunnelUrl) {
        String direct = directUrl == null || directUrl.isBlank() ? advertisedUrl() : directUrl.trim();
        String tunnel = tunnelUrl == null || tunnelUrl.isBlank() ? settings.tunnelUrl() : tunnelUrl.trim();
        PairingService.Redemption redemption = origin.redeem(code, settings.mirrorName(), direct, tunnel, settings.maxFiles());
        index.savePairing(redemption.mirrorId(), redemption.credential(), System.currentTimeMillis());
        LOG.infof("Paired with origin %s as mirror %s; waiting for approval", origin.baseUrl(), redemption.mirrorId());
        return redemption;
    }

    /**
     * Pairs at boot when a code was supplied and no identity is stored yet.
     */
    public boolean autoPair(String code) {
        if (code == null || code.isBlank()) {
            return false;
        }
        if (isPaired()) {
            LOG.debug("Already paired, ignoring boot pairing code");
            return false;
        }
        pair(code, null, null);
        return true;
    }

    private String advertisedUrl() {
        if (settings.advertisedUrl() != null && !settings.advertisedUrl().isBlank()) {
            return settings.advertisedUrl().trim();
        }
        return "http://127.0.0.1:" + settings.listenPort();
    }

    /**
     * Clears partial downloads, drops index rows whose file is gone, and deletes stored
     * files the index does not know about.
     */
    public void recover() {
        storageLock.lock();
        try {
            Files.createDirectories(storage.dir());
            Files.createDirectories(partialDir);
            try (DirectoryStream<Path> partials = Files.newDirectoryStream(partialDir)) {
                for (Path p : partials) {
                    Files.deleteIfExists(p);
                }
            }
            Set<String> indexed = new HashSet<>();
            for (LocalFileIndex.LocalFile file : index.listVerified()) {
                if (storage.exists(file.entryId())) {
                    indexed.add(file.entryId());
                } else {
                    index.remove(file.entryId());
                    LOG.warnf("Stored file for %s is missing, dropped from index", file.entryId());
                }
            }
            try (DirectoryStream<Path> stored = Files.newDirectoryStream(storage.dir(), Files::isRegularFile)) {
                for (Path p : stored) {
                    String name = p.getFileName().toString();
                    if (ContentStore.isSafeId(name) && !indexed.contains(name)) {
                        Files.deleteIfExists(p);
                        LOG.infof("Removed unindexed file %s", name);
                    }
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to recover mirror storage", e);
        } finally {
            storageLock.unlock();
        }
    }

    /**
     * Evictions first, then fetches in the given order, then capacity enforcement. One
     * instruction is processed at a time. A fetch that would push holdings past
     * {@code maxFiles} either displaces lower-ranked holdings or is skipped.
     */
    public SyncReport acceptSyncInstruction(SyncInstruction instruction) {
        syncLock.lock();
        try {
            List<SyncReport.ItemOutcome> outcomes = new ArrayList<>();
            for (String entryId : instruction.evict()) {
                outcomes.add(evict(entryId, "instructed"));
            }
            for (CatalogEntry entry : instruction.fetch()) {
                if (Thread.currentThread().isInterrupted()) {
                    outcomes.add(new SyncReport.ItemOutcome(entry.entryId(), SyncAction.FETCH_FAIL, "interrupted"));
                    continue;
                }
                outcomes.addAll(fetch(entry));
            }
            outcomes.addAll(enforceCapacity());
            long nowMs = System.currentTimeMillis();
            index.putState(LocalFileIndex.KEY_LAST_SYNC_MS, Long.toString(nowMs), nowMs);
            record(outcomes, nowMs);
            List<String> holdings = index.listVerified().stream().map(LocalFileIndex.LocalFile::entryId).toList();
            return new SyncReport(instruction.mirrorId(), outcomes, holdings, nowMs);
        } finally {
            syncLock.unlock();
        }
    }

    private List<SyncReport.ItemOutcome> fetch(CatalogEntry entry) {
        String entryId = entry.entryId();
        if (!ContentStore.isSafeId(entryId)) {
            return List.of(new SyncReport.ItemOutcome(entryId, SyncAction.FETCH_FAIL, "invalid entry id"));
        }
        Optional<String> credential = credential();
        if (credential.isEmpty()) {
            return List.of(new SyncReport.ItemOutcome(entryId, SyncAction.FETCH_FAIL, "not paired"));
        }
        if (ranksOutOfCapacity(entry, capacityExcess(entry))) {
            LOG.debugf("Skipping %s: ranks below every holding at capacity %d", entryId, settings.maxFiles());
            return List.of(new SyncReport.ItemOutcome(entryId, SyncAction.EVICT, CAPACITY_DETAIL));
        }
        Path tmp = null;
        try {
            Files.createDirectories(partialDir);
            tmp = Files.createTempFile(partialDir, entryId + "-", ".partial");
            MessageDigest digest = Hashing.contentDigest();
            long size = origin.fetchContent(credential.get(), entryId, tmp, digest);
            String actual = Hashing.hex(digest);
            if (!Hashing.sameDigest(entry.contentHash(), actual)) {
                LOG.warnf("Hash mismatch for %s: expected %s, got %s", entryId, entry.contentHash(), actual);
                return List.of(new SyncReport.ItemOutcome(entryId, SyncAction.VERIFY_FAIL, "expected " + entry.contentHash() + " got " + actual));
            }
            if (entry.sizeBytes() > 0L && size != entry.sizeBytes()) {
                return List.of(new SyncReport.ItemOutcome(entryId, SyncAction.VERIFY_FAIL, "expected " + entry.sizeBytes() + " bytes got " + size));
            }
            List<SyncReport.ItemOutcome> out = new ArrayList<>();
            storageLock.lock();
            try {
                List<CatalogEntry> excess = capacityExcess(entry);
                if (ranksOutOfCapacity(entry, excess)) {
                    return List.of(new SyncReport.ItemOutcome(entryId, SyncAction.EVICT, CAPACITY_DETAIL));
                }
                for (CatalogEntry displaced : excess) {
                    out.add(evict(displaced.entryId(), CAPACITY_DETAIL));
                }
                Files.move(tmp, storage.path(entryId), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                index.putVerified(entry, System.currentTimeMillis());
            } finally {
                storageLock.unlock();
            }
            out.add(new SyncReport.ItemOutcome(entryId, SyncAction.PUSH, size + " bytes"));
            return out;
        } catch (FetchException e) {
            LOG.warnf("Fetch of %s failed (%s): %s", entryId, e.failure(), e.getMessage());
            return List.of(new SyncReport.ItemOutcome(entryId, SyncAction.FETCH_FAIL, e.failure().name().toLowerCase(Locale.ROOT) + ": " + e.getMessage()));
        } catch (IOException e) {
            LOG.warnf(e, "Storing %s failed", entryId);
            return List.of(new SyncReport.ItemOutcome(entryId, SyncAction.FETCH_FAIL, "storage: " + e.getMessage()));
        } finally {
            deletePartial(tmp);
        }
    }

    /**
     * Holdings that would have to go for {@code incoming} to be stored, ranked together with it.
     */
    private List<CatalogEntry> capacityExcess(CatalogEntry incoming) {
        List<CatalogEntry> candidates = new ArrayList<>();
        candidates.add(incoming);
        for (LocalFileIndex.LocalFile file : index.listVerified()) {
            if (!file.entryId().equals(incoming.entryId())) {
                candidates.add(file.entry());
            }
        }
        return PriorityPolicy.excess(candidates, settings.maxFiles());
    }

    private static boolean ranksOutOfCapacity(CatalogEntry incoming, List<CatalogEntry> excess) {
        return excess.stream().anyMatch(e -> e.entryId().equals(incoming.entryId()));
    }

    private void deletePartial(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warnf(e, "Could not delete partial download %s", tmp);
        }
    }

    private SyncReport.ItemOutcome evict(String entryId, String reason) {
        if (!ContentStore.isSafeId(entryId)) {
            return new SyncReport.ItemOutcome(entryId, SyncAction.EVICT, "invalid entry id");
        }
        storageLock.lock();
        try {
            boolean held = index.remove(entryId);
            storage.delete(entryId);
            return new SyncReport.ItemOutcome(entryId, SyncAction.EVICT, held ? reason : reason + ", not held");
        } finally {
            storageLock.unlock();
        }
    }

    /**
     * Evicts the lowest-ranked holdings until at most {@code maxFiles} remain.
     */
    public List<SyncReport.ItemOutcome> enforceCapacity() {
        List<CatalogEntry> held = index.listVerified().stream().map(LocalFileIndex.LocalFile::entry).toList();
        List<CatalogEntry> excess = PriorityPolicy.excess(held, settings.maxFiles());
        List<SyncReport.ItemOutcome> out = new ArrayList<>();
        for (CatalogEntry entry : excess) {
            out.add(evict(entry.entryId(), CAPACITY_DETAIL));
        }
        if (!out.isEmpty()) {
            LOG.infof("Evicted %d files to stay within capacity %d", out.size(), settings.maxFiles());
        }
        return out;
    }

    private void record(List<SyncReport.ItemOutcome> outcomes, long nowMs) {
        String self = mirrorId().orElse("local");
        List<SyncLogEntry> entries = new ArrayList<>();
        for (SyncReport.ItemOutcome outcome : outcomes) {
            outcomeCounters.get(outcome.action()).incrementAndGet();
            entries.add(SyncLogEntry.of(self, outcome.entryId(), outcome.action(), nowMs, outcome.detail()));
        }
        localLog.appendAll(entries);
    }

    /**
     * A servable file: indexed VERIFIED and present on disk. Anything else is a miss.
     */
    public Optional<LocalFileIndex.LocalFile> findServable(String entryId) {
        if (!ContentStore.isSafeId(entryId)) {
            return Optional.empty();
        }
        return index.find(entryId)
                .filter(f -> f.state() == VerificationState.VERIFIED)
                .filter(f -> storage.exists(entryId));
    }

    public long storedSize(String entryId) {
        return storage.size(entryId);
    }

    /**
     * Streams a servable file to {@code out} at the configured rate. Returns bytes written.
     * An {@link IOException} from {@code out} (client gone) ends the stream.
     */
    public long serveDownload(String entryId, OutputStream out) throws IOException {
        BandwidthThrottle throttle = new BandwidthThrottle(settings.downloadBytesPerSecond());
        activeDownloads.incrementAndGet();
        try (InputStream in = storage.open(entryId)) {
            byte[] buffer = new byte[throttle.chunkSize()];
            int n;
            while ((n = in.read(buffer)) != -1) {
                throttle.acquire(n);
                out.write(buffer, 0, n);
            }
            out.flush();
            servedDownloads.incrementAndGet();
            index.incrementDownloads(entryId);
            return throttle.bytesSent();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Download of " + entryId + " interrupted", e);
        } finally {
            activeDownloads.decrementAndGet();
        }
    }

    public void sendHeartbeat() {
        Optional<String> credential = credential();
        if (credential.isEmpty()) {
            LOG.debug("Not paired, skipping heartbeat");
            return;
        }
        LocalFileIndex.Totals totals = index.totals();
        origin.heartbeat(credential.get(), new HeartbeatReport(totals.fileCount(), totals.totalBytes(), activeDownloads.get()));
    }

    public int activeDownloads() {
        return activeDownloads.get();
    }

    public long servedDownloads() {
        return servedDownloads.get();
    }

    public Map<SyncAction, Long> outcomeCounts() {
        Map<SyncAction, Long> out = new EnumMap<>(SyncAction.class);
        outcomeCounters.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "mirror-agent");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::heartbeatSafely, 0L, settings.heartbeatIntervalMs(), TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(this::capacitySafely, settings.syncIntervalMs(), settings.syncIntervalMs(), TimeUnit.MILLISECONDS);
    }

    private void heartbeatSafely() {
        try {
            sendHeartbeat();
        } catch (FetchException e) {
            LOG.warnf("Heartbeat to %s failed (%s): %s", origin.baseUrl(), e.failure(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Heartbeat failed", e);
        }
    }

    private void capacitySafely() {
        syncLock.lock();
        try {
            List<SyncReport.ItemOutcome> evicted = enforceCapacity();
            if (!evicted.isEmpty()) {
                record(evicted, System.currentTimeMillis());
            }
        } catch (RuntimeException e) {
            LOG.error("Capacity check failed", e);
        } finally {
            syncLock.unlock();
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
