package io.archivemirror.origin;

import io.archivemirror.config.MirrorSettings;
import io.archivemirror.config.MirrorSyncConfig;
import io.archivemirror.heartbeat.HeartbeatMonitor;
import io.archivemirror.model.Mirror;
import io.archivemirror.model.MirrorStatus;
import io.archivemirror.model.SyncAction;
import io.archivemirror.observability.PrometheusFormatter;
import io.archivemirror.pairing.PairingService;
import io.archivemirror.storage.CatalogStore;
import io.archivemirror.storage.ContentStore;
import io.archivemirror.storage.Database;
import io.archivemirror.storage.MirrorFileStore;
import io.archivemirror.storage.MirrorStore;
import io.archivemirror.storage.SyncLogStore;
import io.archivemirror.sync.DownloadRouter;
import io.archivemirror.sync.HttpSyncTransport;
import io.archivemirror.sync.SyncOrchestrator;
import io.archivemirror.sync.SyncTransport;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires the origin-side components over one database.
 */
public final class OriginNode implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(OriginNode.class);

    private final MirrorSyncConfig config;
    private final Database database;
    private final MirrorStore mirrors;
    private final CatalogStore catalog;
    private final MirrorFileStore mirrorFiles;
    private final SyncLogStore syncLog;
    private final ContentStore content;
    private final PairingService pairing;
    private final HeartbeatMonitor heartbeat;
    private final SyncOrchestrator orchestrator;
    private final DownloadRouter router;

    public OriginNode(MirrorSyncConfig config) {
        this(config, new HttpSyncTransport(
                config.settings().httpConnectTimeoutMs(),
                config.settings().syncRequestTimeoutMs()));
    }

    public OriginNode(MirrorSyncConfig config, SyncTransport transport) {
        MirrorSettings s = config.settings();
        this.config = config;
        this.database = new Database(config);
        this.mirrors = new MirrorStore(database);
        this.catalog = new CatalogStore(database);
        this.mirrorFiles = new MirrorFileStore(database);
        this.syncLog = new SyncLogStore(database);
        this.content = new ContentStore(config.contentDir());
        this.pairing = new PairingService(mirrors, s.pairingCodeTtlMs(), s.maxOutstandingCodes());
        this.heartbeat = new HeartbeatMonitor(mirrors, pairing, s.heartbeatIntervalMs(), s.heartbeatTimeoutMultiplier());
        this.orchestrator = new SyncOrchestrator(mirrors, catalog, mirrorFiles, syncLog, transport, s.syncWorkers());
        this.router = new DownloadRouter(catalog, mirrors, mirrorFiles, publicUrl(s));
    }

    private static String publicUrl(MirrorSettings s) {
        if (s.advertisedUrl() != null && !s.advertisedUrl().isBlank()) {
            return s.advertisedUrl().trim();
        }
        return s.originUrl();
    }

    public void init() {
        config.validateOrigin();
        database.init();
        catalog.addChangeListener(orchestrator::requestSync);
        heartbeat.addOnlineListener(orchestrator::requestSync);
    }

    /**
     * Starts the liveness sweep and periodic sync passes.
     */
    public void start() {
        heartbeat.start();
        orchestrator.start(config.settings().syncIntervalMs());
        LOG.infof("Origin started with data root %s", config.rootDir());
    }

    public Mirror approve(String mirrorId) {
        return changeStatus(mirrorId, MirrorStatus.APPROVED);
    }

    public Mirror reject(String mirrorId) {
        return changeStatus(mirrorId, MirrorStatus.REJECTED);
    }

    private Mirror changeStatus(String mirrorId, MirrorStatus next) {
        MirrorStore.TransitionOutcome outcome = mirrors.transition(mirrorId, next, System.currentTimeMillis());
        if (outcome.changed()) {
            LOG.infof("Mirror %s moved from %s to %s", mirrorId, outcome.previous().wireName(), outcome.current().wireName());
        }
        if (next == MirrorStatus.APPROVED && outcome.changed()) {
            orchestrator.requestSync(mirrorId);
        }
        return mirrors.findMirror(mirrorId).orElseThrow();
    }

    public PrometheusFormatter.OriginStats stats() {
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        mirrors.countByStatus().forEach((k, v) -> byStatus.put(k.wireName(), v));
        Map<String, Long> byAction = new LinkedHashMap<>();
        for (Map.Entry<SyncAction, Long> e : syncLog.countByAction().entrySet()) {
            byAction.put(e.getKey().wireName(), e.getValue());
        }
        return new PrometheusFormatter.OriginStats(
                byStatus,
                mirrorFiles.countVerified(),
                catalog.approvedEntries().size(),
                mirrors.countOutstandingCodes(System.currentTimeMillis()),
                byAction
        );
    }

    public MirrorSyncConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public MirrorStore mirrors() {
        return mirrors;
    }

    public CatalogStore catalog() {
        return catalog;
    }

    public MirrorFileStore mirrorFiles() {
        return mirrorFiles;
    }

    public SyncLogStore syncLog() {
        return syncLog;
    }

    public ContentStore content() {
        return content;
    }

    public PairingService pairing() {
        return pairing;
    }

    public HeartbeatMonitor heartbeat() {
        return heartbeat;
    }

    public SyncOrchestrator orchestrator() {
        return orchestrator;
    }

    public DownloadRouter router() {
        return router;
    }

    @Override
    public void close() {
        heartbeat.close();
        orchestrator.close();
    }
}
