package io.archivemirror.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import io.archivemirror.agent.MirrorAgent;
import io.archivemirror.config.MirrorSettings;
import io.archivemirror.config.MirrorSyncConfig;
import io.archivemirror.http.AdminAuth;
import io.archivemirror.http.MirrorHttpServer;
import io.archivemirror.http.OriginHttpServer;
import io.archivemirror.model.CatalogEntry;
import io.archivemirror.model.MirrorStatus;
import io.archivemirror.model.PairingCode;
import io.archivemirror.origin.OriginNode;
import io.archivemirror.policy.PriorityPolicy;
import io.archivemirror.security.SensitiveDataMasker;
import io.archivemirror.storage.ContentStore;
import io.archivemirror.storage.Database;
import io.archivemirror.sync.DownloadRouter;
import io.archivemirror.sync.SyncResult;
import io.archivemirror.util.Jsons;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Stream;

@Command(
        name = "archive-mirror",
        mixinStandardHelpOptions = true,
        description = "Origin/mirror content replication CLI",
        subcommands = {
                ArchiveMirrorCommand.InitCommand.class,
                ArchiveMirrorCommand.ServeOriginCommand.class,
                ArchiveMirrorCommand.ServeMirrorCommand.class,
                ArchiveMirrorCommand.PairingCodeCommand.class,
                ArchiveMirrorCommand.MirrorsCommand.class,
                ArchiveMirrorCommand.ApproveCommand.class,
                ArchiveMirrorCommand.RejectCommand.class,
                ArchiveMirrorCommand.SyncCommand.class,
                ArchiveMirrorCommand.SyncLogCommand.class,
                ArchiveMirrorCommand.CatalogImportCommand.class,
                ArchiveMirrorCommand.CatalogCommand.class,
                ArchiveMirrorCommand.CatalogApproveCommand.class,
                ArchiveMirrorCommand.RouteCommand.class,
                ArchiveMirrorCommand.HealthCommand.class,
                ArchiveMirrorCommand.SchemaMigrationsCommand.class
        }
)
public final class ArchiveMirrorCommand implements Runnable {
    private static final Logger LOG = Logger.getLogger(ArchiveMirrorCommand.class);

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--config"}, description = "JSON settings file (default <root>/mirror-settings.json)")
    String configFile;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | serve-origin | serve-mirror | pairing-code | mirrors | approve | reject | sync | sync-log | catalog-import | catalog | catalog-approve | route | health | schema-migrations");
    }

    MirrorSyncConfig config() {
        return config(Map.of());
    }

    /**
     * Defaults, then the settings file, then the non-null command-line overrides.
     */
    MirrorSyncConfig config(Map<String, Object> overrides) {
        MirrorSyncConfig loaded = MirrorSyncConfig.load(root, configFile);
        Map<String, Object> patch = new LinkedHashMap<>();
        overrides.forEach((k, v) -> {
            if (v != null) {
                patch.put(k, v);
            }
        });
        MirrorSyncConfig merged = loaded.withSettings(loaded.settings().overlay(patch));
        merged.validate();
        return merged;
    }

    OriginNode origin() {
        OriginNode node = new OriginNode(config());
        node.init();
        return node;
    }

    static void awaitShutdown(String name, AutoCloseable... resources) throws InterruptedException {
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            for (AutoCloseable resource : resources) {
                try {
                    resource.close();
                } catch (Exception e) {
                    LOG.warnf(e, "Failed to close %s during shutdown", resource.getClass().getSimpleName());
                }
            }
            stopped.countDown();
        }, name + "-shutdown-hook"));
        stopped.await();
    }

    @Command(name = "init", description = "Create the data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Override
        public Integer call() {
            MirrorSyncConfig config = parent.config();
            new Database(config).init();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("root", config.rootDir().toString());
            out.put("database", config.dbFile().toString());
            out.put("contentDir", config.contentDir().toString());
            out.put("storageDir", config.storageDir().toString());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "serve-origin", description = "Run the origin API, heartbeat sweep and sync scheduler")
    static final class ServeOriginCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Option(names = {"--bind"}, description = "Bind address")
        String bind;

        @Option(names = {"--port"}, description = "Origin listen port")
        Integer port;

        @Option(names = {"--public-url"}, description = "Origin URL handed to clients for fallback downloads")
        String publicUrl;

        @Option(names = {"--admin-token"}, split = ",", description = "Admin bearer token(s), comma-separated")
        List<String> adminTokens;

        @Option(names = {"--sync-interval-ms"}, description = "Periodic sync pass interval")
        Long syncIntervalMs;

        @Option(names = {"--heartbeat-interval-ms"}, description = "Expected mirror heartbeat interval")
        Long heartbeatIntervalMs;

        @Override
        public Integer call() throws Exception {
            Map<String, Object> overrides = new LinkedHashMap<>();
            overrides.put("bindAddress", bind);
            overrides.put("originListenPort", port);
            overrides.put("advertisedUrl", publicUrl);
            overrides.put("adminTokens", adminTokens);
            overrides.put("syncIntervalMs", syncIntervalMs);
            overrides.put("heartbeatIntervalMs", heartbeatIntervalMs);
            MirrorSyncConfig config = parent.config(overrides);
            MirrorSettings s = config.settings();
            OriginNode node = new OriginNode(config);
            node.init();
            node.start();
            OriginHttpServer server = new OriginHttpServer(node, AdminAuth.parse(s.adminTokens()));
            InetSocketAddress address = server.start(s.bindAddress(), s.originListenPort());
            System.out.println("Origin listening on http://" + address.getHostString() + ":" + address.getPort());
            awaitShutdown("origin", server, node);
            return 0;
        }
    }

    @Command(name = "serve-mirror", description = "Run the mirror agent and its download/sync API")
    static final class ServeMirrorCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Option(names = {"--origin"}, description = "Origin base URL")
        String originUrl;

        @Option(names = {"--name"}, description = "Mirror display name")
        String name;

        @Option(names = {"--bind"}, description = "Bind address")
        String bind;

        @Option(names = {"--port"}, description = "Mirror listen port")
        Integer port;

        @Option(names = {"--advertised-url"}, description = "Direct URL the origin should use to reach this mirror")
        String advertisedUrl;

        @Option(names = {"--tunnel-url"}, description = "Optional tunnel URL, preferred over the direct URL")
        String tunnelUrl;

        @Option(names = {"--storage"}, description = "Storage directory for mirrored files")
        String storage;

        @Option(names = {"--max-files"}, description = "Maximum number of files held")
        Integer maxFiles;

        @Option(names = {"--download-bytes-per-second"}, description = "Per-download speed cap, 0 = unlimited")
        Long downloadBytesPerSecond;

        @Option(names = {"--pairing-code"}, description = "Pair at boot with this code when not yet paired")
        String pairingCode;

        @Override
        public Integer call() throws Exception {
            Map<String, Object> overrides = new LinkedHashMap<>();
            overrides.put("originUrl", originUrl);
            overrides.put("mirrorName", name);
            overrides.put("bindAddress", bind);
            overrides.put("listenPort", port);
            overrides.put("advertisedUrl", advertisedUrl);
            overrides.put("tunnelUrl", tunnelUrl);
            overrides.put("storagePath", storage);
            overrides.put("maxFiles", maxFiles);
            overrides.put("downloadBytesPerSecond", downloadBytesPerSecond);
            MirrorSyncConfig config = parent.config(overrides);
            MirrorSettings s = config.settings();
            MirrorAgent agent = MirrorAgent.open(config);
            MirrorHttpServer server = new MirrorHttpServer(agent);
            InetSocketAddress address = server.start(s.bindAddress(), s.listenPort());
            if (agent.autoPair(pairingCode)) {
                System.out.println(Jsons.toJson(Map.of("paired", true, "mirrorId", agent.mirrorId().orElse(""))));
            }
            agent.start();
            System.out.println("Mirror " + s.mirrorName() + " listening on http://" + address.getHostString() + ":" + address.getPort());
            awaitShutdown("mirror", server, agent);
            return 0;
        }
    }

    @Command(name = "pairing-code", description = "Issue a one-time pairing code")
    static final class PairingCodeCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Override
        public Integer call() {
            try (OriginNode node = parent.origin()) {
                PairingCode code = node.pairing().issueCode();
                System.out.println(Jsons.toJson(code));
            }
            return 0;
        }
    }

    @Command(name = "mirrors", description = "List registered mirrors (credentials masked)")
    static final class MirrorsCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Option(names = {"--status"}, description = "Filter: pending|approved|online|offline|rejected")
        String status;

        @Override
        public Integer call() {
            try (OriginNode node = parent.origin()) {
                Object mirrors = status == null
                        ? node.mirrors().listMirrors()
                        : node.mirrors().listMirrors(MirrorStatus.fromString(status));
                System.out.println(Jsons.toJson(SensitiveDataMasker.masked(mirrors)));
            }
            return 0;
        }
    }

    @Command(name = "approve", description = "Approve a pending mirror")
    static final class ApproveCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Parameters(index = "0", description = "Mirror id")
        String mirrorId;

        @Override
        public Integer call() {
            try (OriginNode node = parent.origin()) {
                System.out.println(Jsons.toJson(SensitiveDataMasker.masked(node.approve(mirrorId))));
            }
            return 0;
        }
    }

    @Command(name = "reject", description = "Reject a mirror")
    static final class RejectCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Parameters(index = "0", description = "Mirror id")
        String mirrorId;

        @Override
        public Integer call() {
            try (OriginNode node = parent.origin()) {
                System.out.println(Jsons.toJson(SensitiveDataMasker.masked(node.reject(mirrorId))));
            }
            return 0;
        }
    }

    @Command(name = "sync", description = "Run one sync pass over all targets, or one mirror")
    static final class SyncCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Option(names = {"--mirror"}, description = "Only this mirror id")
        String mirrorId;

        @Override
        public Integer call() {
            try (OriginNode node = parent.origin()) {
                List<SyncResult> results = mirrorId == null
                        ? node.orchestrator().syncAll()
                        : List.of(node.orchestrator().syncMirror(mirrorId));
                System.out.println(Jsons.toJson(results));
                boolean failed = results.stream().anyMatch(r ->
                        r.outcome() == SyncResult.Outcome.FAILED || r.outcome() == SyncResult.Outcome.UNKNOWN_MIRROR);
                return failed ? 1 : 0;
            }
        }
    }

    @Command(name = "sync-log", description = "Show recent sync log entries for a mirror")
    static final class SyncLogCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Option(names = {"--mirror"}, required = true, description = "Mirror id")
        String mirrorId;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            try (OriginNode node = parent.origin()) {
                System.out.println(Jsons.toJson(node.syncLog().listForMirror(mirrorId, limit)));
            }
            return 0;
        }
    }

    @Command(name = "catalog-import", description = "Import catalog entries from a JSON file or a directory of files")
    static final class CatalogImportCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Option(names = {"--file"}, description = "JSON array of catalog entries")
        String file;

        @Option(names = {"--dir"}, description = "Directory whose files are hashed, copied into content and cataloged")
        String dir;

        @Option(names = {"--approved"}, defaultValue = "true", description = "Approval flag for entries imported from --dir")
        boolean approved;

        @Override
        public Integer call() throws Exception {
            if ((file == null) == (dir == null)) {
                throw new IllegalArgumentException("Exactly one of --file or --dir is required");
            }
            try (OriginNode node = parent.origin()) {
                long nowMs = System.currentTimeMillis();
                List<CatalogEntry> entries = file != null
                        ? fromFile(Paths.get(file), nowMs)
                        : fromDirectory(node, Paths.get(dir), nowMs);
                int written = node.catalog().upsertAll(entries, nowMs);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("imported", written);
                out.put("approved", entries.stream().filter(CatalogEntry::approved).count());
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }

        private static List<CatalogEntry> fromFile(Path path, long nowMs) throws IOException {
            List<CatalogEntry> raw = Jsons.mapper().readValue(path.toFile(), new TypeReference<List<CatalogEntry>>() {});
            List<CatalogEntry> out = new ArrayList<>();
            for (CatalogEntry e : raw) {
                ContentStore.requireSafeId(e.entryId());
                out.add(new CatalogEntry(e.entryId(), e.fileName(), e.contentHash(), e.sizeBytes(), e.popularity(),
                        e.createdAtMs() == 0L ? nowMs : e.createdAtMs(), e.approved()));
            }
            return out;
        }

        private List<CatalogEntry> fromDirectory(OriginNode node, Path source, long nowMs) throws IOException {
            List<Path> files;
            try (Stream<Path> listing = Files.list(source)) {
                files = listing.filter(Files::isRegularFile).sorted().toList();
            }
            List<CatalogEntry> out = new ArrayList<>();
            for (Path path : files) {
                String entryId = path.getFileName().toString();
                if (!ContentStore.isSafeId(entryId)) {
                    LOG.warnf("Skipping %s: not a usable entry id", path);
                    continue;
                }
                ContentStore.Stored stored;
                try (InputStream in = Files.newInputStream(path)) {
                    stored = node.content().put(entryId, in);
                }
                Optional<CatalogEntry> existing = node.catalog().find(entryId);
                long popularity = existing.map(CatalogEntry::popularity).orElse(0L);
                long createdAt = existing.map(CatalogEntry::createdAtMs).orElse(nowMs);
                out.add(new CatalogEntry(entryId, entryId, stored.contentHash(), stored.sizeBytes(), popularity, createdAt, approved));
            }
            return out;
        }
    }

    @Command(name = "catalog", description = "List catalog entries, best ranked first")
    static final class CatalogCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Option(names = {"--approved-only"}, description = "Only entries eligible for mirroring")
        boolean approvedOnly;

        @Override
        public Integer call() {
            try (OriginNode node = parent.origin()) {
                List<CatalogEntry> entries = approvedOnly ? node.catalog().approvedEntries() : node.catalog().listAll();
                System.out.println(Jsons.toJson(PriorityPolicy.rank(entries)));
            }
            return 0;
        }
    }

    @Command(name = "catalog-approve", description = "Approve a catalog entry for mirroring, or withdraw it")
    static final class CatalogApproveCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Parameters(index = "0", description = "Entry id")
        String entryId;

        @Option(names = {"--withdraw"}, description = "Withdraw approval; mirrors evict the entry on their next pass")
        boolean withdraw;

        @Override
        public Integer call() {
            try (OriginNode node = parent.origin()) {
                if (node.catalog().find(entryId).isEmpty()) {
                    System.out.println(Jsons.toJson(Map.of("error", "entry_not_found", "entryId", entryId)));
                    return 1;
                }
                boolean changed = node.catalog().setApproved(entryId, !withdraw, System.currentTimeMillis());
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("entryId", entryId);
                out.put("approved", !withdraw);
                out.put("changed", changed);
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "route", description = "Show where a download of an entry would be sent")
    static final class RouteCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Parameters(index = "0", description = "Entry id")
        String entryId;

        @Override
        public Integer call() {
            try (OriginNode node = parent.origin()) {
                Optional<DownloadRouter.Route> route = node.router().route(entryId);
                if (route.isEmpty()) {
                    System.out.println(Jsons.toJson(Map.of("error", "entry_not_found", "entryId", entryId)));
                    return 1;
                }
                System.out.println(Jsons.toJson(route.get()));
            }
            return 0;
        }
    }

    @Command(name = "health", description = "Print the local mirror's health snapshot")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Override
        public Integer call() {
            try (MirrorAgent agent = MirrorAgent.open(parent.config())) {
                System.out.println(Jsons.toJson(agent.health()));
            }
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        ArchiveMirrorCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            Database database = new Database(parent.config());
            database.init();
            System.out.println(Jsons.toJson(database.listSchemaMigrations(limit)));
            return 0;
        }
    }
}
