package io.archivemirror.agent;

import io.archivemirror.config.MirrorSettings;
import io.archivemirror.config.MirrorSyncConfig;
import io.archivemirror.http.AdminAuth;
import io.archivemirror.http.OriginHttpServer;
import io.archivemirror.model.CatalogEntry;
import io.archivemirror.model.MirrorStatus;
import io.archivemirror.model.SyncAction;
import io.archivemirror.model.SyncInstruction;
import io.archivemirror.model.SyncReport;
import io.archivemirror.origin.OriginNode;
import io.archivemirror.pairing.PairingService;
import io.archivemirror.storage.ContentStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class MirrorAgentTest {

    @Test
    void fetchesVerifiesAndServesOnlyMatchingContent() throws Exception {
        Path originRoot = Files.createTempDirectory("archive-mirror-test-agent-origin-");
        Path mirrorRoot = Files.createTempDirectory("archive-mirror-test-agent-mirror-");
        try (Harness h = new Harness(originRoot, mirrorRoot, 10)) {
            CatalogEntry alpha = h.publish("alpha", "alpha payload", 5L, false);
            CatalogEntry tampered = h.publish("tampered", "real bytes", 4L, true);
            CatalogEntry missing = new CatalogEntry("missing", "missing.bin", "0".repeat(32), 3L, 3L, 1L, true);
            h.node.catalog().upsertAll(List.of(missing), 1L);

            SyncReport report = h.agent.acceptSyncInstruction(new SyncInstruction(
                    h.mirrorId, List.of(alpha, tampered, missing), List.of(), System.currentTimeMillis()));

            Assertions.assertEquals(1L, report.count(SyncAction.PUSH));
            Assertions.assertEquals(1L, report.count(SyncAction.VERIFY_FAIL));
            Assertions.assertEquals(1L, report.count(SyncAction.FETCH_FAIL));
            Assertions.assertEquals(List.of("alpha"), report.holdings());
            Assertions.assertTrue(report.outcomes().stream()
                    .anyMatch(o -> o.entryId().equals("missing") && o.detail().startsWith("not_found")));

            Assertions.assertTrue(h.agent.findServable("alpha").isPresent());
            Assertions.assertTrue(h.agent.findServable("tampered").isEmpty());
            Assertions.assertTrue(h.agent.findServable("missing").isEmpty());
            Assertions.assertFalse(Files.exists(h.mirrorConfig.storageDir().resolve("tampered")));
            try (Stream<Path> partials = Files.list(h.mirrorConfig.partialDir())) {
                Assertions.assertEquals(0L, partials.count());
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            h.agent.serveDownload("alpha", out);
            Assertions.assertEquals("alpha payload", out.toString(StandardCharsets.UTF_8));
            Assertions.assertEquals(1L, h.agent.servedDownloads());
            Assertions.assertEquals(0, h.agent.activeDownloads());

            HealthSnapshot health = h.agent.health();
            Assertions.assertTrue(health.paired());
            Assertions.assertEquals(h.mirrorId, health.mirrorId());
            Assertions.assertEquals(1, health.fileCount());
            Assertions.assertEquals(13L, health.totalBytes());
            Assertions.assertTrue(health.lastSyncAtMs() > 0L);
            Assertions.assertEquals(1L, h.agent.outcomeCounts().get(SyncAction.VERIFY_FAIL));
        }
    }

    @Test
    void evictionsRunFirstAndCapacityIsEnforcedByRank() throws Exception {
        Path originRoot = Files.createTempDirectory("archive-mirror-test-agent-capacity-origin-");
        Path mirrorRoot = Files.createTempDirectory("archive-mirror-test-agent-capacity-mirror-");
        try (Harness h = new Harness(originRoot, mirrorRoot, 2)) {
            CatalogEntry top = h.publish("top", "top", 30L, false);
            CatalogEntry mid = h.publish("mid", "mid", 20L, false);
            CatalogEntry low = h.publish("low", "low", 10L, false);

            SyncReport report = h.agent.acceptSyncInstruction(new SyncInstruction(
                    h.mirrorId, List.of(low, mid, top), List.of(), 1L));
            Assertions.assertEquals(3L, report.count(SyncAction.PUSH));
            Assertions.assertEquals(1L, report.count(SyncAction.EVICT));
            Assertions.assertTrue(report.outcomes().stream().anyMatch(o ->
                    o.action() == SyncAction.EVICT && o.entryId().equals("low") && o.detail().equals(MirrorAgent.CAPACITY_DETAIL)));
            Assertions.assertEquals(List.of("mid", "top"), report.holdings().stream().sorted().toList());

            SyncReport second = h.agent.acceptSyncInstruction(new SyncInstruction(
                    h.mirrorId, List.of(low), List.of("mid"), 2L));
            Assertions.assertEquals(SyncAction.EVICT, second.outcomes().get(0).action());
            Assertions.assertEquals("mid", second.outcomes().get(0).entryId());
            Assertions.assertEquals(List.of("low", "top"), second.holdings().stream().sorted().toList());
            Assertions.assertTrue(h.agent.health().fileCount() <= 2);

            CatalogEntry tail = h.publish("tail", "tail", 1L, false);
            SyncReport third = h.agent.acceptSyncInstruction(new SyncInstruction(
                    h.mirrorId, List.of(tail), List.of(), 3L));
            Assertions.assertEquals(0L, third.count(SyncAction.PUSH));
            Assertions.assertEquals(List.of(new SyncReport.ItemOutcome("tail", SyncAction.EVICT, MirrorAgent.CAPACITY_DETAIL)),
                    third.outcomes());
            Assertions.assertEquals(List.of("low", "top"), third.holdings().stream().sorted().toList());
            Assertions.assertFalse(Files.exists(h.mirrorConfig.storageDir().resolve("tail")));
        }
    }

    @Test
    void fetchThatWouldOverfillDisplacesLowestHoldingBeforeLanding() throws Exception {
        Path originRoot = Files.createTempDirectory("archive-mirror-test-agent-displace-origin-");
        Path mirrorRoot = Files.createTempDirectory("archive-mirror-test-agent-displace-mirror-");
        try (Harness h = new Harness(originRoot, mirrorRoot, 1)) {
            CatalogEntry low = h.publish("low", "low", 1L, false);
            CatalogEntry high = h.publish("high", "high", 9L, false);
            h.agent.acceptSyncInstruction(new SyncInstruction(h.mirrorId, List.of(low), List.of(), 1L));

            SyncReport report = h.agent.acceptSyncInstruction(new SyncInstruction(
                    h.mirrorId, List.of(high), List.of(), 2L));
            Assertions.assertEquals(List.of(
                    new SyncReport.ItemOutcome("low", SyncAction.EVICT, MirrorAgent.CAPACITY_DETAIL),
                    new SyncReport.ItemOutcome("high", SyncAction.PUSH, "4 bytes")
            ), report.outcomes());
            Assertions.assertEquals(List.of("high"), report.holdings());
            Assertions.assertEquals(1, h.agent.health().fileCount());
        }
    }

    @Test
    void downloadsReachTheClientNoFasterThanTheCap() throws Exception {
        Path originRoot = Files.createTempDirectory("archive-mirror-test-agent-rate-origin-");
        Path mirrorRoot = Files.createTempDirectory("archive-mirror-test-agent-rate-mirror-");
        try (Harness h = new Harness(originRoot, mirrorRoot, 10, 2_000L)) {
            CatalogEntry big = h.publish("big", "x".repeat(6_000), 1L, false);
            h.agent.acceptSyncInstruction(new SyncInstruction(h.mirrorId, List.of(big), List.of(), 1L));

            long started = System.nanoTime();
            List<Long> overruns = new ArrayList<>();
            OutputStream client = new OutputStream() {
                private long received;

                @Override
                public void write(int b) {
                    write(new byte[] {(byte) b}, 0, 1);
                }

                @Override
                public void write(byte[] b, int off, int len) {
                    received += len;
                    long allowed = 2_000L * (System.nanoTime() - started) / 1_000_000_000L;
                    if (received > allowed * 11L / 10L + 1L) {
                        overruns.add(received);
                    }
                }
            };
            Assertions.assertEquals(6_000L, h.agent.serveDownload("big", client));
            long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

            Assertions.assertEquals(List.of(), overruns);
            Assertions.assertTrue(elapsedMs >= 2_990L, "6000 bytes at 2000 B/s took only " + elapsedMs + " ms");
        }
    }

    @Test
    void clientDisconnectEndsDownloadAndReleasesSlot() throws Exception {
        Path originRoot = Files.createTempDirectory("archive-mirror-test-agent-disconnect-origin-");
        Path mirrorRoot = Files.createTempDirectory("archive-mirror-test-agent-disconnect-mirror-");
        try (Harness h = new Harness(originRoot, mirrorRoot, 10, 20_000L)) {
            CatalogEntry big = h.publish("big", "y".repeat(5_000), 1L, false);
            h.agent.acceptSyncInstruction(new SyncInstruction(h.mirrorId, List.of(big), List.of(), 1L));

            OutputStream dropping = new OutputStream() {
                private int written;

                @Override
                public void write(int b) throws IOException {
                    write(new byte[] {(byte) b}, 0, 1);
                }

                @Override
                public void write(byte[] b, int off, int len) throws IOException {
                    if (written > 1_500) {
                        throw new IOException("connection reset by peer");
                    }
                    written += len;
                }
            };
            Assertions.assertThrows(IOException.class, () -> h.agent.serveDownload("big", dropping));
            Assertions.assertEquals(0, h.agent.activeDownloads());
            Assertions.assertEquals(0L, h.agent.servedDownloads());
            Assertions.assertTrue(h.agent.findServable("big").isPresent());
        }
    }

    @Test
    void recoveryDropsPartialsAndUnindexedFiles() throws Exception {
        Path originRoot = Files.createTempDirectory("archive-mirror-test-agent-recover-origin-");
        Path mirrorRoot = Files.createTempDirectory("archive-mirror-test-agent-recover-mirror-");
        try (Harness h = new Harness(originRoot, mirrorRoot, 10)) {
            CatalogEntry kept = h.publish("kept", "kept bytes", 1L, false);
            h.agent.acceptSyncInstruction(new SyncInstruction(h.mirrorId, List.of(kept), List.of(), 1L));

            Path storage = h.mirrorConfig.storageDir();
            Files.writeString(storage.resolve("stray"), "left behind");
            Files.writeString(h.mirrorConfig.partialDir().resolve("half.partial"), "half");

            try (MirrorAgent reopened = MirrorAgent.open(h.mirrorConfig)) {
                Assertions.assertTrue(reopened.isPaired());
                Assertions.assertEquals(h.mirrorId, reopened.mirrorId().orElseThrow());
                Assertions.assertTrue(reopened.findServable("kept").isPresent());
                Assertions.assertFalse(Files.exists(storage.resolve("stray")));
                Assertions.assertFalse(Files.exists(h.mirrorConfig.partialDir().resolve("half.partial")));
                Assertions.assertTrue(Files.exists(h.mirrorConfig.dbFile()));
            }

            Files.delete(storage.resolve("kept"));
            try (MirrorAgent reopened = MirrorAgent.open(h.mirrorConfig)) {
                Assertions.assertTrue(reopened.findServable("kept").isEmpty());
                Assertions.assertEquals(0, reopened.health().fileCount());
            }
        }
    }

    @Test
    void credentialCheckAndBootPairing() throws Exception {
        Path originRoot = Files.createTempDirectory("archive-mirror-test-agent-pair-origin-");
        Path mirrorRoot = Files.createTempDirectory("archive-mirror-test-agent-pair-mirror-");
        try (Harness h = new Harness(originRoot, mirrorRoot, 10)) {
            String credential = h.agent.credential().orElseThrow();
            Assertions.assertTrue(h.agent.acceptsCredential(credential));
            Assertions.assertFalse(h.agent.acceptsCredential(credential + "x"));
            Assertions.assertFalse(h.agent.acceptsCredential(null));
            Assertions.assertFalse(h.agent.autoPair(h.node.pairing().issueCode().code()));
            Assertions.assertEquals(credential, h.agent.credential().orElseThrow());
            Assertions.assertFalse(h.agent.autoPair(" "));
        }
    }

    /**
     * A running origin API plus a paired, approved mirror agent.
     */
    private static final class Harness implements AutoCloseable {
        final Path originRoot;
        final Path mirrorRoot;
        final OriginNode node;
        final OriginHttpServer server;
        final MirrorSyncConfig mirrorConfig;
        final MirrorAgent agent;
        final String mirrorId;

        Harness(Path originRoot, Path mirrorRoot, int maxFiles) throws IOException {
            this(originRoot, mirrorRoot, maxFiles, 0L);
        }

        Harness(Path originRoot, Path mirrorRoot, int maxFiles, long bytesPerSecond) throws IOException {
            this.originRoot = originRoot;
            this.mirrorRoot = mirrorRoot;
            node = new OriginNode(MirrorSyncConfig.fromRoot(originRoot.toString()));
            node.init();
            server = new OriginHttpServer(node, AdminAuth.disabled());
            InetSocketAddress address = server.start("127.0.0.1", 0);
            MirrorSettings settings = MirrorSettings.defaults().overlay(Map.of(
                    "originUrl", "http://127.0.0.1:" + address.getPort(),
                    "mirrorName", "test-mirror",
                    "maxFiles", maxFiles,
                    "downloadBytesPerSecond", bytesPerSecond
            ));
            mirrorConfig = MirrorSyncConfig.fromRoot(mirrorRoot.toString()).withSettings(settings);
            agent = MirrorAgent.open(mirrorConfig);
            PairingService.Redemption redemption = agent.pair(node.pairing().issueCode().code(), "http://127.0.0.1:1", null);
            mirrorId = redemption.mirrorId();
            node.mirrors().transition(mirrorId, MirrorStatus.APPROVED, System.currentTimeMillis());
        }

        /**
         * Stores {@code body} at the origin; with {@code wrongHash} the catalog advertises a digest
         * that does not match the stored bytes.
         */
        CatalogEntry publish(String id, String body, long popularity, boolean wrongHash) {
            ContentStore.Stored stored = node.content().put(id, new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
            String hash = wrongHash ? "f".repeat(32) : stored.contentHash();
            CatalogEntry entry = new CatalogEntry(id, id + ".bin", hash, stored.sizeBytes(), popularity, 1L, true);
            node.catalog().upsertAll(List.of(entry), 1L);
            return entry;
        }

        @Override
        public void close() throws IOException {
            agent.close();
            server.close();
            node.close();
            deleteRecursively(originRoot);
            deleteRecursively(mirrorRoot);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
