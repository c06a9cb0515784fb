package io.archivemirror.agent;

import com.sun.net.httpserver.HttpServer;
import io.archivemirror.config.MirrorSyncConfig;
import io.archivemirror.model.CatalogEntry;
import io.archivemirror.model.SyncAction;
import io.archivemirror.model.SyncInstruction;
import io.archivemirror.model.SyncReport;
import io.archivemirror.storage.Database;
import io.archivemirror.storage.LocalFileIndex;
import io.archivemirror.storage.SyncLogStore;
import io.archivemirror.util.Hashing;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class OriginClientTest {

    @Test
    void stalledBodyTimesOutAsUnreachable() throws Exception {
        Path root = Files.createTempDirectory("archive-mirror-test-stall-");
        try (StallingOrigin stalling = new StallingOrigin()) {
            OriginClient client = new OriginClient(stalling.url(), 1_000L, 500L, 1_000L);
            Path target = Files.createTempFile(root, "slow-", ".partial");

            FetchException e = Assertions.assertTimeoutPreemptively(Duration.ofSeconds(10), () ->
                    Assertions.assertThrows(FetchException.class,
                            () -> client.fetchContent("cred", "slow", target, Hashing.contentDigest())));
            Assertions.assertEquals(FetchFailure.UNREACHABLE, e.failure());
            Assertions.assertTrue(e.getMessage().contains("timed out"), e.getMessage());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stalledFetchDoesNotHoldUpTheSyncPass() throws Exception {
        Path root = Files.createTempDirectory("archive-mirror-test-stall-agent-");
        try (StallingOrigin stalling = new StallingOrigin()) {
            MirrorSyncConfig config = MirrorSyncConfig.fromRoot(root.toString());
            Database database = new Database(config);
            database.init();
            LocalFileIndex index = new LocalFileIndex(database);
            index.savePairing("mir_stall", "cred", System.currentTimeMillis());
            MirrorAgent agent = new MirrorAgent(config, index, new SyncLogStore(database),
                    new OriginClient(stalling.url(), 1_000L, 500L, 1_000L));
            CatalogEntry slow = new CatalogEntry("slow", "slow.bin", "0".repeat(32), 1_000L, 1L, 1L, true);

            SyncReport report = Assertions.assertTimeoutPreemptively(Duration.ofSeconds(10), () ->
                    agent.acceptSyncInstruction(new SyncInstruction("mir_stall", List.of(slow), List.of(), 1L)));

            SyncReport.ItemOutcome outcome = report.outcomes().get(0);
            Assertions.assertEquals(SyncAction.FETCH_FAIL, outcome.action());
            Assertions.assertTrue(outcome.detail().startsWith("unreachable"), outcome.detail());
            Assertions.assertEquals(List.of(), report.holdings());
            try (Stream<Path> partials = Files.list(config.partialDir())) {
                Assertions.assertEquals(0L, partials.count());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    /**
     * Answers content requests with headers and a few bytes, then goes silent.
     */
    private static final class StallingOrigin implements AutoCloseable {
        private final CountDownLatch release = new CountDownLatch(1);
        private final ExecutorService pool = Executors.newCachedThreadPool();
        private final HttpServer server;

        StallingOrigin() throws IOException {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
            server.createContext("/api/mirrors/content/", exchange -> {
                try {
                    exchange.sendResponseHeaders(200, 1_000L);
                    OutputStream body = exchange.getResponseBody();
                    body.write(new byte[10]);
                    body.flush();
                    release.await(30L, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    exchange.close();
                }
            });
            server.setExecutor(pool);
            server.start();
        }

        String url() {
            return "http://127.0.0.1:" + server.getAddress().getPort();
        }

        @Override
        public void close() {
            release.countDown();
            server.stop(0);
            pool.shutdownNow();
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
