package io.archivemirror.sync;

import io.archivemirror.config.MirrorSyncConfig;
import io.archivemirror.model.CatalogEntry;
import io.archivemirror.model.MirrorStatus;
import io.archivemirror.pairing.PairingService;
import io.archivemirror.storage.CatalogStore;
import io.archivemirror.storage.Database;
import io.archivemirror.storage.MirrorFileStore;
import io.archivemirror.storage.MirrorStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class DownloadRouterTest {

    @Test
    void prefersOnlineHolderWithMostHeadroomThenTunnel() throws Exception {
        Path root = Files.createTempDirectory("archive-mirror-test-router-");
        try {
            Database db = new Database(MirrorSyncConfig.fromRoot(root.toString()));
            db.init();
            MirrorStore mirrors = new MirrorStore(db);
            CatalogStore catalog = new CatalogStore(db);
            MirrorFileStore files = new MirrorFileStore(db);
            PairingService pairing = new PairingService(mirrors, 60_000L, 20);
            DownloadRouter router = new DownloadRouter(catalog, mirrors, files, "http://origin.example/");
            catalog.upsertAll(List.of(
                    new CatalogEntry("film", "film.mkv", "a".repeat(32), 100L, 5L, 1L, true),
                    new CatalogEntry("draft", "draft.mkv", "b".repeat(32), 100L, 5L, 1L, false),
                    new CatalogEntry("old reel#2", "old.mkv", "c".repeat(32), 100L, 5L, 1L, true)
            ), 1L);
            long now = System.currentTimeMillis();

            Assertions.assertEquals("http://origin.example/download/film", router.route("film").orElseThrow().url());
            Assertions.assertTrue(router.route("film").orElseThrow().origin());
            Assertions.assertTrue(router.route("draft").isEmpty());
            Assertions.assertTrue(router.route("missing").isEmpty());
            Assertions.assertEquals("http://origin.example/download/old%20reel%232", router.route("old reel#2").orElseThrow().url());

            String busy = online(pairing, mirrors, "http://busy:8000", null, 10, 9, now);
            String direct = online(pairing, mirrors, "http://direct:8000", null, 10, 2, now);
            String tunneled = online(pairing, mirrors, "http://hidden:8000", "https://tunnel.example", 10, 2, now);
            String offline = online(pairing, mirrors, "http://gone:8000", null, 100, 0, now);
            mirrors.markStaleOffline(now + 1L, now);
            mirrors.recordHeartbeat(busy, now, 9, 0L);
            mirrors.recordHeartbeat(direct, now, 2, 0L);
            mirrors.recordHeartbeat(tunneled, now, 2, 0L);
            Assertions.assertEquals(MirrorStatus.OFFLINE, mirrors.findMirror(offline).orElseThrow().status());
            for (String id : List.of(busy, direct, tunneled, offline)) {
                files.applyReport(id, List.of("film"), List.of(), null, now);
            }

            DownloadRouter.Route route = router.route("film").orElseThrow();
            Assertions.assertFalse(route.origin());
            Assertions.assertEquals(tunneled, route.mirrorId());
            Assertions.assertEquals("https://tunnel.example/download/film", route.url());

            files.applyReport(tunneled, List.of(), List.of("film"), null, now);
            Assertions.assertEquals(direct, router.route("film").orElseThrow().mirrorId());
        } finally {
            deleteRecursively(root);
        }
    }

    private static String online(PairingService pairing, MirrorStore mirrors, String direct, String tunnel,
                                 int capacity, int held, long now) {
        String code = pairing.issueCode(now).code();
        String id = pairing.redeem(new PairingService.RedeemRequest(code, "m", direct, tunnel, capacity), now).mirrorId();
        mirrors.transition(id, MirrorStatus.APPROVED, now);
        mirrors.recordHeartbeat(id, now, held, 0L);
        return id;
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
