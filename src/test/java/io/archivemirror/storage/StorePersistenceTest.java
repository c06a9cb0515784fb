package io.archivemirror.storage;

import io.archivemirror.config.MirrorSyncConfig;
import io.archivemirror.model.CatalogEntry;
import io.archivemirror.model.Mirror;
import io.archivemirror.model.MirrorStatus;
import io.archivemirror.model.PairingCode;
import io.archivemirror.model.SyncAction;
import io.archivemirror.model.SyncLogEntry;
import io.archivemirror.pairing.PairingService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

final class StorePersistenceTest {

    @Test
    void originStateSurvivesReopen() throws Exception {
        Path root = Files.createTempDirectory("archive-mirror-test-persist-");
        try {
            MirrorSyncConfig config = MirrorSyncConfig.fromRoot(root.toString());
            Database db = new Database(config);
            db.init();
            MirrorStore mirrors = new MirrorStore(db);
            CatalogStore catalog = new CatalogStore(db);
            MirrorFileStore files = new MirrorFileStore(db);
            SyncLogStore log = new SyncLogStore(db);
            PairingService pairing = new PairingService(mirrors, 60_000L, 5);
            long now = System.currentTimeMillis();

            PairingCode outstanding = pairing.issueCode(now);
            String used = pairing.issueCode(now).code();
            PairingService.Redemption redemption = pairing.redeem(
                    new PairingService.RedeemRequest(used, "attic", "http://attic:8000", "https://attic.example", 7), now);
            mirrors.transition(redemption.mirrorId(), MirrorStatus.APPROVED, now);
            mirrors.recordHeartbeat(redemption.mirrorId(), now, 2, 64L);
            catalog.upsertAll(List.of(
                    new CatalogEntry("a", "a.bin", "1".repeat(32), 32L, 4L, now, true),
                    new CatalogEntry("b", "b.bin", "2".repeat(32), 32L, 1L, now, false)
            ), now);
            files.applyReport(redemption.mirrorId(), List.of("a", "b"), List.of(), null, now);
            log.appendAll(List.of(
                    SyncLogEntry.of(redemption.mirrorId(), "a", SyncAction.PUSH, now, null),
                    SyncLogEntry.of(redemption.mirrorId(), "b", SyncAction.VERIFY_FAIL, now + 1L, "hash mismatch")
            ));

            Database reopened = new Database(config);
            reopened.init();
            MirrorStore mirrors2 = new MirrorStore(reopened);
            Mirror mirror = mirrors2.findMirror(redemption.mirrorId()).orElseThrow();
            Assertions.assertEquals(MirrorStatus.ONLINE, mirror.status());
            Assertions.assertEquals("attic", mirror.name());
            Assertions.assertEquals(7, mirror.capacity());
            Assertions.assertEquals("https://attic.example", mirror.effectiveAddress().url());
            Assertions.assertEquals(2, mirror.reportedFileCount());
            Assertions.assertEquals(64L, mirror.reportedBytes());
            Assertions.assertEquals(redemption.mirrorId(),
                    mirrors2.findMirrorByCredential(redemption.credential()).orElseThrow().mirrorId());

            Assertions.assertTrue(mirrors2.findPairingCode(used).orElseThrow().consumed());
            Assertions.assertEquals(redemption.mirrorId(), mirrors2.findPairingCode(used).orElseThrow().mirrorId());
            Assertions.assertTrue(mirrors2.findPairingCode(outstanding.code()).orElseThrow().isOutstanding(now));
            Assertions.assertEquals(1, mirrors2.countOutstandingCodes(now));

            CatalogStore catalog2 = new CatalogStore(reopened);
            Assertions.assertEquals(List.of("a"), catalog2.approvedEntries().stream().map(CatalogEntry::entryId).toList());
            Assertions.assertEquals(2, catalog2.listAll().size());
            Assertions.assertTrue(catalog2.setApproved("b", true, now));
            Assertions.assertFalse(catalog2.setApproved("b", true, now));

            MirrorFileStore files2 = new MirrorFileStore(reopened);
            Assertions.assertEquals(Set.of("a", "b"), files2.verifiedEntryIds(redemption.mirrorId()));
            files2.applyReport(redemption.mirrorId(), List.of(), List.of(), List.of("a"), now);
            Assertions.assertEquals(Set.of("a"), files2.verifiedEntryIds(redemption.mirrorId()));
            Assertions.assertEquals(List.of(redemption.mirrorId()), files2.mirrorsHolding("a"));

            List<SyncLogEntry> entries = new SyncLogStore(reopened).listForMirror(redemption.mirrorId(), 10);
            Assertions.assertEquals(2, entries.size());
            Assertions.assertEquals(SyncAction.VERIFY_FAIL, entries.get(0).action());
            Assertions.assertEquals("hash mismatch", entries.get(0).detail());
            Assertions.assertEquals(1L, new SyncLogStore(reopened).countByAction().get(SyncAction.PUSH));

            Assertions.assertEquals(1, reopened.listSchemaMigrations(10).size());
            Assertions.assertTrue(reopened.listSchemaMigrations(10).get(0).success());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void contentStoreHashesAndRejectsUnsafeIds() throws Exception {
        Path root = Files.createTempDirectory("archive-mirror-test-content-");
        try {
            ContentStore content = new ContentStore(root.resolve("content"));
            ContentStore.Stored stored = content.put("clip", new ByteArrayInputStream("hello".getBytes(StandardCharsets.UTF_8)));
            Assertions.assertEquals("5d41402abc4b2a76b9719d911017c592", stored.contentHash());
            Assertions.assertEquals(5L, stored.sizeBytes());
            Assertions.assertTrue(content.exists("clip"));
            Assertions.assertEquals(5L, content.size("clip"));

            Assertions.assertFalse(ContentStore.isSafeId("../etc"));
            Assertions.assertFalse(ContentStore.isSafeId(""));
            Assertions.assertThrows(IllegalArgumentException.class, () -> ContentStore.requireSafeId("a/b"));
            Assertions.assertTrue(content.delete("clip"));
            Assertions.assertFalse(content.exists("clip"));
        } finally {
            deleteRecursively(root);
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
