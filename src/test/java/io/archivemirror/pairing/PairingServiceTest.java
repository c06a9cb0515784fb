package io.archivemirror.pairing;

import io.archivemirror.config.MirrorSyncConfig;
import io.archivemirror.model.Mirror;
import io.archivemirror.model.MirrorStatus;
import io.archivemirror.model.PairingCode;
import io.archivemirror.storage.Database;
import io.archivemirror.storage.MirrorStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Stream;

final class PairingServiceTest {
    private static final long TTL_MS = 15L * 60L * 1_000L;

    @Test
    void redeemCreatesPendingMirrorWithFreshCredential() throws Exception {
        Path root = Files.createTempDirectory("archive-mirror-test-pairing-");
        try {
            MirrorStore store = store(root);
            PairingService pairing = new PairingService(store, TTL_MS, 5);
            long now = 1_000_000L;

            PairingCode code = pairing.issueCode(now);
            Assertions.assertTrue(code.code().matches("[A-Z2-9]{4}-[A-Z2-9]{4}"));
            Assertions.assertEquals(now + TTL_MS, code.expiresAtMs());

            PairingService.Redemption redemption = pairing.redeem(
                    new PairingService.RedeemRequest(code.code().toLowerCase().replace("-", " "), "Lab mirror", "10.0.0.5:8000", null, 40),
                    now + 1_000L
            );
            Assertions.assertTrue(redemption.mirrorId().startsWith("mir_"));
            Assertions.assertEquals(32, Base64.getUrlDecoder().decode(redemption.credential()).length);

            Mirror mirror = store.findMirror(redemption.mirrorId()).orElseThrow();
            Assertions.assertEquals(MirrorStatus.PENDING, mirror.status());
            Assertions.assertEquals("Lab mirror", mirror.name());
            Assertions.assertEquals("http://10.0.0.5:8000", mirror.directAddress().url());
            Assertions.assertNull(mirror.tunnelAddress());
            Assertions.assertEquals(40, mirror.capacity());
            Assertions.assertTrue(store.findPairingCode(code.code()).orElseThrow().consumed());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void redeemFailuresAreDistinct() throws Exception {
        Path root = Files.createTempDirectory("archive-mirror-test-pairing-failures-");
        try {
            MirrorStore store = store(root);
            PairingService pairing = new PairingService(store, TTL_MS, 5);
            long now = 5_000_000L;

            PairingException unknown = Assertions.assertThrows(PairingException.class,
                    () -> pairing.redeem(request("ZZZZ-ZZZZ"), now));
            Assertions.assertEquals(PairingFailure.INVALID_CODE, unknown.failure());

            PairingCode used = pairing.issueCode(now);
            PairingService.Redemption first = pairing.redeem(request(used.code()), now + 1L);
            store.transition(first.mirrorId(), MirrorStatus.REJECTED, now + 1L);
            Assertions.assertEquals(MirrorStatus.REJECTED, store.findMirror(first.mirrorId()).orElseThrow().status());
            // Rejecting the mirror does not free its code.
            PairingException consumed = Assertions.assertThrows(PairingException.class,
                    () -> pairing.redeem(request(used.code()), now + 2L));
            Assertions.assertEquals(PairingFailure.ALREADY_CONSUMED, consumed.failure());

            PairingCode stale = pairing.issueCode(now);
            PairingException expired = Assertions.assertThrows(PairingException.class,
                    () -> pairing.redeem(request(stale.code()), now + TTL_MS));
            Assertions.assertEquals(PairingFailure.EXPIRED_CODE, expired.failure());

            // Expiry is reported even for a code that was also consumed.
            PairingException usedAndExpired = Assertions.assertThrows(PairingException.class,
                    () -> pairing.redeem(request(used.code()), now + TTL_MS + 1L));
            Assertions.assertEquals(PairingFailure.EXPIRED_CODE, usedAndExpired.failure());

            Assertions.assertEquals(1, store.listMirrors().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void issueIsRateLimitedByOutstandingCodes() throws Exception {
        Path root = Files.createTempDirectory("archive-mirror-test-pairing-limit-");
        try {
            MirrorStore store = store(root);
            PairingService pairing = new PairingService(store, TTL_MS, 2);
            long now = 10_000L;

            Set<String> codes = new HashSet<>();
            codes.add(pairing.issueCode(now).code());
            codes.add(pairing.issueCode(now).code());
            Assertions.assertEquals(2, codes.size());

            PairingException limited = Assertions.assertThrows(PairingException.class, () -> pairing.issueCode(now + 1L));
            Assertions.assertEquals(PairingFailure.RATE_LIMITED, limited.failure());
            Assertions.assertEquals(429, limited.failure().httpStatus());

            // Consuming or expiring a code frees a slot.
            pairing.redeem(request(codes.iterator().next()), now + 2L);
            Assertions.assertNotNull(pairing.issueCode(now + 3L));
            Assertions.assertNotNull(pairing.issueCode(now + TTL_MS + 1L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void redeemRejectsIncompleteRequests() throws Exception {
        Path root = Files.createTempDirectory("archive-mirror-test-pairing-request-");
        try {
            PairingService pairing = new PairingService(store(root), TTL_MS, 5);
            PairingCode code = pairing.issueCode(1L);
            Assertions.assertThrows(IllegalArgumentException.class, () -> pairing.redeem(
                    new PairingService.RedeemRequest(code.code(), "m", " ", null, 10), 2L));
            Assertions.assertThrows(IllegalArgumentException.class, () -> pairing.redeem(
                    new PairingService.RedeemRequest(code.code(), "m", "http://h:1", null, 0), 2L));
            // The code survives a rejected request.
            Assertions.assertNotNull(pairing.redeem(request(code.code()), 3L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void purgeKeepsRecentlyExpiredCodes() throws Exception {
        Path root = Files.createTempDirectory("archive-mirror-test-pairing-purge-");
        try {
            MirrorStore store = store(root);
            PairingService pairing = new PairingService(store, TTL_MS, 5);
            PairingCode code = pairing.issueCode(0L);

            Assertions.assertEquals(0, pairing.purgeExpired(TTL_MS + 1L));
            Assertions.assertTrue(store.findPairingCode(code.code()).isPresent());
            Assertions.assertEquals(1, pairing.purgeExpired(TTL_MS + PairingService.PURGE_GRACE_MS + 1L));
            Assertions.assertTrue(store.findPairingCode(code.code()).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void normalizeCodeIsDashAndCaseInsensitive() {
        Assertions.assertEquals("ABCD-EFGH", PairingService.normalizeCode(" abcd efgh "));
        Assertions.assertEquals("ABCD-EFGH", PairingService.normalizeCode("ABCDEFGH"));
        Assertions.assertNull(PairingService.normalizeCode("ABC"));
        Assertions.assertNull(PairingService.normalizeCode(null));
    }

    private static PairingService.RedeemRequest request(String code) {
        return new PairingService.RedeemRequest(code, "mirror", "http://127.0.0.1:8000", "https://tunnel.example", 10);
    }

    private static MirrorStore store(Path root) {
        Database db = new Database(MirrorSyncConfig.fromRoot(root.toString()));
        db.init();
        return new MirrorStore(db);
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
