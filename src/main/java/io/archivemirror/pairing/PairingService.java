package io.archivemirror.pairing;

import io.archivemirror.model.Mirror;
import io.archivemirror.model.MirrorAddress;
import io.archivemirror.model.MirrorStatus;
import io.archivemirror.model.PairingCode;
import io.archivemirror.storage.MirrorStore;
import org.jboss.logging.Logger;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Locale;
import java.util.UUID;

/**
 * Issues one-time pairing codes and turns a redeemed code into a PENDING mirror with its
 * own credential.
 */
public final class PairingService {
    private static final Logger LOG = Logger.getLogger(PairingService.class);

    /** Excludes 0, O, 1, I and L. */
    static final String ALPHABET = "ABCDEFGHJKMNPQRSTUVWXYZ23456789";
    static final int CODE_LENGTH = 8;
    private static final int CREDENTIAL_BYTES = 32;
    private static final int MAX_COLLISION_RETRIES = 5;
    /** How long an expired code stays queryable before the sweep purges it. */
    static final long PURGE_GRACE_MS = 24L * 60L * 60L * 1_000L;

    private final MirrorStore store;
    private final long codeTtlMs;
    private final int maxOutstanding;
    private final SecureRandom random = new SecureRandom();

    public PairingService(MirrorStore store, long codeTtlMs, int maxOutstanding) {
        if (codeTtlMs <= 0L) {
            throw new IllegalArgumentException("codeTtlMs must be > 0");
        }
        if (maxOutstanding < 1) {
            throw new IllegalArgumentException("maxOutstanding must be >= 1");
        }
        this.store = store;
        this.codeTtlMs = codeTtlMs;
        this.maxOutstanding = maxOutstanding;
    }

    public PairingCode issueCode() {
        return issueCode(System.currentTimeMillis());
    }

    public PairingCode issueCode(long nowMs) {
        for (int attempt = 0; attempt < MAX_COLLISION_RETRIES; attempt++) {
            MirrorStore.IssueOutcome outcome = store.issuePairingCode(newCode(), nowMs, nowMs + codeTtlMs, maxOutstanding);
            switch (outcome.status()) {
                case ISSUED -> {
                    LOG.infof("Issued pairing code expiring at %d (%d outstanding)", outcome.code().expiresAtMs(), outcome.outstanding());
                    return outcome.code();
                }
                case LIMIT_REACHED -> throw new PairingException(
                        PairingFailure.RATE_LIMITED,
                        "Too many outstanding pairing codes (" + outcome.outstanding() + "/" + maxOutstanding + ")");
                case COLLISION -> LOG.debug("Pairing code collision, retrying");
                default -> throw new IllegalStateException("Unexpected issue outcome: " + outcome.status());
            }
        }
        throw new IllegalStateException("Could not generate a unique pairing code");
    }

    public Redemption redeem(RedeemRequest request) {
        return redeem(request, System.currentTimeMillis());
    }

    /**
     * Redeems a code. Failures are reported as {@link PairingException}; invalid request
     * fields as {@link IllegalArgumentException}.
     */
    public Redemption redeem(RedeemRequest request, long nowMs) {
        if (request == null) {
            throw new IllegalArgumentException("pairing request must not be null");
        }
        String code = normalizeCode(request.code());
        if (code == null) {
            throw new PairingException(PairingFailure.INVALID_CODE, "Unknown pairing code");
        }
        if (request.directUrl() == null || request.directUrl().isBlank()) {
            throw new IllegalArgumentException("direct_url is required");
        }
        if (request.capacity() < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        String name = request.mirrorName() == null || request.mirrorName().isBlank()
                ? "mirror"
                : request.mirrorName().trim();
        Mirror candidate = new Mirror(
                "mir_" + UUID.randomUUID(),
                name,
                MirrorStatus.PENDING,
                newCredential(),
                MirrorAddress.direct(request.directUrl()),
                MirrorAddress.optionalTunnel(request.tunnelUrl()),
                request.capacity(),
                0L,
                nowMs,
                0L,
                0,
                0L
        );
        MirrorStore.RedeemOutcome outcome = store.redeemPairingCode(code, candidate, nowMs);
        return switch (outcome.status()) {
            case REDEEMED -> {
                LOG.infof("Mirror %s (%s) paired, awaiting approval", outcome.mirror().mirrorId(), name);
                yield new Redemption(outcome.mirror().mirrorId(), outcome.mirror().credential());
            }
            case INVALID -> throw new PairingException(PairingFailure.INVALID_CODE, "Unknown pairing code");
            case EXPIRED -> throw new PairingException(PairingFailure.EXPIRED_CODE, "Pairing code has expired");
            case CONSUMED -> throw new PairingException(PairingFailure.ALREADY_CONSUMED, "Pairing code was already used");
        };
    }

    public int purgeExpired(long nowMs) {
        int purged = store.purgeExpiredCodes(nowMs - PURGE_GRACE_MS);
        if (purged > 0) {
            LOG.debugf("Purged %d expired pairing codes", purged);
        }
        return purged;
    }

    /**
     * Upper-cases, drops separators and whitespace, and re-inserts the dash. Returns null when
     * the input cannot be a code.
     */
    public static String normalizeCode(String raw) {
        if (raw == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (char ch : raw.toUpperCase(Locale.ROOT).toCharArray()) {
            if (Character.isLetterOrDigit(ch)) {
                sb.append(ch);
            }
        }
        if (sb.length() != CODE_LENGTH) {
            return null;
        }
        return sb.substring(0, CODE_LENGTH / 2) + "-" + sb.substring(CODE_LENGTH / 2);
    }

    private String newCode() {
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return normalizeCode(sb.toString());
    }

    private String newCredential() {
        byte[] bytes = new byte[CREDENTIAL_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public record RedeemRequest(String code, String mirrorName, String directUrl, String tunnelUrl, int capacity) {}

    public record Redemption(String mirrorId, String credential) {}
}
