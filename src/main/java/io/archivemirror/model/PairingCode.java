package io.archivemirror.model;

public record PairingCode(
        String code,
        long issuedAtMs,
        long expiresAtMs,
        boolean consumed,
        long consumedAtMs,
        String mirrorId
) {
    public boolean isExpired(long nowMs) {
        return nowMs >= expiresAtMs;
    }

    public boolean isOutstanding(long nowMs) {
        return !consumed && !isExpired(nowMs);
    }
}
