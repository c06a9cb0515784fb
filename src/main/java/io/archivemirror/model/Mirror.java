package io.archivemirror.model;

public record Mirror(
        String mirrorId,
        String name,
        MirrorStatus status,
        String credential,
        MirrorAddress directAddress,
        MirrorAddress tunnelAddress,
        int capacity,
        long lastHeartbeatMs,
        long createdAtMs,
        long lastSyncAtMs,
        int reportedFileCount,
        long reportedBytes
) {
    /**
     * The tunnel wins when configured; otherwise the direct address.
     */
    public MirrorAddress effectiveAddress() {
        return tunnelAddress != null ? tunnelAddress : directAddress;
    }

    public Mirror withStatus(MirrorStatus next) {
        return new Mirror(mirrorId, name, next, credential, directAddress, tunnelAddress, capacity,
                lastHeartbeatMs, createdAtMs, lastSyncAtMs, reportedFileCount, reportedBytes);
    }
}
