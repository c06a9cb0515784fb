package io.archivemirror.agent;

public record HealthSnapshot(
        String status,
        String mirrorName,
        boolean paired,
        String mirrorId,
        int fileCount,
        long totalBytes,
        int capacity,
        int activeDownloads,
        long servedDownloads,
        long lastSyncAtMs,
        long downloadBytesPerSecond
) {
}
