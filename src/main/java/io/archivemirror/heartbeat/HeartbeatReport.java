package io.archivemirror.heartbeat;

/**
 * Counters a mirror sends with every heartbeat.
 */
public record HeartbeatReport(int fileCount, long totalBytes, int activeDownloads) {
    public static HeartbeatReport empty() {
        return new HeartbeatReport(0, 0L, 0);
    }
}
