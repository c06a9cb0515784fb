package io.archivemirror.model;

public record SyncLogEntry(
        long id,
        String mirrorId,
        String entryId,
        SyncAction action,
        long createdAtMs,
        String detail
) {
    public static SyncLogEntry of(String mirrorId, String entryId, SyncAction action, long nowMs, String detail) {
        return new SyncLogEntry(0L, mirrorId, entryId, action, nowMs, detail == null ? "" : detail);
    }
}
