package io.archivemirror.sync;

public record SyncResult(
        String mirrorId,
        Outcome outcome,
        int pushed,
        int evicted,
        int verifyFailed,
        int fetchFailed,
        String detail
) {
    public enum Outcome {
        COMPLETED,
        NOTHING_TO_DO,
        SKIPPED_IN_FLIGHT,
        SKIPPED_NOT_TARGET,
        UNKNOWN_MIRROR,
        UNREACHABLE,
        FAILED
    }

    static SyncResult of(String mirrorId, Outcome outcome, String detail) {
        return new SyncResult(mirrorId, outcome, 0, 0, 0, 0, detail == null ? "" : detail);
    }
}
