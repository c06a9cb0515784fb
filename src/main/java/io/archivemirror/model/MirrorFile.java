package io.archivemirror.model;

public record MirrorFile(
        String mirrorId,
        String entryId,
        VerificationState state,
        long syncedAtMs
) {
}
