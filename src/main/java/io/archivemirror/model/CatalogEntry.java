package io.archivemirror.model;

public record CatalogEntry(
        String entryId,
        String fileName,
        String contentHash,
        long sizeBytes,
        long popularity,
        long createdAtMs,
        boolean approved
) {
}
