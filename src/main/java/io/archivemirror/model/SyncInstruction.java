package io.archivemirror.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * One orchestration pass worth of work for a single mirror.
 */
public record SyncInstruction(
        String mirrorId,
        List<CatalogEntry> fetch,
        List<String> evict,
        long issuedAtMs
) {
    public SyncInstruction {
        fetch = fetch == null ? List.of() : List.copyOf(fetch);
        evict = evict == null ? List.of() : List.copyOf(evict);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return fetch.isEmpty() && evict.isEmpty();
    }
}
