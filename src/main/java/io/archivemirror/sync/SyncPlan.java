package io.archivemirror.sync;

import io.archivemirror.model.CatalogEntry;

import java.util.List;
import java.util.Set;

/**
 * Difference between what a mirror should hold and what it holds: {@code toFetch} in rank
 * order, {@code toEvict} sorted by id.
 */
public record SyncPlan(
        String mirrorId,
        List<CatalogEntry> toFetch,
        List<String> toEvict,
        Set<String> desired,
        Set<String> current
) {
    public SyncPlan {
        toFetch = List.copyOf(toFetch);
        toEvict = List.copyOf(toEvict);
        desired = Set.copyOf(desired);
        current = Set.copyOf(current);
    }

    public boolean hasWork() {
        return !toFetch.isEmpty() || !toEvict.isEmpty();
    }
}
