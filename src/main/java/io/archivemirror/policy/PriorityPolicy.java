package io.archivemirror.policy;

import io.archivemirror.model.CatalogEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks catalog entries for distribution and retention.
 *
 * <p>Order, best first: popularity descending, byte size ascending, creation time
 * descending, entry id ascending. The last key is unique, so the order is total and
 * the origin and every mirror agree on the same set for the same input.
 */
public final class PriorityPolicy {
    public static final Comparator<CatalogEntry> RANKING = Comparator
            .comparingLong(CatalogEntry::popularity).reversed()
            .thenComparingLong(CatalogEntry::sizeBytes)
            .thenComparing(Comparator.comparingLong(CatalogEntry::createdAtMs).reversed())
            .thenComparing(CatalogEntry::entryId);

    private PriorityPolicy() {
    }

    public static List<CatalogEntry> rank(Collection<CatalogEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return List.of();
        }
        List<CatalogEntry> out = new ArrayList<>(entries);
        out.sort(RANKING);
        return out;
    }

    public static List<CatalogEntry> select(Collection<CatalogEntry> entries, int targetCount) {
        if (targetCount <= 0) {
            return List.of();
        }
        List<CatalogEntry> ranked = rank(entries);
        if (ranked.size() <= targetCount) {
            return ranked;
        }
        return List.copyOf(ranked.subList(0, targetCount));
    }

    /**
     * Lowest-ranked first: the order in which holdings should be evicted.
     */
    public static List<CatalogEntry> evictionOrder(Collection<CatalogEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return List.of();
        }
        List<CatalogEntry> out = new ArrayList<>(entries);
        out.sort(RANKING.reversed());
        return out;
    }

    /**
     * The entries that must be dropped so that at most {@code capacity} remain.
     */
    public static List<CatalogEntry> excess(Collection<CatalogEntry> entries, int capacity) {
        int size = entries == null ? 0 : entries.size();
        int over = size - Math.max(0, capacity);
        if (over <= 0) {
            return List.of();
        }
        return List.copyOf(evictionOrder(entries).subList(0, over));
    }
}
