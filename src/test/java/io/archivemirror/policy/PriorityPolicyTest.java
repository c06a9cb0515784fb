package io.archivemirror.policy;

import io.archivemirror.model.CatalogEntry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class PriorityPolicyTest {

    @Test
    void ranksByPopularityThenSmallerThenNewerThenId() {
        CatalogEntry popular = entry("a", 50, 900, 1_000L);
        CatalogEntry smaller = entry("b", 10, 100, 1_000L);
        CatalogEntry larger = entry("c", 10, 500, 1_000L);
        CatalogEntry newer = entry("d", 10, 500, 2_000L);
        CatalogEntry tieLow = entry("e", 1, 1, 1L);
        CatalogEntry tieHigh = entry("f", 1, 1, 1L);

        List<CatalogEntry> ranked = PriorityPolicy.rank(List.of(tieHigh, larger, tieLow, newer, smaller, popular));

        Assertions.assertEquals(
                List.of("a", "b", "d", "c", "e", "f"),
                ranked.stream().map(CatalogEntry::entryId).toList()
        );
    }

    @Test
    void selectIsAPrefixOfTheRanking() {
        List<CatalogEntry> entries = List.of(
                entry("x", 3, 10, 1L),
                entry("y", 7, 10, 1L),
                entry("z", 5, 10, 1L)
        );
        Assertions.assertEquals(List.of("y", "z"), PriorityPolicy.select(entries, 2).stream().map(CatalogEntry::entryId).toList());
        Assertions.assertEquals(3, PriorityPolicy.select(entries, 10).size());
        Assertions.assertTrue(PriorityPolicy.select(entries, 0).isEmpty());
        Assertions.assertTrue(PriorityPolicy.select(entries, -1).isEmpty());
        Assertions.assertTrue(PriorityPolicy.select(List.of(), 5).isEmpty());
    }

    @Test
    void excessDropsLowestRankedFirst() {
        List<CatalogEntry> entries = List.of(
                entry("keep-1", 9, 10, 1L),
                entry("drop-2", 1, 10, 1L),
                entry("keep-2", 8, 10, 1L),
                entry("drop-1", 0, 10, 1L)
        );
        Assertions.assertEquals(
                List.of("drop-1", "drop-2"),
                PriorityPolicy.excess(entries, 2).stream().map(CatalogEntry::entryId).toList()
        );
        Assertions.assertTrue(PriorityPolicy.excess(entries, 4).isEmpty());
        Assertions.assertEquals(4, PriorityPolicy.excess(entries, 0).size());
    }

    private static CatalogEntry entry(String id, long popularity, long size, long createdAt) {
        return new CatalogEntry(id, id + ".bin", "0".repeat(32), size, popularity, createdAt, true);
    }
}
