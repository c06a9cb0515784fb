package io.archivemirror.model;

import java.util.List;

/**
 * What a mirror did with a {@link SyncInstruction}. {@code holdings} is the full set of
 * verified entry ids the mirror holds after the pass, including any self-eviction.
 */
public record SyncReport(
        String mirrorId,
        List<ItemOutcome> outcomes,
        List<String> holdings,
        long completedAtMs
) {
    public SyncReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        holdings = holdings == null ? List.of() : List.copyOf(holdings);
    }

    public long count(SyncAction action) {
        return outcomes.stream().filter(o -> o.action() == action).count();
    }

    public record ItemOutcome(String entryId, SyncAction action, String detail) {
    }
}
