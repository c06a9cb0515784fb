package io.archivemirror.model;

public enum SyncAction {
    PUSH("push"),
    EVICT("evict"),
    VERIFY_FAIL("verify-fail"),
    FETCH_FAIL("fetch-fail");

    private final String wireName;

    SyncAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static SyncAction fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Sync action must not be blank");
        }
        String value = raw.trim();
        for (SyncAction action : values()) {
            if (action.wireName.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown sync action: " + raw);
    }
}
