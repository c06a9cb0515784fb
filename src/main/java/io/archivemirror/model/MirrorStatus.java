package io.archivemirror.model;

import java.util.Locale;

public enum MirrorStatus {
    PENDING,
    APPROVED,
    ONLINE,
    OFFLINE,
    REJECTED;

    public boolean canTransitionTo(MirrorStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == APPROVED || next == REJECTED;
            case APPROVED -> next == ONLINE || next == OFFLINE;
            case ONLINE -> next == OFFLINE;
            case OFFLINE -> next == ONLINE;
            case REJECTED -> false;
        };
    }

    /**
     * Mirrors whose liveness the heartbeat monitor tracks.
     */
    public boolean isTracked() {
        return this == APPROVED || this == ONLINE || this == OFFLINE;
    }

    /**
     * Mirrors the orchestrator pushes to. OFFLINE mirrors keep their files but get no new work.
     */
    public boolean isSyncTarget() {
        return this == APPROVED || this == ONLINE;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MirrorStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Mirror status must not be blank");
        }
        for (MirrorStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown mirror status: " + raw);
    }
}
