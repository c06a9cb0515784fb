package io.archivemirror.storage;

import io.archivemirror.model.SyncAction;
import io.archivemirror.model.SyncLogEntry;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only replication history: insert and query, nothing else.
 */
public final class SyncLogStore {
    private final Database database;

    public SyncLogStore(Database database) {
        this.database = database;
    }

    public void append(SyncLogEntry entry) {
        appendAll(List.of(entry));
    }

    public void appendAll(List<SyncLogEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO sync_log(mirror_id,entry_id,action,detail,created_at_ms) VALUES(?,?,?,?,?)";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (SyncLogEntry entry : entries) {
                    ps.setString(1, entry.mirrorId());
                    ps.setString(2, entry.entryId());
                    ps.setString(3, entry.action().wireName());
                    ps.setString(4, entry.detail() == null ? "" : entry.detail());
                    ps.setLong(5, entry.createdAtMs());
                    ps.executeUpdate();
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to append sync log", e);
        }
    }

    /**
     * Newest first.
     */
    public List<SyncLogEntry> listForMirror(String mirrorId, int limit) {
        String sql = """
                SELECT id,mirror_id,entry_id,action,detail,created_at_ms
                FROM sync_log
                WHERE mirror_id=?
                ORDER BY id DESC
                LIMIT ?
                """;
        List<SyncLogEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, mirrorId);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SyncLogEntry(
                            rs.getLong("id"),
                            rs.getString("mirror_id"),
                            rs.getString("entry_id"),
                            SyncAction.fromString(rs.getString("action")),
                            rs.getLong("created_at_ms"),
                            rs.getString("detail")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read sync log: " + mirrorId, e);
        }
    }

    public Map<SyncAction, Long> countByAction() {
        Map<SyncAction, Long> out = new EnumMap<>(SyncAction.class);
        for (SyncAction action : SyncAction.values()) {
            out.put(action, 0L);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT action, COUNT(1) AS n FROM sync_log GROUP BY action");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(SyncAction.fromString(rs.getString("action")), rs.getLong("n"));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count sync log", e);
        }
    }
}
