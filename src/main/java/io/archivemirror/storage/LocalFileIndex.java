package io.archivemirror.storage;

import io.archivemirror.model.CatalogEntry;
import io.archivemirror.model.VerificationState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The mirror's own view of what it stores, plus its pairing state. Lives in the mirror's
 * database, never the origin's.
 */
public final class LocalFileIndex {
    public static final String KEY_MIRROR_ID = "mirror_id";
    public static final String KEY_CREDENTIAL = "credential";
    public static final String KEY_LAST_SYNC_MS = "last_sync_ms";

    private static final String COLUMNS = "entry_id,file_name,content_hash,size_bytes,popularity,created_at_ms,state,synced_at_ms,download_count";

    private final Database database;

    public LocalFileIndex(Database database) {
        this.database = database;
    }

    public Optional<LocalFile> find(String entryId) {
        String sql = "SELECT " + COLUMNS + " FROM local_files WHERE entry_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, entryId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load local file: " + entryId, e);
        }
    }

    public List<LocalFile> listVerified() {
        String sql = "SELECT " + COLUMNS + " FROM local_files WHERE state='VERIFIED' ORDER BY entry_id";
        List<LocalFile> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list local files", e);
        }
    }

    public void putVerified(CatalogEntry entry, long nowMs) {
        String sql = """
                INSERT INTO local_files(entry_id,file_name,content_hash,size_bytes,popularity,created_at_ms,state,synced_at_ms,download_count)
                VALUES(?,?,?,?,?,?,'VERIFIED',?,0)
                ON CONFLICT(entry_id) DO UPDATE SET
                    file_name=excluded.file_name,
                    content_hash=excluded.content_hash,
                    size_bytes=excluded.size_bytes,
                    popularity=excluded.popularity,
                    created_at_ms=excluded.created_at_ms,
                    state='VERIFIED',
                    synced_at_ms=excluded.synced_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, entry.entryId());
            ps.setString(2, entry.fileName());
            ps.setString(3, entry.contentHash());
            ps.setLong(4, entry.sizeBytes());
            ps.setLong(5, entry.popularity());
            ps.setLong(6, entry.createdAtMs());
            ps.setLong(7, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record local file: " + entry.entryId(), e);
        }
    }

    public boolean remove(String entryId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM local_files WHERE entry_id=?")) {
            ps.setString(1, entryId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to remove local file: " + entryId, e);
        }
    }

    public void incrementDownloads(String entryId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE local_files SET download_count=download_count+1 WHERE entry_id=?")) {
            ps.setString(1, entryId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count local download: " + entryId, e);
        }
    }

    public Totals totals() {
        String sql = "SELECT COUNT(1) AS n, COALESCE(SUM(size_bytes),0) AS bytes FROM local_files WHERE state='VERIFIED'";
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return new Totals(0, 0L);
            }
            return new Totals(rs.getInt("n"), rs.getLong("bytes"));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to total local files", e);
        }
    }

    public Optional<String> getState(String key) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT state_value FROM agent_state WHERE state_key=?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read agent state: " + key, e);
        }
    }

    public void putState(String key, String value, long nowMs) {
        String sql = """
                INSERT INTO agent_state(state_key,state_value,updated_at_ms) VALUES(?,?,?)
                ON CONFLICT(state_key) DO UPDATE SET state_value=excluded.state_value, updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.setLong(3, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write agent state: " + key, e);
        }
    }

    /**
     * Stores the pairing result in one transaction so a crash never leaves half of it.
     */
    public void savePairing(String mirrorId, String credential, long nowMs) {
        String sql = """
                INSERT INTO agent_state(state_key,state_value,updated_at_ms) VALUES(?,?,?)
                ON CONFLICT(state_key) DO UPDATE SET state_value=excluded.state_value, updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, KEY_MIRROR_ID);
                ps.setString(2, mirrorId);
                ps.setLong(3, nowMs);
                ps.executeUpdate();
                ps.setString(1, KEY_CREDENTIAL);
                ps.setString(2, credential);
                ps.setLong(3, nowMs);
                ps.executeUpdate();
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to save pairing state", e);
        }
    }

    private static LocalFile map(ResultSet rs) throws SQLException {
        return new LocalFile(
                new CatalogEntry(
                        rs.getString("entry_id"),
                        rs.getString("file_name"),
                        rs.getString("content_hash"),
                        rs.getLong("size_bytes"),
                        rs.getLong("popularity"),
                        rs.getLong("created_at_ms"),
                        true
                ),
                VerificationState.valueOf(rs.getString("state")),
                rs.getLong("synced_at_ms"),
                rs.getLong("download_count")
        );
    }

    public record LocalFile(CatalogEntry entry, VerificationState state, long syncedAtMs, long downloadCount) {
        public String entryId() {
            return entry.entryId();
        }
    }

    public record Totals(int fileCount, long totalBytes) {}
}
