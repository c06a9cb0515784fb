package io.archivemirror.storage;

import io.archivemirror.model.CatalogEntry;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * SQLite-backed catalog. Writes come from catalog imports; change listeners fire after a
 * committed write that can alter what mirrors should hold.
 */
public final class CatalogStore implements CatalogSource {
    private static final String COLUMNS = "entry_id,file_name,content_hash,size_bytes,popularity,approved,created_at_ms";

    private final Database database;
    private final List<Runnable> changeListeners = new CopyOnWriteArrayList<>();

    public CatalogStore(Database database) {
        this.database = database;
    }

    public void addChangeListener(Runnable listener) {
        if (listener != null) {
            changeListeners.add(listener);
        }
    }

    @Override
    public List<CatalogEntry> approvedEntries() {
        return query("SELECT " + COLUMNS + " FROM catalog_entries WHERE approved=1 ORDER BY entry_id");
    }

    public List<CatalogEntry> listAll() {
        return query("SELECT " + COLUMNS + " FROM catalog_entries ORDER BY entry_id");
    }

    @Override
    public Optional<CatalogEntry> find(String entryId) {
        String sql = "SELECT " + COLUMNS + " FROM catalog_entries WHERE entry_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, entryId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load catalog entry: " + entryId, e);
        }
    }

    /**
     * Inserts or replaces every entry in one transaction and notifies listeners once.
     */
    public int upsertAll(List<CatalogEntry> entries, long nowMs) {
        if (entries == null || entries.isEmpty()) {
            return 0;
        }
        String sql = """
                INSERT INTO catalog_entries(entry_id,file_name,content_hash,size_bytes,popularity,approved,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?)
                ON CONFLICT(entry_id) DO UPDATE SET
                    file_name=excluded.file_name,
                    content_hash=excluded.content_hash,
                    size_bytes=excluded.size_bytes,
                    popularity=excluded.popularity,
                    approved=excluded.approved,
                    created_at_ms=excluded.created_at_ms,
                    updated_at_ms=excluded.updated_at_ms
                """;
        int written = 0;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (CatalogEntry entry : entries) {
                    ps.setString(1, entry.entryId());
                    ps.setString(2, entry.fileName());
                    ps.setString(3, entry.contentHash());
                    ps.setLong(4, entry.sizeBytes());
                    ps.setLong(5, entry.popularity());
                    ps.setInt(6, entry.approved() ? 1 : 0);
                    ps.setLong(7, entry.createdAtMs());
                    ps.setLong(8, nowMs);
                    written += ps.executeUpdate();
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to import catalog entries", e);
        }
        fireChanged();
        return written;
    }

    public boolean setApproved(String entryId, boolean approved, long nowMs) {
        String sql = "UPDATE catalog_entries SET approved=?, updated_at_ms=? WHERE entry_id=? AND approved<>?";
        int rows;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, approved ? 1 : 0);
            ps.setLong(2, nowMs);
            ps.setString(3, entryId);
            ps.setInt(4, approved ? 1 : 0);
            rows = ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to change approval: " + entryId, e);
        }
        if (rows > 0) {
            fireChanged();
        }
        return rows > 0;
    }

    /**
     * Popularity drifts continuously, so it does not notify listeners; the next periodic pass
     * picks up the new ranking.
     */
    public void incrementPopularity(String entryId) {
        String sql = "UPDATE catalog_entries SET popularity=popularity+1 WHERE entry_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, entryId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count download: " + entryId, e);
        }
    }

    private void fireChanged() {
        for (Runnable listener : changeListeners) {
            listener.run();
        }
    }

    private List<CatalogEntry> query(String sql) {
        List<CatalogEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read catalog", e);
        }
    }

    private static CatalogEntry map(ResultSet rs) throws SQLException {
        return new CatalogEntry(
                rs.getString("entry_id"),
                rs.getString("file_name"),
                rs.getString("content_hash"),
                rs.getLong("size_bytes"),
                rs.getLong("popularity"),
                rs.getLong("created_at_ms"),
                rs.getInt("approved") == 1
        );
    }
}
