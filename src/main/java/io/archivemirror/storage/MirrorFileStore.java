package io.archivemirror.storage;

import io.archivemirror.model.MirrorFile;
import io.archivemirror.model.VerificationState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Origin-side index of which mirror holds which entry. Rows are written as VERIFIED only
 * after the mirror reported a matching content hash.
 */
public final class MirrorFileStore {
    private final Database database;

    public MirrorFileStore(Database database) {
        this.database = database;
    }

    public List<MirrorFile> listForMirror(String mirrorId) {
        String sql = "SELECT mirror_id,entry_id,state,synced_at_ms FROM mirror_files WHERE mirror_id=? ORDER BY entry_id";
        List<MirrorFile> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, mirrorId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new MirrorFile(
                            rs.getString("mirror_id"),
                            rs.getString("entry_id"),
                            VerificationState.valueOf(rs.getString("state")),
                            rs.getLong("synced_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list mirror files: " + mirrorId, e);
        }
    }

    public Set<String> verifiedEntryIds(String mirrorId) {
        Set<String> out = new LinkedHashSet<>();
        for (MirrorFile file : listForMirror(mirrorId)) {
            if (file.state() == VerificationState.VERIFIED) {
                out.add(file.entryId());
            }
        }
        return out;
    }

    /**
     * Mirror ids holding a VERIFIED copy of {@code entryId}.
     */
    public List<String> mirrorsHolding(String entryId) {
        String sql = "SELECT mirror_id FROM mirror_files WHERE entry_id=? AND state='VERIFIED' ORDER BY mirror_id";
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, entryId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString("mirror_id"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find holders: " + entryId, e);
        }
    }

    public int countVerified() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(1) FROM mirror_files WHERE state='VERIFIED'");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count mirror files", e);
        }
    }

    /**
     * Applies one sync report atomically: verified pushes are inserted, evictions removed,
     * then the mirror's rows are reconciled with the complete {@code holdings} it reported.
     */
    public void applyReport(String mirrorId, Collection<String> pushed, Collection<String> evicted,
                            Collection<String> holdings, long nowMs) {
        String upsert = """
                INSERT INTO mirror_files(mirror_id,entry_id,state,synced_at_ms) VALUES(?,?,'VERIFIED',?)
                ON CONFLICT(mirror_id,entry_id) DO UPDATE SET state='VERIFIED', synced_at_ms=excluded.synced_at_ms
                """;
        String insertIfMissing = "INSERT OR IGNORE INTO mirror_files(mirror_id,entry_id,state,synced_at_ms) VALUES(?,?,'VERIFIED',?)";
        String delete = "DELETE FROM mirror_files WHERE mirror_id=? AND entry_id=?";
        String select = "SELECT entry_id FROM mirror_files WHERE mirror_id=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psUp = c.prepareStatement(upsert);
                 PreparedStatement psIns = c.prepareStatement(insertIfMissing);
                 PreparedStatement psDel = c.prepareStatement(delete);
                 PreparedStatement psSel = c.prepareStatement(select)) {
                for (String entryId : pushed) {
                    psUp.setString(1, mirrorId);
                    psUp.setString(2, entryId);
                    psUp.setLong(3, nowMs);
                    psUp.executeUpdate();
                }
                for (String entryId : evicted) {
                    psDel.setString(1, mirrorId);
                    psDel.setString(2, entryId);
                    psDel.executeUpdate();
                }
                if (holdings != null) {
                    Set<String> held = new HashSet<>(holdings);
                    List<String> stale = new ArrayList<>();
                    psSel.setString(1, mirrorId);
                    try (ResultSet rs = psSel.executeQuery()) {
                        while (rs.next()) {
                            String entryId = rs.getString("entry_id");
                            if (!held.contains(entryId)) {
                                stale.add(entryId);
                            }
                        }
                    }
                    for (String entryId : stale) {
                        psDel.setString(1, mirrorId);
                        psDel.setString(2, entryId);
                        psDel.executeUpdate();
                    }
                    for (String entryId : held) {
                        psIns.setString(1, mirrorId);
                        psIns.setString(2, entryId);
                        psIns.setLong(3, nowMs);
                        psIns.executeUpdate();
                    }
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to apply sync report: " + mirrorId, e);
        }
    }
}
