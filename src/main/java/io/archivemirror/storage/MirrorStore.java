package io.archivemirror.storage;

import io.archivemirror.model.Mirror;
import io.archivemirror.model.MirrorAddress;
import io.archivemirror.model.MirrorStatus;
import io.archivemirror.model.PairingCode;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of mirrors and the pairing codes that create them.
 *
 * <p>Every read-then-write operation runs in one IMMEDIATE transaction, so concurrent
 * callers (HTTP handlers, the sweep, the orchestrator) serialize on the database lock.
 */
public final class MirrorStore {
    private static final String MIRROR_COLUMNS = """
            mirror_id,name,status,credential,direct_url,tunnel_url,capacity,last_heartbeat_ms,
            created_at_ms,last_sync_at_ms,reported_file_count,reported_bytes
            """;

    private final Database database;

    public MirrorStore(Database database) {
        this.database = database;
    }

    public IssueOutcome issuePairingCode(String code, long nowMs, long expiresAtMs, int maxOutstanding) {
        String count = "SELECT COUNT(1) FROM pairing_codes WHERE consumed=0 AND expires_at_ms>?";
        String insert = "INSERT OR IGNORE INTO pairing_codes(code,issued_at_ms,expires_at_ms,consumed,consumed_at_ms) VALUES(?,?,?,0,0)";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psCount = c.prepareStatement(count);
                 PreparedStatement psIns = c.prepareStatement(insert)) {
                psCount.setLong(1, nowMs);
                int outstanding;
                try (ResultSet rs = psCount.executeQuery()) {
                    outstanding = rs.next() ? rs.getInt(1) : 0;
                }
                if (outstanding >= maxOutstanding) {
                    c.commit();
                    return new IssueOutcome(IssueStatus.LIMIT_REACHED, null, outstanding);
                }
                psIns.setString(1, code);
                psIns.setLong(2, nowMs);
                psIns.setLong(3, expiresAtMs);
                int rows = psIns.executeUpdate();
                c.commit();
                if (rows == 0) {
                    return new IssueOutcome(IssueStatus.COLLISION, null, outstanding);
                }
                return new IssueOutcome(
                        IssueStatus.ISSUED,
                        new PairingCode(code, nowMs, expiresAtMs, false, 0L, null),
                        outstanding + 1
                );
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to issue pairing code", e);
        }
    }

    /**
     * Consumes {@code code} and inserts {@code mirror} atomically. The expiry check comes
     * before the consumed check, so an expired code reports EXPIRED even if it was used.
     */
    public RedeemOutcome redeemPairingCode(String code, Mirror mirror, long nowMs) {
        String select = "SELECT code,issued_at_ms,expires_at_ms,consumed,consumed_at_ms,mirror_id FROM pairing_codes WHERE code=?";
        String consume = "UPDATE pairing_codes SET consumed=1, consumed_at_ms=?, mirror_id=? WHERE code=? AND consumed=0";
        String insert = """
                INSERT INTO mirrors(mirror_id,name,status,credential,direct_url,tunnel_url,capacity,
                    last_heartbeat_ms,last_sync_at_ms,reported_file_count,reported_bytes,
                    created_at_ms,updated_at_ms,status_changed_at_ms)
                VALUES(?,?,?,?,?,?,?,0,0,0,0,?,?,?)
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psSel = c.prepareStatement(select);
                 PreparedStatement psConsume = c.prepareStatement(consume);
                 PreparedStatement psIns = c.prepareStatement(insert)) {
                psSel.setString(1, code);
                PairingCode existing;
                try (ResultSet rs = psSel.executeQuery()) {
                    if (!rs.next()) {
                        c.commit();
                        return new RedeemOutcome(RedeemStatus.INVALID, null);
                    }
                    existing = mapCode(rs);
                }
                if (existing.isExpired(nowMs)) {
                    c.commit();
                    return new RedeemOutcome(RedeemStatus.EXPIRED, null);
                }
                if (existing.consumed()) {
                    c.commit();
                    return new RedeemOutcome(RedeemStatus.CONSUMED, null);
                }
                psIns.setString(1, mirror.mirrorId());
                psIns.setString(2, mirror.name());
                psIns.setString(3, MirrorStatus.PENDING.name());
                psIns.setString(4, mirror.credential());
                psIns.setString(5, mirror.directAddress().url());
                psIns.setString(6, mirror.tunnelAddress() == null ? null : mirror.tunnelAddress().url());
                psIns.setInt(7, mirror.capacity());
                psIns.setLong(8, nowMs);
                psIns.setLong(9, nowMs);
                psIns.setLong(10, nowMs);
                psIns.executeUpdate();

                psConsume.setLong(1, nowMs);
                psConsume.setString(2, mirror.mirrorId());
                psConsume.setString(3, code);
                if (psConsume.executeUpdate() != 1) {
                    throw new IllegalStateException("Pairing code consumed concurrently: " + code);
                }
                c.commit();
                return new RedeemOutcome(RedeemStatus.REDEEMED, mirror.withStatus(MirrorStatus.PENDING));
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to redeem pairing code", e);
        }
    }

    public Optional<PairingCode> findPairingCode(String code) {
        String sql = "SELECT code,issued_at_ms,expires_at_ms,consumed,consumed_at_ms,mirror_id FROM pairing_codes WHERE code=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, code);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapCode(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load pairing code", e);
        }
    }

    public int countOutstandingCodes(long nowMs) {
        String sql = "SELECT COUNT(1) FROM pairing_codes WHERE consumed=0 AND expires_at_ms>?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count pairing codes", e);
        }
    }

    /**
     * Deletes codes that expired before {@code expiredBeforeMs}.
     */
    public int purgeExpiredCodes(long expiredBeforeMs) {
        String sql = "DELETE FROM pairing_codes WHERE expires_at_ms<?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, expiredBeforeMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to purge pairing codes", e);
        }
    }

    public Optional<Mirror> findMirror(String mirrorId) {
        String sql = "SELECT " + MIRROR_COLUMNS + " FROM mirrors WHERE mirror_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, mirrorId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapMirror(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load mirror: " + mirrorId, e);
        }
    }

    public Optional<Mirror> findMirrorByCredential(String credential) {
        if (credential == null || credential.isBlank()) {
            return Optional.empty();
        }
        String sql = "SELECT " + MIRROR_COLUMNS + " FROM mirrors WHERE credential=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, credential.trim());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapMirror(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load mirror by credential", e);
        }
    }

    public List<Mirror> listMirrors() {
        String sql = "SELECT " + MIRROR_COLUMNS + " FROM mirrors ORDER BY created_at_ms ASC, mirror_id ASC";
        List<Mirror> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapMirror(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list mirrors", e);
        }
    }

    public List<Mirror> listMirrors(MirrorStatus status) {
        String sql = "SELECT " + MIRROR_COLUMNS + " FROM mirrors WHERE status=? ORDER BY created_at_ms ASC, mirror_id ASC";
        List<Mirror> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapMirror(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list mirrors by status", e);
        }
    }

    public Map<MirrorStatus, Integer> countByStatus() {
        Map<MirrorStatus, Integer> out = new EnumMap<>(MirrorStatus.class);
        for (MirrorStatus status : MirrorStatus.values()) {
            out.put(status, 0);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(1) AS n FROM mirrors GROUP BY status");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(MirrorStatus.fromString(rs.getString("status")), rs.getInt("n"));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count mirrors", e);
        }
    }

    /**
     * Moves a mirror to {@code next}. Disallowed transitions raise {@link IllegalStateException}
     * and leave the row untouched.
     */
    public TransitionOutcome transition(String mirrorId, MirrorStatus next, long nowMs) {
        String select = "SELECT status FROM mirrors WHERE mirror_id=?";
        String update = "UPDATE mirrors SET status=?, updated_at_ms=?, status_changed_at_ms=? WHERE mirror_id=? AND status=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psSel = c.prepareStatement(select);
                 PreparedStatement psUp = c.prepareStatement(update)) {
                psSel.setString(1, mirrorId);
                MirrorStatus previous;
                try (ResultSet rs = psSel.executeQuery()) {
                    if (!rs.next()) {
                        throw new IllegalArgumentException("Unknown mirror: " + mirrorId);
                    }
                    previous = MirrorStatus.fromString(rs.getString("status"));
                }
                if (previous == next) {
                    c.commit();
                    return new TransitionOutcome(false, previous, previous);
                }
                if (!previous.canTransitionTo(next)) {
                    throw new IllegalStateException(
                            "Mirror " + mirrorId + " cannot move from " + previous.wireName() + " to " + next.wireName());
                }
                psUp.setString(1, next.name());
                psUp.setLong(2, nowMs);
                psUp.setLong(3, nowMs);
                psUp.setString(4, mirrorId);
                psUp.setString(5, previous.name());
                psUp.executeUpdate();
                c.commit();
                return new TransitionOutcome(true, previous, next);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed to change mirror status: " + mirrorId, e);
        }
    }

    /**
     * Refreshes liveness for a tracked mirror. PENDING and REJECTED rows are read but never written.
     */
    public HeartbeatOutcome recordHeartbeat(String mirrorId, long nowMs, int fileCount, long totalBytes) {
        String select = "SELECT status FROM mirrors WHERE mirror_id=?";
        String update = """
                UPDATE mirrors
                SET status=?, last_heartbeat_ms=?, reported_file_count=?, reported_bytes=?, updated_at_ms=?,
                    status_changed_at_ms=CASE WHEN status=? THEN status_changed_at_ms ELSE ? END
                WHERE mirror_id=?
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psSel = c.prepareStatement(select);
                 PreparedStatement psUp = c.prepareStatement(update)) {
                psSel.setString(1, mirrorId);
                MirrorStatus previous;
                try (ResultSet rs = psSel.executeQuery()) {
                    if (!rs.next()) {
                        c.commit();
                        return new HeartbeatOutcome(false, null, null);
                    }
                    previous = MirrorStatus.fromString(rs.getString("status"));
                }
                if (!previous.isTracked()) {
                    c.commit();
                    return new HeartbeatOutcome(false, previous, previous);
                }
                MirrorStatus next = MirrorStatus.ONLINE;
                psUp.setString(1, next.name());
                psUp.setLong(2, nowMs);
                psUp.setInt(3, Math.max(0, fileCount));
                psUp.setLong(4, Math.max(0L, totalBytes));
                psUp.setLong(5, nowMs);
                psUp.setString(6, next.name());
                psUp.setLong(7, nowMs);
                psUp.setString(8, mirrorId);
                psUp.executeUpdate();
                c.commit();
                return new HeartbeatOutcome(true, previous, next);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed mirror heartbeat: " + mirrorId, e);
        }
    }

    /**
     * ONLINE mirrors whose last heartbeat is older than {@code staleBeforeMs} become OFFLINE.
     * Returns the ids that changed.
     */
    public List<String> markStaleOffline(long staleBeforeMs, long nowMs) {
        String select = "SELECT mirror_id FROM mirrors WHERE status='ONLINE' AND last_heartbeat_ms<? ORDER BY mirror_id";
        String update = """
                UPDATE mirrors
                SET status='OFFLINE', updated_at_ms=?, status_changed_at_ms=?
                WHERE status='ONLINE' AND last_heartbeat_ms<?
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psSel = c.prepareStatement(select);
                 PreparedStatement psUp = c.prepareStatement(update)) {
                List<String> ids = new ArrayList<>();
                psSel.setLong(1, staleBeforeMs);
                try (ResultSet rs = psSel.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getString("mirror_id"));
                    }
                }
                if (!ids.isEmpty()) {
                    psUp.setLong(1, nowMs);
                    psUp.setLong(2, nowMs);
                    psUp.setLong(3, staleBeforeMs);
                    psUp.executeUpdate();
                }
                c.commit();
                return ids;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to sweep stale mirrors", e);
        }
    }

    public void markSynced(String mirrorId, long nowMs) {
        String sql = "UPDATE mirrors SET last_sync_at_ms=?, updated_at_ms=? WHERE mirror_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setLong(2, nowMs);
            ps.setString(3, mirrorId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record sync time: " + mirrorId, e);
        }
    }

    private static Mirror mapMirror(ResultSet rs) throws SQLException {
        return new Mirror(
                rs.getString("mirror_id"),
                rs.getString("name"),
                MirrorStatus.fromString(rs.getString("status")),
                rs.getString("credential"),
                MirrorAddress.direct(rs.getString("direct_url")),
                MirrorAddress.optionalTunnel(rs.getString("tunnel_url")),
                rs.getInt("capacity"),
                rs.getLong("last_heartbeat_ms"),
                rs.getLong("created_at_ms"),
                rs.getLong("last_sync_at_ms"),
                rs.getInt("reported_file_count"),
                rs.getLong("reported_bytes")
        );
    }

    private static PairingCode mapCode(ResultSet rs) throws SQLException {
        return new PairingCode(
                rs.getString("code"),
                rs.getLong("issued_at_ms"),
                rs.getLong("expires_at_ms"),
                rs.getInt("consumed") == 1,
                rs.getLong("consumed_at_ms"),
                rs.getString("mirror_id")
        );
    }

    public enum IssueStatus { ISSUED, LIMIT_REACHED, COLLISION }
    public enum RedeemStatus { REDEEMED, INVALID, EXPIRED, CONSUMED }
    public record IssueOutcome(IssueStatus status, PairingCode code, int outstanding) {}
    public record RedeemOutcome(RedeemStatus status, Mirror mirror) {}
    public record TransitionOutcome(boolean changed, MirrorStatus previous, MirrorStatus current) {}
    public record HeartbeatOutcome(boolean tracked, MirrorStatus previous, MirrorStatus current) {
        public boolean cameOnline() {
            return tracked && previous != MirrorStatus.ONLINE && current == MirrorStatus.ONLINE;
        }
    }
}
