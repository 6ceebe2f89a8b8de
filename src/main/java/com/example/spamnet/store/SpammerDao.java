package com.example.spamnet.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The spammer table. At most one record per identifier; conflicting reports are
 * resolved last-write-wins on the report timestamp.
 *
 * <p>Every operation runs while holding the {@link Db} monitor, so an upsert's
 * read-compare-write is atomic and readers never see a partial row.
 */
public class SpammerDao {

    private static final Logger LOG = LoggerFactory.getLogger(SpammerDao.class);

    public static class SpammerRecord {
        public String identifier;
        public String note;
        public long timestamp;
        public String originId;
        public long updatedAt;

        public static SpammerRecord of(String identifier, String note, long timestamp, String originId) {
            SpammerRecord r = new SpammerRecord();
            r.identifier = identifier;
            r.note = note == null ? "" : note;
            r.timestamp = timestamp;
            r.originId = originId;
            return r;
        }

        @Override
        public String toString() {
            return String.format("%s [ts=%d, origin=%s] %s", identifier, timestamp, originId, note);
        }
    }

    private final Db db;

    public SpammerDao(Db db) {
        this.db = db;
    }

    /**
     * Whether {@code incoming} should replace {@code current}: a newer timestamp
     * wins; on equal timestamps the greater (origin id, note) pair wins so every
     * node settles on the same record whatever the arrival order.
     */
    public static boolean supersedes(SpammerRecord incoming, SpammerRecord current) {
        if (current == null) return true;
        if (incoming.timestamp != current.timestamp) {
            return incoming.timestamp > current.timestamp;
        }
        int byOrigin = nullToEmpty(incoming.originId).compareTo(nullToEmpty(current.originId));
        if (byOrigin != 0) {
            return byOrigin > 0;
        }
        return nullToEmpty(incoming.note).compareTo(nullToEmpty(current.note)) > 0;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public SpammerRecord get(String identifier) throws SQLException {
        synchronized (db) {
            return find(db.getConnection(), identifier);
        }
    }

    /**
     * Stores {@code record} unless the stored one for the same identifier wins.
     * Returns after the write is committed.
     *
     * @return true if the store changed
     */
    public boolean upsert(SpammerRecord record) throws StoreWriteException {
        if (record == null || record.identifier == null || record.identifier.isBlank()) {
            throw new IllegalArgumentException("Missing identifier");
        }
        if (record.originId == null || record.originId.isBlank()) {
            throw new IllegalArgumentException("Missing origin id");
        }
        synchronized (db) {
            Connection conn = null;
            try {
                conn = db.getConnection();
                conn.setAutoCommit(false);
                SpammerRecord current = find(conn, record.identifier);
                if (!supersedes(record, current)) {
                    conn.rollback();
                    return false;
                }
                long now = System.currentTimeMillis();
                String sql = "INSERT INTO spammers (identifier, note, reported_at, origin_id, updated_at) VALUES (?, ?, ?, ?, ?) " +
                        "ON CONFLICT(identifier) DO UPDATE SET " +
                        "note = excluded.note, " +
                        "reported_at = excluded.reported_at, " +
                        "origin_id = excluded.origin_id, " +
                        "updated_at = excluded.updated_at";
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, record.identifier);
                    ps.setString(2, nullToEmpty(record.note));
                    ps.setLong(3, record.timestamp);
                    ps.setString(4, record.originId);
                    ps.setLong(5, now);
                    ps.executeUpdate();
                }
                conn.commit();
                record.updatedAt = now;
                return true;
            } catch (SQLException e) {
                rollbackQuietly(conn);
                throw new StoreWriteException("Upsert failed for " + record.identifier, e);
            } finally {
                restoreAutoCommit(conn);
            }
        }
    }

    public List<SpammerRecord> all() throws SQLException {
        synchronized (db) {
            Connection conn = db.getConnection();
            List<SpammerRecord> list = new ArrayList<>();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT * FROM spammers ORDER BY identifier")) {
                while (rs.next()) {
                    list.add(mapRow(rs));
                }
            }
            return list;
        }
    }

    /** Manual purge; nothing in the gossip path deletes records. */
    public boolean delete(String identifier) throws StoreWriteException {
        synchronized (db) {
            try (PreparedStatement ps = db.getConnection().prepareStatement("DELETE FROM spammers WHERE identifier = ?")) {
                ps.setString(1, identifier);
                return ps.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new StoreWriteException("Delete failed for " + identifier, e);
            }
        }
    }

    public int count() throws SQLException {
        synchronized (db) {
            try (Statement stmt = db.getConnection().createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM spammers")) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private SpammerRecord find(Connection conn, String identifier) throws SQLException {
        String sql = "SELECT * FROM spammers WHERE identifier = ? LIMIT 1";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, identifier);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return mapRow(rs);
                }
            }
        }
        return null;
    }

    private void rollbackQuietly(Connection conn) {
        if (conn == null) return;
        try {
            conn.rollback();
        } catch (SQLException e) {
            LOG.warn("Rollback failed", e);
        }
    }

    private void restoreAutoCommit(Connection conn) {
        if (conn == null) return;
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            LOG.warn("Restoring auto-commit failed", e);
        }
    }

    private SpammerRecord mapRow(ResultSet rs) throws SQLException {
        SpammerRecord r = new SpammerRecord();
        r.identifier = rs.getString("identifier");
        r.note = rs.getString("note");
        r.timestamp = rs.getLong("reported_at");
        r.originId = rs.getString("origin_id");
        r.updatedAt = rs.getLong("updated_at");
        return r;
    }
}
