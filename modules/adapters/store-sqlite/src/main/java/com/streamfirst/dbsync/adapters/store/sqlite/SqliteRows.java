package com.streamfirst.dbsync.adapters.store.sqlite;

import com.streamfirst.dbsync.domain.RecordKey;
import com.streamfirst.dbsync.domain.Row;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;

/**
 * Table layout and row mapping shared by the store and its connections. Every row of every
 * collection lives in one {@code records} table keyed by (collection, id).
 */
final class SqliteRows {

    static final String[] SCHEMA = {
        "CREATE TABLE IF NOT EXISTS records ("
            + "collection TEXT NOT NULL, "
            + "id TEXT NOT NULL, "
            + "modified_at INTEGER NOT NULL, "
            + "payload TEXT, "
            + "deleted INTEGER NOT NULL DEFAULT 0, "
            + "PRIMARY KEY (collection, id))",
        "CREATE INDEX IF NOT EXISTS idx_records_modified_at ON records(modified_at, collection, id)"
    };

    static final String COLUMNS = "collection, id, modified_at, payload, deleted";

    static final String UPSERT =
        "INSERT INTO records(" + COLUMNS + ") VALUES(?,?,?,?,?) "
            + "ON CONFLICT(collection, id) DO UPDATE SET "
            + "modified_at = excluded.modified_at, payload = excluded.payload, deleted = excluded.deleted";

    static final String CHANGES_SINCE =
        "SELECT " + COLUMNS + " FROM records WHERE modified_at > ? ORDER BY modified_at, collection, id";

    static final String FIND =
        "SELECT " + COLUMNS + " FROM records WHERE collection = ? AND id = ? AND deleted = 0";

    static final String LIST =
        "SELECT " + COLUMNS + " FROM records WHERE collection = ? AND deleted = 0 ORDER BY id";

    static final String HIGH_WATERMARK = "SELECT MAX(modified_at) FROM records";

    static final String ROW_COUNT = "SELECT COUNT(*) FROM records WHERE deleted = 0";

    private SqliteRows() {
    }

    static Row read(ResultSet rs) throws SQLException {
        RecordKey key = new RecordKey(rs.getString(1), rs.getString(2));
        Instant modifiedAt = Instant.ofEpochMilli(rs.getLong(3));
        if (rs.getInt(5) != 0) {
            return Row.tombstone(key, modifiedAt);
        }
        return Row.of(key, modifiedAt, rs.getString(4));
    }

    static void bindUpsert(PreparedStatement ps, Row row) throws SQLException {
        ps.setString(1, row.key().collection());
        ps.setString(2, row.key().id());
        ps.setLong(3, row.modifiedAt().toEpochMilli());
        if (row.deleted()) {
            ps.setNull(4, Types.VARCHAR);
        } else {
            ps.setString(4, row.payload());
        }
        ps.setInt(5, row.deleted() ? 1 : 0);
    }
}
