package com.streamfirst.dbsync.adapters.store.sqlite;

import com.streamfirst.dbsync.domain.*;
import com.streamfirst.dbsync.ports.RecordStore;
import com.streamfirst.dbsync.ports.StoreConnection;
import com.streamfirst.dbsync.ports.StoreFactory;
import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * RecordStore backed by a SQLite database file in WAL mode. Replication and snapshot work runs
 * on one control connection owned by the store; callers get their own connections from
 * {@link #openConnection(boolean)}.
 */
@Slf4j
public class SqliteRecordStore implements RecordStore {

    private final StoreId id;
    private final Path file;
    private final StoreFactory.Role role;
    private final int busyTimeoutMillis;
    private final String url;
    private final Connection control;
    private volatile boolean closed;

    public SqliteRecordStore(StoreId id, Path file, StoreFactory.Role role, int busyTimeoutMillis) {
        this.id = Objects.requireNonNull(id);
        this.file = file.toAbsolutePath();
        this.role = Objects.requireNonNull(role);
        this.busyTimeoutMillis = busyTimeoutMillis;
        this.url = "jdbc:sqlite:" + this.file;
        try {
            Files.createDirectories(this.file.getParent());
            this.control = connect(false);
            try (Statement st = control.createStatement()) {
                for (String ddl : SqliteRows.SCHEMA) {
                    st.execute(ddl);
                }
            }
        } catch (IOException | SQLException e) {
            throw new StoreException("Failed to open " + role + " store " + id + " at " + this.file, e);
        }
        log.info("Opened {} store {} at {}", role, id, this.file);
    }

    public Path getFile() {
        return file;
    }

    @Override
    public StoreId id() {
        return id;
    }

    @Override
    public StoreConnection openConnection(boolean readOnly) {
        checkOpen();
        try {
            return new SqliteStoreConnection(id, connect(readOnly), readOnly);
        } catch (SQLException e) {
            throw new StoreException("Failed to connect to store " + id, e);
        }
    }

    @Override
    public synchronized List<Row> changesSince(Watermark cutoff) {
        checkOpen();
        try (PreparedStatement ps = control.prepareStatement(SqliteRows.CHANGES_SINCE)) {
            ps.setLong(1, cutoff.toEpochMilli());
            List<Row> changes = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    changes.add(SqliteRows.read(rs));
                }
            }
            return changes;
        } catch (SQLException e) {
            throw new StoreException("Failed to read changes since " + cutoff + " from " + id, e);
        }
    }

    @Override
    public synchronized void apply(List<Row> rows) {
        checkOpen();
        if (rows.isEmpty()) {
            return;
        }
        try {
            control.setAutoCommit(false);
            try (PreparedStatement ps = control.prepareStatement(SqliteRows.UPSERT)) {
                for (Row row : rows) {
                    SqliteRows.bindUpsert(ps, row);
                    ps.addBatch();
                }
                ps.executeBatch();
                control.commit();
            } catch (SQLException e) {
                control.rollback();
                throw e;
            } finally {
                control.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to apply " + rows.size() + " rows to " + id, e);
        }
        log.debug("Applied {} rows to store {}", rows.size(), id);
    }

    @Override
    public synchronized Watermark highWatermark() {
        checkOpen();
        try (Statement st = control.createStatement();
             ResultSet rs = st.executeQuery(SqliteRows.HIGH_WATERMARK)) {
            if (rs.next()) {
                long max = rs.getLong(1);
                return rs.wasNull() ? Watermark.EPOCH : Watermark.ofEpochMilli(max);
            }
            return Watermark.EPOCH;
        } catch (SQLException e) {
            throw new StoreException("Failed to read high watermark of " + id, e);
        }
    }

    @Override
    public synchronized long rowCount() {
        checkOpen();
        try (Statement st = control.createStatement();
             ResultSet rs = st.executeQuery(SqliteRows.ROW_COUNT)) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new StoreException("Failed to count rows of " + id, e);
        }
    }

    @Override
    public synchronized void snapshotTo(Path target) {
        checkOpen();
        if (Files.exists(target)) {
            throw new StoreException("Snapshot target already exists: " + target);
        }
        String literal = target.toAbsolutePath().toString().replace("'", "''");
        try (Statement st = control.createStatement()) {
            st.execute("VACUUM INTO '" + literal + "'");
        } catch (SQLException e) {
            throw new StoreException("Failed to snapshot " + id + " to " + target, e);
        }
        log.debug("Snapshot of {} written to {}", id, target);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            control.close();
            log.info("Closed store {}", id);
        } catch (SQLException e) {
            throw new StoreException("Failed to close store " + id, e);
        }
    }

    private Connection connect(boolean readOnly) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(busyTimeoutMillis);
        if (readOnly) {
            config.setReadOnly(true);
        } else {
            config.setJournalMode(SQLiteConfig.JournalMode.WAL);
            // replicas can always be rebuilt from the primary
            config.setSynchronous(role == StoreFactory.Role.PRIMARY
                ? SQLiteConfig.SynchronousMode.NORMAL
                : SQLiteConfig.SynchronousMode.OFF);
        }
        return DriverManager.getConnection(url, config.toProperties());
    }

    private void checkOpen() {
        if (closed) {
            throw new StoreException("Store " + id + " is closed");
        }
    }
}
