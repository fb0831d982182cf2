package com.streamfirst.dbsync.adapters.store.sqlite;

import com.streamfirst.dbsync.domain.RecordKey;
import com.streamfirst.dbsync.domain.Row;
import com.streamfirst.dbsync.domain.StoreException;
import com.streamfirst.dbsync.domain.StoreId;
import com.streamfirst.dbsync.ports.StoreConnection;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One JDBC connection to a SQLite store.
 */
@Slf4j
class SqliteStoreConnection implements StoreConnection {

    private final StoreId storeId;
    private final Connection connection;
    private final boolean readOnly;

    SqliteStoreConnection(StoreId storeId, Connection connection, boolean readOnly) {
        this.storeId = storeId;
        this.connection = connection;
        this.readOnly = readOnly;
    }

    @Override
    public StoreId storeId() {
        return storeId;
    }

    @Override
    public boolean isReadOnly() {
        return readOnly;
    }

    @Override
    public boolean isOpen() {
        try {
            return !connection.isClosed();
        } catch (SQLException e) {
            return false;
        }
    }

    @Override
    public Optional<Row> find(RecordKey key) {
        try (PreparedStatement ps = connection.prepareStatement(SqliteRows.FIND)) {
            ps.setString(1, key.collection());
            ps.setString(2, key.id());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(SqliteRows.read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read " + key + " from " + storeId, e);
        }
    }

    @Override
    public List<Row> list(String collection) {
        try (PreparedStatement ps = connection.prepareStatement(SqliteRows.LIST)) {
            ps.setString(1, collection);
            List<Row> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(SqliteRows.read(rs));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw new StoreException("Failed to list " + collection + " from " + storeId, e);
        }
    }

    @Override
    public void put(Row row) {
        if (readOnly) {
            throw new StoreException("Connection to " + storeId + " is read-only");
        }
        try (PreparedStatement ps = connection.prepareStatement(SqliteRows.UPSERT)) {
            SqliteRows.bindUpsert(ps, row);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to write " + row.key() + " to " + storeId, e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection to {}", storeId, e);
        }
    }
}
