package com.streamfirst.dbsync.adapters.store.sqlite;

import com.streamfirst.dbsync.domain.StoreId;
import com.streamfirst.dbsync.ports.RecordStore;
import com.streamfirst.dbsync.ports.StoreFactory;

import java.nio.file.Path;

/**
 * Opens SQLite-backed stores.
 */
public class SqliteStoreFactory implements StoreFactory {

    public static final int DEFAULT_BUSY_TIMEOUT_MILLIS = 5_000;

    private final int busyTimeoutMillis;

    public SqliteStoreFactory() {
        this(DEFAULT_BUSY_TIMEOUT_MILLIS);
    }

    public SqliteStoreFactory(int busyTimeoutMillis) {
        if (busyTimeoutMillis < 0) {
            throw new IllegalArgumentException("Busy timeout cannot be negative: " + busyTimeoutMillis);
        }
        this.busyTimeoutMillis = busyTimeoutMillis;
    }

    @Override
    public RecordStore open(StoreId id, Path file, Role role) {
        return new SqliteRecordStore(id, file, role, busyTimeoutMillis);
    }
}
