package com.streamfirst.dbsync.ports;

import com.streamfirst.dbsync.domain.RecordKey;
import com.streamfirst.dbsync.domain.Row;
import com.streamfirst.dbsync.domain.StoreId;

import java.util.List;
import java.util.Optional;

/**
 * A single connection to a {@link RecordStore}. Not thread-safe; owned by one caller at a time.
 */
public interface StoreConnection extends AutoCloseable {

    StoreId storeId();

    boolean isReadOnly();

    boolean isOpen();

    /**
     * Looks up a live row. Tombstones are reported as absent.
     */
    Optional<Row> find(RecordKey key);

    /**
     * Lists the live rows of a collection, ordered by id.
     */
    List<Row> list(String collection);

    /**
     * Stores a row as given, replacing the row with the same key.
     *
     * @throws com.streamfirst.dbsync.domain.StoreException if the connection is read-only or the
     *     write fails
     */
    void put(Row row);

    @Override
    void close();
}
