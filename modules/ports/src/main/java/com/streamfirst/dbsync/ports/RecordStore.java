package com.streamfirst.dbsync.ports;

import com.streamfirst.dbsync.domain.*;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for one embedded store instance: the primary or a replica.
 * Abstracts the storage engine (SQLite files, in-memory maps) behind a uniform, schema-agnostic
 * row interface. Implementations must be safe for concurrent use.
 */
public interface RecordStore extends AutoCloseable {

    /**
     * @return the name this store was opened under
     */
    StoreId id();

    /**
     * Opens a new connection to this store. The caller owns the connection and must close it.
     *
     * @param readOnly whether writes through the connection are refused
     * @return an open connection
     * @throws StoreException if the store cannot be reached
     */
    StoreConnection openConnection(boolean readOnly);

    /**
     * Returns every row, tombstones included, modified strictly after the cutoff.
     *
     * @param cutoff exclusive lower bound on {@code modifiedAt}
     * @return rows ordered by {@code modifiedAt}, then by key
     * @throws StoreException if the store cannot be read
     */
    List<Row> changesSince(Watermark cutoff);

    /**
     * Applies a batch of rows atomically, replacing any existing row with the same key.
     * Rows are stored as given: modification times are not compared and tombstones are kept.
     *
     * @param rows rows in the order they must be applied
     * @throws StoreException if the batch could not be applied; nothing is applied then
     */
    void apply(List<Row> rows);

    /**
     * @return the newest {@code modifiedAt} in the store, or {@link Watermark#EPOCH} when empty
     */
    Watermark highWatermark();

    /**
     * @return number of live (non-deleted) rows
     */
    long rowCount();

    /**
     * Writes a consistent full copy of the store to a new file.
     *
     * @param target file to create; must not exist
     * @throws StoreException if the copy could not be written
     */
    void snapshotTo(Path target);

    /**
     * Releases every resource held by the store. Further calls fail.
     */
    @Override
    void close();
}
