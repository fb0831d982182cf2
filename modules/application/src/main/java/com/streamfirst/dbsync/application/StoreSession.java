package com.streamfirst.dbsync.application;

import com.streamfirst.dbsync.domain.RecordKey;
import com.streamfirst.dbsync.domain.Row;
import com.streamfirst.dbsync.domain.RowMutation;
import com.streamfirst.dbsync.domain.StoreException;
import com.streamfirst.dbsync.domain.StoreId;
import com.streamfirst.dbsync.ports.StoreConnection;

import java.util.List;
import java.util.Optional;

/**
 * Connection handed to request handlers by {@link ReplicationCoordinator#getConnection(boolean)}.
 * Writes are only possible on a writable primary session; they pass the write-rate limiter and
 * are stamped by the primary store. Closing the session gives the connection back.
 */
public final class StoreSession implements AutoCloseable {

    private final StoreConnection connection;
    private final boolean readOnly;
    private final PrimaryStore primary;
    private final WriteRateLimiter limiter;
    private final Runnable onClose;
    private boolean closed;

    private StoreSession(
            StoreConnection connection,
            boolean readOnly,
            PrimaryStore primary,
            WriteRateLimiter limiter,
            Runnable onClose) {
        this.connection = connection;
        this.readOnly = readOnly;
        this.primary = primary;
        this.limiter = limiter;
        this.onClose = onClose;
    }

    static StoreSession onPrimary(
            StoreConnection connection,
            boolean readOnly,
            PrimaryStore primary,
            WriteRateLimiter limiter,
            Runnable release) {
        return new StoreSession(connection, readOnly, primary, limiter, release);
    }

    static StoreSession onReplica(StoreConnection connection) {
        return new StoreSession(connection, true, null, null, connection::close);
    }

    public StoreId storeId() {
        return connection.storeId();
    }

    public boolean isPrimary() {
        return primary != null;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public Optional<Row> find(RecordKey key) {
        checkOpen();
        return connection.find(key);
    }

    public List<Row> list(String collection) {
        checkOpen();
        return connection.list(collection);
    }

    public Row upsert(RecordKey key, String payload) {
        return write(RowMutation.upsert(key, payload));
    }

    public Row delete(RecordKey key) {
        return write(RowMutation.delete(key));
    }

    /**
     * Admits and commits one mutation on the primary.
     *
     * @return the committed row
     * @throws StoreException if the session is read-only or the write fails
     */
    public Row write(RowMutation mutation) {
        checkOpen();
        if (readOnly) {
            throw new StoreException("Session on " + storeId() + " is read-only");
        }
        limiter.admitWrite();
        return primary.write(connection, mutation);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            onClose.run();
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new StoreException("Session on " + storeId() + " is closed");
        }
    }
}
