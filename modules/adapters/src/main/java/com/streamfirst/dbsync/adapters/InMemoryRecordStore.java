package com.streamfirst.dbsync.adapters;

import com.streamfirst.dbsync.domain.*;
import com.streamfirst.dbsync.ports.RecordStore;
import com.streamfirst.dbsync.ports.StoreConnection;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of RecordStore for testing and development.
 * Rows live in a sorted map; snapshots are written as a line-per-row text dump.
 * Data is lost when the application stops - not suitable for production use.
 *
 * <p>Outages can be simulated with {@link #simulateOutage(boolean)}: every operation then fails
 * with a {@link StoreException}, the way an unreachable store file would.
 */
@Slf4j
public class InMemoryRecordStore implements RecordStore {

    private final StoreId id;
    private final NavigableMap<RecordKey, Row> rows = new TreeMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean outage = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    public InMemoryRecordStore(StoreId id) {
        this.id = Objects.requireNonNull(id);
    }

    /**
     * Makes every subsequent operation fail until called again with {@code false}.
     */
    public void simulateOutage(boolean down) {
        log.info("Store {} outage simulation {}", id, down ? "on" : "off");
        outage.set(down);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public StoreId id() {
        return id;
    }

    @Override
    public StoreConnection openConnection(boolean readOnly) {
        checkReachable();
        return new InMemoryConnection(readOnly);
    }

    @Override
    public List<Row> changesSince(Watermark cutoff) {
        checkReachable();
        lock.readLock().lock();
        try {
            return rows.values().stream()
                .filter(row -> row.watermark().isAfter(cutoff))
                .sorted(Row.REPLICATION_ORDER)
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void apply(List<Row> batch) {
        checkReachable();
        lock.writeLock().lock();
        try {
            for (Row row : batch) {
                rows.put(row.key(), row);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Applied {} rows to store {}", batch.size(), id);
    }

    @Override
    public Watermark highWatermark() {
        checkReachable();
        lock.readLock().lock();
        try {
            return rows.values().stream()
                .map(Row::watermark)
                .max(Comparator.naturalOrder())
                .orElse(Watermark.EPOCH);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long rowCount() {
        checkReachable();
        lock.readLock().lock();
        try {
            return rows.values().stream().filter(row -> !row.deleted()).count();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void snapshotTo(Path target) {
        checkReachable();
        List<Row> copy;
        lock.readLock().lock();
        try {
            copy = List.copyOf(rows.values());
        } finally {
            lock.readLock().unlock();
        }
        try (BufferedWriter out = Files.newBufferedWriter(
                target, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW)) {
            out.write("# " + id + " " + copy.size());
            out.newLine();
            Base64.Encoder base64 = Base64.getEncoder();
            for (Row row : copy) {
                out.write(String.join("\t",
                    row.key().collection(),
                    row.key().id(),
                    Long.toString(row.modifiedAt().toEpochMilli()),
                    row.deleted() ? "D" : "L",
                    row.deleted() ? "" : base64.encodeToString(row.payload().getBytes(StandardCharsets.UTF_8))));
                out.newLine();
            }
        } catch (IOException e) {
            throw new StoreException("Failed to snapshot store " + id + " to " + target, e);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Closed in-memory store {}", id);
        }
    }

    private void checkReachable() {
        if (closed.get()) {
            throw new StoreException("Store " + id + " is closed");
        }
        if (outage.get()) {
            throw new StoreException("Store " + id + " is unavailable");
        }
    }

    private final class InMemoryConnection implements StoreConnection {

        private final boolean readOnly;
        private boolean open = true;

        private InMemoryConnection(boolean readOnly) {
            this.readOnly = readOnly;
        }

        @Override
        public StoreId storeId() {
            return id;
        }

        @Override
        public boolean isReadOnly() {
            return readOnly;
        }

        @Override
        public boolean isOpen() {
            return open && !closed.get();
        }

        @Override
        public Optional<Row> find(RecordKey key) {
            checkOpen();
            lock.readLock().lock();
            try {
                return Optional.ofNullable(rows.get(key)).filter(row -> !row.deleted());
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public List<Row> list(String collection) {
            checkOpen();
            lock.readLock().lock();
            try {
                return rows.values().stream()
                    .filter(row -> row.key().collection().equals(collection) && !row.deleted())
                    .toList();
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public void put(Row row) {
            checkOpen();
            if (readOnly) {
                throw new StoreException("Connection to " + id + " is read-only");
            }
            lock.writeLock().lock();
            try {
                rows.put(row.key(), row);
            } finally {
                lock.writeLock().unlock();
            }
        }

        @Override
        public void close() {
            open = false;
        }

        private void checkOpen() {
            if (!open) {
                throw new StoreException("Connection to " + id + " is closed");
            }
            checkReachable();
        }
    }
}
