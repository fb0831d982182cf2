package com.streamfirst.dbsync.application;

import com.streamfirst.dbsync.domain.Row;
import com.streamfirst.dbsync.domain.RowMutation;
import com.streamfirst.dbsync.domain.Watermark;
import com.streamfirst.dbsync.ports.RecordStore;
import com.streamfirst.dbsync.ports.StoreConnection;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single writable store. Stamps every write with its commit time and keeps track of the
 * newest one.
 *
 * <p>Stamping and committing happen under one lock, so rows become visible in stamp order. A
 * replica that has seen everything up to a stamp can therefore never miss a row committed later
 * with a smaller stamp.
 */
@Slf4j
public final class PrimaryStore {

    private final RecordStore store;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Instant lastCommit;

    public PrimaryStore(RecordStore store, Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.clock = Objects.requireNonNull(clock);
        this.lastCommit = store.highWatermark().at();
        log.info("Primary store {} opened at watermark {}", store.id(), lastCommit);
    }

    public RecordStore store() {
        return store;
    }

    /** Newest commit time, {@link Watermark#EPOCH} before the first write. */
    public Watermark lastCommit() {
        return Watermark.of(lastCommit);
    }

    /**
     * Commits a mutation through the given connection.
     *
     * <p>Without an explicit time the row is stamped with the clock, moved forward by a millisecond
     * if needed so that stamps strictly increase. An explicit time must be later than every
     * previous commit.
     *
     * @return the row as committed
     * @throws IllegalArgumentException if an explicit time is not after the last commit
     * @throws com.streamfirst.dbsync.domain.StoreException if the store rejects the write
     */
    public Row write(StoreConnection connection, RowMutation mutation) {
        writeLock.lock();
        try {
            Instant at = stamp(mutation);
            Row row = mutation.toRow(at);
            connection.put(row);
            lastCommit = row.modifiedAt();
            log.debug("Committed {} on {}", row, store.id());
            return row;
        } finally {
            writeLock.unlock();
        }
    }

    private Instant stamp(RowMutation mutation) {
        Instant previous = lastCommit;
        if (mutation.modifiedAt().isPresent()) {
            Instant explicit = Instant.ofEpochMilli(mutation.modifiedAt().get().toEpochMilli());
            if (!explicit.isAfter(previous)) {
                throw new IllegalArgumentException(
                        "Commit time " + explicit + " of " + mutation.key() + " is not after last commit " + previous);
            }
            return explicit;
        }
        Instant now = Instant.ofEpochMilli(clock.millis());
        return now.isAfter(previous) ? now : previous.plusMillis(1);
    }
}
