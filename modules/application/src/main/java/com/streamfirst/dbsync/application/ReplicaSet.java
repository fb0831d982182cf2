package com.streamfirst.dbsync.application;

import com.streamfirst.dbsync.domain.ReplicaState;
import com.streamfirst.dbsync.domain.StoreException;
import com.streamfirst.dbsync.domain.StoreId;
import com.streamfirst.dbsync.domain.Watermark;
import com.streamfirst.dbsync.ports.RecordStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The read replicas and their synchronization state. Watermarks only move forward; all state
 * changes go through one lock, and readers get immutable {@link ReplicaState} copies.
 */
@Slf4j
public final class ReplicaSet implements AutoCloseable {

    private final Map<StoreId, ReplicaDescriptor> descriptors = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    /**
     * Registers the replicas. Each starts at the newest change it already holds, so a restarted
     * coordinator resumes where it stopped, but never past the primary's newest commit: a replica
     * ahead of the primary (for example after the primary was restored from a backup) starts at
     * that commit and is brought up to date from there. An unreadable replica starts at {@link
     * Watermark#EPOCH} and unavailable.
     *
     * @param primaryCommit newest commit of the primary when the set is created
     */
    public ReplicaSet(List<RecordStore> stores, Watermark primaryCommit, Clock clock) {
        this.clock = clock;
        for (RecordStore store : stores) {
            ReplicaDescriptor descriptor = new ReplicaDescriptor(store);
            try {
                Watermark held = store.highWatermark();
                if (held.isAfter(primaryCommit)) {
                    log.warn(
                            "Replica {} holds changes up to {}, newer than the primary's {}; resuming from the primary's",
                            store.id(),
                            held,
                            primaryCommit);
                    held = primaryCommit;
                }
                descriptor.lastSync = held;
            } catch (StoreException e) {
                log.warn("Replica {} unreadable at startup, starting from scratch", store.id(), e);
                descriptor.available = false;
                descriptor.consecutiveFailures = 1;
                descriptor.lastError = e.getMessage();
            }
            if (descriptors.putIfAbsent(store.id(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate replica " + store.id());
            }
            log.info("Registered replica {} at watermark {}", store.id(), descriptor.lastSync);
        }
    }

    public int size() {
        return descriptors.size();
    }

    public boolean isEmpty() {
        return descriptors.isEmpty();
    }

    /** Replica ids in registration order. */
    public List<StoreId> ids() {
        return List.copyOf(descriptors.keySet());
    }

    public RecordStore store(StoreId id) {
        return descriptor(id).store;
    }

    public ReplicaState state(StoreId id) {
        lock.lock();
        try {
            return descriptor(id).toState();
        } finally {
            lock.unlock();
        }
    }

    /** States of all replicas in registration order. */
    public List<ReplicaState> snapshot() {
        lock.lock();
        try {
            List<ReplicaState> states = new ArrayList<>(descriptors.size());
            descriptors.values().forEach(d -> states.add(d.toState()));
            return states;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a successful push. The watermark never moves backwards.
     *
     * @param reached newest change the replica now holds
     */
    public void recordSuccess(StoreId id, Watermark reached) {
        lock.lock();
        try {
            ReplicaDescriptor d = descriptor(id);
            if (!d.available) {
                log.info("Replica {} is available again", id);
            }
            d.lastSync = d.lastSync.max(reached);
            d.available = true;
            d.consecutiveFailures = 0;
            d.lastError = null;
            d.lastSuccess = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    /** Records a failed push; the watermark is left where it was. */
    public void recordFailure(StoreId id, String error) {
        lock.lock();
        try {
            ReplicaDescriptor d = descriptor(id);
            d.available = false;
            d.consecutiveFailures++;
            d.lastError = error;
        } finally {
            lock.unlock();
        }
    }

    /** Closes every replica store, logging failures. */
    @Override
    public void close() {
        for (ReplicaDescriptor d : descriptors.values()) {
            try {
                d.store.close();
            } catch (StoreException e) {
                log.warn("Failed to close replica {}", d.store.id(), e);
            }
        }
    }

    private ReplicaDescriptor descriptor(StoreId id) {
        ReplicaDescriptor d = descriptors.get(id);
        if (d == null) {
            throw new IllegalArgumentException("Unknown replica " + id);
        }
        return d;
    }

    /** Mutable per-replica state; fields are guarded by the set's lock. */
    private static final class ReplicaDescriptor {
        private final RecordStore store;
        private Watermark lastSync = Watermark.EPOCH;
        private boolean available = true;
        private int consecutiveFailures;
        private String lastError;
        private Instant lastSuccess;

        private ReplicaDescriptor(RecordStore store) {
            this.store = store;
        }

        private ReplicaState toState() {
            return new ReplicaState(
                    store.id(),
                    lastSync,
                    available,
                    consecutiveFailures,
                    Optional.ofNullable(lastError),
                    Optional.ofNullable(lastSuccess));
        }
    }
}
