package com.streamfirst.dbsync.application;

import com.streamfirst.dbsync.domain.ReplicaState;
import com.streamfirst.dbsync.domain.ReplicaUnavailableException;
import com.streamfirst.dbsync.domain.ReplicationReport;
import com.streamfirst.dbsync.domain.Row;
import com.streamfirst.dbsync.domain.StoreException;
import com.streamfirst.dbsync.domain.StoreId;
import com.streamfirst.dbsync.domain.Watermark;
import com.streamfirst.dbsync.ports.RecordStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the replicas in sync with the primary. Each cycle pushes to every replica on its own:
 * the changes after the replica's watermark are applied in one batch, and the watermark moves to
 * the newest change of that batch. A replica that fails keeps its watermark, so the same batch is
 * retried next cycle, while the others carry on. Cycles never overlap: a manual cycle waits for
 * the scheduled one in progress, so batches reach a replica in extraction order.
 */
@Slf4j
public final class ReplicationDaemon extends ScheduledDaemon {

    private final ChangeExtractor extractor;
    private final ReplicaSet replicas;
    private final Duration latencyWarning;
    private final ReentrantLock cycleLock = new ReentrantLock();

    public ReplicationDaemon(
            ChangeExtractor extractor,
            ReplicaSet replicas,
            Duration interval,
            Duration latencyWarning,
            Duration shutdownTimeout) {
        super("replication", interval, shutdownTimeout);
        this.extractor = extractor;
        this.replicas = replicas;
        this.latencyWarning = latencyWarning;
    }

    @Override
    protected Duration initialDelay() {
        return Duration.ZERO;
    }

    @Override
    protected void runCycle() {
        replicate();
    }

    /**
     * Runs one replication cycle over all replicas.
     *
     * @return rows applied per successful replica and the error of each failed one
     */
    public ReplicationReport replicate() {
        cycleLock.lock();
        try {
            return replicateAll();
        } finally {
            cycleLock.unlock();
        }
    }

    private ReplicationReport replicateAll() {
        Map<StoreId, Integer> applied = new LinkedHashMap<>();
        Map<StoreId, String> failures = new LinkedHashMap<>();
        // replicas at the same watermark share one extraction
        Map<Watermark, List<Row>> extracted = new HashMap<>();

        for (StoreId id : replicas.ids()) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Replication cycle abandoned before replica {}", id);
                break;
            }
            ReplicaState state = replicas.state(id);
            List<Row> batch;
            try {
                batch = extracted.computeIfAbsent(state.lastSync(), extractor::changesSince);
            } catch (StoreException e) {
                log.error("Failed to extract changes from the primary, skipping this cycle", e);
                break;
            }
            try {
                applied.put(id, push(id, state, batch));
            } catch (ReplicaUnavailableException e) {
                log.warn("Replication to {} failed, retrying next cycle: {}", id, e.getMessage());
                replicas.recordFailure(id, e.getMessage());
                failures.put(id, e.getMessage());
            }
        }

        ReplicationReport report = new ReplicationReport(applied, failures);
        if (report.totalApplied() > 0 || report.hasFailures()) {
            log.info(
                    "Replication cycle applied {} rows to {} replicas, {} failed",
                    report.totalApplied(),
                    applied.size(),
                    failures.size());
        }
        return report;
    }

    private int push(StoreId id, ReplicaState state, List<Row> batch) {
        RecordStore replica = replicas.store(id);
        long started = System.nanoTime();
        try {
            if (batch.isEmpty()) {
                // nothing to push, but confirm the replica still answers
                replica.highWatermark();
                replicas.recordSuccess(id, state.lastSync());
                return 0;
            }
            replica.apply(batch);
        } catch (RuntimeException e) {
            throw new ReplicaUnavailableException(id, String.valueOf(e.getMessage()), e);
        }
        Watermark reached = batch.get(batch.size() - 1).watermark();
        replicas.recordSuccess(id, reached);

        Duration took = Duration.ofNanos(System.nanoTime() - started);
        if (took.compareTo(latencyWarning) > 0) {
            log.warn("Replication to {} took {} ms", id, took.toMillis());
        }
        log.debug("Replicated {} rows to {}, watermark now {}", batch.size(), id, reached);
        return batch.size();
    }
}
