package com.streamfirst.dbsync.application;

import com.streamfirst.dbsync.domain.*;
import com.streamfirst.dbsync.ports.BackupStoragePort;
import com.streamfirst.dbsync.ports.RecordStore;
import com.streamfirst.dbsync.ports.StoreConnection;
import com.streamfirst.dbsync.ports.StoreFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for request handlers: hands out connections (reads to the freshest replica, writes
 * to the pooled primary), gates writes through the rate limiter, triggers backups and reports
 * health. One instance is built at startup and passed to whoever needs it.
 *
 * <p>{@link #start()} launches the replication and backup daemons; {@link #close()} stops them,
 * fails waiting connection requests and closes every store.
 */
@Slf4j
public final class ReplicationCoordinator implements AutoCloseable {

    private final CoordinatorSettings settings;
    private final PrimaryStore primary;
    private final ConnectionPool<StoreConnection> pool;
    private final ReplicaSet replicas;
    private final ReplicationDaemon replicationDaemon;
    private final BackupDaemon backupDaemon;
    private final WriteRateLimiter limiter;
    private final ReadRouter router;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean();

    private ReplicationCoordinator(
            CoordinatorSettings settings,
            PrimaryStore primary,
            ConnectionPool<StoreConnection> pool,
            ReplicaSet replicas,
            BackupStoragePort backups,
            Clock clock) {
        this.settings = settings;
        this.primary = primary;
        this.pool = pool;
        this.replicas = replicas;
        this.clock = clock;
        this.limiter =
                new WriteRateLimiter(settings.getMaxWriteRate(), settings.getThrottleBackoff(), clock);
        this.router = new ReadRouter(replicas, primary::lastCommit, settings.getMaxReplicaLag());
        this.replicationDaemon =
                new ReplicationDaemon(
                        new ChangeExtractor(primary.store()),
                        replicas,
                        settings.getReplicationInterval(),
                        settings.getReplicaLatencyWarning(),
                        settings.getShutdownTimeout());
        this.backupDaemon =
                new BackupDaemon(
                        primary.store(),
                        backups,
                        clock,
                        settings.getBackupInterval(),
                        settings.retention(),
                        settings.getShutdownTimeout());
    }

    /**
     * Opens the primary and replica stores described by the settings and wires the coordinator.
     * The daemons are not started.
     *
     * @throws IllegalArgumentException if the settings are invalid
     * @throws StoreException if a store cannot be opened; stores opened so far are closed
     */
    public static ReplicationCoordinator open(
            CoordinatorSettings settings, StoreFactory factory, BackupStoragePort backups, Clock clock) {
        settings.validate();
        List<RecordStore> opened = new ArrayList<>();
        try {
            RecordStore primaryStore =
                    factory.open(StoreId.PRIMARY, settings.primaryFile(), StoreFactory.Role.PRIMARY);
            opened.add(primaryStore);
            List<RecordStore> replicaStores = new ArrayList<>();
            for (StoreId id : settings.getReplicaIds()) {
                RecordStore replica = factory.open(id, settings.replicaFile(id), StoreFactory.Role.REPLICA);
                opened.add(replica);
                replicaStores.add(replica);
            }
            ConnectionPool<StoreConnection> pool =
                    new ConnectionPool<>(
                            StoreId.PRIMARY.value(),
                            settings.getPoolSize(),
                            () -> primaryStore.openConnection(false));
            PrimaryStore primary = new PrimaryStore(primaryStore, clock);
            ReplicationCoordinator coordinator =
                    new ReplicationCoordinator(
                            settings,
                            primary,
                            pool,
                            new ReplicaSet(replicaStores, primary.lastCommit(), clock),
                            backups,
                            clock);
            log.info(
                    "Coordinator opened in {} with {} replicas", settings.getDataDirectory(), replicaStores.size());
            return coordinator;
        } catch (RuntimeException e) {
            opened.forEach(ReplicationCoordinator::closeQuietly);
            throw e;
        }
    }

    public static ReplicationCoordinator open(
            CoordinatorSettings settings, StoreFactory factory, BackupStoragePort backups) {
        return open(settings, factory, backups, Clock.systemUTC());
    }

    /** Starts the replication and backup daemons. */
    public void start() {
        checkOpen();
        replicationDaemon.start();
        backupDaemon.start();
    }

    /**
     * Returns a session for reading or writing.
     *
     * <p>A read-only request goes to the freshest available replica, or to a pooled primary
     * connection when no replica qualifies or the chosen one cannot be opened. A write request
     * always leases a primary connection, blocking while the pool is exhausted, or failing after
     * the configured acquire timeout.
     *
     * @throws PoolExhaustedException if no primary connection became free in time
     * @throws PoolClosedException if the coordinator is closed or closes while waiting
     */
    public StoreSession getConnection(boolean readOnly) {
        checkOpen();
        if (readOnly) {
            ReadRouter.Route route = router.route();
            if (route.target() == ReadRouter.Target.REPLICA) {
                StoreId replicaId = route.replica().orElseThrow();
                try {
                    return StoreSession.onReplica(replicas.store(replicaId).openConnection(true));
                } catch (StoreException e) {
                    log.warn("Replica {} could not be opened for reading, using the primary", replicaId, e);
                }
            }
        }
        return leasePrimary(readOnly);
    }

    /**
     * Counts one committed write against the rate limit, delaying the caller when the limit is
     * exceeded. Writes made through a {@link StoreSession} are counted already.
     *
     * @return whether the caller was delayed
     */
    public boolean recordWrite() {
        return limiter.admitWrite();
    }

    /**
     * Commits one mutation on the primary.
     *
     * @return the committed row
     */
    public Row write(RowMutation mutation) {
        try (StoreSession session = getConnection(false)) {
            return session.write(mutation);
        }
    }

    /**
     * Takes a backup now, independent of the backup schedule.
     *
     * @return the new backup, or a {@link ErrorKind#BACKUP_FAILED} failure
     */
    public Result<BackupArtifact> triggerBackup() {
        checkOpen();
        try {
            return Result.success(backupDaemon.createBackup());
        } catch (BackupFailedException e) {
            log.error("Manual backup failed", e);
            return Result.failure(e);
        }
    }

    /** Runs one replication cycle on the calling thread. */
    public ReplicationReport runReplicationCycle() {
        checkOpen();
        return replicationDaemon.replicate();
    }

    /**
     * Runs one scheduled backup cycle on the calling thread: a snapshot, then the retention sweep.
     * Failures are logged and counted like those of the daemon.
     */
    public void runBackupCycle() {
        checkOpen();
        backupDaemon.runCycle();
    }

    /** Runs the retention sweep alone, against the coordinator clock. */
    public RetentionReport runRetentionSweep() {
        checkOpen();
        return backupDaemon.sweep(clock.instant());
    }

    public HealthSnapshot healthSnapshot() {
        List<ReplicaState> states = replicas.snapshot();
        HealthSnapshot.HealthSnapshotBuilder health =
                HealthSnapshot.builder()
                        .replicaCount(states.size())
                        .availableReplicas((int) states.stream().filter(ReplicaState::available).count())
                        .primaryWatermark(primary.lastCommit())
                        .currentWriteRate(limiter.currentRate())
                        .throttledWrites(limiter.throttledCount())
                        .backupFailures(backupDaemon.getFailures());
        states.forEach(state -> health.replicaWatermark(state.id(), state.lastSync()));
        try {
            health.backupCount(backupDaemon.listBackups().size());
            backupDaemon.lastBackup().ifPresent(last -> health.lastBackupTime(last.createdAt()));
        } catch (UncheckedIOException e) {
            log.warn("Could not list backups for the health snapshot", e);
        }
        return health.build();
    }

    public List<ReplicaState> replicaStates() {
        return replicas.snapshot();
    }

    public Optional<ReplicaState> replicaState(StoreId id) {
        return replicas.ids().contains(id) ? Optional.of(replicas.state(id)) : Optional.empty();
    }

    public ReadRouter.Route routeRead() {
        return router.route();
    }

    public CoordinatorSettings getSettings() {
        return settings;
    }

    public boolean isRunning() {
        return replicationDaemon.isRunning() && backupDaemon.isRunning();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops both daemons, closes the pool and every store. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down coordinator");
        replicationDaemon.stop();
        backupDaemon.stop();
        pool.close();
        replicas.close();
        closeQuietly(primary.store());
        log.info("Coordinator shut down");
    }

    private StoreSession leasePrimary(boolean readOnly) {
        StoreConnection connection;
        try {
            Optional<Duration> timeout = settings.getAcquireTimeout();
            connection = timeout.isPresent() ? pool.acquire(timeout.get()) : pool.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoolExhaustedException("Interrupted while waiting for a primary connection", e);
        }
        return StoreSession.onPrimary(
                connection, readOnly, primary, limiter, () -> pool.release(connection));
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new PoolClosedException("Coordinator is closed");
        }
    }

    private static void closeQuietly(RecordStore store) {
        try {
            store.close();
        } catch (StoreException e) {
            log.warn("Failed to close store {}", store.id(), e);
        }
    }
}
