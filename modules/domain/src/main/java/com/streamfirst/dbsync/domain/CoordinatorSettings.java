package com.streamfirst.dbsync.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Static configuration of a coordinator: file layout, replica set, pool size, daemon intervals
 * and write-rate limits. Values are validated once, when the coordinator is opened.
 */
@Value
@Builder(toBuilder = true)
public class CoordinatorSettings {

    /** Directory holding the primary file, the replica directories and the backups */
    @NonNull Path dataDirectory;

    /** Base name of every store file and backup file */
    @NonNull @Builder.Default String databaseName = "proposal_system";

    /** Replica names; each gets its own directory under {@code replicas/} */
    @NonNull @Builder.Default List<StoreId> replicaIds =
        List.of(StoreId.of("replica1"), StoreId.of("replica2"), StoreId.of("replica3"));

    /** Number of pooled primary connections */
    @Builder.Default int poolSize = 20;

    /** Longest wait for a pooled connection; null blocks until one is released */
    Duration acquireTimeout;

    @NonNull @Builder.Default Duration replicationInterval = Duration.ofSeconds(5);

    /** A push to one replica slower than this is logged as a warning */
    @NonNull @Builder.Default Duration replicaLatencyWarning = Duration.ofMillis(200);

    /** Largest lag behind the primary at which a replica still serves reads; null is unbounded */
    Duration maxReplicaLag;

    @NonNull @Builder.Default Duration backupInterval = Duration.ofSeconds(60);

    /** Backups older than this are archived, older than twice this are deleted */
    @Builder.Default int retentionDays = 30;

    /** Writes per one-second window above which callers are delayed */
    @Builder.Default int maxWriteRate = 95;

    @NonNull @Builder.Default Duration throttleBackoff = Duration.ofMillis(10);

    /** How long a stopping daemon may take to finish its in-flight cycle */
    @NonNull @Builder.Default Duration shutdownTimeout = Duration.ofSeconds(5);

    public Optional<Duration> getAcquireTimeout() {
        return Optional.ofNullable(acquireTimeout);
    }

    public Optional<Duration> getMaxReplicaLag() {
        return Optional.ofNullable(maxReplicaLag);
    }

    public Path primaryFile() {
        return dataDirectory.resolve(databaseName + ".db");
    }

    public Path replicaFile(StoreId replicaId) {
        return dataDirectory.resolve("replicas").resolve(replicaId.value()).resolve(databaseName + ".db");
    }

    public Path backupDirectory() {
        return dataDirectory.resolve("backup");
    }

    public Duration retention() {
        return Duration.ofDays(retentionDays);
    }

    /**
     * Checks value ranges and replica name uniqueness.
     *
     * @return this, for chaining
     * @throws IllegalArgumentException on the first invalid value
     */
    public CoordinatorSettings validate() {
        if (!databaseName.matches("[A-Za-z0-9_-]+")) {
            throw new IllegalArgumentException("Database name must be a plain file name: " + databaseName);
        }
        if (poolSize < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1: " + poolSize);
        }
        if (retentionDays < 1) {
            throw new IllegalArgumentException("Retention must be at least one day: " + retentionDays);
        }
        if (maxWriteRate < 1) {
            throw new IllegalArgumentException("Max write rate must be positive: " + maxWriteRate);
        }
        requirePositive("replicationInterval", replicationInterval);
        requirePositive("backupInterval", backupInterval);
        if (throttleBackoff.isNegative()) {
            throw new IllegalArgumentException("Throttle backoff cannot be negative");
        }
        if (acquireTimeout != null && acquireTimeout.isNegative()) {
            throw new IllegalArgumentException("Acquire timeout cannot be negative");
        }
        if (maxReplicaLag != null && maxReplicaLag.isNegative()) {
            throw new IllegalArgumentException("Max replica lag cannot be negative");
        }
        if (new HashSet<>(replicaIds).size() != replicaIds.size()) {
            throw new IllegalArgumentException("Replica ids must be unique: " + replicaIds);
        }
        if (replicaIds.contains(StoreId.PRIMARY)) {
            throw new IllegalArgumentException("A replica cannot be named " + StoreId.PRIMARY);
        }
        return this;
    }

    private static void requirePositive(String name, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
