package com.streamfirst.dbsync.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Observability view of the coordinator. Building one has no side effects.
 */
@Value
@Builder
public class HealthSnapshot {

    /** Number of configured replicas */
    int replicaCount;

    /** Replicas currently eligible for reads */
    int availableReplicas;

    /** Last synchronized watermark of each replica */
    @NonNull @Singular Map<StoreId, Watermark> replicaWatermarks;

    /** Highest commit time on the primary */
    @NonNull Watermark primaryWatermark;

    /** Writes counted in the last completed rate window */
    long currentWriteRate;

    /** Writes that were delayed by the rate limiter since startup */
    long throttledWrites;

    /** Backup files on disk, archived ones included */
    int backupCount;

    /** Failed backup attempts since startup */
    long backupFailures;

    /** Creation time of the newest backup, if any exists */
    Instant lastBackupTime;

    public Optional<Instant> getLastBackupTime() {
        return Optional.ofNullable(lastBackupTime);
    }
}
