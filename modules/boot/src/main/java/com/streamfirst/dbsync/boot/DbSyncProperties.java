package com.streamfirst.dbsync.boot;

import com.streamfirst.dbsync.domain.CoordinatorSettings;
import com.streamfirst.dbsync.domain.StoreId;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code dbsync.*} keys.
 */
@Data
@ConfigurationProperties(prefix = "dbsync")
public class DbSyncProperties {

    /**
     * Directory holding the primary file, the replica directories and the backups.
     */
    private String dataDirectory = "data";

    private String databaseName = "proposal_system";

    private List<String> replicas = new ArrayList<>(List.of("replica1", "replica2", "replica3"));

    private int poolSize = 20;

    /**
     * Longest wait for a pooled primary connection; unset waits indefinitely.
     */
    private Duration acquireTimeout;

    private Duration replicationInterval = Duration.ofSeconds(5);

    private Duration replicaLatencyWarning = Duration.ofMillis(200);

    /**
     * Replicas lagging the primary by more than this do not serve reads; unset accepts any lag.
     */
    private Duration maxReplicaLag;

    private Duration backupInterval = Duration.ofSeconds(60);

    private int retentionDays = 30;

    private int maxWriteRate = 95;

    private Duration throttleBackoff = Duration.ofMillis(10);

    private Duration shutdownTimeout = Duration.ofSeconds(5);

    /**
     * How long a SQLite connection waits for a lock held by another connection.
     */
    private Duration sqliteBusyTimeout = Duration.ofSeconds(5);

    public CoordinatorSettings toSettings() {
        return CoordinatorSettings.builder()
            .dataDirectory(Path.of(dataDirectory))
            .databaseName(databaseName)
            .replicaIds(replicas.stream().map(StoreId::of).toList())
            .poolSize(poolSize)
            .acquireTimeout(acquireTimeout)
            .replicationInterval(replicationInterval)
            .replicaLatencyWarning(replicaLatencyWarning)
            .maxReplicaLag(maxReplicaLag)
            .backupInterval(backupInterval)
            .retentionDays(retentionDays)
            .maxWriteRate(maxWriteRate)
            .throttleBackoff(throttleBackoff)
            .shutdownTimeout(shutdownTimeout)
            .build()
            .validate();
    }
}
