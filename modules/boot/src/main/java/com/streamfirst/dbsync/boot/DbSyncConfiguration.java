package com.streamfirst.dbsync.boot;

import com.streamfirst.dbsync.adapters.FileSystemBackupStorage;
import com.streamfirst.dbsync.adapters.store.sqlite.SqliteStoreFactory;
import com.streamfirst.dbsync.application.ReplicationCoordinator;
import com.streamfirst.dbsync.domain.CoordinatorSettings;
import com.streamfirst.dbsync.domain.HealthSnapshot;
import com.streamfirst.dbsync.ports.BackupStoragePort;
import com.streamfirst.dbsync.ports.StoreFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the coordinator over SQLite files and a local backup directory.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(DbSyncProperties.class)
public class DbSyncConfiguration {

    // --- Adapters ---

    @Bean
    public CoordinatorSettings coordinatorSettings(DbSyncProperties properties) {
        return properties.toSettings();
    }

    @Bean
    public StoreFactory storeFactory(DbSyncProperties properties) {
        return new SqliteStoreFactory(Math.toIntExact(properties.getSqliteBusyTimeout().toMillis()));
    }

    @Bean
    public BackupStoragePort backupStorage(CoordinatorSettings settings) {
        return new FileSystemBackupStorage(settings.backupDirectory(), settings.getDatabaseName());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // --- Coordinator, started with the context and closed with it ---

    @Bean(initMethod = "start", destroyMethod = "close")
    public ReplicationCoordinator replicationCoordinator(
            CoordinatorSettings settings, StoreFactory storeFactory, BackupStoragePort backupStorage, Clock clock) {
        return ReplicationCoordinator.open(settings, storeFactory, backupStorage, clock);
    }

    @Bean
    public CommandLineRunner startupReport(ReplicationCoordinator coordinator) {
        return args -> {
            HealthSnapshot health = coordinator.healthSnapshot();
            log.info("Coordinator running: {} of {} replicas available, primary at {}, {} backups on disk",
                health.getAvailableReplicas(),
                health.getReplicaCount(),
                health.getPrimaryWatermark(),
                health.getBackupCount());
        };
    }
}
