package com.streamfirst.dbsync.integration;

import com.streamfirst.dbsync.adapters.FileSystemBackupStorage;
import com.streamfirst.dbsync.adapters.store.sqlite.SqliteStoreFactory;
import com.streamfirst.dbsync.application.ReplicationCoordinator;
import com.streamfirst.dbsync.application.StoreSession;
import com.streamfirst.dbsync.domain.*;
import com.streamfirst.dbsync.ports.RecordStore;
import com.streamfirst.dbsync.ports.StoreFactory;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the coordinator on real SQLite files: a primary, three replicas and a
 * backup directory laid out under a temporary data directory.
 *
 * Covers the full path from a write on the primary through replication to a read on a replica,
 * plus backups, restarts and concurrent writers.
 */
@Slf4j
public class SqliteReplicationEndToEndTest {

    private static final StoreId REPLICA_1 = StoreId.of("replica1");
    private static final StoreId REPLICA_2 = StoreId.of("replica2");
    private static final StoreId REPLICA_3 = StoreId.of("replica3");

    private static final RecordKey PROPOSAL = RecordKey.of("proposals", "p1");
    private static final RecordKey USER = RecordKey.of("users", "u1");

    @TempDir
    Path dataDir;

    private CoordinatorSettings settings;
    private ReplicationCoordinator coordinator;

    /**
     * Opens a coordinator over fresh SQLite files with short daemon intervals.
     */
    @BeforeEach
    void setupCoordinator() {
        settings = CoordinatorSettings.builder()
            .dataDirectory(dataDir)
            .poolSize(4)
            .replicationInterval(Duration.ofMillis(50))
            .backupInterval(Duration.ofHours(1))
            .shutdownTimeout(Duration.ofSeconds(5))
            .build();
        coordinator = open();
        log.info("Coordinator opened in {}", dataDir);
    }

    @AfterEach
    void closeCoordinator() {
        coordinator.close();
    }

    private ReplicationCoordinator open() {
        return ReplicationCoordinator.open(
            settings,
            new SqliteStoreFactory(),
            new FileSystemBackupStorage(settings.backupDirectory(), settings.getDatabaseName()));
    }

    /**
     * Write on the primary, replicate, then read the row back from a replica file.
     */
    @Test
    void testWriteReplicateAndReadFromReplica() {
        Row written = coordinator.write(RowMutation.upsert(PROPOSAL, "{\"title\":\"Community garden\"}"));
        assertTrue(Files.exists(settings.primaryFile()), "Primary file should be created");

        ReplicationReport report = coordinator.runReplicationCycle();
        assertFalse(report.hasFailures(), "No replica should fail: " + report.failures());
        assertEquals(3, report.totalApplied(), "Each replica should receive the row");

        for (StoreId id : List.of(REPLICA_1, REPLICA_2, REPLICA_3)) {
            assertTrue(Files.exists(settings.replicaFile(id)), "Replica file should exist for " + id);
            assertEquals(written.watermark(), coordinator.replicaState(id).orElseThrow().lastSync());
        }

        try (StoreSession session = coordinator.getConnection(true)) {
            assertFalse(session.isPrimary(), "Reads should be served by a replica");
            assertEquals(REPLICA_1, session.storeId(), "Ties go to the lowest replica id");
            Row read = session.find(PROPOSAL).orElseThrow();
            assertEquals(written, read);
        }
    }

    /**
     * Deletions travel to the replicas as tombstones.
     */
    @Test
    void testDeletionReachesReplicas() {
        coordinator.write(RowMutation.upsert(USER, "{\"name\":\"alice\"}"));
        coordinator.runReplicationCycle();

        coordinator.write(RowMutation.delete(USER));
        coordinator.runReplicationCycle();

        try (StoreSession session = coordinator.getConnection(true)) {
            assertFalse(session.isPrimary());
            assertTrue(session.find(USER).isEmpty(), "Deleted user should be gone from the replica");
            assertTrue(session.list("users").isEmpty());
        }
    }

    /**
     * The daemon replicates on its own once started.
     */
    @Test
    void testBackgroundReplication() throws Exception {
        coordinator.start();
        Row written = coordinator.write(RowMutation.upsert(PROPOSAL, "{}"));

        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline
            && coordinator.healthSnapshot().getReplicaWatermarks().values().stream()
                .anyMatch(watermark -> watermark.isBefore(written.watermark()))) {
            Thread.sleep(20);
        }

        HealthSnapshot health = coordinator.healthSnapshot();
        assertEquals(3, health.getAvailableReplicas());
        health.getReplicaWatermarks().values()
            .forEach(watermark -> assertEquals(written.watermark(), watermark));
    }

    /**
     * A manual backup is a complete SQLite copy of the primary.
     */
    @Test
    void testManualBackupIsRestorable() {
        coordinator.write(RowMutation.upsert(PROPOSAL, "{}"));
        coordinator.write(RowMutation.upsert(USER, "{}"));

        Result<BackupArtifact> result = coordinator.triggerBackup();
        assertTrue(result.isSuccess(), () -> "Backup should succeed: " + result);
        BackupArtifact artifact = result.orElseThrow();
        assertEquals(settings.backupDirectory(), artifact.path().getParent());
        assertTrue(artifact.sizeBytes() > 0);

        try (RecordStore restored = new SqliteStoreFactory()
                .open(StoreId.of("restored"), artifact.path(), StoreFactory.Role.REPLICA)) {
            assertEquals(2, restored.rowCount());
        }
        assertEquals(1, coordinator.healthSnapshot().getBackupCount());
    }

    /**
     * A restarted coordinator resumes from the watermarks stored in the replica files.
     */
    @Test
    void testRestartResumesFromStoredWatermarks() {
        Row first = coordinator.write(RowMutation.upsert(PROPOSAL, "{\"v\":1}"));
        coordinator.runReplicationCycle();
        coordinator.close();

        coordinator = open();
        assertEquals(first.watermark(), coordinator.replicaState(REPLICA_2).orElseThrow().lastSync());

        Row second = coordinator.write(RowMutation.upsert(PROPOSAL, "{\"v\":2}"));
        assertTrue(second.modifiedAt().isAfter(first.modifiedAt()), "Stamps keep increasing across restarts");
        ReplicationReport report = coordinator.runReplicationCycle();
        assertEquals(3, report.totalApplied(), "Only the new change should be pushed");
    }

    /**
     * Concurrent writers through the pool all commit, and every change replicates.
     */
    @Test
    void testConcurrentWriters() throws Exception {
        ExecutorService writers = Executors.newFixedThreadPool(8);
        try {
            List<Future<Row>> futures = new java.util.ArrayList<>();
            for (int i = 0; i < 40; i++) {
                RecordKey key = RecordKey.of("audit_logs", "a" + i);
                futures.add(writers.submit(() -> coordinator.write(RowMutation.upsert(key, "{}"))));
            }
            for (Future<Row> future : futures) {
                assertNotNull(future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            writers.shutdownNow();
        }

        coordinator.runReplicationCycle();
        try (StoreSession session = coordinator.getConnection(true)) {
            assertEquals(40, session.list("audit_logs").size());
        }
    }
}
