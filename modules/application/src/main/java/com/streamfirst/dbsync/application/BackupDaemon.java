package com.streamfirst.dbsync.application;

import com.streamfirst.dbsync.domain.BackupArtifact;
import com.streamfirst.dbsync.domain.BackupFailedException;
import com.streamfirst.dbsync.domain.RetentionReport;
import com.streamfirst.dbsync.ports.BackupStoragePort;
import com.streamfirst.dbsync.ports.RecordStore;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Takes periodic full snapshots of the primary and enforces retention: backups older than the
 * retention period are archived, backups older than twice the period are deleted.
 *
 * <p>A failed snapshot is logged and retried on the next tick; it never stops the daemon.
 */
@Slf4j
public final class BackupDaemon extends ScheduledDaemon {

    private final RecordStore primary;
    private final BackupStoragePort storage;
    private final Clock clock;
    private final Duration retention;
    private final ReentrantLock snapshotLock = new ReentrantLock();
    private final AtomicLong failures = new AtomicLong();
    private volatile BackupArtifact lastBackup;

    public BackupDaemon(
            RecordStore primary,
            BackupStoragePort storage,
            Clock clock,
            Duration interval,
            Duration retention,
            Duration shutdownTimeout) {
        super("backup", interval, shutdownTimeout);
        this.primary = primary;
        this.storage = storage;
        this.clock = clock;
        this.retention = retention;
    }

    @Override
    protected void runCycle() {
        try {
            createBackup();
        } catch (BackupFailedException e) {
            log.error("Backup failed, retrying next cycle", e);
        }
        try {
            sweep(clock.instant());
        } catch (UncheckedIOException e) {
            log.error("Retention sweep failed, retrying next cycle", e);
        }
    }

    /**
     * Writes a snapshot of the primary. Used by the schedule and by manual triggers; snapshots
     * never run concurrently.
     *
     * @return the new backup
     * @throws BackupFailedException if no complete snapshot could be written
     */
    public BackupArtifact createBackup() {
        snapshotLock.lock();
        Path path = null;
        try {
            path = storage.allocate(clock.instant());
            primary.snapshotTo(path);
            BackupArtifact artifact = storage.describe(path);
            lastBackup = artifact;
            log.info("Backup created: {} ({} bytes)", artifact.path(), artifact.sizeBytes());
            return artifact;
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            if (path != null) {
                storage.discard(path);
            }
            throw new BackupFailedException("Failed to back up " + primary.id() + " to " + path, e);
        } finally {
            snapshotLock.unlock();
        }
    }

    /**
     * Archives and deletes backups by age relative to {@code now}. A backup that cannot be moved or
     * removed is logged and left for the next sweep.
     *
     * @throws UncheckedIOException if the backups cannot be listed
     */
    public RetentionReport sweep(Instant now) {
        Duration deleteAfter = retention.multipliedBy(2);
        List<BackupArtifact> archived = new ArrayList<>();
        List<BackupArtifact> deleted = new ArrayList<>();

        for (BackupArtifact artifact : storage.listActive()) {
            Duration age = Duration.between(artifact.createdAt(), now);
            try {
                if (age.compareTo(deleteAfter) > 0) {
                    storage.delete(artifact);
                    deleted.add(artifact);
                } else if (age.compareTo(retention) > 0) {
                    archived.add(storage.archive(artifact));
                }
            } catch (UncheckedIOException e) {
                log.warn("Retention of {} failed", artifact.fileName(), e);
            }
        }
        for (BackupArtifact artifact : storage.listArchived()) {
            if (Duration.between(artifact.createdAt(), now).compareTo(deleteAfter) > 0) {
                try {
                    storage.delete(artifact);
                    deleted.add(artifact);
                } catch (UncheckedIOException e) {
                    log.warn("Removal of archived {} failed", artifact.fileName(), e);
                }
            }
        }

        if (!archived.isEmpty() || !deleted.isEmpty()) {
            log.info("Retention sweep archived {} and deleted {} backups", archived.size(), deleted.size());
        }
        return new RetentionReport(archived, deleted);
    }

    public long getFailures() {
        return failures.get();
    }

    /** Backups on disk, archived ones included. */
    public List<BackupArtifact> listBackups() {
        return Stream.concat(storage.listActive().stream(), storage.listArchived().stream())
                .sorted(Comparator.comparing(BackupArtifact::createdAt))
                .toList();
    }

    /** The newest backup this daemon wrote, or failing that the newest one on disk. */
    public Optional<BackupArtifact> lastBackup() {
        BackupArtifact last = lastBackup;
        if (last != null) {
            return Optional.of(last);
        }
        List<BackupArtifact> all = listBackups();
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }
}
