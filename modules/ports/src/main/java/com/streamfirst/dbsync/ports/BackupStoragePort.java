package com.streamfirst.dbsync.ports;

import com.streamfirst.dbsync.domain.BackupArtifact;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Port for the place backups live: allocation of new backup files, discovery of existing ones,
 * and the archive and delete steps of the retention sweep.
 */
public interface BackupStoragePort {

    /**
     * Reserves a path for a new backup taken at the given time. The file name carries a sortable
     * timestamp suffix; the path does not exist yet.
     *
     * @param createdAt snapshot time encoded into the name
     * @return path the snapshot should be written to
     */
    Path allocate(Instant createdAt);

    /**
     * Describes a backup file that has just been written.
     *
     * @throws java.io.UncheckedIOException if the file cannot be read
     */
    BackupArtifact describe(Path path);

    /**
     * @return backups in the main directory, oldest first
     */
    List<BackupArtifact> listActive();

    /**
     * @return archived backups, oldest first
     */
    List<BackupArtifact> listArchived();

    /**
     * Moves a backup to the archive.
     *
     * @return the artifact at its archived location
     */
    BackupArtifact archive(BackupArtifact artifact);

    /**
     * Permanently removes a backup file. Removing a missing file is not an error.
     */
    void delete(BackupArtifact artifact);

    /**
     * Removes a partially written file after a failed snapshot.
     */
    void discard(Path path);
}
