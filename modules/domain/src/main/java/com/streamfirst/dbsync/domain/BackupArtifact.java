package com.streamfirst.dbsync.domain;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * A point-in-time copy of the primary store on disk. Immutable once written; removed only by
 * the retention sweep.
 *
 * @param path location of the backup file
 * @param createdAt when the snapshot was taken
 * @param sizeBytes file size
 */
public record BackupArtifact(Path path, Instant createdAt, long sizeBytes) {
    public BackupArtifact {
        Objects.requireNonNull(path, "Backup path cannot be null");
        Objects.requireNonNull(createdAt, "Backup createdAt cannot be null");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("Backup size cannot be negative: " + sizeBytes);
        }
    }

    public String fileName() {
        return path.getFileName().toString();
    }
}
