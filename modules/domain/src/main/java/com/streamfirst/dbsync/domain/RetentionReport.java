package com.streamfirst.dbsync.domain;

import java.util.List;

/**
 * Outcome of one retention sweep.
 *
 * @param archived artifacts moved to the archive, at their new location
 * @param deleted artifacts permanently removed
 */
public record RetentionReport(List<BackupArtifact> archived, List<BackupArtifact> deleted) {
    public RetentionReport {
        archived = List.copyOf(archived);
        deleted = List.copyOf(deleted);
    }

    public static RetentionReport empty() {
        return new RetentionReport(List.of(), List.of());
    }
}
