package com.streamfirst.dbsync.application;

import com.streamfirst.dbsync.domain.Row;
import com.streamfirst.dbsync.domain.Watermark;
import com.streamfirst.dbsync.ports.RecordStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/** Reads the changes a replica is missing from the primary. Never writes. */
@Slf4j
public final class ChangeExtractor {

    private final RecordStore primary;

    public ChangeExtractor(RecordStore primary) {
        this.primary = Objects.requireNonNull(primary);
    }

    /**
     * Returns every primary row, tombstones included, modified strictly after {@code cutoff},
     * ordered by modification time and then by key.
     *
     * @throws com.streamfirst.dbsync.domain.StoreException if the primary cannot be read
     */
    public List<Row> changesSince(Watermark cutoff) {
        List<Row> changes =
                primary.changesSince(cutoff).stream()
                        .filter(row -> row.watermark().isAfter(cutoff))
                        .sorted(Row.REPLICATION_ORDER)
                        .toList();
        log.debug("Extracted {} changes after {}", changes.size(), cutoff);
        return changes;
    }
}
