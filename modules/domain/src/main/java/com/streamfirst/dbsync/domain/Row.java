package com.streamfirst.dbsync.domain;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * A row as stored and replicated. The payload is opaque to the coordinator; only the key and
 * the modification time are interpreted. A deleted row is kept as a tombstone so that the
 * deletion travels to replicas like any other change.
 *
 * @param key identifier of the row
 * @param modifiedAt commit time of the last change, millisecond precision
 * @param payload opaque row content, null for tombstones
 * @param deleted whether this row is a tombstone
 */
public record Row(RecordKey key, Instant modifiedAt, String payload, boolean deleted) {

    /** Replication order: modification time, then key. */
    public static final Comparator<Row> REPLICATION_ORDER =
            Comparator.comparing(Row::modifiedAt).thenComparing(Row::key);

    public Row {
        Objects.requireNonNull(key, "Row key cannot be null");
        Objects.requireNonNull(modifiedAt, "Row modifiedAt cannot be null");
        modifiedAt = Instant.ofEpochMilli(modifiedAt.toEpochMilli());
        if (deleted) {
            payload = null;
        } else {
            Objects.requireNonNull(payload, "Row payload cannot be null for " + key);
        }
    }

    public static Row of(RecordKey key, Instant modifiedAt, String payload) {
        return new Row(key, modifiedAt, payload, false);
    }

    public static Row tombstone(RecordKey key, Instant modifiedAt) {
        return new Row(key, modifiedAt, null, true);
    }

    public Watermark watermark() {
        return Watermark.of(modifiedAt);
    }

    @Override
    public String toString() {
        return "Row{" + key + " @" + modifiedAt + (deleted ? " deleted" : "") + '}';
    }
}
