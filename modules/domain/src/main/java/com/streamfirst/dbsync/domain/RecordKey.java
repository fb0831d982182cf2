package com.streamfirst.dbsync.domain;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies a row in a store. The collection names the logical table the row belongs to
 * (for example "proposals" or "audit_logs"); the id is unique within that collection.
 *
 * @param collection logical table name
 * @param id row identifier within the collection
 */
public record RecordKey(String collection, String id) implements Comparable<RecordKey> {

    private static final Comparator<RecordKey> ORDER =
            Comparator.comparing(RecordKey::collection).thenComparing(RecordKey::id);

    public RecordKey {
        Objects.requireNonNull(collection, "Record collection cannot be null");
        Objects.requireNonNull(id, "Record id cannot be null");
        if (collection.isBlank()) {
            throw new IllegalArgumentException("Record collection cannot be empty");
        }
        if (id.isBlank()) {
            throw new IllegalArgumentException("Record id cannot be empty");
        }
    }

    public static RecordKey of(String collection, String id) {
        return new RecordKey(collection, id);
    }

    @Override
    public int compareTo(RecordKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return collection + "/" + id;
    }
}
