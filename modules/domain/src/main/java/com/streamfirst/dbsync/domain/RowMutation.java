package com.streamfirst.dbsync.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A change submitted by a write caller. The modification time is optional; when absent the
 * primary store stamps the commit time itself.
 *
 * @param key row to change
 * @param payload new content, null for deletions
 * @param modifiedAt explicit commit time, if the caller supplies one
 * @param delete whether the row is being deleted
 */
public record RowMutation(
        RecordKey key, String payload, Optional<Instant> modifiedAt, boolean delete) {

    public RowMutation {
        Objects.requireNonNull(key, "Mutation key cannot be null");
        Objects.requireNonNull(modifiedAt, "Mutation modifiedAt cannot be null, use Optional.empty()");
        if (!delete && payload == null) {
            throw new IllegalArgumentException("Upsert of " + key + " requires a payload");
        }
    }

    public static RowMutation upsert(RecordKey key, String payload) {
        return new RowMutation(key, payload, Optional.empty(), false);
    }

    public static RowMutation upsertAt(RecordKey key, String payload, Instant modifiedAt) {
        return new RowMutation(key, payload, Optional.of(modifiedAt), false);
    }

    public static RowMutation delete(RecordKey key) {
        return new RowMutation(key, null, Optional.empty(), true);
    }

    /** Materializes the mutation as the row committed at {@code at}. */
    public Row toRow(Instant at) {
        return delete ? Row.tombstone(key, at) : Row.of(key, at, payload);
    }
}
