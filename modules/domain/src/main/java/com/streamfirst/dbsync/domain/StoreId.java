package com.streamfirst.dbsync.domain;

import java.util.Objects;

/**
 * Name of a store instance: the primary or one of the replicas. Replica ids double as the
 * directory name of the replica's file.
 *
 * @param value the store name (e.g. "primary", "replica1")
 */
public record StoreId(String value) implements Comparable<StoreId> {

    public static final StoreId PRIMARY = new StoreId("primary");

    public StoreId {
        Objects.requireNonNull(value, "Store id cannot be null");
        if (!value.matches("[A-Za-z0-9_.-]+")) {
            throw new IllegalArgumentException("Store id must be a plain file name: " + value);
        }
    }

    public static StoreId of(String value) {
        return new StoreId(value);
    }

    @Override
    public int compareTo(StoreId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
