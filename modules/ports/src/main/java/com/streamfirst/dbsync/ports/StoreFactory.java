package com.streamfirst.dbsync.ports;

import com.streamfirst.dbsync.domain.StoreId;

import java.nio.file.Path;

/**
 * Creates or reopens store instances at a file location.
 */
public interface StoreFactory {

    /**
     * Roles a store can be opened for. Replicas may trade durability for speed since they can
     * always be rebuilt from the primary.
     */
    enum Role {
        PRIMARY,
        REPLICA
    }

    /**
     * Opens the store at the given file, creating it and its schema if missing.
     *
     * @param id name of the store
     * @param file location of the store file
     * @param role what the store is used for
     * @return an open store
     * @throws com.streamfirst.dbsync.domain.StoreException if the store cannot be opened
     */
    RecordStore open(StoreId id, Path file, Role role);
}
