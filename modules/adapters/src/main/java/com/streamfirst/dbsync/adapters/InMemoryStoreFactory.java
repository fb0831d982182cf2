package com.streamfirst.dbsync.adapters;

import com.streamfirst.dbsync.domain.StoreId;
import com.streamfirst.dbsync.ports.RecordStore;
import com.streamfirst.dbsync.ports.StoreFactory;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of StoreFactory. Ignores the file location and keeps every store it
 * opened so tests can reach them, e.g. to simulate an outage of one replica.
 */
@Slf4j
public class InMemoryStoreFactory implements StoreFactory {

    private final Map<StoreId, InMemoryRecordStore> stores = new ConcurrentHashMap<>();

    @Override
    public RecordStore open(StoreId id, Path file, Role role) {
        log.debug("Opening in-memory {} store {} (file {} ignored)", role, id, file);
        return stores.compute(id, (key, existing) ->
            existing == null || existing.isClosed() ? new InMemoryRecordStore(key) : existing);
    }

    /**
     * @return the store opened under the given id, if any
     */
    public Optional<InMemoryRecordStore> store(StoreId id) {
        return Optional.ofNullable(stores.get(id));
    }

    public InMemoryRecordStore require(StoreId id) {
        return store(id).orElseThrow(() -> new IllegalArgumentException("No store opened as " + id));
    }
}
