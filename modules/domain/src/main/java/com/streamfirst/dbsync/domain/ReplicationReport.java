package com.streamfirst.dbsync.domain;

import java.util.Map;

/**
 * Outcome of one replication cycle.
 *
 * @param applied rows pushed to each replica that succeeded
 * @param failures error message for each replica that failed
 */
public record ReplicationReport(Map<StoreId, Integer> applied, Map<StoreId, String> failures) {
    public ReplicationReport {
        applied = Map.copyOf(applied);
        failures = Map.copyOf(failures);
    }

    public int totalApplied() {
        return applied.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
