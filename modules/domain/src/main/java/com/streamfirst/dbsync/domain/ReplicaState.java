package com.streamfirst.dbsync.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time view of one replica, handed out to readers of the replica set.
 *
 * @param id replica name
 * @param lastSync watermark of the newest change applied to the replica
 * @param available false after a failed push, until the next successful one
 * @param consecutiveFailures failed pushes since the last success
 * @param lastError message of the most recent failure, if any
 * @param lastSuccess time of the last successful push, if any
 */
public record ReplicaState(
    StoreId id,
    Watermark lastSync,
    boolean available,
    int consecutiveFailures,
    Optional<String> lastError,
    Optional<Instant> lastSuccess) {}
