package com.streamfirst.dbsync.domain;

import lombok.Getter;

/**
 * A push to one replica failed. Isolated to that replica: logged and retried on the next cycle,
 * never propagated to writers.
 */
@Getter
public class ReplicaUnavailableException extends DbSyncException {

    private final StoreId replicaId;

    public ReplicaUnavailableException(StoreId replicaId, String message, Throwable cause) {
        super(ErrorKind.REPLICA_UNAVAILABLE, "Replica " + replicaId + ": " + message, cause);
        this.replicaId = replicaId;
    }
}
