package com.streamfirst.dbsync.domain;

/** Thrown when no pooled connection becomes available within the caller's timeout. */
public class PoolExhaustedException extends DbSyncException {

    public PoolExhaustedException(String message) {
        super(ErrorKind.POOL_EXHAUSTED, message);
    }

    public PoolExhaustedException(String message, Throwable cause) {
        super(ErrorKind.POOL_EXHAUSTED, message, cause);
    }
}
