package com.streamfirst.dbsync.domain;

/** Thrown to callers of a connection pool that has been closed, including callers that were already waiting. */
public class PoolClosedException extends DbSyncException {

    public PoolClosedException(String message) {
        super(ErrorKind.POOL_CLOSED, message);
    }

    public PoolClosedException(String message, Throwable cause) {
        super(ErrorKind.POOL_CLOSED, message, cause);
    }
}
