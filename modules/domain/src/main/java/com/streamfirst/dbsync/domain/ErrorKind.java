package com.streamfirst.dbsync.domain;

/**
 * Failure categories of the coordinator. Only pool lifecycle errors and store failures reach
 * the immediate caller; replica and backup failures stay at the daemon boundary.
 */
public enum ErrorKind {
    /** No pooled connection became free in time; retry with backoff */
    POOL_EXHAUSTED,
    /** The pool was closed, the coordinator is shutting down */
    POOL_CLOSED,
    /** A replica could not be reached or rejected a batch */
    REPLICA_UNAVAILABLE,
    /** A snapshot or retention step failed */
    BACKUP_FAILED,
    /** A read or write against a store failed */
    STORE_FAILURE
}
