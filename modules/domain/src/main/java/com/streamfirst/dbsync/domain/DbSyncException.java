package com.streamfirst.dbsync.domain;

import java.util.Objects;

/** Base of the coordinator's exceptions; each carries the {@link ErrorKind} it represents. */
public abstract class DbSyncException extends RuntimeException {

    private final ErrorKind kind;

    protected DbSyncException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind);
    }

    protected DbSyncException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** Whether retrying the same call later may succeed. */
    public boolean isTransient() {
        return kind == ErrorKind.POOL_EXHAUSTED
            || kind == ErrorKind.REPLICA_UNAVAILABLE
            || kind == ErrorKind.BACKUP_FAILED;
    }
}
