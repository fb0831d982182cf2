package com.streamfirst.dbsync.domain;

/** Wraps a failure of the underlying store while reading or writing rows. */
public class StoreException extends DbSyncException {

    public StoreException(String message) {
        super(ErrorKind.STORE_FAILURE, message);
    }

    public StoreException(String message, Throwable cause) {
        super(ErrorKind.STORE_FAILURE, message, cause);
    }
}
