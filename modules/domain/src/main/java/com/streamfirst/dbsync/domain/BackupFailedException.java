package com.streamfirst.dbsync.domain;

/** Raised when a snapshot of the primary store cannot be written. */
public class BackupFailedException extends DbSyncException {

    public BackupFailedException(String message) {
        super(ErrorKind.BACKUP_FAILED, message);
    }

    public BackupFailedException(String message, Throwable cause) {
        super(ErrorKind.BACKUP_FAILED, message, cause);
    }
}
