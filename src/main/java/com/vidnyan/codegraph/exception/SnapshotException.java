package com.vidnyan.codegraph.exception;

/**
 * I/O or encoding failure while reading or writing a snapshot.
 */
public class SnapshotException extends CodeGraphException {

    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
