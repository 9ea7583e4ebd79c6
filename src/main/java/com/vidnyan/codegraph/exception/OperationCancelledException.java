package com.vidnyan.codegraph.exception;

/**
 * Thrown when a cancellation token is observed at a safe boundary.
 */
public class OperationCancelledException extends CodeGraphException {

    public OperationCancelledException(String message) {
        super(message);
    }
}
