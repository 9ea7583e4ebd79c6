package com.vidnyan.codegraph.adapter.out.change;

import com.vidnyan.codegraph.exception.CodeGraphException;

/**
 * A change detection strategy could not produce a result.
 */
public class ChangeDetectionException extends CodeGraphException {

    public ChangeDetectionException(String message) {
        super(message);
    }

    public ChangeDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
