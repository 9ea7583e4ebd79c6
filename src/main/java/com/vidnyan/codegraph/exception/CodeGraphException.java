package com.vidnyan.codegraph.exception;

/**
 * Base class of all domain exceptions.
 */
public class CodeGraphException extends RuntimeException {

    public CodeGraphException(String message) {
        super(message);
    }

    public CodeGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
