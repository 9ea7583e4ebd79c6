package com.vidnyan.codegraph.exception;

/**
 * Malformed or unsupported graph query.
 */
public class GraphQueryException extends CodeGraphException {

    private final int position;

    public GraphQueryException(String message, int position) {
        super(position >= 0 ? message + " (at position " + position + ")" : message);
        this.position = position;
    }

    public GraphQueryException(String message) {
        this(message, -1);
    }

    public int getPosition() {
        return position;
    }
}
