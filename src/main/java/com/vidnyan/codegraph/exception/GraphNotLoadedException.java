package com.vidnyan.codegraph.exception;

public class GraphNotLoadedException extends CodeGraphException {

    public GraphNotLoadedException(String message) {
        super(message);
    }
}
