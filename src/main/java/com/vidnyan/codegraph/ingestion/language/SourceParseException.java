package com.vidnyan.codegraph.ingestion.language;

import com.vidnyan.codegraph.exception.CodeGraphException;

public class SourceParseException extends CodeGraphException {

    public SourceParseException(String message) {
        super(message);
    }

    public SourceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
