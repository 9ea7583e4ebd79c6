package com.vidnyan.codegraph.exception;

public class ProjectNotOpenException extends CodeGraphException {

    public ProjectNotOpenException(String projectId) {
        super("Project is not open: " + projectId);
    }
}
