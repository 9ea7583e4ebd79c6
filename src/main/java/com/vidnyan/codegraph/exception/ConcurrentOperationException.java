package com.vidnyan.codegraph.exception;

/**
 * Another ingestion, update or save is already running for the same project.
 */
public class ConcurrentOperationException extends CodeGraphException {

    private final String projectId;

    public ConcurrentOperationException(String projectId, String operation) {
        super("Operation '" + operation + "' rejected: another operation is in flight for project " + projectId);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
