package com.vidnyan.codegraph.domain.model;

/**
 * A source file handed to the pipeline: project-relative path plus text content.
 */
public record FileEntry(String path, String content) {
}
