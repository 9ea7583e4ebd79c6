package com.vidnyan.codegraph.application.port.out;

import com.vidnyan.codegraph.domain.model.FileEntry;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Port for discovering and reading the source files of a project.
 */
public interface ProjectFiles {

    /**
     * Every readable, non-ignored text file under the root, sorted by path.
     */
    List<FileEntry> scan(Path projectRoot);

    /**
     * Reads the given project-relative paths. Missing or unreadable files are
     * left out of the result.
     */
    Map<String, String> read(Path projectRoot, Collection<String> paths);

    boolean exists(Path projectRoot, String path);
}
