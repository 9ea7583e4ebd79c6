package com.vidnyan.codegraph.application.port.out;

import com.vidnyan.codegraph.domain.model.DiffResult;
import com.vidnyan.codegraph.domain.model.FileManifest;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Port for classifying files as added, modified or deleted since a snapshot.
 */
public interface ChangeDetector {

    /**
     * @param gitCommit commit recorded with the snapshot, null when unknown
     * @param manifest  file manifest recorded with the snapshot
     */
    DiffResult detectChanges(Path projectRoot, String gitCommit, FileManifest manifest);

    /**
     * HEAD commit of the repository rooted at {@code projectRoot}, if any.
     */
    Optional<String> currentCommit(Path projectRoot);

    /**
     * Manifest of the given contents, stamped with the files' modification times on disk.
     */
    FileManifest buildManifest(Path projectRoot, Map<String, String> fileContents);
}
