package com.vidnyan.codegraph.application.port.out;

import com.vidnyan.codegraph.domain.model.FileManifest;
import com.vidnyan.codegraph.domain.snapshot.SnapshotLoadResult;
import com.vidnyan.codegraph.domain.snapshot.SnapshotMeta;
import com.vidnyan.codegraph.domain.snapshot.SnapshotPayload;
import com.vidnyan.codegraph.domain.snapshot.SnapshotSaveResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Port for signed, version-gated project snapshots.
 * Implemented by the file system adapter.
 */
public interface SnapshotStore {

    /**
     * Encodes, signs and writes the payload with its manifest. Never throws;
     * a failure is reported in the result.
     */
    SnapshotSaveResult save(Path projectRoot, SnapshotPayload payload, FileManifest manifest);

    /**
     * Reads, verifies and decodes the snapshot of a project. Never throws;
     * anything unusable is reported as a non-valid status.
     */
    SnapshotLoadResult load(Path projectRoot);

    Optional<FileManifest> loadManifest(Path projectRoot);

    Optional<SnapshotMeta> readMeta(Path projectRoot);

    boolean exists(Path projectRoot);

    long diskUsage(Path projectRoot);

    void delete(Path projectRoot);

    List<Path> listProjects(Path baseDir);
}
