package com.vidnyan.codegraph.adapter.out.snapshot;

import com.vidnyan.codegraph.application.port.out.SnapshotStore;
import com.vidnyan.codegraph.domain.model.FileManifest;
import com.vidnyan.codegraph.domain.snapshot.SnapshotFormat;
import com.vidnyan.codegraph.domain.snapshot.SnapshotLoadResult;
import com.vidnyan.codegraph.domain.snapshot.SnapshotLoadResult.Status;
import com.vidnyan.codegraph.domain.snapshot.SnapshotMeta;
import com.vidnyan.codegraph.domain.snapshot.SnapshotPayload;
import com.vidnyan.codegraph.domain.snapshot.SnapshotSaveResult;
import com.vidnyan.codegraph.domain.snapshot.StoredSnapshotMeta;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot store combining the CBOR/GZIP codec, HMAC signing and the
 * {@code .codegraph/} file layout.
 * <p>
 * Load checks, in order: presence, format version, application version,
 * signature, decodability.
 */
@Slf4j
@RequiredArgsConstructor
public class SignedSnapshotStore implements SnapshotStore {

    private final SnapshotCodec codec;
    private final SnapshotSigner signer;
    private final FileSystemSnapshotStore files;
    private final String appVersion;
    private final boolean updateGitignore;

    @Override
    public SnapshotSaveResult save(Path projectRoot, SnapshotPayload payload, FileManifest manifest) {
        long start = System.currentTimeMillis();
        try {
            byte[] data = codec.serialize(payload);
            String hmac = signer.sign(data);

            files.writeSnapshot(projectRoot, data, StoredSnapshotMeta.signed(payload.meta(), hmac), manifest);
            if (updateGitignore) {
                files.ensureGitignore(projectRoot);
            }

            long duration = System.currentTimeMillis() - start;
            log.info("Saved snapshot of {}: {} KB in {} ms", projectRoot, data.length / 1024, duration);
            return SnapshotSaveResult.succeeded(data.length, duration);
        } catch (RuntimeException e) {
            log.warn("Snapshot save failed for {}: {}", projectRoot, e.getMessage());
            return SnapshotSaveResult.failed(System.currentTimeMillis() - start, e.getMessage());
        }
    }

    @Override
    public SnapshotLoadResult load(Path projectRoot) {
        SnapshotLoadResult result;
        try {
            result = doLoad(projectRoot);
        } catch (RuntimeException e) {
            result = SnapshotLoadResult.invalid(Status.CORRUPT, e.getMessage());
        }
        if (result.isValid()) {
            log.info("Loaded snapshot of {}", projectRoot);
        } else if (result.status() != Status.MISSING) {
            log.warn("Discarding snapshot of {}: {} ({})", projectRoot, result.status(), result.detail());
        }
        return result;
    }

    private SnapshotLoadResult doLoad(Path projectRoot) {
        if (!files.exists(projectRoot)) {
            return SnapshotLoadResult.invalid(Status.MISSING, "no snapshot");
        }
        Optional<StoredSnapshotMeta> stored = files.readMeta(projectRoot);
        if (stored.isEmpty()) {
            return SnapshotLoadResult.invalid(Status.MISSING, "no " + SnapshotFormat.META_FILE);
        }
        StoredSnapshotMeta meta = stored.get();
        if (meta.formatVersion() != SnapshotFormat.FORMAT_VERSION) {
            return SnapshotLoadResult.invalid(Status.FORMAT_MISMATCH,
                    "format " + meta.formatVersion() + ", expected " + SnapshotFormat.FORMAT_VERSION);
        }
        if (!Objects.equals(meta.appVersion(), appVersion)) {
            return SnapshotLoadResult.invalid(Status.VERSION_MISMATCH,
                    "written by " + meta.appVersion() + ", running " + appVersion);
        }

        Optional<byte[]> data = files.readSnapshot(projectRoot);
        if (data.isEmpty()) {
            return SnapshotLoadResult.invalid(Status.MISSING, "no " + SnapshotFormat.SNAPSHOT_FILE);
        }
        if (!signer.verify(data.get(), meta.hmac())) {
            return SnapshotLoadResult.invalid(Status.INTEGRITY_FAILURE, "signature mismatch");
        }

        SnapshotPayload payload = codec.deserialize(data.get());
        if (payload.meta().formatVersion() != SnapshotFormat.FORMAT_VERSION) {
            return SnapshotLoadResult.invalid(Status.FORMAT_MISMATCH, "payload header format mismatch");
        }
        return SnapshotLoadResult.valid(payload);
    }

    @Override
    public Optional<FileManifest> loadManifest(Path projectRoot) {
        try {
            return files.readManifest(projectRoot);
        } catch (RuntimeException e) {
            log.warn("Ignoring unreadable manifest of {}: {}", projectRoot, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<SnapshotMeta> readMeta(Path projectRoot) {
        try {
            return files.readMeta(projectRoot).map(StoredSnapshotMeta::toMeta);
        } catch (RuntimeException e) {
            log.debug("Unreadable snapshot meta of {}: {}", projectRoot, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean exists(Path projectRoot) {
        return files.exists(projectRoot);
    }

    @Override
    public long diskUsage(Path projectRoot) {
        return files.diskUsage(projectRoot);
    }

    @Override
    public void delete(Path projectRoot) {
        files.delete(projectRoot);
    }

    @Override
    public List<Path> listProjects(Path baseDir) {
        return files.listProjects(baseDir);
    }
}
