package com.vidnyan.codegraph.adapter.out.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codegraph.domain.model.FileManifest;
import com.vidnyan.codegraph.domain.snapshot.SnapshotFormat;
import com.vidnyan.codegraph.domain.snapshot.StoredSnapshotMeta;
import com.vidnyan.codegraph.exception.SnapshotException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Files of the {@code .codegraph/} directory inside a project.
 * <p>
 * Saves are atomic per file: a lock file holding the writer's PID guards temp
 * files that are renamed over {@code snapshot.bin}, {@code meta.json} and
 * {@code manifest.json}.
 */
@Slf4j
@RequiredArgsConstructor
public class FileSystemSnapshotStore {

    private static final String GITIGNORE_ENTRY = SnapshotFormat.DIRECTORY + "/";

    private final ObjectMapper objectMapper;

    public Path directoryOf(Path projectRoot) {
        return projectRoot.resolve(SnapshotFormat.DIRECTORY);
    }

    /**
     * Writes snapshot, meta and manifest under the lock. All three are staged
     * in temp files before the first of them replaces the current one.
     *
     * @throws SnapshotException when another live process holds the lock or I/O fails;
     *                           the current files are left as they were
     */
    public void writeSnapshot(Path projectRoot, byte[] data, StoredSnapshotMeta meta, FileManifest manifest) {
        Path dir = directoryOf(projectRoot);
        Path lock = dir.resolve(SnapshotFormat.LOCK_FILE);
        Path snapshotTmp = dir.resolve(SnapshotFormat.SNAPSHOT_TMP_FILE);
        Path metaTmp = tempFileOf(dir, SnapshotFormat.META_FILE);
        Path manifestTmp = tempFileOf(dir, SnapshotFormat.MANIFEST_FILE);
        try {
            Files.createDirectories(dir);
            cleanStaleLock(projectRoot);
            try {
                Files.writeString(lock, String.valueOf(ProcessHandle.current().pid()), StandardOpenOption.CREATE_NEW);
            } catch (FileAlreadyExistsException e) {
                throw new SnapshotException("Snapshot of " + projectRoot + " is locked by another writer");
            }
            try {
                Files.write(snapshotTmp, data);
                objectMapper.writeValue(metaTmp.toFile(), meta);
                objectMapper.writeValue(manifestTmp.toFile(), manifest);
                moveAtomically(snapshotTmp, dir.resolve(SnapshotFormat.SNAPSHOT_FILE));
                moveAtomically(metaTmp, dir.resolve(SnapshotFormat.META_FILE));
                moveAtomically(manifestTmp, dir.resolve(SnapshotFormat.MANIFEST_FILE));
            } finally {
                Files.deleteIfExists(snapshotTmp);
                Files.deleteIfExists(metaTmp);
                Files.deleteIfExists(manifestTmp);
                Files.deleteIfExists(lock);
            }
        } catch (IOException e) {
            throw new SnapshotException("Failed to write snapshot for " + projectRoot, e);
        }
    }

    public Optional<byte[]> readSnapshot(Path projectRoot) {
        try {
            return Optional.of(Files.readAllBytes(directoryOf(projectRoot).resolve(SnapshotFormat.SNAPSHOT_FILE)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new SnapshotException("Failed to read snapshot for " + projectRoot, e);
        }
    }

    public Optional<StoredSnapshotMeta> readMeta(Path projectRoot) {
        return readJson(projectRoot, SnapshotFormat.META_FILE, StoredSnapshotMeta.class);
    }

    public Optional<FileManifest> readManifest(Path projectRoot) {
        return readJson(projectRoot, SnapshotFormat.MANIFEST_FILE, FileManifest.class);
    }

    /**
     * Cleans up a stale lock as a side effect.
     */
    public boolean exists(Path projectRoot) {
        if (!Files.isRegularFile(directoryOf(projectRoot).resolve(SnapshotFormat.SNAPSHOT_FILE))) {
            return false;
        }
        try {
            cleanStaleLock(projectRoot);
        } catch (IOException e) {
            log.debug("Could not check snapshot lock of {}: {}", projectRoot, e.getMessage());
        }
        return true;
    }

    /**
     * Removes the lock file if the PID it names is no longer running.
     *
     * @return true if a stale lock was removed
     */
    public boolean cleanStaleLock(Path projectRoot) throws IOException {
        Path lock = directoryOf(projectRoot).resolve(SnapshotFormat.LOCK_FILE);
        if (!Files.exists(lock)) {
            return false;
        }
        long pid;
        try {
            pid = Long.parseLong(Files.readString(lock).trim());
        } catch (NumberFormatException e) {
            pid = -1;
        }
        boolean alive = pid > 0 && ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
        if (alive) {
            return false;
        }
        log.info("Removing stale snapshot lock of {} (pid {})", projectRoot, pid);
        return Files.deleteIfExists(lock);
    }

    public boolean isLocked(Path projectRoot) {
        return Files.exists(directoryOf(projectRoot).resolve(SnapshotFormat.LOCK_FILE));
    }

    /**
     * Appends the snapshot directory to the project's .gitignore when missing.
     * Failures are logged, never thrown.
     */
    public void ensureGitignore(Path projectRoot) {
        Path gitignore = projectRoot.resolve(".gitignore");
        try {
            String content = Files.exists(gitignore) ? Files.readString(gitignore) : "";
            boolean present = content.lines()
                    .map(String::trim)
                    .anyMatch(l -> l.equals(GITIGNORE_ENTRY) || l.equals(SnapshotFormat.DIRECTORY));
            if (present) {
                return;
            }
            String prefix = content.isEmpty() || content.endsWith("\n") ? "" : "\n";
            Files.writeString(gitignore, prefix + "\n# code graph snapshot\n" + GITIGNORE_ENTRY + "\n",
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Could not update {}: {}", gitignore, e.getMessage());
        }
    }

    /**
     * Total size in bytes of the files in the snapshot directory.
     */
    public long diskUsage(Path projectRoot) {
        Path dir = directoryOf(projectRoot);
        if (!Files.isDirectory(dir)) {
            return 0L;
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile).mapToLong(FileSystemSnapshotStore::sizeOf).sum();
        } catch (IOException e) {
            throw new SnapshotException("Failed to measure " + dir, e);
        }
    }

    public void delete(Path projectRoot) {
        Path dir = directoryOf(projectRoot);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
            log.info("Deleted snapshot of {}", projectRoot);
        } catch (IOException e) {
            throw new SnapshotException("Failed to delete " + dir, e);
        }
    }

    /**
     * Direct subdirectories of {@code baseDir} that hold a snapshot.
     */
    public List<Path> listProjects(Path baseDir) {
        List<Path> projects = new ArrayList<>();
        if (!Files.isDirectory(baseDir)) {
            return projects;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(baseDir, Files::isDirectory)) {
            for (Path entry : entries) {
                if (exists(entry)) {
                    projects.add(entry);
                }
            }
        } catch (IOException e) {
            throw new SnapshotException("Failed to list projects under " + baseDir, e);
        }
        projects.sort(Comparator.naturalOrder());
        return projects;
    }

    private <T> Optional<T> readJson(Path projectRoot, String fileName, Class<T> type) {
        Path file = directoryOf(projectRoot).resolve(fileName);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new SnapshotException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    static Path tempFileOf(Path dir, String fileName) {
        return dir.resolve(fileName + ".tmp");
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0L;
        }
    }
}
