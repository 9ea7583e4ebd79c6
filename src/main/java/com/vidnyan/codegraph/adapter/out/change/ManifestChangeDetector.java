package com.vidnyan.codegraph.adapter.out.change;

import com.vidnyan.codegraph.adapter.out.scanner.FileHasher;
import com.vidnyan.codegraph.adapter.out.scanner.IgnoreRules;
import com.vidnyan.codegraph.adapter.out.scanner.ProjectFileScanner;
import com.vidnyan.codegraph.domain.model.DiffResult;
import com.vidnyan.codegraph.domain.model.FileManifest;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Detects changes by comparing the working tree with a recorded manifest.
 * A file whose mtime moved by more than the tolerance is re-hashed and counted
 * as modified only if its content hash differs.
 */
@Slf4j
public class ManifestChangeDetector {

    public static final long DEFAULT_MTIME_TOLERANCE_MS = 1000L;

    /** Recorded mtime that never matches a real one. */
    static final long UNKNOWN_MTIME = 0L;

    private final long mtimeToleranceMs;

    public ManifestChangeDetector() {
        this(DEFAULT_MTIME_TOLERANCE_MS);
    }

    public ManifestChangeDetector(long mtimeToleranceMs) {
        this.mtimeToleranceMs = mtimeToleranceMs;
    }

    public DiffResult detect(Path projectRoot, FileManifest manifest) {
        Map<String, Long> current = walk(projectRoot);
        Set<String> remaining = new HashSet<>(manifest.files().keySet());
        DiffResult.Builder diff = DiffResult.builder().gitRepo(false);

        for (Map.Entry<String, Long> file : current.entrySet()) {
            String path = file.getKey();
            FileManifest.Entry recorded = manifest.get(path).orElse(null);
            if (recorded == null) {
                if (ProjectFileScanner.readIndexable(projectRoot.resolve(path)).isPresent()) {
                    diff.added(path);
                }
                continue;
            }
            remaining.remove(path);
            if (Math.abs(file.getValue() - recorded.mtime()) > mtimeToleranceMs) {
                try {
                    if (!FileHasher.hashFile(projectRoot.resolve(path)).equals(recorded.hash())) {
                        diff.modified(path);
                    }
                } catch (IOException e) {
                    log.debug("Cannot hash {}, treating as modified: {}", path, e.getMessage());
                    diff.modified(path);
                }
            }
        }
        remaining.forEach(diff::deleted);

        DiffResult result = diff.build();
        log.debug("Manifest change detection: {}", result);
        return result;
    }

    /**
     * Hashes each content and stamps it with the file's mtime. Paths no longer
     * on disk are left out.
     * <p>
     * A file edited on disk since its content was read gets {@link #UNKNOWN_MTIME},
     * so the next {@link #detect} re-hashes it instead of trusting the mtime.
     */
    public FileManifest buildManifest(Path projectRoot, Map<String, String> fileContents) {
        FileManifest.Builder manifest = FileManifest.builder();
        fileContents.forEach((path, content) -> {
            Path file = projectRoot.resolve(path);
            try {
                long mtime = Files.getLastModifiedTime(file).toMillis();
                String hash = FileHasher.hash(content);
                if (!FileHasher.hashFile(file).equals(hash)) {
                    log.debug("{} changed on disk after it was read", path);
                    mtime = UNKNOWN_MTIME;
                }
                manifest.put(path, hash, mtime);
            } catch (IOException e) {
                log.debug("Leaving {} out of the manifest: {}", path, e.getMessage());
            }
        });
        return manifest.build();
    }

    /**
     * Project-relative path → mtime of every tracked file. Files too large for
     * the scanner are left out.
     */
    static Map<String, Long> walk(Path root) {
        Map<String, Long> files = new TreeMap<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && IgnoreRules.isIgnoredDirectory(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && attrs.size() <= ProjectFileScanner.MAX_FILE_BYTES
                            && !IgnoreRules.isIgnoredFile(file.getFileName().toString())) {
                        files.put(FileHasher.relativePath(root, file), attrs.lastModifiedTime().toMillis());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new ChangeDetectionException("Failed to walk " + root, e);
        }
        return files;
    }
}
