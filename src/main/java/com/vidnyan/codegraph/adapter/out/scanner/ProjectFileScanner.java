package com.vidnyan.codegraph.adapter.out.scanner;

import com.vidnyan.codegraph.application.port.out.ProjectFiles;
import com.vidnyan.codegraph.domain.model.FileEntry;
import com.vidnyan.codegraph.exception.CodeGraphException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Scans a project directory for text files.
 * Ignored directories are not descended into; binary and oversized files are skipped.
 */
@Slf4j
@Component
public class ProjectFileScanner implements ProjectFiles {

    public static final long MAX_FILE_BYTES = 2L * 1024 * 1024;

    @Override
    public List<FileEntry> scan(Path projectRoot) {
        if (!Files.isDirectory(projectRoot)) {
            throw new CodeGraphException("Not a directory: " + projectRoot);
        }
        List<String> paths = discover(projectRoot);
        List<FileEntry> entries = new ArrayList<>();
        read(projectRoot, paths).forEach((path, content) -> entries.add(new FileEntry(path, content)));
        entries.sort(Comparator.comparing(FileEntry::path));
        log.info("Scanned {}: {} files", projectRoot, entries.size());
        return entries;
    }

    @Override
    public Map<String, String> read(Path projectRoot, Collection<String> paths) {
        Map<String, String> contents = new LinkedHashMap<>();
        for (String path : new TreeSet<>(paths)) {
            readIndexable(projectRoot.resolve(path)).ifPresent(content -> contents.put(path, content));
        }
        return contents;
    }

    @Override
    public boolean exists(Path projectRoot, String path) {
        return Files.isRegularFile(projectRoot.resolve(path));
    }

    private List<String> discover(Path root) {
        List<String> paths = new ArrayList<>();
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
                    if (attrs.isRegularFile() && !IgnoreRules.isIgnoredFile(file.getFileName().toString())) {
                        paths.add(FileHasher.relativePath(root, file));
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
            throw new CodeGraphException("Failed to scan " + root, e);
        }
        return paths;
    }

    /**
     * Text of a file that would be indexed; empty for missing, unreadable,
     * oversized or binary files.
     */
    public static Optional<String> readIndexable(Path file) {
        try {
            if (!Files.isRegularFile(file) || Files.size(file) > MAX_FILE_BYTES) {
                return Optional.empty();
            }
            String content = FileHasher.readText(file);
            if (content.indexOf('\0') >= 0) {
                log.debug("Skipping binary file {}", file);
                return Optional.empty();
            }
            return Optional.of(content);
        } catch (IOException e) {
            log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
