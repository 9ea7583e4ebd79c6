package com.vidnyan.codegraph.adapter.out.change;

import com.vidnyan.codegraph.adapter.out.scanner.ProjectFileScanner;
import com.vidnyan.codegraph.domain.model.DiffResult;
import com.vidnyan.codegraph.domain.model.FileEntry;
import com.vidnyan.codegraph.domain.model.FileManifest;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.revwalk.RevCommit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GitChangeDetectorTest {

    @TempDir
    Path tempDir;

    private final GitChangeDetector gitDetector = new GitChangeDetector();

    private String commitAll(Git git, String message) throws Exception {
        git.add().addFilepattern(".").call();
        RevCommit commit = git.commit()
                .setMessage(message)
                .setAuthor("Test", "test@example.com")
                .setCommitter("Test", "test@example.com")
                .setSign(false)
                .call();
        return commit.getName();
    }

    @Test
    void detect_ShouldReportChangesSinceCommit() throws Exception {
        try (Git git = Git.init().setDirectory(tempDir.toFile()).call()) {
            // Arrange
            Files.writeString(tempDir.resolve("a.ts"), "export function foo() { return 1; }\n");
            Files.writeString(tempDir.resolve("b.ts"), "export function bar() { return 2; }\n");
            String commit = commitAll(git, "initial");

            Files.writeString(tempDir.resolve("b.ts"), "export function bar() { return 3; }\n");
            Files.delete(tempDir.resolve("a.ts"));
            Files.createDirectories(tempDir.resolve("lib"));
            Files.writeString(tempDir.resolve("lib/c.ts"), "export const c = 1;\n");

            // Act
            DiffResult diff = gitDetector.detect(tempDir, commit);

            // Assert
            assertTrue(diff.isGitRepo());
            assertEquals(Set.of("lib/c.ts"), diff.added());
            assertEquals(Set.of("b.ts"), diff.modified());
            assertEquals(Set.of("a.ts"), diff.deleted());
        }
    }

    @Test
    void detect_ShouldIgnoreSnapshotDirectoryAndIgnoredFiles() throws Exception {
        try (Git git = Git.init().setDirectory(tempDir.toFile()).call()) {
            Files.writeString(tempDir.resolve("a.ts"), "export function foo() {}\n");
            String commit = commitAll(git, "initial");

            Files.createDirectories(tempDir.resolve(".codegraph"));
            Files.write(tempDir.resolve(".codegraph/snapshot.bin"), new byte[]{1, 2, 3});
            Files.writeString(tempDir.resolve("package-lock.json"), "{}");

            DiffResult diff = gitDetector.detect(tempDir, commit);

            assertTrue(diff.isEmpty());
        }
    }

    @Test
    void detect_ShouldFailForUnknownCommit() throws Exception {
        try (Git git = Git.init().setDirectory(tempDir.toFile()).call()) {
            Files.writeString(tempDir.resolve("a.ts"), "export function foo() {}\n");
            commitAll(git, "initial");

            assertThrows(ChangeDetectionException.class,
                    () -> gitDetector.detect(tempDir, "0123456789abcdef0123456789abcdef01234567"));
        }
    }

    @Test
    void headCommit_ShouldBeEmptyOutsideRepository() {
        assertEquals(Optional.empty(), gitDetector.headCommit(tempDir));
    }

    @Test
    void gitAndManifestStrategies_ShouldAgree() throws Exception {
        try (Git git = Git.init().setDirectory(tempDir.toFile()).call()) {
            // Arrange
            Files.writeString(tempDir.resolve("a.py"), "def foo():\n    return 1\n");
            Files.writeString(tempDir.resolve("b.py"), "def bar():\n    return 2\n");
            String commit = commitAll(git, "initial");
            ManifestChangeDetector manifestDetector = new ManifestChangeDetector();
            FileManifest manifest = manifestDetector.buildManifest(tempDir, Map.of(
                    "a.py", Files.readString(tempDir.resolve("a.py")),
                    "b.py", Files.readString(tempDir.resolve("b.py"))));

            Path a = tempDir.resolve("a.py");
            Files.writeString(a, "def foo():\n    return 10\n");
            Files.setLastModifiedTime(a, FileTime.fromMillis(Files.getLastModifiedTime(a).toMillis() + 10_000));
            Files.writeString(tempDir.resolve("c.py"), "def baz():\n    pass\n");

            ProjectChangeDetector detector = new ProjectChangeDetector(gitDetector, manifestDetector);

            // Act
            DiffResult viaGit = detector.detectChanges(tempDir, commit, manifest);
            DiffResult viaManifest = detector.detectChanges(tempDir, null, manifest);

            // Assert
            assertTrue(viaGit.isGitRepo());
            assertFalse(viaManifest.isGitRepo());
            assertEquals(viaManifest.added(), viaGit.added());
            assertEquals(viaManifest.modified(), viaGit.modified());
            assertEquals(viaManifest.deleted(), viaGit.deleted());
            assertEquals(Set.of("a.py"), viaGit.modified());
        }
    }

    @Test
    void gitAndManifestStrategies_ShouldAgreeOnCommittedBinaryFile() throws Exception {
        try (Git git = Git.init().setDirectory(tempDir.toFile()).call()) {
            // Arrange
            Files.writeString(tempDir.resolve("a.ts"), "export function foo() { return 1; }\n");
            Files.write(tempDir.resolve("blob.ts"), "export\0const x = 1;\n".getBytes(StandardCharsets.UTF_8));
            String commit = commitAll(git, "initial");
            ManifestChangeDetector manifestDetector = new ManifestChangeDetector();
            Map<String, String> scanned = new ProjectFileScanner().scan(tempDir).stream()
                    .collect(Collectors.toMap(FileEntry::path, FileEntry::content));
            FileManifest manifest = manifestDetector.buildManifest(tempDir, scanned);
            ProjectChangeDetector detector = new ProjectChangeDetector(gitDetector, manifestDetector);

            // Act
            DiffResult viaGit = detector.detectChanges(tempDir, commit, manifest);
            DiffResult viaManifest = detector.detectChanges(tempDir, null, manifest);

            // Assert
            assertEquals(Set.of("a.ts"), scanned.keySet());
            assertTrue(viaGit.isEmpty());
            assertTrue(viaManifest.isEmpty(), () -> "manifest reported " + viaManifest);
        }
    }

    @Test
    void detectChanges_ShouldFallBackToManifestWhenNotARepository() throws Exception {
        Files.writeString(tempDir.resolve("a.py"), "def foo():\n    pass\n");
        ProjectChangeDetector detector = new ProjectChangeDetector(gitDetector, new ManifestChangeDetector());

        DiffResult diff = detector.detectChanges(tempDir, "deadbeef", FileManifest.empty());

        assertFalse(diff.isGitRepo());
        assertEquals(Set.of("a.py"), diff.added());
    }
}
