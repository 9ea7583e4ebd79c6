package com.vidnyan.codegraph.adapter.out.change;

import com.vidnyan.codegraph.adapter.out.scanner.FileHasher;
import com.vidnyan.codegraph.adapter.out.scanner.ProjectFileScanner;
import com.vidnyan.codegraph.domain.model.DiffResult;
import com.vidnyan.codegraph.domain.model.FileManifest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ManifestChangeDetectorTest {

    @TempDir
    Path tempDir;

    private final ManifestChangeDetector detector = new ManifestChangeDetector();

    private FileManifest writeProject() throws IOException {
        Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(tempDir.resolve("src/a.ts"), "export function foo() { return 1; }\n");
        Files.writeString(tempDir.resolve("src/b.ts"), "export function bar() { return 2; }\n");
        return detector.buildManifest(tempDir, Map.of(
                "src/a.ts", Files.readString(tempDir.resolve("src/a.ts")),
                "src/b.ts", Files.readString(tempDir.resolve("src/b.ts"))));
    }

    @Test
    void detect_ShouldReportNothingForUntouchedProject() throws IOException {
        FileManifest manifest = writeProject();

        DiffResult diff = detector.detect(tempDir, manifest);

        assertTrue(diff.isEmpty());
        assertFalse(diff.isGitRepo());
    }

    @Test
    void detect_ShouldClassifyAddedModifiedAndDeleted() throws IOException {
        // Arrange
        FileManifest manifest = writeProject();
        Path a = tempDir.resolve("src/a.ts");
        Files.writeString(a, "export function foo() { return 42; }\n");
        Files.setLastModifiedTime(a, FileTime.fromMillis(Files.getLastModifiedTime(a).toMillis() + 10_000));
        Files.delete(tempDir.resolve("src/b.ts"));
        Files.writeString(tempDir.resolve("src/c.ts"), "export const c = 3;\n");

        // Act
        DiffResult diff = detector.detect(tempDir, manifest);

        // Assert
        assertEquals(Set.of("src/c.ts"), diff.added());
        assertEquals(Set.of("src/a.ts"), diff.modified());
        assertEquals(Set.of("src/b.ts"), diff.deleted());
    }

    @Test
    void detect_ShouldIgnoreTouchWithoutContentChange() throws IOException {
        FileManifest manifest = writeProject();
        Path a = tempDir.resolve("src/a.ts");
        Files.setLastModifiedTime(a, FileTime.fromMillis(Files.getLastModifiedTime(a).toMillis() + 60_000));

        DiffResult diff = detector.detect(tempDir, manifest);

        assertTrue(diff.isEmpty());
    }

    @Test
    void detect_ShouldNotRehashWithinMtimeTolerance() throws IOException {
        // a recorded hash that no longer matches, but the mtime is within tolerance
        Files.writeString(tempDir.resolve("a.py"), "def foo():\n    pass\n");
        long mtime = Files.getLastModifiedTime(tempDir.resolve("a.py")).toMillis();
        FileManifest manifest = FileManifest.builder()
                .put("a.py", FileHasher.hash("something else"), mtime - 500)
                .build();

        DiffResult diff = detector.detect(tempDir, manifest);

        assertTrue(diff.modified().isEmpty());
    }

    @Test
    void detect_ShouldSkipIgnoredDirectoriesAndSnapshotDirectory() throws IOException {
        FileManifest manifest = writeProject();
        Files.createDirectories(tempDir.resolve("node_modules/lib"));
        Files.writeString(tempDir.resolve("node_modules/lib/index.js"), "module.exports = {};\n");
        Files.createDirectories(tempDir.resolve(".codegraph"));
        Files.write(tempDir.resolve(".codegraph/snapshot.bin"), new byte[]{1, 2, 3});

        DiffResult diff = detector.detect(tempDir, manifest);

        assertTrue(diff.isEmpty());
    }

    @Test
    void detect_ShouldRehashFileEditedBetweenReadAndManifest() throws IOException {
        // Arrange
        Path a = tempDir.resolve("a.ts");
        String original = "export function foo() { return 1; }\n";
        Files.writeString(a, original);
        Files.setLastModifiedTime(a, FileTime.fromMillis(1_000_000));
        Files.writeString(a, "export function foo() { return 2; }\n");
        Files.setLastModifiedTime(a, FileTime.fromMillis(5_000_000));

        // Act
        FileManifest manifest = detector.buildManifest(tempDir, Map.of("a.ts", original));
        DiffResult diff = detector.detect(tempDir, manifest);

        // Assert
        assertEquals(FileHasher.hash(original), manifest.get("a.ts").orElseThrow().hash());
        assertEquals(Set.of("a.ts"), diff.modified());
    }

    @Test
    void detect_ShouldNotReportFilesTheScannerSkips() throws IOException {
        // Arrange
        FileManifest manifest = writeProject();
        Files.write(tempDir.resolve("src/blob.ts"), "export\0const x = 1;\n".getBytes(StandardCharsets.UTF_8));
        Files.write(tempDir.resolve("src/huge.ts"), new byte[(int) ProjectFileScanner.MAX_FILE_BYTES + 1]);

        // Act
        DiffResult first = detector.detect(tempDir, manifest);
        DiffResult second = detector.detect(tempDir, manifest);

        // Assert
        assertTrue(first.isEmpty(), () -> "unexpected changes " + first);
        assertTrue(second.isEmpty());
    }
}
