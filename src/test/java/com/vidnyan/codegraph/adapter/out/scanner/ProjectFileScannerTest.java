package com.vidnyan.codegraph.adapter.out.scanner;

import com.vidnyan.codegraph.domain.model.FileEntry;
import com.vidnyan.codegraph.exception.CodeGraphException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProjectFileScannerTest {

    @TempDir
    Path tempDir;

    private final ProjectFileScanner scanner = new ProjectFileScanner();

    @Test
    void scan_ShouldFindSourceFilesAndSkipIgnoredOnes() throws IOException {
        // Arrange
        Path mainJava = tempDir.resolve("src/main/java/com/example");
        Files.createDirectories(mainJava);
        Files.writeString(mainJava.resolve("Test1.java"), "public class Test1 {}");
        Files.writeString(tempDir.resolve("index.ts"), "export const x = 1;");
        Files.writeString(tempDir.resolve("notes.txt"), "documentation");

        Files.createDirectories(tempDir.resolve("node_modules/lib"));
        Files.writeString(tempDir.resolve("node_modules/lib/index.js"), "module.exports = {};");
        Files.createDirectories(tempDir.resolve(".codegraph"));
        Files.writeString(tempDir.resolve(".codegraph/meta.json"), "{}");
        Files.writeString(tempDir.resolve("package-lock.json"), "{}");
        Files.writeString(tempDir.resolve("logo.png"), "not really a png");
        Files.writeString(tempDir.resolve(".env"), "SECRET=1");
        Files.write(tempDir.resolve("blob.ts"), new byte[]{'a', 0, 'b'});

        // Act
        List<FileEntry> results = scanner.scan(tempDir);

        // Assert
        assertEquals(List.of("index.ts", "notes.txt", "src/main/java/com/example/Test1.java"),
                results.stream().map(FileEntry::path).toList());
        assertEquals("public class Test1 {}", results.get(2).content());
    }

    @Test
    void scan_ShouldRejectMissingDirectory() {
        assertThrows(CodeGraphException.class, () -> scanner.scan(tempDir.resolve("missing")));
    }

    @Test
    void read_ShouldSkipFilesThatCannotBeRead() throws IOException {
        Files.writeString(tempDir.resolve("a.ts"), "export const a = 1;");

        Map<String, String> contents = scanner.read(tempDir, Set.of("a.ts", "gone.ts"));

        assertEquals(Map.of("a.ts", "export const a = 1;"), contents);
        assertTrue(scanner.exists(tempDir, "a.ts"));
        assertFalse(scanner.exists(tempDir, "gone.ts"));
    }
}
