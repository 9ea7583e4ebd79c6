package com.vidnyan.codegraph.adapter.out.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vidnyan.codegraph.domain.model.FileManifest;
import com.vidnyan.codegraph.domain.snapshot.SnapshotFormat;
import com.vidnyan.codegraph.domain.snapshot.SnapshotLoadResult;
import com.vidnyan.codegraph.domain.snapshot.SnapshotLoadResult.Status;
import com.vidnyan.codegraph.domain.snapshot.SnapshotPayload;
import com.vidnyan.codegraph.domain.snapshot.SnapshotSaveResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignedSnapshotStoreTest {

    @TempDir
    Path tempDir;

    private Path project;
    private Path keyDir;
    private SignedSnapshotStore store;

    @BeforeEach
    void setUp() throws IOException {
        project = Files.createDirectories(tempDir.resolve("project"));
        keyDir = tempDir.resolve("keys");
        store = SnapshotFixtures.store(keyDir, SnapshotFixtures.APP_VERSION);
    }

    private Path snapshotFile(String name) {
        return project.resolve(SnapshotFormat.DIRECTORY).resolve(name);
    }

    private void saveFixture() {
        SnapshotSaveResult saved = store.save(project, SnapshotFixtures.payload(),
                FileManifest.builder().put("a.ts", "abc", 1L).build());
        assertTrue(saved.success(), saved.error());
    }

    @Test
    void load_ShouldReturnSavedPayload() {
        // Arrange
        SnapshotPayload payload = SnapshotFixtures.payload();
        saveFixture();

        // Act
        SnapshotLoadResult loaded = store.load(project);

        // Assert
        assertEquals(Status.VALID, loaded.status());
        assertEquals(payload.nodes(), loaded.payload().nodes());
        assertEquals(payload.relationships(), loaded.payload().relationships());
        assertEquals(payload.fileContents(), loaded.payload().fileContents());
        assertTrue(Files.exists(snapshotFile(SnapshotFormat.SNAPSHOT_FILE)));
        assertTrue(Files.exists(snapshotFile(SnapshotFormat.META_FILE)));
        assertTrue(Files.exists(snapshotFile(SnapshotFormat.MANIFEST_FILE)));
        assertFalse(Files.exists(snapshotFile(SnapshotFormat.LOCK_FILE)));
        assertEquals("abc", store.loadManifest(project).orElseThrow().get("a.ts").orElseThrow().hash());
    }

    @Test
    void load_ShouldReportMissingSnapshot() {
        SnapshotLoadResult loaded = store.load(project);

        assertEquals(Status.MISSING, loaded.status());
        assertNull(loaded.payload());
    }

    @Test
    void load_ShouldDetectTamperedSnapshot() throws IOException {
        // Arrange
        saveFixture();
        Path bin = snapshotFile(SnapshotFormat.SNAPSHOT_FILE);
        byte[] data = Files.readAllBytes(bin);
        data[data.length / 2] ^= 0x01;
        Files.write(bin, data);

        // Act
        SnapshotLoadResult loaded = store.load(project);

        // Assert
        assertEquals(Status.INTEGRITY_FAILURE, loaded.status());
        assertFalse(loaded.isValid());
    }

    @Test
    void load_ShouldRejectSnapshotSignedWithAnotherKey() {
        saveFixture();
        SignedSnapshotStore otherMachine = SnapshotFixtures.store(tempDir.resolve("other-keys"),
                SnapshotFixtures.APP_VERSION);

        assertEquals(Status.INTEGRITY_FAILURE, otherMachine.load(project).status());
    }

    @Test
    void load_ShouldReportFormatMismatchWithoutThrowing() throws IOException {
        // Arrange
        saveFixture();
        Path meta = snapshotFile(SnapshotFormat.META_FILE);
        ObjectMapper mapper = SnapshotFixtures.objectMapper();
        ObjectNode json = (ObjectNode) mapper.readTree(meta.toFile());
        json.put("formatVersion", SnapshotFormat.FORMAT_VERSION + 1);
        mapper.writeValue(meta.toFile(), json);

        // Act
        SnapshotLoadResult loaded = assertDoesNotThrow(() -> store.load(project));

        // Assert
        assertEquals(Status.FORMAT_MISMATCH, loaded.status());
    }

    @Test
    void load_ShouldReportVersionMismatch() {
        saveFixture();
        SignedSnapshotStore newerApp = SnapshotFixtures.store(keyDir, "2.0.0");

        SnapshotLoadResult loaded = newerApp.load(project);

        assertEquals(Status.VERSION_MISMATCH, loaded.status());
    }

    @Test
    void load_ShouldReportCorruptMetaWithoutThrowing() throws IOException {
        saveFixture();
        Files.writeString(snapshotFile(SnapshotFormat.META_FILE), "{ not json");

        SnapshotLoadResult loaded = assertDoesNotThrow(() -> store.load(project));

        assertFalse(loaded.isValid());
    }

    @Test
    void exists_ShouldCleanStaleLock() throws IOException {
        // Arrange
        saveFixture();
        Path lock = snapshotFile(SnapshotFormat.LOCK_FILE);
        Files.writeString(lock, String.valueOf(Long.MAX_VALUE));

        // Act
        boolean exists = store.exists(project);

        // Assert
        assertTrue(exists);
        assertFalse(Files.exists(lock));
    }

    @Test
    void save_ShouldFailWhileLiveProcessHoldsLock() throws IOException {
        saveFixture();
        Files.writeString(snapshotFile(SnapshotFormat.LOCK_FILE), String.valueOf(ProcessHandle.current().pid()));
        byte[] before = Files.readAllBytes(snapshotFile(SnapshotFormat.SNAPSHOT_FILE));

        SnapshotSaveResult result = store.save(project, SnapshotFixtures.payload(), FileManifest.empty());

        assertFalse(result.success());
        assertNotNull(result.error());
        assertArrayEquals(before, Files.readAllBytes(snapshotFile(SnapshotFormat.SNAPSHOT_FILE)));
    }

    @Test
    void save_ShouldKeepPreviousSnapshotWhenMetaCannotBeWritten() throws IOException {
        // Arrange
        saveFixture();
        byte[] before = Files.readAllBytes(snapshotFile(SnapshotFormat.SNAPSHOT_FILE));
        Files.createDirectories(FileSystemSnapshotStore.tempFileOf(
                project.resolve(SnapshotFormat.DIRECTORY), SnapshotFormat.META_FILE));
        SnapshotPayload original = SnapshotFixtures.payload();
        SnapshotPayload edited = new SnapshotPayload(original.meta(), original.nodes(), original.relationships(),
                Map.of("a.ts", "export function foo() { return 2; }\n"), original.embeddings());

        // Act
        SnapshotSaveResult result = store.save(project, edited, FileManifest.builder().put("a.ts", "def", 2L).build());

        // Assert
        assertFalse(result.success());
        assertEquals(0L, result.size());
        assertArrayEquals(before, Files.readAllBytes(snapshotFile(SnapshotFormat.SNAPSHOT_FILE)));
        SnapshotLoadResult loaded = store.load(project);
        assertEquals(Status.VALID, loaded.status());
        assertEquals(original.fileContents(), loaded.payload().fileContents());
        assertEquals("abc", store.loadManifest(project).orElseThrow().get("a.ts").orElseThrow().hash());
        assertFalse(Files.exists(snapshotFile(SnapshotFormat.LOCK_FILE)));
    }

    @Test
    void save_ShouldAddSnapshotDirectoryToGitignoreOnce() throws IOException {
        Files.writeString(project.resolve(".gitignore"), "node_modules/\n");

        saveFixture();
        saveFixture();

        List<String> lines = Files.readAllLines(project.resolve(".gitignore"));
        assertEquals(1, lines.stream().filter(l -> l.trim().equals(SnapshotFormat.DIRECTORY + "/")).count());
        assertTrue(lines.contains("node_modules/"));
    }

    @Test
    void delete_ShouldRemoveSnapshotDirectory() {
        saveFixture();
        assertTrue(store.diskUsage(project) > 0);

        store.delete(project);

        assertFalse(store.exists(project));
        assertFalse(Files.exists(project.resolve(SnapshotFormat.DIRECTORY)));
        assertEquals(Status.MISSING, store.load(project).status());
    }

    @Test
    void listProjects_ShouldFindProjectsWithSnapshots() throws IOException {
        saveFixture();
        Files.createDirectories(tempDir.resolve("no-snapshot"));

        List<Path> projects = store.listProjects(tempDir);

        assertEquals(1, projects.size());
        assertEquals(project.getFileName(), projects.get(0).getFileName());
    }
}
