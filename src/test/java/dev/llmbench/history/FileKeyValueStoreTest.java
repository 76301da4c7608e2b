package dev.llmbench.history;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileKeyValueStoreTest {
    @TempDir Path tempDir;

    @Test
    void missingKeyIsEmpty() {
        assertEquals(Optional.empty(), new FileKeyValueStore(tempDir).get("benchmarkHistory"));
    }

    @Test
    void setCreatesDirectoryAndOverwrites() throws Exception {
        var dir = tempDir.resolve("nested").resolve("history");
        var store = new FileKeyValueStore(dir);

        store.set("benchmarkHistory", "[1]");
        store.set("benchmarkHistory", "[2]");

        assertEquals(Optional.of("[2]"), store.get("benchmarkHistory"));
        assertEquals("[2]", Files.readString(dir.resolve("benchmarkHistory.json")));
        try (var files = Files.list(dir)) {
            assertEquals(1, files.count(), "temp files are cleaned up");
        }
    }

    @Test
    void valuesSurviveNewInstance() {
        new FileKeyValueStore(tempDir).set("runs", "[]");
        assertEquals(Optional.of("[]"), new FileKeyValueStore(tempDir).get("runs"));
    }

    @Test
    void removeDeletesValue() {
        var store = new FileKeyValueStore(tempDir);
        store.set("runs", "[]");
        store.remove("runs");
        store.remove("runs");
        assertTrue(store.get("runs").isEmpty());
    }

    @Test
    void rejectsKeysThatEscapeTheDirectory() {
        var store = new FileKeyValueStore(tempDir);
        assertThrows(IllegalArgumentException.class, () -> store.get("../secrets"));
        assertThrows(IllegalArgumentException.class, () -> store.set("a/b", "x"));
    }

    @Test
    void unreadableValueIsStoreFailure() throws Exception {
        Files.createDirectories(tempDir.resolve("runs.json"));
        var store = new FileKeyValueStore(tempDir);
        assertThrows(HistoryStoreException.class, () -> store.get("runs"));
    }
}
