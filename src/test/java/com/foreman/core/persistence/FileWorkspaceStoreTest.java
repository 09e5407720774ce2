package com.foreman.core.persistence;

import com.foreman.core.resilience.RetryExecutor;
import com.foreman.core.resilience.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileWorkspaceStoreTest {

    @TempDir
    Path root;

    private List<String> retried;
    private FileWorkspaceStore store;

    @BeforeEach
    void setUp() {
        retried = new ArrayList<>();
        store = new FileWorkspaceStore(new RetryExecutor(RetryPolicy.DEFAULT, d -> { }, retried::add));
    }

    @Test
    @DisplayName("Write, read and append round trip through UTF-8 files")
    void writeReadAppend() {
        Path file = root.resolve("progress.log");
        store.writeString(file, "héllo\n");
        store.append(file, "wörld\n");
        assertEquals("héllo\nwörld\n", store.readString(file));
    }

    @Test
    @DisplayName("append creates a missing file")
    void appendCreates() {
        Path file = root.resolve("new.log");
        store.append(file, "line\n");
        assertEquals("line\n", store.readString(file));
    }

    @Test
    @DisplayName("Reading a missing file retries ENOENT, then fails with that code")
    void readMissing() {
        var ex = assertThrows(StoreException.class, () -> store.readString(root.resolve("nope.json")));
        assertEquals("ENOENT", ex.getCode());
        assertEquals(List.of("ENOENT", "ENOENT"), retried);
    }

    @Test
    @DisplayName("exists() answers false for a missing path without retrying")
    void existsDoesNotRetry() {
        assertFalse(store.exists(root.resolve("nope")));
        assertTrue(store.exists(root));
        assertTrue(retried.isEmpty());
    }

    @Test
    @DisplayName("remove deletes trees and ignores missing paths")
    void removeTree() throws Exception {
        Path dir = root.resolve("tasks/auth");
        store.ensureDirectory(dir);
        store.writeString(dir.resolve("login.json"), "{}");

        store.remove(root.resolve("tasks"));
        assertFalse(Files.exists(root.resolve("tasks")));
        assertDoesNotThrow(() -> store.remove(root.resolve("tasks")));
    }

    @Test
    @DisplayName("copy duplicates a directory tree")
    void copyTree() {
        Path source = root.resolve("tasks");
        store.ensureDirectory(source.resolve("auth"));
        store.writeString(source.resolve("index.json"), "{}");
        store.writeString(source.resolve("auth/login.json"), "{\"id\":\"auth.login\"}");

        Path target = root.resolve("archive/tasks");
        store.copy(source, target);

        assertEquals("{}", store.readString(target.resolve("index.json")));
        assertEquals("{\"id\":\"auth.login\"}", store.readString(target.resolve("auth/login.json")));
        assertTrue(store.exists(source.resolve("auth/login.json")));
    }

    @Test
    @DisplayName("list returns sorted entry names")
    void listSorted() {
        store.writeString(root.resolve("b.txt"), "");
        store.writeString(root.resolve("a.txt"), "");
        store.ensureDirectory(root.resolve("c"));
        assertEquals(List.of("a.txt", "b.txt", "c"), store.list(root));
    }
}
