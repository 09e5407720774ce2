package com.foreman.core.persistence;

import java.nio.file.Path;
import java.util.List;

/**
 * File operations the engine persists through. Implementations retry transient
 * faults and report what remains as {@link StoreException}.
 */
public interface WorkspaceStore {

    String readString(Path path);

    void writeString(Path path, String content);

    boolean exists(Path path);

    /** Creates the directory and any missing parents. */
    void ensureDirectory(Path path);

    /** Deletes a file or a directory tree. A missing path is not an error. */
    void remove(Path path);

    /** Names of the entries directly inside {@code directory}, sorted. */
    List<String> list(Path directory);

    /** Appends to a file, creating it if needed. */
    void append(Path path, String content);

    /** Copies a file or a directory tree, replacing existing files at the destination. */
    void copy(Path source, Path target);
}
