package com.foreman.core.persistence;

import com.foreman.core.resilience.ErrorCodes;
import com.foreman.core.resilience.IoOperation;
import com.foreman.core.resilience.RetryExecutor;
import com.foreman.core.resilience.RetryPolicy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link WorkspaceStore} on the local file system. Every call is wrapped
 * individually by the {@link RetryExecutor}.
 */
public class FileWorkspaceStore implements WorkspaceStore {

    private final RetryExecutor retry;
    private final RetryPolicy existsPolicy;

    public FileWorkspaceStore(RetryExecutor retry) {
        this.retry = retry;
        // a missing path is the answer for exists(), not a fault to wait out
        Set<String> codes = new HashSet<>(retry.getDefaultPolicy().retryableErrors());
        codes.remove(ErrorCodes.ENOENT);
        this.existsPolicy = retry.getDefaultPolicy().withRetryableErrors(codes);
    }

    @Override
    public String readString(Path path) {
        return run("read " + path, () -> Files.readString(path, StandardCharsets.UTF_8));
    }

    @Override
    public void writeString(Path path, String content) {
        run("write " + path, () -> Files.writeString(path, content, StandardCharsets.UTF_8));
    }

    @Override
    public boolean exists(Path path) {
        try {
            return retry.execute(() -> {
                if (!Files.exists(path) && !Files.notExists(path)) {
                    throw new IOException("Cannot determine whether " + path + " exists");
                }
                return Files.exists(path);
            }, existsPolicy);
        } catch (IOException e) {
            throw wrap("check " + path, e);
        }
    }

    @Override
    public void ensureDirectory(Path path) {
        run("create directory " + path, () -> Files.createDirectories(path));
    }

    @Override
    public void remove(Path path) {
        run("remove " + path, () -> {
            if (!Files.exists(path)) {
                return null;
            }
            Files.walkFileTree(path, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    if (exc != null) {
                        throw exc;
                    }
                    Files.delete(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
            return null;
        });
    }

    @Override
    public List<String> list(Path directory) {
        return run("list " + directory, () -> {
            var names = new ArrayList<String>();
            try (var entries = Files.newDirectoryStream(directory)) {
                for (Path entry : entries) {
                    names.add(entry.getFileName().toString());
                }
            }
            Collections.sort(names);
            return names;
        });
    }

    @Override
    public void append(Path path, String content) {
        run("append " + path, () -> Files.writeString(path, content, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND));
    }

    @Override
    public void copy(Path source, Path target) {
        run("copy " + source + " to " + target, () -> {
            if (!Files.isDirectory(source)) {
                Path parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                return Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
            Files.walkFileTree(source, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                    Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.copy(file, target.resolve(source.relativize(file).toString()),
                            StandardCopyOption.REPLACE_EXISTING);
                    return FileVisitResult.CONTINUE;
                }
            });
            return target;
        });
    }

    private <T> T run(String description, IoOperation<T> operation) {
        try {
            return retry.execute(operation);
        } catch (IOException e) {
            throw wrap(description, e);
        }
    }

    private static StoreException wrap(String description, IOException e) {
        String code = ErrorCodes.codeOf(e);
        return new StoreException(code != null ? code : ErrorCodes.EIO,
                "Failed to " + description + ": " + e.getMessage(), e);
    }
}
