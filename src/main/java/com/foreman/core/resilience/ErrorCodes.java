package com.foreman.core.resilience;

import java.io.InterruptedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.util.Locale;
import java.util.Set;

/**
 * Maps Java I/O exceptions onto errno-style codes so retry allow-lists can be
 * expressed the same way regardless of which layer raised the error.
 */
public final class ErrorCodes {

    public static final String EBUSY = "EBUSY";
    public static final String ENOENT = "ENOENT";
    public static final String EAGAIN = "EAGAIN";
    public static final String ETIMEDOUT = "ETIMEDOUT";
    public static final String EACCES = "EACCES";
    public static final String EEXIST = "EEXIST";
    public static final String ENOTDIR = "ENOTDIR";
    public static final String ENOTEMPTY = "ENOTEMPTY";
    public static final String EIO = "EIO";

    /** Codes retried by default: resource busy, not yet available, would block, timed out. */
    public static final Set<String> TRANSIENT = Set.of(EBUSY, ENOENT, EAGAIN, ETIMEDOUT);

    private ErrorCodes() {}

    /**
     * Returns the code for {@code error}, or null if it has none.
     */
    public static String codeOf(Throwable error) {
        if (error instanceof CodedException coded) {
            return coded.getCode();
        }
        if (error instanceof NoSuchFileException) return ENOENT;
        if (error instanceof AccessDeniedException) return EACCES;
        if (error instanceof FileAlreadyExistsException) return EEXIST;
        if (error instanceof NotDirectoryException) return ENOTDIR;
        if (error instanceof DirectoryNotEmptyException) return ENOTEMPTY;
        if (error instanceof InterruptedIOException) return ETIMEDOUT;
        if (error instanceof FileSystemException fse && fse.getReason() != null) {
            String reason = fse.getReason().toLowerCase(Locale.ROOT);
            if (reason.contains("busy")) return EBUSY;
            if (reason.contains("temporarily unavailable") || reason.contains("try again")) return EAGAIN;
            if (reason.contains("timed out")) return ETIMEDOUT;
        }
        return null;
    }
}
