package com.foreman.core.service;

import com.foreman.core.model.Phase;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of {@link StateService#archiveSession(boolean)}.
 *
 * @param archived      whether anything was moved into the archive
 * @param archivePath   the archive directory, or null
 * @param files         names of the archived entries
 * @param blocked       true when an unfinished session was left in place
 * @param blockedReason why the archive was refused, or null
 * @param currentPhase  phase of the refused session, or null
 */
public record ArchiveResult(
        boolean archived,
        Path archivePath,
        List<String> files,
        boolean blocked,
        String blockedReason,
        Phase currentPhase
) {

    public ArchiveResult {
        files = files == null ? List.of() : List.copyOf(files);
    }

    static ArchiveResult nothingToArchive() {
        return new ArchiveResult(false, null, List.of(), false, null, null);
    }

    static ArchiveResult refused(Phase phase) {
        return new ArchiveResult(false, null, List.of(), true,
                "Session is in \"" + phase + "\" phase. Use --force to archive incomplete session.", phase);
    }

    static ArchiveResult archived(Path archivePath, List<String> files) {
        return new ArchiveResult(true, archivePath, files, false, null, null);
    }
}
