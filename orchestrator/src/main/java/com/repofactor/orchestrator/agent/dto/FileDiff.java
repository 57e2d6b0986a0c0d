package com.repofactor.orchestrator.agent.dto;

import java.util.List;

/**
 * Unified diff of a single file plus its line counts.
 *
 * changeSummary is a short description of the change:
 * "File Added", "File Removed" or "Lines Changed: n" (n = diff lines).
 */
public record FileDiff(String path,
                       String diffText,
                       int linesAdded,
                       int linesRemoved,
                       List<String> changeSummary) {

    public static final String FILE_ADDED   = "File Added";
    public static final String FILE_REMOVED = "File Removed";

    public FileDiff {
        changeSummary = changeSummary == null ? List.of() : List.copyOf(changeSummary);
    }
}
