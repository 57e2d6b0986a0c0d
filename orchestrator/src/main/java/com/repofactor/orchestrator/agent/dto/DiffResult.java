package com.repofactor.orchestrator.agent.dto;

import java.util.List;

/**
 * Unified diff for the whole change set.
 *
 * unifiedDiff is the concatenation of every file's diff, in path order.
 */
public record DiffResult(
        String         unifiedDiff,
        int            filesChanged,
        int            linesAdded,
        int            linesRemoved,
        List<FileDiff> files,
        String         summary
) {
    public DiffResult {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
