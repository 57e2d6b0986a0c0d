package com.repofactor.orchestrator.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory copy of the repository being integrated: file path → content.
 * Cloning and reading the repository happen before the pipeline starts.
 */
public record RepoSnapshot(String repoName, Map<String, String> files) {

    public RepoSnapshot {
        repoName = repoName == null ? "" : repoName;
        // Sorted so prompts and diffs list files in a stable order.
        // A file submitted without content is an empty file.
        TreeMap<String, String> sorted = new TreeMap<>();
        if (files != null) {
            files.forEach((path, content) -> sorted.put(path, content == null ? "" : content));
        }
        files = Collections.unmodifiableMap(sorted);
    }

    public int fileCount() {
        return files.size();
    }
}
