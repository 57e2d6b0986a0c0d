package com.repofactor.orchestrator.agent.dto;

import java.util.HashMap;
import java.util.Map;

/**
 * Input of the diff agent. Both maps are path → full content; a path missing
 * from one side is treated as an added or removed file.
 */
public record DiffRequest(Map<String, String> originalFiles,
                          Map<String, String> modifiedFiles) {

    public DiffRequest {
        originalFiles = withoutNulls(originalFiles);
        modifiedFiles = withoutNulls(modifiedFiles);
    }

    // Null content counts as an empty file.
    private static Map<String, String> withoutNulls(Map<String, String> files) {
        if (files == null) return Map.of();
        Map<String, String> copy = new HashMap<>();
        files.forEach((path, content) -> copy.put(path, content == null ? "" : content));
        return Map.copyOf(copy);
    }
}
