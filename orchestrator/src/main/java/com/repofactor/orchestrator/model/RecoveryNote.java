package com.repofactor.orchestrator.model;

/**
 * One unit of guidance appended to the implementation instructions after a
 * research cycle.
 *
 * retryIndex is the value retry_count takes at the end of the cycle that
 * produced the note (1 for the first cycle).
 */
public record RecoveryNote(int retryIndex, String description, String codeSnippet) {

    public RecoveryNote {
        if (retryIndex < 1) {
            throw new IllegalArgumentException("retryIndex must be >= 1, was " + retryIndex);
        }
        description = description == null ? "" : description.strip();
        codeSnippet = codeSnippet == null ? "" : codeSnippet.strip();
    }

    /**
     * Render the note as an instruction block, delimited so the
     * implementation agent can tell it apart from the user's instructions.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== RECOVERY NOTE (retry ").append(retryIndex).append(") ===\n");
        if (!description.isEmpty()) {
            sb.append(description).append('\n');
        }
        if (!codeSnippet.isEmpty()) {
            sb.append("```\n").append(codeSnippet).append("\n```\n");
        }
        sb.append("=== END RECOVERY NOTE ===");
        return sb.toString();
    }
}
