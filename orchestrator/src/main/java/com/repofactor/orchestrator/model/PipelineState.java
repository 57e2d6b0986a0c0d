package com.repofactor.orchestrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable record of one integration run.
 *
 * Created once per run by the Driver, which is its only writer. The decision
 * function only ever sees it through {@link PipelineStateView}.
 *
 * Growth rules:
 *   - executionLogs and recoveryNotes are append-only
 *   - retryCount only goes up, by one per research cycle
 *   - results keeps the latest output per agent; an entry is only replaced
 *     by a later output of the same agent
 */
public class PipelineState implements PipelineStateView {

    private PipelineStage currentStage = PipelineStage.START;
    private int retryCount = 0;

    // Overwritten on every failure; never cleared by a success.
    private String lastErrorMessage;

    private final String originalInstructions;
    private final List<String> executionLogs = new ArrayList<>();
    private final List<RecoveryNote> recoveryNotes = new ArrayList<>();
    private final Map<AgentRole, Object> results = new EnumMap<>(AgentRole.class);

    public PipelineState(String originalInstructions) {
        this.originalInstructions = originalInstructions == null ? "" : originalInstructions;
    }

    // ------------------------------------------------------------------
    // PipelineStateView
    // ------------------------------------------------------------------

    @Override public PipelineStage currentStage() { return currentStage; }
    @Override public int           retryCount()   { return retryCount; }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public Optional<String>   lastErrorMessage()     { return Optional.ofNullable(lastErrorMessage); }
    public String             originalInstructions() { return originalInstructions; }
    public List<String>       executionLogs()        { return Collections.unmodifiableList(executionLogs); }
    public List<RecoveryNote> recoveryNotes()        { return Collections.unmodifiableList(recoveryNotes); }
    public Map<AgentRole, Object> results()          { return Collections.unmodifiableMap(results); }

    /**
     * The instructions handed to the implementation agent: the original text
     * followed by every recovery note, oldest first.
     */
    public String accumulatedInstructions() {
        StringBuilder sb = new StringBuilder(originalInstructions);
        for (RecoveryNote note : recoveryNotes) {
            sb.append("\n\n").append(note.render());
        }
        return sb.toString();
    }

    /** Typed lookup of a stored agent output. */
    public <T> Optional<T> result(AgentRole role, Class<T> type) {
        Object value = results.get(role);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    /** Last {@code maxLines} execution log lines, oldest first. */
    public List<String> executionLogTail(int maxLines) {
        if (maxLines <= 0) return List.of();
        int from = Math.max(0, executionLogs.size() - maxLines);
        return List.copyOf(executionLogs.subList(from, executionLogs.size()));
    }

    // ------------------------------------------------------------------
    // Writes (Driver only)
    // ------------------------------------------------------------------

    public void advanceTo(PipelineStage stage)        { this.currentStage = stage; }
    public void recordError(String message)           { this.lastErrorMessage = message; }
    public void putResult(AgentRole role, Object out) { results.put(role, out); }

    public void appendLogs(List<String> lines) {
        if (lines != null) executionLogs.addAll(lines);
    }

    public void addRecoveryNote(RecoveryNote note) {
        recoveryNotes.add(note);
    }

    public void incrementRetryCount() {
        this.retryCount++;
    }

    // ------------------------------------------------------------------
    // Persistence
    // ------------------------------------------------------------------

    /** Flat, immutable copy of this state for checkpointing and audit. */
    public PipelineSnapshot snapshot() {
        Map<String, Object> keyed = new LinkedHashMap<>();
        results.forEach((role, value) -> keyed.put(role.key(), value));
        return new PipelineSnapshot(
                currentStage.wireName(),
                retryCount,
                lastErrorMessage,
                List.copyOf(executionLogs),
                originalInstructions,
                accumulatedInstructions(),
                List.copyOf(recoveryNotes),
                keyed
        );
    }
}
