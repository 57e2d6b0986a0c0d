package com.repofactor.orchestrator.agent;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import com.repofactor.orchestrator.agent.dto.DiffRequest;
import com.repofactor.orchestrator.agent.dto.DiffResult;
import com.repofactor.orchestrator.agent.dto.FileDiff;
import com.repofactor.orchestrator.model.AgentRole;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Diff agent computed locally with java-diff-utils; no model call.
 *
 * Files are compared in path order. A path present on one side only is an
 * added or removed file (its other side is empty).
 */
@Component
public class UnifiedDiffAgent implements DiffAgent {

    static final int CONTEXT_LINES = 3;

    @Override
    public DiffResult diff(DiffRequest request) {
        try {
            Set<String> paths = new TreeSet<>(request.originalFiles().keySet());
            paths.addAll(request.modifiedFiles().keySet());

            List<FileDiff> fileDiffs = new ArrayList<>();
            int added = 0;
            int removed = 0;
            for (String path : paths) {
                List<String> original = lines(request.originalFiles().get(path));
                List<String> modified = lines(request.modifiedFiles().get(path));
                if (original.equals(modified)) continue;

                FileDiff fileDiff = diffFile(path, original, modified);
                fileDiffs.add(fileDiff);
                added   += fileDiff.linesAdded();
                removed += fileDiff.linesRemoved();
            }

            String unified = String.join("\n", fileDiffs.stream().map(FileDiff::diffText).toList());
            String summary = "%d files changed, %d lines added, %d lines removed"
                    .formatted(fileDiffs.size(), added, removed);
            return new DiffResult(unified, fileDiffs.size(), added, removed, fileDiffs, summary);
        } catch (RuntimeException e) {
            throw new AgentCallException(AgentRole.DIFF, "Diff generation failed: " + e.getMessage(), e);
        }
    }

    private static FileDiff diffFile(String path, List<String> original, List<String> modified) {
        Patch<String> patch = DiffUtils.diff(original, modified);
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + path,
                "b/" + path,
                original,
                patch,
                CONTEXT_LINES
        );
        int added = 0;
        int removed = 0;
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            added   += delta.getTarget().size();
            removed += delta.getSource().size();
        }
        return new FileDiff(path, String.join("\n", unified), added, removed,
                List.of(changeSummary(original, modified, unified.size())));
    }

    private static String changeSummary(List<String> original, List<String> modified, int diffLines) {
        if (original.isEmpty()) return FileDiff.FILE_ADDED;
        if (modified.isEmpty()) return FileDiff.FILE_REMOVED;
        return "Lines Changed: " + diffLines;
    }

    private static List<String> lines(String content) {
        return content == null || content.isEmpty() ? List.of() : content.lines().toList();
    }
}
