package dev.workflows.model;

import java.util.List;

/**
 * What a repair pass changed. The document is the same instance that was passed in.
 */
public record RepairResult(WorkflowDocument document, int fixCount, List<String> appliedFixes) {

    public RepairResult {
        appliedFixes = appliedFixes == null ? List.of() : List.copyOf(appliedFixes);
    }
}
