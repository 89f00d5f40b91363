package dev.workflows.model;

import java.util.List;

/**
 * Everything one pipeline run produced.
 *
 * @param repair the repair pass, or null when auto-repair was disabled
 */
public record BuildResult(
    WorkflowDocument document,
    ValidationResult validation,
    RepairResult repair,
    List<Decision> decisions,
    InputKind inputKind
) {
    public BuildResult {
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }
}
