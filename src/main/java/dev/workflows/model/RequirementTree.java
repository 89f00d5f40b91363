package dev.workflows.model;

import java.util.List;

/**
 * Intermediate tree extracted from prompt text. An empty branch list is a valid,
 * non-throwing "nothing recognized" result.
 *
 * @param expectedComplexity announced node-count range, or null if the prompt states none
 */
public record RequirementTree(
    String workflowName,
    List<Branch> branches,
    ComplexityRange expectedComplexity,
    boolean errorHandlingRequested
) {
    public static final String DEFAULT_NAME = "Workflow";

    public RequirementTree {
        workflowName = workflowName == null || workflowName.isBlank() ? DEFAULT_NAME : workflowName;
        branches = branches == null ? List.of() : List.copyOf(branches);
    }

    public static RequirementTree empty() {
        return new RequirementTree(DEFAULT_NAME, List.of(), null, false);
    }

    public boolean isEmpty() {
        return branches.isEmpty();
    }

    public int requirementCount() {
        return branches.stream().mapToInt(b -> b.requirements().size()).sum();
    }
}
