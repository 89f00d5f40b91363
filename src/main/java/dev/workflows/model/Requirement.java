package dev.workflows.model;

import java.util.List;
import java.util.Objects;

/**
 * One node the prompt asks for, with the motif markers the extractor detected.
 */
public record Requirement(
    String name,
    String description,
    MatchResult match,
    String branchId,
    boolean parallel,
    boolean switchNode,
    boolean merge,
    List<String> conditions
) {
    public Requirement {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
        Objects.requireNonNull(match, "match");
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public NodeType type() {
        return match.nodeType();
    }
}
