package dev.workflows.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of resolving a free-text requirement to a node type.
 * Low confidence is metadata, never a failure.
 */
public record MatchResult(
    NodeType nodeType,
    double confidence,
    String reasoning,
    List<NodeType> alternatives,
    Strategy strategy
) {
    public static final double AMBIGUITY_THRESHOLD = 0.5;

    /** Which resolution path produced the match. DECLARED means the prompt named the type itself. */
    public enum Strategy { DECLARED, SEMANTIC, CATALOG, OVERRIDE, DEFAULT }

    public MatchResult {
        Objects.requireNonNull(nodeType, "nodeType");
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        reasoning = reasoning == null ? "" : reasoning;
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        Objects.requireNonNull(strategy, "strategy");
    }

    public boolean isAmbiguous() {
        return confidence < AMBIGUITY_THRESHOLD;
    }
}
