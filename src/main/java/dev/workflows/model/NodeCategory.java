package dev.workflows.model;

/**
 * Coarse grouping of node types. The label is the word the catalog lookup matches against.
 */
public enum NodeCategory {
    TRIGGER("trigger"),
    COMMUNICATION("communication"),
    DATA("data"),
    FLOW("flow"),
    HTTP("http"),
    DATABASE("database"),
    FILES("files"),
    CLOUD("cloud"),
    UTILITY("utility"),
    INTEGRATION("integration"),
    UNRECOGNIZED("unrecognized");

    private final String label;

    NodeCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
