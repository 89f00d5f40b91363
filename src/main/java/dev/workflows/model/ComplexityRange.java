package dev.workflows.model;

/**
 * Node-count range a prompt announces, e.g. "Expected Complexity: 8-12 nodes".
 */
public record ComplexityRange(int min, int max) {

    public ComplexityRange {
        if (min > max) {
            int swap = min;
            min = max;
            max = swap;
        }
    }

    public boolean contains(int nodeCount) {
        return nodeCount >= min && nodeCount <= max;
    }
}
