package dev.workflows.model;

/**
 * Input that cannot be turned into a workflow at all: a JSON draft with neither nodes
 * nor connections, or input that yields zero nodes.
 */
public class StructuralException extends RuntimeException {

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
