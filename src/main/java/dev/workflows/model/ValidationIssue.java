package dev.workflows.model;

import java.util.Objects;

/**
 * One finding of the structural validator.
 *
 * @param nodeName the node the issue is about, or null for document-level issues
 */
public record ValidationIssue(
    Severity severity,
    IssueCategory category,
    String message,
    boolean autofixable,
    String nodeName
) {
    public ValidationIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(message, "message");
    }

    public static ValidationIssue error(IssueCategory category, String nodeName, boolean autofixable, String message) {
        return new ValidationIssue(Severity.ERROR, category, message, autofixable, nodeName);
    }

    public static ValidationIssue warning(IssueCategory category, String nodeName, boolean autofixable, String message) {
        return new ValidationIssue(Severity.WARNING, category, message, autofixable, nodeName);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
