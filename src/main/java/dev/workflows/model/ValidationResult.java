package dev.workflows.model;

import java.util.List;

/**
 * Validation summary handed back to callers: validity, a 0-100 score and every issue found.
 */
public record ValidationResult(boolean isValid, int score, List<ValidationIssue> issues) {

    public static final int ERROR_PENALTY = 20;
    public static final int WARNING_PENALTY = 5;

    public ValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /** Derive validity and score from the issue list. */
    public static ValidationResult of(List<ValidationIssue> issues) {
        long errors = issues.stream().filter(ValidationIssue::isError).count();
        long warnings = issues.size() - errors;
        int score = (int) Math.max(0, 100 - ERROR_PENALTY * errors - WARNING_PENALTY * warnings);
        return new ValidationResult(errors == 0, score, issues);
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> !i.isError()).toList();
    }
}
