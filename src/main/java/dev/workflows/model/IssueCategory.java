package dev.workflows.model;

/**
 * What a validation issue is about.
 */
public enum IssueCategory {
    EMPTY_WORKFLOW,
    MISSING_TRIGGER,
    DISCONNECTED_NODE,
    NO_OUTGOING_EDGE,
    MISSING_PARAMETER,
    DUPLICATE_NAME,
    TRIGGER_AS_TARGET,
    DANGLING_CONNECTION,
    UNRECOGNIZED_TYPE,
    INCOMPLETE_SWITCH,
    MISSING_ERROR_HANDLING,
    UNMERGED_BRANCHES
}
