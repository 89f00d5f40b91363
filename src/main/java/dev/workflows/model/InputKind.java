package dev.workflows.model;

/** Where the document came from: prose, a JSON draft, or an already-serialized document. */
public enum InputKind {
    TEXT,
    JSON_DRAFT,
    DOCUMENT
}
