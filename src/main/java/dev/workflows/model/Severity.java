package dev.workflows.model;

public enum Severity {
    ERROR,
    WARNING
}
