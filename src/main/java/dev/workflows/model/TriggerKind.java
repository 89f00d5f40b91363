package dev.workflows.model;

/**
 * How a branch is started. Request/response-shaped triggers get a trailing response node.
 */
public enum TriggerKind {
    WEBHOOK(NodeType.WEBHOOK, "Webhook Trigger", true),
    SCHEDULE(NodeType.SCHEDULE_TRIGGER, "Schedule Trigger", false),
    ERROR(NodeType.ERROR_TRIGGER, "Error Trigger", false),
    MANUAL(NodeType.MANUAL_TRIGGER, "Manual Trigger", false);

    private final NodeType nodeType;
    private final String defaultName;
    private final boolean requestResponse;

    TriggerKind(NodeType nodeType, String defaultName, boolean requestResponse) {
        this.nodeType = nodeType;
        this.defaultName = defaultName;
        this.requestResponse = requestResponse;
    }

    public NodeType nodeType() { return nodeType; }
    public String defaultName() { return defaultName; }
    public boolean requestResponse() { return requestResponse; }
}
