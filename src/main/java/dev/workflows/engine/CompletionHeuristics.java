package dev.workflows.engine;

import dev.workflows.model.Connections;
import dev.workflows.model.Edge;
import dev.workflows.model.Node;
import dev.workflows.model.NodeType;
import dev.workflows.model.WorkflowDocument;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Keyword classifier for "this node ends a flow". Fuzzy on purpose and kept as close as
 * possible to the lists the repair behaviour was tuned against.
 */
public final class CompletionHeuristics {

    /** Types that never need an outgoing edge. */
    private static final Set<NodeType> TERMINAL_TYPES =
        EnumSet.of(NodeType.RESPOND_TO_WEBHOOK, NodeType.ERROR_TRIGGER, NodeType.NO_OP);

    private static final List<String> TERMINAL_NAMES = List.of("response", "error handler");

    /** Persistence writes, notification sends and file writes. */
    private static final Set<NodeType> COMPLETION_TYPES = EnumSet.of(
        NodeType.POSTGRES, NodeType.MYSQL, NodeType.MONGO_DB, NodeType.REDIS,
        NodeType.EMAIL_SEND, NodeType.SLACK, NodeType.TELEGRAM, NodeType.TWILIO,
        NodeType.WRITE_BINARY_FILE, NodeType.SPREADSHEET_FILE,
        NodeType.GOOGLE_SHEETS, NodeType.AIRTABLE, NodeType.NOTION);

    private static final List<String> COMPLETION_NAMES = List.of(
        "save", "store", "update", "send", "notify",
        "complete", "finish", "done", "final", "end",
        "log", "record", "report", "alert");

    private CompletionHeuristics() {}

    /** Response, error-trigger and no-op nodes, or names that say so. */
    public static boolean isTerminal(Node node) {
        return TERMINAL_TYPES.contains(node.type()) || nameContains(node, TERMINAL_NAMES);
    }

    /** A branch ending here already reached a logical conclusion. */
    public static boolean isCompletion(Node node) {
        return COMPLETION_TYPES.contains(node.type()) || nameContains(node, COMPLETION_NAMES);
    }

    /** Either terminal or a completion; no outgoing edge expected. */
    public static boolean concludes(Node node) {
        return isTerminal(node) || isCompletion(node);
    }

    /**
     * Follow first-port first-edge links from {@code start} to the node with no outgoing main edge.
     * Empty when the walk revisits a node, since a loop has no end to report.
     */
    public static Optional<String> branchEnd(WorkflowDocument document, String start) {
        Connections connections = document.connections();
        var visited = new HashSet<String>();
        String current = start;
        while (visited.add(current)) {
            List<List<Edge>> ports = connections.ports(current);
            if (ports.isEmpty() || ports.get(0).isEmpty()) {
                return Optional.of(current);
            }
            current = ports.get(0).get(0).target();
        }
        return Optional.empty();
    }

    private static boolean nameContains(Node node, List<String> needles) {
        String name = node.name().toLowerCase(Locale.ROOT);
        for (String needle : needles) {
            if (name.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
