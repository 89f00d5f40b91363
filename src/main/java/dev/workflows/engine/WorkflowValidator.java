package dev.workflows.engine;

import dev.workflows.model.Connections;
import dev.workflows.model.Edge;
import dev.workflows.model.IssueCategory;
import dev.workflows.model.Node;
import dev.workflows.model.NodeType;
import dev.workflows.model.PipelineOptions;
import dev.workflows.model.ValidationIssue;
import dev.workflows.model.ValidationResult;
import dev.workflows.model.WorkflowDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only structural checks and the 0-100 score. Never mutates the document.
 */
public final class WorkflowValidator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowValidator.class);

    static final int LARGE_WORKFLOW_NODES = 20;
    static final int MAX_UNMERGED_BRANCHING_NODES = 3;

    private WorkflowValidator() {}

    public static ValidationResult validate(WorkflowDocument document) {
        return validate(document, PipelineOptions.DEFAULT_ROW_TOLERANCE);
    }

    public static ValidationResult validate(WorkflowDocument document, int rowTolerance) {
        var issues = new ArrayList<ValidationIssue>();
        List<Node> nodes = document.nodes();
        Connections connections = document.connections();

        if (nodes.isEmpty()) {
            issues.add(ValidationIssue.error(IssueCategory.EMPTY_WORKFLOW, null, false, "Workflow has no nodes"));
        }

        // names are the adjacency key
        var seen = new HashSet<String>();
        var reported = new HashSet<String>();
        for (Node node : nodes) {
            if (!seen.add(node.name()) && reported.add(node.name())) {
                issues.add(ValidationIssue.error(IssueCategory.DUPLICATE_NAME, node.name(), false,
                    "Node name '%s' is used more than once".formatted(node.name())));
            }
        }

        if (nodes.stream().noneMatch(Node::isTrigger)) {
            issues.add(ValidationIssue.error(IssueCategory.MISSING_TRIGGER, null, false,
                "Workflow has no trigger node"));
        }

        Set<String> incoming = checkEdges(document, issues);

        Set<String> disconnected = new LinkedHashSet<>();
        for (Node node : nodes) {
            if (!node.isTrigger() && !incoming.contains(node.name())) {
                disconnected.add(node.name());
            }
        }

        for (Node node : nodes) {
            if (node.type() == NodeType.UNRECOGNIZED) {
                issues.add(ValidationIssue.warning(IssueCategory.UNRECOGNIZED_TYPE, node.name(), false,
                    "Node '%s' has unrecognized type '%s'".formatted(node.name(), node.typeTag())));
            }

            if (disconnected.contains(node.name())) {
                boolean fixable = RowNeighbours.preceding(document, node, rowTolerance).isPresent();
                issues.add(ValidationIssue.error(IssueCategory.DISCONNECTED_NODE, node.name(), fixable,
                    "Node '%s' is disconnected - no incoming connections".formatted(node.name())));
            }

            // one gap, one issue: a dead end whose right-hand neighbour is disconnected is that neighbour's problem
            if (!connections.hasOutgoing(node.name()) && !CompletionHeuristics.concludes(node)) {
                RowNeighbours.following(document, node, rowTolerance)
                    .filter(next -> !disconnected.contains(next.name()))
                    .ifPresent(next -> issues.add(ValidationIssue.warning(IssueCategory.NO_OUTGOING_EDGE,
                        node.name(), true, "Node '%s' has no outgoing connections".formatted(node.name()))));
            }

            List<String> missing = NodeParameters.missingRequired(node);
            if (!missing.isEmpty()) {
                boolean fixable = missing.stream().anyMatch(key -> NodeParameters.documentedDefault(node.type(), key)
                    .filter(value -> !NodeParameters.isMissing(value))
                    .isPresent());
                issues.add(ValidationIssue.warning(IssueCategory.MISSING_PARAMETER, node.name(), fixable,
                    "Node '%s' is missing required parameters %s".formatted(node.name(), missing)));
            }

            if (node.type() == NodeType.SWITCH) {
                checkSwitch(node, connections, issues);
            }
        }

        boolean hasErrorTrigger = nodes.stream().anyMatch(n -> n.type() == NodeType.ERROR_TRIGGER);
        if (nodes.size() > LARGE_WORKFLOW_NODES && !hasErrorTrigger) {
            issues.add(ValidationIssue.warning(IssueCategory.MISSING_ERROR_HANDLING, null, false,
                "Workflow has %d nodes but no error trigger".formatted(nodes.size())));
        }
        long branching = nodes.stream().filter(n -> n.type() == NodeType.IF || n.type() == NodeType.SWITCH).count();
        boolean hasMerge = nodes.stream().anyMatch(n -> n.type() == NodeType.MERGE);
        if (branching > MAX_UNMERGED_BRANCHING_NODES && !hasMerge) {
            issues.add(ValidationIssue.warning(IssueCategory.UNMERGED_BRANCHES, null, false,
                "Workflow has %d branching nodes and no merge node".formatted(branching)));
        }

        ValidationResult result = ValidationResult.of(issues);
        log.debug("Validated '{}': {} errors, {} warnings, score {}",
            document.name(), result.errors().size(), result.warnings().size(), result.score());
        return result;
    }

    /**
     * Report edges that leave or reach unknown nodes and edges into triggers.
     *
     * @return names of every node that has an incoming edge
     */
    private static Set<String> checkEdges(WorkflowDocument document, List<ValidationIssue> issues) {
        Connections connections = document.connections();
        var incoming = new HashSet<String>();
        for (String source : connections.sources()) {
            if (!document.hasNode(source)) {
                issues.add(ValidationIssue.error(IssueCategory.DANGLING_CONNECTION, source, false,
                    "Connections are declared for unknown node '%s'".formatted(source)));
            }
            for (Edge edge : connections.edgesFrom(source)) {
                incoming.add(edge.target());
                var target = document.node(edge.target());
                if (target.isEmpty()) {
                    issues.add(ValidationIssue.error(IssueCategory.DANGLING_CONNECTION, source, false,
                        "Node '%s' connects to unknown node '%s'".formatted(source, edge.target())));
                } else if (target.get().isTrigger()) {
                    issues.add(ValidationIssue.error(IssueCategory.TRIGGER_AS_TARGET, edge.target(), false,
                        "Trigger node '%s' is the target of '%s'".formatted(edge.target(), source)));
                }
            }
        }
        return incoming;
    }

    /** Every declared branch needs a non-empty port; undeclared switches need at least one output. */
    private static void checkSwitch(Node node, Connections connections, List<ValidationIssue> issues) {
        List<List<Edge>> ports = connections.ports(node.name());
        int declared = declaredBranches(node);
        if (declared == 0) {
            if (ports.isEmpty()) {
                issues.add(ValidationIssue.error(IssueCategory.INCOMPLETE_SWITCH, node.name(), false,
                    "Switch '%s' has no output connections".formatted(node.name())));
                return;
            }
            declared = ports.size();
        }
        for (int p = 0; p < declared; p++) {
            if (p >= ports.size() || ports.get(p).isEmpty()) {
                issues.add(ValidationIssue.error(IssueCategory.INCOMPLETE_SWITCH, node.name(), false,
                    "Switch '%s' output %d has no connections".formatted(node.name(), p)));
            }
        }
        // one extra port is the fallback output
        if (ports.size() > declared + 1) {
            issues.add(ValidationIssue.error(IssueCategory.INCOMPLETE_SWITCH, node.name(), false,
                "Switch '%s' declares %d branches but has %d outputs".formatted(node.name(), declared, ports.size())));
        }
    }

    /** Size of {@code rules.rules}, or of a bare {@code rules} list; 0 when nothing is declared. */
    static int declaredBranches(Node node) {
        Object rules = node.parameters().get("rules");
        if (rules instanceof Map<?, ?> wrapper && wrapper.get("rules") instanceof List<?> list) {
            return list.size();
        }
        if (rules instanceof List<?> list) {
            return list.size();
        }
        return 0;
    }
}
