package dev.workflows.engine;

import dev.workflows.model.Connections;
import dev.workflows.model.Edge;
import dev.workflows.model.Node;
import dev.workflows.model.NodeType;
import dev.workflows.model.PipelineOptions;
import dev.workflows.model.Position;
import dev.workflows.model.RepairResult;
import dev.workflows.model.WorkflowDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Bounded, conservative repairs, applied in a fixed order: switch merges, disconnected nodes,
 * dead ends, parameter defaults. Mutates the document in place and never throws.
 *
 * <p>Empty switch outputs are left empty. Inventing a destination would misrepresent what the
 * workflow is meant to do, so those stay as validation errors.
 */
public final class WorkflowRepairer {

    static final String STAGE = "repair";

    static final int MERGE_OFFSET_X = 200;

    private static final Logger log = LoggerFactory.getLogger(WorkflowRepairer.class);

    private WorkflowRepairer() {}

    public static RepairResult repair(WorkflowDocument document) {
        return repair(document, PipelineOptions.DEFAULT_ROW_TOLERANCE, DecisionTrace.discarding());
    }

    public static RepairResult repair(WorkflowDocument document, int rowTolerance, DecisionTrace trace) {
        var fixes = new ArrayList<String>();
        mergeSwitchBranches(document, fixes);
        connectDisconnected(document, rowTolerance, fixes);
        chainDeadEnds(document, rowTolerance, fixes);
        fillParameterDefaults(document, fixes);

        fixes.forEach(fix -> trace.record(STAGE, "fix", fix));
        if (!fixes.isEmpty()) {
            log.info("Repaired '{}' with {} fixes", document.name(), fixes.size());
        }
        return new RepairResult(document, fixes.size(), fixes);
    }

    /**
     * Reconverge the open branches of every switch. A branch whose last node already concludes
     * the flow is left alone; a merge is only worth adding for two or more open branches.
     */
    static void mergeSwitchBranches(WorkflowDocument document, List<String> fixes) {
        Connections connections = document.connections();
        for (Node router : List.copyOf(document.nodes())) {
            if (router.type() != NodeType.SWITCH) {
                continue;
            }
            var ends = new ArrayList<String>();
            for (List<Edge> port : connections.ports(router.name())) {
                if (port.isEmpty()) {
                    continue;
                }
                CompletionHeuristics.branchEnd(document, port.get(0).target())
                    .filter(end -> !ends.contains(end))
                    .ifPresent(ends::add);
            }

            var open = new ArrayList<Node>();
            for (String end : ends) {
                document.node(end)
                    .filter(n -> !CompletionHeuristics.concludes(n))
                    .ifPresent(open::add);
            }
            if (open.size() < 2) {
                continue;
            }

            int maxX = router.position().x();
            for (Node end : open) {
                maxX = Math.max(maxX, end.position().x());
            }
            String mergeName = document.uniqueName("Merge " + router.name() + " Results");
            var parameters = new LinkedHashMap<String, Object>();
            parameters.put("mode", "chooseBranch");
            parameters.put("options", new LinkedHashMap<>());
            Node merge = new Node(uniqueId(document, "merge_" + router.id()), mergeName, NodeType.MERGE,
                NodeType.MERGE.tag(), 2, new Position(maxX + MERGE_OFFSET_X, router.position().y()), parameters);
            document.addNode(merge);
            for (int i = 0; i < open.size(); i++) {
                connections.connect(open.get(i).name(), 0, new Edge(merge.name(), Edge.MAIN, i));
            }
            fixes.add("added %s after %d open branches of %s".formatted(merge.name(), open.size(), router.name()));
        }
    }

    static void connectDisconnected(WorkflowDocument document, int rowTolerance, List<String> fixes) {
        Connections connections = document.connections();
        Set<String> targets = new HashSet<>(connections.targets());
        for (Node node : document.nodes()) {
            if (node.isTrigger() || targets.contains(node.name())) {
                continue;
            }
            Optional<Node> source = RowNeighbours.preceding(document, node, rowTolerance);
            if (source.isPresent() && connections.connect(source.get().name(), node.name())) {
                targets.add(node.name());
                fixes.add("connected %s -> %s".formatted(source.get().name(), node.name()));
            }
        }
    }

    static void chainDeadEnds(WorkflowDocument document, int rowTolerance, List<String> fixes) {
        Connections connections = document.connections();
        for (Node node : document.nodes()) {
            if (connections.hasOutgoing(node.name()) || CompletionHeuristics.concludes(node)) {
                continue;
            }
            Optional<Node> next = RowNeighbours.following(document, node, rowTolerance);
            if (next.isPresent() && connections.connect(node.name(), next.get().name())) {
                fixes.add("chained %s -> %s".formatted(node.name(), next.get().name()));
            }
        }
    }

    /** Only documented, non-blank defaults; placeholders would not make a parameter valid. */
    static void fillParameterDefaults(WorkflowDocument document, List<String> fixes) {
        for (Node node : document.nodes()) {
            for (String key : NodeParameters.missingRequired(node)) {
                Optional<Object> value = NodeParameters.documentedDefault(node.type(), key)
                    .filter(v -> !NodeParameters.isMissing(v));
                if (value.isPresent()) {
                    node.parameters().put(key, value.get());
                    fixes.add("filled %s.%s".formatted(node.name(), key));
                }
            }
        }
    }

    private static String uniqueId(WorkflowDocument document, String base) {
        String id = base;
        int suffix = 2;
        while (document.hasId(id)) {
            id = base + "_" + suffix++;
        }
        return id;
    }

}
