package dev.workflows.engine;

import dev.workflows.model.Branch;
import dev.workflows.model.Edge;
import dev.workflows.model.Layout;
import dev.workflows.model.Node;
import dev.workflows.model.NodeType;
import dev.workflows.model.Position;
import dev.workflows.model.Requirement;
import dev.workflows.model.RequirementTree;
import dev.workflows.model.StructuralException;
import dev.workflows.model.TriggerKind;
import dev.workflows.model.WorkflowDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Lays out a workflow from a {@link RequirementTree}.
 *
 * <p>Each branch is walked left to right. At every requirement one motif handler runs:
 * explicit parallel fan-out, switch routing, an implicit run of named alternatives, or plain
 * sequential placement. Every handler returns a {@link MotifOutcome} so the walk resumes
 * from wherever the motif left off.
 */
public final class SynthesisBuilder {

    static final String STAGE = "synthesis";

    private static final Logger log = LoggerFactory.getLogger(SynthesisBuilder.class);

    static final String RESPONSE_NODE = "Respond to Webhook";
    static final String MERGE_NODE = "Merge Results";
    static final String ERROR_TRIGGER_NODE = "Error Handler";
    static final String ERROR_NOTIFICATION_NODE = "Error Notification";

    /** Where the walk continues after a motif: the node to connect from, the next x, the next index. */
    record MotifOutcome(String currentSource, int endX, int nextIndex) {}

    private SynthesisBuilder() {}

    public static WorkflowDocument build(RequirementTree tree, Layout layout) {
        return build(tree, layout, DecisionTrace.discarding());
    }

    /**
     * @throws StructuralException if the tree holds no requirements at all
     */
    public static WorkflowDocument build(RequirementTree tree, Layout layout, DecisionTrace trace) {
        if (tree.requirementCount() == 0) {
            throw new StructuralException("No node requirements could be extracted from the input");
        }
        var ctx = new BuildContext(WorkflowDocument.create(tree.workflowName()), layout, trace);

        int baseY = layout.startY();
        for (int b = 0; b < tree.branches().size(); b++) {
            Branch branch = tree.branches().get(b);
            if (b > 0) {
                baseY = Math.max(baseY + layout.branchSpacing(), ctx.maxY + layout.parallelSpacing());
            }
            buildBranch(ctx, branch, baseY);
        }

        boolean hasErrorBranch = tree.branches().stream().anyMatch(b -> b.trigger() == TriggerKind.ERROR);
        if (tree.errorHandlingRequested() && !hasErrorBranch) {
            addErrorHandling(ctx);
        }

        WorkflowDocument document = ctx.document;
        if (tree.expectedComplexity() != null && !tree.expectedComplexity().contains(document.nodes().size())) {
            trace.record(STAGE, "complexity-mismatch", "built %d nodes, prompt expected %d-%d".formatted(
                document.nodes().size(), tree.expectedComplexity().min(), tree.expectedComplexity().max()));
        }
        log.info("Synthesized '{}' with {} nodes across {} branches",
            document.name(), document.nodes().size(), tree.branches().size());
        return document;
    }

    private static void buildBranch(BuildContext ctx, Branch branch, int baseY) {
        Layout layout = ctx.layout;
        TriggerKind kind = branch.trigger();
        Node trigger = ctx.place(kind.defaultName(), kind.nodeType(), new Position(layout.startX(), baseY));
        if (kind.nodeType() == NodeType.WEBHOOK) {
            trigger.parameters().put("path", NodeParameters.slug(branch.name()));
        }
        ctx.trace.record(STAGE, "trigger", branch.name() + " -> " + trigger.name());

        List<Requirement> reqs = branch.requirements();
        String current = trigger.name();
        int x = layout.startX() + layout.horizontalSpacing();
        int i = 0;
        while (i < reqs.size()) {
            Requirement req = reqs.get(i);
            MotifOutcome outcome;
            if (req.parallel()) {
                outcome = explicitParallel(ctx, reqs, i, current, x, baseY);
            } else if (req.switchNode()) {
                outcome = switchRouting(ctx, reqs, i, current, x, baseY, kind.requestResponse());
            } else {
                int run = alternativeRunLength(reqs, i);
                outcome = run >= 2
                    ? implicitParallel(ctx, reqs, i, run, current, x, baseY)
                    : sequential(ctx, req, i, current, x, baseY);
            }
            current = outcome.currentSource();
            x = outcome.endX();
            i = outcome.nextIndex();
        }

        if (kind.requestResponse()) {
            boolean answered = ctx.document.node(current)
                .map(n -> n.type() == NodeType.RESPOND_TO_WEBHOOK)
                .orElse(false);
            if (!answered) {
                Node response = ctx.place(RESPONSE_NODE, NodeType.RESPOND_TO_WEBHOOK, new Position(x, baseY));
                ctx.connect(current, response.name());
                ctx.trace.record(STAGE, "response-node", "appended to " + branch.name());
            }
        }
    }

    private static MotifOutcome sequential(BuildContext ctx, Requirement req, int index,
                                           String current, int x, int baseY) {
        Node node = ctx.place(req.name(), placeableType(ctx, req), new Position(x, baseY));
        ctx.connect(current, node.name());
        return new MotifOutcome(node.name(), x + ctx.layout.horizontalSpacing(), index + 1);
    }

    private static MotifOutcome explicitParallel(BuildContext ctx, List<Requirement> reqs, int index,
                                                 String current, int x, int baseY) {
        Requirement marker = reqs.get(index);
        int mergeIndex = -1;
        for (int k = index + 1; k < reqs.size(); k++) {
            if (reqs.get(k).switchNode() || reqs.get(k).parallel()) {
                break;
            }
            if (reqs.get(k).merge()) {
                mergeIndex = k;
                break;
            }
        }

        List<Requirement> members = new ArrayList<>();
        if (mergeIndex >= 0) {
            members.addAll(reqs.subList(index + 1, mergeIndex));
        } else {
            for (int k = index + 1; k < reqs.size() && isAlternativeMember(reqs.get(k)); k++) {
                members.add(reqs.get(k));
            }
        }
        List<List<Requirement>> rows = toRows(members);
        if (rows.size() < 2) {
            ctx.trace.record(STAGE, "parallel-fallback", marker.name() + ": fewer than two rows");
            return sequential(ctx, marker, index, current, x, baseY);
        }

        MotifOutcome source = sequential(ctx, marker, index, current, x, baseY);
        Requirement mergeReq = mergeIndex >= 0 ? reqs.get(mergeIndex) : null;
        int next = mergeIndex >= 0 ? mergeIndex + 1 : index + 1 + members.size();
        ctx.trace.record(STAGE, "parallel", marker.name() + ": " + rows.size() + " rows");
        return fanOut(ctx, rows, mergeReq, source.currentSource(), source.endX(), baseY, next);
    }

    private static MotifOutcome implicitParallel(BuildContext ctx, List<Requirement> reqs, int index, int run,
                                                 String current, int x, int baseY) {
        var rows = new ArrayList<List<Requirement>>();
        for (int k = index; k < index + run; k++) {
            rows.add(List.of(reqs.get(k)));
        }
        int next = index + run;
        Requirement mergeReq = null;
        if (next < reqs.size() && reqs.get(next).merge() && !reqs.get(next).switchNode()) {
            mergeReq = reqs.get(next);
            next++;
        }
        ctx.trace.record(STAGE, "alternatives", run + " alternatives from " + reqs.get(index).name());
        return fanOut(ctx, rows, mergeReq, current, x, baseY, next);
    }

    /** Place rows as siblings below one another and reconverge them into one merge node. */
    private static MotifOutcome fanOut(BuildContext ctx, List<List<Requirement>> rows, Requirement mergeReq,
                                       String source, int startX, int baseY, int nextIndex) {
        Layout layout = ctx.layout;
        var ends = new ArrayList<String>();
        int maxX = startX;
        for (int r = 0; r < rows.size(); r++) {
            int y = baseY + r * layout.parallelSpacing();
            int rowX = startX;
            String last = source;
            for (Requirement member : rows.get(r)) {
                Node node = ctx.place(member.name(), placeableType(ctx, member), new Position(rowX, y));
                ctx.connect(last, node.name());
                last = node.name();
                rowX += layout.horizontalSpacing();
            }
            ends.add(last);
            maxX = Math.max(maxX, rowX);
        }
        String mergeName = mergeReq == null ? MERGE_NODE : mergeReq.name();
        Node merge = ctx.place(mergeName, NodeType.MERGE, new Position(maxX, baseY));
        merge.setTypeVersion(2);
        for (int r = 0; r < ends.size(); r++) {
            ctx.document.connections().connect(ends.get(r), 0, new Edge(merge.name(), Edge.MAIN, r));
        }
        return new MotifOutcome(merge.name(), maxX + layout.horizontalSpacing(), nextIndex);
    }

    private static MotifOutcome switchRouting(BuildContext ctx, List<Requirement> reqs, int index, String current,
                                              int x, int baseY, boolean responseFollows) {
        Layout layout = ctx.layout;
        Requirement req = reqs.get(index);
        Node router = ctx.place(req.name(), NodeType.SWITCH, new Position(x, baseY));
        ctx.connect(current, router.name());

        List<String> labels = switchLabels(ctx, req);
        router.parameters().put("rules", rulesFor(labels));
        ctx.document.connections().ensurePorts(router.name(), labels.size());

        int branchX = x + layout.horizontalSpacing();
        int top = baseY - (labels.size() - 1) * layout.parallelSpacing() / 2;
        var routed = new LinkedHashMap<Integer, String>();
        int j = index + 1;
        while (j < reqs.size()) {
            Requirement candidate = reqs.get(j);
            if (candidate.switchNode() || candidate.parallel()) {
                break;
            }
            Optional<Integer> port = portFor(labels, routed, candidate);
            if (port.isEmpty()) {
                break;
            }
            int y = top + port.get() * layout.parallelSpacing();
            Node node = ctx.place(candidate.name(), placeableType(ctx, candidate), new Position(branchX, y));
            ctx.document.connections().connect(router.name(), port.get(), Edge.to(node.name()));
            routed.put(port.get(), node.name());
            j++;
        }

        if (routed.isEmpty()) {
            ctx.trace.record(STAGE, "switch-unrouted", router.name() + ": no requirement matched " + labels);
            return new MotifOutcome(router.name(), branchX, index + 1);
        }
        ctx.trace.record(STAGE, "switch", router.name() + " routed " + routed.size() + "/" + labels.size());

        boolean remaining = j < reqs.size();
        if (routed.size() >= 2 && (remaining || responseFollows)) {
            Node merge = ctx.place("Merge " + router.name() + " Results", NodeType.MERGE,
                new Position(branchX + layout.horizontalSpacing(), baseY));
            merge.setTypeVersion(2);
            merge.parameters().put("mode", "chooseBranch");
            int input = 0;
            for (String end : routed.values()) {
                ctx.document.connections().connect(end, 0, new Edge(merge.name(), Edge.MAIN, input++));
            }
            return new MotifOutcome(merge.name(), branchX + 2 * layout.horizontalSpacing(), j);
        }
        String last = new ArrayList<>(routed.values()).get(routed.size() - 1);
        return new MotifOutcome(last, branchX + layout.horizontalSpacing(), j);
    }

    static List<String> switchLabels(BuildContext ctx, Requirement req) {
        if (!req.conditions().isEmpty()) {
            ctx.trace.record(STAGE, "switch-labels", req.name() + ": extracted " + req.conditions());
            return req.conditions();
        }
        String text = (req.name() + " " + req.description()).toLowerCase(Locale.ROOT);
        List<String> labels;
        String rule;
        if (text.contains("payment")) {
            labels = List.of("Stripe", "PayPal", "Crypto");
            rule = "payment";
        } else if (text.contains("shipping")) {
            labels = List.of("DHL", "UPS", "FedEx");
            rule = "shipping";
        } else if (text.contains("risk") || text.contains("score")) {
            labels = List.of("Low", "Medium", "High");
            rule = "risk";
        } else {
            labels = List.of("option1", "option2", "option3");
            rule = "default";
        }
        ctx.trace.record(STAGE, "switch-labels", req.name() + ": " + rule + " " + labels);
        return labels;
    }

    private static Map<String, Object> rulesFor(List<String> labels) {
        var rules = new ArrayList<Object>();
        for (int p = 0; p < labels.size(); p++) {
            var rule = new LinkedHashMap<String, Object>();
            rule.put("operation", "equal");
            rule.put("value2", labels.get(p));
            rule.put("output", p);
            rules.add(rule);
        }
        var wrapper = new LinkedHashMap<String, Object>();
        wrapper.put("rules", rules);
        return wrapper;
    }

    private static Optional<Integer> portFor(List<String> labels, Map<Integer, String> routed, Requirement req) {
        for (String text : List.of(req.name(), req.description())) {
            for (int p = 0; p < labels.size(); p++) {
                if (!routed.containsKey(p) && mentions(text, labels.get(p))) {
                    return Optional.of(p);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean mentions(String text, String label) {
        if (label.isBlank()) {
            return false;
        }
        return Pattern.compile("(?<![\\p{Alnum}])" + Pattern.quote(label) + "(?![\\p{Alnum}])",
            Pattern.CASE_INSENSITIVE).matcher(text).find();
    }

    /** Length of the run of distinct alternatives of one group starting at {@code index}. */
    static int alternativeRunLength(List<Requirement> reqs, int index) {
        var first = altOf(reqs.get(index));
        if (first.isEmpty() || !isAlternativeMember(reqs.get(index))) {
            return 0;
        }
        var seen = new ArrayList<String>();
        seen.add(first.get().label());
        int k = index + 1;
        while (k < reqs.size() && isAlternativeMember(reqs.get(k))) {
            var alt = altOf(reqs.get(k));
            if (alt.isEmpty() || !alt.get().group().equals(first.get().group()) || seen.contains(alt.get().label())) {
                break;
            }
            seen.add(alt.get().label());
            k++;
        }
        return k - index;
    }

    private static boolean isAlternativeMember(Requirement req) {
        return !req.switchNode() && !req.parallel() && !req.merge() && altOf(req).isPresent();
    }

    private static Optional<MotifAnalyzer.Alternative> altOf(Requirement req) {
        return MotifAnalyzer.alternativeOf(req.name(), req.description());
    }

    /** Each member naming an alternative opens a new row; others extend the current row. */
    private static List<List<Requirement>> toRows(List<Requirement> members) {
        var rows = new ArrayList<List<Requirement>>();
        List<Requirement> row = null;
        for (Requirement member : members) {
            if (row == null || altOf(member).isPresent()) {
                row = new ArrayList<>();
                rows.add(row);
            }
            row.add(member);
        }
        return rows;
    }

    /** Triggers cannot sit mid-branch: substitute the best non-trigger alternative. */
    private static NodeType placeableType(BuildContext ctx, Requirement req) {
        NodeType type = req.type();
        if (!type.isTrigger()) {
            return type;
        }
        NodeType substitute = req.match().alternatives().stream()
            .filter(t -> !t.isTrigger())
            .findFirst()
            .orElse(NodeTypeResolver.DEFAULT_TYPE);
        ctx.trace.record(STAGE, "trigger-substituted", req.name() + ": " + type.shortName() + " -> "
            + substitute.shortName());
        return substitute;
    }

    private static void addErrorHandling(BuildContext ctx) {
        Layout layout = ctx.layout;
        int y = layout.startY() - layout.parallelSpacing();
        Node handler = ctx.place(ERROR_TRIGGER_NODE, NodeType.ERROR_TRIGGER, new Position(layout.startX(), y));
        Node notify = ctx.place(ERROR_NOTIFICATION_NODE, NodeType.EMAIL_SEND,
            new Position(layout.startX() + layout.horizontalSpacing(), y));
        notify.parameters().put("toRecipients", new ArrayList<>(List.of("admin@example.com")));
        notify.parameters().put("subject",
            "Workflow Error: {{$node[\"" + handler.name() + "\"].json.workflow.name}}");
        notify.parameters().put("text",
            "Error: {{$node[\"" + handler.name() + "\"].json.error.message}}\n\nNode: {{$node[\""
                + handler.name() + "\"].json.error.node.name}}");
        ctx.connect(handler.name(), notify.name());
        ctx.trace.record(STAGE, "error-handling", "added " + handler.name() + " -> " + notify.name());
    }

    /** Per-build mutable state. */
    static final class BuildContext {
        final WorkflowDocument document;
        final Layout layout;
        final DecisionTrace trace;
        int nextId = 1;
        int maxY;

        BuildContext(WorkflowDocument document, Layout layout, DecisionTrace trace) {
            this.document = document;
            this.layout = layout;
            this.trace = trace;
            this.maxY = layout.startY();
        }

        Node place(String requestedName, NodeType type, Position position) {
            String name = uniqueName(requestedName);
            var node = new Node(String.valueOf(nextId++), name, type, position,
                NodeParameters.starterParameters(type, name));
            NodeParameters.complete(node);
            if (type == NodeType.WEBHOOK) {
                node.attributes().put("webhookId", UUID.randomUUID().toString());
            }
            document.addNode(node);
            maxY = Math.max(maxY, position.y());
            return node;
        }

        void connect(String source, String target) {
            document.connections().connect(source, target);
        }

        private String uniqueName(String requested) {
            String base = requested == null || requested.isBlank() ? "Node" : requested.trim();
            String name = document.uniqueName(base);
            if (!name.equals(base)) {
                trace.record(STAGE, "renamed-duplicate", base + " -> " + name);
            }
            return name;
        }
    }
}
