package dev.workflows.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.workflows.model.Connections;
import dev.workflows.model.Edge;
import dev.workflows.model.Layout;
import dev.workflows.model.MatchResult;
import dev.workflows.model.Node;
import dev.workflows.model.NodeType;
import dev.workflows.model.Position;
import dev.workflows.model.RequirementTree;
import dev.workflows.model.StructuralException;
import dev.workflows.model.WorkflowDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Turns an AI-authored node/connection draft into a document with as little change as possible.
 *
 * <p>Draft values always win. Gaps are filled (ids, names, positions, type versions, required
 * parameters), known malformed shapes are corrected, and connections go through the
 * {@link ConnectionNormalizer}. Nothing is rejected except a draft with neither nodes nor
 * connections.
 */
public final class DirectPreservationBuilder {

    static final String STAGE = "preservation";

    private static final Logger log = LoggerFactory.getLogger(DirectPreservationBuilder.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /** Node fields owned by the core schema; anything else at node root is kept as an attribute. */
    static final Set<String> CORE_FIELDS =
        Set.of("id", "name", "type", "typeVersion", "position", "parameters");

    private DirectPreservationBuilder() {}

    public static WorkflowDocument build(JsonNode draft, Layout layout) {
        return build(draft, layout, DecisionTrace.discarding());
    }

    /**
     * @throws StructuralException if the draft is not an object or has neither {@code nodes}
     *                             nor {@code connections}
     */
    public static WorkflowDocument build(JsonNode draft, Layout layout, DecisionTrace trace) {
        if (draft == null || !draft.isObject() || (!draft.has("nodes") && !draft.has("connections"))) {
            throw new StructuralException("Draft must be a JSON object with 'nodes' or 'connections'");
        }
        WorkflowDocument document = newDocument(draft);

        JsonNode nodes = draft.path("nodes");
        var idToName = new HashMap<String, String>();
        if (nodes.isArray()) {
            for (int i = 0; i < nodes.size(); i++) {
                JsonNode raw = nodes.get(i);
                if (!raw.isObject()) {
                    trace.record(STAGE, "skipped-node", "entry " + i + " is not an object");
                    continue;
                }
                Node node = toNode(document, raw, i, layout, trace);
                document.addNode(node);
                JsonNode rawId = raw.get("id");
                if (rawId != null && rawId.isValueNode() && !rawId.asText().isBlank()) {
                    idToName.putIfAbsent(rawId.asText(), node.name());
                }
            }
        } else if (!nodes.isMissingNode()) {
            trace.record(STAGE, "skipped-nodes", "'nodes' is not an array");
        }

        Connections loaded = ConnectionNormalizer.toConnections(draft.get("connections"));
        copyConnections(document, loaded, idToName, trace);

        log.info("Preserved draft '{}' with {} nodes and {} edges",
            document.name(), document.nodes().size(), document.connections().edgeCount());
        return document;
    }

    private static WorkflowDocument newDocument(JsonNode draft) {
        String name = text(draft, "name", RequirementTree.DEFAULT_NAME);
        JsonNode meta = draft.path("meta");
        var document = new WorkflowDocument(name,
            text(draft, "id", UUID.randomUUID().toString()),
            text(draft, "versionId", UUID.randomUUID().toString()),
            text(meta, "instanceId", UUID.randomUUID().toString()));
        if (draft.path("tags").isArray()) {
            draft.get("tags").forEach(tag -> document.tags().add(MAPPER.convertValue(tag, Object.class)));
        }
        if (draft.path("pinData").isObject()) {
            document.pinData().putAll(MAPPER.convertValue(draft.get("pinData"), MAP_TYPE));
        }
        document.setActive(draft.path("active").asBoolean(false));
        return document;
    }

    private static Node toNode(WorkflowDocument document, JsonNode raw, int index, Layout layout,
                               DecisionTrace trace) {
        String name = uniqueName(document, text(raw, "name", "Node " + (index + 1)), trace);

        String tag = text(raw, "type", "");
        NodeType type;
        if (tag.isBlank()) {
            MatchResult match = NodeTypeResolver.resolve(name, trace);
            type = match.nodeType();
            tag = type.tag();
            trace.record(STAGE, "type-resolved", name + " -> " + type.shortName(), match.confidence());
        } else {
            type = NodeType.fromTag(tag);
            if (type == NodeType.UNRECOGNIZED) {
                trace.record(STAGE, "unrecognized-type", name + ": " + tag);
            }
        }

        String id = text(raw, "id", "");
        if (id.isBlank() || document.hasId(id)) {
            int n = index + 1;
            id = "node-" + n;
            while (document.hasId(id)) {
                id = "node-" + ++n;
            }
            trace.record(STAGE, "id-assigned", name + " -> " + id);
        }

        double typeVersion = 1;
        JsonNode rawVersion = raw.get("typeVersion");
        if (rawVersion != null && rawVersion.isNumber() && rawVersion.asDouble() > 0) {
            typeVersion = rawVersion.asDouble();
        }

        Position position = position(raw.get("position"));
        if (position == null) {
            position = new Position(layout.startX() + index * layout.horizontalSpacing(), layout.startY());
            trace.record(STAGE, "position-assigned", name + " -> " + position.x() + "," + position.y());
        }

        Map<String, Object> parameters = raw.path("parameters").isObject()
            ? MAPPER.convertValue(raw.get("parameters"), MAP_TYPE)
            : new LinkedHashMap<>();

        var node = new Node(id, name, type, tag, typeVersion, position, parameters);
        for (var field : raw.properties()) {
            if (!CORE_FIELDS.contains(field.getKey())) {
                node.attributes().put(field.getKey(), MAPPER.convertValue(field.getValue(), Object.class));
            }
        }

        List<String> changes = NodeParameters.complete(node);
        if (!changes.isEmpty()) {
            trace.record(STAGE, "parameters", name + ": " + String.join(", ", changes));
        }
        if (type == NodeType.WEBHOOK && !node.attributes().containsKey("webhookId")) {
            node.attributes().put("webhookId", UUID.randomUUID().toString());
        }
        return node;
    }

    /**
     * Copy loaded edges, rewriting sources and targets that name a node by id. Edges into a
     * trigger are dropped: triggers only start a flow.
     */
    private static void copyConnections(WorkflowDocument document, Connections loaded,
                                        Map<String, String> idToName, DecisionTrace trace) {
        Connections target = document.connections();
        for (String rawSource : loaded.sources()) {
            String source = toName(document, rawSource, idToName, trace);
            for (String type : loaded.portTypes(rawSource)) {
                List<List<Edge>> ports = loaded.ports(rawSource, type);
                target.ensurePorts(source, type, ports.size());
                for (int p = 0; p < ports.size(); p++) {
                    for (Edge edge : ports.get(p)) {
                        String targetName = toName(document, edge.target(), idToName, trace);
                        if (document.node(targetName).map(Node::isTrigger).orElse(false)) {
                            trace.record(STAGE, "dropped-trigger-target", source + " -> " + targetName);
                            continue;
                        }
                        target.connect(source, type, p, new Edge(targetName, edge.portType(), edge.inputIndex()));
                    }
                }
            }
        }
    }

    private static String toName(WorkflowDocument document, String key, Map<String, String> idToName,
                                 DecisionTrace trace) {
        if (document.hasNode(key)) {
            return key;
        }
        String byId = idToName.get(key);
        if (byId != null) {
            trace.record(STAGE, "id-remapped", key + " -> " + byId);
            return byId;
        }
        // unknown names stay as they are; the validator reports them
        return key;
    }

    private static String uniqueName(WorkflowDocument document, String requested, DecisionTrace trace) {
        String base = requested.isBlank() ? "Node" : requested.trim();
        String name = document.uniqueName(base);
        if (!name.equals(base)) {
            trace.record(STAGE, "renamed-duplicate", base + " -> " + name);
        }
        return name;
    }

    /** Accepts {@code [x, y]} or {@code {"x": .., "y": ..}}; anything else is absent. */
    static Position position(JsonNode raw) {
        if (raw == null) {
            return null;
        }
        if (raw.isArray() && raw.size() >= 2 && raw.get(0).isNumber() && raw.get(1).isNumber()) {
            return new Position(raw.get(0).asInt(), raw.get(1).asInt());
        }
        if (raw.isObject() && raw.path("x").isNumber() && raw.path("y").isNumber()) {
            return new Position(raw.get("x").asInt(), raw.get("y").asInt());
        }
        return null;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.isNull() || value.asText().isBlank()) {
            return fallback;
        }
        return value.asText();
    }
}
