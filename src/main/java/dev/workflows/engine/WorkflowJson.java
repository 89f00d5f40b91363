package dev.workflows.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.workflows.model.Layout;
import dev.workflows.model.Node;
import dev.workflows.model.NodeType;
import dev.workflows.model.Position;
import dev.workflows.model.RequirementTree;
import dev.workflows.model.ValidationIssue;
import dev.workflows.model.ValidationResult;
import dev.workflows.model.WorkflowDocument;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.UUID;

/**
 * JSON form of workflow documents and validation summaries.
 */
public final class WorkflowJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private WorkflowJson() {}

    public static ObjectNode toJson(WorkflowDocument document) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("name", document.name());
        root.put("id", document.id());
        root.put("versionId", document.versionId());
        root.putObject("meta").put("instanceId", document.instanceId());
        root.set("tags", MAPPER.valueToTree(document.tags()));
        root.set("pinData", MAPPER.valueToTree(document.pinData()));
        root.put("active", document.active());

        ArrayNode nodes = root.putArray("nodes");
        for (Node node : document.nodes()) {
            nodes.add(toJson(node));
        }
        root.set("connections", ConnectionNormalizer.toJson(document.connections()));
        return root;
    }

    static ObjectNode toJson(Node node) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("id", node.id());
        json.put("name", node.name());
        json.put("type", node.typeTag());
        double version = node.typeVersion();
        if (version == Math.rint(version) && !Double.isInfinite(version)) {
            json.put("typeVersion", (long) version);
        } else {
            json.put("typeVersion", version);
        }
        json.putArray("position").add(node.position().x()).add(node.position().y());
        json.set("parameters", MAPPER.valueToTree(node.parameters()));
        node.attributes().forEach((key, value) -> {
            if (!json.has(key)) {
                json.set(key, MAPPER.valueToTree(value));
            }
        });
        return json;
    }

    public static ObjectNode toJson(ValidationResult validation) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("isValid", validation.isValid());
        json.put("score", validation.score());
        ArrayNode issues = json.putArray("issues");
        for (ValidationIssue issue : validation.issues()) {
            ObjectNode item = issues.addObject();
            item.put("severity", issue.severity().name().toLowerCase(Locale.ROOT));
            item.put("category", issue.category().name().toLowerCase(Locale.ROOT).replace('_', '-'));
            item.put("message", issue.message());
            item.put("autofixable", issue.autofixable());
            if (issue.nodeName() != null) {
                item.put("node", issue.nodeName());
            }
        }
        return json;
    }

    /** The exposed result shape: {@code {document, validation}}. */
    public static ObjectNode toJson(WorkflowDocument document, ValidationResult validation) {
        ObjectNode json = MAPPER.createObjectNode();
        json.set("document", toJson(document));
        json.set("validation", toJson(validation));
        return json;
    }

    public static String write(JsonNode json, boolean pretty) {
        return pretty ? json.toPrettyString() : json.toString();
    }

    /**
     * Load an already-serialized document as it is, for stand-alone validation. Parameters are
     * not completed and duplicate names are kept so the validator can report them; missing
     * identifiers and positions are still filled in since the model requires them.
     */
    public static WorkflowDocument readDocument(String json) throws IOException {
        return readDocument(MAPPER.readTree(json));
    }

    public static WorkflowDocument readFile(Path path) throws IOException {
        return readDocument(MAPPER.readTree(path.toFile()));
    }

    static WorkflowDocument readDocument(JsonNode root) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IOException("Workflow document must be a JSON object");
        }
        var document = new WorkflowDocument(
            root.path("name").asText(RequirementTree.DEFAULT_NAME),
            root.path("id").asText(UUID.randomUUID().toString()),
            root.path("versionId").asText(UUID.randomUUID().toString()),
            root.path("meta").path("instanceId").asText(UUID.randomUUID().toString()));
        root.path("tags").forEach(tag -> document.tags().add(MAPPER.convertValue(tag, Object.class)));
        if (root.path("pinData").isObject()) {
            document.pinData().putAll(MAPPER.convertValue(root.get("pinData"), MAP_TYPE));
        }
        document.setActive(root.path("active").asBoolean(false));

        Layout layout = Layout.defaults();
        JsonNode nodes = root.path("nodes");
        if (!nodes.isMissingNode() && !nodes.isNull() && !nodes.isArray()) {
            throw new IOException("Workflow 'nodes' must be a JSON array");
        }
        for (int i = 0; i < nodes.size(); i++) {
            JsonNode raw = nodes.get(i);
            if (!raw.isObject()) {
                throw new IOException("Workflow node " + i + " must be a JSON object");
            }
            String tag = raw.path("type").asText("");
            Position position = DirectPreservationBuilder.position(raw.get("position"));
            if (position == null) {
                position = new Position(layout.startX() + i * layout.horizontalSpacing(), layout.startY());
            }
            var node = new Node(
                raw.path("id").asText(String.valueOf(i + 1)),
                raw.path("name").asText("Node " + (i + 1)),
                NodeType.fromTag(tag), tag,
                raw.path("typeVersion").asDouble(1),
                position,
                raw.path("parameters").isObject()
                    ? MAPPER.convertValue(raw.get("parameters"), MAP_TYPE)
                    : new LinkedHashMap<>());
            raw.properties().forEach(field -> {
                if (!DirectPreservationBuilder.CORE_FIELDS.contains(field.getKey())) {
                    node.attributes().put(field.getKey(), MAPPER.convertValue(field.getValue(), Object.class));
                }
            });
            document.addNodeUnchecked(node);
        }

        document.connections().addAll(ConnectionNormalizer.toConnections(root.get("connections")));
        return document;
    }
}
