package dev.workflows.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.workflows.model.Connections;
import dev.workflows.model.Edge;

/**
 * Boundary adapter for externally supplied adjacency maps. Rewrites every known malformed
 * shape into the canonical {@code {source: {type: [[{node, type, index}]]}}} form.
 *
 * <p>Handled shapes: a flat array of descriptors (wrapped as one port), bare target-name
 * strings, a single descriptor object, a port list without its connection-type wrapper,
 * stray descriptors mixed in with ports (moved to port 0), and null entries (dropped).
 * Canonical input passes through unchanged, so normalizing twice equals normalizing once.
 */
public final class ConnectionNormalizer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ConnectionNormalizer() {}

    public static ObjectNode normalize(JsonNode connections) {
        ObjectNode result = NODES.objectNode();
        if (connections == null || !connections.isObject()) {
            return result;
        }
        for (var entry : connections.properties()) {
            JsonNode value = entry.getValue();
            ObjectNode byType = NODES.objectNode();
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isArray() || value.isTextual() || isDescriptor(value)) {
                byType.set(Edge.MAIN, ports(value, Edge.MAIN));
            } else if (value.isObject()) {
                for (var typed : value.properties()) {
                    if (typed.getValue() == null || typed.getValue().isNull()) {
                        continue;
                    }
                    byType.set(typed.getKey(), ports(typed.getValue(), typed.getKey()));
                }
            } else {
                continue;
            }
            result.set(entry.getKey(), byType);
        }
        return result;
    }

    /** Normalize then load into the canonical in-memory structure. */
    public static Connections toConnections(JsonNode connections) {
        var result = new Connections();
        for (var source : normalize(connections).properties()) {
            for (var typed : source.getValue().properties()) {
                ArrayNode ports = (ArrayNode) typed.getValue();
                result.ensurePorts(source.getKey(), typed.getKey(), ports.size());
                for (int p = 0; p < ports.size(); p++) {
                    for (JsonNode d : ports.get(p)) {
                        Edge edge = new Edge(d.get("node").asText(), d.get("type").asText(), d.get("index").asInt());
                        result.connect(source.getKey(), typed.getKey(), p, edge);
                    }
                }
            }
        }
        return result;
    }

    /** Serialize the canonical structure. */
    public static ObjectNode toJson(Connections connections) {
        ObjectNode result = NODES.objectNode();
        for (String source : connections.sources()) {
            ObjectNode byType = result.putObject(source);
            for (String type : connections.portTypes(source)) {
                ArrayNode ports = byType.putArray(type);
                for (var port : connections.ports(source, type)) {
                    ArrayNode out = ports.addArray();
                    port.forEach(edge -> out.add(descriptor(edge.target(), edge.portType(), edge.inputIndex())));
                }
            }
        }
        return result;
    }

    private static ArrayNode ports(JsonNode value, String connectionType) {
        ArrayNode ports = NODES.arrayNode();
        if (!value.isArray()) {
            ArrayNode single = ports.addArray();
            addDescriptor(single, value, connectionType);
            return ports;
        }
        if (value.isEmpty()) {
            return ports;
        }
        boolean hasNested = false;
        for (JsonNode element : value) {
            if (element.isArray()) {
                hasNested = true;
                break;
            }
        }
        if (!hasNested) {
            // flat list of descriptors: one port
            ArrayNode single = ports.addArray();
            for (JsonNode element : value) {
                addDescriptor(single, element, connectionType);
            }
            return ports;
        }
        ArrayNode stray = NODES.arrayNode();
        for (JsonNode element : value) {
            if (element.isArray()) {
                ArrayNode port = ports.addArray();
                for (JsonNode d : element) {
                    addDescriptor(port, d, connectionType);
                }
            } else if (element.isNull()) {
                ports.addArray();
            } else {
                addDescriptor(stray, element, connectionType);
            }
        }
        if (!stray.isEmpty()) {
            ArrayNode first = (ArrayNode) ports.get(0);
            for (JsonNode d : stray) {
                if (!containsDescriptor(first, d)) {
                    first.add(d);
                }
            }
        }
        return ports;
    }

    private static void addDescriptor(ArrayNode port, JsonNode raw, String connectionType) {
        if (raw == null || raw.isNull()) {
            return;
        }
        if (raw.isTextual()) {
            if (!raw.asText().isBlank()) {
                port.add(descriptor(raw.asText(), connectionType, 0));
            }
            return;
        }
        if (!raw.isObject()) {
            return;
        }
        String target = targetOf(raw);
        if (target == null) {
            return;
        }
        JsonNode type = raw.get("type");
        JsonNode index = raw.get("index");
        port.add(descriptor(target,
            type != null && type.isTextual() && !type.asText().isBlank() ? type.asText() : connectionType,
            index != null && index.canConvertToInt() ? Math.max(0, index.asInt()) : 0));
    }

    private static boolean isDescriptor(JsonNode value) {
        return value.isObject() && targetOf(value) != null;
    }

    private static String targetOf(JsonNode raw) {
        for (String key : new String[] {"node", "name", "target"}) {
            JsonNode candidate = raw.get(key);
            if (candidate != null && candidate.isTextual() && !candidate.asText().isBlank()) {
                return candidate.asText();
            }
        }
        return null;
    }

    private static boolean containsDescriptor(ArrayNode port, JsonNode descriptor) {
        for (JsonNode existing : port) {
            if (existing.equals(descriptor)) {
                return true;
            }
        }
        return false;
    }

    private static ObjectNode descriptor(String target, String type, int index) {
        ObjectNode d = NODES.objectNode();
        d.put("node", target);
        d.put("type", type);
        d.put("index", index);
        return d;
    }
}
