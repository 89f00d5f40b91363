package dev.workflows.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A processing node. Mutable: builders fill parameters, repair moves nothing but may add nodes.
 *
 * <p>The name doubles as the adjacency key in {@link Connections} and is therefore fixed at
 * construction. {@code typeTag} keeps the exact external tag so unrecognized types round-trip.
 */
public final class Node {
    private final String id;
    private final String name;
    private final NodeType type;
    private final String typeTag;
    private double typeVersion;
    private Position position;
    private final Map<String, Object> parameters;
    private final Map<String, Object> attributes;

    public Node(String id, String name, NodeType type, String typeTag, double typeVersion,
                Position position, Map<String, Object> parameters) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.typeTag = type == NodeType.UNRECOGNIZED ? Objects.requireNonNullElse(typeTag, "") : type.tag();
        this.typeVersion = typeVersion;
        this.position = Objects.requireNonNull(position, "position");
        this.parameters = parameters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parameters);
        this.attributes = new LinkedHashMap<>();
    }

    public Node(String id, String name, NodeType type, Position position, Map<String, Object> parameters) {
        this(id, name, type, type.tag(), 1, position, parameters);
    }

    public String id() { return id; }
    public String name() { return name; }
    public NodeType type() { return type; }
    public String typeTag() { return typeTag; }
    public double typeVersion() { return typeVersion; }
    public Position position() { return position; }

    /** Live, mutable parameter map. */
    public Map<String, Object> parameters() { return parameters; }

    /** Root-level properties outside the core schema (webhookId, credentials, stray fields). */
    public Map<String, Object> attributes() { return attributes; }

    public void setTypeVersion(double typeVersion) { this.typeVersion = typeVersion; }
    public void moveTo(Position position) { this.position = Objects.requireNonNull(position); }

    /** Triggers by catalog category, or an unrecognized tag that names itself a trigger. */
    public boolean isTrigger() {
        if (type == NodeType.UNRECOGNIZED) {
            return typeTag.toLowerCase(Locale.ROOT).endsWith("trigger");
        }
        return type.isTrigger();
    }

    public Node copy() {
        var copy = new Node(id, name, type, typeTag, typeVersion, position, deepCopy(parameters));
        copy.attributes.putAll(deepCopy(attributes));
        return copy;
    }

    private static Map<String, Object> deepCopy(Map<?, ?> source) {
        var copy = new LinkedHashMap<String, Object>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), deepCopyValue(entry.getValue()));
        }
        return copy;
    }

    private static Object deepCopyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy(map);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>();
            list.forEach(item -> copy.add(deepCopyValue(item)));
            return copy;
        }
        return value;
    }

    @Override
    public String toString() {
        return "Node[" + name + " (" + typeTag + ") @" + position.x() + "," + position.y() + "]";
    }
}
