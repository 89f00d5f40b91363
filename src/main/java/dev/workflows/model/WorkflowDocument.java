package dev.workflows.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Mutable workflow graph, constructed fresh per request and mutated in place through the pipeline.
 *
 * <p>Nodes are indexed by name and id, so lookups stay constant-time on large drafts.
 */
public final class WorkflowDocument {
    private String name;
    private final String id;
    private final String versionId;
    private final String instanceId;
    private final List<Object> tags;
    private final Map<String, Object> pinData;
    private boolean active;
    private final List<Node> nodes;
    private final Map<String, Node> byName;
    private final Set<String> ids;
    private final Map<String, Integer> nextSuffix;
    private final Connections connections;

    public WorkflowDocument(String name, String id, String versionId, String instanceId) {
        this.name = Objects.requireNonNullElse(name, "Workflow");
        this.id = Objects.requireNonNull(id, "id");
        this.versionId = Objects.requireNonNull(versionId, "versionId");
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        this.tags = new ArrayList<>();
        this.pinData = new LinkedHashMap<>();
        this.active = false;
        this.nodes = new ArrayList<>();
        this.byName = new HashMap<>();
        this.ids = new HashSet<>();
        this.nextSuffix = new HashMap<>();
        this.connections = new Connections();
    }

    /** A blank document with freshly generated identifiers. */
    public static WorkflowDocument create(String name) {
        return new WorkflowDocument(name, UUID.randomUUID().toString(),
            UUID.randomUUID().toString(), UUID.randomUUID().toString());
    }

    public String name() { return name; }
    public String id() { return id; }
    public String versionId() { return versionId; }
    public String instanceId() { return instanceId; }
    public boolean active() { return active; }

    public List<Object> tags() { return tags; }
    public Map<String, Object> pinData() { return pinData; }
    public Connections connections() { return connections; }

    /** Nodes in document order. Use {@link #addNode} to append. */
    public List<Node> nodes() { return Collections.unmodifiableList(nodes); }

    public void rename(String name) { this.name = Objects.requireNonNull(name); }
    public void setActive(boolean active) { this.active = active; }

    /**
     * Append a node. Names are the adjacency key and must stay unique.
     *
     * @throws IllegalArgumentException if a node with the same name exists
     */
    public Node addNode(Node node) {
        if (byName.containsKey(node.name())) {
            throw new IllegalArgumentException("Duplicate node name: " + node.name());
        }
        return addNodeUnchecked(node);
    }

    /**
     * Append a node without the uniqueness check. Used only when loading external
     * documents that the validator must be able to report on.
     */
    public Node addNodeUnchecked(Node node) {
        nodes.add(node);
        byName.putIfAbsent(node.name(), node);
        ids.add(node.id());
        return node;
    }

    /** The first node with this name. */
    public Optional<Node> node(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean hasNode(String name) {
        return byName.containsKey(name);
    }

    public boolean hasId(String id) {
        return ids.contains(id);
    }

    /**
     * {@code base} if no node uses it, otherwise {@code base} with the smallest free numeric
     * suffix from 2 up. Names are never removed, so the search resumes where the last one stopped.
     */
    public String uniqueName(String base) {
        if (!byName.containsKey(base)) {
            return base;
        }
        int suffix = nextSuffix.getOrDefault(base, 2);
        while (byName.containsKey(base + " " + suffix)) {
            suffix++;
        }
        nextSuffix.put(base, suffix);
        return base + " " + suffix;
    }

    public WorkflowDocument copy() {
        var copy = new WorkflowDocument(name, id, versionId, instanceId);
        copy.active = active;
        copy.tags.addAll(tags);
        copy.pinData.putAll(pinData);
        nodes.forEach(node -> copy.addNodeUnchecked(node.copy()));
        copy.connections.addAll(connections);
        return copy;
    }
}
