package dev.workflows.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adjacency of a workflow document, keyed by source node name.
 *
 * <p>Each source holds, per connection type, an ordered list of output ports; each port is
 * an ordered list of {@link Edge}s. The double-nested shape is guaranteed by construction:
 * the only way in is {@link #connect} and {@link #ensurePorts}.
 */
public final class Connections {

    private final Map<String, Map<String, List<List<Edge>>>> bySource = new LinkedHashMap<>();

    public Connections() {}

    /** Connect {@code source} output 0 to {@code target} input 0 on the main connection type. */
    public boolean connect(String source, String target) {
        return connect(source, 0, Edge.to(target));
    }

    /**
     * Append an edge to the given output port, padding with empty ports as needed.
     *
     * @return false if the identical edge was already present on that port
     */
    public boolean connect(String source, int outputIndex, Edge edge) {
        return connect(source, Edge.MAIN, outputIndex, edge);
    }

    /** As {@link #connect(String, int, Edge)} for a named connection type. */
    public boolean connect(String source, String connectionType, int outputIndex, Edge edge) {
        List<List<Edge>> ports = mutablePorts(source, connectionType, outputIndex + 1);
        List<Edge> port = ports.get(outputIndex);
        if (port.contains(edge)) {
            return false;
        }
        port.add(edge);
        return true;
    }

    /** Make sure {@code source} declares at least {@code count} main ports. */
    public void ensurePorts(String source, int count) {
        mutablePorts(source, Edge.MAIN, count);
    }

    public void ensurePorts(String source, String connectionType, int count) {
        mutablePorts(source, connectionType, count);
    }

    private List<List<Edge>> mutablePorts(String source, String connectionType, int count) {
        List<List<Edge>> ports = bySource
            .computeIfAbsent(source, k -> new LinkedHashMap<>())
            .computeIfAbsent(connectionType, k -> new ArrayList<>());
        while (ports.size() < count) {
            ports.add(new ArrayList<>());
        }
        return ports;
    }

    /** Main ports of {@code source}; empty if the node has none. */
    public List<List<Edge>> ports(String source) {
        return ports(source, Edge.MAIN);
    }

    public List<List<Edge>> ports(String source, String portType) {
        Map<String, List<List<Edge>>> byType = bySource.get(source);
        if (byType == null || !byType.containsKey(portType)) {
            return List.of();
        }
        List<List<Edge>> view = new ArrayList<>();
        for (List<Edge> port : byType.get(portType)) {
            view.add(Collections.unmodifiableList(port));
        }
        return Collections.unmodifiableList(view);
    }

    /** Connection types declared by {@code source}, in insertion order. */
    public Set<String> portTypes(String source) {
        Map<String, List<List<Edge>>> byType = bySource.get(source);
        return byType == null ? Set.of() : Collections.unmodifiableSet(byType.keySet());
    }

    public Set<String> sources() {
        return Collections.unmodifiableSet(bySource.keySet());
    }

    /** Every edge leaving {@code source}, across all connection types and ports. */
    public List<Edge> edgesFrom(String source) {
        var edges = new ArrayList<Edge>();
        Map<String, List<List<Edge>>> byType = bySource.get(source);
        if (byType != null) {
            byType.values().forEach(ports -> ports.forEach(edges::addAll));
        }
        return edges;
    }

    public boolean hasOutgoing(String source) {
        return !edgesFrom(source).isEmpty();
    }

    /** Names of every node that appears as a target descriptor. */
    public Set<String> targets() {
        var targets = new LinkedHashSet<String>();
        for (String source : bySource.keySet()) {
            edgesFrom(source).forEach(edge -> targets.add(edge.target()));
        }
        return targets;
    }

    public int edgeCount() {
        int count = 0;
        for (String source : bySource.keySet()) {
            count += edgesFrom(source).size();
        }
        return count;
    }

    public boolean isEmpty() {
        return bySource.isEmpty();
    }

    /** Add every port and edge of {@code other}, keeping port positions. */
    public void addAll(Connections other) {
        other.bySource.forEach((source, byType) -> byType.forEach((type, ports) -> {
            ensurePorts(source, type, ports.size());
            for (int i = 0; i < ports.size(); i++) {
                for (Edge edge : ports.get(i)) {
                    connect(source, type, i, edge);
                }
            }
        }));
    }

    public Connections copy() {
        var copy = new Connections();
        copy.addAll(this);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Connections other && bySource.equals(other.bySource);
    }

    @Override
    public int hashCode() {
        return bySource.hashCode();
    }

    @Override
    public String toString() {
        return bySource.toString();
    }
}
