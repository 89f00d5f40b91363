package dev.workflows.model;

import java.util.Objects;

/**
 * One target descriptor inside an output port: the target node's name,
 * the connection type and the target's input index.
 */
public record Edge(String target, String portType, int inputIndex) {

    public static final String MAIN = "main";

    public Edge {
        Objects.requireNonNull(target, "target");
        portType = portType == null || portType.isBlank() ? MAIN : portType;
        inputIndex = Math.max(0, inputIndex);
    }

    public static Edge to(String target) {
        return new Edge(target, MAIN, 0);
    }
}
