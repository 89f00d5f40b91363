package dev.workflows.model;

/**
 * Canvas coordinates of a node. Serialized as {@code [x, y]}.
 */
public record Position(int x, int y) {

    public Position shifted(int dx, int dy) {
        return new Position(x + dx, y + dy);
    }
}
