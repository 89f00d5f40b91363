package dev.workflows.engine;

import dev.workflows.model.Node;
import dev.workflows.model.WorkflowDocument;

import java.util.Comparator;
import java.util.Optional;

/**
 * Row-proximity lookups shared by the validator and the repairer. Two nodes share a row when
 * their vertical distance is within the tolerance.
 */
final class RowNeighbours {

    private RowNeighbours() {}

    static boolean sameRow(Node a, Node b, int tolerance) {
        return Math.abs(a.position().y() - b.position().y()) <= tolerance;
    }

    /** Closest node to the left on the same row; ties go to the smaller vertical offset. */
    static Optional<Node> preceding(WorkflowDocument document, Node node, int tolerance) {
        int x = node.position().x();
        return document.nodes().stream()
            .filter(n -> n != node && n.position().x() < x && sameRow(n, node, tolerance))
            .min(Comparator.<Node>comparingInt(n -> x - n.position().x())
                .thenComparingInt(n -> Math.abs(n.position().y() - node.position().y())));
    }

    /** Closest non-trigger node to the right on the same row, by Manhattan distance. */
    static Optional<Node> following(WorkflowDocument document, Node node, int tolerance) {
        int x = node.position().x();
        return document.nodes().stream()
            .filter(n -> n != node && n.position().x() > x && sameRow(n, node, tolerance) && !n.isTrigger())
            .min(Comparator.comparingInt(n -> n.position().x() - x
                + Math.abs(n.position().y() - node.position().y())));
    }
}
