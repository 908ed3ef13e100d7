package org.processcanvas.bpmn.graph.models;

/**
 * A lane of a pool. Lanes are kept in document order, which is their visual stacking order.
 */
public record Lane(
        String id,
        String name,
        double height,
        String color
) {
}
