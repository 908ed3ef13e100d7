package org.processcanvas.bpmn.converter.models;

import org.processcanvas.bpmn.graph.models.Position;
import org.processcanvas.bpmn.graph.models.Size;

/**
 * Bounds of a diagram shape.
 * <p>
 * Example from BPMN:
 * <bpmndi:BPMNShape id="Activity_1_di" bpmnElement="Activity_1">
 *   <dc:Bounds x="270" y="80" width="100" height="80" />
 * </bpmndi:BPMNShape>
 */
public record ShapeBounds(
        double x,
        double y,
        double width,
        double height
) {
    public Position position() {
        return new Position(x, y);
    }

    public Size size() {
        return new Size(width, height);
    }
}
