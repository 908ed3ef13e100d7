package org.processcanvas.bpmn.converter.models;

import org.processcanvas.bpmn.graph.models.Position;

import java.util.List;
import java.util.Map;

/**
 * Diagram interchange data of one document: shape bounds by annotated element id
 * and edge waypoints by connection id.
 */
public record LayoutIndex(
        Map<String, ShapeBounds> shapesByElementId,
        Map<String, List<Position>> waypointsByConnectionId
) {
    public LayoutIndex {
        shapesByElementId = Map.copyOf(shapesByElementId);
        waypointsByConnectionId = Map.copyOf(waypointsByConnectionId);
    }

    /**
     * @return the bounds of the element's shape, or null when the document has none
     */
    public ShapeBounds shapeOf(String elementId) {
        return elementId == null ? null : shapesByElementId.get(elementId);
    }

    public List<Position> waypointsOf(String connectionId) {
        return connectionId == null ? List.of() : waypointsByConnectionId.getOrDefault(connectionId, List.of());
    }
}
