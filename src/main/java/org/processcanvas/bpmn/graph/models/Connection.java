package org.processcanvas.bpmn.graph.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/**
 * A directed edge between two nodes.
 *
 * @param sourceHandle symbolic attachment point on the source node
 * @param targetHandle symbolic attachment point on the target node
 * @param condition    guard expression, sequence flows only
 * @param isDefault    whether this is the default flow of its source
 * @param waypoints    waypoints as found in the imported diagram, informational
 */
@Builder(toBuilder = true)
public record Connection(
        String id,
        ConnectionKind kind,
        String sourceId,
        String targetId,
        String sourceHandle,
        String targetHandle,
        String label,
        String condition,
        @JsonProperty("isDefault") boolean isDefault,
        List<Position> waypoints
) {
    public Connection {
        if (kind == null) {
            kind = ConnectionKind.SEQUENCE_FLOW;
        }
        waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
    }

    @JsonIgnore
    public boolean isSequenceFlow() {
        return kind == ConnectionKind.SEQUENCE_FLOW;
    }
}
