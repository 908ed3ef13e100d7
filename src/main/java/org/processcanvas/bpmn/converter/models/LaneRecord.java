package org.processcanvas.bpmn.converter.models;

import org.processcanvas.bpmn.graph.models.Lane;

/**
 * A lane as found in a process fragment.
 *
 * @param processId the fragment declaring the lane
 */
public record LaneRecord(
        String id,
        String name,
        double height,
        String color,
        String processId
) {
    public Lane toLane() {
        return new Lane(id, name, height, color);
    }
}
