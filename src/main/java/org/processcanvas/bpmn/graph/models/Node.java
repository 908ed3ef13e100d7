package org.processcanvas.bpmn.graph.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.util.List;

/**
 * A diagram element of the process canvas.
 *
 * @param id          unique within a graph
 * @param kind        node kind
 * @param subKind     kind-dependent code: event phase, task kind, gateway kind or data object kind
 * @param label       display text, the id when absent
 * @param position    top-left corner in layout units
 * @param size        width and height in layout units
 * @param containerId owning pool, set iff the node sits in a lane attached to a pool
 * @param laneId      lane the node is a member of
 * @param laneName    name of that lane
 * @param laneColor   colour of that lane
 * @param eventFlavor message/timer/error/escalation marker of events, display only
 * @param description documentation text of tasks
 * @param color       pool colour
 * @param lanes       ordered lanes, pools only
 */
@Builder(toBuilder = true)
public record Node(
        String id,
        NodeKind kind,
        String subKind,
        String label,
        Position position,
        Size size,
        String containerId,
        String laneId,
        String laneName,
        String laneColor,
        EventFlavor eventFlavor,
        String description,
        String color,
        List<Lane> lanes
) {
    public Node {
        if (label == null || label.isEmpty()) {
            label = id;
        }
        if (position == null) {
            position = new Position(0, 0);
        }
        if (size == null && kind != null) {
            size = kind.defaultSize();
        }
        lanes = lanes == null ? List.of() : List.copyOf(lanes);
    }

    @JsonIgnore
    public boolean isPool() {
        return kind == NodeKind.POOL;
    }

    @JsonIgnore
    public boolean isContained() {
        return containerId != null;
    }

    /**
     * Finds a lane of this pool by id.
     *
     * @return the lane, or null if this node has no such lane
     */
    public Lane findLane(String id) {
        for (Lane lane : lanes) {
            if (lane.id().equals(id)) {
                return lane;
            }
        }
        return null;
    }
}
