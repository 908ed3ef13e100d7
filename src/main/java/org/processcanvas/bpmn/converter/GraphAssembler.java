package org.processcanvas.bpmn.converter;

import lombok.extern.slf4j.Slf4j;
import org.processcanvas.bpmn.config.models.ConverterConfig;
import org.processcanvas.bpmn.converter.models.ClassifiedElement;
import org.processcanvas.bpmn.converter.models.ContainmentResult;
import org.processcanvas.bpmn.converter.models.LaneRecord;
import org.processcanvas.bpmn.converter.models.LayoutIndex;
import org.processcanvas.bpmn.converter.models.ParticipantRecord;
import org.processcanvas.bpmn.converter.models.ShapeBounds;
import org.processcanvas.bpmn.graph.ContainmentTree;
import org.processcanvas.bpmn.graph.models.Connection;
import org.processcanvas.bpmn.graph.models.Graph;
import org.processcanvas.bpmn.graph.models.Lane;
import org.processcanvas.bpmn.graph.models.Node;
import org.processcanvas.bpmn.graph.models.NodeKind;
import org.processcanvas.bpmn.graph.models.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Last import stage: merges pools, classified elements and connections into a graph.
 * <p>
 * Nodes the diagram section has no shape for are placed on one row, {@code baseX + n * spacing} apart,
 * where n counts such nodes in output order. The placement depends only on the document.
 */
@Slf4j
public class GraphAssembler {

    public static Graph assemble(ContainmentResult containment, List<ClassifiedElement> elements,
                                 List<Connection> connections, LayoutIndex layout, ConverterConfig config) {
        ContainmentTree tree = containment.tree();
        FallbackPlacement fallback = new FallbackPlacement(config);
        List<Node> nodes = new ArrayList<>();

        for (ParticipantRecord participant : containment.participants().values()) {
            List<Lane> lanes = new ArrayList<>();
            for (String laneId : tree.lanesOf(participant.id())) {
                lanes.add(containment.lanes().get(laneId).toLane());
            }
            ShapeBounds bounds = layout.shapeOf(participant.id());
            nodes.add(Node.builder()
                    .id(participant.id())
                    .kind(NodeKind.POOL)
                    .label(participant.name())
                    .position(bounds == null ? fallback.next() : bounds.position())
                    .size(bounds == null ? null : bounds.size())
                    .color(participant.color())
                    .lanes(lanes)
                    .build());
        }

        for (ClassifiedElement element : elements) {
            ShapeBounds bounds = layout.shapeOf(element.id());
            Node.NodeBuilder builder = Node.builder()
                    .id(element.id())
                    .kind(element.classification().kind())
                    .subKind(element.classification().subKind())
                    .label(element.label())
                    .position(bounds == null ? fallback.next() : bounds.position())
                    .size(bounds == null ? null : bounds.size())
                    .eventFlavor(element.eventFlavor())
                    .description(element.description());

            String laneId = tree.laneOf(element.id());
            LaneRecord lane = laneId == null ? null : containment.lanes().get(laneId);
            if (lane != null) {
                builder.laneId(lane.id())
                        .laneName(lane.name())
                        .laneColor(lane.color())
                        .containerId(tree.containerOf(element.id()));
            }
            nodes.add(builder.build());
        }

        log.debug("Assembled {} nodes ({} placed by fallback) and {} connections",
                nodes.size(), fallback.count, connections.size());
        return new Graph(nodes, connections);
    }

    private static class FallbackPlacement {
        private final ConverterConfig config;
        private int count;

        FallbackPlacement(ConverterConfig config) {
            this.config = config;
        }

        Position next() {
            Position position = new Position(config.layout.baseX + count * config.layout.spacing, config.layout.y);
            count++;
            return position;
        }
    }
}
