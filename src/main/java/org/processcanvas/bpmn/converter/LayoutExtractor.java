package org.processcanvas.bpmn.converter;

import lombok.extern.slf4j.Slf4j;
import org.processcanvas.bpmn.converter.models.Classification;
import org.processcanvas.bpmn.converter.models.LayoutIndex;
import org.processcanvas.bpmn.converter.models.ShapeBounds;
import org.processcanvas.bpmn.graph.models.NodeKind;
import org.processcanvas.bpmn.graph.models.Position;
import org.processcanvas.bpmn.graph.models.Size;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.processcanvas.bpmn.converter.BpmnDom.BPMNDI_NS;
import static org.processcanvas.bpmn.converter.BpmnDom.BPMN_NS;
import static org.processcanvas.bpmn.converter.BpmnDom.DC_NS;
import static org.processcanvas.bpmn.converter.BpmnDom.DI_NS;

/**
 * Second import stage: indexes the diagram interchange section.
 */
@Slf4j
public class LayoutExtractor {
    private static final Size GENERIC_SIZE = new Size(100, 80);

    /**
     * Indexes shape bounds by annotated element id and edge waypoints by connection id.
     * Shapes without a Bounds child are ignored. A missing width or height falls back to the
     * size of the annotated element's kind: 40x40 for gateways, 30x30 for events, 100x80 otherwise.
     *
     * @param doc the parsed document
     * @return an immutable layout index
     */
    public static LayoutIndex extract(Document doc) {
        Map<String, Element> semanticById = indexSemanticElements(doc);

        Map<String, ShapeBounds> shapes = new HashMap<>();
        for (Element shapeEl : BpmnDom.descendants(doc, BPMNDI_NS, "BPMNShape")) {
            String elementId = BpmnDom.attr(shapeEl, "bpmnElement");
            Element boundsEl = BpmnDom.firstChild(shapeEl, DC_NS, "Bounds");
            if (elementId == null || boundsEl == null) {
                continue;
            }
            Size fallback = fallbackSize(semanticById.get(elementId));
            shapes.putIfAbsent(elementId, new ShapeBounds(
                    number(boundsEl, "x", 0),
                    number(boundsEl, "y", 0),
                    number(boundsEl, "width", fallback.width()),
                    number(boundsEl, "height", fallback.height())));
        }

        Map<String, List<Position>> waypoints = new HashMap<>();
        for (Element edgeEl : BpmnDom.descendants(doc, BPMNDI_NS, "BPMNEdge")) {
            String connectionId = BpmnDom.attr(edgeEl, "bpmnElement");
            if (connectionId == null) {
                continue;
            }
            List<Position> points = new ArrayList<>();
            for (Element waypointEl : BpmnDom.children(edgeEl, DI_NS, "waypoint")) {
                points.add(new Position(number(waypointEl, "x", 0), number(waypointEl, "y", 0)));
            }
            waypoints.putIfAbsent(connectionId, List.copyOf(points));
        }

        log.debug("Indexed {} shapes and {} edges", shapes.size(), waypoints.size());
        return new LayoutIndex(shapes, waypoints);
    }

    private static Map<String, Element> indexSemanticElements(Document doc) {
        Map<String, Element> byId = new HashMap<>();
        for (Element process : BpmnDom.descendants(doc, BPMN_NS, "process")) {
            for (Element child : BpmnDom.childElements(process)) {
                String id = BpmnDom.attr(child, "id");
                if (id != null) {
                    byId.putIfAbsent(id, child);
                }
            }
        }
        return byId;
    }

    private static Size fallbackSize(Element semanticEl) {
        if (semanticEl == null) {
            return GENERIC_SIZE;
        }
        Classification classification = ElementClassifier.classify(semanticEl);
        if (classification.kind() == NodeKind.GATEWAY || classification.kind() == NodeKind.EVENT) {
            return classification.kind().defaultSize();
        }
        return GENERIC_SIZE;
    }

    private static double number(Element element, String name, double fallback) {
        String value = BpmnDom.attr(element, name);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}=\"{}\" on {}", name, value, element.getLocalName());
            return fallback;
        }
    }
}
