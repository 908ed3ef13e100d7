package org.processcanvas.bpmn.converter;

import lombok.extern.slf4j.Slf4j;
import org.processcanvas.bpmn.converter.models.Classification;
import org.processcanvas.bpmn.converter.models.ClassifiedElement;
import org.processcanvas.bpmn.converter.models.Diagnostic;
import org.processcanvas.bpmn.converter.models.DiagnosticCode;
import org.processcanvas.bpmn.converter.models.LayoutIndex;
import org.processcanvas.bpmn.converter.models.StageResult;
import org.processcanvas.bpmn.graph.models.Connection;
import org.processcanvas.bpmn.graph.models.ConnectionKind;
import org.processcanvas.bpmn.graph.models.EventPhase;
import org.processcanvas.bpmn.graph.models.NodeKind;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.processcanvas.bpmn.converter.BpmnDom.BPMN_NS;

/**
 * Fifth import stage: turns sequence flows and message flows into connections.
 */
@Slf4j
public class FlowResolver {
    public static final String START_RIGHT = "start-right";
    public static final String INTER_OUTPUT = "inter-output";
    public static final String END_LEFT = "end-left";
    public static final String INTER_INPUT = "inter-input";
    public static final String OUTPUT_RIGHT = "output-right";
    public static final String INPUT_LEFT = "input-left";

    private static final String NO_CONDITION = "None";
    private static final Classification POOL = new Classification(NodeKind.POOL, null);

    /**
     * Builds one connection per flow whose endpoints both resolve to a classified element or, for message flows,
     * a pool. Other flows are dropped with a {@link DiagnosticCode#DANGLING_REFERENCE} warning.
     *
     * @param doc      the parsed document
     * @param elements classified elements, in document order
     * @param poolIds  ids of the pools
     * @param layout   diagram index, for the waypoints
     * @return connections in document order, sequence flows first
     */
    public static StageResult<List<Connection>> resolve(Document doc, List<ClassifiedElement> elements,
                                                        Collection<String> poolIds, LayoutIndex layout) {
        Map<String, ClassifiedElement> elementsById = new HashMap<>();
        Map<String, Classification> endpoints = new HashMap<>();
        for (String poolId : poolIds) {
            endpoints.put(poolId, POOL);
        }
        for (ClassifiedElement element : elements) {
            elementsById.put(element.id(), element);
            endpoints.put(element.id(), element.classification());
        }

        List<Connection> connections = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<String> usedIds = new HashSet<>(endpoints.keySet());

        int index = 0;
        for (Element processEl : BpmnDom.descendants(doc, BPMN_NS, "process")) {
            for (Element flowEl : BpmnDom.children(processEl, BPMN_NS, "sequenceFlow")) {
                index++;
                Connection connection = toConnection(flowEl, ConnectionKind.SEQUENCE_FLOW, "flow_" + index,
                        endpoints, elementsById, usedIds, layout, diagnostics);
                if (connection != null) {
                    connections.add(connection);
                }
            }
        }

        index = 0;
        for (Element collaborationEl : BpmnDom.descendants(doc, BPMN_NS, "collaboration")) {
            for (Element flowEl : BpmnDom.children(collaborationEl, BPMN_NS, "messageFlow")) {
                index++;
                Connection connection = toConnection(flowEl, ConnectionKind.MESSAGE_FLOW, "msgflow_" + index,
                        endpoints, elementsById, usedIds, layout, diagnostics);
                if (connection != null) {
                    connections.add(connection);
                }
            }
        }

        log.debug("Resolved {} connections, dropped {}", connections.size(), diagnostics.size());
        return new StageResult<>(connections, diagnostics);
    }

    private static Connection toConnection(Element flowEl, ConnectionKind kind, String fallbackId,
                                           Map<String, Classification> endpoints,
                                           Map<String, ClassifiedElement> elementsById, Set<String> usedIds,
                                           LayoutIndex layout, List<Diagnostic> diagnostics) {
        String id = BpmnDom.attr(flowEl, "id");
        if (id == null) {
            id = fallbackId;
            while (usedIds.contains(id)) {
                id = id + "_";
            }
        }
        String sourceId = BpmnDom.attr(flowEl, "sourceRef");
        String targetId = BpmnDom.attr(flowEl, "targetRef");

        Classification source = sourceId == null ? null : endpoints.get(sourceId);
        Classification target = targetId == null ? null : endpoints.get(targetId);
        if (source == null || target == null) {
            String missing = source == null ? sourceId : targetId;
            diagnostics.add(Diagnostic.warning(DiagnosticCode.DANGLING_REFERENCE, id,
                    String.format("%s '%s' refers to unknown element '%s' and is dropped", flowEl.getLocalName(), id, missing)));
            return null;
        }
        if (kind == ConnectionKind.SEQUENCE_FLOW && (source.kind() == NodeKind.POOL || target.kind() == NodeKind.POOL)) {
            String poolId = source.kind() == NodeKind.POOL ? sourceId : targetId;
            diagnostics.add(Diagnostic.warning(DiagnosticCode.DANGLING_REFERENCE, id,
                    String.format("sequenceFlow '%s' connects pool '%s', which only takes message flows, and is dropped",
                            id, poolId)));
            return null;
        }
        if (!usedIds.add(id)) {
            diagnostics.add(Diagnostic.warning(DiagnosticCode.DUPLICATE_ID, id,
                    String.format("%s '%s' repeats an id already in use and is dropped", flowEl.getLocalName(), id)));
            return null;
        }

        String label = NameCodec.decode(BpmnDom.attr(flowEl, "name"));
        String condition = null;
        boolean isDefault = false;
        if (kind == ConnectionKind.SEQUENCE_FLOW) {
            condition = readCondition(flowEl);
            ClassifiedElement sourceElement = elementsById.get(sourceId);
            isDefault = sourceElement != null && id.equals(sourceElement.defaultFlowId());
        }

        return Connection.builder()
                .id(id)
                .kind(kind)
                .sourceId(sourceId)
                .targetId(targetId)
                .sourceHandle(sourceHandle(source))
                .targetHandle(targetHandle(target))
                .label(label)
                .condition(condition)
                .isDefault(isDefault)
                .waypoints(layout.waypointsOf(id))
                .build();
    }

    private static String readCondition(Element flowEl) {
        String condition = BpmnDom.text(BpmnDom.firstChild(flowEl, BPMN_NS, "conditionExpression"));
        if (condition == null || NO_CONDITION.equals(condition)) {
            return null;
        }
        return condition;
    }

    /**
     * Handle on the source side, chosen by the source's classification.
     */
    public static String sourceHandle(Classification source) {
        if (source.kind() == NodeKind.EVENT) {
            EventPhase phase = EventPhase.fromCode(source.subKind());
            if (phase == EventPhase.START) {
                return START_RIGHT;
            }
            if (phase == EventPhase.INTERMEDIATE) {
                return INTER_OUTPUT;
            }
        }
        return OUTPUT_RIGHT;
    }

    /**
     * Handle on the target side, chosen by the target's classification.
     */
    public static String targetHandle(Classification target) {
        if (target.kind() == NodeKind.EVENT) {
            EventPhase phase = EventPhase.fromCode(target.subKind());
            if (phase == EventPhase.END) {
                return END_LEFT;
            }
            if (phase == EventPhase.INTERMEDIATE) {
                return INTER_INPUT;
            }
        }
        return INPUT_LEFT;
    }
}
