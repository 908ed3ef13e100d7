package org.processcanvas.bpmn.converter;

import lombok.extern.slf4j.Slf4j;
import org.processcanvas.bpmn.converter.models.Classification;
import org.processcanvas.bpmn.converter.models.ClassifiedElement;
import org.processcanvas.bpmn.converter.models.Diagnostic;
import org.processcanvas.bpmn.converter.models.DiagnosticCode;
import org.processcanvas.bpmn.converter.models.StageResult;
import org.processcanvas.bpmn.graph.models.EventFlavor;
import org.processcanvas.bpmn.graph.models.EventPhase;
import org.processcanvas.bpmn.graph.models.GatewayKind;
import org.processcanvas.bpmn.graph.models.NodeKind;
import org.processcanvas.bpmn.graph.models.TaskKind;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.processcanvas.bpmn.converter.BpmnDom.BPMN_NS;

/**
 * Maps semantic elements to node kinds by exact tag lookup.
 * Tags without an entry are unclassified and skipped, so newer BPMN content is ignored rather than rejected.
 */
@Slf4j
public class ElementClassifier {
    public static final String DATA_OBJECT_SUB_KIND = "data-object";

    private static final Map<String, Classification> BY_TAG;
    private static final Map<Classification, String> TAG_BY_CLASSIFICATION;

    static {
        Map<String, Classification> byTag = new LinkedHashMap<>();
        byTag.put("startEvent", event(EventPhase.START));
        byTag.put("intermediateThrowEvent", event(EventPhase.INTERMEDIATE));
        byTag.put("intermediateCatchEvent", event(EventPhase.INTERMEDIATE));
        byTag.put("endEvent", event(EventPhase.END));

        byTag.put("userTask", task(TaskKind.USER));
        byTag.put("serviceTask", task(TaskKind.SERVICE));
        byTag.put("manualTask", task(TaskKind.MANUAL));
        byTag.put("scriptTask", task(TaskKind.SCRIPT));
        byTag.put("businessRuleTask", task(TaskKind.BUSINESS_RULE));
        byTag.put("sendTask", task(TaskKind.SEND));
        byTag.put("receiveTask", task(TaskKind.RECEIVE));

        byTag.put("exclusiveGateway", gateway(GatewayKind.EXCLUSIVE));
        byTag.put("parallelGateway", gateway(GatewayKind.PARALLEL));
        byTag.put("inclusiveGateway", gateway(GatewayKind.INCLUSIVE));
        byTag.put("eventBasedGateway", gateway(GatewayKind.EVENT_BASED));
        byTag.put("complexGateway", gateway(GatewayKind.COMPLEX));

        byTag.put("dataObjectReference", new Classification(NodeKind.DATA_OBJECT, DATA_OBJECT_SUB_KIND));
        byTag.put("textAnnotation", new Classification(NodeKind.NOTE, null));
        BY_TAG = Collections.unmodifiableMap(byTag);

        // first tag wins, so intermediate events are written as throw events
        Map<Classification, String> tagByClassification = new LinkedHashMap<>();
        byTag.forEach((tag, classification) -> tagByClassification.putIfAbsent(classification, tag));
        TAG_BY_CLASSIFICATION = Collections.unmodifiableMap(tagByClassification);
    }

    private static Classification event(EventPhase phase) {
        return new Classification(NodeKind.EVENT, phase.code());
    }

    private static Classification task(TaskKind kind) {
        return new Classification(NodeKind.TASK, kind.code());
    }

    private static Classification gateway(GatewayKind kind) {
        return new Classification(NodeKind.GATEWAY, kind.code());
    }

    /**
     * Classifies a local tag name.
     *
     * @return the classification, or {@link Classification#UNCLASSIFIED}
     */
    public static Classification classify(String tag) {
        if (tag == null) {
            return Classification.UNCLASSIFIED;
        }
        return BY_TAG.getOrDefault(tag, Classification.UNCLASSIFIED);
    }

    /**
     * Classifies an element of the BPMN model namespace (or of no namespace).
     */
    public static Classification classify(Element element) {
        String namespace = element.getNamespaceURI();
        if (namespace != null && !BPMN_NS.equals(namespace)) {
            return Classification.UNCLASSIFIED;
        }
        return classify(element.getLocalName());
    }

    /**
     * Inverse of {@link #classify(String)}.
     * Kinds without a BPMN element (pools, canvas shapes) have no tag.
     *
     * @return the tag to write, or null when the classification has no BPMN element
     */
    public static String tagFor(Classification classification) {
        return TAG_BY_CLASSIFICATION.get(normalize(classification));
    }

    /**
     * Classifies the tag of an already classified pair. Always returns an equal classification.
     */
    public static Classification reclassify(Classification classification) {
        String tag = tagFor(classification);
        return tag == null ? classification : classify(tag);
    }

    /**
     * Fills in the sub-kind a node of the kind gets when it has none or an unknown one:
     * start events, user tasks and exclusive gateways.
     */
    public static Classification normalize(Classification classification) {
        if (classification == null || !classification.isClassified()) {
            return Classification.UNCLASSIFIED;
        }
        if (TAG_BY_CLASSIFICATION.containsKey(classification)) {
            return classification;
        }
        return switch (classification.kind()) {
            case EVENT -> event(EventPhase.START);
            case TASK -> task(TaskKind.USER);
            case GATEWAY -> gateway(GatewayKind.EXCLUSIVE);
            case DATA_OBJECT -> new Classification(NodeKind.DATA_OBJECT, DATA_OBJECT_SUB_KIND);
            case NOTE -> new Classification(NodeKind.NOTE, null);
            case POOL, SHAPE -> classification;
        };
    }

    /**
     * Classifies the semantic content of every process fragment, plus text annotations of collaborations,
     * in document order.
     *
     * @param doc         the parsed document
     * @param reservedIds ids already taken by pools and lanes
     * @return the classified elements; repeated ids are reported and skipped
     */
    public static StageResult<List<ClassifiedElement>> classifyDocument(Document doc, Set<String> reservedIds) {
        List<ClassifiedElement> elements = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<String> seen = new HashSet<>(reservedIds);
        int skipped = 0;

        List<Element> containers = new ArrayList<>(BpmnDom.descendants(doc, BPMN_NS, "process"));
        containers.addAll(BpmnDom.descendants(doc, BPMN_NS, "collaboration"));

        for (Element container : containers) {
            boolean isProcess = "process".equals(container.getLocalName());
            String processId = isProcess ? BpmnDom.attr(container, "id") : null;
            for (Element child : BpmnDom.childElements(container)) {
                Classification classification = classify(child);
                if (!classification.isClassified()) {
                    skipped++;
                    continue;
                }
                if (!isProcess && classification.kind() != NodeKind.NOTE) {
                    continue;
                }
                String id = BpmnDom.attr(child, "id");
                if (id == null) {
                    skipped++;
                    continue;
                }
                if (!seen.add(id)) {
                    diagnostics.add(Diagnostic.warning(DiagnosticCode.DUPLICATE_ID, id,
                            String.format("Element '%s' (%s) repeats an id already in use and is skipped", id, child.getLocalName())));
                    continue;
                }
                elements.add(toClassifiedElement(child, id, processId, classification));
            }
        }

        log.debug("Classified {} elements, skipped {} unclassified", elements.size(), skipped);
        return new StageResult<>(elements, diagnostics);
    }

    private static ClassifiedElement toClassifiedElement(Element element, String id, String processId,
                                                         Classification classification) {
        ClassifiedElement.ClassifiedElementBuilder builder = ClassifiedElement.builder()
                .id(id)
                .tag(element.getLocalName())
                .processId(processId)
                .classification(classification)
                .defaultFlowId(BpmnDom.attr(element, "default"));

        String name = NameCodec.decode(BpmnDom.attr(element, "name"));
        switch (classification.kind()) {
            case EVENT -> builder.eventFlavor(findEventFlavor(element));
            case TASK -> builder.description(BpmnDom.text(BpmnDom.firstChild(element, BPMN_NS, "documentation")));
            case NOTE -> name = BpmnDom.text(BpmnDom.firstChild(element, BPMN_NS, "text"));
            default -> {
            }
        }
        return builder.label(name == null || name.isEmpty() ? id : name).build();
    }

    private static EventFlavor findEventFlavor(Element eventEl) {
        for (EventFlavor flavor : EventFlavor.values()) {
            if (BpmnDom.firstChild(eventEl, BPMN_NS, flavor.definitionTag()) != null) {
                return flavor;
            }
        }
        return null;
    }
}
