package org.processcanvas.bpmn.converter;

import lombok.extern.slf4j.Slf4j;
import org.processcanvas.bpmn.config.models.ConverterConfig;
import org.processcanvas.bpmn.config.models.ExportConfig;
import org.processcanvas.bpmn.converter.models.Classification;
import org.processcanvas.bpmn.graph.ContainmentTree;
import org.processcanvas.bpmn.graph.GraphInvariants;
import org.processcanvas.bpmn.graph.models.Connection;
import org.processcanvas.bpmn.graph.models.Graph;
import org.processcanvas.bpmn.graph.models.Lane;
import org.processcanvas.bpmn.graph.models.Node;
import org.processcanvas.bpmn.graph.models.NodeKind;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.processcanvas.bpmn.converter.BpmnDom.BPMNDI_NS;
import static org.processcanvas.bpmn.converter.BpmnDom.BPMN_NS;
import static org.processcanvas.bpmn.converter.BpmnDom.DC_NS;
import static org.processcanvas.bpmn.converter.BpmnDom.DI_NS;
import static org.processcanvas.bpmn.converter.BpmnDom.XSI_NS;

/**
 * Export: writes a graph as a BPMN 2.0 document with diagram interchange.
 * <p>
 * Every pool gets its own process; nodes outside pools go to a main process carrying the display name.
 * A collaboration is written when the graph has a pool or a message flow.
 */
@Slf4j
public class BpmnDocumentWriter {
    private static final double LANE_HEADER_WIDTH = 30;

    private final Graph graph;
    private final String processName;
    private final IdSource idSource;
    private final ExportConfig exportConfig;

    private Document doc;
    private ContainmentTree tree;
    private final Set<String> usedIds = new HashSet<>();
    private final Map<String, String> processIdByPool = new LinkedHashMap<>();
    private Map<String, Node> nodesById;
    private final Map<String, List<Connection>> incomingByNode = new HashMap<>();
    private final Map<String, List<Connection>> outgoingByNode = new HashMap<>();

    private BpmnDocumentWriter(Graph graph, String processName, IdSource idSource, ConverterConfig config) {
        this.graph = graph;
        this.processName = processName;
        this.idSource = idSource;
        this.exportConfig = config.export;
    }

    /**
     * Writes the graph as BPMN XML.
     *
     * @param graph       the graph to export
     * @param processName display name of the main process
     * @param idSource    source of the ids of synthesized elements, used for this call only
     * @param config      writer settings
     * @return the document text
     * @throws IllegalStateException if the graph breaks one of its invariants; nothing is written then
     */
    public static String write(Graph graph, String processName, IdSource idSource, ConverterConfig config) {
        return new BpmnDocumentWriter(graph, processName, idSource, config).write();
    }

    private String write() {
        tree = GraphInvariants.check(graph);
        nodesById = graph.indexNodes();
        for (Node node : graph.nodes()) {
            usedIds.add(node.id());
            node.lanes().forEach(lane -> usedIds.add(lane.id()));
        }
        for (Connection connection : graph.connections()) {
            usedIds.add(connection.id());
            if (connection.isSequenceFlow()) {
                incomingByNode.computeIfAbsent(connection.targetId(), id -> new ArrayList<>()).add(connection);
                outgoingByNode.computeIfAbsent(connection.sourceId(), id -> new ArrayList<>()).add(connection);
            }
        }

        doc = newDocument();
        Element definitionsEl = createDefinitions();

        List<Node> pools = graph.pools();
        boolean hasMessageFlows = graph.connections().stream().anyMatch(c -> !c.isSequenceFlow());
        String collaborationId = !pools.isEmpty() || hasMessageFlows ? synthesizeId("Collaboration") : null;
        for (Node pool : pools) {
            processIdByPool.put(pool.id(), synthesizeId("Process"));
        }

        List<Node> mainNodes = graph.nodes().stream()
                .filter(node -> isExported(node) && !node.isContained())
                .toList();
        String mainProcessId = !mainNodes.isEmpty() || pools.isEmpty() ? synthesizeId("Process") : null;

        if (collaborationId != null) {
            definitionsEl.appendChild(createCollaboration(collaborationId, pools));
        }
        for (Node pool : pools) {
            List<Node> members = graph.nodes().stream()
                    .filter(node -> isExported(node) && pool.id().equals(node.containerId()))
                    .toList();
            definitionsEl.appendChild(createProcess(processIdByPool.get(pool.id()), pool.label(), pool.lanes(), members));
        }
        if (mainProcessId != null) {
            definitionsEl.appendChild(createProcess(mainProcessId, processName, orphanLanes(), mainNodes));
        }
        definitionsEl.appendChild(createDiagram(collaborationId != null ? collaborationId : mainProcessId, pools));

        String xml = serialize();
        log.debug("Exported {} nodes and {} connections into {} processes",
                graph.nodes().size(), graph.connections().size(), processIdByPool.size() + (mainProcessId == null ? 0 : 1));
        return xml;
    }

    private Element createDefinitions() {
        Element definitionsEl = doc.createElementNS(BPMN_NS, "bpmn:definitions");
        declareNamespace(definitionsEl, "bpmn", BPMN_NS);
        declareNamespace(definitionsEl, "bpmndi", BPMNDI_NS);
        declareNamespace(definitionsEl, "dc", DC_NS);
        declareNamespace(definitionsEl, "di", DI_NS);
        declareNamespace(definitionsEl, "xsi", XSI_NS);
        declareNamespace(definitionsEl, exportConfig.extensionPrefix, exportConfig.extensionNamespace);
        definitionsEl.setAttribute("id", synthesizeId("Definitions"));
        definitionsEl.setAttribute("targetNamespace", exportConfig.targetNamespace);
        definitionsEl.setAttribute("exporter", exportConfig.exporter);
        definitionsEl.setAttribute("exporterVersion", exportConfig.exporterVersion);
        doc.appendChild(definitionsEl);
        return definitionsEl;
    }

    private Element createCollaboration(String collaborationId, List<Node> pools) {
        Element collaborationEl = bpmn("collaboration");
        collaborationEl.setAttribute("id", collaborationId);
        for (Node pool : pools) {
            Element participantEl = bpmn("participant");
            participantEl.setAttribute("id", pool.id());
            participantEl.setAttribute("name", NameCodec.encode(pool.label()));
            participantEl.setAttribute("processRef", processIdByPool.get(pool.id()));
            collaborationEl.appendChild(participantEl);
        }
        for (Connection connection : graph.connections()) {
            if (!connection.isSequenceFlow()) {
                collaborationEl.appendChild(createFlow("messageFlow", connection));
            }
        }
        return collaborationEl;
    }

    private Element createProcess(String processId, String name, List<Lane> lanes, List<Node> nodes) {
        Element processEl = bpmn("process");
        processEl.setAttribute("id", processId);
        if (name != null && !name.isEmpty()) {
            processEl.setAttribute("name", NameCodec.encode(name));
        }
        processEl.setAttribute("isExecutable", "false");

        if (!lanes.isEmpty()) {
            Element laneSetEl = bpmn("laneSet");
            laneSetEl.setAttribute("id", synthesizeId("LaneSet"));
            for (Lane lane : lanes) {
                laneSetEl.appendChild(createLane(lane));
            }
            processEl.appendChild(laneSetEl);
        }

        Set<String> nodeIds = new HashSet<>();
        List<Node> notes = new ArrayList<>();
        for (Node node : nodes) {
            nodeIds.add(node.id());
            if (node.kind() == NodeKind.NOTE) {
                notes.add(node);
            } else if (node.kind() == NodeKind.DATA_OBJECT) {
                Element dataObjectEl = bpmn("dataObject");
                dataObjectEl.setAttribute("id", dataObjectId(node));
                processEl.appendChild(dataObjectEl);
                processEl.appendChild(createFlowElement(node));
            } else {
                processEl.appendChild(createFlowElement(node));
            }
        }
        for (Connection connection : graph.connections()) {
            if (connection.isSequenceFlow() && nodeIds.contains(connection.sourceId())) {
                processEl.appendChild(createFlow("sequenceFlow", connection));
            }
        }
        for (Node note : notes) {
            processEl.appendChild(createTextAnnotation(note));
        }
        return processEl;
    }

    private Element createLane(Lane lane) {
        Element laneEl = bpmn("lane");
        laneEl.setAttribute("id", lane.id());
        if (lane.name() != null) {
            laneEl.setAttribute("name", NameCodec.encode(lane.name()));
        }
        // canvas shapes have no element to refer to
        for (String memberId : tree.membersOf(lane.id())) {
            if (isExported(nodesById.get(memberId))) {
                appendRef(laneEl, "flowNodeRef", memberId);
            }
        }
        return laneEl;
    }

    /**
     * Lanes that belong to no pool, rebuilt from the lane fields of their members.
     */
    private List<Lane> orphanLanes() {
        List<Lane> lanes = new ArrayList<>();
        for (String laneId : tree.orphanLanes()) {
            String name = tree.membersOf(laneId).stream()
                    .map(nodesById::get)
                    .map(Node::laneName)
                    .filter(laneName -> laneName != null)
                    .findFirst()
                    .orElse(null);
            lanes.add(new Lane(laneId, name, 0, null));
        }
        return lanes;
    }

    private Element createFlowElement(Node node) {
        String tag = ElementClassifier.tagFor(new Classification(node.kind(), node.subKind()));
        Element el = bpmn(tag);
        el.setAttribute("id", node.id());
        el.setAttribute("name", NameCodec.encode(node.label()));
        if (node.kind() == NodeKind.DATA_OBJECT) {
            el.setAttribute("dataObjectRef", dataObjectId(node));
        }

        if (node.description() != null && !node.description().isEmpty()) {
            Element documentationEl = bpmn("documentation");
            documentationEl.setTextContent(node.description());
            el.appendChild(documentationEl);
        }
        el.appendChild(createExtensionElements());

        if (isFlowNode(node)) {
            for (Connection connection : incomingByNode.getOrDefault(node.id(), List.of())) {
                appendRef(el, "incoming", connection.id());
            }
            for (Connection connection : outgoingByNode.getOrDefault(node.id(), List.of())) {
                appendRef(el, "outgoing", connection.id());
                if (connection.isDefault() && supportsDefault(tag)) {
                    el.setAttribute("default", connection.id());
                }
            }
        }

        if (node.kind() == NodeKind.EVENT && node.eventFlavor() != null) {
            el.appendChild(bpmn(node.eventFlavor().definitionTag()));
        }
        return el;
    }

    private Element createTextAnnotation(Node note) {
        Element el = bpmn("textAnnotation");
        el.setAttribute("id", note.id());
        el.appendChild(createExtensionElements());
        Element textEl = bpmn("text");
        textEl.setTextContent(note.label());
        el.appendChild(textEl);
        return el;
    }

    private Element createExtensionElements() {
        Element extensionElements = bpmn("extensionElements");
        Element metaDataEl = doc.createElementNS(exportConfig.extensionNamespace, exportConfig.extensionPrefix + ":metaData");
        metaDataEl.setAttribute("metaKey", exportConfig.metaKey);
        metaDataEl.setAttribute("metaValue", exportConfig.metaValue);
        extensionElements.appendChild(metaDataEl);
        return extensionElements;
    }

    private Element createFlow(String tag, Connection connection) {
        Element flowEl = bpmn(tag);
        flowEl.setAttribute("id", connection.id());
        if (connection.label() != null && !connection.label().isEmpty()) {
            flowEl.setAttribute("name", NameCodec.encode(connection.label()));
        }
        flowEl.setAttribute("sourceRef", connection.sourceId());
        flowEl.setAttribute("targetRef", connection.targetId());
        if (connection.isSequenceFlow() && connection.condition() != null && !connection.condition().isBlank()) {
            Element conditionEl = bpmn("conditionExpression");
            conditionEl.setAttributeNS(XSI_NS, "xsi:type", "bpmn:tFormalExpression");
            conditionEl.setTextContent(connection.condition());
            flowEl.appendChild(conditionEl);
        }
        return flowEl;
    }

    private Element createDiagram(String planeElementId, List<Node> pools) {
        Element diagramEl = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNDiagram");
        diagramEl.setAttribute("id", synthesizeId("BPMNDiagram"));
        Element planeEl = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNPlane");
        planeEl.setAttribute("id", synthesizeId("BPMNPlane"));
        planeEl.setAttribute("bpmnElement", planeElementId);
        diagramEl.appendChild(planeEl);

        for (Node pool : pools) {
            planeEl.appendChild(createShape(pool.id(), pool.position().x(), pool.position().y(),
                    pool.size().width(), pool.size().height(), true));
            double laneY = pool.position().y();
            for (Lane lane : pool.lanes()) {
                planeEl.appendChild(createShape(lane.id(), pool.position().x() + LANE_HEADER_WIDTH, laneY,
                        pool.size().width() - LANE_HEADER_WIDTH, lane.height(), true));
                laneY += lane.height();
            }
        }
        for (Node node : graph.nodes()) {
            if (isExported(node)) {
                planeEl.appendChild(createShape(node.id(), node.position().x(), node.position().y(),
                        node.size().width(), node.size().height(), false));
            }
        }
        for (Connection connection : graph.connections()) {
            planeEl.appendChild(createEdge(connection));
        }
        return diagramEl;
    }

    private Element createShape(String elementId, double x, double y, double width, double height, boolean horizontal) {
        Element shapeEl = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNShape");
        shapeEl.setAttribute("id", elementId + "_di");
        shapeEl.setAttribute("bpmnElement", elementId);
        if (horizontal) {
            shapeEl.setAttribute("isHorizontal", "true");
        }
        Element boundsEl = doc.createElementNS(DC_NS, "dc:Bounds");
        boundsEl.setAttribute("x", format(x));
        boundsEl.setAttribute("y", format(y));
        boundsEl.setAttribute("width", format(width));
        boundsEl.setAttribute("height", format(height));
        shapeEl.appendChild(boundsEl);
        return shapeEl;
    }

    /**
     * Straight edge from the middle of the source's right side to the middle of the target's left side.
     */
    private Element createEdge(Connection connection) {
        Node source = nodesById.get(connection.sourceId());
        Node target = nodesById.get(connection.targetId());

        Element edgeEl = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNEdge");
        edgeEl.setAttribute("id", connection.id() + "_di");
        edgeEl.setAttribute("bpmnElement", connection.id());
        edgeEl.appendChild(createWaypoint(source.position().x() + source.size().width(),
                source.position().y() + source.size().height() / 2));
        edgeEl.appendChild(createWaypoint(target.position().x(),
                target.position().y() + target.size().height() / 2));
        return edgeEl;
    }

    private Element createWaypoint(double x, double y) {
        Element waypointEl = doc.createElementNS(DI_NS, "di:waypoint");
        waypointEl.setAttribute("x", format(x));
        waypointEl.setAttribute("y", format(y));
        return waypointEl;
    }

    private void appendRef(Element parent, String tag, String id) {
        Element refEl = bpmn(tag);
        refEl.setTextContent(id);
        parent.appendChild(refEl);
    }

    private Element bpmn(String localName) {
        return doc.createElementNS(BPMN_NS, "bpmn:" + localName);
    }

    private String synthesizeId(String prefix) {
        String id = idSource.nextId(prefix);
        while (!usedIds.add(id)) {
            id = idSource.nextId(prefix);
        }
        return id;
    }

    private String dataObjectId(Node node) {
        return "DataObject_" + node.id();
    }

    private static boolean isExported(Node node) {
        return node.kind() != NodeKind.POOL && node.kind() != NodeKind.SHAPE;
    }

    private static boolean isFlowNode(Node node) {
        return node.kind() == NodeKind.EVENT || node.kind() == NodeKind.TASK || node.kind() == NodeKind.GATEWAY;
    }

    /**
     * Only activities and exclusive, inclusive and complex gateways have a default flow attribute.
     */
    private static boolean supportsDefault(String tag) {
        return tag.endsWith("Task")
                || tag.equals("exclusiveGateway")
                || tag.equals("inclusiveGateway")
                || tag.equals("complexGateway");
    }

    private static void declareNamespace(Element root, String prefix, String namespace) {
        root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:" + prefix, namespace);
    }

    private static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    private static Document newDocument() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            Document document = factory.newDocumentBuilder().newDocument();
            document.setXmlStandalone(true);
            return document;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML document builder is not available", e);
        }
    }

    private String serialize() {
        try {
            TransformerFactory transformerFactory = TransformerFactory.newInstance();
            transformerFactory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            Transformer transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");

            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("Failed to serialize BPMN document", e);
        }
    }
}
