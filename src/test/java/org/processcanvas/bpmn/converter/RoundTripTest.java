package org.processcanvas.bpmn.converter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.processcanvas.bpmn.config.ConverterConfigHelper;
import org.processcanvas.bpmn.graph.GraphJsonHelper;
import org.processcanvas.bpmn.graph.models.Connection;
import org.processcanvas.bpmn.graph.models.Graph;
import org.processcanvas.bpmn.graph.models.Lane;
import org.processcanvas.bpmn.graph.models.Node;
import org.processcanvas.bpmn.graph.models.NodeKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoundTripTest {
    private final BpmnConverter converter = new BpmnConverter(ConverterConfigHelper.loadDefaults(), SequentialIdSource::new);

    private static List<String> describeNodes(Graph graph) {
        return graph.nodes().stream()
                .filter(node -> node.kind() != NodeKind.SHAPE)
                .map(RoundTripTest::describe)
                .sorted()
                .toList();
    }

    private static String describe(Node node) {
        return String.join("|", node.id(), node.kind().code(), String.valueOf(node.subKind()), node.label(),
                String.valueOf(node.containerId()), String.valueOf(node.laneId()), String.valueOf(node.eventFlavor()));
    }

    private static List<String> describeConnections(Graph graph) {
        return graph.connections().stream()
                .map(c -> String.join("|", c.id(), c.kind().code(), c.sourceId(), c.targetId(),
                        String.valueOf(c.condition()), String.valueOf(c.isDefault())))
                .sorted()
                .toList();
    }

    private static List<String> describeLanes(Graph graph) {
        return graph.pools().stream()
                .flatMap(pool -> pool.lanes().stream().map(lane -> pool.id() + "/" + lane.id() + "/" + lane.name()))
                .toList();
    }

    private void assertSameStructure(Graph expected, Graph actual) {
        assertEquals(describeNodes(expected), describeNodes(actual));
        assertEquals(describeConnections(expected), describeConnections(actual));
        assertEquals(describeLanes(expected), describeLanes(actual));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "scenario_a_linear.bpmn",
            "scenario_b_lanes.bpmn",
            "scenario_c_message_flow.bpmn",
            "scenario_d_gateway_default.bpmn",
            "scenario_e_missing_shape.bpmn",
            "mixed_elements.bpmn"
    })
    void shouldKeepStructureThroughExportAndImport(String fixture) throws IOException {
        String original = Files.readString(Path.of("src/test/resources/bpmn", fixture));
        Graph imported = converter.importBpmn(original).graph();

        String exported = converter.exportBpmn(imported, "Round trip");
        Graph reimported = converter.importBpmn(exported).graph();

        assertSameStructure(imported, reimported);
        assertDoesNotThrow(() -> BpmnValidator.validate(exported));
    }

    @Test
    void shouldKeepOrderGraphThroughExportAndImport() throws IOException {
        Graph graph = GraphJsonHelper.loadGraphFile("src/test/resources/graph/order_process.json");

        Graph reimported = converter.importBpmn(converter.exportBpmn(graph, "Order handling")).graph();

        assertSameStructure(graph, reimported);
        assertNull(reimported.findNode("sketch_1"));
        assertEquals(graph.findNode("task_check").position(), reimported.findNode("task_check").position());
        assertEquals(graph.findNode("task_check").description(), reimported.findNode("task_check").description());
        assertEquals("Order\nreceived", reimported.findNode("start_order").label());
    }

    @Test
    void shouldKeepLayoutOfImportedShapes() throws IOException {
        Graph imported = converter.importBpmn(
                Files.readString(Path.of("src/test/resources/bpmn/scenario_b_lanes.bpmn"))).graph();

        Graph reimported = converter.importBpmn(converter.exportBpmn(imported, "Round trip")).graph();

        for (Node node : imported.nodes()) {
            Node again = reimported.findNode(node.id());
            assertEquals(node.position(), again.position(), node.id());
            assertEquals(node.size(), again.size(), node.id());
        }
        Node pool = reimported.findNode("Pool_Shop");
        assertEquals(120, pool.lanes().get(0).height());
        assertEquals(180, pool.lanes().get(1).height());
    }

    @Test
    void shouldMoveDefaultFlagWithConnectionId() throws IOException {
        Graph imported = converter.importBpmn(
                Files.readString(Path.of("src/test/resources/bpmn/scenario_d_gateway_default.bpmn"))).graph();

        Graph reimported = converter.importBpmn(converter.exportBpmn(imported, "Round trip")).graph();

        Connection small = reimported.findConnection("Flow_Small");
        assertTrue(small.isDefault());
        assertFalse(reimported.findConnection("Flow_Large").isDefault());
        assertEquals("${amount > 1000}", reimported.findConnection("Flow_Large").condition());
    }

    @Test
    void shouldKeepDataObjectsAndNotesInPoolLanes() {
        Graph graph = new Graph(List.of(
                Node.builder().id("pool").kind(NodeKind.POOL).label("Desk")
                        .lanes(List.of(new Lane("lane1", "Clerk", 150, null))).build(),
                Node.builder().id("task").kind(NodeKind.TASK).subKind("user").label("File")
                        .containerId("pool").laneId("lane1").laneName("Clerk").build(),
                Node.builder().id("d").kind(NodeKind.DATA_OBJECT).subKind("data-object").label("Record")
                        .containerId("pool").laneId("lane1").laneName("Clerk").build(),
                Node.builder().id("note").kind(NodeKind.NOTE).label("Keep for a year")
                        .containerId("pool").laneId("lane1").laneName("Clerk").build()),
                List.of());

        Graph reimported = converter.importBpmn(converter.exportBpmn(graph, "Filing")).graph();

        assertSameStructure(graph, reimported);
        assertEquals("pool", reimported.findNode("d").containerId());
        assertEquals("lane1", reimported.findNode("d").laneId());
        assertEquals("lane1", reimported.findNode("note").laneId());
    }
}
