package org.processcanvas.bpmn.converter;

import org.junit.jupiter.api.Test;
import org.processcanvas.bpmn.converter.models.Classification;
import org.processcanvas.bpmn.converter.models.ClassifiedElement;
import org.processcanvas.bpmn.converter.models.DiagnosticCode;
import org.processcanvas.bpmn.converter.models.StageResult;
import org.processcanvas.bpmn.graph.models.Connection;
import org.processcanvas.bpmn.graph.models.NodeKind;
import org.w3c.dom.Document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FlowResolverTest {
    private static final String MIXED_BPMN = "src/test/resources/bpmn/mixed_elements.bpmn";
    private static final String DANGLING_BPMN = "src/test/resources/bpmn/dangling_reference.bpmn";

    private static StageResult<List<Connection>> resolve(String path) throws IOException {
        Document doc = BpmnDocumentReader.read(Files.readString(Path.of(path)));
        List<ClassifiedElement> elements = ElementClassifier.classifyDocument(doc, Set.of()).value();
        return FlowResolver.resolve(doc, elements, List.of(), LayoutExtractor.extract(doc));
    }

    @Test
    void shouldSelectHandlesByEndpointSubKind() {
        assertEquals("start-right", FlowResolver.sourceHandle(new Classification(NodeKind.EVENT, "start")));
        assertEquals("inter-output", FlowResolver.sourceHandle(new Classification(NodeKind.EVENT, "intermediate")));
        assertEquals("output-right", FlowResolver.sourceHandle(new Classification(NodeKind.EVENT, "end")));
        assertEquals("output-right", FlowResolver.sourceHandle(new Classification(NodeKind.GATEWAY, "event-based")));

        assertEquals("end-left", FlowResolver.targetHandle(new Classification(NodeKind.EVENT, "end")));
        assertEquals("inter-input", FlowResolver.targetHandle(new Classification(NodeKind.EVENT, "intermediate")));
        assertEquals("input-left", FlowResolver.targetHandle(new Classification(NodeKind.EVENT, "start")));
        assertEquals("input-left", FlowResolver.targetHandle(new Classification(NodeKind.POOL, null)));
    }

    @Test
    void shouldBuildConnectionsWithHandles() throws IOException {
        List<Connection> connections = resolve(MIXED_BPMN).value();

        assertEquals(4, connections.size());
        Connection first = connections.get(0);
        assertEquals("Flow_X1", first.id());
        assertEquals("start-right", first.sourceHandle());
        assertEquals("inter-input", first.targetHandle());

        Connection second = connections.get(1);
        assertEquals("inter-output", second.sourceHandle());
        assertEquals("input-left", second.targetHandle());

        Connection last = connections.get(3);
        assertEquals("output-right", last.sourceHandle());
        assertEquals("end-left", last.targetHandle());
    }

    @Test
    void shouldIgnoreNoneCondition() throws IOException {
        Connection flow = resolve(MIXED_BPMN).value().get(1);

        assertEquals("Flow_X2", flow.id());
        assertNull(flow.condition());
    }

    @Test
    void shouldGenerateIdForFlowWithoutId() throws IOException {
        Connection flow = resolve(MIXED_BPMN).value().get(2);

        assertEquals("flow_3", flow.id());
        assertEquals("Task_Send", flow.sourceId());
        assertEquals("Gateway_Events", flow.targetId());
    }

    @Test
    void shouldDropFlowsWithUnresolvedEndpoints() throws IOException {
        StageResult<List<Connection>> result = resolve(DANGLING_BPMN);

        assertEquals(List.of("Flow_Ok"), result.value().stream().map(Connection::id).toList());
        assertEquals(2, result.diagnostics().size());
        assertTrue(result.diagnostics().stream().allMatch(d -> d.code() == DiagnosticCode.DANGLING_REFERENCE));
        assertEquals("Flow_ToNowhere", result.diagnostics().get(0).elementId());
    }

    @Test
    void shouldDropSequenceFlowsTouchingPools() {
        String xml = """
                <definitions xmlns="http://www.omg.org/spec/BPMN/20100524/MODEL">
                  <collaboration id="C">
                    <participant id="Pool_A" processRef="P" />
                    <messageFlow id="Message_1" sourceRef="Pool_A" targetRef="Task_1" />
                  </collaboration>
                  <process id="P">
                    <userTask id="Task_1" />
                    <sequenceFlow id="Flow_FromPool" sourceRef="Pool_A" targetRef="Task_1" />
                  </process>
                </definitions>
                """;
        Document doc = BpmnDocumentReader.read(xml);
        List<ClassifiedElement> elements = ElementClassifier.classifyDocument(doc, Set.of("Pool_A")).value();

        StageResult<List<Connection>> result =
                FlowResolver.resolve(doc, elements, List.of("Pool_A"), LayoutExtractor.extract(doc));

        assertEquals(List.of("Message_1"), result.value().stream().map(Connection::id).toList());
        assertEquals(1, result.diagnostics().size());
        assertEquals(DiagnosticCode.DANGLING_REFERENCE, result.diagnostics().get(0).code());
        assertEquals("Flow_FromPool", result.diagnostics().get(0).elementId());
    }
}
