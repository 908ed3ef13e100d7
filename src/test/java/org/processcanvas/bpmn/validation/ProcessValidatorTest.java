package org.processcanvas.bpmn.validation;

import org.junit.jupiter.api.Test;
import org.processcanvas.bpmn.graph.GraphJsonHelper;
import org.processcanvas.bpmn.graph.models.Connection;
import org.processcanvas.bpmn.graph.models.ConnectionKind;
import org.processcanvas.bpmn.graph.models.Graph;
import org.processcanvas.bpmn.graph.models.Node;
import org.processcanvas.bpmn.graph.models.NodeKind;
import org.processcanvas.bpmn.validation.models.IssueCategory;
import org.processcanvas.bpmn.validation.models.IssueType;
import org.processcanvas.bpmn.validation.models.ValidationIssue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessValidatorTest {

    private static Node node(String id, NodeKind kind, String subKind) {
        return Node.builder().id(id).kind(kind).subKind(subKind).label("Label of " + id).build();
    }

    private static Connection flow(String id, String sourceId, String targetId) {
        return Connection.builder().id(id).sourceId(sourceId).targetId(targetId).build();
    }

    private static List<String> messages(List<ValidationIssue> issues) {
        return issues.stream().map(ValidationIssue::message).toList();
    }

    @Test
    void shouldFindNothingInWellFormedProcess() throws IOException {
        Graph graph = GraphJsonHelper.loadGraphFile("src/test/resources/graph/order_process.json");

        assertEquals(List.of(), ProcessValidator.validate(graph));
    }

    @Test
    void shouldFindNothingInEmptyGraph() {
        assertEquals(List.of(), ProcessValidator.validate(new Graph(List.of(), List.of())));
    }

    @Test
    void shouldNumberIssuesInRuleOrder() {
        Graph graph = new Graph(List.of(node("task", NodeKind.TASK, "user")), List.of());

        List<ValidationIssue> issues = ProcessValidator.validate(graph);

        assertEquals(4, issues.size());
        ValidationIssue first = issues.get(0);
        assertEquals("validation-1", first.id());
        assertEquals(IssueType.ERROR, first.type());
        assertEquals(IssueCategory.STRUCTURE, first.category());
        assertEquals("Process must have at least one Start Event", first.message());
        assertNull(first.nodeId());
        assertEquals("validation-2", issues.get(1).id());
        assertEquals("Process must have at least one End Event", issues.get(1).message());
        assertEquals("task \"Label of task\" has no incoming connections", issues.get(2).message());
        assertEquals("task", issues.get(3).nodeId());
    }

    @Test
    void shouldReportMisconnectedStartAndEndEvents() {
        Graph graph = new Graph(List.of(
                node("start", NodeKind.EVENT, "start"),
                node("task", NodeKind.TASK, "user"),
                node("end", NodeKind.EVENT, "end")), List.of(
                flow("f1", "task", "start"),
                flow("f2", "start", "task"),
                flow("f3", "end", "task")));

        List<ValidationIssue> issues = ProcessValidator.validate(graph);

        assertTrue(messages(issues).contains("Start Event cannot have incoming sequence flows"));
        assertTrue(messages(issues).contains("End Event cannot have outgoing sequence flows"));
        assertTrue(messages(issues).contains("End Event has no incoming sequence flows - unreachable"));
        assertEquals(IssueCategory.BPMN_COMPLIANCE, issues.stream()
                .filter(issue -> issue.message().startsWith("Start Event cannot")).findFirst().orElseThrow().category());
    }

    @Test
    void shouldWarnAboutSeveralStartEvents() {
        Graph graph = new Graph(List.of(
                node("s1", NodeKind.EVENT, "start"),
                node("s2", NodeKind.EVENT, "start"),
                node("end", NodeKind.EVENT, "end")), List.of(
                flow("f1", "s1", "end"),
                flow("f2", "s2", "end")));

        List<ValidationIssue> issues = ProcessValidator.validate(graph);

        assertEquals(1, issues.size());
        assertEquals(IssueType.WARNING, issues.get(0).type());
        assertEquals(IssueCategory.BEST_PRACTICE, issues.get(0).category());
        assertEquals("Process has 2 Start Events. Consider if this is intentional.", issues.get(0).message());
    }

    private static Graph gatewayGraph(String gatewayKind, Connection first, Connection second) {
        return new Graph(List.of(
                node("start", NodeKind.EVENT, "start"),
                node("gw", NodeKind.GATEWAY, gatewayKind),
                node("a", NodeKind.EVENT, "end"),
                node("b", NodeKind.EVENT, "end")), List.of(
                flow("f0", "start", "gw"), first, second));
    }

    @Test
    void shouldWarnAboutExclusiveGatewayWithoutConditions() {
        Graph graph = gatewayGraph("exclusive", flow("fa", "gw", "a"), flow("fb", "gw", "b"));

        assertEquals(List.of("exclusive Gateway should have conditions on outgoing flows"),
                messages(ProcessValidator.validate(graph)));
    }

    @Test
    void shouldSuggestDefaultWhenEveryFlowIsConditioned() {
        Connection fa = flow("fa", "gw", "a").toBuilder().condition("${a}").build();
        Connection fb = flow("fb", "gw", "b").toBuilder().condition("${b}").build();

        List<ValidationIssue> issues = ProcessValidator.validate(gatewayGraph("exclusive", fa, fb));

        assertEquals(1, issues.size());
        assertEquals(IssueType.INFO, issues.get(0).type());
        assertEquals("gw", issues.get(0).nodeId());
    }

    @Test
    void shouldAcceptGatewayWithDefaultFlow() {
        Connection fa = flow("fa", "gw", "a").toBuilder().condition("${a}").build();
        Connection fb = flow("fb", "gw", "b").toBuilder().isDefault(true).build();

        assertEquals(List.of(), ProcessValidator.validate(gatewayGraph("inclusive", fa, fb)));
    }

    @Test
    void shouldWarnAboutConditionsOnParallelGateway() {
        Connection fa = flow("fa", "gw", "a").toBuilder().condition("${a}").build();

        List<ValidationIssue> issues = ProcessValidator.validate(gatewayGraph("parallel", fa, flow("fb", "gw", "b")));

        assertEquals(1, issues.size());
        assertEquals(IssueCategory.BPMN_COMPLIANCE, issues.get(0).category());
        assertEquals("Parallel Gateway should not have conditions on outgoing flows", issues.get(0).message());
    }

    @Test
    void shouldIgnoreMessageFlowsForConnectivity() {
        Graph graph = new Graph(List.of(
                node("start", NodeKind.EVENT, "start"),
                node("end", NodeKind.EVENT, "end")), List.of(
                Connection.builder().id("m").kind(ConnectionKind.MESSAGE_FLOW).sourceId("start").targetId("end").build()));

        List<String> messages = messages(ProcessValidator.validate(graph));

        assertTrue(messages.contains("Start Event must have at least one outgoing sequence flow"));
        assertTrue(messages.contains("End Event has no incoming sequence flows - unreachable"));
    }

    @Test
    void shouldAskForLabelsAndSmallerProcesses() {
        List<Node> nodes = new ArrayList<>();
        List<Connection> connections = new ArrayList<>();
        nodes.add(node("start", NodeKind.EVENT, "start"));
        String previous = "start";
        for (int i = 1; i <= 21; i++) {
            String id = "task_" + i;
            nodes.add(i == 1 ? Node.builder().id(id).kind(NodeKind.TASK).subKind("user").build() : node(id, NodeKind.TASK, "user"));
            connections.add(flow("f_" + i, previous, id));
            previous = id;
        }
        nodes.add(node("end", NodeKind.EVENT, "end"));
        connections.add(flow("f_end", previous, "end"));

        List<ValidationIssue> issues = ProcessValidator.validate(new Graph(nodes, connections));

        assertEquals(2, issues.size());
        assertEquals("task should have a descriptive label", issues.get(0).message());
        assertEquals("task_1", issues.get(0).nodeId());
        assertEquals("Process has 21 tasks. Consider breaking into sub-processes for better readability.",
                issues.get(1).message());
    }
}
