package org.processcanvas.bpmn.validation;

import lombok.extern.slf4j.Slf4j;
import org.processcanvas.bpmn.graph.models.Connection;
import org.processcanvas.bpmn.graph.models.EventPhase;
import org.processcanvas.bpmn.graph.models.GatewayKind;
import org.processcanvas.bpmn.graph.models.Graph;
import org.processcanvas.bpmn.graph.models.Node;
import org.processcanvas.bpmn.graph.models.NodeKind;
import org.processcanvas.bpmn.validation.models.IssueCategory;
import org.processcanvas.bpmn.validation.models.IssueType;
import org.processcanvas.bpmn.validation.models.ValidationIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a graph against common BPMN modelling rules.
 * Only sequence flows count as incoming or outgoing flows.
 */
@Slf4j
public class ProcessValidator {
    private static final int MAX_TASKS = 20;

    private final Graph graph;
    private final List<ValidationIssue> issues = new ArrayList<>();

    private ProcessValidator(Graph graph) {
        this.graph = graph;
    }

    /**
     * @param graph the graph to check
     * @return the issues in rule order; empty for a graph without nodes
     */
    public static List<ValidationIssue> validate(Graph graph) {
        if (graph.nodes().isEmpty()) {
            return List.of();
        }
        ProcessValidator validator = new ProcessValidator(graph);
        validator.validateProcessStructure();
        validator.validateStartEvents();
        validator.validateEndEvents();
        validator.validateGateways();
        validator.validateConnectivity();
        validator.validateLabels();
        log.debug("Process validation found {} issues", validator.issues.size());
        return List.copyOf(validator.issues);
    }

    private void validateProcessStructure() {
        int startEvents = events(EventPhase.START).size();
        if (startEvents == 0) {
            addIssue(IssueType.ERROR, IssueCategory.STRUCTURE, "Process must have at least one Start Event", null);
        }
        if (events(EventPhase.END).isEmpty()) {
            addIssue(IssueType.ERROR, IssueCategory.STRUCTURE, "Process must have at least one End Event", null);
        }
        if (startEvents > 1) {
            addIssue(IssueType.WARNING, IssueCategory.BEST_PRACTICE,
                    String.format("Process has %d Start Events. Consider if this is intentional.", startEvents), null);
        }
    }

    private void validateStartEvents() {
        for (Node event : events(EventPhase.START)) {
            if (!incoming(event).isEmpty()) {
                addIssue(IssueType.ERROR, IssueCategory.BPMN_COMPLIANCE,
                        "Start Event cannot have incoming sequence flows", event.id());
            }
            if (outgoing(event).isEmpty()) {
                addIssue(IssueType.ERROR, IssueCategory.STRUCTURE,
                        "Start Event must have at least one outgoing sequence flow", event.id());
            }
        }
    }

    private void validateEndEvents() {
        for (Node event : events(EventPhase.END)) {
            if (!outgoing(event).isEmpty()) {
                addIssue(IssueType.ERROR, IssueCategory.BPMN_COMPLIANCE,
                        "End Event cannot have outgoing sequence flows", event.id());
            }
            if (incoming(event).isEmpty()) {
                addIssue(IssueType.WARNING, IssueCategory.STRUCTURE,
                        "End Event has no incoming sequence flows - unreachable", event.id());
            }
        }
    }

    private void validateGateways() {
        for (Node gateway : graph.nodes()) {
            if (gateway.kind() != NodeKind.GATEWAY) {
                continue;
            }
            String gatewayType = gateway.subKind() == null ? GatewayKind.EXCLUSIVE.code() : gateway.subKind();
            List<Connection> outgoing = outgoing(gateway);

            if (incoming(gateway).isEmpty()) {
                addIssue(IssueType.WARNING, IssueCategory.STRUCTURE,
                        String.format("%s Gateway has no incoming flows", gatewayType), gateway.id());
            }
            if (outgoing.isEmpty()) {
                addIssue(IssueType.WARNING, IssueCategory.STRUCTURE,
                        String.format("%s Gateway has no outgoing flows", gatewayType), gateway.id());
            }

            boolean exclusive = GatewayKind.EXCLUSIVE.code().equals(gatewayType);
            boolean inclusive = GatewayKind.INCLUSIVE.code().equals(gatewayType);
            if ((exclusive || inclusive) && outgoing.size() > 1) {
                long unconditioned = outgoing.stream().filter(c -> !hasCondition(c)).count();
                boolean hasDefault = outgoing.stream().anyMatch(Connection::isDefault);
                if (unconditioned == outgoing.size() && !hasDefault) {
                    addIssue(IssueType.WARNING, IssueCategory.BEST_PRACTICE,
                            String.format("%s Gateway should have conditions on outgoing flows", gatewayType), gateway.id());
                }
                if (exclusive && unconditioned == 0 && !hasDefault) {
                    addIssue(IssueType.INFO, IssueCategory.BEST_PRACTICE,
                            "Consider marking one outgoing flow as default for Exclusive Gateway", gateway.id());
                }
            }

            if (GatewayKind.PARALLEL.code().equals(gatewayType) && outgoing.stream().anyMatch(ProcessValidator::hasCondition)) {
                addIssue(IssueType.WARNING, IssueCategory.BPMN_COMPLIANCE,
                        "Parallel Gateway should not have conditions on outgoing flows", gateway.id());
            }
        }
    }

    private void validateConnectivity() {
        for (Node node : graph.nodes()) {
            if (!isFlowNode(node)) {
                continue;
            }
            EventPhase phase = node.kind() == NodeKind.EVENT ? EventPhase.fromCode(node.subKind()) : null;
            if (phase != EventPhase.START && incoming(node).isEmpty()) {
                addIssue(IssueType.WARNING, IssueCategory.STRUCTURE,
                        String.format("%s \"%s\" has no incoming connections", node.kind().code(), node.label()), node.id());
            }
            if (phase != EventPhase.END && outgoing(node).isEmpty()) {
                addIssue(IssueType.WARNING, IssueCategory.STRUCTURE,
                        String.format("%s \"%s\" has no outgoing connections", node.kind().code(), node.label()), node.id());
            }
        }
    }

    /**
     * A label equal to the id means the element was never named.
     */
    private void validateLabels() {
        for (Node node : graph.nodes()) {
            if (isFlowNode(node) && (node.label().isBlank() || node.label().equals(node.id()))) {
                addIssue(IssueType.INFO, IssueCategory.BEST_PRACTICE,
                        String.format("%s should have a descriptive label", node.kind().code()), node.id());
            }
        }

        long tasks = graph.nodes().stream().filter(node -> node.kind() == NodeKind.TASK).count();
        if (tasks > MAX_TASKS) {
            addIssue(IssueType.INFO, IssueCategory.BEST_PRACTICE,
                    String.format("Process has %d tasks. Consider breaking into sub-processes for better readability.", tasks),
                    null);
        }
    }

    private List<Node> events(EventPhase phase) {
        return graph.nodes().stream()
                .filter(node -> node.kind() == NodeKind.EVENT && phase.code().equals(node.subKind()))
                .toList();
    }

    private List<Connection> incoming(Node node) {
        return graph.connections().stream()
                .filter(c -> c.isSequenceFlow() && node.id().equals(c.targetId()))
                .toList();
    }

    private List<Connection> outgoing(Node node) {
        return graph.connections().stream()
                .filter(c -> c.isSequenceFlow() && node.id().equals(c.sourceId()))
                .toList();
    }

    private static boolean hasCondition(Connection connection) {
        return connection.condition() != null && !connection.condition().isBlank();
    }

    private static boolean isFlowNode(Node node) {
        return node.kind() == NodeKind.EVENT || node.kind() == NodeKind.TASK || node.kind() == NodeKind.GATEWAY;
    }

    private void addIssue(IssueType type, IssueCategory category, String message, String nodeId) {
        issues.add(new ValidationIssue("validation-" + (issues.size() + 1), type, category, message, nodeId));
    }
}
