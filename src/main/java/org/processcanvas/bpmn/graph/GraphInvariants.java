package org.processcanvas.bpmn.graph;

import org.processcanvas.bpmn.graph.models.Connection;
import org.processcanvas.bpmn.graph.models.Graph;
import org.processcanvas.bpmn.graph.models.Lane;
import org.processcanvas.bpmn.graph.models.Node;
import org.processcanvas.bpmn.graph.models.NodeKind;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Checks the structural invariants of a graph and builds its ownership tree.
 * Any violation is a programming error of the caller and fails with {@link IllegalStateException}.
 */
public class GraphInvariants {

    /**
     * Verifies the graph and returns its containment tree.
     *
     * @param graph the graph to check
     * @return the ownership tree of pools, lanes and lane members
     * @throws IllegalStateException on the first violated invariant
     */
    public static ContainmentTree check(Graph graph) {
        if (graph == null) {
            throw new IllegalStateException("Graph is required");
        }

        Map<String, Node> nodesById = new HashMap<>();
        for (Node node : graph.nodes()) {
            if (node.id() == null || node.id().isBlank()) {
                throw new IllegalStateException("Node without id");
            }
            if (node.kind() == null) {
                throw new IllegalStateException(String.format("Node '%s' has no kind", node.id()));
            }
            if (nodesById.put(node.id(), node) != null) {
                throw new IllegalStateException(String.format("Duplicate node id '%s'", node.id()));
            }
        }

        ContainmentTree tree = new ContainmentTree();
        for (Node node : graph.nodes()) {
            if (node.isPool()) {
                if (node.containerId() != null) {
                    throw new IllegalStateException(String.format("Pool '%s' cannot be contained in '%s'",
                            node.id(), node.containerId()));
                }
                tree.addPool(node.id());
            }
        }
        for (Node pool : graph.pools()) {
            for (Lane lane : pool.lanes()) {
                if (nodesById.containsKey(lane.id())) {
                    throw new IllegalStateException(String.format("Lane '%s' of pool '%s' clashes with a node id",
                            lane.id(), pool.id()));
                }
                tree.attachLane(pool.id(), lane.id());
            }
        }

        for (Node node : graph.nodes()) {
            assignToLane(node, nodesById, tree);
        }

        Set<String> connectionIds = new HashSet<>();
        Set<String> defaultSources = new HashSet<>();
        for (Connection connection : graph.connections()) {
            if (connection.id() == null || !connectionIds.add(connection.id())) {
                throw new IllegalStateException(String.format("Missing or duplicate connection id '%s'", connection.id()));
            }
            if (nodesById.containsKey(connection.id())) {
                throw new IllegalStateException(String.format("Connection id '%s' clashes with a node id", connection.id()));
            }
            checkEndpoint(connection, connection.sourceId(), nodesById);
            checkEndpoint(connection, connection.targetId(), nodesById);
            if (connection.isDefault() && connection.isSequenceFlow() && !defaultSources.add(connection.sourceId())) {
                throw new IllegalStateException(String.format("Node '%s' has more than one default flow",
                        connection.sourceId()));
            }
        }
        return tree;
    }

    private static void assignToLane(Node node, Map<String, Node> nodesById, ContainmentTree tree) {
        String containerId = node.containerId();
        String laneId = node.laneId();

        if (containerId != null) {
            Node container = nodesById.get(containerId);
            if (container == null) {
                throw new IllegalStateException(String.format("Node '%s' refers to missing container '%s'",
                        node.id(), containerId));
            }
            if (!container.isPool()) {
                throw new IllegalStateException(String.format("Container '%s' of node '%s' is not a pool",
                        containerId, node.id()));
            }
            if (laneId == null || container.findLane(laneId) == null) {
                throw new IllegalStateException(String.format("Pool '%s' has no lane '%s' for node '%s'",
                        containerId, laneId, node.id()));
            }
            tree.assignMember(laneId, node.id());
            return;
        }

        if (laneId != null) {
            String owner = tree.poolOf(laneId);
            if (owner != null) {
                throw new IllegalStateException(String.format("Node '%s' is in lane '%s' of pool '%s' but has no container",
                        node.id(), laneId, owner));
            }
            if (!tree.hasLane(laneId)) {
                tree.addOrphanLane(laneId);
            }
            tree.assignMember(laneId, node.id());
        }
    }

    private static void checkEndpoint(Connection connection, String nodeId, Map<String, Node> nodesById) {
        Node node = nodeId == null ? null : nodesById.get(nodeId);
        if (node == null) {
            throw new IllegalStateException(String.format("Connection '%s' refers to missing node '%s'",
                    connection.id(), nodeId));
        }
        if (node.kind() == NodeKind.SHAPE) {
            throw new IllegalStateException(String.format("Connection '%s' refers to canvas-only shape '%s'",
                    connection.id(), nodeId));
        }
        if (node.isPool() && connection.isSequenceFlow()) {
            throw new IllegalStateException(String.format("Sequence flow '%s' touches pool '%s'; pools only take message flows",
                    connection.id(), nodeId));
        }
    }
}
