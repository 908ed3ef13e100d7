package org.processcanvas.bpmn.graph.models;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node set plus connection set, as exchanged with the canvas.
 */
public record Graph(
        List<Node> nodes,
        List<Connection> connections
) {
    public Graph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        connections = connections == null ? List.of() : List.copyOf(connections);
    }

    /**
     * Indexes the nodes by id, keeping graph order. A repeated id keeps its first node.
     */
    public Map<String, Node> indexNodes() {
        Map<String, Node> byId = new LinkedHashMap<>();
        for (Node node : nodes) {
            byId.putIfAbsent(node.id(), node);
        }
        return byId;
    }

    public Node findNode(String id) {
        for (Node node : nodes) {
            if (node.id().equals(id)) {
                return node;
            }
        }
        return null;
    }

    public Connection findConnection(String id) {
        for (Connection connection : connections) {
            if (connection.id().equals(id)) {
                return connection;
            }
        }
        return null;
    }

    public List<Node> pools() {
        return nodes.stream().filter(Node::isPool).toList();
    }
}
