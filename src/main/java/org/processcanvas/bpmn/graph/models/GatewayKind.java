package org.processcanvas.bpmn.graph.models;

/**
 * Sub-kind of a gateway node.
 */
public enum GatewayKind {
    EXCLUSIVE("exclusive"),
    PARALLEL("parallel"),
    INCLUSIVE("inclusive"),
    EVENT_BASED("event-based"),
    COMPLEX("complex");

    private final String code;

    GatewayKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
