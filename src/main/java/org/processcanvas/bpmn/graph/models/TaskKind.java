package org.processcanvas.bpmn.graph.models;

/**
 * Sub-kind of a task node.
 */
public enum TaskKind {
    USER("user"),
    SERVICE("service"),
    MANUAL("manual"),
    SCRIPT("script"),
    BUSINESS_RULE("business-rule"),
    SEND("send"),
    RECEIVE("receive");

    private final String code;

    TaskKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
