package org.processcanvas.bpmn.graph.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a diagram node, with the size a node of that kind gets when no layout says otherwise.
 */
public enum NodeKind {
    EVENT("event", 30, 30),
    TASK("task", 100, 80),
    GATEWAY("gateway", 40, 40),
    DATA_OBJECT("data-object", 36, 50),
    POOL("pool-with-lanes", 600, 250),
    SHAPE("shape", 100, 80),
    NOTE("note", 100, 30);

    private final String code;
    private final double defaultWidth;
    private final double defaultHeight;

    NodeKind(String code, double defaultWidth, double defaultHeight) {
        this.code = code;
        this.defaultWidth = defaultWidth;
        this.defaultHeight = defaultHeight;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public Size defaultSize() {
        return new Size(defaultWidth, defaultHeight);
    }

    @JsonCreator
    public static NodeKind fromCode(String code) {
        for (NodeKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node kind: " + code);
    }
}
