package org.processcanvas.bpmn.graph.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConnectionKind {
    SEQUENCE_FLOW("sequence-flow"),
    MESSAGE_FLOW("message-flow");

    private final String code;

    ConnectionKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ConnectionKind fromCode(String code) {
        for (ConnectionKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown connection kind: " + code);
    }
}
