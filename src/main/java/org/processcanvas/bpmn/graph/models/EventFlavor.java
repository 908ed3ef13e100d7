package org.processcanvas.bpmn.graph.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Display-only flavour of an event, taken from its event definition child.
 * Never used for connection handle selection.
 */
public enum EventFlavor {
    MESSAGE("message", "messageEventDefinition"),
    TIMER("timer", "timerEventDefinition"),
    ERROR("error", "errorEventDefinition"),
    ESCALATION("escalation", "escalationEventDefinition");

    private final String code;
    private final String definitionTag;

    EventFlavor(String code, String definitionTag) {
        this.code = code;
        this.definitionTag = definitionTag;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String definitionTag() {
        return definitionTag;
    }

    @JsonCreator
    public static EventFlavor fromCode(String code) {
        for (EventFlavor flavor : values()) {
            if (flavor.code.equals(code)) {
                return flavor;
            }
        }
        throw new IllegalArgumentException("Unknown event flavor: " + code);
    }
}
