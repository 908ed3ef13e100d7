package org.processcanvas.bpmn.graph.models;

/**
 * Sub-kind of an event node.
 */
public enum EventPhase {
    START("start"),
    INTERMEDIATE("intermediate"),
    END("end");

    private final String code;

    EventPhase(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * @return the phase for the given code, or null when the code is not an event phase
     */
    public static EventPhase fromCode(String code) {
        for (EventPhase phase : values()) {
            if (phase.code.equals(code)) {
                return phase;
            }
        }
        return null;
    }
}
