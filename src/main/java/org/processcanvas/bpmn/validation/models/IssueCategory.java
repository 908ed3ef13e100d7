package org.processcanvas.bpmn.validation.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueCategory {
    STRUCTURE("structure"),
    BPMN_COMPLIANCE("bpmn-compliance"),
    BEST_PRACTICE("best-practice");

    private final String code;

    IssueCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
