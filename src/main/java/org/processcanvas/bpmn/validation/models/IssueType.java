package org.processcanvas.bpmn.validation.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueType {
    ERROR("error"),
    WARNING("warning"),
    INFO("info");

    private final String code;

    IssueType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
