package org.processcanvas.bpmn.converter.models;

public enum DiagnosticCode {
    DANGLING_REFERENCE,
    DUPLICATE_LANE_CLAIM,
    DUPLICATE_LANE_MEMBERSHIP,
    INVALID_LANE_MEMBER,
    DUPLICATE_ID
}
