package org.processcanvas.bpmn.converter.models;

public enum Severity {
    INFO,
    WARNING
}
