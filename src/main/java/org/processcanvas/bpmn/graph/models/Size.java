package org.processcanvas.bpmn.graph.models;

public record Size(double width, double height) {
}
