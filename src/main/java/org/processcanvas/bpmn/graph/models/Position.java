package org.processcanvas.bpmn.graph.models;

public record Position(double x, double y) {
}
