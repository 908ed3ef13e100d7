package org.processcanvas.bpmn.converter.models;

import org.processcanvas.bpmn.graph.models.Graph;

import java.util.List;

/**
 * A successfully imported graph and the recoverable diagnostics collected on the way.
 */
public record ImportResult(
        Graph graph,
        List<Diagnostic> diagnostics
) {
    public ImportResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasDiagnostic(DiagnosticCode code) {
        return diagnostics.stream().anyMatch(d -> d.code() == code);
    }
}
