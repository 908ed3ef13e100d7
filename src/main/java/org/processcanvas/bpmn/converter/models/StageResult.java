package org.processcanvas.bpmn.converter.models;

import java.util.List;

/**
 * Output of an import stage together with the diagnostics it recorded.
 */
public record StageResult<T>(
        T value,
        List<Diagnostic> diagnostics
) {
    public StageResult {
        diagnostics = List.copyOf(diagnostics);
    }
}
