package org.processcanvas.bpmn.converter.models;

/**
 * A recoverable inconsistency found during import. The import carries on and reports it.
 *
 * @param elementId id of the offending element
 */
public record Diagnostic(
        DiagnosticCode code,
        Severity severity,
        String elementId,
        String message
) {
    public static Diagnostic warning(DiagnosticCode code, String elementId, String message) {
        return new Diagnostic(code, Severity.WARNING, elementId, message);
    }
}
