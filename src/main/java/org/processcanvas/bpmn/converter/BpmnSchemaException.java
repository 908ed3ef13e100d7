package org.processcanvas.bpmn.converter;

/**
 * The document is XML but not a usable BPMN document: no definitions root, or no process to import.
 */
public class BpmnSchemaException extends BpmnImportException {

    public BpmnSchemaException(String message) {
        super(message, null, null);
    }

    public BpmnSchemaException(String message, String elementId) {
        super(message, elementId, null);
    }
}
