package org.processcanvas.bpmn.converter;

/**
 * Fatal import failure. Nothing is returned to the caller.
 */
public class BpmnImportException extends RuntimeException {
    private final String elementId;

    public BpmnImportException(String message, String elementId, Throwable cause) {
        super(message, cause);
        this.elementId = elementId;
    }

    /**
     * @return id of the offending element, or null when the failure is not tied to one
     */
    public String getElementId() {
        return elementId;
    }
}
