package org.processcanvas.bpmn.converter;

/**
 * The document text is not well-formed XML. The message carries the parser diagnostic.
 */
public class MalformedDocumentException extends BpmnImportException {
    private final int lineNumber;
    private final int columnNumber;

    public MalformedDocumentException(String parserMessage, int lineNumber, int columnNumber, Throwable cause) {
        super(String.format("Invalid XML at line %d, column %d: %s", lineNumber, columnNumber, parserMessage), null, cause);
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getColumnNumber() {
        return columnNumber;
    }
}
