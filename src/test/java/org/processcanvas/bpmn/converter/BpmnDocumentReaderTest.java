package org.processcanvas.bpmn.converter;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BpmnDocumentReaderTest {
    private static final String SCENARIO_A_BPMN = "src/test/resources/bpmn/scenario_a_linear.bpmn";
    private static final String MALFORMED_BPMN = "src/test/resources/bpmn/malformed.bpmn";
    private static final String NOT_DEFINITIONS_XML = "src/test/resources/bpmn/not_definitions.xml";
    private static final String DOCTYPE_BPMN = "src/test/resources/bpmn/doctype.bpmn";

    @Test
    void shouldParseDefinitionsRoot() throws IOException {
        Document doc = BpmnDocumentReader.read(Files.readString(Path.of(SCENARIO_A_BPMN)));

        assertEquals("definitions", doc.getDocumentElement().getLocalName());
        assertEquals(BpmnDom.BPMN_NS, doc.getDocumentElement().getNamespaceURI());
    }

    @Test
    void shouldReportLineAndColumnWhenMalformed() throws IOException {
        String text = Files.readString(Path.of(MALFORMED_BPMN));

        MalformedDocumentException e = assertThrows(MalformedDocumentException.class,
                () -> BpmnDocumentReader.read(text));
        assertTrue(e.getLineNumber() > 0);
        assertTrue(e.getColumnNumber() > 0);
        assertTrue(e.getMessage().startsWith("Invalid XML at line"));
    }

    @Test
    void shouldRejectRootOtherThanDefinitions() throws IOException {
        String text = Files.readString(Path.of(NOT_DEFINITIONS_XML));

        BpmnSchemaException e = assertThrows(BpmnSchemaException.class, () -> BpmnDocumentReader.read(text));
        assertEquals("missing definitions", e.getMessage());
    }

    @Test
    void shouldRefuseDoctypeDeclarations() throws IOException {
        String text = Files.readString(Path.of(DOCTYPE_BPMN));

        assertThrows(MalformedDocumentException.class, () -> BpmnDocumentReader.read(text));
    }

    @Test
    void shouldRejectEmptyText() {
        assertThrows(MalformedDocumentException.class, () -> BpmnDocumentReader.read("  "));
        assertThrows(MalformedDocumentException.class, () -> BpmnDocumentReader.read(null));
    }
}
