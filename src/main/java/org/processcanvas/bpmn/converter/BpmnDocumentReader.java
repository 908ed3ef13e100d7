package org.processcanvas.bpmn.converter;

import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;

/**
 * First import stage: parses document text into a namespace-aware DOM.
 */
@Slf4j
public class BpmnDocumentReader {

    /**
     * Parses BPMN text and checks for the definitions root.
     *
     * @param documentText the raw document
     * @return the parsed document
     * @throws MalformedDocumentException if the text is not well-formed XML
     * @throws BpmnSchemaException        if the root element is not {@code definitions}
     */
    public static Document read(String documentText) {
        if (documentText == null || documentText.isBlank()) {
            throw new MalformedDocumentException("document is empty", 1, 1, null);
        }

        Document doc;
        try {
            DocumentBuilder builder = newDocumentBuilder();
            doc = builder.parse(new InputSource(new StringReader(documentText.trim())));
        } catch (SAXParseException e) {
            throw new MalformedDocumentException(e.getMessage(), e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException e) {
            throw new MalformedDocumentException(e.getMessage(), -1, -1, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read BPMN text", e);
        }

        Element definitionsEl = doc.getDocumentElement();
        if (definitionsEl == null || !"definitions".equals(definitionsEl.getLocalName())) {
            throw new BpmnSchemaException("missing definitions");
        }
        log.debug("Parsed BPMN document, definitions id '{}'", definitionsEl.getAttribute("id"));
        return doc;
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    /**
     * Turns every parser complaint into an exception instead of the default stderr print.
     */
    private static class RethrowingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException exception) {
            log.debug("XML parser warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
