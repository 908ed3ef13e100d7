package org.processcanvas.bpmn.converter;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * Namespaces of BPMN 2.0 documents and DOM lookups by local name.
 * Lookups accept elements in the expected namespace and, for hand-written documents, elements without a namespace.
 */
public final class BpmnDom {
    public static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";
    public static final String BPMNDI_NS = "http://www.omg.org/spec/BPMN/20100524/DI";
    public static final String DC_NS = "http://www.omg.org/spec/DD/20100524/DC";
    public static final String DI_NS = "http://www.omg.org/spec/DD/20100524/DI";
    public static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";

    private BpmnDom() {
    }

    public static boolean is(Node node, String namespace, String localName) {
        if (node.getNodeType() != Node.ELEMENT_NODE || !localName.equals(node.getLocalName())) {
            return false;
        }
        String actual = node.getNamespaceURI();
        return actual == null || actual.equals(namespace);
    }

    /**
     * All descendant elements with the given name, in document order.
     */
    public static List<Element> descendants(Node root, String namespace, String localName) {
        NodeList nodes = root.getNodeType() == Node.DOCUMENT_NODE
                ? ((Document) root).getElementsByTagNameNS("*", localName)
                : ((Element) root).getElementsByTagNameNS("*", localName);
        List<Element> result = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (is(nodes.item(i), namespace, localName)) {
                result.add((Element) nodes.item(i));
            }
        }
        return result;
    }

    /**
     * Direct child elements with the given name, in document order.
     */
    public static List<Element> children(Element parent, String namespace, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (is(child, namespace, localName)) {
                result.add((Element) child);
            }
        }
        return result;
    }

    /**
     * All direct child elements, in document order.
     */
    public static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) child);
            }
        }
        return result;
    }

    public static Element firstChild(Element parent, String namespace, String localName) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (is(child, namespace, localName)) {
                return (Element) child;
            }
        }
        return null;
    }

    /**
     * @return the attribute value, or null when it is absent or empty
     */
    public static String attr(Element element, String name) {
        String value = element.getAttribute(name);
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * @return the trimmed text content, or null when it is blank
     */
    public static String text(Element element) {
        if (element == null) {
            return null;
        }
        String value = element.getTextContent();
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }
}
