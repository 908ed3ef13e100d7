package org.processcanvas.bpmn.converter.models;

import org.processcanvas.bpmn.graph.models.NodeKind;

/**
 * Result of classifying a semantic element: a node kind plus a kind-dependent sub-kind code.
 * An element with no entry in the tag table is {@link #UNCLASSIFIED}.
 */
public record Classification(
        NodeKind kind,
        String subKind
) {
    public static final Classification UNCLASSIFIED = new Classification(null, null);

    public boolean isClassified() {
        return kind != null;
    }
}
