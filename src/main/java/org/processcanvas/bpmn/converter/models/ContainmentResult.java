package org.processcanvas.bpmn.converter.models;

import org.processcanvas.bpmn.graph.ContainmentTree;

import java.util.List;
import java.util.Map;

/**
 * Pools, lanes and lane membership of a document.
 *
 * @param participants participants by id, in document order
 * @param lanes        every lane by id, orphan lanes included, in discovery order
 * @param tree         pool -> lanes -> member ids
 * @param processIds   ids of all process fragments, in document order
 */
public record ContainmentResult(
        Map<String, ParticipantRecord> participants,
        Map<String, LaneRecord> lanes,
        ContainmentTree tree,
        List<String> processIds,
        List<Diagnostic> diagnostics
) {
}
