package org.processcanvas.bpmn.converter.models;

import lombok.Builder;
import org.processcanvas.bpmn.graph.models.EventFlavor;

/**
 * A semantic element of a process fragment that maps to a node.
 *
 * @param tag           local tag name, e.g. "userTask"
 * @param processId     the fragment declaring the element
 * @param label         decoded name, the id when absent
 * @param eventFlavor   events only
 * @param description   tasks only, from the documentation child
 * @param defaultFlowId value of the "default" attribute, if any
 */
@Builder
public record ClassifiedElement(
        String id,
        String tag,
        String processId,
        Classification classification,
        String label,
        EventFlavor eventFlavor,
        String description,
        String defaultFlowId
) {
}
