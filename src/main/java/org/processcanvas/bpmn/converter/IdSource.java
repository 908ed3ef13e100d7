package org.processcanvas.bpmn.converter;

/**
 * Supplies ids for elements synthesized during export (definitions, processes, collaboration, diagram).
 * One instance serves one export call.
 */
public interface IdSource {

    /**
     * @param prefix element type prefix, e.g. "Process"; must start with a letter
     * @return an id unique within this source
     */
    String nextId(String prefix);
}
