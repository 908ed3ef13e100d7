package org.processcanvas.bpmn.converter;

/**
 * Deterministic ids: {@code Process_1}, {@code Definitions_2}, ...
 */
public class SequentialIdSource implements IdSource {
    private int counter;

    @Override
    public String nextId(String prefix) {
        counter++;
        return prefix + "_" + counter;
    }
}
