package org.processcanvas.bpmn.converter.models;

/**
 * A collaboration participant, which becomes a pool.
 *
 * @param processRef id of the process fragment the participant owns, may be null for black-box pools
 */
public record ParticipantRecord(
        String id,
        String name,
        String processRef,
        String color
) {
}
