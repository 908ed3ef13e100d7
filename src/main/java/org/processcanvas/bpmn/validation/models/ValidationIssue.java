package org.processcanvas.bpmn.validation.models;

/**
 * A modelling problem of a graph.
 *
 * @param id     {@code validation-<n>}, numbered in report order
 * @param nodeId the node concerned, null for process-wide issues
 */
public record ValidationIssue(
        String id,
        IssueType type,
        IssueCategory category,
        String message,
        String nodeId
) {
}
