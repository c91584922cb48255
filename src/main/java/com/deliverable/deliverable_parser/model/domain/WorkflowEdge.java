package com.deliverable.deliverable_parser.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Directed edge between two node ids of the same graph. Label is only set on decision outcomes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowEdge(
    String id,
    String source,
    String target,
    String label
) {
    public static WorkflowEdge of(String id, String source, String target) {
        return new WorkflowEdge(id, source, target, null);
    }
}
