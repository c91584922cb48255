package com.deliverable.deliverable_parser.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One diagram node. The label is display text and may already be truncated.
 * Null-safe: a null substeps list is treated as empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowNode(
    String id,
    NodeType type,
    String label,
    String description,
    List<String> substeps
) {
    public WorkflowNode {
        type = type != null ? type : NodeType.STEP;
        label = label != null ? label : "";
        substeps = substeps != null ? List.copyOf(substeps) : List.of();
    }

    public static WorkflowNode of(String id, NodeType type, String label) {
        return new WorkflowNode(id, type, label, null, List.of());
    }

    public WorkflowNode withType(NodeType newType) {
        return new WorkflowNode(id, newType, label, description, substeps);
    }
}
