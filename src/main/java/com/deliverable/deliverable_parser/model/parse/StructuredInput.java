package com.deliverable.deliverable_parser.model.parse;

import com.deliverable.deliverable_parser.model.domain.WorkflowEdge;
import com.deliverable.deliverable_parser.model.domain.WorkflowNode;

import java.util.List;

/**
 * Graph read from a JSON payload. Ids are unique and every edge endpoint exists in {@code nodes}.
 */
public record StructuredInput(
    List<WorkflowNode> nodes,
    List<WorkflowEdge> edges,
    String layout
) implements WorkflowSource {

    public StructuredInput {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }
}
