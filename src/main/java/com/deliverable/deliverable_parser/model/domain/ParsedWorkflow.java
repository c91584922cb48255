package com.deliverable.deliverable_parser.model.domain;

import java.util.List;

/**
 * Result of one workflow parse. Built fresh per call and never mutated afterwards.
 */
public record ParsedWorkflow(
    List<WorkflowNode> nodes,
    List<WorkflowEdge> edges,
    String layout
) {
    public ParsedWorkflow {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        layout = layout != null ? layout : WorkflowFormat.LINEAR_PROCESS.getLayout();
    }
}
