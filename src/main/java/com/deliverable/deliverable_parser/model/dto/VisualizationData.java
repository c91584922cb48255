package com.deliverable.deliverable_parser.model.dto;

import com.deliverable.deliverable_parser.model.domain.WorkflowEdge;
import com.deliverable.deliverable_parser.model.domain.WorkflowNode;

import java.util.List;

/**
 * Generic visualization envelope shared with chart types. For workflows {@code type} is
 * always "workflow", {@code data} is empty and the graph travels in {@code config}.
 */
public record VisualizationData(
    String type,
    String title,
    List<Object> data,
    WorkflowConfig config
) {
    public static final String WORKFLOW_TYPE = "workflow";

    public record WorkflowConfig(List<WorkflowNode> nodes, List<WorkflowEdge> edges, String layout) {}
}
