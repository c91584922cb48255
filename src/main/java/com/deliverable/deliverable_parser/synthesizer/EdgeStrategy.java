package com.deliverable.deliverable_parser.synthesizer;

import com.deliverable.deliverable_parser.model.domain.ParsedWorkflow;
import com.deliverable.deliverable_parser.model.domain.WorkflowFormat;
import com.deliverable.deliverable_parser.model.domain.WorkflowNode;

import java.util.List;

public interface EdgeStrategy {

    WorkflowFormat supportedFormat();

    // nodes arrive typed, start first and end last; strategies may add outcome nodes
    ParsedWorkflow synthesize(List<WorkflowNode> nodes);
}
