package com.deliverable.deliverable_parser.synthesizer;

import com.deliverable.deliverable_parser.model.domain.ParsedWorkflow;
import com.deliverable.deliverable_parser.model.domain.WorkflowEdge;
import com.deliverable.deliverable_parser.model.domain.WorkflowFormat;
import com.deliverable.deliverable_parser.model.domain.WorkflowNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain chain: every node points at its successor, n - 1 edges for n nodes.
 */
abstract class SequentialEdgeStrategy implements EdgeStrategy {

    @Override
    public ParsedWorkflow synthesize(List<WorkflowNode> nodes) {
        List<WorkflowEdge> edges = new ArrayList<>();
        for (int i = 0; i < nodes.size() - 1; i++) {
            edges.add(WorkflowEdge.of("edge-" + i, nodes.get(i).id(), nodes.get(i + 1).id()));
        }
        return new ParsedWorkflow(nodes, edges, supportedFormat().getLayout());
    }
}

@Component
class LinearEdgeStrategy extends SequentialEdgeStrategy {
    @Override public WorkflowFormat supportedFormat() { return WorkflowFormat.LINEAR_PROCESS; }
}

/*
 * Approval gates are already decision-typed review/approve nodes; only the layout tag differs.
 */
@Component
class ApprovalEdgeStrategy extends SequentialEdgeStrategy {
    @Override public WorkflowFormat supportedFormat() { return WorkflowFormat.APPROVAL_WORKFLOW; }
}
