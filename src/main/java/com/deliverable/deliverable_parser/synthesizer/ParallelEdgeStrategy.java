package com.deliverable.deliverable_parser.synthesizer;

import com.deliverable.deliverable_parser.config.ParserProperties;
import com.deliverable.deliverable_parser.model.domain.ParsedWorkflow;
import com.deliverable.deliverable_parser.model.domain.WorkflowEdge;
import com.deliverable.deliverable_parser.model.domain.WorkflowFormat;
import com.deliverable.deliverable_parser.model.domain.WorkflowNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fan-out / fan-in: the start node points at up to {@code maxParallelBranches} intermediate
 * nodes and each of them points at the end node. Intermediate nodes past the cap continue
 * the last branch as a chain that ends in the end node.
 */
@Component
@RequiredArgsConstructor
public class ParallelEdgeStrategy implements EdgeStrategy {

    private final ParserProperties properties;

    @Override
    public WorkflowFormat supportedFormat() {
        return WorkflowFormat.PARALLEL_WORKFLOW;
    }

    @Override
    public ParsedWorkflow synthesize(List<WorkflowNode> nodes) {
        List<WorkflowEdge> edges = new ArrayList<>();
        if (nodes.size() < 2) {
            return new ParsedWorkflow(nodes, edges, supportedFormat().getLayout());
        }
        WorkflowNode start = nodes.get(0);
        WorkflowNode end = nodes.get(nodes.size() - 1);
        List<WorkflowNode> middle = nodes.subList(1, nodes.size() - 1);

        if (middle.isEmpty()) {
            edges.add(WorkflowEdge.of("edge-start-0", start.id(), end.id()));
            return new ParsedWorkflow(nodes, edges, supportedFormat().getLayout());
        }

        int branches = Math.min(properties.effectiveMaxParallelBranches(), middle.size());
        for (int b = 0; b < branches; b++) {
            edges.add(WorkflowEdge.of("edge-start-" + b, start.id(), middle.get(b).id()));
        }
        for (int b = 0; b < branches - 1; b++) {
            edges.add(WorkflowEdge.of("edge-end-" + b, middle.get(b).id(), end.id()));
        }

        // last branch carries the overflow, if any
        List<WorkflowNode> tail = middle.subList(branches - 1, middle.size());
        for (int t = 0; t < tail.size() - 1; t++) {
            edges.add(WorkflowEdge.of("edge-tail-" + t, tail.get(t).id(), tail.get(t + 1).id()));
        }
        edges.add(WorkflowEdge.of("edge-end-" + (branches - 1), tail.get(tail.size() - 1).id(), end.id()));

        return new ParsedWorkflow(nodes, edges, supportedFormat().getLayout());
    }
}
