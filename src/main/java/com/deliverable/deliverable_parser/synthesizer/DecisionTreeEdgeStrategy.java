package com.deliverable.deliverable_parser.synthesizer;

import com.deliverable.deliverable_parser.model.domain.NodeType;
import com.deliverable.deliverable_parser.model.domain.ParsedWorkflow;
import com.deliverable.deliverable_parser.model.domain.WorkflowEdge;
import com.deliverable.deliverable_parser.model.domain.WorkflowFormat;
import com.deliverable.deliverable_parser.model.domain.WorkflowNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Branches every decision node into a "Yes" and a "No" outcome node.
 *
 * <pre>
 *   start → step-1 → step-2 (decision) ─Yes→ step-2-yes → step-3 → end
 *                                      └No─→ step-2-no  ─────────→ end
 * </pre>
 * The decision node itself has no unlabeled edge; its successor is reached through the Yes outcome.
 * Other nodes chain to the next main node, never to a synthesized outcome.
 */
@Component
public class DecisionTreeEdgeStrategy implements EdgeStrategy {

    static final String YES_LABEL = "Yes - Continue";
    static final String NO_LABEL  = "No - Alternative";

    @Override
    public WorkflowFormat supportedFormat() {
        return WorkflowFormat.DECISION_TREE;
    }

    @Override
    public ParsedWorkflow synthesize(List<WorkflowNode> nodes) {
        List<WorkflowNode> graphNodes = new ArrayList<>();
        List<WorkflowEdge> edges = new ArrayList<>();
        if (nodes.isEmpty()) {
            return new ParsedWorkflow(graphNodes, edges, supportedFormat().getLayout());
        }
        WorkflowNode end = nodes.get(nodes.size() - 1);
        int edgeId = 0;

        for (int i = 0; i < nodes.size(); i++) {
            WorkflowNode current = nodes.get(i);
            graphNodes.add(current);
            if (i == nodes.size() - 1 || current.type() == NodeType.END) continue;
            WorkflowNode next = nodes.get(i + 1);

            if (current.type() == NodeType.DECISION) {
                WorkflowNode yes = WorkflowNode.of(current.id() + "-yes", NodeType.STEP, YES_LABEL);
                WorkflowNode no  = WorkflowNode.of(current.id() + "-no", NodeType.STEP, NO_LABEL);
                graphNodes.add(yes);
                graphNodes.add(no);
                edges.add(new WorkflowEdge("edge-" + edgeId++, current.id(), yes.id(), "Yes"));
                edges.add(new WorkflowEdge("edge-" + edgeId++, current.id(), no.id(), "No"));
                edges.add(WorkflowEdge.of("edge-" + edgeId++, yes.id(), next.id()));
                edges.add(WorkflowEdge.of("edge-" + edgeId++, no.id(), end.id()));
            } else {
                edges.add(WorkflowEdge.of("edge-" + edgeId++, current.id(), next.id()));
            }
        }
        return new ParsedWorkflow(graphNodes, edges, supportedFormat().getLayout());
    }
}
