package com.deliverable.deliverable_parser.engine;

import com.deliverable.deliverable_parser.model.domain.NodeType;
import com.deliverable.deliverable_parser.model.domain.WorkflowNode;
import com.deliverable.deliverable_parser.model.parse.RawStep;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns extracted steps into typed nodes framed by exactly one start and one end node.
 *
 * A first step that opens with "Start"/"Begin" becomes the start node itself, and a last step
 * that opens with "Complete"/"End"/"Finish" becomes the end node; otherwise a "Start" or
 * "Complete" node is synthesized. With no steps at all the result is just {start, end}.
 */
@Component
public class NodeClassifier {

    public static final String START_ID = "start";
    public static final String END_ID   = "end";
    static final String START_LABEL = "Start";
    static final String END_LABEL   = "Complete";

    private static final Pattern START_SENTINEL = Pattern.compile("^(?:start|begin)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern END_SENTINEL   = Pattern.compile("^(?:complete|end|finish)\\b", Pattern.CASE_INSENSITIVE);
    private static final List<String> DECISION_KEYWORDS = List.of("decision", "review", "approve", "check");

    public List<WorkflowNode> classify(List<RawStep> steps) {
        List<RawStep> interior = new ArrayList<>(steps != null ? steps : List.of());

        WorkflowNode start = WorkflowNode.of(START_ID, NodeType.START, START_LABEL);
        if (!interior.isEmpty() && START_SENTINEL.matcher(interior.get(0).label()).lookingAt()) {
            RawStep first = interior.remove(0);
            start = new WorkflowNode(START_ID, NodeType.START, first.label(), null, first.substeps());
        }
        WorkflowNode end = WorkflowNode.of(END_ID, NodeType.END, END_LABEL);
        if (!interior.isEmpty() && END_SENTINEL.matcher(interior.get(interior.size() - 1).label()).lookingAt()) {
            RawStep last = interior.remove(interior.size() - 1);
            end = new WorkflowNode(END_ID, NodeType.END, last.label(), null, last.substeps());
        }

        int total = interior.size() + 2;
        List<WorkflowNode> nodes = new ArrayList<>(total);
        nodes.add(start);
        for (int i = 0; i < interior.size(); i++) {
            RawStep step = interior.get(i);
            NodeType type = typeFor(i + 1, total, step.label());
            nodes.add(new WorkflowNode("step-" + (i + 1), type, step.label(), null, step.substeps()));
        }
        nodes.add(end);
        return nodes;
    }

    /**
     * Precedence: position 0 is START, the last position is END, then decision keywords, then STEP.
     */
    public NodeType typeFor(int position, int total, String label) {
        if (position == 0) return NodeType.START;
        if (position == total - 1) return NodeType.END;
        String lower = label != null ? label.toLowerCase(Locale.ROOT) : "";
        for (String keyword : DECISION_KEYWORDS) {
            if (lower.contains(keyword)) return NodeType.DECISION;
        }
        return NodeType.STEP;
    }
}
