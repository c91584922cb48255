package com.deliverable.deliverable_parser.engine;

import com.deliverable.deliverable_parser.model.domain.NodeType;
import com.deliverable.deliverable_parser.model.domain.WorkflowNode;
import com.deliverable.deliverable_parser.model.parse.RawStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class NodeClassifierTest {

    private NodeClassifier classifier;

    @BeforeEach
    public void setUp() {
        this.classifier = new NodeClassifier();
    }

    @Test
    public void shouldFrameEmptyInputWithStartAndEnd() {
        List<WorkflowNode> nodes = classifier.classify(List.of());

        assertEquals(2, nodes.size());
        assertEquals(WorkflowNode.of("start", NodeType.START, "Start"), nodes.get(0));
        assertEquals(WorkflowNode.of("end", NodeType.END, "Complete"), nodes.get(1));
    }

    @Test
    public void shouldTypeInteriorStepsByKeyword() {
        List<WorkflowNode> nodes = classifier.classify(List.of(
                step("Gather receipts"),
                step("Review draft"),
                step("Quality check"),
                step("Send to client")));

        assertThat(nodes).extracting(WorkflowNode::id)
                .containsExactly("start", "step-1", "step-2", "step-3", "step-4", "end");
        assertThat(nodes).extracting(WorkflowNode::type)
                .containsExactly(NodeType.START, NodeType.STEP, NodeType.DECISION,
                        NodeType.DECISION, NodeType.STEP, NodeType.END);
    }

    @Test
    public void shouldAbsorbSentinelStepsIntoStartAndEnd() {
        List<WorkflowNode> nodes = classifier.classify(List.of(
                new RawStep("Begin intake", List.of("open ticket")),
                step("Process claim"),
                step("Finish filing")));

        assertEquals(3, nodes.size());
        assertEquals(NodeType.START, nodes.get(0).type());
        assertEquals("Begin intake", nodes.get(0).label());
        assertEquals(List.of("open ticket"), nodes.get(0).substeps());
        assertEquals("step-1", nodes.get(1).id());
        assertEquals(NodeType.END, nodes.get(2).type());
        assertEquals("Finish filing", nodes.get(2).label());
    }

    @Test
    public void shouldKeepExactlyOneStartAndOneEnd() {
        List<WorkflowNode> nodes = classifier.classify(List.of(step("Start here")));

        assertEquals(2, nodes.size());
        assertEquals("Start here", nodes.get(0).label());
        assertEquals("Complete", nodes.get(1).label());
        assertEquals(1, nodes.stream().filter(n -> n.type() == NodeType.START).count());
        assertEquals(1, nodes.stream().filter(n -> n.type() == NodeType.END).count());
    }

    @Test
    public void shouldApplyPositionBeforeKeyword() {
        assertEquals(NodeType.START, classifier.typeFor(0, 5, "Review everything"));
        assertEquals(NodeType.END, classifier.typeFor(4, 5, "Decision made"));
        assertEquals(NodeType.DECISION, classifier.typeFor(2, 5, "Approve budget"));
        assertEquals(NodeType.STEP, classifier.typeFor(2, 5, "Book venue"));
    }

    private static RawStep step(String label) {
        return new RawStep(label, List.of());
    }
}
