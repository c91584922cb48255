package com.deliverable.deliverable_parser.synthesizer;

import com.deliverable.deliverable_parser.config.ParserProperties;
import com.deliverable.deliverable_parser.model.domain.NodeType;
import com.deliverable.deliverable_parser.model.domain.ParsedWorkflow;
import com.deliverable.deliverable_parser.model.domain.WorkflowEdge;
import com.deliverable.deliverable_parser.model.domain.WorkflowFormat;
import com.deliverable.deliverable_parser.model.domain.WorkflowNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.deliverable.deliverable_parser.support.WorkflowAssertions.assertWellFormed;
import static com.deliverable.deliverable_parser.support.WorkflowAssertions.outgoing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EdgeStrategiesTest {

    private ParserProperties properties;
    private EdgeStrategyRegistry registry;

    @BeforeEach
    public void setUp() {
        this.properties = new ParserProperties();
        this.registry = ParserFixtures.registry(properties);
    }

    @Test
    public void shouldChainLinearNodes() {
        ParsedWorkflow workflow = registry.get(WorkflowFormat.LINEAR_PROCESS).synthesize(nodes(NodeType.STEP, NodeType.STEP));

        assertEquals("linear-process", workflow.layout());
        assertEquals(List.of(
                WorkflowEdge.of("edge-0", "start", "step-1"),
                WorkflowEdge.of("edge-1", "step-1", "step-2"),
                WorkflowEdge.of("edge-2", "step-2", "end")), workflow.edges());
    }

    @Test
    public void shouldChainApprovalNodesWithApprovalLayout() {
        ParsedWorkflow workflow = registry.get(WorkflowFormat.APPROVAL_WORKFLOW)
                .synthesize(nodes(NodeType.STEP, NodeType.DECISION));

        assertEquals("approval-workflow", workflow.layout());
        assertEquals(3, workflow.edges().size());
        assertWellFormed(workflow);
    }

    @Test
    public void shouldInsertYesAndNoOutcomesAfterDecision() {
        ParsedWorkflow workflow = registry.get(WorkflowFormat.DECISION_TREE)
                .synthesize(nodes(NodeType.STEP, NodeType.DECISION, NodeType.STEP));

        assertThat(workflow.nodes()).extracting(WorkflowNode::id)
                .containsExactly("start", "step-1", "step-2", "step-2-yes", "step-2-no", "step-3", "end");
        assertEquals(DecisionTreeEdgeStrategy.YES_LABEL, workflow.nodes().get(3).label());
        assertEquals(DecisionTreeEdgeStrategy.NO_LABEL, workflow.nodes().get(4).label());

        assertEquals(List.of(
                new WorkflowEdge("edge-2", "step-2", "step-2-yes", "Yes"),
                new WorkflowEdge("edge-3", "step-2", "step-2-no", "No")), outgoing(workflow, "step-2"));
        assertEquals(List.of(WorkflowEdge.of("edge-4", "step-2-yes", "step-3")), outgoing(workflow, "step-2-yes"));
        assertEquals(List.of(WorkflowEdge.of("edge-5", "step-2-no", "end")), outgoing(workflow, "step-2-no"));
        assertEquals(7, workflow.edges().size());
        assertWellFormed(workflow);
    }

    @Test
    public void shouldRouteDecisionRightBeforeEndToEnd() {
        ParsedWorkflow workflow = registry.get(WorkflowFormat.DECISION_TREE).synthesize(nodes(NodeType.DECISION));

        assertEquals(List.of("end"), outgoing(workflow, "step-1-yes").stream().map(WorkflowEdge::target).toList());
        assertEquals(List.of("end"), outgoing(workflow, "step-1-no").stream().map(WorkflowEdge::target).toList());
        assertWellFormed(workflow);
    }

    @Test
    public void shouldNotBranchWithoutDecisionNodes() {
        ParsedWorkflow workflow = registry.get(WorkflowFormat.DECISION_TREE).synthesize(nodes(NodeType.STEP));

        assertEquals(3, workflow.edges().size());
        assertTrue(workflow.edges().stream().allMatch(e -> e.label() == null));
    }

    @Test
    public void shouldFanOutToCappedBranchesAndChainOverflow() {
        ParsedWorkflow workflow = registry.get(WorkflowFormat.PARALLEL_WORKFLOW)
                .synthesize(nodes(NodeType.STEP, NodeType.STEP, NodeType.STEP, NodeType.STEP, NodeType.STEP));

        assertEquals("parallel-workflow", workflow.layout());
        assertThat(outgoing(workflow, "start")).extracting(WorkflowEdge::target)
                .containsExactly("step-1", "step-2", "step-3");
        assertThat(outgoing(workflow, "step-1")).extracting(WorkflowEdge::target).containsExactly("end");
        assertThat(outgoing(workflow, "step-2")).extracting(WorkflowEdge::target).containsExactly("end");
        assertThat(outgoing(workflow, "step-3")).extracting(WorkflowEdge::target).containsExactly("step-4");
        assertThat(outgoing(workflow, "step-4")).extracting(WorkflowEdge::target).containsExactly("step-5");
        assertThat(outgoing(workflow, "step-5")).extracting(WorkflowEdge::target).containsExactly("end");
        assertEquals(8, workflow.edges().size());
        assertWellFormed(workflow);
    }

    @Test
    public void shouldFanOutFewerNodesThanCap() {
        ParsedWorkflow workflow = registry.get(WorkflowFormat.PARALLEL_WORKFLOW)
                .synthesize(nodes(NodeType.STEP, NodeType.STEP));

        assertEquals(4, workflow.edges().size());
        assertThat(outgoing(workflow, "start")).extracting(WorkflowEdge::target).containsExactly("step-1", "step-2");
        assertWellFormed(workflow);
    }

    @Test
    public void shouldConnectStartToEndWhenNothingToParallelize() {
        ParsedWorkflow workflow = registry.get(WorkflowFormat.PARALLEL_WORKFLOW).synthesize(nodes());

        assertEquals(List.of(WorkflowEdge.of("edge-start-0", "start", "end")), workflow.edges());
    }

    @Test
    public void shouldHonourConfiguredBranchCap() {
        properties.setMaxParallelBranches(1);

        ParsedWorkflow workflow = registry.get(WorkflowFormat.PARALLEL_WORKFLOW)
                .synthesize(nodes(NodeType.STEP, NodeType.STEP, NodeType.STEP));

        assertThat(outgoing(workflow, "start")).extracting(WorkflowEdge::target).containsExactly("step-1");
        assertWellFormed(workflow);
    }

    @Test
    public void shouldRegisterEveryFormat() {
        for (WorkflowFormat format : WorkflowFormat.values()) {
            assertTrue(registry.isSupported(format));
            assertEquals(format, registry.get(format).supportedFormat());
        }
    }

    @Test
    public void shouldRejectUnregisteredFormat() {
        EdgeStrategyRegistry empty = new EdgeStrategyRegistry(List.of());

        assertFalse(empty.isSupported(WorkflowFormat.LINEAR_PROCESS));
        assertThrows(IllegalArgumentException.class, () -> empty.get(WorkflowFormat.LINEAR_PROCESS));
    }

    // start, step-1..n with the given types, end
    private static List<WorkflowNode> nodes(NodeType... interior) {
        List<WorkflowNode> nodes = new ArrayList<>();
        nodes.add(WorkflowNode.of("start", NodeType.START, "Start"));
        for (int i = 0; i < interior.length; i++) {
            nodes.add(WorkflowNode.of("step-" + (i + 1), interior[i], "Step " + (i + 1)));
        }
        nodes.add(WorkflowNode.of("end", NodeType.END, "Complete"));
        return nodes;
    }
}
