package com.deliverable.deliverable_parser.service;

import com.deliverable.deliverable_parser.config.ParserProperties;
import com.deliverable.deliverable_parser.model.domain.ChecklistProgress;
import com.deliverable.deliverable_parser.model.domain.ParsedWorkflow;
import com.deliverable.deliverable_parser.model.domain.WorkflowNode;
import com.deliverable.deliverable_parser.model.dto.ChecklistResponse;
import com.deliverable.deliverable_parser.model.dto.VisualizationData;
import com.deliverable.deliverable_parser.synthesizer.ParserFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DeliverableServiceTest {

    private static final String STEPS = "1. Draft proposal\n2. Send to client";

    private DeliverableService service;

    @BeforeEach
    public void setUp() {
        ParserProperties properties = new ParserProperties();
        this.service = new DeliverableService(
                ParserFixtures.workflowAssembler(properties),
                ParserFixtures.checklistParser(properties),
                new ChatModeNormalizer());
    }

    @Test
    public void shouldSkipVisualizationOutsideWorkflowMode() {
        assertTrue(service.generateWorkflowVisualization(STEPS, "standard", null).isEmpty());
        assertTrue(service.generateWorkflowVisualization(STEPS, "checklist", null).isEmpty());
        assertTrue(service.generateWorkflowVisualization(STEPS, null, null).isEmpty());
    }

    @Test
    public void shouldWrapWorkflowInVisualizationEnvelope() {
        Optional<VisualizationData> result = service.generateWorkflowVisualization(STEPS, "workflow", null);

        assertTrue(result.isPresent());
        VisualizationData data = result.get();
        assertEquals("workflow", data.type());
        assertEquals("Linear Process Workflow", data.title());
        assertTrue(data.data().isEmpty());
        assertEquals("linear-process", data.config().layout());
        assertEquals(service.parseWorkflow(STEPS, null).nodes(), data.config().nodes());
    }

    @Test
    public void shouldApplySelectedFormat() {
        VisualizationData data = service.generateWorkflowVisualization(STEPS, "Workflow", "decision").orElseThrow();

        assertEquals("decision-tree", data.config().layout());
        assertEquals("Decision Tree Workflow", data.title());
    }

    @Test
    public void shouldIgnoreUnknownFormat() {
        assertEquals("linear-process", service.parseWorkflow(STEPS, "zigzag").layout());
        assertEquals("parallel-workflow", service.parseWorkflow(STEPS, "parallel-workflow").layout());
    }

    @Test
    public void shouldTitleUnknownStructuredLayouts() {
        ParsedWorkflow workflow = new ParsedWorkflow(
                List.of(WorkflowNode.of("a", null, "A")), List.of(), "swimlane");

        assertEquals("Structured Workflow", service.toVisualization(workflow).title());
    }

    @Test
    public void shouldReportChecklistProgress() {
        ChecklistResponse response = service.parseChecklist("## Prep\n- [x] a\n- [ ] b\n## Go\n- [ ] c");

        ChecklistProgress progress = response.progress();
        assertEquals(3, progress.total());
        assertEquals(1, progress.completed());
        assertEquals(33, progress.percent());
        assertEquals(List.of(
                new ChecklistProgress.SectionProgress("Prep", 2, 1),
                new ChecklistProgress.SectionProgress("Go", 1, 0)), progress.sections());
    }

    @Test
    public void shouldReportZeroProgressForEmptyChecklist() {
        ChecklistProgress progress = service.parseChecklist("").progress();

        assertEquals(0, progress.total());
        assertEquals(0, progress.percent());
    }
}
