package com.deliverable.deliverable_parser.service;

import com.deliverable.deliverable_parser.checklist.ChecklistParser;
import com.deliverable.deliverable_parser.engine.WorkflowAssembler;
import com.deliverable.deliverable_parser.model.domain.ChatMode;
import com.deliverable.deliverable_parser.model.domain.ChecklistProgress;
import com.deliverable.deliverable_parser.model.domain.ChecklistSection;
import com.deliverable.deliverable_parser.model.domain.ParsedWorkflow;
import com.deliverable.deliverable_parser.model.domain.WorkflowFormat;
import com.deliverable.deliverable_parser.model.dto.ChecklistResponse;
import com.deliverable.deliverable_parser.model.dto.VisualizationData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class DeliverableService {

    private final WorkflowAssembler  workflowAssembler;
    private final ChecklistParser    checklistParser;
    private final ChatModeNormalizer chatModeNormalizer;

    /**
     * Parses a response into a workflow graph.
     * @param formatId optional format selection ("linear", "decision", "parallel", "approval" or a
     *                 layout tag); unknown ids are ignored and the classifier decides
     */
    public ParsedWorkflow parseWorkflow(String text, String formatId) {
        WorkflowFormat override = WorkflowFormat.fromId(formatId).orElse(null);
        if (override == null && formatId != null && !formatId.isBlank()) {
            log.debug("Ignoring unknown workflow format '{}'", formatId);
        }
        return workflowAssembler.parseWorkflow(text, override);
    }

    /**
     * Builds the renderer envelope for a chat response. Workflow extraction only runs in
     * workflow mode; every other mode gets an empty result.
     */
    public Optional<VisualizationData> generateWorkflowVisualization(String response, String chatMode, String formatId) {
        if (chatModeNormalizer.normalize(chatMode) != ChatMode.WORKFLOW) {
            return Optional.empty();
        }
        return Optional.of(toVisualization(parseWorkflow(response, formatId)));
    }

    public VisualizationData toVisualization(ParsedWorkflow workflow) {
        String name = WorkflowFormat.fromId(workflow.layout())
                .map(WorkflowFormat::getDisplayName)
                .orElse("Structured");
        String title = name.endsWith(" Workflow") ? name : name + " Workflow";
        return new VisualizationData(
                VisualizationData.WORKFLOW_TYPE,
                title,
                List.of(),
                new VisualizationData.WorkflowConfig(workflow.nodes(), workflow.edges(), workflow.layout()));
    }

    public ChecklistResponse parseChecklist(String text) {
        List<ChecklistSection> sections = checklistParser.parseChecklist(text);
        return new ChecklistResponse(sections, ChecklistProgress.of(sections));
    }
}
