package com.deliverable.deliverable_parser.engine;

import com.deliverable.deliverable_parser.model.domain.ParsedWorkflow;
import com.deliverable.deliverable_parser.model.domain.WorkflowFormat;
import com.deliverable.deliverable_parser.model.domain.WorkflowNode;
import com.deliverable.deliverable_parser.model.parse.RawStep;
import com.deliverable.deliverable_parser.model.parse.StructuredInput;
import com.deliverable.deliverable_parser.model.parse.TextDerived;
import com.deliverable.deliverable_parser.model.parse.WorkflowSource;
import com.deliverable.deliverable_parser.synthesizer.EdgeStrategyRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Workflow path: raw text → normalize → (structured JSON | format + steps → typed nodes → edges).
 *
 * Pure and stateless; safe to call from any number of threads. Never throws for any input:
 * text without recognisable steps yields the two-node graph start → end.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkflowAssembler {

    private final TextNormalizer           normalizer;
    private final StructuredWorkflowReader structuredReader;
    private final FormatClassifier         formatClassifier;
    private final StepExtractor            stepExtractor;
    private final NodeClassifier           nodeClassifier;
    private final EdgeStrategyRegistry     strategyRegistry;

    public ParsedWorkflow parseWorkflow(String rawText) {
        return parseWorkflow(rawText, null);
    }

    /**
     * @param formatOverride when non-null, replaces the classifier's decision (user-selected format)
     */
    public ParsedWorkflow parseWorkflow(String rawText, WorkflowFormat formatOverride) {
        String normalized = normalizer.normalize(rawText);
        WorkflowSource source = structuredReader.read(normalized);

        ParsedWorkflow result;
        if (source instanceof StructuredInput structured) {
            String layout = formatOverride != null ? formatOverride.getLayout() : structured.layout();
            result = new ParsedWorkflow(structured.nodes(), structured.edges(), layout);
        } else if (source instanceof TextDerived text) {
            result = fromText(text.normalizedText(), formatOverride);
        } else {
            throw new IllegalStateException("Unhandled workflow source: " + source.getClass().getSimpleName());
        }

        log.debug("Parsed workflow: layout={}, nodes={}, edges={}, structured={}",
                result.layout(), result.nodes().size(), result.edges().size(), source instanceof StructuredInput);
        return result;
    }

    private ParsedWorkflow fromText(String normalizedText, WorkflowFormat formatOverride) {
        WorkflowFormat format = formatOverride != null ? formatOverride : formatClassifier.classify(normalizedText);
        List<RawStep> steps = stepExtractor.extract(normalizedText);
        List<WorkflowNode> nodes = nodeClassifier.classify(steps);
        return strategyRegistry.get(format).synthesize(nodes);
    }
}
