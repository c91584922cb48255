package com.deliverable.deliverable_parser.engine;

import com.deliverable.deliverable_parser.model.domain.WorkflowFormat;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Picks the workflow format from keyword cues in the normalized text.
 *
 * Rules are evaluated top to bottom and the first match wins:
 * <ol>
 *   <li>"decision" together with "yes" or "no" → Decision Tree</li>
 *   <li>"parallel", "simultaneous" or "concurrent" → Parallel Workflow</li>
 *   <li>"approval" together with "review" → Approval Workflow</li>
 *   <li>otherwise → Linear Process</li>
 * </ol>
 * Matching is plain substring search on the lower-cased text, so "no" also matches inside "note".
 */
@Component
public class FormatClassifier {

    public record Rule(String description, Predicate<String> predicate, WorkflowFormat format) {}

    private static final List<Rule> RULES = List.of(
        new Rule("decision with a yes/no outcome",
                 t -> t.contains("decision") && (t.contains("yes") || t.contains("no")),
                 WorkflowFormat.DECISION_TREE),
        new Rule("parallel, simultaneous or concurrent branches",
                 t -> t.contains("parallel") || t.contains("simultaneous") || t.contains("concurrent"),
                 WorkflowFormat.PARALLEL_WORKFLOW),
        new Rule("approval together with review",
                 t -> t.contains("approval") && t.contains("review"),
                 WorkflowFormat.APPROVAL_WORKFLOW)
    );

    public WorkflowFormat classify(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) return WorkflowFormat.LINEAR_PROCESS;
        String lower = normalizedText.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.predicate().test(lower)) {
                return rule.format();
            }
        }
        return WorkflowFormat.LINEAR_PROCESS;
    }

    /** Rules in evaluation order. */
    public List<Rule> rules() {
        return RULES;
    }
}
