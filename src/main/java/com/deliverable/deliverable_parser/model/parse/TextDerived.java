package com.deliverable.deliverable_parser.model.parse;

/**
 * Normalized text that did not parse as a structured graph.
 */
public record TextDerived(String normalizedText) implements WorkflowSource {

    public TextDerived {
        normalizedText = normalizedText != null ? normalizedText : "";
    }
}
