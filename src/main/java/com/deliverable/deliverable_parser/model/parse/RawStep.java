package com.deliverable.deliverable_parser.model.parse;

import java.util.List;

/**
 * A step line found by the extractor, before it is typed.
 * {@code label} is already cleaned of markers and truncated; substeps are already capped.
 */
public record RawStep(String label, List<String> substeps) {

    public RawStep {
        label = label != null ? label : "";
        substeps = substeps != null ? List.copyOf(substeps) : List.of();
    }
}
