package com.deliverable.deliverable_parser.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of workflow shapes. Selects the edge synthesis strategy and the renderer layout.
 */
public enum WorkflowFormat {
    LINEAR_PROCESS("linear", "Linear Process", "linear-process"),
    DECISION_TREE("decision", "Decision Tree", "decision-tree"),
    PARALLEL_WORKFLOW("parallel", "Parallel Workflow", "parallel-workflow"),
    APPROVAL_WORKFLOW("approval", "Approval Workflow", "approval-workflow");

    private final String id;
    private final String displayName;
    private final String layout;

    WorkflowFormat(String id, String displayName, String layout) {
        this.id = id;
        this.displayName = displayName;
        this.layout = layout;
    }

    public String getId()          { return id; }
    public String getDisplayName() { return displayName; }

    @JsonValue
    public String getLayout()      { return layout; }

    /** Accepts the short selector id ("parallel"), the layout tag ("parallel-workflow") or the enum name. */
    public static Optional<WorkflowFormat> fromId(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String key = value.trim().toLowerCase(Locale.ROOT);
        for (WorkflowFormat format : values()) {
            if (format.id.equals(key) || format.layout.equals(key)
                    || format.name().equalsIgnoreCase(key)
                    || format.displayName.equalsIgnoreCase(key)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
