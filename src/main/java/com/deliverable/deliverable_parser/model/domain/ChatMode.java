package com.deliverable.deliverable_parser.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChatMode {
    STANDARD("standard"),
    DEEP_RESEARCH("deep-research"),
    CHECKLIST("checklist"),
    WORKFLOW("workflow"),       // the only mode that triggers workflow extraction
    AUDIT_PLAN("audit-plan"),
    CALCULATION("calculation");

    private final String value;

    ChatMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Every mode except STANDARD produces a deliverable for the output pane. */
    public boolean isProfessional() {
        return this != STANDARD;
    }

    public boolean usesChainOfThought() {
        return this == DEEP_RESEARCH || this == CALCULATION;
    }
}
