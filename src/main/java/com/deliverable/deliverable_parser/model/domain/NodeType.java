package com.deliverable.deliverable_parser.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeType {
    START,
    STEP,
    DECISION,  // review / approve / check gates; branches in a decision tree
    END;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient lookup used for model-produced JSON: anything unrecognised is a plain step. */
    @JsonCreator
    public static NodeType fromValue(String value) {
        if (value == null || value.isBlank()) return STEP;
        try {
            return NodeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return STEP;
        }
    }
}
