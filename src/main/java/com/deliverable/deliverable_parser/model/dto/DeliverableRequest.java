package com.deliverable.deliverable_parser.model.dto;

/**
 * Request body for the /api/deliverables endpoints.
 * Null-safe: a missing text is treated as empty; chatMode and format are optional.
 */
public record DeliverableRequest(
    String text,
    String chatMode,
    String format
) {
    public String text() {
        return text != null ? text : "";
    }
}
