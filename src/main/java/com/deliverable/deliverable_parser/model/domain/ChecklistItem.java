package com.deliverable.deliverable_parser.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A checklist entry with its annotations already removed from {@code text}.
 * The id is only unique within the parse call that produced it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChecklistItem(
    String id,
    String text,
    Priority priority,
    String deadline,
    boolean completed,
    String section
) {
    public ChecklistItem {
        priority = priority != null ? priority : Priority.MEDIUM;
    }
}
