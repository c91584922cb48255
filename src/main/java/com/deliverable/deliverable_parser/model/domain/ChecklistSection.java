package com.deliverable.deliverable_parser.model.domain;

import java.util.List;

public record ChecklistSection(
    String title,
    List<ChecklistItem> items
) {
    public ChecklistSection {
        items = items != null ? List.copyOf(items) : List.of();
    }
}
