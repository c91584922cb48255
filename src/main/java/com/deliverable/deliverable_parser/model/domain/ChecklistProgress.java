package com.deliverable.deliverable_parser.model.domain;

import java.util.List;

/**
 * Completion counts as the checklist view shows them: per section and overall.
 * Percentages are rounded and 0 for an empty checklist.
 */
public record ChecklistProgress(
    int total,
    int completed,
    int percent,
    List<SectionProgress> sections
) {
    public record SectionProgress(String title, int total, int completed) {}

    public static ChecklistProgress of(List<ChecklistSection> sections) {
        List<SectionProgress> perSection = sections.stream()
                .map(s -> new SectionProgress(
                        s.title(),
                        s.items().size(),
                        (int) s.items().stream().filter(ChecklistItem::completed).count()))
                .toList();
        int total = perSection.stream().mapToInt(SectionProgress::total).sum();
        int completed = perSection.stream().mapToInt(SectionProgress::completed).sum();
        int percent = total == 0 ? 0 : (int) Math.round(completed * 100.0 / total);
        return new ChecklistProgress(total, completed, percent, perSection);
    }
}
