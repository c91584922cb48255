package com.deliverable.deliverable_parser.checklist;

import com.deliverable.deliverable_parser.config.ParserProperties;
import com.deliverable.deliverable_parser.engine.TextNormalizer;
import com.deliverable.deliverable_parser.model.domain.ChecklistItem;
import com.deliverable.deliverable_parser.model.domain.ChecklistSection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checklist path: groups checkbox and bullet lines under their "##" / "###" headings.
 *
 * <ul>
 *   <li>{@code ## Title} or {@code ### Title} closes the current section (if it has items) and opens a new one.</li>
 *   <li>{@code - [ ] text} / {@code * [x] text} is an item; "x" in either case marks it completed.</li>
 *   <li>{@code - text} without a "[" is an open item; priority is read but not the deadline.</li>
 *   <li>Every other line is ignored and never leaks into item text.</li>
 * </ul>
 * Items before the first heading go to the default section. If nothing was recognised the
 * result is a single empty fallback section, never an empty list.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChecklistParser {

    private static final Pattern SECTION_HEADER = Pattern.compile("^#{2,3}\\s+");
    private static final Pattern CHECKBOX       = Pattern.compile("^[-*]\\s*\\[([xX\\s])\\]\\s*(.+)");
    private static final Pattern PLAIN_BULLET   = Pattern.compile("^[-*]\\s+");

    private final TextNormalizer      normalizer;
    private final AnnotationExtractor annotations;
    private final ParserProperties    properties;

    enum Phase {
        BEFORE_SECTION,  // collecting into the default section
        IN_SECTION
    }

    /** Scan state for one call. Passed through every transition, never shared between calls. */
    static final class Accumulator {
        private Phase phase = Phase.BEFORE_SECTION;
        private String title;
        private List<ChecklistItem> items = new ArrayList<>();
        private final List<ChecklistSection> sections = new ArrayList<>();
        private int itemCounter;

        Accumulator(String defaultTitle) {
            this.title = defaultTitle;
        }

        Phase phase() {
            return phase;
        }
    }

    public List<ChecklistSection> parseChecklist(String rawText) {
        String text = normalizer.normalizeForChecklist(rawText);
        Accumulator acc = new Accumulator(properties.effectiveDefaultSectionTitle());
        for (String line : text.lines().toList()) {
            accept(acc, line.trim());
        }
        List<ChecklistSection> sections = finish(acc);
        log.debug("Parsed checklist: sections={}, items={}", sections.size(), acc.itemCounter);
        return sections;
    }

    void accept(Accumulator acc, String line) {
        Matcher header = SECTION_HEADER.matcher(line);
        if (header.lookingAt()) {
            openSection(acc, line.substring(header.end()).trim());
            return;
        }
        Matcher checkbox = CHECKBOX.matcher(line);
        if (checkbox.lookingAt()) {
            boolean completed = checkbox.group(1).equalsIgnoreCase("x");
            addItem(acc, annotations.extract(checkbox.group(2), true), completed);
            return;
        }
        Matcher bullet = PLAIN_BULLET.matcher(line);
        if (bullet.lookingAt() && !line.contains("[")) {
            addItem(acc, annotations.extract(line.substring(bullet.end()), false), false);
        }
    }

    private void openSection(Accumulator acc, String title) {
        flush(acc);
        acc.title = title;
        acc.items = new ArrayList<>();
        acc.phase = Phase.IN_SECTION;
    }

    private void addItem(Accumulator acc, AnnotationExtractor.Annotated annotated, boolean completed) {
        if (annotated.text().isEmpty()) return;
        acc.items.add(new ChecklistItem(
                "item-" + acc.itemCounter++,
                annotated.text(),
                annotated.priority(),
                annotated.deadline(),
                completed,
                acc.title));
    }

    private void flush(Accumulator acc) {
        if (!acc.items.isEmpty()) {
            acc.sections.add(new ChecklistSection(acc.title, acc.items));
        }
    }

    List<ChecklistSection> finish(Accumulator acc) {
        flush(acc);
        if (acc.sections.isEmpty()) {
            return List.of(new ChecklistSection(properties.effectiveFallbackSectionTitle(), List.of()));
        }
        return List.copyOf(acc.sections);
    }
}
