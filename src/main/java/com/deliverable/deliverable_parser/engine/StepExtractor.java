package com.deliverable.deliverable_parser.engine;

import com.deliverable.deliverable_parser.config.ParserProperties;
import com.deliverable.deliverable_parser.model.parse.RawStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks normalized text line by line and collects step lines in order.
 *
 * A line is a step when it starts with an enumerator ("1."), a bullet ("-", "*", "•"),
 * a "Step/Phase/Stage/Task N" keyword, or a sentinel verb (Start, Begin, Review, Approve,
 * Complete, End, Finish). A bullet becomes a substep of the preceding step when it is indented,
 * or when that step came from an explicit marker rather than a bullet; otherwise it is a step.
 *
 * Labels are truncated to {@link ParserProperties#getLabelMaxLength()} characters plus "...".
 * Callers that need the full line must keep the source text themselves.
 */
@Component
@RequiredArgsConstructor
public class StepExtractor {

    private static final Pattern NUMBERED     = Pattern.compile("^\\d+\\.\\s*");
    private static final Pattern BULLET       = Pattern.compile("^(?:[-*]\\s+|•\\s*)");
    private static final Pattern KEYWORD_STEP = Pattern.compile(
            "^(?:step|phase|stage|task)\\s*(?:\\d+[a-z]?\\b|[a-z]+\\s*(?=:))\\s*[:.)\\-]?\\s*",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SENTINEL     = Pattern.compile(
            "^(?:start|begin|review|approve|complete|end|finish)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern INDENTED     = Pattern.compile("^(?: {2,}|\\t)");

    private final ParserProperties properties;

    public List<RawStep> extract(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) return List.of();

        List<String> lines = normalizedText.lines()
                .filter(line -> !line.isBlank())
                .toList();
        int maxSubsteps = properties.effectiveMaxSubsteps();

        List<StepDraft> drafts = new ArrayList<>();
        StepDraft current = null;
        for (String line : lines) {
            String trimmed = line.trim();
            boolean primary = isPrimary(trimmed);
            boolean bullet = !primary && BULLET.matcher(trimmed).lookingAt();

            if (bullet && current != null && (current.explicit || INDENTED.matcher(line).lookingAt())) {
                String substep = stripBullet(trimmed);
                if (!substep.isEmpty() && current.substeps.size() < maxSubsteps) {
                    current.substeps.add(substep);
                }
                continue;
            }
            if (primary || bullet) {
                String label = cleanStep(trimmed);
                if (label.isEmpty()) continue;
                current = new StepDraft(properties.truncateLabel(label), primary);
                drafts.add(current);
            }
            // prose between steps is ignored and does not end the current step
        }
        return drafts.stream()
                .map(d -> new RawStep(d.label, d.substeps))
                .toList();
    }

    /** Numbered item, keyword step or sentinel verb, also when wrapped in a bullet ("- Step 2: ..."). */
    boolean isPrimary(String trimmed) {
        if (NUMBERED.matcher(trimmed).lookingAt()
                || KEYWORD_STEP.matcher(trimmed).lookingAt()
                || SENTINEL.matcher(trimmed).lookingAt()) {
            return true;
        }
        Matcher bullet = BULLET.matcher(trimmed);
        return bullet.lookingAt() && KEYWORD_STEP.matcher(trimmed.substring(bullet.end())).lookingAt();
    }

    private static String cleanStep(String trimmed) {
        String text = stripBullet(trimmed);
        text = NUMBERED.matcher(text).replaceFirst("");
        text = KEYWORD_STEP.matcher(text).replaceFirst("");
        return text.trim();
    }

    private static String stripBullet(String trimmed) {
        return BULLET.matcher(trimmed).replaceFirst("").trim();
    }

    private static final class StepDraft {
        private final String label;
        private final boolean explicit;
        private final List<String> substeps = new ArrayList<>();

        private StepDraft(String label, boolean explicit) {
            this.label = label;
            this.explicit = explicit;
        }
    }
}
