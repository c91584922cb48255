package com.deliverable.deliverable_parser.checklist;

import com.deliverable.deliverable_parser.model.domain.Priority;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls inline annotations out of an item line:
 * "(high priority)" sets the priority and "due: April 15" / "by: Friday" / "deadline: Q3"
 * sets the deadline (up to the next comma). Both are removed from the display text.
 */
@Component
public class AnnotationExtractor {

    private static final Pattern PRIORITY       = Pattern.compile("\\((\\w+)\\s*priority\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PRIORITY_STRIP = Pattern.compile("\\([^)]*priority\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEADLINE       = Pattern.compile("\\b(?:by|due|deadline):\\s*([^,]+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern SPACE_RUNS     = Pattern.compile("\\s{2,}");
    private static final Pattern SPACE_COMMA    = Pattern.compile("\\s+,");
    private static final Pattern COMMA_RUNS     = Pattern.compile(",(?:\\s*,)+");
    private static final Pattern EDGE_JUNK      = Pattern.compile("^[\\s,]+|[\\s,]+$");

    public record Annotated(String text, Priority priority, String deadline) {}

    public Annotated extract(String text, boolean withDeadline) {
        if (text == null) return new Annotated("", Priority.MEDIUM, null);

        Matcher p = PRIORITY.matcher(text);
        Priority priority = p.find() ? Priority.fromWord(p.group(1)) : Priority.MEDIUM;
        String display = PRIORITY_STRIP.matcher(text).replaceFirst("");

        String deadline = null;
        if (withDeadline) {
            Matcher d = DEADLINE.matcher(display);
            if (d.find()) {
                String value = d.group(1).trim();
                deadline = value.isEmpty() ? null : value;
                display = display.substring(0, d.start()) + display.substring(d.end());
            }
        }
        return new Annotated(tidy(display), priority, deadline);
    }

    private static String tidy(String text) {
        String s = SPACE_RUNS.matcher(text).replaceAll(" ");
        s = SPACE_COMMA.matcher(s).replaceAll(",");
        s = COMMA_RUNS.matcher(s).replaceAll(",");
        return EDGE_JUNK.matcher(s).replaceAll("");
    }
}
