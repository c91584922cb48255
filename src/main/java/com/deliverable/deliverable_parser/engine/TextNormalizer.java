package com.deliverable.deliverable_parser.engine;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans a model response before structure extraction.
 *
 * <ul>
 *   <li>If the original text has a {@code <DELIVERABLE>...</DELIVERABLE>} block, only its body is used.</li>
 *   <li>Code fence markers are removed; the fenced body stays so embedded JSON is still reachable.</li>
 *   <li>{@code **} and {@code *} emphasis markers are removed, except a leading {@code * } bullet marker.</li>
 *   <li>Leading heading hashes are removed on the workflow path only. Checklists need them as section markers.</li>
 * </ul>
 *
 * Never returns null; null or blank input gives an empty string.
 */
@Component
public class TextNormalizer {

    private static final Pattern DELIVERABLE_PATTERN =
            Pattern.compile("<DELIVERABLE>([\\s\\S]*?)</DELIVERABLE>", Pattern.CASE_INSENSITIVE);
    private static final Pattern FENCE_PATTERN    = Pattern.compile("```[\\w+-]*[ \\t]*\\n?");
    private static final Pattern HEADING_PATTERN  = Pattern.compile("(?m)^[ \\t]*#{1,6}[ \\t]*");
    private static final Pattern STAR_BULLET      = Pattern.compile("^(\\s*\\*\\s+)(.*)$");

    /** Full cleanup for the workflow path. */
    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) return "";
        String text = clean(isolateDeliverable(raw));
        return HEADING_PATTERN.matcher(text).replaceAll("").trim();
    }

    /** Same cleanup but keeps {@code ##} / {@code ###} headings intact. */
    public String normalizeForChecklist(String raw) {
        if (raw == null || raw.isBlank()) return "";
        return clean(isolateDeliverable(raw)).trim();
    }

    /** Returns the body of the first deliverable block, or the whole text when there is none. */
    public String isolateDeliverable(String raw) {
        if (raw == null) return "";
        Matcher m = DELIVERABLE_PATTERN.matcher(raw);
        return m.find() ? m.group(1).trim() : raw;
    }

    private String clean(String text) {
        String unixText = text.replace("\r\n", "\n").replace('\r', '\n');
        String unfenced = FENCE_PATTERN.matcher(unixText).replaceAll("");
        return stripEmphasis(unfenced);
    }

    private String stripEmphasis(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            String line = lines[i];
            Matcher bullet = STAR_BULLET.matcher(line);
            if (bullet.matches()) {
                sb.append(bullet.group(1)).append(bullet.group(2).replace("*", ""));
            } else {
                sb.append(line.replace("*", ""));
            }
        }
        return sb.toString();
    }
}
