package com.deliverable.deliverable_parser.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Rendering-driven limits for parsed deliverables, bound from {@code app.parser.*}.
 *
 * <pre>
 * app.parser.label-max-length=50
 * app.parser.max-substeps=5
 * app.parser.max-parallel-branches=3
 * app.parser.default-section-title=Tasks
 * app.parser.fallback-section-title=Checklist
 * </pre>
 *
 * The defaults are tuned to the diagram renderer's node width. Non-positive numbers
 * and blank titles fall back to the defaults through the effective* accessors.
 */
@Data
@ConfigurationProperties(prefix = "app.parser")
public class ParserProperties {

    static final int DEFAULT_LABEL_MAX_LENGTH = 50;
    static final int DEFAULT_MAX_SUBSTEPS = 5;
    static final int DEFAULT_MAX_PARALLEL_BRANCHES = 3;

    /**
     * Labels longer than this are cut and suffixed with "...". The full text is not kept anywhere.
     */
    private int labelMaxLength = DEFAULT_LABEL_MAX_LENGTH;

    /**
     * Sub-step bullets kept per workflow node; the rest are dropped.
     */
    private int maxSubsteps = DEFAULT_MAX_SUBSTEPS;

    /**
     * How many intermediate nodes the start node fans out to in a parallel workflow.
     */
    private int maxParallelBranches = DEFAULT_MAX_PARALLEL_BRANCHES;

    /**
     * Section that collects checklist items seen before the first heading.
     */
    private String defaultSectionTitle = "Tasks";

    /**
     * Title of the single empty section returned when nothing was recognised.
     */
    private String fallbackSectionTitle = "Checklist";

    public int effectiveLabelMaxLength() {
        return labelMaxLength > 0 ? labelMaxLength : DEFAULT_LABEL_MAX_LENGTH;
    }

    public int effectiveMaxSubsteps() {
        return maxSubsteps > 0 ? maxSubsteps : DEFAULT_MAX_SUBSTEPS;
    }

    public int effectiveMaxParallelBranches() {
        return maxParallelBranches > 0 ? maxParallelBranches : DEFAULT_MAX_PARALLEL_BRANCHES;
    }

    public String effectiveDefaultSectionTitle() {
        return defaultSectionTitle != null && !defaultSectionTitle.isBlank() ? defaultSectionTitle : "Tasks";
    }

    public String effectiveFallbackSectionTitle() {
        return fallbackSectionTitle != null && !fallbackSectionTitle.isBlank() ? fallbackSectionTitle : "Checklist";
    }

    /** Cuts a label to the configured length, appending "..." when anything was removed. */
    public String truncateLabel(String label) {
        if (label == null) return "";
        int max = effectiveLabelMaxLength();
        if (label.length() <= max) return label;
        // never split a surrogate pair (emoji)
        int cut = Character.isHighSurrogate(label.charAt(max - 1)) ? max - 1 : max;
        return label.substring(0, cut) + "...";
    }
}
