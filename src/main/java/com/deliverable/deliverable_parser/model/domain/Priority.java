package com.deliverable.deliverable_parser.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    // "(urgent priority)" and other unknown words stay MEDIUM
    public static Priority fromWord(String word) {
        if (word == null) return MEDIUM;
        return switch (word.trim().toLowerCase(Locale.ROOT)) {
            case "high" -> HIGH;
            case "low"  -> LOW;
            default     -> MEDIUM;
        };
    }
}
