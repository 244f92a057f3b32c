package com.raditha.tersify.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How prominently a diagnostic is reported. Declared from least to most severe.
 */
public enum Severity {
    HIDDEN,
    INFO,
    SUGGESTION,
    WARNING,
    ERROR;

    /**
     * Convert a string value to Severity.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding Severity
     * @throws IllegalArgumentException if the value is not a valid severity
     */
    @JsonCreator
    public static Severity fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity value cannot be null");
        }

        return switch (value.trim().toLowerCase()) {
            case "hidden" -> HIDDEN;
            case "info" -> INFO;
            case "suggestion" -> SUGGESTION;
            case "warning" -> WARNING;
            case "error" -> ERROR;
            default -> throw new IllegalArgumentException(
                    "Invalid severity: " + value + ". Must be: hidden, info, suggestion, warning, or error");
        };
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    @JsonValue
    public String toCliString() {
        return name().toLowerCase();
    }
}
