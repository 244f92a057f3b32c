package com.raditha.tersify.cli;

/**
 * What the CLI does with the diagnostics it finds.
 */
public enum FixMode {
    /**
     * Report diagnostics only. This is the default.
     */
    REPORT,

    /**
     * Print the fixes as unified diffs without touching any file.
     */
    DRY_RUN,

    /**
     * Rewrite the files in place.
     */
    APPLY;

    /**
     * Convert a string value to FixMode enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding FixMode
     * @throws IllegalArgumentException if the value is not a valid mode
     */
    public static FixMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("FixMode value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "report" -> REPORT;
            case "dry-run" -> DRY_RUN;
            case "apply" -> APPLY;
            default -> throw new IllegalArgumentException(
                    "Invalid mode: " + value + ". Must be: report, dry-run, or apply");
        };
    }

    public String toCliString() {
        return switch (this) {
            case REPORT -> "report";
            case DRY_RUN -> "dry-run";
            case APPLY -> "apply";
        };
    }
}
