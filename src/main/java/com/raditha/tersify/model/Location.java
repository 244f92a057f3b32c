package com.raditha.tersify.model;

import com.github.javaparser.Range;

/**
 * Represents a source code span (line and column positions).
 * Simplified wrapper around JavaParser's Range.
 *
 * @param startLine   Starting line number (1-indexed)
 * @param startColumn Starting column number (1-indexed)
 * @param endLine     Ending line number (1-indexed, inclusive)
 * @param endColumn   Ending column number (1-indexed, inclusive)
 */
public record Location(
        int startLine,
        int startColumn,
        int endLine,
        int endColumn) {

    public Location {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line span " + startLine + "-" + endLine);
        }
    }

    /**
     * Create from JavaParser Range.
     */
    public static Location from(Range range) {
        return new Location(
                range.begin.line,
                range.begin.column,
                range.end.line,
                range.end.column);
    }

    /**
     * Format as "12:5" for display.
     */
    public String toDisplayString() {
        return startLine + ":" + startColumn;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
