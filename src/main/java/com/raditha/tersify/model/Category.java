package com.raditha.tersify.model;

/**
 * Grouping of rules for display.
 */
public enum Category {
    /**
     * Code that can be written more concisely.
     */
    OPPORTUNITIES,

    /**
     * Code that re-implements something a library call already does.
     */
    PRACTICES_AND_IMPROVEMENTS
}
