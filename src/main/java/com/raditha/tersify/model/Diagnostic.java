package com.raditha.tersify.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A rewrite opportunity reported by a rule.
 *
 * @param ruleId   id of the rule that produced it, used for filtering and suppression
 * @param severity how prominently to report it
 * @param message  user-facing message
 * @param location span the diagnostic points at
 */
public record Diagnostic(
        String ruleId,
        Severity severity,
        String message,
        Location location) {

    /**
     * Orders diagnostics by position in the source.
     */
    public static final Comparator<Diagnostic> BY_LOCATION = Comparator
            .comparingInt((Diagnostic d) -> d.location().startLine())
            .thenComparingInt(d -> d.location().startColumn())
            .thenComparing(Diagnostic::ruleId);

    public Diagnostic {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(location, "location");
    }

    /**
     * Format as "12:5: warning [RuleId] message".
     */
    public String toDisplayString() {
        return String.format("%s: %s [%s] %s", location.toDisplayString(), severity.toCliString(), ruleId, message);
    }
}
