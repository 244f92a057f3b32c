package com.raditha.tersify.rules;

import com.raditha.tersify.model.Category;
import com.raditha.tersify.model.Severity;

import java.util.Objects;

/**
 * Identity and presentation of a rule, owned by the rule instance it is passed to.
 *
 * @param id                 stable rule id used in reports and for filtering
 * @param title              short human-readable name
 * @param message            message attached to each diagnostic
 * @param fixTitle           description of the fix
 * @param severity           severity of reported diagnostics
 * @param category           grouping for display
 * @param suppressionKeyword token that disables the rule inside {@code @SuppressWarnings}
 */
public record RuleDescriptor(
        String id,
        String title,
        String message,
        String fixTitle,
        Severity severity,
        Category category,
        String suppressionKeyword) {

    public RuleDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(severity, "severity");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Rule id cannot be blank");
        }
        if (fixTitle == null) {
            fixTitle = message;
        }
        if (suppressionKeyword == null) {
            suppressionKeyword = id;
        }
    }

    public RuleDescriptor withSeverity(Severity newSeverity) {
        return new RuleDescriptor(id, title, message, fixTitle, newSeverity, category, suppressionKeyword);
    }
}
