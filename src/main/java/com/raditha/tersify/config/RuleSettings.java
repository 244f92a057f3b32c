package com.raditha.tersify.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.raditha.tersify.model.Severity;

import java.util.Map;

/**
 * Per-rule settings.
 *
 * @param enabled  whether the rule runs; null means enabled
 * @param severity severity override; null keeps the rule's default
 * @param options  rule specific options
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleSettings(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("options") Map<String, String> options) {

    public RuleSettings {
        if (options == null) {
            options = Map.of();
        }
    }

    public static RuleSettings defaults() {
        return new RuleSettings(true, null, Map.of());
    }

    public boolean isEnabled() {
        return enabled == null || enabled;
    }

    public String option(String key, String defaultValue) {
        String value = options.get(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
