package com.raditha.tersify.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.javaparser.ParserConfiguration;

import java.util.List;
import java.util.Map;

/**
 * Root configuration, loaded from {@code tersify.yml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * language_level: JAVA_17
 * exclude_patterns:
 *   - "**&#47;generated/**"
 * rules:
 *   IfToConditional:
 *     severity: suggestion
 *   ReplaceWithFirstOrDefault:
 *     enabled: true
 *     options:
 *       any_method: Any
 *       first_method: First
 *       replacement_method: FirstOrDefault
 * }</pre>
 *
 * @param languageLevel   JavaParser language level used to parse sources
 * @param excludePatterns file patterns to skip (glob format)
 * @param rules           settings keyed by rule id; rules without an entry use their defaults
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TersifyConfig(
        @JsonProperty("language_level") String languageLevel,
        @JsonProperty("exclude_patterns") List<String> excludePatterns,
        @JsonProperty("rules") Map<String, RuleSettings> rules) {

    public static final String DEFAULT_LANGUAGE_LEVEL = "JAVA_17";

    /**
     * Validate configuration.
     */
    public TersifyConfig {
        if (languageLevel == null || languageLevel.isBlank()) {
            languageLevel = DEFAULT_LANGUAGE_LEVEL;
        }
        try {
            ParserConfiguration.LanguageLevel.valueOf(languageLevel.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown language_level: " + languageLevel, e);
        }
        if (excludePatterns == null) {
            excludePatterns = defaultExcludePatterns();
        }
        if (rules == null) {
            rules = Map.of();
        }
    }

    public static TersifyConfig defaults() {
        return new TersifyConfig(DEFAULT_LANGUAGE_LEVEL, defaultExcludePatterns(), Map.of());
    }

    public ParserConfiguration.LanguageLevel parserLanguageLevel() {
        return ParserConfiguration.LanguageLevel.valueOf(languageLevel.trim().toUpperCase());
    }

    public ParserConfiguration parserConfiguration() {
        return new ParserConfiguration().setLanguageLevel(parserLanguageLevel());
    }

    public RuleSettings ruleSettings(String ruleId) {
        return rules.getOrDefault(ruleId, RuleSettings.defaults());
    }

    /**
     * Default file exclusion patterns.
     */
    private static List<String> defaultExcludePatterns() {
        return List.of(
                "**/target/**",
                "**/build/**",
                "**/generated/**",
                "**/.git/**");
    }

    /**
     * Check if a file path matches any exclusion pattern.
     */
    public boolean shouldExclude(String filePath) {
        String normalized = filePath.replace('\\', '/');
        for (String pattern : excludePatterns) {
            if (matchesGlobPattern(normalized, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Simple glob pattern matching.
     * Supports ** and * wildcards.
     */
    private static boolean matchesGlobPattern(String path, String pattern) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '*' && i + 1 < pattern.length() && pattern.charAt(i + 1) == '*') {
                regex.append(".*");
                i++;
            } else if (c == '*') {
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else if ("\\.[]{}()+-^$|".indexOf(c) >= 0) {
                regex.append('\\').append(c);
            } else {
                regex.append(c);
            }
        }
        return path.matches(regex.toString());
    }
}
