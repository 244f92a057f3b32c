package com.raditha.tersify.rules;

import com.raditha.tersify.config.RuleSettings;
import com.raditha.tersify.config.TersifyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Builds rule instances from configuration.
 * Each rule receives its own descriptor, so severities and options never leak between instances.
 */
public class RuleFactory {

    public static final String ANY_METHOD = "any_method";
    public static final String FIRST_METHOD = "first_method";
    public static final String REPLACEMENT_METHOD = "replacement_method";

    private static final Logger logger = LoggerFactory.getLogger(RuleFactory.class);
    private static final Set<String> KNOWN_RULES = Set.of(IfToConditionalRule.ID, FirstOrDefaultRule.ID);

    private RuleFactory() {
        /* this is only a utility class */
    }

    public static Set<String> knownRuleIds() {
        return KNOWN_RULES;
    }

    /**
     * Create every rule the configuration enables.
     */
    public static List<RewriteRule<?>> createRules(TersifyConfig config) {
        return createRules(config, List.of());
    }

    /**
     * Create the enabled rules, restricted to {@code onlyRuleIds} when it is not empty.
     *
     * @throws IllegalArgumentException if {@code onlyRuleIds} names an unknown rule
     */
    public static List<RewriteRule<?>> createRules(TersifyConfig config, Collection<String> onlyRuleIds) {
        for (String id : onlyRuleIds) {
            if (!KNOWN_RULES.contains(id)) {
                throw new IllegalArgumentException("Unknown rule: " + id + ". Known rules: " + KNOWN_RULES);
            }
        }
        config.rules().keySet().stream()
                .filter(id -> !KNOWN_RULES.contains(id))
                .forEach(id -> logger.warn("Ignoring settings for unknown rule '{}'", id));

        List<RewriteRule<?>> rules = new ArrayList<>();
        RuleSettings ifSettings = config.ruleSettings(IfToConditionalRule.ID);
        if (isSelected(IfToConditionalRule.ID, ifSettings, onlyRuleIds)) {
            rules.add(new IfToConditionalRule(applySeverity(IfToConditionalRule.defaultDescriptor(), ifSettings)));
        }

        RuleSettings firstSettings = config.ruleSettings(FirstOrDefaultRule.ID);
        if (isSelected(FirstOrDefaultRule.ID, firstSettings, onlyRuleIds)) {
            FirstOrDefaultRule.MethodNames defaults = FirstOrDefaultRule.MethodNames.defaults();
            FirstOrDefaultRule.MethodNames names = new FirstOrDefaultRule.MethodNames(
                    firstSettings.option(ANY_METHOD, defaults.any()),
                    firstSettings.option(FIRST_METHOD, defaults.first()),
                    firstSettings.option(REPLACEMENT_METHOD, defaults.replacement()));
            rules.add(new FirstOrDefaultRule(
                    applySeverity(FirstOrDefaultRule.defaultDescriptor(names), firstSettings), names));
        }

        logger.debug("Enabled rules: {}", rules.stream().map(RewriteRule::id).toList());
        return rules;
    }

    private static boolean isSelected(String id, RuleSettings settings, Collection<String> onlyRuleIds) {
        if (!onlyRuleIds.isEmpty()) {
            return onlyRuleIds.contains(id);
        }
        return settings.isEnabled();
    }

    private static RuleDescriptor applySeverity(RuleDescriptor descriptor, RuleSettings settings) {
        return settings.severity() == null ? descriptor : descriptor.withSeverity(settings.severity());
    }
}
