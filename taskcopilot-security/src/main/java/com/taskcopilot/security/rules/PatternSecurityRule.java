package com.taskcopilot.security.rules;

import com.taskcopilot.common.config.HooksConfig.CustomRuleConfig;
import com.taskcopilot.common.infra.PatternMatchers;
import com.taskcopilot.common.infra.ToolInputs;
import com.taskcopilot.common.model.PolicyAction;
import com.taskcopilot.common.model.Severity;
import com.taskcopilot.common.model.ToolCallContext;
import com.taskcopilot.security.SecurityTypes.RuleResult;
import com.taskcopilot.security.SecurityTypes.SecurityRule;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A user-defined rule: case-insensitive regexes searched in the top-level
 * string values of the tool input. Patterns compile lazily through the
 * shared cache; an invalid pattern is logged once and never matches.
 */
public final class PatternSecurityRule implements SecurityRule {

    public static final int DEFAULT_PRIORITY = 50;

    private final String id;
    private final String name;
    private final String description;
    private final boolean enabledByDefault;
    private final int priority;
    private final List<String> patterns;
    private final Severity severity;
    private final PolicyAction action;

    private PatternSecurityRule(String id, String name, String description, boolean enabledByDefault,
            int priority, List<String> patterns, Severity severity, PolicyAction action) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.enabledByDefault = enabledByDefault;
        this.priority = priority;
        this.patterns = patterns;
        this.severity = severity;
        this.action = action;
    }

    /**
     * Build a rule from configuration, filling the custom-rule defaults
     * (enabled, priority 50, severity medium, action warn).
     *
     * @throws IllegalArgumentException when the rule has no id
     */
    public static PatternSecurityRule from(CustomRuleConfig config) {
        if (config == null || config.getId() == null || config.getId().isBlank()) {
            throw new IllegalArgumentException("Custom security rule requires an id");
        }
        return new PatternSecurityRule(
                config.getId(),
                config.getName() != null ? config.getName() : config.getId(),
                config.getDescription() != null ? config.getDescription() : "",
                config.getEnabled() == null || config.getEnabled(),
                config.getPriority() != null ? config.getPriority() : DEFAULT_PRIORITY,
                config.getPatterns() != null ? List.copyOf(config.getPatterns()) : List.of(),
                config.getSeverity() != null ? config.getSeverity() : Severity.MEDIUM,
                config.getAction() != null ? config.getAction() : PolicyAction.WARN);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public boolean enabledByDefault() {
        return enabledByDefault;
    }

    @Override
    public RuleResult evaluate(ToolCallContext context) {
        if (patterns.isEmpty())
            return null;

        String allContent = String.join("\n", ToolInputs.topLevelStrings(context.getToolInput()));

        for (String patternStr : patterns) {
            Optional<Pattern> compiled = PatternMatchers.compileRegex(patternStr);
            if (compiled.isEmpty() || !compiled.get().matcher(allContent).find())
                continue;
            return new RuleResult(
                    action,
                    id,
                    "Matched pattern: " + patternStr,
                    severity,
                    patternStr,
                    "Review " + context.getToolName() + " call for security concerns");
        }
        return null;
    }
}
