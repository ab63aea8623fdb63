package com.taskcopilot.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskcopilot.common.config.HooksConfig.CustomRuleConfig;
import com.taskcopilot.common.infra.ErrorUtils;
import com.taskcopilot.security.SecurityTypes.EvaluationResult;
import com.taskcopilot.security.SecurityTypes.RuleResult;
import com.taskcopilot.security.SecurityTypes.RuleSummary;
import com.taskcopilot.security.rules.DefaultSecurityRules;
import com.taskcopilot.security.rules.PatternSecurityRule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Management operations over a {@link SecurityRuleEngine}: register custom
 * rules or reset to defaults, list, dry-run test and toggle. Every operation
 * answers with a response record and never throws.
 */
@Slf4j
public class SecurityRuleTools {

    // -----------------------------------------------------------------------
    // Responses
    // -----------------------------------------------------------------------

    public record RegisterResponse(boolean success, List<String> registered, String message) {
    }

    public record ListResponse(List<RuleSummary> rules, int totalCount, int enabledCount) {
    }

    public record Finding(String ruleName, String reason, String severity, String recommendation) {

        static Finding of(RuleResult r) {
            return new Finding(r.ruleName(), r.reason(), r.severity() != null ? r.severity().label() : null,
                    r.recommendation());
        }
    }

    public record TestResponse(
            String toolName,
            boolean allowed,
            String action,
            List<Finding> violations,
            List<Finding> warnings,
            long executionTimeMs) {
    }

    public record ToggleResponse(boolean success, String ruleId, boolean enabled, String message) {
    }

    private final SecurityRuleEngine engine;

    public SecurityRuleTools(SecurityRuleEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    // -----------------------------------------------------------------------
    // Operations
    // -----------------------------------------------------------------------

    /**
     * Register custom pattern rules, or with {@code resetToDefaults} drop
     * every rule and reinstall the default set.
     */
    public RegisterResponse registerRules(List<CustomRuleConfig> customRules, boolean resetToDefaults) {
        List<String> registered = new ArrayList<>();
        try {
            if (resetToDefaults) {
                engine.clear();
                List<String> ids = DefaultSecurityRules.install(engine);
                return new RegisterResponse(true, ids, "Security rules reset to defaults");
            }
            if (customRules != null) {
                for (CustomRuleConfig config : customRules) {
                    PatternSecurityRule rule = PatternSecurityRule.from(config);
                    engine.registerRule(rule);
                    registered.add(rule.id());
                }
            }
            return new RegisterResponse(true, registered,
                    "Registered " + registered.size() + " custom security rule(s)");
        } catch (RuntimeException e) {
            log.warn("Failed to register security rules: {}", ErrorUtils.formatErrorMessage(e));
            return new RegisterResponse(false, registered,
                    "Failed to register rules: " + ErrorUtils.formatErrorMessage(e));
        }
    }

    /**
     * List rules. With a rule id, only that rule (or nothing) is returned.
     */
    public ListResponse listRules(boolean includeDisabled, String ruleId) {
        if (ruleId != null) {
            return engine.getRule(ruleId)
                    .map(r -> new ListResponse(List.of(r), 1, r.enabled() ? 1 : 0))
                    .orElseGet(() -> new ListResponse(List.of(), 0, 0));
        }
        List<RuleSummary> all = engine.listRules();
        List<RuleSummary> shown = includeDisabled ? all : all.stream().filter(RuleSummary::enabled).toList();
        int enabled = (int) all.stream().filter(RuleSummary::enabled).count();
        return new ListResponse(shown, all.size(), enabled);
    }

    /**
     * Evaluate a hypothetical call without running it.
     */
    public TestResponse testCall(String toolName, JsonNode toolInput) {
        EvaluationResult result = engine.dryRun(toolName, toolInput);
        return new TestResponse(
                toolName,
                result.allowed(),
                result.action().label(),
                result.violations().stream().map(Finding::of).toList(),
                result.warnings().stream().map(Finding::of).toList(),
                result.executionTimeMs());
    }

    public ToggleResponse toggleRule(String ruleId, boolean enabled) {
        if (!engine.toggleRule(ruleId, enabled)) {
            return new ToggleResponse(false, ruleId, false, "Rule '" + ruleId + "' not found");
        }
        return new ToggleResponse(true, ruleId, enabled,
                "Rule '" + ruleId + "' " + (enabled ? "enabled" : "disabled"));
    }
}
