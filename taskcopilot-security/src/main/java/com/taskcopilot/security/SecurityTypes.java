package com.taskcopilot.security;

import com.taskcopilot.common.model.PolicyAction;
import com.taskcopilot.common.model.Severity;
import com.taskcopilot.common.model.ToolCallContext;

import java.util.List;

/**
 * Security rule contract and evaluation records.
 */
public final class SecurityTypes {

    private SecurityTypes() {
    }

    // -----------------------------------------------------------------------
    // Rules
    // -----------------------------------------------------------------------

    /**
     * A synchronous, side-effect-free check over one tool call. Higher
     * priority rules are evaluated first.
     */
    public interface SecurityRule {

        String id();

        String name();

        String description();

        int priority();

        default boolean enabledByDefault() {
            return true;
        }

        /**
         * @return a finding, or {@code null} when the rule has no opinion
         */
        RuleResult evaluate(ToolCallContext context);
    }

    public record RuleResult(
            PolicyAction action,
            String ruleName,
            String reason,
            Severity severity,
            String matchedPattern,
            String recommendation) {
    }

    // -----------------------------------------------------------------------
    // Evaluation
    // -----------------------------------------------------------------------

    public record EvaluationResult(
            boolean allowed,
            PolicyAction action,
            List<RuleResult> violations,
            List<RuleResult> warnings,
            long executionTimeMs,
            boolean dryRun) {

        /** Highest severity among violations, else among warnings. */
        public Severity highestSeverity() {
            Severity max = null;
            for (RuleResult r : violations.isEmpty() ? warnings : violations) {
                max = Severity.max(max, r.severity());
            }
            return max;
        }
    }

    public record RuleSummary(String id, String name, String description, boolean enabled, int priority) {
    }
}
