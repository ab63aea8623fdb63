package com.taskcopilot.security;

import com.taskcopilot.hooks.HookResults.PreActionResult;
import com.taskcopilot.hooks.HookResults.PreActionStatus;
import com.taskcopilot.hooks.HookTypes.PreActionHook;
import com.taskcopilot.security.SecurityTypes.EvaluationResult;
import com.taskcopilot.security.SecurityTypes.RuleResult;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exposes a {@link SecurityRuleEngine} as a global pre-action hook.
 * Violations deny the call, warnings only warn.
 */
public final class SecurityPreActionHook {

    public static final String HOOK_ID = "security-rules";
    public static final int DEFAULT_PRIORITY = 1;

    private SecurityPreActionHook() {
    }

    public static PreActionHook create(SecurityRuleEngine engine) {
        return create(engine, DEFAULT_PRIORITY);
    }

    public static PreActionHook create(SecurityRuleEngine engine, int priority) {
        return PreActionHook.builder()
                .id(HOOK_ID)
                .name("Security rules")
                .description("Evaluates tool calls against the registered security rules")
                .priority(priority)
                .handler(ctx -> toResult(engine.evaluate(ctx)))
                .build();
    }

    static PreActionResult toResult(EvaluationResult evaluation) {
        List<String> warningReasons = reasons(evaluation.warnings());
        if (!evaluation.violations().isEmpty()) {
            return PreActionResult.builder()
                    .status(PreActionStatus.DENY)
                    .reason(String.join("; ", reasons(evaluation.violations())))
                    .severity(evaluation.highestSeverity())
                    .warnings(warningReasons)
                    .build();
        }
        if (!warningReasons.isEmpty()) {
            return PreActionResult.builder()
                    .status(PreActionStatus.WARN)
                    .severity(evaluation.highestSeverity())
                    .warnings(warningReasons)
                    .build();
        }
        return PreActionResult.allow();
    }

    private static List<String> reasons(List<RuleResult> results) {
        return results.stream().map(RuleResult::reason).collect(Collectors.toList());
    }
}
