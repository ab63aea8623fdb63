package com.taskcopilot.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskcopilot.common.infra.ErrorUtils;
import com.taskcopilot.common.infra.RegistrationCapacityExceededException;
import com.taskcopilot.common.model.PolicyAction;
import com.taskcopilot.common.model.ToolCallContext;
import com.taskcopilot.security.SecurityTypes.EvaluationResult;
import com.taskcopilot.security.SecurityTypes.RuleResult;
import com.taskcopilot.security.SecurityTypes.RuleSummary;
import com.taskcopilot.security.SecurityTypes.SecurityRule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry and evaluator for security rules.
 * <p>
 * Independent of the hook registry and always global. Every enabled rule
 * runs on every evaluation, so callers receive the complete set of findings;
 * a rule that throws is logged and skipped.
 */
@Slf4j
public class SecurityRuleEngine {

    public static final int MAX_RULES = 100;

    private record RuleEntry(SecurityRule rule, boolean enabled, long sequence) {
    }

    private static final Comparator<RuleEntry> EVALUATION_ORDER = Comparator
            .comparingInt((RuleEntry e) -> e.rule().priority()).reversed()
            .thenComparingLong(RuleEntry::sequence);

    private final Map<String, RuleEntry> rules = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final int maxRules;

    public SecurityRuleEngine() {
        this(MAX_RULES);
    }

    public SecurityRuleEngine(int maxRules) {
        this.maxRules = maxRules;
    }

    // -----------------------------------------------------------------------
    // Registration
    // -----------------------------------------------------------------------

    /**
     * Register a rule; a rule with the same id is replaced.
     *
     * @throws RegistrationCapacityExceededException when the engine is full
     */
    public synchronized void registerRule(SecurityRule rule) {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(rule.id(), "rule id");
        if (!rules.containsKey(rule.id()) && rules.size() >= maxRules) {
            throw new RegistrationCapacityExceededException("rules", maxRules);
        }
        rules.put(rule.id(), new RuleEntry(rule, rule.enabledByDefault(), sequence.incrementAndGet()));
        log.debug("Registered security rule {} (priority={})", rule.id(), rule.priority());
    }

    public synchronized boolean unregisterRule(String ruleId) {
        return ruleId != null && rules.remove(ruleId) != null;
    }

    public synchronized boolean toggleRule(String ruleId, boolean enabled) {
        RuleEntry entry = ruleId != null ? rules.get(ruleId) : null;
        if (entry == null)
            return false;
        rules.put(ruleId, new RuleEntry(entry.rule(), enabled, entry.sequence()));
        log.debug("Security rule {} {}", ruleId, enabled ? "enabled" : "disabled");
        return true;
    }

    public synchronized void clear() {
        rules.clear();
    }

    // -----------------------------------------------------------------------
    // Lookup
    // -----------------------------------------------------------------------

    public Optional<RuleSummary> getRule(String ruleId) {
        RuleEntry entry = ruleId != null ? rules.get(ruleId) : null;
        return Optional.ofNullable(entry).map(SecurityRuleEngine::summarize);
    }

    /**
     * All rules, enabled or not, in evaluation order.
     */
    public List<RuleSummary> listRules() {
        return ordered().stream().map(SecurityRuleEngine::summarize).toList();
    }

    /**
     * Enabled rules in evaluation order.
     */
    public List<SecurityRule> activeRules() {
        return ordered().stream().filter(RuleEntry::enabled).map(RuleEntry::rule).toList();
    }

    public int size() {
        return rules.size();
    }

    // -----------------------------------------------------------------------
    // Evaluation
    // -----------------------------------------------------------------------

    public EvaluationResult evaluate(String toolName, Map<String, ?> toolInput) {
        return evaluate(ToolCallContext.builder().toolName(toolName).toolInput(toolInput).build());
    }

    public EvaluationResult evaluate(String toolName, JsonNode toolInput) {
        return evaluate(toolName, toolInput, null);
    }

    public EvaluationResult evaluate(String toolName, JsonNode toolInput, Map<String, Object> metadata) {
        return evaluate(ToolCallContext.builder()
                .toolName(toolName)
                .toolInput(toolInput)
                .metadata(metadata)
                .build());
    }

    public EvaluationResult evaluate(ToolCallContext context) {
        return evaluate(context, false);
    }

    /**
     * Evaluate a hypothetical call. Same rules and results as
     * {@link #evaluate(ToolCallContext)}; the context carries
     * {@code dryRun=true} in its metadata.
     */
    public EvaluationResult dryRun(String toolName, JsonNode toolInput) {
        return evaluate(ToolCallContext.builder()
                .toolName(toolName)
                .toolInput(toolInput)
                .metadata(Map.of("dryRun", true))
                .build(), true);
    }

    public EvaluationResult dryRun(String toolName, Map<String, ?> toolInput) {
        return evaluate(ToolCallContext.builder()
                .toolName(toolName)
                .toolInput(toolInput)
                .metadata(Map.of("dryRun", true))
                .build(), true);
    }

    private EvaluationResult evaluate(ToolCallContext context, boolean dryRun) {
        long start = System.nanoTime();
        List<RuleResult> violations = new ArrayList<>();
        List<RuleResult> warnings = new ArrayList<>();

        for (SecurityRule rule : activeRules()) {
            RuleResult result;
            try {
                result = rule.evaluate(context);
            } catch (RuntimeException | StackOverflowError e) {
                // deep recursion in a custom pattern is contained to that rule
                log.warn("Error evaluating security rule {}: {}", rule.id(), ErrorUtils.formatErrorMessage(e));
                continue;
            }
            if (result == null || result.action() == null)
                continue;
            if (result.action() == PolicyAction.BLOCK) {
                violations.add(result);
            } else if (result.action() == PolicyAction.WARN) {
                warnings.add(result);
            }
        }

        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        PolicyAction action = PolicyAction.aggregate(violations.size(), warnings.size());
        if (action != PolicyAction.ALLOW) {
            log.debug("Security evaluation of {}: {} ({} violation(s), {} warning(s))", context.getToolName(),
                    action.label(), violations.size(), warnings.size());
        }
        return new EvaluationResult(violations.isEmpty(), action, List.copyOf(violations), List.copyOf(warnings),
                elapsed, dryRun);
    }

    private List<RuleEntry> ordered() {
        List<RuleEntry> entries = new ArrayList<>(rules.values());
        entries.sort(EVALUATION_ORDER);
        return entries;
    }

    private static RuleSummary summarize(RuleEntry entry) {
        SecurityRule rule = entry.rule();
        return new RuleSummary(rule.id(), rule.name(), rule.description(), entry.enabled(), rule.priority());
    }
}
