package com.taskcopilot.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskcopilot.common.model.ToolCallContext;
import com.taskcopilot.hooks.HookContexts.PostActionContext;
import com.taskcopilot.hooks.HookContexts.PromptContext;
import com.taskcopilot.hooks.HookContexts.StopContext;
import com.taskcopilot.hooks.HookExecutor;
import com.taskcopilot.hooks.HookRegistry;
import com.taskcopilot.hooks.HookResults.PostActionOutcome;
import com.taskcopilot.hooks.HookResults.PreActionOutcome;
import com.taskcopilot.hooks.HookResults.PromptOutcome;
import com.taskcopilot.hooks.HookResults.StopOutcome;
import com.taskcopilot.hooks.HookTypes.HookRegistration;
import com.taskcopilot.hooks.HookTypes.HookScope;
import com.taskcopilot.hooks.HookTypes.HookSummary;
import com.taskcopilot.hooks.HookTypes.HookType;
import com.taskcopilot.hooks.HookTypes.LifecycleHook;
import com.taskcopilot.hooks.HookTypes.RegistryStats;
import com.taskcopilot.hooks.checkpoint.AutoCheckpointHooks;
import com.taskcopilot.security.SecurityRuleEngine;
import com.taskcopilot.security.SecurityRuleTools;
import com.taskcopilot.security.SecurityTypes.EvaluationResult;
import com.taskcopilot.security.SecurityTypes.SecurityRule;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Host-facing facade over the hook registry, the executor and the security
 * rule engine. One instance per process, built by
 * {@link HookRuntimeBootstrap}.
 */
public final class HookRuntime implements AutoCloseable {

    private final HookRegistry registry;
    private final HookExecutor executor;
    private final SecurityRuleEngine ruleEngine;
    private final SecurityRuleTools ruleTools;
    private final AutoCheckpointHooks checkpointHooks;

    HookRuntime(HookRegistry registry, HookExecutor executor, SecurityRuleEngine ruleEngine,
            AutoCheckpointHooks checkpointHooks) {
        this.registry = registry;
        this.executor = executor;
        this.ruleEngine = ruleEngine;
        this.ruleTools = new SecurityRuleTools(ruleEngine);
        this.checkpointHooks = checkpointHooks;
    }

    // --- Hook registration ---

    public HookRegistration registerHook(LifecycleHook hook) {
        return registry.register(hook);
    }

    public HookRegistration registerHook(LifecycleHook hook, HookScope scope, String agentId, String taskId) {
        return registry.register(hook, scope, agentId, taskId);
    }

    public boolean unregisterHook(String hookId, HookType type) {
        return registry.unregister(hookId, type);
    }

    public boolean toggleHook(String hookId, HookType type, boolean enabled) {
        return registry.toggle(hookId, type, enabled);
    }

    public List<HookSummary> listAllHooks() {
        return registry.listAll();
    }

    public RegistryStats getRegistryStats() {
        return registry.stats();
    }

    // --- Dispatch ---

    public PreActionOutcome executePreActionHooks(ToolCallContext context) {
        return executor.runPreAction(context);
    }

    public PostActionOutcome executePostActionHooks(PostActionContext context) {
        return executor.runPostAction(context);
    }

    public PromptOutcome executePromptSubmittedHooks(PromptContext context) {
        return executor.runPromptSubmitted(context);
    }

    public StopOutcome executeStopHooks(StopContext context) {
        return executor.runStop(context);
    }

    // --- Security rules ---

    public void registerSecurityRule(SecurityRule rule) {
        ruleEngine.registerRule(rule);
    }

    public EvaluationResult evaluateSecurityRules(String toolName, JsonNode toolInput) {
        return ruleEngine.evaluate(toolName, toolInput);
    }

    public EvaluationResult evaluateSecurityRules(String toolName, Map<String, ?> toolInput) {
        return ruleEngine.evaluate(toolName, toolInput);
    }

    /**
     * Dry run: evaluate a hypothetical call.
     */
    public EvaluationResult testSecurityRules(String toolName, Map<String, ?> toolInput) {
        return ruleEngine.dryRun(toolName, toolInput);
    }

    // --- Accessors ---

    public HookRegistry getRegistry() {
        return registry;
    }

    public SecurityRuleEngine getRuleEngine() {
        return ruleEngine;
    }

    public SecurityRuleTools getRuleTools() {
        return ruleTools;
    }

    public Optional<AutoCheckpointHooks> getCheckpointHooks() {
        return Optional.ofNullable(checkpointHooks);
    }

    @Override
    public void close() {
        executor.close();
    }
}
