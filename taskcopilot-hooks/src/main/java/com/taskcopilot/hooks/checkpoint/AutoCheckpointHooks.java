package com.taskcopilot.hooks.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskcopilot.common.config.HooksConfig.AutoCheckpointConfig;
import com.taskcopilot.common.config.HooksConfig.Triggers;
import com.taskcopilot.common.infra.ErrorUtils;
import com.taskcopilot.common.infra.ToolInputs;
import com.taskcopilot.common.model.ToolCallContext;
import com.taskcopilot.hooks.HookContexts.StopContext;
import com.taskcopilot.hooks.HookRegistry;
import com.taskcopilot.hooks.HookResults.ActionPerformed;
import com.taskcopilot.hooks.HookResults.PreActionResult;
import com.taskcopilot.hooks.HookResults.StopResult;
import com.taskcopilot.hooks.HookTypes.HookType;
import com.taskcopilot.hooks.HookTypes.PreActionHook;
import com.taskcopilot.hooks.HookTypes.StopHook;
import com.taskcopilot.hooks.HookTypes.StopTrigger;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Creates checkpoints at iteration boundaries, significant task status
 * transitions, work product stores and session stops.
 * <p>
 * Checkpoint failures are logged and never propagated to the caller.
 */
@Slf4j
public class AutoCheckpointHooks {

    public static final String STOP_HOOK_ID = "auto-checkpoint-stop";
    public static final String ITERATION_HOOK_ID = "auto-checkpoint-iteration";

    private static final Set<String> SIGNIFICANT_TRANSITIONS = Set.of(
            "pending->in_progress",
            "in_progress->blocked",
            "blocked->in_progress");

    private final CheckpointClient client;
    private volatile AutoCheckpointConfig config;

    public AutoCheckpointHooks(CheckpointClient client) {
        this(client, new AutoCheckpointConfig());
    }

    public AutoCheckpointHooks(CheckpointClient client, AutoCheckpointConfig config) {
        this.client = Objects.requireNonNull(client, "client");
        this.config = copy(config != null ? config : new AutoCheckpointConfig());
    }

    // =========================================================================
    // Direct triggers
    // =========================================================================

    /**
     * Before an iteration starts, so a failed iteration can be rolled back.
     */
    public void onIterationStart(String taskId, int iterationNumber) {
        if (!config.isEnabled() || !triggers().isIterationStart())
            return;
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("iterationStarted", Instant.now().toString());
        context.put("autoCreated", true);
        create(CheckpointRequest.builder()
                .taskId(taskId)
                .trigger(CheckpointRequest.Trigger.AUTO_ITERATION)
                .executionPhase("iteration")
                .executionStep(iterationNumber)
                .agentContext(context)
                .build(), "iteration " + iterationNumber);
    }

    /**
     * After iteration validation fails; keeps the validation state and the
     * agent's draft output for debugging.
     */
    public void onIterationFailure(String taskId, int iterationNumber, Object validationResult,
            String agentOutput) {
        if (!config.isEnabled() || !triggers().isIterationFailure())
            return;
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("validationResult", validationResult);
        context.put("iterationFailed", Instant.now().toString());
        context.put("autoCreated", true);
        create(CheckpointRequest.builder()
                .taskId(taskId)
                .trigger(CheckpointRequest.Trigger.AUTO_ITERATION)
                .executionPhase("iteration_failed")
                .executionStep(iterationNumber)
                .agentContext(context)
                .draftContent(agentOutput)
                .draftType("implementation")
                .build(), "iteration failure");
    }

    /**
     * Only pending to in_progress, in_progress to blocked and blocked to
     * in_progress are checkpointed.
     */
    public void onTaskStatusChange(String taskId, String oldStatus, String newStatus) {
        if (!config.isEnabled() || !triggers().isTaskStatusChange())
            return;
        if (!SIGNIFICANT_TRANSITIONS.contains(oldStatus + "->" + newStatus))
            return;
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("oldStatus", oldStatus);
        context.put("newStatus", newStatus);
        context.put("statusChangedAt", Instant.now().toString());
        context.put("autoCreated", true);
        create(CheckpointRequest.builder()
                .taskId(taskId)
                .trigger(CheckpointRequest.Trigger.MANUAL)
                .executionPhase("status_change")
                .agentContext(context)
                .build(), "status change");
    }

    public void onWorkProductStore(String taskId, String workProductId, String workProductType) {
        if (!config.isEnabled() || !triggers().isWorkProductStore())
            return;
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("workProductId", workProductId);
        context.put("workProductType", workProductType);
        context.put("workProductStoredAt", Instant.now().toString());
        context.put("autoCreated", true);
        create(CheckpointRequest.builder()
                .taskId(taskId)
                .trigger(CheckpointRequest.Trigger.AUTO_WORK_PRODUCT)
                .executionPhase("work_product_stored")
                .agentContext(context)
                .build(), "work product store");
    }

    public void updateConfig(AutoCheckpointConfig update) {
        if (update != null) {
            this.config = copy(update);
        }
    }

    public AutoCheckpointConfig getConfig() {
        return copy(config);
    }

    // =========================================================================
    // Registry integration
    // =========================================================================

    /**
     * Register the stop hook and the iteration pre-action hook.
     */
    public void install(HookRegistry registry) {
        List<StopTrigger> stopTriggers = new ArrayList<>();
        for (String key : config.getStopTriggers()) {
            StopTrigger trigger = StopTrigger.fromKey(key);
            if (trigger == null) {
                log.warn("Ignoring unknown stop trigger '{}'", key);
            } else {
                stopTriggers.add(trigger);
            }
        }
        registry.register(StopHook.builder()
                .id(STOP_HOOK_ID)
                .name("Auto-checkpoint on stop")
                .priority(5)
                .triggers(stopTriggers)
                .runOnFailure(true)
                .handler(this::handleStop)
                .build());
        registry.register(PreActionHook.builder()
                .id(ITERATION_HOOK_ID)
                .name("Auto-checkpoint on iteration start")
                .priority(5)
                .toolPatterns(new ArrayList<>(config.getIterationToolPatterns()))
                .handler(this::handleIterationCall)
                .build());
    }

    public void uninstall(HookRegistry registry) {
        registry.unregister(STOP_HOOK_ID, HookType.STOP);
        registry.unregister(ITERATION_HOOK_ID, HookType.PRE_ACTION);
    }

    StopResult handleStop(StopContext ctx) {
        String taskId = ctx.effectiveTaskId();
        if (taskId == null || !config.isEnabled()) {
            return StopResult.ok();
        }
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("stopTrigger", ctx.getTrigger() != null ? ctx.getTrigger().key() : null);
        context.put("modifiedFiles", ctx.getModifiedFiles());
        context.put("workProductIds", ctx.getWorkProductIds());
        if (ctx.getError() != null) {
            context.put("error", ctx.getError().message());
        }
        context.put("stoppedAt", Instant.now().toString());
        context.put("autoCreated", true);
        String checkpointId = create(CheckpointRequest.builder()
                .taskId(taskId)
                .trigger(CheckpointRequest.Trigger.AUTO_STOP)
                .executionPhase("stopped")
                .agentContext(context)
                .build(), "stop");
        boolean ok = checkpointId != null;
        return StopResult.builder()
                .success(ok)
                .actionsPerformed(List.of(new ActionPerformed("checkpoint", ok,
                        ok ? "Created checkpoint " + checkpointId : "Checkpoint failed")))
                .build();
    }

    PreActionResult handleIterationCall(ToolCallContext ctx) {
        JsonNode input = ctx.getToolInput();
        String taskId = ctx.getTaskId();
        if (taskId == null && input.path("taskId").isTextual()) {
            taskId = input.path("taskId").textValue();
        }
        if (taskId == null) {
            return PreActionResult.skip();
        }
        int iteration = ToolInputs.intField(input, "iterationNumber", ToolInputs.intField(input, "iteration", 0));
        onIterationStart(taskId, iteration);
        return PreActionResult.allow();
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private Triggers triggers() {
        Triggers t = config.getTriggers();
        return t != null ? t : new Triggers();
    }

    private String create(CheckpointRequest request, String what) {
        try {
            return client.createCheckpoint(request);
        } catch (RuntimeException e) {
            log.warn("Auto-checkpoint failed for {} (task {}): {}", what, request.getTaskId(),
                    ErrorUtils.formatErrorMessage(e));
            return null;
        }
    }

    private static AutoCheckpointConfig copy(AutoCheckpointConfig source) {
        Triggers t = source.getTriggers() != null ? source.getTriggers() : new Triggers();
        AutoCheckpointConfig defaults = new AutoCheckpointConfig();
        return AutoCheckpointConfig.builder()
                .enabled(source.isEnabled())
                .triggers(Triggers.builder()
                        .iterationStart(t.isIterationStart())
                        .iterationFailure(t.isIterationFailure())
                        .taskStatusChange(t.isTaskStatusChange())
                        .workProductStore(t.isWorkProductStore())
                        .build())
                .stopTriggers(new ArrayList<>(source.getStopTriggers() != null
                        ? source.getStopTriggers() : defaults.getStopTriggers()))
                .iterationToolPatterns(new ArrayList<>(source.getIterationToolPatterns() != null
                        ? source.getIterationToolPatterns() : defaults.getIterationToolPatterns()))
                .build();
    }
}
