package com.taskcopilot.hooks;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskcopilot.common.infra.ToolInputs;
import com.taskcopilot.hooks.HookTypes.ScopeFilter;
import com.taskcopilot.hooks.HookTypes.StopTrigger;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Inputs handed to post-action, prompt-submitted and stop handlers.
 * Pre-action handlers receive {@link com.taskcopilot.common.model.ToolCallContext}.
 */
public final class HookContexts {

    private HookContexts() {
    }

    // =========================================================================
    // Post-action
    // =========================================================================

    @Value
    @Builder
    public static class PostActionContext {
        String toolName;
        JsonNode toolInput;
        JsonNode toolResult;
        boolean success;
        String error;
        long durationMs;
        String agentId;
        String taskId;
        @Builder.Default
        Instant timestamp = Instant.now();

        public JsonNode getToolInput() {
            return ToolInputs.copyOf(toolInput);
        }

        public JsonNode getToolResult() {
            return toolResult == null ? null : toolResult.deepCopy();
        }

        public ScopeFilter scope() {
            return new ScopeFilter(agentId, taskId);
        }

        public static class PostActionContextBuilder {

            public PostActionContextBuilder toolInput(JsonNode toolInput) {
                this.toolInput = ToolInputs.copyOf(toolInput);
                return this;
            }

            public PostActionContextBuilder toolInput(Map<String, ?> toolInput) {
                this.toolInput = ToolInputs.of(toolInput);
                return this;
            }
        }
    }

    // =========================================================================
    // Prompt submitted
    // =========================================================================

    public enum PromptIntent {
        QUESTION,
        COMMAND,
        CORRECTION,
        REQUEST,
        OTHER
    }

    public record SuggestedSkill(String name, double confidence) {
    }

    @Value
    @Builder
    public static class PromptContext {
        String promptText;
        PromptIntent detectedIntent;
        List<String> mentionedFiles;
        List<SuggestedSkill> suggestedSkills;
        boolean continuation;
        /** Slash command the prompt invoked, if any. */
        String command;
        String agentId;
        String taskId;
        @Builder.Default
        Instant timestamp = Instant.now();

        public List<String> getMentionedFiles() {
            return mentionedFiles == null ? List.of() : List.copyOf(mentionedFiles);
        }

        public List<SuggestedSkill> getSuggestedSkills() {
            return suggestedSkills == null ? List.of() : List.copyOf(suggestedSkills);
        }

        public ScopeFilter scope() {
            return new ScopeFilter(agentId, taskId);
        }
    }

    // =========================================================================
    // Stop
    // =========================================================================

    public record TaskState(String id, String status, String notes) {
    }

    public record StopError(String message, String stack, String code) {
    }

    @Value
    @Builder
    public static class StopContext {
        StopTrigger trigger;
        TaskState taskState;
        List<String> modifiedFiles;
        List<String> workProductIds;
        StopError error;
        Long sessionDurationMs;
        String agentId;
        String taskId;
        @Builder.Default
        Instant timestamp = Instant.now();

        public List<String> getModifiedFiles() {
            return modifiedFiles == null ? List.of() : List.copyOf(modifiedFiles);
        }

        public List<String> getWorkProductIds() {
            return workProductIds == null ? List.of() : List.copyOf(workProductIds);
        }

        /** Task bound to this stop: explicit id, else the task state's id. */
        public String effectiveTaskId() {
            if (taskId != null)
                return taskId;
            return taskState != null ? taskState.id() : null;
        }

        public ScopeFilter scope() {
            return new ScopeFilter(agentId, effectiveTaskId());
        }
    }
}
