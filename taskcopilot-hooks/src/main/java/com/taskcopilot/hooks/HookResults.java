package com.taskcopilot.hooks;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskcopilot.common.model.PolicyAction;
import com.taskcopilot.common.model.Severity;
import com.taskcopilot.hooks.HookTypes.HookType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handler results, per-invocation reports and the aggregate outcome of each
 * dispatch path.
 */
public final class HookResults {

    private HookResults() {
    }

    // =========================================================================
    // Pre-action
    // =========================================================================

    public enum PreActionStatus {
        ALLOW,
        DENY,
        WARN,
        SKIP
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PreActionResult {
        private PreActionStatus status;
        private String reason;
        /** Replacement tool arguments, when the hook rewrites the call. */
        private JsonNode modifiedArgs;
        private List<String> warnings;
        private Severity severity;
        private long executionTimeMs;

        public static PreActionResult allow() {
            return builder().status(PreActionStatus.ALLOW).build();
        }

        public static PreActionResult skip() {
            return builder().status(PreActionStatus.SKIP).build();
        }

        public static PreActionResult deny(String reason, Severity severity) {
            return builder().status(PreActionStatus.DENY).reason(reason).severity(severity).build();
        }

        public static PreActionResult warn(String reason) {
            return builder().status(PreActionStatus.WARN).reason(reason).build();
        }
    }

    // =========================================================================
    // Post-action
    // =========================================================================

    public enum PostActionStatus {
        CONTINUE,
        HALT,
        RETRY
    }

    public enum LogLevel {
        DEBUG,
        INFO,
        WARN,
        ERROR
    }

    public record LogEntry(LogLevel level, String message, Map<String, Object> data) {
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PostActionResult {
        private PostActionStatus status;
        private JsonNode transformedResult;
        private Map<String, Object> enrichment;
        private LogEntry logEntry;
        private long executionTimeMs;

        public static PostActionResult pass() {
            return builder().status(PostActionStatus.CONTINUE).build();
        }
    }

    // =========================================================================
    // Prompt submitted
    // =========================================================================

    public enum PromptStatus {
        PROCEED,
        BLOCK,
        REDIRECT
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PromptResult {
        private PromptStatus status;
        private String contextInjection;
        private List<String> skillsToLoad;
        private String redirectTo;
        private String userMessage;
        private long executionTimeMs;

        public static PromptResult proceed() {
            return builder().status(PromptStatus.PROCEED).build();
        }

        public static PromptResult inject(String contextInjection, List<String> skillsToLoad) {
            return builder()
                    .status(PromptStatus.PROCEED)
                    .contextInjection(contextInjection)
                    .skillsToLoad(skillsToLoad)
                    .build();
        }

        public static PromptResult block(String userMessage) {
            return builder().status(PromptStatus.BLOCK).userMessage(userMessage).build();
        }

        public static PromptResult redirect(String redirectTo, String userMessage) {
            return builder().status(PromptStatus.REDIRECT).redirectTo(redirectTo).userMessage(userMessage).build();
        }
    }

    // =========================================================================
    // Stop
    // =========================================================================

    public record ActionPerformed(String action, boolean success, String message) {
    }

    public record AuditEntry(String summary, Map<String, Object> details) {
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StopResult {
        private boolean success;
        private List<ActionPerformed> actionsPerformed;
        private Map<String, Object> persistedState;
        private AuditEntry auditEntry;
        private long executionTimeMs;

        public static StopResult ok() {
            return builder().success(true).build();
        }

        public static StopResult failed(String message) {
            return builder()
                    .success(false)
                    .actionsPerformed(List.of(new ActionPerformed("hook", false, message)))
                    .build();
        }
    }

    // =========================================================================
    // Reports and aggregate outcomes
    // =========================================================================

    /**
     * One per handler invocation. {@code error} is {@code "Timeout"} when the
     * handler ran out of time.
     */
    public record ExecutionReport(
            String hookId,
            HookType hookType,
            boolean success,
            long durationMs,
            Object result,
            String error,
            Instant timestamp) {
    }

    public record PreActionOutcome(
            boolean allowed,
            PolicyAction action,
            List<String> violations,
            List<String> warnings,
            List<PreActionResult> results,
            List<ExecutionReport> reports) {
    }

    public record PostActionOutcome(List<PostActionResult> results, List<ExecutionReport> reports) {
    }

    public record PromptOutcome(
            boolean proceed,
            List<String> contextInjections,
            Set<String> skillsToLoad,
            String redirectTo,
            List<PromptResult> results,
            List<ExecutionReport> reports) {
    }

    public record StopOutcome(List<StopResult> results, List<ExecutionReport> reports) {

        public boolean allSucceeded() {
            return results.stream().allMatch(StopResult::isSuccess);
        }
    }
}
