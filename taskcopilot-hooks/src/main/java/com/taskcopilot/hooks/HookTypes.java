package com.taskcopilot.hooks;

import com.taskcopilot.common.model.ToolCallContext;
import com.taskcopilot.hooks.HookContexts.PostActionContext;
import com.taskcopilot.hooks.HookContexts.PromptContext;
import com.taskcopilot.hooks.HookContexts.StopContext;
import com.taskcopilot.hooks.HookResults.PostActionResult;
import com.taskcopilot.hooks.HookResults.PreActionResult;
import com.taskcopilot.hooks.HookResults.PromptResult;
import com.taskcopilot.hooks.HookResults.StopResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lifecycle hook definitions: the four hook kinds, their scopes and the
 * registry's bookkeeping records.
 */
public final class HookTypes {

    private HookTypes() {
    }

    public static final long DEFAULT_TIMEOUT_MS = 5000;
    public static final int DEFAULT_PRIORITY = 3;

    private static <T> List<T> copyOf(List<T> list) {
        return list == null ? null : new ArrayList<>(list);
    }

    // =========================================================================
    // Hook type / scope / stop trigger
    // =========================================================================

    public enum HookType {
        PRE_ACTION,
        POST_ACTION,
        PROMPT_SUBMITTED,
        STOP;

        public String key() {
            return name().toLowerCase();
        }
    }

    public enum HookScope {
        GLOBAL,
        AGENT,
        TASK;

        public String key() {
            return name().toLowerCase();
        }
    }

    /**
     * Why a session is stopping.
     */
    public enum StopTrigger {
        SESSION_END,
        TASK_COMPLETE,
        TASK_BLOCKED,
        ERROR,
        TIMEOUT,
        USER_INTERRUPT,
        CONTEXT_LIMIT;

        public String key() {
            return name().toLowerCase();
        }

        public static StopTrigger fromKey(String key) {
            if (key == null)
                return null;
            for (StopTrigger trigger : values()) {
                if (trigger.key().equalsIgnoreCase(key.trim()))
                    return trigger;
            }
            return null;
        }
    }

    // =========================================================================
    // Handler
    // =========================================================================

    /**
     * A hook body. May block; the executor bounds it with the hook's timeout.
     */
    @FunctionalInterface
    public interface HookHandler<C, R> {
        R handle(C context) throws Exception;
    }

    // =========================================================================
    // Hook definitions
    // =========================================================================

    /**
     * Fields shared by every hook kind. Priority and timeout are optional;
     * unset values take the registry/executor defaults.
     */
    public sealed interface LifecycleHook permits PreActionHook, PostActionHook, PromptSubmittedHook, StopHook {

        String getId();

        String getName();

        String getDescription();

        boolean isEnabled();

        Integer getPriority();

        Long getTimeoutMs();

        List<String> getTags();

        HookType type();

        /** Copy with a new id; list fields are copied, not shared. */
        LifecycleHook withId(String id);

        LifecycleHook withEnabled(boolean enabled);

        default int effectivePriority(int fallback) {
            return getPriority() != null ? getPriority() : fallback;
        }

        default long effectiveTimeoutMs(long fallback) {
            Long timeout = getTimeoutMs();
            return timeout != null && timeout > 0 ? timeout : fallback;
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static final class PreActionHook implements LifecycleHook {
        private String id;
        private String name;
        private String description;
        @Builder.Default
        private boolean enabled = true;
        private Integer priority;
        private Long timeoutMs;
        private List<String> tags;
        /** Case-insensitive tool-name globs; empty means every tool. */
        private List<String> toolPatterns;
        private HookHandler<ToolCallContext, PreActionResult> handler;

        @Override
        public HookType type() {
            return HookType.PRE_ACTION;
        }

        @Override
        public PreActionHook withId(String id) {
            return copyBuilder().id(id).build();
        }

        @Override
        public PreActionHook withEnabled(boolean enabled) {
            return copyBuilder().enabled(enabled).build();
        }

        private PreActionHookBuilder copyBuilder() {
            return toBuilder()
                    .tags(copyOf(tags))
                    .toolPatterns(copyOf(toolPatterns));
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static final class PostActionHook implements LifecycleHook {
        private String id;
        private String name;
        private String description;
        @Builder.Default
        private boolean enabled = true;
        private Integer priority;
        private Long timeoutMs;
        private List<String> tags;
        private List<String> toolPatterns;
        /** Only run when the tool call failed. */
        private boolean onErrorOnly;
        private HookHandler<PostActionContext, PostActionResult> handler;

        @Override
        public HookType type() {
            return HookType.POST_ACTION;
        }

        @Override
        public PostActionHook withId(String id) {
            return copyBuilder().id(id).build();
        }

        @Override
        public PostActionHook withEnabled(boolean enabled) {
            return copyBuilder().enabled(enabled).build();
        }

        private PostActionHookBuilder copyBuilder() {
            return toBuilder()
                    .tags(copyOf(tags))
                    .toolPatterns(copyOf(toolPatterns));
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static final class PromptSubmittedHook implements LifecycleHook {
        private String id;
        private String name;
        private String description;
        @Builder.Default
        private boolean enabled = true;
        private Integer priority;
        private Long timeoutMs;
        private List<String> tags;
        /** Case-insensitive regexes searched in the prompt text. */
        private List<String> promptPatterns;
        /** Exact command names, e.g. {@code /protocol}. */
        private List<String> commandPatterns;
        private HookHandler<PromptContext, PromptResult> handler;

        @Override
        public HookType type() {
            return HookType.PROMPT_SUBMITTED;
        }

        @Override
        public PromptSubmittedHook withId(String id) {
            return copyBuilder().id(id).build();
        }

        @Override
        public PromptSubmittedHook withEnabled(boolean enabled) {
            return copyBuilder().enabled(enabled).build();
        }

        private PromptSubmittedHookBuilder copyBuilder() {
            return toBuilder()
                    .tags(copyOf(tags))
                    .promptPatterns(copyOf(promptPatterns))
                    .commandPatterns(copyOf(commandPatterns));
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static final class StopHook implements LifecycleHook {
        private String id;
        private String name;
        private String description;
        @Builder.Default
        private boolean enabled = true;
        private Integer priority;
        private Long timeoutMs;
        private List<String> tags;
        /** Triggers this hook responds to; empty means it never fires. */
        private List<StopTrigger> triggers;
        private boolean runOnFailure;
        private HookHandler<StopContext, StopResult> handler;

        @Override
        public HookType type() {
            return HookType.STOP;
        }

        @Override
        public StopHook withId(String id) {
            return copyBuilder().id(id).build();
        }

        @Override
        public StopHook withEnabled(boolean enabled) {
            return copyBuilder().enabled(enabled).build();
        }

        private StopHookBuilder copyBuilder() {
            return toBuilder()
                    .tags(copyOf(tags))
                    .triggers(copyOf(triggers));
        }
    }

    // =========================================================================
    // Registry records
    // =========================================================================

    public record HookRegistration(String hookId, Instant registeredAt, HookScope scope, boolean active) {
    }

    public record HookSummary(
            HookType type,
            String id,
            String name,
            boolean enabled,
            int priority,
            HookScope scope,
            String agentId,
            String taskId) {
    }

    public record RegistryStats(Map<HookType, Integer> counts) {

        public int count(HookType type) {
            return counts.getOrDefault(type, 0);
        }

        public int total() {
            return counts.values().stream().mapToInt(Integer::intValue).sum();
        }
    }

    /**
     * Binding of the call being dispatched; either id may be null.
     */
    public record ScopeFilter(String agentId, String taskId) {

        public static final ScopeFilter NONE = new ScopeFilter(null, null);
    }
}
