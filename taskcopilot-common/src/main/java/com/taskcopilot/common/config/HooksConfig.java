package com.taskcopilot.common.config;

import com.taskcopilot.common.model.PolicyAction;
import com.taskcopilot.common.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration for the hook runtime, read from a JSON file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HooksConfig {

    private HookDefaults hooks;
    private SecurityConfig security;
    private AutoCheckpointConfig autoCheckpoint;

    // --- Hook registry / executor defaults ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HookDefaults {
        @Builder.Default
        private long defaultTimeoutMs = 5000;
        @Builder.Default
        private int defaultPriority = 3;
        @Builder.Default
        private int maxHooksPerType = 100;
    }

    // --- Security rule engine ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SecurityConfig {
        @Builder.Default
        private boolean enabled = true;
        @Builder.Default
        private boolean installDefaults = true;
        /** Register the engine as a global pre-action hook. */
        @Builder.Default
        private boolean registerPreActionHook = true;
        @Builder.Default
        private int hookPriority = 1;
        @Builder.Default
        private int maxRules = 100;
        @Builder.Default
        private List<String> disabledRules = new ArrayList<>();
        @Builder.Default
        private List<CustomRuleConfig> customRules = new ArrayList<>();
    }

    /**
     * A pattern-based rule declared in configuration. Unset fields take the
     * custom-rule defaults when the rule is built.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CustomRuleConfig {
        private String id;
        private String name;
        private String description;
        private Boolean enabled;
        private Integer priority;
        private List<String> patterns;
        private Severity severity;
        private PolicyAction action;
    }

    // --- Auto-checkpoint adapter ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AutoCheckpointConfig {
        @Builder.Default
        private boolean enabled = true;
        @Builder.Default
        private Triggers triggers = new Triggers();
        @Builder.Default
        private List<String> stopTriggers = new ArrayList<>(
                List.of("task_blocked", "error", "context_limit", "user_interrupt"));
        @Builder.Default
        private List<String> iterationToolPatterns = new ArrayList<>(
                List.of("iteration_start", "iteration_next"));
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Triggers {
        @Builder.Default
        private boolean iterationStart = true;
        @Builder.Default
        private boolean iterationFailure = true;
        @Builder.Default
        private boolean taskStatusChange = false;
        @Builder.Default
        private boolean workProductStore = false;
    }

    public static HooksConfig defaults() {
        return new HooksConfigService.Defaults().apply(new HooksConfig());
    }
}
