package com.taskcopilot.hooks.checkpoint;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointRequest {

    public enum Trigger {
        AUTO_ITERATION,
        AUTO_WORK_PRODUCT,
        AUTO_STOP,
        MANUAL;

        public String key() {
            return name().toLowerCase();
        }
    }

    private String taskId;
    private Trigger trigger;
    /** e.g. iteration, iteration_failed, status_change, work_product_stored, stopped */
    private String executionPhase;
    private Integer executionStep;
    private Map<String, Object> agentContext;
    private String draftContent;
    private String draftType;
}
