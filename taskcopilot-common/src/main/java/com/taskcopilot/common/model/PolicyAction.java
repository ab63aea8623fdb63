package com.taskcopilot.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Decision levels shared by hook dispatch and security rule evaluation.
 * Ordered by strictness: ALLOW &lt; WARN &lt; BLOCK.
 */
public enum PolicyAction {
    ALLOW(0),
    WARN(1),
    BLOCK(2);

    private final int level;

    PolicyAction(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    /**
     * Parse a label such as "block". Unknown or missing labels resolve to WARN.
     */
    @JsonCreator
    public static PolicyAction fromLabel(String label) {
        if (label == null)
            return WARN;
        return switch (label.trim().toLowerCase()) {
            case "allow" -> ALLOW;
            case "block" -> BLOCK;
            default -> WARN;
        };
    }

    /**
     * Aggregate decision: BLOCK if anything was blocked, else WARN if anything
     * warned, else ALLOW.
     */
    public static PolicyAction aggregate(int violations, int warnings) {
        if (violations > 0)
            return BLOCK;
        if (warnings > 0)
            return WARN;
        return ALLOW;
    }
}
