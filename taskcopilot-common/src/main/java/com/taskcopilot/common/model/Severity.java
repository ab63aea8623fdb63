package com.taskcopilot.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity attached to rule findings and hook decisions.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Severity fromLabel(String label) {
        if (label == null)
            return MEDIUM;
        return switch (label.trim().toLowerCase()) {
            case "low" -> LOW;
            case "high" -> HIGH;
            case "critical" -> CRITICAL;
            default -> MEDIUM;
        };
    }

    /**
     * Return the more severe of two values (nulls ignored).
     */
    public static Severity max(Severity a, Severity b) {
        if (a == null)
            return b;
        if (b == null)
            return a;
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
