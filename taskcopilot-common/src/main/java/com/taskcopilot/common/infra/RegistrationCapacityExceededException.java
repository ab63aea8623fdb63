package com.taskcopilot.common.infra;

import lombok.Getter;

/**
 * Thrown when a registration would push a registry past its fixed ceiling.
 * The only registration failure reported to the caller synchronously.
 */
@Getter
public class RegistrationCapacityExceededException extends RuntimeException {

    private final String kind;
    private final int limit;

    public RegistrationCapacityExceededException(String kind, int limit) {
        super("Maximum " + describe(kind) + " (" + limit + ") reached" + suffix(kind));
        this.kind = kind;
        this.limit = limit;
    }

    private static String describe(String kind) {
        return kind != null && kind.startsWith("rule") ? "rules" : "hooks";
    }

    private static String suffix(String kind) {
        if (kind == null || kind.startsWith("rule"))
            return "";
        return " for type " + kind;
    }
}
