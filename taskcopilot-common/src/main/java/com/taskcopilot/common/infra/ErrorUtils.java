package com.taskcopilot.common.infra;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Error formatting utilities. Safely extract readable messages from
 * exceptions raised by hook handlers and security rules.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        String msg = err.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return err.getClass().getSimpleName();
    }

    /**
     * Strip the wrappers added by futures so the handler's own exception is
     * reported.
     */
    public static Throwable unwrap(Throwable err) {
        Throwable current = err;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
