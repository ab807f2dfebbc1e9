package com.deepansh.explorer.exception;

/**
 * A tool call failed or exceeded its time budget. Retried up to the configured limit.
 */
public class ToolExecutionException extends ExplorationException {

    private final boolean timeout;

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.timeout = false;
    }

    private ToolExecutionException(String message, boolean timeout) {
        super(message);
        this.timeout = timeout;
    }

    public static ToolExecutionException timedOut(String toolName, long timeoutMs) {
        return new ToolExecutionException(
                "Tool " + toolName + " timed out after " + timeoutMs + "ms", true);
    }

    public boolean isTimeout() {
        return timeout;
    }
}
