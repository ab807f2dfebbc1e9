package com.deepansh.explorer.exception;

/**
 * Base unchecked exception for the exploration engine.
 * Thrown for configuration and programming errors that should surface to the caller;
 * failures inside a loop iteration are converted to observations instead.
 */
public class ExplorationException extends RuntimeException {

    public ExplorationException(String message) {
        super(message);
    }

    public ExplorationException(String message, Throwable cause) {
        super(message, cause);
    }
}
