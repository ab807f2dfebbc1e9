package com.deepansh.explorer.exception;

/**
 * A tool returned a malformed or empty result. Retried like an execution failure.
 */
public class ResultValidationException extends ExplorationException {

    public ResultValidationException(String message) {
        super(message);
    }
}
