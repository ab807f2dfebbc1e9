package com.deepansh.explorer.exception;

/**
 * Action parameters failed the per-kind required-field check. Never retried.
 */
public class ActionValidationException extends ExplorationException {

    public ActionValidationException(String message) {
        super(message);
    }
}
