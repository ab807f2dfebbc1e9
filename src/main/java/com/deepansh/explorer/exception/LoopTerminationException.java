package com.deepansh.explorer.exception;

import com.deepansh.explorer.model.TerminationReason;

/**
 * Signals that the loop must stop. Raised at the loop's checkpoints and
 * caught by the controller, which turns it into a {@code LoopResult}.
 */
public abstract class LoopTerminationException extends ExplorationException {

    private final TerminationReason reason;

    protected LoopTerminationException(TerminationReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TerminationReason getReason() {
        return reason;
    }
}
