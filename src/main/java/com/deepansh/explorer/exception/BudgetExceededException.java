package com.deepansh.explorer.exception;

import com.deepansh.explorer.model.TerminationReason;

/**
 * Iteration or wall-clock budget reached. A clean stop, not a crash.
 */
public class BudgetExceededException extends LoopTerminationException {

    public BudgetExceededException(TerminationReason reason, String message) {
        super(reason, message);
    }
}
