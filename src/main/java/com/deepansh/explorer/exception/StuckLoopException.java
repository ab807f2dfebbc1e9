package com.deepansh.explorer.exception;

import com.deepansh.explorer.model.TerminationReason;

public class StuckLoopException extends LoopTerminationException {

    public StuckLoopException(String message) {
        super(TerminationReason.STUCK_LOOP_ESCALATION, message);
    }
}
