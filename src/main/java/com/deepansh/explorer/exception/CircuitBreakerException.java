package com.deepansh.explorer.exception;

import com.deepansh.explorer.model.TerminationReason;

public class CircuitBreakerException extends LoopTerminationException {

    public CircuitBreakerException(int consecutiveErrors) {
        super(TerminationReason.CIRCUIT_BREAKER,
                "Too many consecutive errors (" + consecutiveErrors + ")");
    }
}
