package com.deepansh.explorer.core;

/**
 * States of the loop controller's state machine.
 * INIT → REASONING → ACTING → OBSERVING → (REASONING | DONE | ABORTED)
 */
public enum LoopPhase {
    INIT,
    REASONING,
    ACTING,
    OBSERVING,
    DONE,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }
}
