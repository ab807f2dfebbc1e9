package com.deepansh.explorer.model;

/**
 * Why an exploration loop stopped. Every {@link LoopResult} carries exactly one.
 */
public enum TerminationReason {

    GOAL_ACHIEVED("goal achieved"),
    MAX_ITERATIONS("iteration budget exhausted"),
    TOTAL_TIMEOUT("total time budget exceeded"),
    CIRCUIT_BREAKER("circuit breaker opened after consecutive errors"),
    STUCK_LOOP_ESCALATION("stuck loop could not be recovered"),
    ERROR_BUDGET_EXHAUSTED("error budget exhausted"),
    INTERNAL_ERROR("unexpected internal failure");

    private final String description;

    TerminationReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isAbort() {
        return this == CIRCUIT_BREAKER || this == STUCK_LOOP_ESCALATION
                || this == ERROR_BUDGET_EXHAUSTED || this == INTERNAL_ERROR;
    }
}
