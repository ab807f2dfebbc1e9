package com.deepansh.explorer.core;

import com.deepansh.explorer.model.ActionType;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;

/**
 * Spots repetitive action histories and picks a recovery.
 *
 * An action's identity is its description. Nothing is flagged before
 * {@value #MIN_HISTORY} actions have been taken.
 */
@Slf4j
public class StuckLoopDetector {

    static final int MIN_HISTORY = 5;
    static final int OSCILLATION_WINDOW = 6;
    static final int MAX_RECOVERIES = 3;
    private static final int STRATEGY_WINDOW = 3;

    private final int repeatWindow;

    /**
     * @param maxSameActionRepeats repeats tolerated after the first occurrence;
     *                             the default of 3 flags four identical actions in a row
     */
    public StuckLoopDetector(int maxSameActionRepeats) {
        if (maxSameActionRepeats < 1) {
            throw new IllegalArgumentException("maxSameActionRepeats must be positive");
        }
        this.repeatWindow = maxSameActionRepeats + 1;
    }

    public boolean isStuck(List<String> actions) {
        int n = actions.size();
        if (n < MIN_HISTORY) {
            return false;
        }

        if (n >= repeatWindow && new HashSet<>(actions.subList(n - repeatWindow, n)).size() == 1) {
            return true;
        }

        if (n >= OSCILLATION_WINDOW) {
            List<String> last = actions.subList(n - OSCILLATION_WINDOW, n);
            return last.get(0).equals(last.get(2)) && last.get(2).equals(last.get(4))
                    && last.get(1).equals(last.get(3)) && last.get(3).equals(last.get(5));
        }
        return false;
    }

    /**
     * Escalates once {@value #MAX_RECOVERIES} recoveries have already been tried,
     * otherwise switches away from whatever the last actions kept doing.
     */
    public RecoveryStrategy selectRecovery(LoopState state) {
        if (state.getStuckDetections().size() >= MAX_RECOVERIES) {
            return RecoveryStrategy.ESCALATE_TO_HUMAN;
        }

        List<ActionType> recent = state.recentActionTypes(STRATEGY_WINDOW);
        if (recent.size() == STRATEGY_WINDOW && recent.stream().allMatch(t -> t == ActionType.READ_FILE)) {
            return RecoveryStrategy.SWITCH_TO_DIRECTORY_SCAN;
        }
        if (recent.size() == STRATEGY_WINDOW && recent.stream().allMatch(t -> t == ActionType.SCAN_DIRECTORY)) {
            return RecoveryStrategy.SWITCH_TO_FILE_SEARCH;
        }
        return RecoveryStrategy.TRY_LLM_REASONING;
    }

    /**
     * Records the chosen recovery in the loop state.
     *
     * @return false when the loop cannot recover and must abort
     */
    public boolean attemptRecovery(LoopState state, long nowMillis) {
        RecoveryStrategy strategy = selectRecovery(state);
        state.getStuckDetections().add(strategy);

        if (strategy == RecoveryStrategy.ESCALATE_TO_HUMAN) {
            log.error("Stuck loop persists after {} recoveries, escalating", MAX_RECOVERIES);
            return false;
        }

        log.info("Stuck loop detected, attempting recovery: {}", strategy.getValue());
        state.getCurrentContext().put("recovery_attempt", nowMillis);
        state.getCurrentContext().put("recovery_strategy", strategy.getValue());
        return true;
    }
}
