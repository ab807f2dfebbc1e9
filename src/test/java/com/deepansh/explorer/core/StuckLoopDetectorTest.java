package com.deepansh.explorer.core;

import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.model.AgentAction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StuckLoopDetectorTest {

    private final StuckLoopDetector detector = new StuckLoopDetector(3);

    @Test
    void fewerThanFiveActions_neverStuck() {
        assertThat(detector.isStuck(List.of("a", "a", "a", "a"))).isFalse();
    }

    @Test
    void fourIdenticalTrailingActions_isStuck() {
        assertThat(detector.isStuck(List.of("x", "a", "a", "a", "a"))).isTrue();
    }

    @Test
    void threeIdenticalTrailingActions_isNotStuck() {
        assertThat(detector.isStuck(List.of("x", "y", "a", "a", "a"))).isFalse();
    }

    @Test
    void periodTwoOscillation_isStuck() {
        assertThat(detector.isStuck(List.of("a", "b", "a", "b", "a", "b"))).isTrue();
    }

    @Test
    void brokenOscillation_isNotStuck() {
        assertThat(detector.isStuck(List.of("a", "b", "a", "c", "a", "b"))).isFalse();
    }

    @Test
    void repeatedReads_recoverWithDirectoryScan() {
        LoopState state = stateWith(ActionType.READ_FILE, ActionType.READ_FILE, ActionType.READ_FILE);

        assertThat(detector.selectRecovery(state)).isEqualTo(RecoveryStrategy.SWITCH_TO_DIRECTORY_SCAN);
    }

    @Test
    void repeatedScans_recoverWithFileSearch() {
        LoopState state = stateWith(ActionType.SCAN_DIRECTORY, ActionType.SCAN_DIRECTORY, ActionType.SCAN_DIRECTORY);

        assertThat(detector.selectRecovery(state)).isEqualTo(RecoveryStrategy.SWITCH_TO_FILE_SEARCH);
    }

    @Test
    void mixedActions_recoverWithLlmReasoning() {
        LoopState state = stateWith(ActionType.READ_FILE, ActionType.SEARCH_FILES, ActionType.READ_FILE);

        assertThat(detector.selectRecovery(state)).isEqualTo(RecoveryStrategy.TRY_LLM_REASONING);
    }

    @Test
    void attemptRecovery_writesContext_andEscalatesAfterThreeRecoveries() {
        LoopState state = stateWith(ActionType.READ_FILE, ActionType.READ_FILE, ActionType.READ_FILE);

        assertThat(detector.attemptRecovery(state, 1000L)).isTrue();
        assertThat(state.getCurrentContext())
                .containsEntry("recovery_attempt", 1000L)
                .containsEntry("recovery_strategy", "switch_to_directory_scan");

        assertThat(detector.attemptRecovery(state, 2000L)).isTrue();
        assertThat(detector.attemptRecovery(state, 3000L)).isTrue();
        assertThat(detector.attemptRecovery(state, 4000L)).isFalse();
        assertThat(state.getStuckDetections()).endsWith(RecoveryStrategy.ESCALATE_TO_HUMAN);
    }

    private static LoopState stateWith(ActionType... types) {
        LoopState state = new LoopState("goal", 10);
        for (ActionType type : types) {
            state.recordAction(AgentAction.builder().type(type).description(type.getValue()).build());
        }
        return state;
    }
}
