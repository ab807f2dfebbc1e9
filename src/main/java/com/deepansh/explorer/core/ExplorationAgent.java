package com.deepansh.explorer.core;

import com.deepansh.explorer.model.AgentAction;
import com.deepansh.explorer.model.Observation;

import java.util.Locale;
import java.util.Objects;

/**
 * A specialized explorer driven by {@link LoopController}.
 *
 * Agents supply reasoning, action planning and the final summary. The loop,
 * tool execution, caching, tracing and stuck-loop handling are not their concern.
 * {@link #reason} and {@link #planAction} must not mutate the state they are given.
 */
public interface ExplorationAgent {

    String getName();

    String reason(LoopState state);

    AgentAction planAction(LoopState state, String reasoning);

    /**
     * Records the observation's insight and remembers the last success or error.
     * Override to extract domain entities, calling this default first.
     */
    default void observe(LoopState state, Observation observation) {
        state.getObservations().add(observation.getInsight());

        if (observation.isSuccess()) {
            state.getCurrentContext().put("last_successful_action", observation.getActionTaken());
            state.getCurrentContext().put("last_insight", observation.getInsight());
            state.getCurrentContext().remove("last_error");
        } else {
            state.getCurrentContext().put("last_error", observation.getInsight());
        }
    }

    /**
     * Heuristic: any of the last three insights mentions "completed" or "achieved".
     * Agents with a real notion of done should override it.
     */
    default boolean isGoalAchieved(LoopState state) {
        return state.recentObservations(3).stream()
                .filter(Objects::nonNull)
                .map(o -> o.toLowerCase(Locale.ROOT))
                .anyMatch(o -> o.contains("completed") || o.contains("achieved"));
    }

    String generateSummary(LoopState state);
}
