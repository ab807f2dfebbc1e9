package com.deepansh.explorer.core;

import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.model.AgentAction;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds all mutable state for a single exploration loop.
 * Created by {@link LoopController#executeLoop}, discarded when the loop ends
 * (a snapshot survives in the {@code LoopResult}).
 *
 * Agents read it freely; only the controller, the tool executor and the default
 * {@link ExplorationAgent#observe} write to it.
 */
@Data
public class LoopState {

    private final String goal;
    private final int maxIterations;

    private int iteration;
    private LoopPhase phase = LoopPhase.INIT;

    private final List<String> observations = new ArrayList<>();
    private final List<String> actionsTaken = new ArrayList<>();
    private final List<ActionType> actionTypesTaken = new ArrayList<>();
    private final List<String> reasoningHistory = new ArrayList<>();

    /** Last raw result per action kind */
    private final Map<ActionType, Object> toolResults = new EnumMap<>(ActionType.class);
    private final Map<String, Object> currentContext = new LinkedHashMap<>();

    /** Recovery strategies chosen each time a stuck loop was detected */
    private final List<RecoveryStrategy> stuckDetections = new ArrayList<>();

    private int cacheHits;
    private int errorCount;
    private int consecutiveErrors;

    public LoopState(String goal, int maxIterations) {
        this.goal = goal;
        this.maxIterations = maxIterations;
    }

    public void recordAction(AgentAction action) {
        actionsTaken.add(action.getDescription());
        actionTypesTaken.add(action.getType());
    }

    public void incrementCacheHits() {
        cacheHits++;
    }

    public void incrementErrorCount() {
        errorCount++;
    }

    public List<ActionType> recentActionTypes(int count) {
        int from = Math.max(0, actionTypesTaken.size() - count);
        return actionTypesTaken.subList(from, actionTypesTaken.size());
    }

    public List<String> recentObservations(int count) {
        int from = Math.max(0, observations.size() - count);
        return observations.subList(from, observations.size());
    }
}
