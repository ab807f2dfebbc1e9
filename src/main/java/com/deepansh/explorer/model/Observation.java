package com.deepansh.explorer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Structured outcome of executing an {@link AgentAction}.
 * The raw {@link #result} is opaque to the loop controller.
 */
@Value
@Builder
public class Observation {

    String actionTaken;
    Object result;
    boolean success;
    String insight;

    @Builder.Default
    double confidence = 0.0;

    String suggestedNextAction;

    /** Estimated progress towards the goal, 0.0 to 1.0 */
    @Builder.Default
    double goalProgress = 0.0;

    public static Observation failure(AgentAction action, String insight) {
        return Observation.builder()
                .actionTaken(action.getDescription())
                .success(false)
                .insight(insight)
                .confidence(0.0)
                .build();
    }
}
