package com.deepansh.explorer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A unit of work requested by an agent's planning step.
 * Immutable once built; the executor never rewrites it.
 */
@Value
@Builder
public class AgentAction {

    ActionType type;

    /** Human-readable description. Also the identity used by stuck-loop detection. */
    String description;

    @Singular
    Map<String, Object> parameters;

    @Builder.Default
    String expectedOutcome = "";

    /** Optional explicit tool name, informational only; dispatch is by {@link #type}. */
    @Builder.Default
    String toolName = "";
}
