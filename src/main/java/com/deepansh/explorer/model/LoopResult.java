package com.deepansh.explorer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final outcome of one {@code executeLoop} call.
 * Always produced, even when the loop aborts; {@link #error} is only set
 * when the loop stopped because of failures it could not absorb.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoopResult {

    private String sessionId;
    private String agentName;
    private String goal;
    private int iterations;
    private long elapsedMs;

    @Builder.Default
    private List<String> observations = new ArrayList<>();

    @Builder.Default
    private List<String> actionsTaken = new ArrayList<>();

    @Builder.Default
    private List<String> reasoningHistory = new ArrayList<>();

    private int cacheHits;
    private int errorCount;

    @Builder.Default
    private Map<String, Object> finalContext = new LinkedHashMap<>();

    private boolean goalAchieved;
    private TerminationReason terminationReason;
    private String summary;
    private String error;
}
