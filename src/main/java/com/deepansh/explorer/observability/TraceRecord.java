package com.deepansh.explorer.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One traced phase of one loop iteration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraceRecord {

    /** {sessionId}-{iteration}-{phase} */
    private String traceId;
    private String sessionId;
    private String agentName;
    private int iteration;
    private TracePhase phase;

    /** Epoch millis */
    private long timestamp;
    private long durationMs;

    @Builder.Default
    private Map<String, Object> content = new LinkedHashMap<>();

    @Builder.Default
    private boolean success = true;

    private String error;
}
