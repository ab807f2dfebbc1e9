package com.deepansh.explorer.observability;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A complete traced loop run: metadata plus its ordered trace records.
 * Also the shape of the persisted trace file.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TraceSession {

    private String sessionId;
    private String agentName;
    private String goal;

    /** Epoch millis */
    private long startTime;
    /** Null while the session is active */
    private Long endTime;

    private int totalIterations;
    private List<TraceRecord> traces = Collections.synchronizedList(new ArrayList<>());
    private Map<String, Object> finalResult = new LinkedHashMap<>();
    private SessionMetrics metrics;

    TraceSession(String sessionId, String agentName, String goal, long startTime) {
        this.sessionId = sessionId;
        this.agentName = agentName;
        this.goal = goal;
        this.startTime = startTime;
    }
}
