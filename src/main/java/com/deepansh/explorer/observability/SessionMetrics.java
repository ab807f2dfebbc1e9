package com.deepansh.explorer.observability;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregates computed over a session's trace records.
 * Phase stats are keyed by the phase's wire value ("reason", "act", "observe", "error").
 */
@Data
@NoArgsConstructor
public class SessionMetrics {

    private long totalDurationMs;
    /** Sum of traced phase durations, excluding loop overhead */
    private long processingDurationMs;
    private int totalTraces;
    private int iterations;
    private int errors;
    private double successRate;
    private Map<String, PhaseStats> phases = new LinkedHashMap<>();

    static SessionMetrics of(TraceSession session, long now) {
        List<TraceRecord> traces = new ArrayList<>(session.getTraces());
        SessionMetrics metrics = new SessionMetrics();

        long end = session.getEndTime() != null ? session.getEndTime() : now;
        metrics.setTotalDurationMs(end - session.getStartTime());
        metrics.setTotalTraces(traces.size());
        metrics.setIterations((int) traces.stream().mapToInt(TraceRecord::getIteration).distinct().count());
        metrics.setProcessingDurationMs(traces.stream().mapToLong(TraceRecord::getDurationMs).sum());

        long failed = traces.stream().filter(t -> !t.isSuccess()).count();
        metrics.setErrors((int) failed);
        metrics.setSuccessRate(traces.isEmpty() ? 0.0 : (double) (traces.size() - failed) / traces.size());

        Map<TracePhase, List<TraceRecord>> byPhase = traces.stream()
                .collect(Collectors.groupingBy(TraceRecord::getPhase));
        for (TracePhase phase : TracePhase.values()) {
            metrics.getPhases().put(phase.getValue(), PhaseStats.of(byPhase.getOrDefault(phase, List.of())));
        }
        return metrics;
    }
}
