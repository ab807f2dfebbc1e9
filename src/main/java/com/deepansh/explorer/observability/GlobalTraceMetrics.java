package com.deepansh.explorer.observability;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Process-wide accumulator shared by every agent's loop.
 *
 * Starts with no session active and lives as long as the tracer. All access is
 * synchronized on this instance since concurrent agents report into it.
 */
public class GlobalTraceMetrics {

    private int totalSessions;
    private int activeSessions;
    private int completedSessions;
    private long totalIterations;
    private long totalErrors;
    private double avgSessionDurationMs;
    private final Map<String, Integer> agentUsage = new TreeMap<>();
    private final Map<TracePhase, List<Long>> phaseDurations = new EnumMap<>(TracePhase.class);

    public synchronized void sessionStarted(String agentName) {
        totalSessions++;
        activeSessions++;
        agentUsage.merge(agentName, 1, Integer::sum);
    }

    public synchronized void phaseTraced(TracePhase phase, long durationMs, boolean success) {
        if (phase != TracePhase.ERROR) {
            phaseDurations.computeIfAbsent(phase, p -> new ArrayList<>()).add(durationMs);
        }
        if (!success) {
            totalErrors++;
        }
    }

    public synchronized void sessionEnded(int iterations, long durationMs) {
        activeSessions = Math.max(0, activeSessions - 1);
        completedSessions++;
        totalIterations += iterations;
        // running mean over ended sessions; overlapping ones are still active
        avgSessionDurationMs = (avgSessionDurationMs * (completedSessions - 1) + durationMs) / completedSessions;
    }

    public synchronized boolean isIdle() {
        return activeSessions == 0;
    }

    public synchronized Map<String, Object> snapshot() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_sessions", totalSessions);
        metrics.put("active_sessions", activeSessions);
        metrics.put("completed_sessions", completedSessions);
        metrics.put("total_iterations", totalIterations);
        metrics.put("total_errors", totalErrors);
        metrics.put("avg_session_duration_ms", avgSessionDurationMs);
        metrics.put("agent_usage", new TreeMap<>(agentUsage));

        for (TracePhase phase : List.of(TracePhase.REASON, TracePhase.ACT, TracePhase.OBSERVE)) {
            List<Long> durations = phaseDurations.getOrDefault(phase, List.of());
            String name = phase.getValue();
            metrics.put("avg_" + name + "_duration_ms",
                    durations.stream().mapToLong(Long::longValue).average().orElse(0.0));
            metrics.put("max_" + name + "_duration_ms",
                    durations.stream().mapToLong(Long::longValue).max().orElse(0L));
            metrics.put("min_" + name + "_duration_ms",
                    durations.stream().mapToLong(Long::longValue).min().orElse(0L));
            metrics.put(name + "_count", durations.size());
        }
        return metrics;
    }
}
