package com.deepansh.explorer.observability;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalTraceMetricsTest {

    @Test
    void overlappingSessions_averageOverEndedSessionsOnly() {
        GlobalTraceMetrics metrics = new GlobalTraceMetrics();
        metrics.sessionStarted("DocumentationAgent");
        metrics.sessionStarted("CodebaseAgent");

        metrics.sessionEnded(3, 100);
        assertThat(metrics.snapshot()).containsEntry("avg_session_duration_ms", 100.0);

        metrics.sessionEnded(5, 100);
        Map<String, Object> snapshot = metrics.snapshot();
        assertThat(snapshot)
                .containsEntry("avg_session_duration_ms", 100.0)
                .containsEntry("total_sessions", 2)
                .containsEntry("completed_sessions", 2)
                .containsEntry("active_sessions", 0)
                .containsEntry("total_iterations", 8L);
        assertThat(metrics.isIdle()).isTrue();
    }

    @Test
    void sessionStillRunning_doesNotDiluteAverage() {
        GlobalTraceMetrics metrics = new GlobalTraceMetrics();
        metrics.sessionStarted("DocumentationAgent");
        metrics.sessionStarted("DocumentationAgent");
        metrics.sessionStarted("CodebaseAgent");

        metrics.sessionEnded(2, 200);
        metrics.sessionEnded(2, 400);

        assertThat(metrics.snapshot())
                .containsEntry("avg_session_duration_ms", 300.0)
                .containsEntry("active_sessions", 1)
                .containsEntry("agent_usage", Map.of("CodebaseAgent", 1, "DocumentationAgent", 2));
        assertThat(metrics.isIdle()).isFalse();
    }
}
