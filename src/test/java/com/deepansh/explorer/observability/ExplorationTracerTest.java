package com.deepansh.explorer.observability;

import com.deepansh.explorer.config.LoopConfig;
import com.deepansh.explorer.model.LoopResult;
import com.deepansh.explorer.model.TerminationReason;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ExplorationTracerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void newTracer_isIdle() {
        ExplorationTracer tracer = new ExplorationTracer(LoopConfig.defaults(), objectMapper);

        assertThat(tracer.isIdle()).isTrue();
        assertThat(tracer.getGlobalMetrics()).containsEntry("total_sessions", 0).containsEntry("active_sessions", 0);
    }

    @Test
    void tracePhase_unknownSession_returnsEmpty() {
        ExplorationTracer tracer = new ExplorationTracer(LoopConfig.defaults(), objectMapper);

        assertThat(tracer.tracePhase("missing", TracePhase.REASON, 1, Map.of(), 5)).isEmpty();
    }

    @Test
    void session_lifecycle_computesMetrics() {
        ExplorationTracer tracer = new ExplorationTracer(LoopConfig.defaults(), objectMapper);
        String sessionId = tracer.startSession("DocumentationAgent", "find docs");
        assertThat(tracer.isIdle()).isFalse();

        Optional<String> traceId = tracer.tracePhase(sessionId, TracePhase.REASON, 1, Map.of("reasoning", "scan"), 10);
        tracer.tracePhase(sessionId, TracePhase.ACT, 1, Map.of("action", "scan"), 30);
        tracer.tracePhase(sessionId, TracePhase.OBSERVE, 1, Map.of("insight", "ok"), 2);
        tracer.tracePhase(sessionId, TracePhase.ACT, 2, Map.of("action", "read"), 20, false, "boom");

        assertThat(traceId).contains(sessionId + "-1-reason");
        assertThat(tracer.getSessionMetrics(sessionId)).hasValueSatisfying(m -> assertThat(m.getTotalTraces()).isEqualTo(4));

        TraceSession session = tracer.endSession(sessionId, result()).orElseThrow();

        SessionMetrics metrics = session.getMetrics();
        assertThat(metrics.getIterations()).isEqualTo(2);
        assertThat(metrics.getErrors()).isEqualTo(1);
        assertThat(metrics.getSuccessRate()).isEqualTo(0.75);
        assertThat(metrics.getProcessingDurationMs()).isEqualTo(62);
        assertThat(metrics.getPhases().get("act").getCount()).isEqualTo(2);
        assertThat(metrics.getPhases().get("act").getMaxMs()).isEqualTo(30);
        assertThat(session.getFinalResult()).containsEntry("goal_achieved", true);

        Map<String, Object> global = tracer.getGlobalMetrics();
        assertThat(global).containsEntry("total_sessions", 1)
                .containsEntry("active_sessions", 0)
                .containsEntry("total_iterations", 2L)
                .containsEntry("total_errors", 1L)
                .containsEntry("act_count", 2)
                .containsEntry("max_act_duration_ms", 30L);
        assertThat(global.get("agent_usage")).isEqualTo(Map.of("DocumentationAgent", 1));
        assertThat(tracer.isIdle()).isTrue();
    }

    @Test
    void endSession_twice_secondIsEmpty() {
        ExplorationTracer tracer = new ExplorationTracer(LoopConfig.defaults(), objectMapper);
        String sessionId = tracer.startSession("A", "g");

        assertThat(tracer.endSession(sessionId, result())).isPresent();
        assertThat(tracer.endSession(sessionId, result())).isEmpty();
    }

    @Test
    void endSession_persistsTraceFile_thatCanBeReloaded() {
        LoopConfig config = LoopConfig.builder().traceDirectory(tempDir).build();
        ExplorationTracer tracer = new ExplorationTracer(config, objectMapper);
        String sessionId = tracer.startSession("CodebaseAgent", "map code");
        tracer.tracePhase(sessionId, TracePhase.REASON, 1, Map.of("reasoning", "scan"), 4);
        tracer.endSession(sessionId, result());

        assertThat(Files.exists(tempDir.resolve("trace_" + sessionId + "_CodebaseAgent.json"))).isTrue();

        ExplorationTracer restarted = new ExplorationTracer(config, objectMapper);
        assertThat(restarted.listPersistedSessions()).containsExactly(sessionId);

        TraceSession loaded = restarted.findSession(sessionId).orElseThrow();
        assertThat(loaded.getAgentName()).isEqualTo("CodebaseAgent");
        assertThat(loaded.getTraces()).hasSize(1);
        assertThat(loaded.getTraces().get(0).getPhase()).isEqualTo(TracePhase.REASON);
        assertThat(restarted.getTraceSummary(sessionId)).contains("CodebaseAgent").contains("REASON");
    }

    @Test
    void exportMetrics_writesJson() throws Exception {
        ExplorationTracer tracer = new ExplorationTracer(LoopConfig.defaults(), objectMapper);
        Path out = tempDir.resolve("metrics/global.json");

        tracer.exportMetrics(out);

        assertThat(objectMapper.readValue(out.toFile(), Map.class)).containsKey("total_sessions");
    }

    @Test
    void traceSummary_unknownSession() {
        ExplorationTracer tracer = new ExplorationTracer(LoopConfig.defaults(), objectMapper);

        assertThat(tracer.getTraceSummary("nope")).isEqualTo("Session nope not found");
    }

    private static LoopResult result() {
        return LoopResult.builder()
                .goal("g")
                .iterations(2)
                .goalAchieved(true)
                .terminationReason(TerminationReason.GOAL_ACHIEVED)
                .summary("done")
                .build();
    }
}
