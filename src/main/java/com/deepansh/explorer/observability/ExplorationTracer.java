package com.deepansh.explorer.observability;

import com.deepansh.explorer.config.LoopConfig;
import com.deepansh.explorer.model.LoopResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records reason/act/observe phases per loop session and keeps run analytics.
 *
 * One instance per process, shared by every agent. Active sessions are keyed by
 * session id; a session is only written by the loop that owns it.
 * Completed sessions are kept in memory (most recent {@value #COMPLETED_SESSIONS_KEPT})
 * and, when a trace directory is configured, written to
 * {@code trace_{sessionId}_{agentName}.json}.
 *
 * Trace persistence must never crash a loop: write failures are logged and dropped.
 */
@Component
@Slf4j
public class ExplorationTracer {

    static final int COMPLETED_SESSIONS_KEPT = 100;
    private static final String FILE_PREFIX = "trace_";

    private final Path traceDirectory;
    private final ObjectMapper objectMapper;
    private final GlobalTraceMetrics globalMetrics = new GlobalTraceMetrics();
    private final Map<String, TraceSession> activeSessions = new ConcurrentHashMap<>();
    private final Map<String, TraceSession> completedSessions = Collections.synchronizedMap(
            new LinkedHashMap<String, TraceSession>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, TraceSession> eldest) {
                    return size() > COMPLETED_SESSIONS_KEPT;
                }
            });

    public ExplorationTracer(LoopConfig config, ObjectMapper objectMapper) {
        this.traceDirectory = config.getTraceDirectory();
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);

        if (traceDirectory != null) {
            try {
                Files.createDirectories(traceDirectory);
            } catch (IOException e) {
                log.warn("Could not create trace directory {}: {}", traceDirectory, e.getMessage());
            }
        }
    }

    public String startSession(String agentName, String goal) {
        String sessionId = UUID.randomUUID().toString().substring(0, 8);
        activeSessions.put(sessionId, new TraceSession(sessionId, agentName, goal, System.currentTimeMillis()));
        globalMetrics.sessionStarted(agentName);

        log.info("Started exploration session [session={}, agent={}, goal='{}']", sessionId, agentName, goal);
        return sessionId;
    }

    public Optional<String> tracePhase(String sessionId, TracePhase phase, int iteration,
                                       Map<String, Object> content, long durationMs) {
        return tracePhase(sessionId, phase, iteration, content, durationMs, true, null);
    }

    /**
     * @return the trace id, or empty if the session is unknown (already ended or never started)
     */
    public Optional<String> tracePhase(String sessionId, TracePhase phase, int iteration,
                                       Map<String, Object> content, long durationMs,
                                       boolean success, String error) {
        TraceSession session = activeSessions.get(sessionId);
        if (session == null) {
            log.warn("Session {} not found for tracing", sessionId);
            return Optional.empty();
        }

        String traceId = sessionId + "-" + iteration + "-" + phase.getValue();
        session.getTraces().add(TraceRecord.builder()
                .traceId(traceId)
                .sessionId(sessionId)
                .agentName(session.getAgentName())
                .iteration(iteration)
                .phase(phase)
                .timestamp(System.currentTimeMillis())
                .durationMs(durationMs)
                .content(content != null ? new LinkedHashMap<>(content) : new LinkedHashMap<>())
                .success(success)
                .error(error)
                .build());
        globalMetrics.phaseTraced(phase, durationMs, success);

        if (success) {
            log.info("{} [iter {}] {} ({}ms): {}", session.getAgentName(), iteration,
                    phase.name(), durationMs, preview(content));
        } else {
            log.warn("{} [iter {}] {} FAILED ({}ms): {}", session.getAgentName(), iteration,
                    phase.name(), durationMs, error);
        }
        return Optional.of(traceId);
    }

    /**
     * Finalizes the session: computes its metrics, updates the global accumulator
     * and writes the trace file when configured.
     */
    public Optional<TraceSession> endSession(String sessionId, LoopResult result) {
        TraceSession session = activeSessions.remove(sessionId);
        if (session == null) {
            log.warn("Session {} not found for ending", sessionId);
            return Optional.empty();
        }

        long now = System.currentTimeMillis();
        session.setEndTime(now);
        session.setFinalResult(summarize(result));
        session.setMetrics(SessionMetrics.of(session, now));
        session.setTotalIterations(session.getMetrics().getIterations());

        globalMetrics.sessionEnded(session.getTotalIterations(), now - session.getStartTime());
        completedSessions.put(sessionId, session);

        log.info("Completed exploration session [session={}, agent={}, iterations={}, duration={}ms]",
                sessionId, session.getAgentName(), session.getTotalIterations(), now - session.getStartTime());

        if (traceDirectory != null) {
            persist(session);
        }
        return Optional.of(session);
    }

    /**
     * Metrics of an active session computed on the fly, or the final metrics of a completed one.
     */
    public Optional<SessionMetrics> getSessionMetrics(String sessionId) {
        TraceSession active = activeSessions.get(sessionId);
        if (active != null) {
            return Optional.of(SessionMetrics.of(active, System.currentTimeMillis()));
        }
        return Optional.ofNullable(completedSessions.get(sessionId)).map(TraceSession::getMetrics);
    }

    public Map<String, Object> getGlobalMetrics() {
        return globalMetrics.snapshot();
    }

    public boolean isIdle() {
        return globalMetrics.isIdle();
    }

    /**
     * Looks a session up in memory first, then among persisted trace files.
     */
    public Optional<TraceSession> findSession(String sessionId) {
        TraceSession session = activeSessions.get(sessionId);
        if (session == null) {
            session = completedSessions.get(sessionId);
        }
        return session != null ? Optional.of(session) : loadPersistedSession(sessionId);
    }

    /**
     * Human-readable, one line per trace record.
     */
    public String getTraceSummary(String sessionId) {
        Optional<TraceSession> found = findSession(sessionId);
        if (found.isEmpty()) {
            return "Session " + sessionId + " not found";
        }

        TraceSession session = found.get();
        StringBuilder sb = new StringBuilder();
        sb.append("Trace summary for ").append(session.getAgentName())
                .append(" (session: ").append(sessionId).append(")\n");
        sb.append("Goal: ").append(session.getGoal()).append('\n');
        sb.append("Iterations: ").append(session.getTotalIterations()).append('\n');
        sb.append("=".repeat(50)).append('\n');

        List<TraceRecord> traces;
        synchronized (session.getTraces()) {
            traces = new ArrayList<>(session.getTraces());
        }
        for (TraceRecord trace : traces) {
            sb.append(trace.isSuccess() ? "[ok]   " : "[fail] ")
                    .append("iter ").append(trace.getIteration())
                    .append(" - ").append(trace.getPhase().name())
                    .append(": ").append(preview(trace.getContent())).append('\n');
            if (trace.getError() != null) {
                sb.append("       error: ").append(trace.getError()).append('\n');
            }
            if (trace.getDurationMs() > 0) {
                sb.append("       duration: ").append(trace.getDurationMs()).append("ms\n");
            }
        }
        return sb.toString();
    }

    public void exportMetrics(Path outputFile) throws IOException {
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(outputFile.toFile(), getGlobalMetrics());
        log.info("Exported trace metrics to {}", outputFile);
    }

    public Optional<TraceSession> loadPersistedSession(String sessionId) {
        if (traceDirectory == null || !Files.isDirectory(traceDirectory)) {
            return Optional.empty();
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(traceDirectory,
                FILE_PREFIX + sessionId + "_*.json")) {
            Iterator<Path> matches = files.iterator();
            if (matches.hasNext()) {
                return Optional.of(objectMapper.readValue(matches.next().toFile(), TraceSession.class));
            }
        } catch (IOException e) {
            log.warn("Failed to load trace for session {}: {}", sessionId, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Session ids of all trace files in the trace directory, sorted.
     */
    public List<String> listPersistedSessions() {
        List<String> sessionIds = new ArrayList<>();
        if (traceDirectory == null || !Files.isDirectory(traceDirectory)) {
            return sessionIds;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(traceDirectory, FILE_PREFIX + "*.json")) {
            for (Path file : files) {
                String name = file.getFileName().toString().substring(FILE_PREFIX.length());
                int separator = name.indexOf('_');
                if (separator > 0) {
                    sessionIds.add(name.substring(0, separator));
                }
            }
        } catch (IOException e) {
            log.warn("Failed to list trace directory {}: {}", traceDirectory, e.getMessage());
        }
        Collections.sort(sessionIds);
        return sessionIds;
    }

    private void persist(TraceSession session) {
        Path file = traceDirectory.resolve(FILE_PREFIX + session.getSessionId() + "_"
                + session.getAgentName() + ".json");
        try {
            Files.createDirectories(traceDirectory);
            objectMapper.writeValue(file.toFile(), session);
            log.debug("Saved trace to {}", file);
        } catch (IOException e) {
            log.error("Failed to save trace for session={}", session.getSessionId(), e);
        }
    }

    private static Map<String, Object> summarize(LoopResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        if (result == null) {
            return summary;
        }
        summary.put("goal", result.getGoal());
        summary.put("iterations", result.getIterations());
        summary.put("goal_achieved", result.isGoalAchieved());
        summary.put("termination_reason",
                result.getTerminationReason() != null ? result.getTerminationReason().name() : null);
        summary.put("actions_taken", result.getActionsTaken().size());
        summary.put("cache_hits", result.getCacheHits());
        summary.put("error_count", result.getErrorCount());
        summary.put("elapsed_ms", result.getElapsedMs());
        summary.put("summary", result.getSummary());
        summary.put("error", result.getError());
        return summary;
    }

    private static String preview(Map<String, Object> content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        Object summary = content.get("summary");
        String text = summary != null ? summary.toString() : content.toString();
        return text.length() <= 100 ? text : text.substring(0, 100) + "...";
    }
}
