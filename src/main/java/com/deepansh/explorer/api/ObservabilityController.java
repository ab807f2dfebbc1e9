package com.deepansh.explorer.api;

import com.deepansh.explorer.observability.ExplorationTracer;
import com.deepansh.explorer.observability.TraceSession;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for exploration traces and analytics.
 *
 * GET /api/v1/traces                       - ids of persisted trace sessions
 * GET /api/v1/traces/metrics               - global metrics across all sessions
 * GET /api/v1/traces/{sessionId}           - full trace session
 * GET /api/v1/traces/{sessionId}/summary   - human-readable trace summary
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
@Validated
public class ObservabilityController {

    private static final String SESSION_ID = "[a-zA-Z0-9-]+";

    private final ExplorationTracer tracer;

    @GetMapping
    public ResponseEntity<List<String>> listSessions() {
        return ResponseEntity.ok(tracer.listPersistedSessions());
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> getGlobalMetrics() {
        return ResponseEntity.ok(tracer.getGlobalMetrics());
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<TraceSession> getSession(@PathVariable @Pattern(regexp = SESSION_ID) String sessionId) {
        return tracer.findSession(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/{sessionId}/summary", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> getSummary(@PathVariable @Pattern(regexp = SESSION_ID) String sessionId) {
        if (tracer.findSession(sessionId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(tracer.getTraceSummary(sessionId));
    }
}
