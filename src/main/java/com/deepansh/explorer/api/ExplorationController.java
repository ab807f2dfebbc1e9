package com.deepansh.explorer.api;

import com.deepansh.explorer.model.ExplorationRequest;
import com.deepansh.explorer.model.ExplorationResponse;
import com.deepansh.explorer.service.ExplorationSupervisor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Exploration endpoint.
 *
 * POST /api/v1/explorations
 *   Runs the requested agents over a local repository and waits for all of them.
 *
 * GET /api/v1/explorations/health
 */
@RestController
@RequestMapping("/api/v1/explorations")
@RequiredArgsConstructor
@Slf4j
public class ExplorationController {

    private final ExplorationSupervisor supervisor;

    @PostMapping
    public ResponseEntity<ExplorationResponse> explore(@Valid @RequestBody ExplorationRequest request) {
        log.info("Exploration request [repo={}, agents={}, maxIterations={}]",
                request.getRepositoryPath(), request.getAgents(), request.getMaxIterations());
        return ResponseEntity.ok(supervisor.explore(request));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
