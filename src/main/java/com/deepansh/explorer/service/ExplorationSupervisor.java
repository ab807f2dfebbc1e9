package com.deepansh.explorer.service;

import com.deepansh.explorer.agent.AgentType;
import com.deepansh.explorer.agent.RepositoryAgent;
import com.deepansh.explorer.cache.ResultCache;
import com.deepansh.explorer.config.LoopConfig;
import com.deepansh.explorer.core.LoopController;
import com.deepansh.explorer.exception.ExplorationException;
import com.deepansh.explorer.llm.LlmClient;
import com.deepansh.explorer.model.ExplorationRequest;
import com.deepansh.explorer.model.ExplorationResponse;
import com.deepansh.explorer.model.LoopResult;
import com.deepansh.explorer.model.TerminationReason;
import com.deepansh.explorer.observability.ExplorationTracer;
import com.deepansh.explorer.repo.CodeRepository;
import com.deepansh.explorer.repo.LocalCodeRepository;
import com.deepansh.explorer.tool.ToolExecutor;
import com.deepansh.explorer.tool.impl.BuiltInTools;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Wires one loop per requested agent and runs them concurrently.
 *
 * Every agent gets its own {@link ResultCache} and its own {@link ToolExecutor};
 * the tool worker pool, the LLM client and the tracer are shared. Persistent caches
 * live under {@code cacheDirectory/<agent>/<md5 of repository root>} so results
 * never leak between repositories.
 *
 * When allowed roots are configured, only directories under one of them can be explored.
 */
@Service
@Slf4j
public class ExplorationSupervisor {

    private final LoopConfig config;
    private final ExplorationTracer tracer;
    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;
    private final TaskExecutor explorationExecutor;
    private final ExecutorService toolWorkers;

    public ExplorationSupervisor(LoopConfig config,
                                 ExplorationTracer tracer,
                                 LlmClient llmClient,
                                 ObjectMapper objectMapper,
                                 @Qualifier("explorationTaskExecutor") TaskExecutor explorationExecutor,
                                 @Qualifier("toolExecutorService") ExecutorService toolWorkers) {
        this.config = config;
        this.tracer = tracer;
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
        this.explorationExecutor = explorationExecutor;
        this.toolWorkers = toolWorkers;
    }

    public ExplorationResponse explore(ExplorationRequest request) {
        long start = System.currentTimeMillis();
        CodeRepository repository = openRepository(request.getRepositoryPath(), config.getAllowedRoots());
        List<AgentType> agentTypes = request.getAgents() == null || request.getAgents().isEmpty()
                ? List.of(AgentType.DOCUMENTATION)
                : request.getAgents().stream().distinct().toList();

        log.info("Exploration started [repo={}, agents={}, goal='{}']",
                repository.getName(), agentTypes, request.getGoal());

        List<CompletableFuture<LoopResult>> runs = new ArrayList<>();
        for (AgentType type : agentTypes) {
            runs.add(CompletableFuture.supplyAsync(
                    () -> runAgent(type.newAgent(), repository, request.getGoal(), request.getMaxIterations()),
                    explorationExecutor));
        }

        List<LoopResult> results = runs.stream()
                .map(CompletableFuture::join)
                .toList();

        long elapsed = System.currentTimeMillis() - start;
        log.info("Exploration finished [repo={}, agents={}, elapsed={}ms]", repository.getName(), results.size(), elapsed);

        return ExplorationResponse.builder()
                .repositoryPath(repository.getName())
                .goal(request.getGoal())
                .results(new ArrayList<>(results))
                .goalAchieved(results.stream().anyMatch(LoopResult::isGoalAchieved))
                .elapsedMs(elapsed)
                .build();
    }

    /**
     * Runs one agent to completion. Never throws; wiring failures come back as an
     * INTERNAL_ERROR result so sibling agents are unaffected.
     */
    LoopResult runAgent(RepositoryAgent agent, CodeRepository repository, String goal, Integer maxIterations) {
        try {
            ResultCache cache = cacheFor(agent.getName(), repository);
            ToolExecutor executor = new ToolExecutor(
                    BuiltInTools.registry(repository, cache, llmClient, agent.getName()), cache, config, toolWorkers);
            LoopController controller = new LoopController(
                    agent, executor, config.isTracingEnabled() ? tracer : null, config);
            return controller.executeLoop(goal, maxIterations);
        } catch (RuntimeException e) {
            log.error("Agent {} could not be started: {}", agent.getName(), e.getMessage(), e);
            return LoopResult.builder()
                    .agentName(agent.getName())
                    .goal(goal)
                    .terminationReason(TerminationReason.INTERNAL_ERROR)
                    .summary("Stopped: " + TerminationReason.INTERNAL_ERROR.getDescription())
                    .error(e.getMessage())
                    .build();
        }
    }

    private ResultCache cacheFor(String agentName, CodeRepository repository) {
        if (config.getCacheDirectory() == null) {
            return new ResultCache(config.getCacheMaxSize(), config.getCacheTtl());
        }
        String repositoryKey = DigestUtils.md5DigestAsHex(repository.getName().getBytes(StandardCharsets.UTF_8));
        return new ResultCache(config.getCacheMaxSize(), config.getCacheTtl(),
                config.getCacheDirectory().resolve(agentName).resolve(repositoryKey), objectMapper);
    }

    static CodeRepository openRepository(String repositoryPath, List<Path> allowedRoots) {
        Path root = Path.of(repositoryPath);
        if (!Files.isDirectory(root)) {
            throw new ExplorationException("Repository path is not a directory: " + repositoryPath);
        }
        Path resolved = canonical(root);
        if (!allowedRoots.isEmpty() && allowedRoots.stream().map(ExplorationSupervisor::canonical)
                .noneMatch(resolved::startsWith)) {
            log.warn("Rejected repository outside allowed roots [path={}, allowedRoots={}]", resolved, allowedRoots);
            throw new ExplorationException("Repository path is outside the allowed roots: " + repositoryPath);
        }
        return new LocalCodeRepository(resolved);
    }

    private static Path canonical(Path path) {
        try {
            return Files.exists(path) ? path.toRealPath() : path.toAbsolutePath().normalize();
        } catch (IOException e) {
            throw new ExplorationException("Cannot resolve path " + path + ": " + e.getMessage(), e);
        }
    }
}
