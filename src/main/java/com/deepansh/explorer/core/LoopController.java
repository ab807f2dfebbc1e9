package com.deepansh.explorer.core;

import com.deepansh.explorer.config.LoopConfig;
import com.deepansh.explorer.exception.BudgetExceededException;
import com.deepansh.explorer.exception.CircuitBreakerException;
import com.deepansh.explorer.exception.LoopTerminationException;
import com.deepansh.explorer.exception.StuckLoopException;
import com.deepansh.explorer.model.AgentAction;
import com.deepansh.explorer.model.LoopResult;
import com.deepansh.explorer.model.Observation;
import com.deepansh.explorer.model.TerminationReason;
import com.deepansh.explorer.observability.ExplorationTracer;
import com.deepansh.explorer.observability.TracePhase;
import com.deepansh.explorer.tool.ToolExecutor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Core Reason → Act → Observe loop.
 *
 * Per-iteration flow:
 * 1. Stop if the goal is achieved, the iteration budget is spent or the total timeout passed
 * 2. REASONING: agent.reason, traced as "reason"
 * 3. ACTING: agent.planAction, then the tool executor, traced as "act"
 * 4. OBSERVING: agent.observe, traced as "observe"
 * 5. Consecutive-error bookkeeping and circuit breaker
 * 6. Stuck-loop detection and recovery
 *
 * The iteration timeout is checked after reasoning and after acting; an overrun
 * abandons the rest of that iteration. An action that already ran still counts
 * toward the circuit breaker and stuck detection. Exceptions from the agent are counted and
 * traced as "error"; the loop only gives up once the error budget is spent.
 *
 * {@link #executeLoop} never throws: every run ends in a {@link LoopResult}
 * whose summary states why the loop stopped.
 *
 * Single-threaded. One controller drives one agent; do not share it between threads.
 */
@Slf4j
public class LoopController {

    private final ExplorationAgent agent;
    private final ToolExecutor toolExecutor;
    private final ExplorationTracer tracer;
    private final LoopConfig config;
    private final StuckLoopDetector stuckDetector;
    private final Clock clock;

    /**
     * @param tracer may be null to run without tracing
     */
    public LoopController(ExplorationAgent agent, ToolExecutor toolExecutor,
                          ExplorationTracer tracer, LoopConfig config) {
        this(agent, toolExecutor, tracer, config,
                new StuckLoopDetector(config.getMaxSameActionRepeats()), Clock.systemUTC());
    }

    public LoopController(ExplorationAgent agent, ToolExecutor toolExecutor, ExplorationTracer tracer,
                          LoopConfig config, StuckLoopDetector stuckDetector, Clock clock) {
        this.agent = agent;
        this.toolExecutor = toolExecutor;
        this.tracer = tracer;
        this.config = config;
        this.stuckDetector = stuckDetector;
        this.clock = clock;
    }

    public LoopResult executeLoop(String goal) {
        return executeLoop(goal, null);
    }

    /**
     * @param maxIterations overrides the configured budget when non-null and positive
     */
    public LoopResult executeLoop(String goal, Integer maxIterations) {
        int budget = maxIterations != null && maxIterations > 0 ? maxIterations : config.getMaxIterations();
        LoopState state = new LoopState(goal, budget);
        String sessionId = tracer != null ? tracer.startSession(agent.getName(), goal) : null;
        long start = clock.millis();

        log.info("Exploration started [agent={}, session={}, maxIterations={}, goal='{}']",
                agent.getName(), sessionId, budget, goal);

        TerminationReason reason;
        String error = null;
        try {
            reason = runLoop(state, sessionId, start);
        } catch (LoopTerminationException e) {
            reason = e.getReason();
            if (reason == TerminationReason.ERROR_BUDGET_EXHAUSTED) {
                error = e.getMessage();
            }
            log.warn("Exploration stopped [agent={}, session={}, reason={}]: {}",
                    agent.getName(), sessionId, reason, e.getMessage());
        } catch (RuntimeException e) {
            reason = TerminationReason.INTERNAL_ERROR;
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Exploration failed [agent={}, session={}]", agent.getName(), sessionId, e);
        }

        state.setPhase(reason.isAbort() ? LoopPhase.ABORTED : LoopPhase.DONE);
        LoopResult result = buildResult(state, sessionId, reason, error, clock.millis() - start);

        if (tracer != null) {
            tracer.endSession(sessionId, result);
        }

        log.info("Exploration complete [agent={}, session={}, iterations={}, reason={}, goalAchieved={}, elapsed={}ms]",
                agent.getName(), sessionId, result.getIterations(), reason, result.isGoalAchieved(),
                result.getElapsedMs());
        return result;
    }

    private TerminationReason runLoop(LoopState state, String sessionId, long start) {
        while (true) {
            if (agent.isGoalAchieved(state)) {
                return TerminationReason.GOAL_ACHIEVED;
            }
            if (state.getIteration() >= state.getMaxIterations()) {
                throw new BudgetExceededException(TerminationReason.MAX_ITERATIONS,
                        "Reached max iterations (" + state.getMaxIterations() + ")");
            }
            if (clock.millis() - start > config.getTotalTimeout().toMillis()) {
                throw new BudgetExceededException(TerminationReason.TOTAL_TIMEOUT,
                        "Total timeout (" + config.getTotalTimeout() + ") reached");
            }

            state.setIteration(state.getIteration() + 1);
            log.info("Iteration {}/{} [agent={}, session={}]", state.getIteration(), state.getMaxIterations(),
                    agent.getName(), sessionId);

            try {
                runIteration(state, sessionId);
            } catch (LoopTerminationException e) {
                throw e;
            } catch (RuntimeException e) {
                handleIterationFailure(state, sessionId, e);
            }
        }
    }

    private void runIteration(LoopState state, String sessionId) {
        int iteration = state.getIteration();
        long deadline = clock.millis() + config.getIterationTimeout().toMillis();

        // REASON
        state.setPhase(LoopPhase.REASONING);
        long phaseStart = clock.millis();
        String reasoning = agent.reason(state);
        state.getReasoningHistory().add(reasoning);
        trace(sessionId, TracePhase.REASON, iteration, content("reasoning", reasoning),
                clock.millis() - phaseStart, true, null);

        if (clock.millis() > deadline) {
            abandonIteration(sessionId, iteration, "reasoning");
            return;
        }

        // ACT
        state.setPhase(LoopPhase.ACTING);
        phaseStart = clock.millis();
        AgentAction action = agent.planAction(state, reasoning);
        Observation observation = toolExecutor.act(action, state);

        Map<String, Object> actContent = content("action", action.getDescription());
        actContent.put("type", action.getType() != null ? action.getType().getValue() : null);
        actContent.put("success", observation.isSuccess());
        trace(sessionId, TracePhase.ACT, iteration, actContent, clock.millis() - phaseStart,
                observation.isSuccess(), observation.isSuccess() ? null : observation.getInsight());

        if (clock.millis() > deadline) {
            abandonIteration(sessionId, iteration, "acting");
            // the action already ran: its outcome still counts
            recordOutcome(state, sessionId, observation);
            return;
        }

        // OBSERVE
        state.setPhase(LoopPhase.OBSERVING);
        phaseStart = clock.millis();
        agent.observe(state, observation);
        Map<String, Object> observeContent = content("insight", observation.getInsight());
        observeContent.put("goal_progress", observation.getGoalProgress());
        trace(sessionId, TracePhase.OBSERVE, iteration, observeContent, clock.millis() - phaseStart, true, null);

        recordOutcome(state, sessionId, observation);
    }

    /**
     * Consecutive-error bookkeeping, circuit breaker and stuck-loop check for an executed action.
     */
    private void recordOutcome(LoopState state, String sessionId, Observation observation) {
        if (observation.isSuccess()) {
            state.setConsecutiveErrors(0);
        } else {
            state.setConsecutiveErrors(state.getConsecutiveErrors() + 1);
            checkCircuitBreaker(state);
        }

        if (config.isStuckDetectionEnabled() && stuckDetector.isStuck(state.getActionsTaken())) {
            log.warn("Stuck loop detected [agent={}, session={}, recentActions={}]", agent.getName(), sessionId,
                    state.getActionsTaken().subList(Math.max(0, state.getActionsTaken().size() - 6),
                            state.getActionsTaken().size()));
            if (!stuckDetector.attemptRecovery(state, clock.millis())) {
                throw new StuckLoopException("Stuck loop persisted after "
                        + (state.getStuckDetections().size() - 1) + " recovery attempts");
            }
        }
    }

    private void handleIterationFailure(LoopState state, String sessionId, RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        state.incrementErrorCount();
        state.setConsecutiveErrors(state.getConsecutiveErrors() + 1);

        log.error("Error in iteration {} [agent={}, session={}]: {}", state.getIteration(),
                agent.getName(), sessionId, message, e);
        trace(sessionId, TracePhase.ERROR, state.getIteration(), content("error", message), 0, false, message);

        if (!config.isErrorRecoveryEnabled() || state.getErrorCount() >= config.getMaxErrors()) {
            throw new BudgetExceededException(TerminationReason.ERROR_BUDGET_EXHAUSTED,
                    "Error budget exhausted after " + state.getErrorCount() + " error(s), last: " + message);
        }
        checkCircuitBreaker(state);
    }

    private void checkCircuitBreaker(LoopState state) {
        if (state.getConsecutiveErrors() >= config.getMaxConsecutiveErrors()) {
            throw new CircuitBreakerException(state.getConsecutiveErrors());
        }
    }

    private void abandonIteration(String sessionId, int iteration, String afterPhase) {
        String message = "Iteration timeout (" + config.getIterationTimeout() + ") exceeded after " + afterPhase;
        log.warn("{} [agent={}, session={}, iteration={}]", message, agent.getName(), sessionId, iteration);
        trace(sessionId, TracePhase.ERROR, iteration, content("timeout", afterPhase), 0, false, message);
    }

    private LoopResult buildResult(LoopState state, String sessionId, TerminationReason reason,
                                   String error, long elapsedMs) {
        String agentSummary;
        try {
            agentSummary = agent.generateSummary(state);
        } catch (RuntimeException e) {
            log.warn("Summary generation failed [agent={}]: {}", agent.getName(), e.getMessage());
            agentSummary = agent.getName() + " explored for " + state.getIteration() + " iteration(s).";
        }

        String summary = agentSummary + "\n\nStopped: " + reason.getDescription()
                + (error != null ? " (" + error + ")" : "");

        return LoopResult.builder()
                .sessionId(sessionId)
                .agentName(agent.getName())
                .goal(state.getGoal())
                .iterations(state.getIteration())
                .elapsedMs(elapsedMs)
                .observations(new ArrayList<>(state.getObservations()))
                .actionsTaken(new ArrayList<>(state.getActionsTaken()))
                .reasoningHistory(new ArrayList<>(state.getReasoningHistory()))
                .cacheHits(state.getCacheHits())
                .errorCount(state.getErrorCount())
                .finalContext(new LinkedHashMap<>(state.getCurrentContext()))
                .goalAchieved(reason == TerminationReason.GOAL_ACHIEVED)
                .terminationReason(reason)
                .summary(summary)
                .error(error)
                .build();
    }

    private void trace(String sessionId, TracePhase phase, int iteration, Map<String, Object> content,
                       long durationMs, boolean success, String error) {
        if (tracer != null) {
            tracer.tracePhase(sessionId, phase, iteration, content, durationMs, success, error);
        }
    }

    private static Map<String, Object> content(String key, Object value) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put(key, value);
        return content;
    }
}
