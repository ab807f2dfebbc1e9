package com.deepansh.explorer.core;

import com.deepansh.explorer.cache.ResultCache;
import com.deepansh.explorer.config.LoopConfig;
import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.model.AgentAction;
import com.deepansh.explorer.model.LoopResult;
import com.deepansh.explorer.model.TerminationReason;
import com.deepansh.explorer.observability.ExplorationTracer;
import com.deepansh.explorer.observability.TracePhase;
import com.deepansh.explorer.observability.TraceRecord;
import com.deepansh.explorer.observability.TraceSession;
import com.deepansh.explorer.support.MutableClock;
import com.deepansh.explorer.support.StubTool;
import com.deepansh.explorer.tool.AgentTool;
import com.deepansh.explorer.tool.ToolExecutor;
import com.deepansh.explorer.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

class LoopControllerTest {

    private ExecutorService workers;
    private MutableClock clock;
    private LoopConfig config;

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool();
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        config = LoopConfig.builder()
                .maxToolRetries(0)
                .toolRetryBackoff(Duration.ZERO)
                .build();
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void executeLoop_neverAchievingGoal_stopsAtExactlyMaxIterations() {
        ScriptedAgent agent = new ScriptedAgent(state -> store(state.getIteration()));

        LoopResult result = controller(agent, config, storeTool()).executeLoop("never done", 5);

        assertThat(result.getIterations()).isEqualTo(5);
        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.MAX_ITERATIONS);
        assertThat(result.isGoalAchieved()).isFalse();
        assertThat(result.getActionsTaken()).hasSize(5);
        assertThat(result.getReasoningHistory()).hasSize(5);
        assertThat(result.getSummary()).contains("Stopped: iteration budget exhausted");
        assertThat(result.getError()).isNull();
    }

    @Test
    void executeLoop_withoutOverride_usesConfiguredBudget() {
        ScriptedAgent agent = new ScriptedAgent(state -> store(state.getIteration()));

        LoopResult result = controller(agent, config.toBuilder().maxIterations(3).build(), storeTool())
                .executeLoop("never done");

        assertThat(result.getIterations()).isEqualTo(3);
    }

    @Test
    void executeLoop_goalAchieved_stopsEarly() {
        ScriptedAgent agent = new ScriptedAgent(state -> store(state.getIteration()));
        agent.done = state -> state.getActionsTaken().size() >= 2;

        LoopResult result = controller(agent, config, storeTool()).executeLoop("two steps", 10);

        assertThat(result.getIterations()).isEqualTo(2);
        assertThat(result.isGoalAchieved()).isTrue();
        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.GOAL_ACHIEVED);
        assertThat(result.getSummary()).startsWith("scripted summary").contains("goal achieved");
    }

    @Test
    void executeLoop_completionInsight_satisfiesDefaultGoalCheck() {
        ScriptedAgent agent = new ScriptedAgent(state -> store(state.getIteration()));
        agent.extraInsight = state -> state.getIteration() == 3 ? "Analysis completed" : null;

        LoopResult result = controller(agent, config, storeTool()).executeLoop("heuristic", 10);

        assertThat(result.getIterations()).isEqualTo(3);
        assertThat(result.isGoalAchieved()).isTrue();
    }

    @Test
    void executeLoop_consecutiveToolFailures_openCircuitBreaker() {
        StubTool failing = new StubTool(ActionType.CACHE_STORE, (params, n) -> {
            throw new IOException("unavailable");
        });
        ScriptedAgent agent = new ScriptedAgent(state -> store(state.getIteration()));

        LoopResult result = controller(agent, config, failing).executeLoop("fail", 20);

        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.CIRCUIT_BREAKER);
        assertThat(result.getIterations()).isLessThanOrEqualTo(config.getMaxConsecutiveErrors());
        assertThat(result.getErrorCount()).isEqualTo(3);
        assertThat(result.isGoalAchieved()).isFalse();
    }

    @Test
    void executeLoop_actionsAlwaysFailingValidation_openCircuitBreakerWithoutToolCalls() {
        StubTool read = StubTool.returning(ActionType.READ_FILE, Map.of("content", "x"));
        ScriptedAgent agent = new ScriptedAgent(state -> AgentAction.builder()
                .type(ActionType.READ_FILE)
                .description("Read without a path " + state.getIteration())
                .build());

        LoopResult result = controller(agent, config, read).executeLoop("invalid", 20);

        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.CIRCUIT_BREAKER);
        assertThat(result.getIterations()).isLessThanOrEqualTo(config.getMaxConsecutiveErrors());
        assertThat(read.invocations()).isZero();
        assertThat(result.getActionsTaken()).isEmpty();
    }

    @Test
    void executeLoop_toolHangingPastIterationTimeout_stillOpensCircuitBreaker() {
        StubTool hanging = new StubTool(ActionType.CACHE_STORE, (params, n) -> {
            clock.advance(Duration.ofSeconds(2));
            Thread.sleep(2000);
            return Map.of("stored", true);
        });
        ScriptedAgent agent = new ScriptedAgent(state -> store(state.getIteration()));
        LoopConfig tight = config.toBuilder()
                .toolTimeout(Duration.ofMillis(100))
                .iterationTimeout(Duration.ofSeconds(1))
                .build();

        LoopResult result = controller(agent, tight, hanging).executeLoop("hang", 8);

        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.CIRCUIT_BREAKER);
        assertThat(result.getIterations()).isEqualTo(3);
        assertThat(result.getErrorCount()).isEqualTo(3);
        assertThat(result.getObservations()).isEmpty();
    }

    @Test
    void executeLoop_successResetsConsecutiveErrors() {
        StubTool flaky = new StubTool(ActionType.CACHE_STORE, (params, n) -> {
            if (n % 3 == 0) {
                return Map.of("stored", true);
            }
            throw new IOException("flaky");
        });
        ScriptedAgent agent = new ScriptedAgent(state -> store(state.getIteration()));

        LoopResult result = controller(agent, config.toBuilder().maxErrors(100).build(), flaky)
                .executeLoop("flaky", 9);

        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.MAX_ITERATIONS);
        assertThat(result.getErrorCount()).isEqualTo(6);
    }

    @Test
    void executeLoop_agentExceptions_abortWhenErrorBudgetSpent() {
        ScriptedAgent agent = new ScriptedAgent(state -> store(state.getIteration()));
        agent.reasoner = state -> {
            throw new IllegalStateException("boom");
        };
        LoopConfig budget = config.toBuilder().maxErrors(2).maxConsecutiveErrors(10).build();

        LoopResult result = controller(agent, budget, storeTool()).executeLoop("explode", 20);

        assertThat(result.getIterations()).isEqualTo(2);
        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.ERROR_BUDGET_EXHAUSTED);
        assertThat(result.getError()).contains("boom");
        assertThat(result.getErrorCount()).isEqualTo(2);
        assertThat(result.getSummary()).contains("Stopped: error budget exhausted");
    }

    @Test
    void executeLoop_recoveryDisabled_abortsOnFirstException() {
        ScriptedAgent agent = new ScriptedAgent(state -> {
            throw new IllegalArgumentException("bad plan");
        });

        LoopResult result = controller(agent, config.toBuilder().errorRecoveryEnabled(false).build(), storeTool())
                .executeLoop("explode", 20);

        assertThat(result.getIterations()).isEqualTo(1);
        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.ERROR_BUDGET_EXHAUSTED);
        assertThat(result.getError()).contains("bad plan");
    }

    @Test
    void executeLoop_repeatingSameAction_recoversThenEscalates() {
        StubTool read = StubTool.returning(ActionType.READ_FILE, Map.of("file_path", "a.py", "content", "x"));
        ScriptedAgent agent = new ScriptedAgent(state -> AgentAction.builder()
                .type(ActionType.READ_FILE)
                .description("Read a.py")
                .parameter("file_path", "a.py")
                .build());

        LoopResult result = controller(agent, config, read).executeLoop("loop forever", 20);

        // stuck from the 5th action on, three recoveries, escalation on the fourth detection
        assertThat(result.getIterations()).isEqualTo(8);
        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.STUCK_LOOP_ESCALATION);
        assertThat(result.getFinalContext()).containsEntry("recovery_strategy", "switch_to_directory_scan");
        assertThat(result.getCacheHits()).isEqualTo(7);
        assertThat(read.invocations()).isEqualTo(1);
    }

    @Test
    void executeLoop_stuckDetectionDisabled_runsToBudget() {
        StubTool read = StubTool.returning(ActionType.READ_FILE, Map.of("content", "x"));
        ScriptedAgent agent = new ScriptedAgent(state -> AgentAction.builder()
                .type(ActionType.READ_FILE)
                .description("Read a.py")
                .parameter("file_path", "a.py")
                .build());

        LoopResult result = controller(agent, config.toBuilder().stuckDetectionEnabled(false).build(), read)
                .executeLoop("loop forever", 12);

        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.MAX_ITERATIONS);
        assertThat(result.getIterations()).isEqualTo(12);
    }

    @Test
    void executeLoop_slowReasoning_abandonsIterationWithoutActing() {
        ScriptedAgent agent = new ScriptedAgent(state -> store(state.getIteration()));
        agent.reasoner = state -> {
            clock.advance(Duration.ofSeconds(2));
            return "slow thought";
        };
        LoopConfig tight = config.toBuilder().iterationTimeout(Duration.ofSeconds(1)).build();

        LoopResult result = controller(agent, tight, storeTool()).executeLoop("slow", 3);

        assertThat(result.getIterations()).isEqualTo(3);
        assertThat(result.getActionsTaken()).isEmpty();
        assertThat(agent.planCalls).isZero();
        assertThat(result.getErrorCount()).isZero();
        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.MAX_ITERATIONS);
    }

    @Test
    void executeLoop_totalTimeout_stopsLoop() {
        ScriptedAgent agent = new ScriptedAgent(state -> store(state.getIteration()));
        agent.reasoner = state -> {
            clock.advance(Duration.ofMinutes(4));
            return "long thought";
        };
        LoopConfig budget = config.toBuilder()
                .iterationTimeout(Duration.ofMinutes(10))
                .totalTimeout(Duration.ofMinutes(10))
                .build();

        LoopResult result = controller(agent, budget, storeTool()).executeLoop("slow", 20);

        assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.TOTAL_TIMEOUT);
        assertThat(result.getIterations()).isEqualTo(3);
    }

    @Test
    void executeLoop_withTracer_recordsEveryPhase() {
        ExplorationTracer tracer = new ExplorationTracer(config, new ObjectMapper());
        ScriptedAgent agent = new ScriptedAgent(state -> store(state.getIteration()));

        LoopResult result = new LoopController(agent, executor(config, storeTool()), tracer, config,
                new StuckLoopDetector(config.getMaxSameActionRepeats()), clock).executeLoop("trace me", 2);

        assertThat(result.getSessionId()).isNotNull();
        TraceSession session = tracer.findSession(result.getSessionId()).orElseThrow();
        assertThat(session.getTraces()).extracting(TraceRecord::getPhase).containsExactly(
                TracePhase.REASON, TracePhase.ACT, TracePhase.OBSERVE,
                TracePhase.REASON, TracePhase.ACT, TracePhase.OBSERVE);
        assertThat(session.getTotalIterations()).isEqualTo(2);
        assertThat(session.getFinalResult()).containsEntry("termination_reason", "MAX_ITERATIONS");
        assertThat(tracer.isIdle()).isTrue();
    }

    private LoopController controller(ExplorationAgent agent, LoopConfig loopConfig, AgentTool tool) {
        return new LoopController(agent, executor(loopConfig, tool), null, loopConfig,
                new StuckLoopDetector(loopConfig.getMaxSameActionRepeats()), clock);
    }

    private ToolExecutor executor(LoopConfig loopConfig, AgentTool tool) {
        return new ToolExecutor(new ToolRegistry(List.of(tool)), new ResultCache(100, Duration.ofHours(1)),
                loopConfig, workers);
    }

    private static StubTool storeTool() {
        return StubTool.returning(ActionType.CACHE_STORE, Map.of("stored", true));
    }

    private static AgentAction store(int iteration) {
        return AgentAction.builder()
                .type(ActionType.CACHE_STORE)
                .description("Store note " + iteration)
                .parameter("key", "note-" + iteration)
                .parameter("value", iteration)
                .build();
    }

    private static class ScriptedAgent implements ExplorationAgent {

        Function<LoopState, String> reasoner = state -> "think";
        final Function<LoopState, AgentAction> planner;
        Predicate<LoopState> done;
        Function<LoopState, String> extraInsight = state -> null;
        int planCalls;

        ScriptedAgent(Function<LoopState, AgentAction> planner) {
            this.planner = planner;
        }

        @Override
        public String getName() {
            return "ScriptedAgent";
        }

        @Override
        public String reason(LoopState state) {
            return reasoner.apply(state);
        }

        @Override
        public AgentAction planAction(LoopState state, String reasoning) {
            planCalls++;
            return planner.apply(state);
        }

        @Override
        public void observe(LoopState state, com.deepansh.explorer.model.Observation observation) {
            ExplorationAgent.super.observe(state, observation);
            String insight = extraInsight.apply(state);
            if (insight != null) {
                state.getObservations().add(insight);
            }
        }

        @Override
        public boolean isGoalAchieved(LoopState state) {
            return done != null ? done.test(state) : ExplorationAgent.super.isGoalAchieved(state);
        }

        @Override
        public String generateSummary(LoopState state) {
            return "scripted summary";
        }
    }
}
