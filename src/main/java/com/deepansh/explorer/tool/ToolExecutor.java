package com.deepansh.explorer.tool;

import com.deepansh.explorer.cache.ResultCache;
import com.deepansh.explorer.config.LoopConfig;
import com.deepansh.explorer.core.LoopState;
import com.deepansh.explorer.exception.ActionValidationException;
import com.deepansh.explorer.exception.ResultValidationException;
import com.deepansh.explorer.exception.ToolExecutionException;
import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.model.AgentAction;
import com.deepansh.explorer.model.Observation;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes an agent's action against the tool registry.
 *
 * Per-action flow:
 * 1. Validate parameters (no tool call on failure, never retried)
 * 2. Look up the tool for the action kind
 * 3. Serve cacheable kinds from the agent's cache when possible
 * 4. Run the tool on a worker thread, abandoning it after the tool timeout
 * 5. Validate the result; execution and validation failures are retried
 * 6. Record the action and build the observation
 *
 * Never throws: every failure comes back as an unsuccessful {@link Observation}.
 */
@Slf4j
public class ToolExecutor {

    private final ToolRegistry registry;
    private final ResultCache cache;
    private final LoopConfig config;
    private final ExecutorService workers;
    private final ActionParameterValidator parameterValidator = new ActionParameterValidator();
    private final ToolResultValidator resultValidator = new ToolResultValidator();
    private final Retry retry;

    public ToolExecutor(ToolRegistry registry, ResultCache cache, LoopConfig config, ExecutorService workers) {
        this.registry = registry;
        this.cache = cache;
        this.config = config;
        this.workers = workers;
        this.retry = Retry.of("tool-executor", RetryConfig.custom()
                .maxAttempts(config.getMaxToolRetries() + 1)
                .waitDuration(minimumBackoff(config.getToolRetryBackoff()))
                .retryExceptions(ToolExecutionException.class, ResultValidationException.class)
                .build());
        this.retry.getEventPublisher().onRetry(event -> log.warn("Tool call failed, retrying ({}/{}): {}",
                event.getNumberOfRetryAttempts(), config.getMaxToolRetries(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    public Observation act(AgentAction action, LoopState state) {
        log.info("Acting: {} [type={}]", action.getDescription(),
                action.getType() != null ? action.getType().getValue() : null);

        if (config.isToolValidationEnabled()) {
            try {
                parameterValidator.validate(action);
            } catch (ActionValidationException e) {
                log.warn("Parameter validation failed for [{}]: {}", action.getDescription(), e.getMessage());
                return Observation.failure(action, "Parameter validation failed: " + e.getMessage());
            }
        }

        Optional<AgentTool> tool = action.getType() == null ? Optional.empty() : registry.find(action.getType());
        if (tool.isEmpty()) {
            log.warn("No tool registered for [{}]. Available: {}", action.getType(), registry.availableTypes());
            return Observation.failure(action, "Tool " + action.getType() + " not available");
        }

        String cacheKey = cacheKeyFor(action);
        if (cacheKey != null) {
            Optional<Object> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                state.incrementCacheHits();
                log.debug("Cache hit [key={}]", cacheKey);
                return succeed(action, cached.get(), state);
            }
        }

        AtomicInteger attempts = new AtomicInteger();
        long start = System.currentTimeMillis();
        try {
            Object result = retry.executeCallable(() -> {
                attempts.incrementAndGet();
                Object raw = invokeWithTimeout(tool.get(), action);
                if (config.isToolValidationEnabled()) {
                    resultValidator.validate(action.getType(), raw);
                }
                return raw;
            });

            long elapsed = System.currentTimeMillis() - start;
            if (elapsed > 1000) {
                log.info("Tool [{}] took {}ms", action.getType().getValue(), elapsed);
            }
            if (cacheKey != null) {
                cache.set(cacheKey, result);
            }
            return succeed(action, result, state);

        } catch (ResultValidationException e) {
            return fail(action, state, "Result validation failed: " + e.getMessage());
        } catch (ToolExecutionException e) {
            log.error("Action failed after {} attempt(s) [{}]{}: {}", attempts.get(), action.getDescription(),
                    e.isTimeout() ? " on timeout" : "", e.getMessage());
            return fail(action, state, "Action failed after " + attempts.get() + " attempts: " + e.getMessage());
        } catch (Exception e) {
            log.error("Action failed after {} attempt(s) [{}]: {}", attempts.get(), action.getDescription(), e.getMessage());
            return fail(action, state, "Action failed after " + attempts.get() + " attempts: " + e.getMessage());
        }
    }

    private Object invokeWithTimeout(AgentTool tool, AgentAction action) {
        long timeoutMs = config.getToolTimeout().toMillis();
        Future<Object> future = workers.submit(() -> tool.execute(action.getParameters()));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // abandon the worker; an uncooperative tool may keep running in the background
            future.cancel(true);
            throw ToolExecutionException.timedOut(action.getType().getValue(), timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ToolExecutionException(describe(cause), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ToolExecutionException("Interrupted while waiting for tool", e);
        }
    }

    private Observation succeed(AgentAction action, Object result, LoopState state) {
        state.recordAction(action);
        state.getToolResults().put(action.getType(), result);

        return Observation.builder()
                .actionTaken(action.getDescription())
                .result(result)
                .success(true)
                .insight(insightFor(action.getType(), result))
                .confidence(confidenceFor(action.getType(), result))
                .build();
    }

    private Observation fail(AgentAction action, LoopState state, String insight) {
        state.recordAction(action);
        state.incrementErrorCount();
        return Observation.failure(action, insight);
    }

    private String cacheKeyFor(AgentAction action) {
        if (!config.isCacheEnabled() || !action.getType().isCacheable()) {
            return null;
        }
        return action.getType().getValue() + ":" + new TreeMap<>(action.getParameters());
    }

    static String insightFor(ActionType type, Object result) {
        Map<?, ?> map = result instanceof Map<?, ?> m ? m : Map.of();
        return switch (type) {
            case SCAN_DIRECTORY -> "Scanned directory with " + number(map.get("total_files")) + " files";
            case LIST_FILES -> "Listed " + number(map.get("count")) + " files";
            case READ_FILE -> "Read file with " + number(map.get("line_count")) + " lines";
            case SEARCH_FILES -> "Found " + size(map.get("results")) + " files matching pattern";
            default -> "Executed " + type.getValue();
        };
    }

    static double confidenceFor(ActionType type, Object result) {
        return switch (type) {
            case READ_FILE, SCAN_DIRECTORY -> 0.9;
            case SEARCH_FILES -> result instanceof Map<?, ?> map && size(map.get("results")) > 0 ? 0.8 : 0.3;
            default -> 0.7;
        };
    }

    private static long number(Object value) {
        return value instanceof Number n ? n.longValue() : 0;
    }

    private static int size(Object value) {
        return value instanceof Collection<?> c ? c.size() : 0;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null && !t.getMessage().isBlank()
                ? t.getMessage()
                : t.getClass().getSimpleName();
    }

    private static Duration minimumBackoff(Duration backoff) {
        return backoff.toMillis() < 1 ? Duration.ofMillis(1) : backoff;
    }
}
