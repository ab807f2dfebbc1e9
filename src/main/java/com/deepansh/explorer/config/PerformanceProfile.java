package com.deepansh.explorer.config;

import java.time.Duration;

/**
 * Predefined loop budgets. Applied on top of an existing configuration,
 * so cache and tracing settings are preserved.
 */
public enum PerformanceProfile {

    FAST(10, Duration.ofSeconds(15), Duration.ofMinutes(5), Duration.ofSeconds(10), 5, 500),
    BALANCED(20, Duration.ofSeconds(30), Duration.ofMinutes(10), Duration.ofSeconds(15), 10, 1000),
    THOROUGH(50, Duration.ofSeconds(60), Duration.ofMinutes(30), Duration.ofSeconds(30), 20, 2000);

    private final int maxIterations;
    private final Duration iterationTimeout;
    private final Duration totalTimeout;
    private final Duration toolTimeout;
    private final int maxErrors;
    private final int cacheMaxSize;

    PerformanceProfile(int maxIterations, Duration iterationTimeout, Duration totalTimeout,
                       Duration toolTimeout, int maxErrors, int cacheMaxSize) {
        this.maxIterations = maxIterations;
        this.iterationTimeout = iterationTimeout;
        this.totalTimeout = totalTimeout;
        this.toolTimeout = toolTimeout;
        this.maxErrors = maxErrors;
        this.cacheMaxSize = cacheMaxSize;
    }

    public LoopConfig applyTo(LoopConfig base) {
        return base.toBuilder()
                .maxIterations(maxIterations)
                .iterationTimeout(iterationTimeout)
                .totalTimeout(totalTimeout)
                .toolTimeout(toolTimeout)
                .maxErrors(maxErrors)
                .cacheMaxSize(cacheMaxSize)
                .build();
    }
}
