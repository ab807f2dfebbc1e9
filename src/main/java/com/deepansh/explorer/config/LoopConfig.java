package com.deepansh.explorer.config;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Immutable tunables shared by every component of an exploration loop.
 *
 * Built once (from {@link ExplorerProperties} or a {@link PerformanceProfile}) and
 * passed by reference. Components read it and never write back.
 */
@Value
@Builder(toBuilder = true)
public class LoopConfig {

    // Loop
    @Builder.Default int maxIterations = 20;
    @Builder.Default Duration iterationTimeout = Duration.ofSeconds(30);
    @Builder.Default Duration totalTimeout = Duration.ofMinutes(10);

    // Errors
    @Builder.Default int maxErrors = 10;
    @Builder.Default int maxConsecutiveErrors = 3;
    @Builder.Default boolean errorRecoveryEnabled = true;

    // Stuck detection
    @Builder.Default boolean stuckDetectionEnabled = true;
    @Builder.Default int maxSameActionRepeats = 3;

    // Tools
    @Builder.Default Duration toolTimeout = Duration.ofSeconds(15);
    @Builder.Default int maxToolRetries = 2;
    @Builder.Default Duration toolRetryBackoff = Duration.ofMillis(500);
    @Builder.Default boolean toolValidationEnabled = true;

    // Cache
    @Builder.Default boolean cacheEnabled = true;
    @Builder.Default int cacheMaxSize = 1000;
    @Builder.Default Duration cacheTtl = Duration.ofHours(1);
    /** Null keeps the cache in memory only */
    Path cacheDirectory;

    // Tracing
    @Builder.Default boolean tracingEnabled = true;
    /** Null disables trace files; sessions are still tracked in memory */
    Path traceDirectory;

    // Repositories
    /** Directories an exploration may target. Empty allows any directory. */
    @Builder.Default List<Path> allowedRoots = List.of();

    public static LoopConfig defaults() {
        return LoopConfig.builder().build();
    }

    /**
     * Fails fast on nonsensical values. Called once at startup.
     *
     * @return this, for chaining
     * @throws IllegalArgumentException naming the first offending setting
     */
    public LoopConfig validate() {
        requirePositive(maxIterations, "maxIterations");
        requirePositive(iterationTimeout, "iterationTimeout");
        requirePositive(totalTimeout, "totalTimeout");
        requirePositive(maxErrors, "maxErrors");
        requirePositive(maxConsecutiveErrors, "maxConsecutiveErrors");
        requirePositive(maxSameActionRepeats, "maxSameActionRepeats");
        requirePositive(toolTimeout, "toolTimeout");
        if (maxToolRetries < 0) {
            throw new IllegalArgumentException("maxToolRetries must be non-negative");
        }
        if (toolRetryBackoff == null || toolRetryBackoff.isNegative()) {
            throw new IllegalArgumentException("toolRetryBackoff must be non-negative");
        }
        requirePositive(cacheMaxSize, "cacheMaxSize");
        requirePositive(cacheTtl, "cacheTtl");
        return this;
    }

    /**
     * Coarse classification of this configuration, mirroring {@link PerformanceProfile}.
     */
    public PerformanceProfile describeProfile() {
        long toolSeconds = toolTimeout.toSeconds();
        if (maxIterations <= 10 && toolSeconds <= 10) {
            return PerformanceProfile.FAST;
        }
        if (maxIterations <= 30 && toolSeconds <= 30) {
            return PerformanceProfile.BALANCED;
        }
        return PerformanceProfile.THOROUGH;
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
