package com.deepansh.explorer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed configuration for the exploration engine.
 * Bound from application.yml under the "explorer" prefix, then frozen into a
 * {@link LoopConfig} by {@link #toLoopConfig()}.
 */
@ConfigurationProperties(prefix = "explorer")
@Data
public class ExplorerProperties {

    /** Optional: fast, balanced or thorough. Overrides the loop budgets below when set. */
    private PerformanceProfile profile;

    private Loop loop = new Loop();
    private Errors errors = new Errors();
    private Stuck stuck = new Stuck();
    private Tools tools = new Tools();
    private Cache cache = new Cache();
    private Tracing tracing = new Tracing();
    private Repository repository = new Repository();

    @Data
    public static class Loop {
        private int maxIterations = 20;
        private Duration iterationTimeout = Duration.ofSeconds(30);
        private Duration totalTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class Errors {
        private int maxErrors = 10;
        private int maxConsecutiveErrors = 3;
        private boolean recoveryEnabled = true;
    }

    @Data
    public static class Stuck {
        private boolean detectionEnabled = true;
        private int maxSameActionRepeats = 3;
    }

    @Data
    public static class Tools {
        private Duration timeout = Duration.ofSeconds(15);
        private int maxRetries = 2;
        private Duration retryBackoff = Duration.ofMillis(500);
        private boolean validationEnabled = true;
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private int maxSize = 1000;
        private Duration ttl = Duration.ofHours(1);
        /** Empty keeps caches in memory only. Each agent gets its own sub-directory. */
        private String directory = "";
    }

    @Data
    public static class Tracing {
        private boolean enabled = true;
        /** Empty disables trace files */
        private String directory = "";
    }

    @Data
    public static class Repository {
        /** Roots a repository path must live under. Empty allows any directory. */
        private List<String> allowedRoots = new ArrayList<>();
    }

    public LoopConfig toLoopConfig() {
        LoopConfig config = LoopConfig.builder()
                .maxIterations(loop.getMaxIterations())
                .iterationTimeout(loop.getIterationTimeout())
                .totalTimeout(loop.getTotalTimeout())
                .maxErrors(errors.getMaxErrors())
                .maxConsecutiveErrors(errors.getMaxConsecutiveErrors())
                .errorRecoveryEnabled(errors.isRecoveryEnabled())
                .stuckDetectionEnabled(stuck.isDetectionEnabled())
                .maxSameActionRepeats(stuck.getMaxSameActionRepeats())
                .toolTimeout(tools.getTimeout())
                .maxToolRetries(tools.getMaxRetries())
                .toolRetryBackoff(tools.getRetryBackoff())
                .toolValidationEnabled(tools.isValidationEnabled())
                .cacheEnabled(cache.isEnabled())
                .cacheMaxSize(cache.getMaxSize())
                .cacheTtl(cache.getTtl())
                .cacheDirectory(toPath(cache.getDirectory()))
                .tracingEnabled(tracing.isEnabled())
                .traceDirectory(toPath(tracing.getDirectory()))
                .allowedRoots(repository.getAllowedRoots().stream()
                        .filter(root -> root != null && !root.isBlank())
                        .map(Path::of)
                        .toList())
                .build();

        if (profile != null) {
            config = profile.applyTo(config);
        }
        return config.validate();
    }

    private static Path toPath(String value) {
        return value == null || value.isBlank() ? null : Path.of(value);
    }
}
