package com.deepansh.explorer.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoopConfigTest {

    @Test
    void defaults_areValidAndBalanced() {
        LoopConfig config = LoopConfig.defaults().validate();

        assertThat(config.getMaxIterations()).isEqualTo(20);
        assertThat(config.getMaxSameActionRepeats()).isEqualTo(3);
        assertThat(config.getCacheDirectory()).isNull();
        assertThat(config.describeProfile()).isEqualTo(PerformanceProfile.BALANCED);
    }

    @Test
    void validate_rejectsNonPositiveIterations() {
        assertThatThrownBy(() -> LoopConfig.builder().maxIterations(0).build().validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxIterations");
    }

    @Test
    void validate_rejectsNegativeRetries() {
        assertThatThrownBy(() -> LoopConfig.builder().maxToolRetries(-1).build().validate())
                .hasMessageContaining("maxToolRetries");
    }

    @Test
    void validate_rejectsZeroToolTimeout() {
        assertThatThrownBy(() -> LoopConfig.builder().toolTimeout(Duration.ZERO).build().validate())
                .hasMessageContaining("toolTimeout");
    }

    @Test
    void profile_overridesBudgets_keepsCacheSettings() {
        LoopConfig base = LoopConfig.builder().cacheDirectory(Path.of("cache")).cacheTtl(Duration.ofMinutes(5)).build();

        LoopConfig fast = PerformanceProfile.FAST.applyTo(base);

        assertThat(fast.getMaxIterations()).isEqualTo(10);
        assertThat(fast.getToolTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(fast.getCacheDirectory()).isEqualTo(Path.of("cache"));
        assertThat(fast.getCacheTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(fast.describeProfile()).isEqualTo(PerformanceProfile.FAST);
        assertThat(PerformanceProfile.THOROUGH.applyTo(base).describeProfile()).isEqualTo(PerformanceProfile.THOROUGH);
    }

    @Test
    void properties_convertToValidatedConfig() {
        ExplorerProperties properties = new ExplorerProperties();
        properties.getLoop().setMaxIterations(7);
        properties.getCache().setDirectory("  ");
        properties.getTracing().setDirectory("traces");

        LoopConfig config = properties.toLoopConfig();

        assertThat(config.getMaxIterations()).isEqualTo(7);
        assertThat(config.getCacheDirectory()).isNull();
        assertThat(config.getTraceDirectory()).isEqualTo(Path.of("traces"));
    }

    @Test
    void properties_profileWinsOverLoopBudgets() {
        ExplorerProperties properties = new ExplorerProperties();
        properties.getLoop().setMaxIterations(7);
        properties.setProfile(PerformanceProfile.THOROUGH);

        assertThat(properties.toLoopConfig().getMaxIterations()).isEqualTo(50);
    }

    @Test
    void properties_invalidValue_failsFast() {
        ExplorerProperties properties = new ExplorerProperties();
        properties.getCache().setMaxSize(0);

        assertThatThrownBy(properties::toLoopConfig)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cacheMaxSize");
    }

    @Test
    void properties_allowedRoots_skipBlankEntries() {
        ExplorerProperties properties = new ExplorerProperties();
        properties.getRepository().setAllowedRoots(List.of("/srv/repos", " ", ""));

        assertThat(properties.toLoopConfig().getAllowedRoots()).containsExactly(Path.of("/srv/repos"));
        assertThat(LoopConfig.defaults().getAllowedRoots()).isEmpty();
    }
}
