package com.deepansh.explorer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Freezes the bound {@link ExplorerProperties} into the single {@link LoopConfig}
 * instance every component receives.
 */
@Configuration
@EnableConfigurationProperties(ExplorerProperties.class)
@Slf4j
public class ExplorerConfig {

    @Bean
    public LoopConfig loopConfig(ExplorerProperties properties) {
        LoopConfig config = properties.toLoopConfig();
        log.info("Exploration config loaded [profile={}, maxIterations={}, toolTimeout={}, cacheDir={}, traceDir={}]",
                config.describeProfile(), config.getMaxIterations(), config.getToolTimeout(),
                config.getCacheDirectory(), config.getTraceDirectory());
        return config;
    }
}
