package com.deepansh.explorer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools used by the engine.
 *
 * - explorationTaskExecutor: one task per agent when the supervisor runs several
 *   agents concurrently. Each loop itself stays single-threaded.
 * - toolExecutorService: workers for individual tool calls so they can be abandoned
 *   after the tool timeout. Cached pool, daemon threads: a hung tool never blocks shutdown.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "explorationTaskExecutor")
    public ThreadPoolTaskExecutor explorationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(20);
        executor.setThreadNamePrefix("exploration-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "toolExecutorService", destroyMethod = "shutdownNow")
    public ExecutorService toolExecutorService() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("tool-worker-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }
}
