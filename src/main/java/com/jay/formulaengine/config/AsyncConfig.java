package com.jay.formulaengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools for the evaluation cycle.
 * evaluationExecutor runs one evaluate→validate→route pipeline per subscription;
 * formulaSandboxExecutor runs the formula bodies themselves under a wall-clock timeout;
 * brokerExecutor carries broker calls so each one can be abandoned after execution.broker_timeout_ms.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "evaluationExecutor")
    public ThreadPoolTaskExecutor evaluationExecutor(EngineConfig config) {
        int processors = Runtime.getRuntime().availableProcessors();
        int configured = config.evaluation().getWorkerThreads();
        int corePoolSize = configured > 0 ? configured : Math.max(4, processors * 2);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(corePoolSize);
        executor.setQueueCapacity(config.evaluation().getQueueCapacity());
        executor.setThreadNamePrefix("evaluation-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean(name = "formulaSandboxExecutor")
    public ThreadPoolTaskExecutor formulaSandboxExecutor(EngineConfig config) {
        int processors = Runtime.getRuntime().availableProcessors();
        int configured = config.evaluation().getSandboxThreads();
        int corePoolSize = configured > 0 ? configured : Math.max(2, processors);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(corePoolSize * 2);
        executor.setQueueCapacity(config.evaluation().getQueueCapacity());
        executor.setThreadNamePrefix("formula-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "brokerExecutor")
    public ThreadPoolTaskExecutor brokerExecutor(EngineConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(config.evaluation().getQueueCapacity());
        executor.setThreadNamePrefix("broker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
