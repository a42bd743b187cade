package com.deepansh.react.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated thread pool for streaming agent runs.
 *
 * Isolated from the web thread pool: a streamed run holds its thread for the
 * whole think → act → observe cycle, while the request thread returns the
 * SseEmitter immediately. A full queue rejects new runs instead of queueing them
 * behind long-running ones.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "agentRunExecutor")
    public ThreadPoolTaskExecutor agentRunExecutor(AgentProperties properties) {
        AgentProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("react-run-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
