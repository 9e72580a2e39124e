package com.orchestrator.config;

import com.orchestrator.domain.service.PollSleeper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(QueryRunnerProperties.class)
public class RunnerConfig {

    /**
     * Pool running query submissions and poll loops. A poll loop holds its
     * thread for the whole life of the external job.
     */
    @Bean(name = "queryExecutor")
    public ThreadPoolTaskExecutor queryExecutor(QueryRunnerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerPoolSize());
        executor.setMaxPoolSize(properties.getWorkerPoolSize());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("query-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PollSleeper pollSleeper() {
        return PollSleeper.threadSleep();
    }
}
