package com.hourlyhigh.config;

import com.hourlyhigh.engine.GroupReduceEngine;
import com.hourlyhigh.model.Interval;
import com.hourlyhigh.session.InputSession;
import com.hourlyhigh.sink.HighDiffListener;
import com.hourlyhigh.sink.LoggingSink;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.List;

/**
 * Application-wide Spring configuration.
 */
@Configuration
@EnableScheduling
public class AppConfig {

    /**
     * Dedicated task scheduler for scheduled methods ({@code @Scheduled}).
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("hourly-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        return scheduler;
    }

    /**
     * Workers for the engine's key shards. One thread per shard, so shards of a batch never queue.
     */
    @Bean
    public ThreadPoolTaskExecutor shardExecutor(@Value("${hourly.engine.shards:4}") int shards) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(shards);
        executor.setMaxPoolSize(shards);
        executor.setThreadNamePrefix("hourly-shard-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }

    /**
     * The engine context: owns every group state from startup to shutdown.
     */
    @Bean(destroyMethod = "close")
    public GroupReduceEngine groupReduceEngine(
            @Value("${hourly.engine.interval:1h}") String intervalLabel,
            @Value("${hourly.engine.shards:4}") int shards,
            ThreadPoolTaskExecutor shardExecutor,
            List<HighDiffListener> listeners) {
        Interval interval = Interval.fromLabel(intervalLabel)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported interval: " + intervalLabel
                        + ". Supported: " + String.join(", ", Interval.supportedLabels())));
        GroupReduceEngine engine = new GroupReduceEngine(interval, shards, shardExecutor);
        listeners.forEach(engine::subscribe);
        return engine;
    }

    @Bean
    public InputSession inputSession(GroupReduceEngine engine) {
        return new InputSession(engine);
    }

    @Bean
    @ConditionalOnProperty(name = "hourly.sink.log-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingSink loggingSink() {
        return new LoggingSink();
    }
}
