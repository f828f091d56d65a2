package com.streetsweeping.engine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Core engine beans: the clock every "now" is read from and the executor the schedule
 * catalog is loaded on.
 *
 * Catalog loading parses and indexes the whole table, which takes a noticeable amount of
 * time for the full city dataset. It runs on its own single thread so request threads
 * and the scheduler are never blocked by it; callers see an empty catalog until the
 * load completes.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock(SweepingProperties properties) {
        return Clock.system(properties.getZone());
    }

    @Bean(name = "catalogLoaderExecutor")
    public ThreadPoolTaskExecutor catalogLoaderExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(4);
        executor.setThreadNamePrefix("catalog-loader-");
        executor.initialize();
        return executor;
    }
}
