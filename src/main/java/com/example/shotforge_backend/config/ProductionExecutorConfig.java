package com.example.shotforge_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Provides the thread pool used by {@link com.example.shotforge_backend.service.production.ProductionOrchestrator}
 * to execute production runs in the background.
 */
@Configuration
@EnableConfigurationProperties(ProductionProperties.class)
public class ProductionExecutorConfig {

    @Bean(name = "productionTaskExecutor")
    public ThreadPoolTaskExecutor productionTaskExecutor(ProductionProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getExecutorThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("production-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock productionClock() {
        return Clock.systemUTC();
    }
}
