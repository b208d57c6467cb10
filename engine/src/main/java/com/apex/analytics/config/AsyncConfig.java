package com.apex.analytics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    @Bean(name = "analyticsExecutor")
    public Executor analyticsExecutor(AnalyticsProperties properties) {
        AnalyticsProperties.Executor cfg = properties.getExecutor();
        int corePoolSize = cfg.getCorePoolSize();
        int maxPoolSize = Math.max(cfg.getMaxPoolSize(), corePoolSize);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("analytics-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
