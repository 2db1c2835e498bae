package com.stockalerts.config;

import com.stockalerts.engine.AlertEngineConfig;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Bounded pool for per-symbol price fetches. A full queue makes the submitting thread run
     * the fetch itself, which throttles the cycle instead of dropping symbols.
     */
    @Bean("priceFetchExecutor")
    public ThreadPoolTaskExecutor priceFetchExecutor(AlertEngineConfig alertEngineConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(alertEngineConfig.getFetchPoolSize());
        executor.setMaxPoolSize(alertEngineConfig.getFetchPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("price-fetch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
