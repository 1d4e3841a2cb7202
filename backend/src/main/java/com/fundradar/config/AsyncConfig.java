package com.fundradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: market-data-executor runs bulk price fetches off the caller thread.
 * Single thread so inter-symbol delays hold across concurrent bulk requests.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String MARKET_DATA_EXECUTOR = "market-data-executor";

    @Bean(name = MARKET_DATA_EXECUTOR)
    public Executor marketDataExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("market-data-");
        e.initialize();
        return e;
    }
}
