package com.fundradar.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. FX rates are short-lived; indexer series change at most daily.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String FX_RATE_CACHE = "fxRateCache";
    public static final String INDEXER_SERIES_CACHE = "indexerSeriesCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(FX_RATE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(15, TimeUnit.MINUTES)
                .maximumSize(2_000)
                .build());
        manager.registerCustomCache(INDEXER_SERIES_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(12, TimeUnit.HOURS)
                .maximumSize(500)
                .build());
        return manager;
    }
}
