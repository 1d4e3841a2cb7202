package com.fundradar.marketdata.config;

import com.fundradar.common.RetryPolicy;
import com.fundradar.common.Sleeper;
import com.fundradar.marketdata.BcbIndexerSeriesGateway;
import com.fundradar.marketdata.IndexerSeriesGateway;
import com.fundradar.marketdata.MarketDataGateway;
import com.fundradar.marketdata.YahooChartGateway;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Gateways, retry policy and the shared upstream rate limiter.
 */
@Configuration
@EnableConfigurationProperties(MarketDataProperties.class)
public class MarketDataConfig {

    @Bean
    public RetryPolicy marketDataRetryPolicy(MarketDataProperties properties) {
        MarketDataProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
    }

    @Bean(name = "marketDataRateLimiter")
    public RateLimiter marketDataRateLimiter(MarketDataProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("market-data", config);
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper marketDataSleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    @ConditionalOnMissingBean(MarketDataGateway.class)
    public MarketDataGateway yahooChartGateway(WebClient.Builder webClientBuilder, RateLimiter marketDataRateLimiter,
                                               MarketDataProperties properties) {
        return new YahooChartGateway(webClientBuilder.clone(), marketDataRateLimiter, properties);
    }

    @Bean
    @ConditionalOnMissingBean(IndexerSeriesGateway.class)
    public IndexerSeriesGateway bcbIndexerSeriesGateway(WebClient.Builder webClientBuilder, RateLimiter marketDataRateLimiter,
                                                        MarketDataProperties properties) {
        return new BcbIndexerSeriesGateway(webClientBuilder.clone(), marketDataRateLimiter, properties);
    }
}
