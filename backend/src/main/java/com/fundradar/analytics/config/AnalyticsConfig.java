package com.fundradar.analytics.config;

import com.fundradar.analytics.PerformanceAnalytics;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsConfig {

    @Bean
    public PerformanceAnalytics performanceAnalytics(AnalyticsProperties properties) {
        return new PerformanceAnalytics(properties.getTradingDays(), properties.getRiskFreeRate());
    }
}
