package com.fundradar.analytics.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Performance analytics settings. Documented in application.yml under fundradar.analytics.
 */
@ConfigurationProperties(prefix = "fundradar.analytics")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class AnalyticsProperties {

    /** Annual risk-free rate as a fraction, used by Sharpe, Sortino and Jensen's alpha. */
    private double riskFreeRate = 0.0;

    /** Quote symbol in the price cache used when a request names no benchmark. */
    @NotBlank
    private String benchmarkSymbol = "^BVSP";

    /** Trailing window of rolling metrics, in daily returns. */
    @Min(2)
    private int rollingWindow = 252;

    @Positive
    private int tradingDays = 252;
}
