package com.fundradar.marketdata.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Market-data gateways and incremental price fetch. Documented in application.yml under fundradar.market-data.
 */
@ConfigurationProperties(prefix = "fundradar.market-data")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class MarketDataProperties {

    /** Yahoo Finance chart API base URL. */
    @NotBlank
    private String yahooBaseUrl = "https://query1.finance.yahoo.com/v8/finance/chart";

    /** Banco Central do Brasil SGS base URL. */
    @NotBlank
    private String bcbBaseUrl = "https://api.bcb.gov.br/dados/serie/bcdata.sgs";

    /** Yahoo rejects requests without a browser-like agent. */
    private String userAgent = "Mozilla/5.0 (compatible; fund-radar)";

    /** Read timeout in seconds for a single gateway call. */
    @Positive
    private int readTimeoutSeconds = 20;

    /** Days per fetch window. Default 100. */
    @Positive
    private int batchDays = 100;

    /** Pause between consecutive windows of one symbol. Default 500 ms. */
    private long interBatchDelayMs = 500;

    /** Pause between symbols of a bulk fetch. Default 1000 ms. */
    private long interSymbolDelayMs = 1000;

    /** Local limiter: gateway requests per second across all symbols. */
    @Positive
    private int requestsPerSecond = 2;

    /** Max time a caller waits for a limiter permit before the call fails as retryable. */
    private long limiterTimeoutMs = 30_000;

    @Valid
    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Retry {
        /** Base delay in ms for first retry; doubles each attempt. */
        private long baseDelayMs = 1000L;
        /** Backoff ceiling in ms. */
        private long maxDelayMs = 30_000L;
        /** Jitter factor 0..1 (0.2 = ±20%). */
        @DecimalMin("0")
        @DecimalMax("1")
        private double jitterFactor = 0.2;
        /** Total attempts per window, including the first. */
        @Min(1)
        private int maxAttempts = 4;
    }
}
