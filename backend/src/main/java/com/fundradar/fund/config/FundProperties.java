package com.fundradar.fund.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Fund accounting settings. Documented in application.yml under fundradar.fund.
 */
@ConfigurationProperties(prefix = "fundradar.fund")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class FundProperties {

    /** Currency of NAV, cash position and fees. */
    @NotBlank
    private String baseCurrency = "BRL";

    /** Annual management fee rate (0.02 = 2%), accrued per day over 365. */
    @NotNull
    @DecimalMin("0")
    @DecimalMax("1")
    private BigDecimal managementFeeRate = new BigDecimal("0.02");

    /** Share of gains above the high-water mark charged as performance fee (0.20 = 20%). */
    @NotNull
    @DecimalMin("0")
    @DecimalMax("1")
    private BigDecimal performanceFeeRate = new BigDecimal("0.20");

    /** NAV the management fee is charged on. */
    @NotNull
    private ManagementFeeBasis managementFeeBasis = ManagementFeeBasis.PERIOD_END;

    /** Attempts to update the high-water mark when another writer moved it concurrently. */
    @Min(1)
    private int highWaterMarkMaxAttempts = 3;

    public enum ManagementFeeBasis {
        PERIOD_START,
        PERIOD_END
    }
}
