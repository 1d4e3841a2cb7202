package com.fundradar.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Price and FX resolution. Documented in application.yml under fundradar.pricing.
 */
@ConfigurationProperties(prefix = "fundradar.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * A cached bar older than this many days before the valuation date is still used but flagged stale.
     */
    private int staleAfterDays = 7;

    /**
     * Last-resort FX rates keyed by pair ("USDBRL" = BRL per USD). Used only when neither the pair nor its reverse
     * is cached; conversions using them are flagged approximated.
     */
    private Map<String, BigDecimal> defaultFxRates = new HashMap<>(Map.of(
            "USDBRL", new BigDecimal("5.0"),
            "EURBRL", new BigDecimal("5.5")));
}
