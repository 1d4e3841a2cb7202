package com.fundradar.ledger.config;

import com.fundradar.ledger.OversellPolicy;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Position ledger settings. Documented in application.yml under fundradar.ledger.
 */
@ConfigurationProperties(prefix = "fundradar.ledger")
@NoArgsConstructor
@Getter
@Setter
public class LedgerProperties {

    /** Sell beyond held quantity: REJECT (default) or ALLOW_SHORT. */
    private OversellPolicy oversellPolicy = OversellPolicy.REJECT;

    /** Number of entries returned by top-performer queries when no limit is given. */
    private int topPerformersLimit = 5;
}
