package com.fundradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Fund investor. investorId is unique within a portfolio.
 */
@Document(collection = "investors")
@CompoundIndex(name = "portfolio_investor_unique", def = "{'portfolioId': 1, 'investorId': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class InvestorAccount {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String portfolioId;
    private String investorId;
    private String name;
    private InvestorStatus status = InvestorStatus.ACTIVE;
    private Instant createdAt;

    public static String idFor(String portfolioId, String investorId) {
        return portfolioId + ":" + investorId;
    }

    public boolean isActive() {
        return status == InvestorStatus.ACTIVE;
    }
}
