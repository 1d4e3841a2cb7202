package com.fundradar.fund;

import com.fundradar.context.PortfolioContext;
import com.fundradar.fund.config.FundProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PortfolioContextRegistryTest {

    @Test
    void samePortfolio_sharesOneContext() {
        FundProperties properties = new FundProperties();
        properties.setBaseCurrency("usd");
        PortfolioContextRegistry registry = new PortfolioContextRegistry(properties);

        PortfolioContext first = registry.forPortfolio("fund-1");

        assertThat(registry.forPortfolio("fund-1")).isSameAs(first);
        assertThat(registry.forPortfolio("fund-2")).isNotSameAs(first);
        assertThat(first.baseCurrency()).isEqualTo("USD");
    }

    @Test
    void writerMayReadUnderItsOwnLock() {
        PortfolioContext ctx = new PortfolioContext("fund-1", "BRL");

        String result = ctx.write(() -> {
            assertThat(ctx.isWriteLockedByCurrentThread()).isTrue();
            return ctx.read(() -> "nested");
        });

        assertThat(result).isEqualTo("nested");
        assertThat(ctx.isWriteLockedByCurrentThread()).isFalse();
    }
}
