package com.fundradar.fund;

import com.fundradar.context.PortfolioContext;
import com.fundradar.fund.config.FundProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link PortfolioContext} per portfolio id so every writer of a portfolio shares the same lock.
 */
@Component
@RequiredArgsConstructor
public class PortfolioContextRegistry {

    private final FundProperties fundProperties;
    private final Map<String, PortfolioContext> contexts = new ConcurrentHashMap<>();

    public PortfolioContext forPortfolio(String portfolioId) {
        return contexts.computeIfAbsent(portfolioId, id -> new PortfolioContext(id, fundProperties.getBaseCurrency()));
    }
}
