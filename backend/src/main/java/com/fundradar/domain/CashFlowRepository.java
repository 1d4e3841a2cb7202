package com.fundradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.List;

/**
 * Append-only cash-flow ledger. No update or delete operations are used by the application.
 */
public interface CashFlowRepository extends MongoRepository<CashFlow, String> {

    List<CashFlow> findByPortfolioIdAndDateLessThanEqualOrderByDateAsc(String portfolioId, LocalDate asOf);

    List<CashFlow> findByPortfolioIdAndInvestorIdOrderByDateAsc(String portfolioId, String investorId);

    List<CashFlow> findByPortfolioIdOrderByDateAsc(String portfolioId);
}
