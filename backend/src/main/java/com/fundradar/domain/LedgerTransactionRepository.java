package com.fundradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store for ledger transactions.
 */
public interface LedgerTransactionRepository extends MongoRepository<LedgerTransaction, String> {

    List<LedgerTransaction> findByPortfolioIdAndAssetClassOrderByDateAscSequenceAsc(String portfolioId, AssetClass assetClass);

    List<LedgerTransaction> findByPortfolioIdAndAssetClassAndSymbolOrderByDateAscSequenceAsc(
            String portfolioId, AssetClass assetClass, String symbol);

    Optional<LedgerTransaction> findFirstByPortfolioIdOrderBySequenceDesc(String portfolioId);

    Optional<LedgerTransaction> findFirstByPortfolioIdAndAssetClassOrderByDateDescSequenceDesc(String portfolioId, AssetClass assetClass);

    /** Transactions dated on or before {@code asOf}, in replay order. */
    List<LedgerTransaction> findByPortfolioIdAndAssetClassAndDateLessThanEqualOrderByDateAscSequenceAsc(
            String portfolioId, AssetClass assetClass, LocalDate asOf);
}
