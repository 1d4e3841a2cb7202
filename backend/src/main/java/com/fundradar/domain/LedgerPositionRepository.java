package com.fundradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for materialized positions. Used by the position ledger service and the aggregator read path.
 */
public interface LedgerPositionRepository extends MongoRepository<LedgerPosition, String> {

    List<LedgerPosition> findByPortfolioIdAndAssetClass(String portfolioId, AssetClass assetClass);

    void deleteByPortfolioIdAndAssetClass(String portfolioId, AssetClass assetClass);
}
