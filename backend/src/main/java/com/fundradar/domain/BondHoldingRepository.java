package com.fundradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface BondHoldingRepository extends MongoRepository<BondHolding, String> {

    List<BondHolding> findByPortfolioId(String portfolioId);
}
