package com.fundradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface InvestorAccountRepository extends MongoRepository<InvestorAccount, String> {

    Optional<InvestorAccount> findByPortfolioIdAndInvestorId(String portfolioId, String investorId);

    List<InvestorAccount> findByPortfolioId(String portfolioId);
}
