package com.fundradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.LocalDate;
import java.util.List;

public interface FeeRecordRepository extends MongoRepository<FeeRecord, String> {

    boolean existsByPortfolioIdAndInvestorIdAndPeriodStartAndPeriodEndAndStatusIn(
            String portfolioId, String investorId, LocalDate periodStart, LocalDate periodEnd, List<FeeStatus> statuses);

    List<FeeRecord> findByPortfolioIdOrderByPeriodEndAsc(String portfolioId);

    /** Records whose date falls in [from, to], inclusive. */
    @Query(value = "{'portfolioId': ?0, 'date': {$gte: ?1, $lte: ?2}}", sort = "{'date': 1}")
    List<FeeRecord> findInRange(String portfolioId, LocalDate from, LocalDate to);
}
