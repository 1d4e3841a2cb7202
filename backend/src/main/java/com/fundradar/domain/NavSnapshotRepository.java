package com.fundradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface NavSnapshotRepository extends MongoRepository<NavSnapshot, String> {

    Optional<NavSnapshot> findByPortfolioIdAndDate(String portfolioId, LocalDate date);

    /** Inclusive on both ends. */
    @Query(value = "{'portfolioId': ?0, 'date': {$gte: ?1, $lte: ?2}}", sort = "{'date': 1}")
    List<NavSnapshot> findInRange(String portfolioId, LocalDate from, LocalDate to);
}
