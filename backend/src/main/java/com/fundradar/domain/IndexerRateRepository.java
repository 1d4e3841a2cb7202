package com.fundradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface IndexerRateRepository extends MongoRepository<IndexerRate, String> {

    /** Inclusive on both ends. */
    @Query(value = "{'indexer': ?0, 'date': {$gte: ?1, $lte: ?2}}", sort = "{'date': 1}")
    List<IndexerRate> findInRange(Indexer indexer, LocalDate from, LocalDate to);

    Optional<IndexerRate> findFirstByIndexerOrderByDateDesc(Indexer indexer);
}
