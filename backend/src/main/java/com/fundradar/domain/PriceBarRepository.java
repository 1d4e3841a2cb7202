package com.fundradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read/maintenance access to price_history. Writes go through PriceBarStore bulk upserts.
 */
public interface PriceBarRepository extends MongoRepository<PriceBar, String> {

    /** Inclusive on both ends. */
    @Query(value = "{'symbol': ?0, 'date': {$gte: ?1, $lte: ?2}}", sort = "{'date': 1}")
    List<PriceBar> findInRange(String symbol, LocalDate from, LocalDate to);

    Optional<PriceBar> findFirstBySymbolAndDateLessThanEqualOrderByDateDesc(String symbol, LocalDate date);

    Optional<PriceBar> findFirstBySymbolOrderByDateAsc(String symbol);

    Optional<PriceBar> findFirstBySymbolOrderByDateDesc(String symbol);

    long countBySymbol(String symbol);

    long deleteBySymbol(String symbol);

    long deleteByDateBefore(LocalDate cutoff);
}
