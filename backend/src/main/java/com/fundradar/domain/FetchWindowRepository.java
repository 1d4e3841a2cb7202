package com.fundradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

/**
 * Persistence for window-level fetch progress.
 */
public interface FetchWindowRepository extends MongoRepository<FetchWindow, String> {

    List<FetchWindow> findBySymbolAndStatusInOrderByWindowStartAsc(String symbol, Collection<FetchWindow.WindowStatus> statuses);

    long countBySymbolAndStatus(String symbol, FetchWindow.WindowStatus status);

    void deleteBySymbol(String symbol);
}
