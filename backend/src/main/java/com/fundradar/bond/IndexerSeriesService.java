package com.fundradar.bond;

import com.fundradar.common.DateWindow;
import com.fundradar.common.RetryPolicy;
import com.fundradar.common.Sleeper;
import com.fundradar.config.CaffeineConfig;
import com.fundradar.domain.Indexer;
import com.fundradar.domain.IndexerRate;
import com.fundradar.domain.IndexerRateRepository;
import com.fundradar.marketdata.IndexerSeriesGateway;
import com.fundradar.marketdata.MarketDataException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Cached IPCA / CDI / SELIC series. Reads never touch the network; {@link #refresh} pulls from the gateway.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IndexerSeriesService {

    private final IndexerRateRepository indexerRateRepository;
    private final IndexerSeriesGateway indexerSeriesGateway;
    private final RetryPolicy marketDataRetryPolicy;
    private final Sleeper sleeper;

    @Cacheable(cacheNames = CaffeineConfig.INDEXER_SERIES_CACHE, key = "#indexer + '-' + #from + '-' + #to")
    public List<IndexerRate> series(Indexer indexer, LocalDate from, LocalDate to) {
        return indexerRateRepository.findInRange(indexer, from, to);
    }

    /**
     * Fetches the indexer series for the window and upserts it.
     *
     * @return number of rates stored
     * @throws MarketDataException when retries are exhausted
     */
    @CacheEvict(cacheNames = CaffeineConfig.INDEXER_SERIES_CACHE, allEntries = true)
    public int refresh(Indexer indexer, LocalDate from, LocalDate to) {
        if (indexer == Indexer.PREFIXADO) {
            return 0;
        }
        DateWindow window = new DateWindow(from, to);
        List<IndexerRate> rates = marketDataRetryPolicy.execute(
                () -> indexerSeriesGateway.fetchSeries(indexer, window),
                e -> e instanceof MarketDataException m && m.isRetryable(),
                sleeper);
        indexerRateRepository.saveAll(rates);
        log.info("Stored {} {} rate(s) for {}", rates.size(), indexer, window);
        return rates.size();
    }

    public LocalDate latestDate(Indexer indexer) {
        return indexerRateRepository.findFirstByIndexerOrderByDateDesc(indexer)
                .map(IndexerRate::getDate)
                .orElse(null);
    }
}
