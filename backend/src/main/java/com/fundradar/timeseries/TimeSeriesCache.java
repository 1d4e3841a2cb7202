package com.fundradar.timeseries;

import com.fundradar.common.DateWindow;
import com.fundradar.common.Sleeper;
import com.fundradar.config.AsyncConfig;
import com.fundradar.domain.FetchWindow;
import com.fundradar.domain.FetchWindowRepository;
import com.fundradar.domain.PriceBar;
import com.fundradar.domain.PriceBarRepository;
import com.fundradar.domain.SymbolMetadata;
import com.fundradar.domain.SymbolMetadataRepository;
import com.fundradar.marketdata.config.MarketDataProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Durable per-symbol price history with incremental fetch.
 * <p>
 * A fetch first re-runs the symbol's unfinished windows (PENDING, RUNNING left by a crash, FAILED), then requests only
 * the ranges outside the covered [firstDate, lastDate] of {@link SymbolMetadata}. New windows are recorded as PENDING
 * before any network call, so coverage can be extended to the requested range while unfinished windows keep track of
 * holes. Once the windows have run, {@code lastDate} is pulled back to the newest stored bar, so days that returned no
 * bar yet are requested again. A repeat fetch over a covered range makes no gateway call and writes nothing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TimeSeriesCache {

    private static final EnumSet<FetchWindow.WindowStatus> UNFINISHED = EnumSet.of(
            FetchWindow.WindowStatus.PENDING,
            FetchWindow.WindowStatus.RUNNING,
            FetchWindow.WindowStatus.FAILED);

    private final PriceBarRepository priceBarRepository;
    private final SymbolMetadataRepository symbolMetadataRepository;
    private final FetchWindowRepository fetchWindowRepository;
    private final FetchWindowExecutor fetchWindowExecutor;
    private final MarketDataProperties properties;
    private final Sleeper sleeper;

    public FetchReport fetch(String symbol, LocalDate start, LocalDate end) {
        return fetch(symbol, start, end, properties.getBatchDays(), CancellationToken.none());
    }

    public FetchReport fetch(String symbol, LocalDate start, LocalDate end, int batchDays, CancellationToken cancellation) {
        DateWindow requested = new DateWindow(start, end != null ? end : LocalDate.now());
        SymbolMetadata metadata = symbolMetadataRepository.findById(symbol).orElse(null);

        List<FetchWindow> unfinished = fetchWindowRepository.findBySymbolAndStatusInOrderByWindowStartAsc(symbol, UNFINISHED);
        List<DateWindow> gaps = FetchGapPlanner.windows(metadata, requested, batchDays);
        if (unfinished.isEmpty() && gaps.isEmpty()) {
            log.debug("{}: {} already cached", symbol, requested);
            return FetchReport.upToDate(symbol);
        }

        Map<String, FetchWindow> queue = new LinkedHashMap<>();
        unfinished.forEach(w -> queue.put(w.getId(), w));
        for (DateWindow gap : gaps) {
            FetchWindow planned = fetchWindowExecutor.plan(symbol, gap);
            queue.putIfAbsent(planned.getId(), planned);
        }
        SymbolMetadata coverage = gaps.isEmpty() ? metadata : extendCoverage(symbol, metadata, requested);
        log.info("Fetching {} {}: {} window(s), {} carried over", symbol, requested, queue.size(), unfinished.size());

        int completed = 0;
        int failed = 0;
        int stored = 0;
        boolean cancelled = false;
        boolean first = true;
        for (FetchWindow window : queue.values()) {
            if (cancellation.isCancelled()) {
                cancelled = true;
                break;
            }
            if (!first) {
                sleeper.sleep(properties.getInterBatchDelayMs());
            }
            first = false;
            FetchWindow result = fetchWindowExecutor.execute(window);
            if (result.getStatus() == FetchWindow.WindowStatus.COMPLETE) {
                completed++;
                stored += result.getRecordsStored();
            } else {
                failed++;
            }
        }
        if (coverage != null) {
            reconcileCoverage(coverage);
        }

        FetchReport report = new FetchReport(symbol, queue.size(), completed, failed, stored, cancelled, false);
        if (failed > 0) {
            log.warn("{}: {} of {} window(s) failed; they are retried on the next fetch", symbol, failed, queue.size());
        } else {
            log.info("{}: {} window(s) complete, {} row(s) stored{}", symbol, completed, stored, cancelled ? " (cancelled)" : "");
        }
        return report;
    }

    /**
     * Fetches each symbol in turn with the inter-symbol delay. One symbol failing never aborts the others;
     * cancellation stops before the next window or symbol.
     */
    public BulkFetchReport bulkFetch(Collection<String> symbols, LocalDate start, LocalDate end, int batchDays,
                                     CancellationToken cancellation) {
        List<FetchReport> reports = new ArrayList<>();
        Map<String, String> errors = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        boolean first = true;
        for (String symbol : new LinkedHashSet<>(symbols)) {
            if (cancellation.isCancelled()) {
                skipped.add(symbol);
                continue;
            }
            if (!first) {
                sleeper.sleep(properties.getInterSymbolDelayMs());
            }
            first = false;
            try {
                reports.add(fetch(symbol, start, end, batchDays, cancellation));
            } catch (RuntimeException e) {
                log.warn("Bulk fetch of {} failed: {}", symbol, e.getMessage());
                errors.put(symbol, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }
        BulkFetchReport report = new BulkFetchReport(reports, errors, skipped, cancellation.isCancelled());
        log.info("Bulk fetch of {} symbol(s): {} row(s) stored, {} error(s), {} skipped",
                symbols.size(), report.totalRecordsStored(), errors.size(), skipped.size());
        return report;
    }

    @Async(AsyncConfig.MARKET_DATA_EXECUTOR)
    public CompletableFuture<BulkFetchReport> bulkFetchAsync(Collection<String> symbols, LocalDate start, LocalDate end,
                                                             CancellationToken cancellation) {
        return CompletableFuture.completedFuture(bulkFetch(symbols, start, end, properties.getBatchDays(), cancellation));
    }

    /** Drops everything cached for the symbol, then fetches the range again. */
    public FetchReport forceRefresh(String symbol, LocalDate start, LocalDate end) {
        long deleted = priceBarRepository.deleteBySymbol(symbol);
        symbolMetadataRepository.deleteById(symbol);
        fetchWindowRepository.deleteBySymbol(symbol);
        log.info("{}: force refresh dropped {} cached row(s)", symbol, deleted);
        return fetch(symbol, start, end, properties.getBatchDays(), CancellationToken.none());
    }

    public List<PriceBar> history(String symbol, LocalDate start, LocalDate end) {
        return priceBarRepository.findInRange(symbol, start, end);
    }

    /** Latest bar dated on or before {@code asOf}. */
    public Optional<PriceBar> latestBar(String symbol, LocalDate asOf) {
        return priceBarRepository.findFirstBySymbolAndDateLessThanEqualOrderByDateDesc(symbol, asOf);
    }

    public CacheStats stats() {
        List<SymbolMetadata> all = symbolMetadataRepository.findAll();
        List<CacheStats.SymbolStats> symbols = all.stream()
                .sorted(Comparator.comparing(SymbolMetadata::getSymbol))
                .map(m -> new CacheStats.SymbolStats(m.getSymbol(), m.getFirstDate(), m.getLastDate(),
                        m.getTotalRecords(), m.getLastUpdated()))
                .toList();
        LocalDate earliest = all.stream().map(SymbolMetadata::getFirstDate).filter(d -> d != null)
                .min(Comparator.naturalOrder()).orElse(null);
        LocalDate latest = all.stream().map(SymbolMetadata::getLastDate).filter(d -> d != null)
                .max(Comparator.naturalOrder()).orElse(null);
        return new CacheStats(all.size(), priceBarRepository.count(), earliest, latest, symbols);
    }

    /**
     * Deletes bars older than {@code today - daysToKeep} and moves each symbol's covered start to the cutoff.
     *
     * @return number of bars deleted
     */
    public long clearOldData(int daysToKeep, LocalDate today) {
        if (daysToKeep < 0) {
            throw new IllegalArgumentException("daysToKeep must not be negative");
        }
        LocalDate cutoff = today.minusDays(daysToKeep);
        long deleted = priceBarRepository.deleteByDateBefore(cutoff);
        for (SymbolMetadata m : symbolMetadataRepository.findAll()) {
            if (m.getFirstDate() != null && m.getFirstDate().isBefore(cutoff)) {
                if (m.getLastDate() != null && m.getLastDate().isBefore(cutoff)) {
                    m.setFirstDate(null);
                    m.setLastDate(null);
                } else {
                    m.setFirstDate(cutoff);
                }
            }
            m.setTotalRecords(priceBarRepository.countBySymbol(m.getSymbol()));
            m.setLastUpdated(Instant.now());
            symbolMetadataRepository.save(m);
        }
        log.info("Cleared {} bar(s) dated before {}", deleted, cutoff);
        return deleted;
    }

    private SymbolMetadata extendCoverage(String symbol, SymbolMetadata existing, DateWindow requested) {
        SymbolMetadata m = existing != null ? existing : new SymbolMetadata();
        m.setSymbol(symbol);
        if (!m.hasCoverage()) {
            m.setFirstDate(requested.start());
            m.setLastDate(requested.end());
        } else {
            if (requested.start().isBefore(m.getFirstDate())) {
                m.setFirstDate(requested.start());
            }
            if (requested.end().isAfter(m.getLastDate())) {
                m.setLastDate(requested.end());
            }
        }
        m.setLastUpdated(Instant.now());
        symbolMetadataRepository.save(m);
        return m;
    }

    private void reconcileCoverage(SymbolMetadata m) {
        Optional<LocalDate> newest = priceBarRepository.findFirstBySymbolOrderByDateDesc(m.getSymbol())
                .map(PriceBar::getDate);
        if (m.hasCoverage()) {
            if (newest.isEmpty() || newest.get().isBefore(m.getFirstDate())) {
                m.setFirstDate(null);
                m.setLastDate(null);
            } else if (newest.get().isBefore(m.getLastDate())) {
                log.debug("{}: coverage end pulled back from {} to {}", m.getSymbol(), m.getLastDate(), newest.get());
                m.setLastDate(newest.get());
            }
        }
        m.setTotalRecords(priceBarRepository.countBySymbol(m.getSymbol()));
        m.setLastUpdated(Instant.now());
        symbolMetadataRepository.save(m);
    }
}
