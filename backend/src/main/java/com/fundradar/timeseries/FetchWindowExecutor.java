package com.fundradar.timeseries;

import com.fundradar.common.DateWindow;
import com.fundradar.common.RetryPolicy;
import com.fundradar.common.Sleeper;
import com.fundradar.domain.FetchWindow;
import com.fundradar.domain.FetchWindowRepository;
import com.fundradar.domain.PriceBar;
import com.fundradar.marketdata.MarketDataException;
import com.fundradar.marketdata.MarketDataGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one fetch window: RUNNING → gateway call with backoff → upsert → COMPLETE, or FAILED once retries are
 * exhausted. A failed window never touches bars stored by other windows.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FetchWindowExecutor {

    private static final int MAX_ERROR_LENGTH = 500;

    private final MarketDataGateway gateway;
    private final PriceBarStore priceBarStore;
    private final FetchWindowRepository fetchWindowRepository;
    private final RetryPolicy marketDataRetryPolicy;
    private final Sleeper sleeper;

    /** Persists a PENDING record for a newly planned window, unless one already exists. */
    public FetchWindow plan(String symbol, DateWindow window) {
        String id = FetchWindow.idFor(symbol, window.start(), window.end());
        return fetchWindowRepository.findById(id).orElseGet(() -> {
            FetchWindow w = new FetchWindow();
            w.setId(id);
            w.setSymbol(symbol);
            w.setWindowStart(window.start());
            w.setWindowEnd(window.end());
            w.setStatus(FetchWindow.WindowStatus.PENDING);
            w.setRetryCount(0);
            w.setUpdatedAt(Instant.now());
            return fetchWindowRepository.save(w);
        });
    }

    /**
     * @return the window in its terminal state (COMPLETE or FAILED)
     */
    public FetchWindow execute(FetchWindow window) {
        DateWindow range = new DateWindow(window.getWindowStart(), window.getWindowEnd());
        window.setStatus(FetchWindow.WindowStatus.RUNNING);
        window.setStartedAt(Instant.now());
        window.setUpdatedAt(Instant.now());
        fetchWindowRepository.save(window);

        AtomicInteger attempts = new AtomicInteger();
        try {
            List<PriceBar> bars = marketDataRetryPolicy.execute(() -> {
                        if (attempts.incrementAndGet() > 1) {
                            log.debug("Retrying {} {} (attempt {})", window.getSymbol(), range, attempts.get());
                        }
                        return gateway.fetchDailyBars(window.getSymbol(), range);
                    },
                    FetchWindowExecutor::isRetryable,
                    sleeper);
            int stored = priceBarStore.upsert(bars);
            window.setStatus(FetchWindow.WindowStatus.COMPLETE);
            window.setRecordsStored(stored);
            window.setErrorMessage(null);
            window.setCompletedAt(Instant.now());
            log.debug("Window {} {} complete: {} bars, {} rows changed", window.getSymbol(), range, bars.size(), stored);
        } catch (RuntimeException e) {
            window.setStatus(FetchWindow.WindowStatus.FAILED);
            window.setErrorMessage(truncate(e.getMessage()));
            log.warn("Window {} {} failed after {} attempt(s): {}", window.getSymbol(), range, attempts.get(), e.getMessage());
        }
        window.setRetryCount(window.getRetryCount() + Math.max(0, attempts.get() - 1));
        window.setUpdatedAt(Instant.now());
        return fetchWindowRepository.save(window);
    }

    static boolean isRetryable(RuntimeException e) {
        return e instanceof MarketDataException m && m.isRetryable();
    }

    private static String truncate(String message) {
        if (message == null) {
            return "unknown error";
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
