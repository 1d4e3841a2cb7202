package com.fundradar.timeseries;

import com.fundradar.common.DateWindow;
import com.fundradar.common.RetryPolicy;
import com.fundradar.common.Sleeper;
import com.fundradar.domain.FetchWindow;
import com.fundradar.domain.FetchWindowRepository;
import com.fundradar.domain.PriceBar;
import com.fundradar.marketdata.MarketDataException;
import com.fundradar.marketdata.MarketDataGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FetchWindowExecutorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 4, 9);

    @Mock
    private MarketDataGateway gateway;
    @Mock
    private PriceBarStore priceBarStore;
    @Mock
    private FetchWindowRepository fetchWindowRepository;

    private FetchWindowExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new FetchWindowExecutor(gateway, priceBarStore, fetchWindowRepository,
                new RetryPolicy(1, 10, 0, 3), Sleeper.NONE);
        when(fetchWindowRepository.save(any(FetchWindow.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static FetchWindow pending() {
        FetchWindow w = new FetchWindow();
        w.setId(FetchWindow.idFor("AAPL", START, END));
        w.setSymbol("AAPL");
        w.setWindowStart(START);
        w.setWindowEnd(END);
        w.setStatus(FetchWindow.WindowStatus.PENDING);
        return w;
    }

    @Test
    void execute_success_storesBarsAndCompletes() {
        PriceBar bar = new PriceBar();
        bar.setSymbol("AAPL");
        bar.setDate(START.plusDays(1));
        when(gateway.fetchDailyBars(eq("AAPL"), any(DateWindow.class)))
                .thenThrow(new MarketDataException("HTTP 503", true))
                .thenReturn(List.of(bar));
        when(priceBarStore.upsert(anyList())).thenReturn(1);

        FetchWindow result = executor.execute(pending());

        assertThat(result.getStatus()).isEqualTo(FetchWindow.WindowStatus.COMPLETE);
        assertThat(result.getRecordsStored()).isEqualTo(1);
        assertThat(result.getRetryCount()).isEqualTo(1);
        assertThat(result.getErrorMessage()).isNull();
    }

    @Test
    void execute_nonRetryableFailure_marksFailedWithoutStoring() {
        when(gateway.fetchDailyBars(eq("AAPL"), any(DateWindow.class)))
                .thenThrow(new MarketDataException("HTTP 400", false));

        FetchWindow result = executor.execute(pending());

        assertThat(result.getStatus()).isEqualTo(FetchWindow.WindowStatus.FAILED);
        assertThat(result.getErrorMessage()).isEqualTo("HTTP 400");
        verify(gateway, times(1)).fetchDailyBars(eq("AAPL"), any(DateWindow.class));
        verify(priceBarStore, never()).upsert(anyList());
    }

    @Test
    void execute_retriesExhausted_marksFailed() {
        when(gateway.fetchDailyBars(eq("AAPL"), any(DateWindow.class)))
                .thenThrow(new MarketDataException("HTTP 429", true));

        FetchWindow result = executor.execute(pending());

        assertThat(result.getStatus()).isEqualTo(FetchWindow.WindowStatus.FAILED);
        assertThat(result.getRetryCount()).isEqualTo(2);
        verify(gateway, times(3)).fetchDailyBars(eq("AAPL"), any(DateWindow.class));
    }
}
