package com.fundradar.bond;

import com.fundradar.context.PortfolioContext;
import com.fundradar.domain.BondHolding;
import com.fundradar.domain.BondHoldingRepository;
import com.fundradar.domain.Indexer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BondPortfolioServiceTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 6, 1);

    @Mock
    private BondHoldingRepository bondHoldingRepository;
    @Mock
    private IndexerSeriesService indexerSeriesService;

    private BondPortfolioService service;
    private final PortfolioContext ctx = new PortfolioContext("fund-1", "BRL");

    @BeforeEach
    void setUp() {
        service = new BondPortfolioService(bondHoldingRepository, new BondIndexationEngine(indexerSeriesService));
    }

    private static BondHolding prefixado(String id, String type, String invested, LocalDate application, LocalDate maturity) {
        BondHolding b = new BondHolding();
        b.setId(id);
        b.setPortfolioId("fund-1");
        b.setTitle(id);
        b.setBondType(type);
        b.setIndexer(Indexer.PREFIXADO);
        b.setRate(BigDecimal.ZERO);
        b.setQuantity(BigDecimal.ONE);
        b.setInvestedValue(new BigDecimal(invested));
        b.setApplicationDate(application);
        b.setMaturityDate(maturity);
        return b;
    }

    @Test
    void summaryAndSchedule() {
        when(bondHoldingRepository.findByPortfolioId("fund-1")).thenReturn(List.of(
                prefixado("cdb", "CDB", "3000", LocalDate.of(2023, 1, 1), LocalDate.of(2024, 6, 20)),
                prefixado("lci", "LCI", "1000", LocalDate.of(2023, 1, 1), LocalDate.of(2024, 8, 15)),
                prefixado("old", "CDB", "1000", LocalDate.of(2022, 1, 1), LocalDate.of(2024, 1, 1)),
                prefixado("future", "CDB", "5000", LocalDate.of(2024, 7, 1), LocalDate.of(2026, 1, 1))));

        BondPortfolioSummary summary = service.summary(ctx, AS_OF);

        assertThat(summary.bonds()).isEqualTo(3);
        assertThat(summary.activeBonds()).isEqualTo(2);
        assertThat(summary.totalInvested()).isEqualByComparingTo("5000");
        assertThat(summary.currentValue()).isEqualByComparingTo("5000");
        assertThat(summary.maturingWithin30Days()).isEqualTo(1);
        assertThat(summary.maturingWithin90Days()).isEqualTo(2);

        List<MaturityBucket> schedule = service.maturitySchedule(ctx, AS_OF);
        assertThat(schedule).extracting(MaturityBucket::month)
                .containsExactly(YearMonth.of(2024, 6), YearMonth.of(2024, 8));

        List<BondAllocation> byType = service.allocationByType(ctx, AS_OF);
        assertThat(byType.get(0).key()).isEqualTo("CDB");
        assertThat(byType.get(0).allocationPct()).isEqualByComparingTo("80");
        assertThat(byType.get(0).bonds()).isEqualTo(2);
    }
}
