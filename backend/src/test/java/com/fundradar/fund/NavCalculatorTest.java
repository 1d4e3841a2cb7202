package com.fundradar.fund;

import com.fundradar.bond.BondPortfolioService;
import com.fundradar.bond.BondValuation;
import com.fundradar.common.Money;
import com.fundradar.context.PortfolioContext;
import com.fundradar.domain.AssetClass;
import com.fundradar.domain.Indexer;
import com.fundradar.domain.NavSnapshot;
import com.fundradar.domain.NavSnapshotRepository;
import com.fundradar.ledger.PositionLedgerService;
import com.fundradar.ledger.PositionValuation;
import com.fundradar.pricing.FxRate;
import com.fundradar.pricing.FxRateService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NavCalculatorTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 6, 28);

    @Mock
    private PositionLedgerService positionLedgerService;
    @Mock
    private BondPortfolioService bondPortfolioService;
    @Mock
    private CashLedger cashLedger;
    @Mock
    private FeeEngine feeEngine;
    @Mock
    private FxRateService fxRateService;
    @Mock
    private NavSnapshotRepository navSnapshotRepository;

    @InjectMocks
    private NavCalculator navCalculator;

    private final PortfolioContext ctx = new PortfolioContext("fund-1", "BRL");

    private static PositionValuation position(AssetClass assetClass, String symbol, String currency, String value, boolean stale) {
        BigDecimal v = new BigDecimal(value);
        return new PositionValuation(assetClass, symbol, symbol, currency, BigDecimal.ONE, v, v, AS_OF,
                v, v, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, stale);
    }

    private static BondValuation bond(String accrued) {
        BigDecimal v = new BigDecimal(accrued);
        return new BondValuation("b1", "CDB", "Bank", "CDB", Indexer.CDI, new BigDecimal("100"), BigDecimal.ONE,
                v, v, BigDecimal.ZERO, BigDecimal.ZERO, AS_OF.minusYears(1), null, AS_OF, null, false, false,
                List.of(), "BRL");
    }

    private static InvestorStake stake(String id, String net, String pct) {
        return new InvestorStake(id, id, new BigDecimal(net), BigDecimal.ZERO, new BigDecimal(net), AS_OF, new BigDecimal(pct));
    }

    @Test
    @DisplayName("NAV is portfolio value plus cash minus outstanding fees, in base currency")
    void compute() {
        when(positionLedgerService.valuations(ctx, AssetClass.EQUITY, AS_OF))
                .thenReturn(List.of(position(AssetClass.EQUITY, "PETR4", "BRL", "500000", false)));
        when(positionLedgerService.valuations(ctx, AssetClass.CRYPTO, AS_OF))
                .thenReturn(List.of(position(AssetClass.CRYPTO, "BTC", "USD", "20000", true)));
        when(bondPortfolioService.valuations(ctx, AS_OF)).thenReturn(List.of(bond("300000")));
        when(fxRateService.rate("BRL", "BRL", AS_OF)).thenReturn(FxRate.identity("BRL"));
        when(fxRateService.rate("USD", "BRL", AS_OF)).thenReturn(new FxRate("USD", "BRL", new BigDecimal("5"), false));
        when(cashLedger.cashPosition(ctx, AS_OF)).thenReturn(Money.of("150000", "BRL"));
        when(feeEngine.outstandingFees(ctx, AS_OF)).thenReturn(new BigDecimal("50000"));

        NavSnapshot snapshot = navCalculator.compute(ctx, AS_OF);

        assertThat(snapshot.getEquityValue()).isEqualByComparingTo("500000");
        assertThat(snapshot.getCryptoValue()).isEqualByComparingTo("100000");
        assertThat(snapshot.getBondValue()).isEqualByComparingTo("300000");
        assertThat(snapshot.getPortfolioValue()).isEqualByComparingTo("900000");
        assertThat(snapshot.getNav()).isEqualByComparingTo("1000000");
        assertThat(snapshot.getId()).isEqualTo("fund-1:2024-06-28");
        assertThat(snapshot.getStaleSymbols()).containsExactly("BTC");
        assertThat(snapshot.isApproximated()).isTrue();
    }

    @Test
    void snapshot_persists() {
        when(cashLedger.cashPosition(ctx, AS_OF)).thenReturn(Money.of("1000", "BRL"));
        when(feeEngine.outstandingFees(ctx, AS_OF)).thenReturn(BigDecimal.ZERO);
        when(navSnapshotRepository.save(any(NavSnapshot.class))).thenAnswer(inv -> inv.getArgument(0));

        NavSnapshot snapshot = navCalculator.snapshot(ctx, AS_OF);

        assertThat(snapshot.getNav()).isEqualByComparingTo("1000.00");
        assertThat(snapshot.isApproximated()).isFalse();
        verify(navSnapshotRepository).save(snapshot);
    }

    @Test
    @DisplayName("allocations add up to NAV; the rounding residue goes to the largest stake")
    void allocate_conservesNav() {
        List<InvestorStake> stakes = List.of(
                stake("a", "100", "33.333333"),
                stake("b", "100", "33.333333"),
                stake("c", "100", "33.333334"));

        List<InvestorAllocation> allocations = NavCalculator.allocate(new BigDecimal("1000"), stakes);

        assertThat(allocations.stream().map(InvestorAllocation::investorNav).reduce(BigDecimal.ZERO, BigDecimal::add))
                .isEqualByComparingTo("1000.00");
        assertThat(allocations.get(0).investorId()).isEqualTo("c");
        assertThat(allocations.get(0).investorNav()).isEqualByComparingTo("333.34");
        assertThat(allocations.get(0).unrealizedGain()).isEqualByComparingTo("233.34");
    }

    @Test
    void allocate_splitsByStake() {
        List<InvestorAllocation> allocations = NavCalculator.allocate(new BigDecimal("1200000"), List.of(
                stake("alice", "600000", "60"),
                stake("bob", "400000", "40")));

        assertThat(allocations).extracting(InvestorAllocation::investorNav)
                .usingComparatorForType(BigDecimal::compareTo, BigDecimal.class)
                .containsExactly(new BigDecimal("720000"), new BigDecimal("480000"));
        assertThat(allocations.get(1).unrealizedGainPct()).isEqualByComparingTo("20");
    }

    @Test
    void allocate_withoutPositiveStakes_isEmpty() {
        assertThat(NavCalculator.allocate(new BigDecimal("1000"), List.of(stake("a", "0", "0")))).isEmpty();
        assertThat(NavCalculator.allocate(new BigDecimal("1000"), List.of())).isEmpty();
    }
}
