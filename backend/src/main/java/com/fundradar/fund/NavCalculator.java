package com.fundradar.fund;

import com.fundradar.bond.BondPortfolioService;
import com.fundradar.bond.BondValuation;
import com.fundradar.common.Money;
import com.fundradar.context.PortfolioContext;
import com.fundradar.domain.AssetClass;
import com.fundradar.domain.NavSnapshot;
import com.fundradar.domain.NavSnapshotRepository;
import com.fundradar.ledger.PositionLedgerService;
import com.fundradar.ledger.PositionValuation;
import com.fundradar.pricing.FxRate;
import com.fundradar.pricing.FxRateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Fund NAV: {@code portfolio value + cash position - outstanding fees}, in base currency.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NavCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PositionLedgerService positionLedgerService;
    private final BondPortfolioService bondPortfolioService;
    private final CashLedger cashLedger;
    private final FeeEngine feeEngine;
    private final FxRateService fxRateService;
    private final NavSnapshotRepository navSnapshotRepository;

    /** Computes the NAV as of {@code asOf} without storing it. */
    public NavSnapshot compute(PortfolioContext ctx, LocalDate asOf) {
        return ctx.read(() -> {
            NavComponents components = new NavComponents(ctx.baseCurrency());
            for (AssetClass assetClass : List.of(AssetClass.EQUITY, AssetClass.CRYPTO)) {
                for (PositionValuation v : positionLedgerService.valuations(ctx, assetClass, asOf)) {
                    components.addPosition(v, fxRateService.rate(v.currency(), ctx.baseCurrency(), asOf));
                }
            }
            for (BondValuation b : bondPortfolioService.valuations(ctx, asOf)) {
                components.addBond(b, fxRateService.rate(b.currency(), ctx.baseCurrency(), asOf));
            }
            components.cash = cashLedger.cashPosition(ctx, asOf).amount();
            components.outstandingFees = feeEngine.outstandingFees(ctx, asOf);
            return components.toSnapshot(ctx.portfolioId(), asOf);
        });
    }

    /** Computes and upserts the snapshot for (portfolio, {@code asOf}). */
    public NavSnapshot snapshot(PortfolioContext ctx, LocalDate asOf) {
        return ctx.write(() -> {
            NavSnapshot snapshot = navSnapshotRepository.save(compute(ctx, asOf));
            log.info("Portfolio {}: NAV {} {} on {}{}", ctx.portfolioId(), snapshot.getNav(), snapshot.getCurrency(),
                    asOf, snapshot.isApproximated() ? " (approximated)" : "");
            return snapshot;
        });
    }

    public BigDecimal nav(PortfolioContext ctx, LocalDate asOf) {
        return compute(ctx, asOf).getNav();
    }

    public Optional<NavSnapshot> storedSnapshot(PortfolioContext ctx, LocalDate date) {
        return ctx.read(() -> navSnapshotRepository.findByPortfolioIdAndDate(ctx.portfolioId(), date));
    }

    public List<NavSnapshot> storedSeries(PortfolioContext ctx, LocalDate from, LocalDate to) {
        return ctx.read(() -> navSnapshotRepository.findInRange(ctx.portfolioId(), from, to));
    }

    /**
     * Splits {@code nav} by stake. Each share is rounded to cents and the residue goes to the largest stake, so
     * the shares add up to {@code nav} rounded to cents. Empty when no investor has a positive stake.
     */
    public List<InvestorAllocation> allocateToInvestors(PortfolioContext ctx, BigDecimal nav, LocalDate asOf) {
        return ctx.read(() -> allocate(nav, cashLedger.stakes(ctx, asOf)));
    }

    static List<InvestorAllocation> allocate(BigDecimal nav, List<InvestorStake> stakes) {
        BigDecimal fundNav = nav.setScale(Money.SCALE, RoundingMode.HALF_UP);
        BigDecimal totalPct = stakes.stream().map(InvestorStake::stakePct).reduce(BigDecimal.ZERO, BigDecimal::add);
        if (totalPct.signum() <= 0) {
            return List.of();
        }
        List<BigDecimal> shares = new ArrayList<>();
        BigDecimal allocated = BigDecimal.ZERO;
        int largest = 0;
        for (int i = 0; i < stakes.size(); i++) {
            InvestorStake s = stakes.get(i);
            BigDecimal share = fundNav.multiply(s.stakePct()).divide(totalPct, Money.SCALE, RoundingMode.HALF_UP);
            shares.add(share);
            allocated = allocated.add(share);
            if (s.stakePct().compareTo(stakes.get(largest).stakePct()) > 0) {
                largest = i;
            }
        }
        BigDecimal residue = fundNav.subtract(allocated);
        shares.set(largest, shares.get(largest).add(residue));

        List<InvestorAllocation> allocations = new ArrayList<>();
        for (int i = 0; i < stakes.size(); i++) {
            InvestorStake s = stakes.get(i);
            BigDecimal share = shares.get(i);
            BigDecimal gain = share.subtract(s.netContribution());
            BigDecimal gainPct = s.netContribution().signum() > 0
                    ? gain.multiply(HUNDRED).divide(s.netContribution(), 4, RoundingMode.HALF_UP)
                    : BigDecimal.ZERO;
            allocations.add(new InvestorAllocation(s.investorId(), s.investorName(), s.stakePct(), share,
                    s.netContribution(), gain, gainPct));
        }
        allocations.sort(Comparator.comparing(InvestorAllocation::investorNav).reversed());
        return allocations;
    }

    /** Running totals for one valuation date. */
    static final class NavComponents {

        private final String currency;
        BigDecimal equity = BigDecimal.ZERO;
        BigDecimal crypto = BigDecimal.ZERO;
        BigDecimal bonds = BigDecimal.ZERO;
        BigDecimal cash = BigDecimal.ZERO;
        BigDecimal outstandingFees = BigDecimal.ZERO;
        boolean approximated;
        final Set<String> staleSymbols = new TreeSet<>();

        NavComponents(String currency) {
            this.currency = currency;
        }

        void addPosition(PositionValuation v, FxRate fx) {
            BigDecimal value = fx.convert(v.marketValue());
            if (v.assetClass() == AssetClass.CRYPTO) {
                crypto = crypto.add(value);
            } else {
                equity = equity.add(value);
            }
            approximated |= fx.approximated();
            if (v.priceStale()) {
                staleSymbols.add(v.symbol());
            }
        }

        void addBond(BondValuation b, FxRate fx) {
            bonds = bonds.add(fx.convert(b.accruedValue()));
            approximated |= fx.approximated() || b.approximated();
        }

        NavSnapshot toSnapshot(String portfolioId, LocalDate date) {
            NavSnapshot s = new NavSnapshot();
            s.setId(NavSnapshot.idFor(portfolioId, date));
            s.setPortfolioId(portfolioId);
            s.setDate(date);
            s.setCurrency(currency);
            s.setEquityValue(money(equity));
            s.setCryptoValue(money(crypto));
            s.setBondValue(money(bonds));
            BigDecimal portfolioValue = money(equity).add(money(crypto)).add(money(bonds));
            s.setPortfolioValue(portfolioValue);
            s.setCashPosition(money(cash));
            s.setOutstandingFees(money(outstandingFees));
            s.setNav(portfolioValue.add(money(cash)).subtract(money(outstandingFees)));
            s.setApproximated(approximated || !staleSymbols.isEmpty());
            s.setStaleSymbols(new ArrayList<>(staleSymbols));
            s.setComputedAt(Instant.now());
            return s;
        }

        private static BigDecimal money(BigDecimal v) {
            return v.setScale(Money.SCALE, RoundingMode.HALF_UP);
        }
    }
}
