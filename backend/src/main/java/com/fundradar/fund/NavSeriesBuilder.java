package com.fundradar.fund;

import com.fundradar.bond.BondIndexationEngine;
import com.fundradar.bond.BondPortfolioService;
import com.fundradar.bond.BondValuation;
import com.fundradar.bond.IndexerSeriesService;
import com.fundradar.context.PortfolioContext;
import com.fundradar.domain.AssetClass;
import com.fundradar.domain.BondHolding;
import com.fundradar.domain.CashFlow;
import com.fundradar.domain.CashFlowRepository;
import com.fundradar.domain.FeeRecord;
import com.fundradar.domain.FeeRecordRepository;
import com.fundradar.domain.FeeStatus;
import com.fundradar.domain.Indexer;
import com.fundradar.domain.IndexerRate;
import com.fundradar.domain.LedgerPosition;
import com.fundradar.domain.LedgerTransaction;
import com.fundradar.domain.NavSnapshot;
import com.fundradar.domain.NavSnapshotRepository;
import com.fundradar.ledger.PositionLedger;
import com.fundradar.ledger.PositionLedgerService;
import com.fundradar.ledger.PositionValuation;
import com.fundradar.pricing.FxRateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Daily NAV series over a date range in one pass: transactions and cash flows are loaded once and applied to
 * in-memory ledgers as each day is reached. Weekends are skipped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NavSeriesBuilder {

    private final PositionLedgerService positionLedgerService;
    private final BondPortfolioService bondPortfolioService;
    private final IndexerSeriesService indexerSeriesService;
    private final CashFlowRepository cashFlowRepository;
    private final FeeRecordRepository feeRecordRepository;
    private final NavSnapshotRepository navSnapshotRepository;
    private final FxRateService fxRateService;

    /**
     * @param persist also upsert each day's snapshot
     */
    public List<NavSnapshot> build(PortfolioContext ctx, LocalDate from, LocalDate to, boolean persist) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Series must end on or after it starts: " + from + ".." + to);
        }
        return persist ? ctx.write(() -> buildLocked(ctx, from, to, true)) : ctx.read(() -> buildLocked(ctx, from, to, false));
    }

    private List<NavSnapshot> buildLocked(PortfolioContext ctx, LocalDate from, LocalDate to, boolean persist) {
        List<Replay> replays = new ArrayList<>();
        for (AssetClass assetClass : List.of(AssetClass.EQUITY, AssetClass.CRYPTO)) {
            replays.add(new Replay(positionLedgerService.newLedger(ctx, assetClass),
                    positionLedgerService.transactionsUpTo(ctx, assetClass, to)));
        }
        List<BondHolding> bonds = bondPortfolioService.holdings(ctx);
        Map<String, List<IndexerRate>> bondSeries = new HashMap<>();
        for (BondHolding b : bonds) {
            if (b.getIndexer() != Indexer.PREFIXADO && b.getApplicationDate().isBefore(to)) {
                bondSeries.put(b.getId(), indexerSeriesService.series(b.getIndexer(), b.getApplicationDate(), to));
            }
        }
        List<CashFlow> flows = cashFlowRepository.findByPortfolioIdAndDateLessThanEqualOrderByDateAsc(ctx.portfolioId(), to);
        List<FeeRecord> fees = feeRecordRepository.findByPortfolioIdOrderByPeriodEndAsc(ctx.portfolioId()).stream()
                .filter(f -> f.getStatus() != FeeStatus.PENDING && f.getAmount() != null)
                .toList();

        Map<String, BigDecimal> cashByCurrency = new TreeMap<>();
        int nextFlow = 0;
        List<NavSnapshot> series = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            for (Replay r : replays) {
                r.advanceTo(day);
            }
            while (nextFlow < flows.size() && !flows.get(nextFlow).getDate().isAfter(day)) {
                CashFlow f = flows.get(nextFlow++);
                String ccy = f.getCurrency() == null ? ctx.baseCurrency() : f.getCurrency();
                cashByCurrency.merge(ccy, f.signedAmount(), BigDecimal::add);
            }
            if (isWeekend(day)) {
                continue;
            }
            series.add(snapshotFor(ctx, day, replays, bonds, bondSeries, cashByCurrency, fees));
        }
        if (persist) {
            navSnapshotRepository.saveAll(series);
        }
        log.info("Portfolio {}: built {} NAV point(s) for {}..{}{}", ctx.portfolioId(), series.size(), from, to,
                persist ? " (stored)" : "");
        return series;
    }

    private NavSnapshot snapshotFor(PortfolioContext ctx, LocalDate day, List<Replay> replays, List<BondHolding> bonds,
                                    Map<String, List<IndexerRate>> bondSeries, Map<String, BigDecimal> cashByCurrency,
                                    List<FeeRecord> fees) {
        String base = ctx.baseCurrency();
        NavCalculator.NavComponents components = new NavCalculator.NavComponents(base);
        for (Replay r : replays) {
            for (LedgerPosition p : r.ledger.positions()) {
                if (p.isOpen()) {
                    PositionValuation v = positionLedgerService.valuePosition(p, day);
                    components.addPosition(v, fxRateService.rate(v.currency(), base, day));
                }
            }
        }
        for (BondHolding b : bonds) {
            if (b.getApplicationDate().isAfter(day) || (b.getQuantity() != null && b.getQuantity().signum() == 0)) {
                continue;
            }
            BondValuation valuation = BondIndexationEngine.value(b, day, bondSeries.getOrDefault(b.getId(), List.of()));
            components.addBond(valuation, fxRateService.rate(valuation.currency(), base, day));
        }
        for (Map.Entry<String, BigDecimal> cash : cashByCurrency.entrySet()) {
            components.cash = components.cash.add(fxRateService.rate(cash.getKey(), base, day).convert(cash.getValue()));
        }
        for (FeeRecord f : fees) {
            if (f.isOutstandingAt(day)) {
                String ccy = f.getCurrency() == null ? base : f.getCurrency();
                components.outstandingFees = components.outstandingFees.add(fxRateService.rate(ccy, base, day).convert(f.getAmount()));
            }
        }
        return components.toSnapshot(ctx.portfolioId(), day);
    }

    private static boolean isWeekend(LocalDate day) {
        DayOfWeek dow = day.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }

    /** Applies stored transactions to an in-memory ledger as days pass. */
    private static final class Replay {
        private final PositionLedger ledger;
        private final List<LedgerTransaction> transactions;
        private int next;

        private Replay(PositionLedger ledger, List<LedgerTransaction> transactions) {
            this.ledger = ledger;
            this.transactions = transactions;
        }

        private void advanceTo(LocalDate day) {
            while (next < transactions.size() && !transactions.get(next).getDate().isAfter(day)) {
                LedgerTransaction tx = transactions.get(next++);
                PositionLedger.Outcome outcome = ledger.apply(tx);
                if (!outcome.applied()) {
                    log.warn("NAV series skipped transaction {} on {}: {}", tx.getId(), tx.getDate(), outcome.error());
                }
            }
        }
    }
}
