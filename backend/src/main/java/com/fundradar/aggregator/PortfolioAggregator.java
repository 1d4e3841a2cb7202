package com.fundradar.aggregator;

import com.fundradar.analytics.PerformanceReport;
import com.fundradar.analytics.PerformanceService;
import com.fundradar.analytics.config.AnalyticsProperties;
import com.fundradar.bond.BondPortfolioService;
import com.fundradar.bond.BondValuation;
import com.fundradar.bond.IndexerSeriesService;
import com.fundradar.context.PortfolioContext;
import com.fundradar.domain.AssetClass;
import com.fundradar.domain.BondHolding;
import com.fundradar.domain.Indexer;
import com.fundradar.domain.LedgerPosition;
import com.fundradar.fund.FeeEngine;
import com.fundradar.fund.FeeSummary;
import com.fundradar.fund.InvestorAllocation;
import com.fundradar.fund.NavCalculator;
import com.fundradar.ledger.LedgerSummary;
import com.fundradar.ledger.PositionLedgerService;
import com.fundradar.ledger.PositionValuation;
import com.fundradar.marketdata.config.MarketDataProperties;
import com.fundradar.pricing.FxRate;
import com.fundradar.pricing.FxRateService;
import com.fundradar.pricing.MarketSymbolMapper;
import com.fundradar.timeseries.BulkFetchReport;
import com.fundradar.timeseries.CancellationToken;
import com.fundradar.timeseries.TimeSeriesCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-side facade over ledgers, bonds, fund accounting and analytics for one portfolio.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PortfolioAggregator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int MONEY_SCALE = 2;

    private final PositionLedgerService positionLedgerService;
    private final BondPortfolioService bondPortfolioService;
    private final IndexerSeriesService indexerSeriesService;
    private final NavCalculator navCalculator;
    private final FeeEngine feeEngine;
    private final PerformanceService performanceService;
    private final FxRateService fxRateService;
    private final TimeSeriesCache timeSeriesCache;
    private final MarketDataProperties marketDataProperties;
    private final AnalyticsProperties analyticsProperties;

    /** Totals and allocation by asset class, converted to {@code currency}. */
    public ConsolidatedSummary consolidatedSummary(PortfolioContext ctx, LocalDate asOf, String currency) {
        String target = currency != null ? currency.toUpperCase() : ctx.baseCurrency();
        return ctx.read(() -> {
            Map<String, BigDecimal> rates = new TreeMap<>();
            Set<String> stale = new TreeSet<>();
            boolean approximated = false;
            List<AssetClassAllocation> rows = new ArrayList<>();

            for (AssetClass assetClass : List.of(AssetClass.EQUITY, AssetClass.CRYPTO)) {
                LedgerSummary s = positionLedgerService.summary(ctx, assetClass, asOf, target);
                approximated |= s.approximated();
                stale.addAll(s.staleSymbols());
                for (PositionValuation v : positionLedgerService.valuations(ctx, assetClass, asOf)) {
                    approximated |= recordRate(rates, v.currency(), target, asOf);
                }
                rows.add(new AssetClassAllocation(assetClass, s.marketValue(), s.costBasis(), BigDecimal.ZERO,
                        s.openPositions(), s.totalPnl(), s.returnPct()));
            }

            BigDecimal bondValue = BigDecimal.ZERO;
            BigDecimal bondCost = BigDecimal.ZERO;
            int activeBonds = 0;
            for (BondValuation b : bondPortfolioService.valuations(ctx, asOf)) {
                FxRate fx = fxRateService.rate(b.currency(), target, asOf);
                approximated |= fx.approximated() || b.approximated();
                recordRate(rates, b.currency(), target, asOf);
                bondValue = bondValue.add(fx.convert(b.accruedValue()));
                bondCost = bondCost.add(fx.convert(b.investedValue()));
                if (!b.matured()) {
                    activeBonds++;
                }
            }
            BigDecimal bondPnl = bondValue.subtract(bondCost);
            rows.add(new AssetClassAllocation(AssetClass.FIXED_INCOME, money(bondValue), money(bondCost), BigDecimal.ZERO,
                    activeBonds, money(bondPnl), pct(bondPnl, bondCost)));

            BigDecimal totalValue = rows.stream().map(AssetClassAllocation::value).reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal totalCost = rows.stream().map(AssetClassAllocation::costBasis).reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal totalPnl = rows.stream().map(AssetClassAllocation::pnl).reduce(BigDecimal.ZERO, BigDecimal::add);
            List<AssetClassAllocation> allocations = rows.stream()
                    .map(r -> new AssetClassAllocation(r.assetClass(), r.value(), r.costBasis(), pct(r.value(), totalValue),
                            r.positions(), r.pnl(), r.returnPct()))
                    .toList();
            return new ConsolidatedSummary(asOf, target, money(totalValue), money(totalCost), money(totalPnl),
                    pct(totalPnl, totalCost), allocations, rates, List.copyOf(stale), approximated);
        });
    }

    public List<InvestorAllocation> investorAllocations(PortfolioContext ctx, LocalDate asOf) {
        return ctx.read(() -> navCalculator.allocateToInvestors(ctx, navCalculator.nav(ctx, asOf), asOf));
    }

    public FeeSummary feeSummary(PortfolioContext ctx, LocalDate from, LocalDate to) {
        return feeEngine.summary(ctx, from, to);
    }

    public PerformanceReport performance(PortfolioContext ctx, LocalDate from, LocalDate to, String benchmarkSymbol) {
        return performanceService.performance(ctx, from, to, benchmarkSymbol);
    }

    public PortfolioPositions allPositions(PortfolioContext ctx, LocalDate asOf) {
        return ctx.read(() -> new PortfolioPositions(asOf,
                positionLedgerService.valuations(ctx, AssetClass.EQUITY, asOf),
                positionLedgerService.valuations(ctx, AssetClass.CRYPTO, asOf),
                bondPortfolioService.valuations(ctx, asOf)));
    }

    public List<PositionValuation> topPerformers(PortfolioContext ctx, LocalDate asOf, int limit) {
        return positionLedgerService.topPerformers(ctx, asOf, limit);
    }

    /**
     * Fetches prices for every held symbol, the FX pairs to the base currency and the benchmark, then the indexer
     * series of held bonds. Failures are reported, never thrown.
     */
    public MarketDataRefreshReport refreshMarketData(PortfolioContext ctx, LocalDate from, LocalDate to,
                                                     CancellationToken cancellation) {
        RefreshPlan plan = ctx.read(() -> planRefresh(ctx, to));
        BulkFetchReport prices = timeSeriesCache.bulkFetch(plan.symbols(), from, to, marketDataProperties.getBatchDays(),
                cancellation);
        Map<Indexer, Integer> stored = new EnumMap<>(Indexer.class);
        Map<Indexer, String> errors = new EnumMap<>(Indexer.class);
        for (Indexer indexer : plan.indexers()) {
            if (cancellation.isCancelled()) {
                break;
            }
            try {
                stored.put(indexer, indexerSeriesService.refresh(indexer, plan.seriesStart(), to));
            } catch (RuntimeException e) {
                log.warn("Portfolio {}: refreshing {} failed: {}", ctx.portfolioId(), indexer, e.getMessage());
                errors.put(indexer, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }
        return new MarketDataRefreshReport(prices, stored, errors);
    }

    private RefreshPlan planRefresh(PortfolioContext ctx, LocalDate to) {
        Set<String> symbols = new LinkedHashSet<>();
        for (AssetClass assetClass : List.of(AssetClass.EQUITY, AssetClass.CRYPTO)) {
            for (LedgerPosition p : positionLedgerService.positions(ctx, assetClass)) {
                symbols.add(MarketSymbolMapper.quoteSymbol(assetClass, p.getSymbol(), p.getMarket()));
                String ccy = MarketSymbolMapper.quoteCurrency(assetClass, p.getMarket());
                if (!ccy.equalsIgnoreCase(ctx.baseCurrency())) {
                    symbols.add(MarketSymbolMapper.fxSymbol(ccy, ctx.baseCurrency()));
                }
            }
        }
        symbols.add(analyticsProperties.getBenchmarkSymbol());
        Set<Indexer> indexers = new TreeSet<>();
        LocalDate seriesStart = to;
        for (BondHolding b : bondPortfolioService.holdings(ctx)) {
            if (b.getIndexer() != Indexer.PREFIXADO) {
                indexers.add(b.getIndexer());
                if (b.getApplicationDate().isBefore(seriesStart)) {
                    seriesStart = b.getApplicationDate();
                }
            }
        }
        return new RefreshPlan(symbols, indexers, seriesStart);
    }

    private boolean recordRate(Map<String, BigDecimal> rates, String from, String to, LocalDate asOf) {
        if (from.equalsIgnoreCase(to)) {
            return false;
        }
        FxRate fx = fxRateService.rate(from, to, asOf);
        rates.put(fx.from(), fx.rate());
        return fx.approximated();
    }

    private static BigDecimal pct(BigDecimal part, BigDecimal whole) {
        return whole.signum() > 0 ? part.multiply(HUNDRED).divide(whole, 4, RoundingMode.HALF_UP) : BigDecimal.ZERO;
    }

    private static BigDecimal money(BigDecimal v) {
        return v.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private record RefreshPlan(Set<String> symbols, Set<Indexer> indexers, LocalDate seriesStart) {
    }
}
