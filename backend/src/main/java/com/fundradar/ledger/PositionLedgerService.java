package com.fundradar.ledger;

import com.fundradar.common.RowError;
import com.fundradar.common.RowResult;
import com.fundradar.context.PortfolioContext;
import com.fundradar.domain.AssetClass;
import com.fundradar.domain.LedgerPosition;
import com.fundradar.domain.LedgerPositionRepository;
import com.fundradar.domain.LedgerTransaction;
import com.fundradar.domain.LedgerTransactionRepository;
import com.fundradar.ledger.config.LedgerProperties;
import com.fundradar.pricing.FxRate;
import com.fundradar.pricing.FxRateService;
import com.fundradar.pricing.MarketPriceResolver;
import com.fundradar.pricing.MarketSymbolMapper;
import com.fundradar.pricing.PriceQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Incremental position ledgers per asset class.
 * <p>
 * A transaction dated on or after the latest stored one is applied to its materialized position only. An
 * out-of-order transaction triggers a full rebuild of its asset class from stored transactions; if the rebuild
 * would reject it or any later transaction, it is rejected and nothing is stored.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PositionLedgerService {

    private static final int MONEY_SCALE = 2;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final LedgerTransactionRepository transactionRepository;
    private final LedgerPositionRepository positionRepository;
    private final MarketPriceResolver marketPriceResolver;
    private final FxRateService fxRateService;
    private final LedgerProperties ledgerProperties;

    public PositionLedger.Outcome record(PortfolioContext ctx, LedgerTransaction tx) {
        return ctx.write(() -> recordLocked(ctx, tx, EnumSet.noneOf(AssetClass.class)));
    }

    /**
     * Records parsed rows in date order. Rows that failed parsing are reported as they are.
     */
    public LedgerUpdateReport recordAll(PortfolioContext ctx, List<RowResult<LedgerTransaction>> rows) {
        return ctx.write(() -> {
            List<RowError> rejected = new ArrayList<>();
            Set<AssetClass> rebuilt = EnumSet.noneOf(AssetClass.class);
            List<RowResult<LedgerTransaction>> ok = new ArrayList<>();
            for (RowResult<LedgerTransaction> row : rows) {
                if (row.isOk()) {
                    ok.add(row);
                } else {
                    row.getError().ifPresent(rejected::add);
                }
            }
            ok.sort(Comparator.comparing((RowResult<LedgerTransaction> r) -> r.getValue().orElseThrow().getDate())
                    .thenComparingInt(RowResult::getRow));
            int applied = 0;
            for (RowResult<LedgerTransaction> row : ok) {
                PositionLedger.Outcome outcome = recordLocked(ctx, row.getValue().orElseThrow(), rebuilt);
                if (outcome.applied()) {
                    applied++;
                } else {
                    rejected.add(new RowError(row.getRow(), outcome.error()));
                }
            }
            rejected.sort(Comparator.comparingInt(RowError::row));
            log.info("Portfolio {}: {} transaction(s) applied, {} rejected, rebuilt {}",
                    ctx.portfolioId(), applied, rejected.size(), rebuilt);
            return new LedgerUpdateReport(applied, rejected, rebuilt);
        });
    }

    private PositionLedger.Outcome recordLocked(PortfolioContext ctx, LedgerTransaction tx, Set<AssetClass> rebuilt) {
        String portfolioId = ctx.portfolioId();
        AssetClass assetClass = tx.getAssetClass();
        if (assetClass == null || assetClass == AssetClass.FIXED_INCOME) {
            return PositionLedger.Outcome.rejected("asset class must be EQUITY or CRYPTO");
        }
        tx.setPortfolioId(portfolioId);
        tx.setSequence(nextSequence(portfolioId));
        if (tx.getRecordedAt() == null) {
            tx.setRecordedAt(Instant.now());
        }
        OversellPolicy policy = ledgerProperties.getOversellPolicy();
        boolean outOfOrder = transactionRepository
                .findFirstByPortfolioIdAndAssetClassOrderByDateDescSequenceDesc(portfolioId, assetClass)
                .map(latest -> tx.getDate().isBefore(latest.getDate()))
                .orElse(false);

        if (!outOfOrder) {
            PositionLedger ledger = new PositionLedger(portfolioId, assetClass, policy);
            positionRepository.findById(LedgerPosition.idFor(portfolioId, assetClass, tx.getSymbol())).ifPresent(ledger::load);
            PositionLedger.Outcome outcome = ledger.apply(tx);
            if (outcome.applied()) {
                transactionRepository.save(tx);
                positionRepository.save(outcome.position());
            }
            return outcome;
        }

        List<LedgerTransaction> all = new ArrayList<>(
                transactionRepository.findByPortfolioIdAndAssetClassOrderByDateAscSequenceAsc(portfolioId, assetClass));
        all.add(tx);
        PositionLedger.ReplayResult replay = PositionLedger.replay(portfolioId, assetClass, policy, all);
        if (!replay.rejected().isEmpty()) {
            PositionLedger.Rejection first = replay.rejected().get(0);
            String error = first.transaction() == tx
                    ? first.error()
                    : "back-dated transaction invalidates " + first.transaction().getSymbol() + " on "
                    + first.transaction().getDate() + ": " + first.error();
            return PositionLedger.Outcome.rejected(error);
        }
        transactionRepository.save(tx);
        persist(portfolioId, assetClass, replay.ledger());
        rebuilt.add(assetClass);
        log.info("Portfolio {} {}: back-dated transaction on {} triggered a rebuild of {} position(s)",
                portfolioId, assetClass, tx.getDate(), replay.ledger().positions().size());
        return PositionLedger.Outcome.ok(replay.ledger().position(tx.getSymbol()).orElseThrow());
    }

    /** Recomputes all positions of an asset class from stored transactions. */
    public List<LedgerPosition> rebuild(PortfolioContext ctx, AssetClass assetClass) {
        return ctx.write(() -> {
            PositionLedger.ReplayResult replay = PositionLedger.replay(ctx.portfolioId(), assetClass,
                    ledgerProperties.getOversellPolicy(),
                    transactionRepository.findByPortfolioIdAndAssetClassOrderByDateAscSequenceAsc(ctx.portfolioId(), assetClass));
            replay.rejected().forEach(r -> log.warn("Rebuild of {} {} skipped transaction {} on {}: {}",
                    ctx.portfolioId(), assetClass, r.transaction().getId(), r.transaction().getDate(), r.error()));
            persist(ctx.portfolioId(), assetClass, replay.ledger());
            return new ArrayList<>(replay.ledger().positions());
        });
    }

    private void persist(String portfolioId, AssetClass assetClass, PositionLedger ledger) {
        positionRepository.deleteByPortfolioIdAndAssetClass(portfolioId, assetClass);
        positionRepository.saveAll(ledger.positions());
    }

    private long nextSequence(String portfolioId) {
        return transactionRepository.findFirstByPortfolioIdOrderBySequenceDesc(portfolioId)
                .map(t -> t.getSequence() + 1)
                .orElse(1L);
    }

    public List<LedgerPosition> positions(PortfolioContext ctx, AssetClass assetClass) {
        return ctx.read(() -> positionRepository.findByPortfolioIdAndAssetClass(ctx.portfolioId(), assetClass));
    }

    public List<LedgerTransaction> transactionHistory(PortfolioContext ctx, AssetClass assetClass, String symbol) {
        return ctx.read(() -> transactionRepository
                .findByPortfolioIdAndAssetClassAndSymbolOrderByDateAscSequenceAsc(ctx.portfolioId(), assetClass, symbol));
    }

    /** Open positions as they stood at the end of {@code date}, replayed from stored transactions. */
    public List<LedgerPosition> holdingsAt(PortfolioContext ctx, AssetClass assetClass, LocalDate date) {
        return ctx.read(() -> replayUpTo(ctx.portfolioId(), assetClass, date).stream()
                .filter(LedgerPosition::isOpen)
                .toList());
    }

    /**
     * Values the open positions of an asset class as of {@code asOf}. Uses the materialized positions when
     * {@code asOf} is on or after the last transaction; replays history otherwise.
     */
    public List<PositionValuation> valuations(PortfolioContext ctx, AssetClass assetClass, LocalDate asOf) {
        return ctx.read(() -> {
            LocalDate lastDate = transactionRepository
                    .findFirstByPortfolioIdAndAssetClassOrderByDateDescSequenceDesc(ctx.portfolioId(), assetClass)
                    .map(LedgerTransaction::getDate)
                    .orElse(null);
            List<LedgerPosition> positions = lastDate == null || !asOf.isBefore(lastDate)
                    ? positionRepository.findByPortfolioIdAndAssetClass(ctx.portfolioId(), assetClass)
                    : replayUpTo(ctx.portfolioId(), assetClass, asOf);
            return positions.stream()
                    .filter(LedgerPosition::isOpen)
                    .map(p -> valuePosition(p, asOf))
                    .sorted(Comparator.comparing(PositionValuation::symbol))
                    .toList();
        });
    }

    /**
     * Totals of an asset class converted to {@code currency}. Realized P&amp;L includes closed positions.
     */
    public LedgerSummary summary(PortfolioContext ctx, AssetClass assetClass, LocalDate asOf, String currency) {
        return ctx.read(() -> {
            List<PositionValuation> open = valuations(ctx, assetClass, asOf);
            BigDecimal marketValue = BigDecimal.ZERO;
            BigDecimal costBasis = BigDecimal.ZERO;
            BigDecimal unrealized = BigDecimal.ZERO;
            BigDecimal realized = BigDecimal.ZERO;
            boolean approximated = false;
            Set<String> stale = new TreeSet<>();
            for (PositionValuation v : open) {
                FxRate fx = fxRateService.rate(v.currency(), currency, asOf);
                approximated |= fx.approximated();
                marketValue = marketValue.add(fx.convert(v.marketValue()));
                costBasis = costBasis.add(fx.convert(v.costBasis()));
                unrealized = unrealized.add(fx.convert(v.unrealizedPnl()));
                if (v.priceStale()) {
                    stale.add(v.symbol());
                }
            }
            for (LedgerPosition p : positionRepository.findByPortfolioIdAndAssetClass(ctx.portfolioId(), assetClass)) {
                String ccy = positionCurrency(p);
                FxRate fx = fxRateService.rate(ccy, currency, asOf);
                approximated |= fx.approximated();
                realized = realized.add(fx.convert(p.getRealizedPnl()));
            }
            BigDecimal total = unrealized.add(realized);
            BigDecimal returnPct = costBasis.signum() > 0
                    ? total.multiply(BigDecimal.valueOf(100)).divide(costBasis, 4, ROUNDING)
                    : BigDecimal.ZERO;
            if (!stale.isEmpty()) {
                log.warn("Portfolio {} {}: stale prices for {}", ctx.portfolioId(), assetClass, stale);
            }
            return new LedgerSummary(assetClass, currency,
                    money(marketValue), money(costBasis), money(unrealized), money(realized), money(total), returnPct,
                    open.size(), List.copyOf(stale), approximated || !stale.isEmpty());
        });
    }

    /** Open equity and crypto positions ranked by unrealized return, best first. */
    public List<PositionValuation> topPerformers(PortfolioContext ctx, LocalDate asOf, int limit) {
        return ctx.read(() -> {
            List<PositionValuation> all = new ArrayList<>(valuations(ctx, AssetClass.EQUITY, asOf));
            all.addAll(valuations(ctx, AssetClass.CRYPTO, asOf));
            all.sort(Comparator.comparing(PositionValuation::unrealizedPnlPct).reversed());
            return all.subList(0, Math.min(Math.max(0, limit), all.size()));
        });
    }

    public List<PositionValuation> topPerformers(PortfolioContext ctx, LocalDate asOf) {
        return topPerformers(ctx, asOf, ledgerProperties.getTopPerformersLimit());
    }

    /**
     * Empty in-memory ledger with the configured oversell policy, for callers that replay history day by day.
     */
    public PositionLedger newLedger(PortfolioContext ctx, AssetClass assetClass) {
        return new PositionLedger(ctx.portfolioId(), assetClass, ledgerProperties.getOversellPolicy());
    }

    /** Stored transactions dated on or before {@code date}, in replay order. */
    public List<LedgerTransaction> transactionsUpTo(PortfolioContext ctx, AssetClass assetClass, LocalDate date) {
        return ctx.read(() -> transactionRepository
                .findByPortfolioIdAndAssetClassAndDateLessThanEqualOrderByDateAscSequenceAsc(ctx.portfolioId(), assetClass, date));
    }

    /** Values one position in its own currency; falls back to average cost when no price is known (flagged stale). */
    public PositionValuation valuePosition(LedgerPosition p, LocalDate asOf) {
        AssetClass assetClass = p.getAssetClass();
        String quoteSymbol = MarketSymbolMapper.quoteSymbol(assetClass, p.getSymbol(), p.getMarket());
        String quoteCurrency = MarketSymbolMapper.quoteCurrency(assetClass, p.getMarket());
        String currency = positionCurrency(p);
        PriceQuote quote = marketPriceResolver.resolve(quoteSymbol, quoteCurrency, asOf, p.getLastTradePrice(), currency);
        BigDecimal price;
        if (!quote.isKnown()) {
            price = p.getAvgCost();
        } else if (quote.currency().equalsIgnoreCase(currency)) {
            price = quote.price();
        } else {
            price = fxRateService.rate(quote.currency(), currency, asOf).convert(quote.price());
        }
        BigDecimal quantity = p.getQuantity();
        BigDecimal marketValue = quantity.multiply(price);
        BigDecimal costBasis = quantity.multiply(p.getAvgCost());
        BigDecimal unrealized = quantity.multiply(price.subtract(p.getAvgCost()));
        BigDecimal unrealizedPct = costBasis.signum() != 0
                ? unrealized.multiply(BigDecimal.valueOf(100)).divide(costBasis.abs(), 4, ROUNDING)
                : BigDecimal.ZERO;
        BigDecimal realized = p.getRealizedPnl();
        return new PositionValuation(assetClass, p.getSymbol(), quoteSymbol, currency, quantity, p.getAvgCost(), price,
                quote.priceDate(), money(marketValue), money(costBasis), money(unrealized), unrealizedPct,
                money(realized), money(unrealized.add(realized)), quote.stale() || !quote.isKnown());
    }

    private List<LedgerPosition> replayUpTo(String portfolioId, AssetClass assetClass, LocalDate date) {
        List<LedgerTransaction> txs = transactionRepository
                .findByPortfolioIdAndAssetClassAndDateLessThanEqualOrderByDateAscSequenceAsc(portfolioId, assetClass, date);
        return new ArrayList<>(PositionLedger.replay(portfolioId, assetClass, ledgerProperties.getOversellPolicy(), txs)
                .ledger().positions());
    }

    private static String positionCurrency(LedgerPosition p) {
        return p.getCurrency() != null ? p.getCurrency() : MarketSymbolMapper.quoteCurrency(p.getAssetClass(), p.getMarket());
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, ROUNDING);
    }
}
