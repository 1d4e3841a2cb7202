package com.fundradar.ledger;

import com.fundradar.domain.AssetClass;
import com.fundradar.domain.LedgerPosition;
import com.fundradar.domain.LedgerTransaction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Weighted-average cost ledger for one (portfolio, asset class). Pure in-memory state; the service loads and
 * persists it.
 * <p>
 * Buy: {@code avgCost = (qty * avgCost + buyQty * buyPrice) / (qty + buyQty)}.
 * Sell: {@code realizedPnl += sellQty * (sellPrice - avgCost)}; avgCost unchanged; {@code totalInvested} drops by
 * the cost basis sold.
 */
public final class PositionLedger {

    public static final int SCALE = 10;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    /** Replay order: (date ASC, sequence ASC). */
    public static final Comparator<LedgerTransaction> REPLAY_ORDER = Comparator
            .comparing(LedgerTransaction::getDate)
            .thenComparingLong(LedgerTransaction::getSequence);

    private final String portfolioId;
    private final AssetClass assetClass;
    private final OversellPolicy oversellPolicy;
    private final Map<String, LedgerPosition> positions = new TreeMap<>();
    private LocalDate lastAppliedDate;

    public PositionLedger(String portfolioId, AssetClass assetClass, OversellPolicy oversellPolicy) {
        this.portfolioId = portfolioId;
        this.assetClass = assetClass;
        this.oversellPolicy = oversellPolicy;
    }

    /**
     * Applies transactions in replay order to a fresh ledger. Rejected transactions are reported, not applied.
     */
    public static ReplayResult replay(String portfolioId, AssetClass assetClass, OversellPolicy policy,
                                      Collection<LedgerTransaction> transactions) {
        PositionLedger ledger = new PositionLedger(portfolioId, assetClass, policy);
        List<LedgerTransaction> ordered = new ArrayList<>(transactions);
        ordered.sort(REPLAY_ORDER);
        List<Rejection> rejected = new ArrayList<>();
        for (LedgerTransaction tx : ordered) {
            Outcome outcome = ledger.apply(tx);
            if (!outcome.applied()) {
                rejected.add(new Rejection(tx, outcome.error()));
            }
        }
        return new ReplayResult(ledger, rejected);
    }

    /** True when {@code tx} is dated before the last applied transaction, so applying it in place would misorder. */
    public boolean isBehind(LedgerTransaction tx) {
        return lastAppliedDate != null && tx.getDate().isBefore(lastAppliedDate);
    }

    /**
     * Seeds the ledger with an already-materialized position, used for incremental application.
     */
    public void load(LedgerPosition position) {
        positions.put(position.getSymbol(), position);
        if (position.getLastTransactionDate() != null
                && (lastAppliedDate == null || position.getLastTransactionDate().isAfter(lastAppliedDate))) {
            lastAppliedDate = position.getLastTransactionDate();
        }
    }

    public Outcome apply(LedgerTransaction tx) {
        if (tx.getQuantity() == null || tx.getQuantity().signum() == 0) {
            return Outcome.rejected("quantity must be non-zero");
        }
        if (tx.getPrice() == null || tx.getPrice().signum() < 0) {
            return Outcome.rejected("price must be zero or positive");
        }
        LedgerPosition existing = positions.get(tx.getSymbol());
        LedgerPosition position = existing != null ? existing : newPosition(tx);
        if (tx.isBuy()) {
            applyBuy(position, tx.getQuantity(), tx.getPrice());
        } else {
            BigDecimal sellQty = tx.getQuantity().abs();
            BigDecimal held = position.getQuantity().max(BigDecimal.ZERO);
            if (sellQty.compareTo(held) > 0 && oversellPolicy == OversellPolicy.REJECT) {
                return Outcome.rejected("sell of " + sellQty.toPlainString() + " " + tx.getSymbol()
                        + " exceeds held quantity " + held.toPlainString());
            }
            applySell(position, sellQty, held, tx.getPrice());
        }
        position.setLastTradePrice(tx.getPrice());
        if (position.getFirstTransactionDate() == null || tx.getDate().isBefore(position.getFirstTransactionDate())) {
            position.setFirstTransactionDate(tx.getDate());
        }
        if (position.getLastTransactionDate() == null || !tx.getDate().isBefore(position.getLastTransactionDate())) {
            position.setLastTransactionDate(tx.getDate());
        }
        position.setTransactionCount(position.getTransactionCount() + 1);
        position.setLastCalculatedAt(Instant.now());
        if (tx.getMarket() != null) {
            position.setMarket(tx.getMarket());
        }
        positions.put(position.getSymbol(), position);
        if (lastAppliedDate == null || tx.getDate().isAfter(lastAppliedDate)) {
            lastAppliedDate = tx.getDate();
        }
        return Outcome.ok(position);
    }

    private static void applyBuy(LedgerPosition p, BigDecimal buyQty, BigDecimal buyPrice) {
        BigDecimal qty = p.getQuantity();
        BigDecimal newQty = qty.add(buyQty);
        if (qty.signum() >= 0) {
            BigDecimal cost = qty.multiply(p.getAvgCost()).add(buyQty.multiply(buyPrice));
            p.setAvgCost(cost.divide(newQty, SCALE, ROUNDING));
            p.setTotalInvested(p.getTotalInvested().add(buyQty.multiply(buyPrice)));
        } else {
            BigDecimal covered = buyQty.min(qty.negate());
            p.setRealizedPnl(p.getRealizedPnl().add(covered.multiply(p.getAvgCost().subtract(buyPrice))));
            if (newQty.signum() > 0) {
                // Long remainder: the basis restarts at this buy.
                p.setAvgCost(buyPrice.setScale(SCALE, ROUNDING));
                p.setTotalInvested(newQty.multiply(buyPrice));
            }
        }
        p.setQuantity(newQty);
    }

    private static void applySell(LedgerPosition p, BigDecimal sellQty, BigDecimal held, BigDecimal sellPrice) {
        BigDecimal booked = sellQty.min(held);
        BigDecimal avg = p.getAvgCost();
        if (booked.signum() > 0) {
            p.setRealizedPnl(p.getRealizedPnl().add(booked.multiply(sellPrice.subtract(avg))));
            BigDecimal invested = p.getTotalInvested().subtract(booked.multiply(avg));
            p.setTotalInvested(invested.signum() < 0 ? BigDecimal.ZERO : invested);
        }
        BigDecimal opened = sellQty.subtract(booked);
        if (opened.signum() > 0) {
            BigDecimal shortQty = p.getQuantity().min(BigDecimal.ZERO).negate();
            BigDecimal proceeds = shortQty.multiply(avg).add(opened.multiply(sellPrice));
            p.setAvgCost(proceeds.divide(shortQty.add(opened), SCALE, ROUNDING));
        }
        p.setQuantity(p.getQuantity().subtract(sellQty));
    }

    private LedgerPosition newPosition(LedgerTransaction tx) {
        LedgerPosition p = new LedgerPosition();
        p.setId(LedgerPosition.idFor(portfolioId, assetClass, tx.getSymbol()));
        p.setPortfolioId(portfolioId);
        p.setAssetClass(assetClass);
        p.setSymbol(tx.getSymbol());
        p.setMarket(tx.getMarket());
        p.setCurrency(tx.getCurrency());
        return p;
    }

    public Optional<LedgerPosition> position(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    public Collection<LedgerPosition> positions() {
        return positions.values();
    }

    public LocalDate lastAppliedDate() {
        return lastAppliedDate;
    }

    public AssetClass assetClass() {
        return assetClass;
    }

    public record Outcome(boolean applied, LedgerPosition position, String error) {

        static Outcome ok(LedgerPosition position) {
            return new Outcome(true, position, null);
        }

        static Outcome rejected(String error) {
            return new Outcome(false, null, error);
        }
    }

    public record Rejection(LedgerTransaction transaction, String error) {
    }

    public record ReplayResult(PositionLedger ledger, List<Rejection> rejected) {
    }
}
