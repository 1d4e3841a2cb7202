package com.fundradar.bond;

import com.fundradar.context.PortfolioContext;
import com.fundradar.domain.BondHolding;
import com.fundradar.domain.BondHoldingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;

/**
 * Fixed-income holdings of a portfolio and their read models.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BondPortfolioService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final String DEFAULT_CURRENCY = "BRL";

    private final BondHoldingRepository bondHoldingRepository;
    private final BondIndexationEngine bondIndexationEngine;

    public List<BondHolding> addHoldings(PortfolioContext ctx, List<BondHolding> holdings) {
        return ctx.write(() -> {
            for (BondHolding h : holdings) {
                h.setPortfolioId(ctx.portfolioId());
                if (h.getId() == null) {
                    h.setId(UUID.randomUUID().toString());
                }
            }
            List<BondHolding> saved = bondHoldingRepository.saveAll(holdings);
            log.info("Portfolio {}: stored {} bond holding(s)", ctx.portfolioId(), saved.size());
            return saved;
        });
    }

    public List<BondHolding> holdings(PortfolioContext ctx) {
        return ctx.read(() -> bondHoldingRepository.findByPortfolioId(ctx.portfolioId()));
    }

    /** Valuations of holdings with non-zero quantity, highest value first. */
    public List<BondValuation> valuations(PortfolioContext ctx, LocalDate asOf) {
        return ctx.read(() -> bondHoldingRepository.findByPortfolioId(ctx.portfolioId()).stream()
                .filter(b -> b.getQuantity() == null || b.getQuantity().signum() != 0)
                .filter(b -> !b.getApplicationDate().isAfter(asOf))
                .map(b -> bondIndexationEngine.value(b, asOf))
                .sorted(Comparator.comparing(BondValuation::accruedValue).reversed())
                .toList());
    }

    public BondPortfolioSummary summary(PortfolioContext ctx, LocalDate asOf) {
        List<BondValuation> all = valuations(ctx, asOf);
        BigDecimal invested = BigDecimal.ZERO;
        BigDecimal current = BigDecimal.ZERO;
        int active = 0;
        int within30 = 0;
        int within90 = 0;
        boolean approximated = false;
        for (BondValuation v : all) {
            invested = invested.add(v.investedValue());
            current = current.add(v.accruedValue());
            approximated |= v.approximated();
            if (!v.matured()) {
                active++;
                if (v.daysToMaturity() != null && v.daysToMaturity() <= 30) {
                    within30++;
                }
                if (v.daysToMaturity() != null && v.daysToMaturity() <= 90) {
                    within90++;
                }
            }
        }
        BigDecimal pnl = current.subtract(invested);
        BigDecimal returnPct = invested.signum() > 0
                ? pnl.multiply(HUNDRED).divide(invested, 4, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        String currency = all.isEmpty() ? DEFAULT_CURRENCY : all.get(0).currency();
        return new BondPortfolioSummary(currency, invested, current, pnl, returnPct, all.size(), active,
                within30, within90, approximated);
    }

    public List<BondAllocation> allocationByIndexer(PortfolioContext ctx, LocalDate asOf) {
        return allocate(valuations(ctx, asOf), v -> v.indexer().name());
    }

    public List<BondAllocation> allocationByType(PortfolioContext ctx, LocalDate asOf) {
        return allocate(valuations(ctx, asOf), v -> v.bondType() != null ? v.bondType() : "Unknown");
    }

    /** Active bonds grouped by maturity month, earliest first. */
    public List<MaturityBucket> maturitySchedule(PortfolioContext ctx, LocalDate asOf) {
        Map<YearMonth, MaturityBucket> byMonth = new TreeMap<>();
        for (BondValuation v : valuations(ctx, asOf)) {
            if (v.matured() || v.maturityDate() == null) {
                continue;
            }
            YearMonth month = YearMonth.from(v.maturityDate());
            MaturityBucket b = byMonth.get(month);
            byMonth.put(month, b == null
                    ? new MaturityBucket(month, v.accruedValue(), 1)
                    : new MaturityBucket(month, b.valueMaturing().add(v.accruedValue()), b.bonds() + 1));
        }
        return new ArrayList<>(byMonth.values());
    }

    private static List<BondAllocation> allocate(List<BondValuation> valuations, Function<BondValuation, String> key) {
        Map<String, BigDecimal[]> sums = new TreeMap<>();
        Map<String, Integer> counts = new TreeMap<>();
        BigDecimal total = BigDecimal.ZERO;
        for (BondValuation v : valuations) {
            String k = key.apply(v);
            BigDecimal[] s = sums.computeIfAbsent(k, x -> new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});
            s[0] = s[0].add(v.accruedValue());
            s[1] = s[1].add(v.pnl());
            counts.merge(k, 1, Integer::sum);
            total = total.add(v.accruedValue());
        }
        List<BondAllocation> out = new ArrayList<>();
        for (Map.Entry<String, BigDecimal[]> e : sums.entrySet()) {
            BigDecimal pct = total.signum() > 0
                    ? e.getValue()[0].multiply(HUNDRED).divide(total, 4, RoundingMode.HALF_UP)
                    : BigDecimal.ZERO;
            out.add(new BondAllocation(e.getKey(), e.getValue()[0], e.getValue()[1], pct, counts.get(e.getKey())));
        }
        out.sort(Comparator.comparing(BondAllocation::currentValue).reversed());
        return out;
    }
}
