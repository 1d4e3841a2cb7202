package com.fundradar.bond;

import com.fundradar.domain.BondHolding;
import com.fundradar.domain.Indexer;
import com.fundradar.domain.IndexerRate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Accrues fixed-income holdings to a valuation date ({@code min(asOf, maturity)}); {@code years = days / 365.25}.
 * <ul>
 *   <li>IPCA: {@code principal * Π(1 + monthlyIpca/100) * (1 + rate/100)^years}; a month missing from the series
 *   is replaced by {@code 1.05^(1/12)} and the valuation is flagged approximated.</li>
 *   <li>CDI / SELIC: {@code principal * Π(1 + dailyRate/100 * pctIndexed/100)} over the cached business-day series.
 *   Without series data the reference annual rate (CDI 13.75%, SELIC 11.75%) scaled by pctIndexed is compounded
 *   instead, flagged approximated.</li>
 *   <li>PREFIXADO: {@code principal * (1 + rate/100)^years}.</li>
 * </ul>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BondIndexationEngine {

    static final double DAYS_PER_YEAR = 365.25;
    static final double IPCA_FALLBACK_ANNUAL = 0.05;
    static final BigDecimal CDI_REFERENCE_PCT = new BigDecimal("13.75");
    static final BigDecimal SELIC_REFERENCE_PCT = new BigDecimal("11.75");
    /** Series ending more than this many days before the valuation date is topped up with the reference rate. */
    static final int SERIES_TAIL_TOLERANCE_DAYS = 7;

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int MONEY_SCALE = 2;

    private final IndexerSeriesService indexerSeriesService;

    /** Values {@code bond} with the cached indexer series. */
    public BondValuation value(BondHolding bond, LocalDate asOf) {
        LocalDate valuationDate = valuationDate(bond, asOf);
        List<IndexerRate> series = bond.getIndexer() == Indexer.PREFIXADO || !valuationDate.isAfter(bond.getApplicationDate())
                ? List.of()
                : indexerSeriesService.series(bond.getIndexer(), bond.getApplicationDate(), valuationDate);
        return value(bond, asOf, series);
    }

    /** Values {@code bond} against the given series (IPCA monthly or CDI/SELIC daily, in percent). */
    public static BondValuation value(BondHolding bond, LocalDate asOf, List<IndexerRate> series) {
        LocalDate valuationDate = valuationDate(bond, asOf);
        BigDecimal principal = bond.getInvestedValue();
        BigDecimal rate = bond.getRate() != null ? bond.getRate() : BigDecimal.ZERO;
        Accrual accrual;
        if (!valuationDate.isAfter(bond.getApplicationDate())) {
            accrual = new Accrual(BigDecimal.ONE, false, List.of());
        } else {
            accrual = switch (bond.getIndexer()) {
                case IPCA -> ipca(bond.getApplicationDate(), valuationDate, rate, series);
                case CDI -> floating(bond.getApplicationDate(), valuationDate, rate, series, CDI_REFERENCE_PCT);
                case SELIC -> floating(bond.getApplicationDate(), valuationDate, rate, series, SELIC_REFERENCE_PCT);
                case PREFIXADO -> new Accrual(compound(rate.divide(HUNDRED, MC), years(bond.getApplicationDate(), valuationDate)),
                        false, List.of());
            };
        }
        if (accrual.approximated()) {
            log.debug("Bond {} ({}) valued with approximated {} data", bond.getId(), bond.getTitle(), bond.getIndexer());
        }
        BigDecimal accrued = principal.multiply(accrual.factor(), MC).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal pnl = accrued.subtract(principal);
        BigDecimal pnlPct = principal.signum() > 0
                ? pnl.multiply(HUNDRED).divide(principal, 4, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        boolean matured = bond.isMaturedAt(asOf);
        Long daysToMaturity = bond.getMaturityDate() == null || matured
                ? null
                : ChronoUnit.DAYS.between(asOf, bond.getMaturityDate());
        return new BondValuation(bond.getId(), bond.getTitle(), bond.getIssuer(), bond.getBondType(), bond.getIndexer(),
                rate, bond.getQuantity(), principal, accrued, pnl, pnlPct, bond.getApplicationDate(),
                bond.getMaturityDate(), valuationDate, daysToMaturity, matured, accrual.approximated(),
                accrual.substitutedMonths(), bond.getCurrency());
    }

    static LocalDate valuationDate(BondHolding bond, LocalDate asOf) {
        if (bond.getMaturityDate() != null && bond.getMaturityDate().isBefore(asOf)) {
            return bond.getMaturityDate();
        }
        return asOf;
    }

    static double years(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to) / DAYS_PER_YEAR;
    }

    /**
     * Months whose first day falls in [from, to] contribute their IPCA variation.
     */
    private static Accrual ipca(LocalDate from, LocalDate to, BigDecimal spreadPct, List<IndexerRate> series) {
        Map<YearMonth, BigDecimal> monthly = new HashMap<>();
        for (IndexerRate r : series) {
            monthly.put(YearMonth.from(r.getDate()), r.getValuePct());
        }
        BigDecimal fallbackMonthly = BigDecimal.valueOf(Math.pow(1.0 + IPCA_FALLBACK_ANNUAL, 1.0 / 12.0));
        BigDecimal factor = BigDecimal.ONE;
        List<YearMonth> substituted = new ArrayList<>();
        YearMonth month = from.getDayOfMonth() == 1 ? YearMonth.from(from) : YearMonth.from(from).plusMonths(1);
        YearMonth last = YearMonth.from(to);
        while (!month.isAfter(last)) {
            BigDecimal pct = monthly.get(month);
            if (pct != null) {
                factor = factor.multiply(BigDecimal.ONE.add(pct.divide(HUNDRED, MC)), MC);
            } else {
                factor = factor.multiply(fallbackMonthly, MC);
                substituted.add(month);
            }
            month = month.plusMonths(1);
        }
        factor = factor.multiply(compound(spreadPct.divide(HUNDRED, MC), years(from, to)), MC);
        return new Accrual(factor, !substituted.isEmpty(), List.copyOf(substituted));
    }

    /**
     * Daily rates dated in [from, to) accrue; a missing or short series is completed with the reference rate.
     */
    private static Accrual floating(LocalDate from, LocalDate to, BigDecimal pctIndexed, List<IndexerRate> series,
                                    BigDecimal referenceAnnualPct) {
        BigDecimal share = pctIndexed.signum() > 0 ? pctIndexed.divide(HUNDRED, MC) : BigDecimal.ONE;
        BigDecimal factor = BigDecimal.ONE;
        LocalDate lastRateDate = null;
        for (IndexerRate r : series) {
            if (r.getDate().isBefore(from) || !r.getDate().isBefore(to)) {
                continue;
            }
            BigDecimal daily = r.getValuePct().divide(HUNDRED, MC).multiply(share, MC);
            factor = factor.multiply(BigDecimal.ONE.add(daily), MC);
            if (lastRateDate == null || r.getDate().isAfter(lastRateDate)) {
                lastRateDate = r.getDate();
            }
        }
        BigDecimal referenceAnnual = referenceAnnualPct.divide(HUNDRED, MC).multiply(share, MC);
        if (lastRateDate == null) {
            return new Accrual(compound(referenceAnnual, years(from, to)), true, List.of());
        }
        LocalDate covered = lastRateDate.plusDays(1);
        if (ChronoUnit.DAYS.between(covered, to) > SERIES_TAIL_TOLERANCE_DAYS) {
            factor = factor.multiply(compound(referenceAnnual, years(covered, to)), MC);
            return new Accrual(factor, true, List.of());
        }
        return new Accrual(factor, false, List.of());
    }

    private static BigDecimal compound(BigDecimal annualRate, double years) {
        if (annualRate.signum() == 0 || years <= 0) {
            return BigDecimal.ONE;
        }
        return BigDecimal.valueOf(Math.pow(1.0 + annualRate.doubleValue(), years));
    }

    private record Accrual(BigDecimal factor, boolean approximated, List<YearMonth> substitutedMonths) {
    }
}
