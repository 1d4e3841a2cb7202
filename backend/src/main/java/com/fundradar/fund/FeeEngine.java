package com.fundradar.fund;

import com.fundradar.common.Money;
import com.fundradar.common.RowError;
import com.fundradar.common.RowResult;
import com.fundradar.context.PortfolioContext;
import com.fundradar.domain.FeeRecord;
import com.fundradar.domain.FeeRecordRepository;
import com.fundradar.domain.FeeStatus;
import com.fundradar.domain.FeeType;
import com.fundradar.domain.HighWaterMark;
import com.fundradar.domain.HighWaterMarkRepository;
import com.fundradar.domain.NavSnapshot;
import com.fundradar.domain.NavSnapshotRepository;
import com.fundradar.fund.config.FundProperties;
import com.fundradar.pricing.FxRateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fund-level management and performance fees.
 * <p>
 * Fee records move PENDING → CALCULATED → PAID. The performance fee is charged only on NAV above the
 * high-water mark, which then rises to the period-end NAV and never falls.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FeeEngine {

    public static final String FEE_NOT_FOUND = "FEE_NOT_FOUND";
    public static final String INVALID_PERIOD = "INVALID_PERIOD";

    private static final BigDecimal DAYS_PER_YEAR = BigDecimal.valueOf(365);

    private final FeeRecordRepository feeRecordRepository;
    private final HighWaterMarkRepository highWaterMarkRepository;
    private final NavSnapshotRepository navSnapshotRepository;
    private final FxRateService fxRateService;
    private final FundProperties fundProperties;

    /**
     * Calculates both fees for [periodStart, periodEnd] from the NAV snapshots on the two boundary dates.
     *
     * @throws PreconditionException     NAV_UNDEFINED when either boundary has no snapshot
     * @throws StateTransitionException  PERIOD_ALREADY_CALCULATED when the period already has fees
     */
    public FeePeriodResult calculate(PortfolioContext ctx, LocalDate periodStart, LocalDate periodEnd) {
        if (periodStart == null || periodEnd == null || !periodEnd.isAfter(periodStart)) {
            throw new FundAccountingException(INVALID_PERIOD, "Fee period must end after it starts: " + periodStart + ".." + periodEnd);
        }
        return ctx.write(() -> {
            BigDecimal navStart = navAt(ctx, periodStart);
            BigDecimal navEnd = navAt(ctx, periodEnd);
            if (feeRecordRepository.existsByPortfolioIdAndInvestorIdAndPeriodStartAndPeriodEndAndStatusIn(
                    ctx.portfolioId(), FeeRecord.FUND_INVESTOR_ID, periodStart, periodEnd,
                    List.of(FeeStatus.CALCULATED, FeeStatus.PAID))) {
                throw new StateTransitionException(StateTransitionException.PERIOD_ALREADY_CALCULATED,
                        "Fees for " + periodStart + ".." + periodEnd + " are already calculated");
            }
            long days = ChronoUnit.DAYS.between(periodStart, periodEnd);
            Instant now = Instant.now();

            BigDecimal basis = fundProperties.getManagementFeeBasis() == FundProperties.ManagementFeeBasis.PERIOD_START
                    ? navStart : navEnd;
            BigDecimal managementAmount = managementFee(basis, fundProperties.getManagementFeeRate(), days);
            FeeRecord management = newRecord(ctx, FeeType.MANAGEMENT, periodStart, periodEnd, navStart, navEnd,
                    fundProperties.getManagementFeeRate());
            management.markCalculated(managementAmount, now);

            HighWaterMarkUpdate hwm = raiseHighWaterMark(ctx, navStart, navEnd, periodEnd);
            FeeRecord performance = null;
            if (navEnd.compareTo(hwm.before()) > 0) {
                BigDecimal performanceAmount = performanceFee(navEnd, hwm.before(), fundProperties.getPerformanceFeeRate());
                performance = newRecord(ctx, FeeType.PERFORMANCE, periodStart, periodEnd, navStart, navEnd,
                        fundProperties.getPerformanceFeeRate());
                performance.markCalculated(performanceAmount, now);
            }

            List<FeeRecord> toSave = new ArrayList<>();
            toSave.add(management);
            if (performance != null) {
                toSave.add(performance);
            }
            feeRecordRepository.saveAll(toSave);
            log.info("Portfolio {}: fees {}..{} management={} performance={} hwm {} -> {}", ctx.portfolioId(),
                    periodStart, periodEnd, managementAmount, performance == null ? BigDecimal.ZERO : performance.getAmount(),
                    hwm.before(), hwm.after());
            return new FeePeriodResult(periodStart, periodEnd, days, navStart, navEnd, management, performance,
                    hwm.before(), hwm.after());
        });
    }

    /** {@code basis * annualRate / 365 * days}, in cents. */
    static BigDecimal managementFee(BigDecimal basis, BigDecimal annualRate, long days) {
        return basis.multiply(annualRate)
                .multiply(BigDecimal.valueOf(days))
                .divide(DAYS_PER_YEAR, Money.SCALE, RoundingMode.HALF_UP);
    }

    /** {@code (navEnd - hwm) * rate} when positive, else zero; in cents. */
    static BigDecimal performanceFee(BigDecimal navEnd, BigDecimal highWaterMark, BigDecimal rate) {
        BigDecimal gain = navEnd.subtract(highWaterMark);
        if (gain.signum() <= 0) {
            return BigDecimal.ZERO.setScale(Money.SCALE);
        }
        return gain.multiply(rate).setScale(Money.SCALE, RoundingMode.HALF_UP);
    }

    private BigDecimal navAt(PortfolioContext ctx, LocalDate date) {
        return navSnapshotRepository.findByPortfolioIdAndDate(ctx.portfolioId(), date)
                .map(NavSnapshot::getNav)
                .orElseThrow(() -> new PreconditionException(PreconditionException.NAV_UNDEFINED,
                        "No NAV snapshot for " + ctx.portfolioId() + " on " + date));
    }

    /**
     * Reads the mark (initialized to {@code navStart}), raises it to {@code navEnd} and saves it. A concurrent
     * writer from another process makes the save fail; the mark is then re-read, up to the configured attempts.
     */
    private HighWaterMarkUpdate raiseHighWaterMark(PortfolioContext ctx, BigDecimal navStart, BigDecimal navEnd, LocalDate date) {
        int maxAttempts = Math.max(1, fundProperties.getHighWaterMarkMaxAttempts());
        for (int attempt = 1; ; attempt++) {
            HighWaterMark mark = highWaterMarkRepository.findById(ctx.portfolioId()).orElseGet(() -> {
                HighWaterMark initial = new HighWaterMark();
                initial.setPortfolioId(ctx.portfolioId());
                initial.setValue(navStart);
                initial.setAsOf(date);
                initial.setUpdatedAt(Instant.now());
                return initial;
            });
            BigDecimal before = mark.getValue();
            boolean isNew = mark.getVersion() == null;
            boolean raised = mark.raiseTo(navEnd, date, Instant.now());
            if (!raised && !isNew) {
                return new HighWaterMarkUpdate(before, before);
            }
            try {
                highWaterMarkRepository.save(mark);
                return new HighWaterMarkUpdate(before, mark.getValue());
            } catch (OptimisticLockingFailureException | DuplicateKeyException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("Portfolio {}: high-water mark changed concurrently, retrying ({}/{})",
                        ctx.portfolioId(), attempt, maxAttempts);
            }
        }
    }

    /**
     * @throws FundAccountingException   FEE_NOT_FOUND for an unknown id
     * @throws StateTransitionException  ALREADY_PAID or NOT_CALCULATED
     */
    public FeeRecord markPaid(PortfolioContext ctx, String feeId, LocalDate paymentDate) {
        return ctx.write(() -> {
            FeeRecord fee = feeRecordRepository.findById(feeId)
                    .filter(f -> ctx.portfolioId().equals(f.getPortfolioId()))
                    .orElseThrow(() -> new FundAccountingException(FEE_NOT_FOUND, "Unknown fee record " + feeId));
            if (fee.getStatus() == FeeStatus.PAID) {
                throw new StateTransitionException(StateTransitionException.ALREADY_PAID,
                        "Fee " + feeId + " was already paid on " + fee.getPaymentDate());
            }
            if (fee.getStatus() != FeeStatus.CALCULATED) {
                throw new StateTransitionException(StateTransitionException.NOT_CALCULATED,
                        "Fee " + feeId + " is " + fee.getStatus() + " and cannot be paid");
            }
            fee.markPaid(paymentDate);
            log.info("Portfolio {}: fee {} paid on {}", ctx.portfolioId(), feeId, paymentDate);
            return feeRecordRepository.save(fee);
        });
    }

    /**
     * Stores historical fee records as they were. A paid or calculated performance fee raises the high-water
     * mark to its period-end NAV.
     */
    public List<RowError> importRecords(PortfolioContext ctx, List<RowResult<FeeRecord>> rows) {
        return ctx.write(() -> {
            List<RowError> errors = new ArrayList<>();
            int stored = 0;
            for (RowResult<FeeRecord> row : rows) {
                if (!row.isOk()) {
                    row.getError().ifPresent(errors::add);
                    continue;
                }
                FeeRecord fee = row.getValue().orElseThrow();
                fee.setPortfolioId(ctx.portfolioId());
                if (fee.getCurrency() == null) {
                    fee.setCurrency(ctx.baseCurrency());
                }
                fee.setId(FeeRecord.idFor(ctx.portfolioId(), fee.getInvestorId(), fee.getFeeType(),
                        fee.getPeriodStart(), fee.getPeriodEnd()));
                if (feeRecordRepository.existsById(fee.getId())) {
                    errors.add(new RowError(row.getRow(), "Fee record already exists: " + fee.getId()));
                    continue;
                }
                feeRecordRepository.save(fee);
                stored++;
                if (fee.getFeeType() == FeeType.PERFORMANCE && fee.getStatus() != FeeStatus.PENDING && fee.getNavEnd() != null) {
                    BigDecimal navStart = fee.getNavStart() != null ? fee.getNavStart() : fee.getNavEnd();
                    raiseHighWaterMark(ctx, navStart, fee.getNavEnd(), fee.getPeriodEnd());
                }
            }
            log.info("Portfolio {}: imported {} fee record(s), {} rejected", ctx.portfolioId(), stored, errors.size());
            return errors;
        });
    }

    /** Calculated fees recorded on or before {@code asOf} and not paid by then, in base currency. */
    public BigDecimal outstandingFees(PortfolioContext ctx, LocalDate asOf) {
        return ctx.read(() -> feeRecordRepository.findByPortfolioIdOrderByPeriodEndAsc(ctx.portfolioId()).stream()
                .filter(f -> f.getStatus() != FeeStatus.PENDING && f.getAmount() != null)
                .filter(f -> f.isOutstandingAt(asOf))
                .map(f -> toBase(ctx, f, asOf))
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(Money.SCALE, RoundingMode.HALF_UP));
    }

    public FeeSummary summary(PortfolioContext ctx, LocalDate from, LocalDate to) {
        return ctx.read(() -> {
            List<FeeRecord> records = feeRecordRepository.findInRange(ctx.portfolioId(), from, to);
            BigDecimal management = BigDecimal.ZERO;
            BigDecimal performance = BigDecimal.ZERO;
            BigDecimal paid = BigDecimal.ZERO;
            BigDecimal outstanding = BigDecimal.ZERO;
            int paidCount = 0;
            int outstandingCount = 0;
            for (FeeRecord f : records) {
                if (f.getAmount() == null) {
                    continue;
                }
                BigDecimal amount = toBase(ctx, f, to);
                if (f.getFeeType() == FeeType.MANAGEMENT) {
                    management = management.add(amount);
                } else {
                    performance = performance.add(amount);
                }
                if (f.isPaid()) {
                    paid = paid.add(amount);
                    paidCount++;
                } else {
                    outstanding = outstanding.add(amount);
                    outstandingCount++;
                }
            }
            return new FeeSummary(from, to, ctx.baseCurrency(), money(management), money(performance),
                    money(management.add(performance)), money(paid), money(outstanding), paidCount, outstandingCount,
                    records);
        });
    }

    public Optional<HighWaterMark> highWaterMark(PortfolioContext ctx) {
        return ctx.read(() -> highWaterMarkRepository.findById(ctx.portfolioId()));
    }

    private FeeRecord newRecord(PortfolioContext ctx, FeeType type, LocalDate start, LocalDate end,
                                BigDecimal navStart, BigDecimal navEnd, BigDecimal rate) {
        FeeRecord fee = new FeeRecord();
        fee.setId(FeeRecord.idFor(ctx.portfolioId(), FeeRecord.FUND_INVESTOR_ID, type, start, end));
        fee.setPortfolioId(ctx.portfolioId());
        fee.setInvestorId(FeeRecord.FUND_INVESTOR_ID);
        fee.setDate(end);
        fee.setPeriodStart(start);
        fee.setPeriodEnd(end);
        fee.setFeeType(type);
        fee.setNavStart(navStart);
        fee.setNavEnd(navEnd);
        fee.setRate(rate);
        fee.setCurrency(ctx.baseCurrency());
        return fee;
    }

    private BigDecimal toBase(PortfolioContext ctx, FeeRecord fee, LocalDate asOf) {
        String ccy = fee.getCurrency() == null ? ctx.baseCurrency() : fee.getCurrency();
        return fxRateService.rate(ccy, ctx.baseCurrency(), asOf).convert(fee.getAmount());
    }

    private static BigDecimal money(BigDecimal v) {
        return v.setScale(Money.SCALE, RoundingMode.HALF_UP);
    }

    private record HighWaterMarkUpdate(BigDecimal before, BigDecimal after) {
    }
}
