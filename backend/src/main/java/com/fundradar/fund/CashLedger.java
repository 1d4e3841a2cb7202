package com.fundradar.fund;

import com.fundradar.common.Money;
import com.fundradar.common.RowError;
import com.fundradar.common.RowResult;
import com.fundradar.context.PortfolioContext;
import com.fundradar.domain.CashFlow;
import com.fundradar.domain.CashFlowRepository;
import com.fundradar.domain.CashFlowType;
import com.fundradar.domain.InvestorAccount;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only investor cash flows and the contribution figures derived from them. Amounts are converted to the
 * portfolio base currency at read time.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CashLedger {

    public static final String INVALID_CASH_FLOW = "INVALID_CASH_FLOW";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int PCT_SCALE = 6;

    private final CashFlowRepository cashFlowRepository;
    private final InvestorRegistry investorRegistry;
    private final FxRateService fxRateService;

    /**
     * Validates and appends one flow. Unknown investors are registered on the fly; inactive investors may
     * still withdraw but not deposit.
     *
     * @throws FundAccountingException INVALID_CASH_FLOW for a malformed flow
     * @throws PreconditionException   INVESTOR_INACTIVE for a deposit by a deactivated investor
     */
    public CashFlow addCashFlow(PortfolioContext ctx, CashFlow flow) {
        return ctx.write(() -> appendLocked(ctx, flow));
    }

    /**
     * Appends parsed rows in file order. Parse failures and validation failures are reported per row.
     */
    public List<RowError> addAll(PortfolioContext ctx, List<RowResult<CashFlow>> rows) {
        return ctx.write(() -> {
            List<RowError> errors = new ArrayList<>();
            int stored = 0;
            for (RowResult<CashFlow> row : rows) {
                if (!row.isOk()) {
                    row.getError().ifPresent(errors::add);
                    continue;
                }
                try {
                    appendLocked(ctx, row.getValue().orElseThrow());
                    stored++;
                } catch (FundAccountingException e) {
                    errors.add(new RowError(row.getRow(), e.getMessage()));
                }
            }
            log.info("Portfolio {}: stored {} cash flow(s), {} rejected", ctx.portfolioId(), stored, errors.size());
            return errors;
        });
    }

    private CashFlow appendLocked(PortfolioContext ctx, CashFlow flow) {
        validate(flow);
        InvestorAccount investor = investorRegistry.ensureRegistered(ctx, flow.getInvestorId(), flow.getInvestorName());
        if (flow.getType() == CashFlowType.DEPOSIT && !investor.isActive()) {
            throw new PreconditionException(PreconditionException.INVESTOR_INACTIVE,
                    "Investor " + flow.getInvestorId() + " is inactive and cannot deposit");
        }
        flow.setId(UUID.randomUUID().toString());
        flow.setPortfolioId(ctx.portfolioId());
        flow.setCurrency(flow.getCurrency() == null ? ctx.baseCurrency() : flow.getCurrency().toUpperCase());
        if (flow.getInvestorName() == null) {
            flow.setInvestorName(investor.getName());
        }
        flow.setRecordedAt(Instant.now());
        CashFlow saved = cashFlowRepository.insert(flow);
        log.debug("Portfolio {}: {} {} {} by {} on {}", ctx.portfolioId(), saved.getType(), saved.getAmount(),
                saved.getCurrency(), saved.getInvestorId(), saved.getDate());
        return saved;
    }

    private static void validate(CashFlow flow) {
        if (flow.getDate() == null) {
            throw new FundAccountingException(INVALID_CASH_FLOW, "Cash flow date is required");
        }
        if (flow.getType() == null) {
            throw new FundAccountingException(INVALID_CASH_FLOW, "Cash flow type is required");
        }
        if (flow.getAmount() == null || flow.getAmount().signum() <= 0) {
            throw new FundAccountingException(INVALID_CASH_FLOW, "Cash flow amount must be positive: " + flow.getAmount());
        }
        if (flow.getInvestorId() == null || flow.getInvestorId().isBlank()) {
            throw new FundAccountingException(INVALID_CASH_FLOW, "investorId is required");
        }
    }

    /** Deposits minus withdrawals dated on or before {@code asOf}, in base currency. */
    public Money cashPosition(PortfolioContext ctx, LocalDate asOf) {
        return ctx.read(() -> {
            Money total = Money.zero(ctx.baseCurrency());
            for (CashFlow f : cashFlowRepository.findByPortfolioIdAndDateLessThanEqualOrderByDateAsc(ctx.portfolioId(), asOf)) {
                total = total.plus(new Money(toBase(ctx, f.signedAmount(), f.getCurrency(), asOf), ctx.baseCurrency()));
            }
            return total.rounded();
        });
    }

    public BigDecimal netContribution(PortfolioContext ctx, String investorId, LocalDate asOf) {
        return ctx.read(() -> stakesLocked(ctx, asOf).stream()
                .filter(s -> s.investorId().equals(investorId))
                .map(InvestorStake::netContribution)
                .findFirst()
                .orElse(BigDecimal.ZERO));
    }

    /** Stake in percent; zero when the fund's total net contribution is not positive. */
    public BigDecimal stakePct(PortfolioContext ctx, String investorId, LocalDate asOf) {
        return ctx.read(() -> stakesLocked(ctx, asOf).stream()
                .filter(s -> s.investorId().equals(investorId))
                .map(InvestorStake::stakePct)
                .findFirst()
                .orElse(BigDecimal.ZERO));
    }

    /** One row per investor with flows on or before {@code asOf}, largest net contribution first. */
    public List<InvestorStake> stakes(PortfolioContext ctx, LocalDate asOf) {
        return ctx.read(() -> stakesLocked(ctx, asOf));
    }

    private List<InvestorStake> stakesLocked(PortfolioContext ctx, LocalDate asOf) {
        Map<String, Totals> byInvestor = new LinkedHashMap<>();
        for (CashFlow f : cashFlowRepository.findByPortfolioIdAndDateLessThanEqualOrderByDateAsc(ctx.portfolioId(), asOf)) {
            Totals t = byInvestor.computeIfAbsent(f.getInvestorId(), id -> new Totals(f.getInvestorName()));
            BigDecimal amount = toBase(ctx, f.getAmount(), f.getCurrency(), asOf);
            if (f.getType() == CashFlowType.DEPOSIT) {
                t.deposits = t.deposits.add(amount);
                if (t.firstInvestment == null) {
                    t.firstInvestment = f.getDate();
                }
            } else {
                t.withdrawals = t.withdrawals.add(amount);
            }
        }
        BigDecimal totalNet = byInvestor.values().stream()
                .map(Totals::net)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        List<InvestorStake> stakes = new ArrayList<>();
        byInvestor.forEach((investorId, t) -> {
            BigDecimal pct = totalNet.signum() > 0
                    ? t.net().multiply(HUNDRED).divide(totalNet, PCT_SCALE, RoundingMode.HALF_UP)
                    : BigDecimal.ZERO;
            stakes.add(new InvestorStake(investorId, t.name, money(t.deposits), money(t.withdrawals), money(t.net()),
                    t.firstInvestment, pct));
        });
        stakes.sort(Comparator.comparing(InvestorStake::netContribution).reversed()
                .thenComparing(InvestorStake::investorId));
        return stakes;
    }

    /** Flows dated in [from, to], oldest first. */
    public List<CashFlow> cashFlowHistory(PortfolioContext ctx, LocalDate from, LocalDate to) {
        return ctx.read(() -> cashFlowRepository.findByPortfolioIdOrderByDateAsc(ctx.portfolioId()).stream()
                .filter(f -> !f.getDate().isBefore(from) && !f.getDate().isAfter(to))
                .toList());
    }

    /** Cumulative contributions of one investor, one point per date with a flow. Converted at {@code asOf}. */
    public List<ContributionPoint> investorHistory(PortfolioContext ctx, String investorId, LocalDate asOf) {
        return ctx.read(() -> {
            List<ContributionPoint> points = new ArrayList<>();
            BigDecimal deposits = BigDecimal.ZERO;
            BigDecimal withdrawals = BigDecimal.ZERO;
            for (CashFlow f : cashFlowRepository.findByPortfolioIdAndInvestorIdOrderByDateAsc(ctx.portfolioId(), investorId)) {
                if (f.getDate().isAfter(asOf)) {
                    break;
                }
                BigDecimal amount = toBase(ctx, f.getAmount(), f.getCurrency(), asOf);
                if (f.getType() == CashFlowType.DEPOSIT) {
                    deposits = deposits.add(amount);
                } else {
                    withdrawals = withdrawals.add(amount);
                }
                ContributionPoint point = new ContributionPoint(f.getDate(), money(deposits), money(withdrawals),
                        money(deposits.subtract(withdrawals)));
                if (!points.isEmpty() && points.get(points.size() - 1).date().equals(f.getDate())) {
                    points.set(points.size() - 1, point);
                } else {
                    points.add(point);
                }
            }
            return points;
        });
    }

    private BigDecimal toBase(PortfolioContext ctx, BigDecimal amount, String currency, LocalDate asOf) {
        String ccy = currency == null ? ctx.baseCurrency() : currency;
        return fxRateService.rate(ccy, ctx.baseCurrency(), asOf).convert(amount);
    }

    private static BigDecimal money(BigDecimal v) {
        return v.setScale(Money.SCALE, RoundingMode.HALF_UP);
    }

    private static final class Totals {
        private final String name;
        private BigDecimal deposits = BigDecimal.ZERO;
        private BigDecimal withdrawals = BigDecimal.ZERO;
        private LocalDate firstInvestment;

        private Totals(String name) {
            this.name = name;
        }

        private BigDecimal net() {
            return deposits.subtract(withdrawals);
        }
    }
}
