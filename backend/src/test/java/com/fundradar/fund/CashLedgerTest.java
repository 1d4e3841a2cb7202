package com.fundradar.fund;

import com.fundradar.common.Money;
import com.fundradar.common.RowError;
import com.fundradar.common.RowResult;
import com.fundradar.context.PortfolioContext;
import com.fundradar.domain.CashFlow;
import com.fundradar.domain.CashFlowRepository;
import com.fundradar.domain.CashFlowType;
import com.fundradar.domain.InvestorAccount;
import com.fundradar.domain.InvestorStatus;
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
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CashLedgerTest {

    private static final LocalDate D1 = LocalDate.of(2024, 1, 2);
    private static final LocalDate D2 = LocalDate.of(2024, 3, 1);
    private static final LocalDate AS_OF = LocalDate.of(2024, 6, 28);

    @Mock
    private CashFlowRepository cashFlowRepository;
    @Mock
    private InvestorRegistry investorRegistry;
    @Mock
    private FxRateService fxRateService;

    @InjectMocks
    private CashLedger cashLedger;

    private final PortfolioContext ctx = new PortfolioContext("fund-1", "BRL");

    private static CashFlow flow(String investorId, LocalDate date, CashFlowType type, String amount) {
        CashFlow f = new CashFlow();
        f.setInvestorId(investorId);
        f.setInvestorName(investorId.toUpperCase());
        f.setDate(date);
        f.setType(type);
        f.setAmount(new BigDecimal(amount));
        f.setCurrency("BRL");
        return f;
    }

    private static InvestorAccount account(String investorId, InvestorStatus status) {
        InvestorAccount a = new InvestorAccount();
        a.setPortfolioId("fund-1");
        a.setInvestorId(investorId);
        a.setName("Alice");
        a.setStatus(status);
        return a;
    }

    private void identityFx() {
        when(fxRateService.rate(eq("BRL"), eq("BRL"), any(LocalDate.class))).thenReturn(FxRate.identity("BRL"));
    }

    @Test
    void addCashFlow_registersAndAppends() {
        CashFlow deposit = flow("alice", D1, CashFlowType.DEPOSIT, "600000");
        deposit.setInvestorName(null);
        deposit.setCurrency("brl");
        when(investorRegistry.ensureRegistered(ctx, "alice", null)).thenReturn(account("alice", InvestorStatus.ACTIVE));
        when(cashFlowRepository.insert(any(CashFlow.class))).thenAnswer(inv -> inv.getArgument(0));

        CashFlow saved = cashLedger.addCashFlow(ctx, deposit);

        assertThat(saved.getId()).isNotBlank();
        assertThat(saved.getPortfolioId()).isEqualTo("fund-1");
        assertThat(saved.getCurrency()).isEqualTo("BRL");
        assertThat(saved.getInvestorName()).isEqualTo("Alice");
        assertThat(saved.getRecordedAt()).isNotNull();
    }

    @Test
    @DisplayName("inactive investor cannot deposit but can withdraw")
    void inactiveInvestor() {
        when(investorRegistry.ensureRegistered(ctx, "alice", "ALICE")).thenReturn(account("alice", InvestorStatus.INACTIVE));
        when(cashFlowRepository.insert(any(CashFlow.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThatThrownBy(() -> cashLedger.addCashFlow(ctx, flow("alice", D2, CashFlowType.DEPOSIT, "100")))
                .isInstanceOf(PreconditionException.class)
                .extracting(e -> ((FundAccountingException) e).getErrorCode())
                .isEqualTo(PreconditionException.INVESTOR_INACTIVE);

        assertThat(cashLedger.addCashFlow(ctx, flow("alice", D2, CashFlowType.WITHDRAWAL, "100")).getId()).isNotNull();
    }

    @Test
    void addCashFlow_nonPositiveAmount_isInvalid() {
        assertThatThrownBy(() -> cashLedger.addCashFlow(ctx, flow("alice", D1, CashFlowType.DEPOSIT, "0")))
                .isInstanceOf(FundAccountingException.class)
                .extracting(e -> ((FundAccountingException) e).getErrorCode())
                .isEqualTo(CashLedger.INVALID_CASH_FLOW);
        verify(cashFlowRepository, never()).insert(any(CashFlow.class));
    }

    @Test
    @DisplayName("batch append reports parse and validation failures per row")
    void addAll_collectsRowErrors() {
        when(investorRegistry.ensureRegistered(ctx, "bob", "BOB")).thenReturn(account("bob", InvestorStatus.ACTIVE));
        when(cashFlowRepository.insert(any(CashFlow.class))).thenAnswer(inv -> inv.getArgument(0));

        List<RowError> errors = cashLedger.addAll(ctx, List.of(
                RowResult.ok(1, flow("bob", D1, CashFlowType.DEPOSIT, "1000")),
                RowResult.<CashFlow>rejected(2, "unparseable amount 'abc'"),
                RowResult.ok(3, flow("bob", D1, CashFlowType.DEPOSIT, "-5"))));

        assertThat(errors).extracting(RowError::row).containsExactly(2, 3);
        verify(cashFlowRepository).insert(any(CashFlow.class));
    }

    @Test
    @DisplayName("stakes are net contributions over the fund total, largest first")
    void stakes() {
        identityFx();
        when(cashFlowRepository.findByPortfolioIdAndDateLessThanEqualOrderByDateAsc("fund-1", AS_OF)).thenReturn(List.of(
                flow("alice", D1, CashFlowType.DEPOSIT, "600000"),
                flow("bob", D1, CashFlowType.DEPOSIT, "400000"),
                flow("bob", D2, CashFlowType.WITHDRAWAL, "100000")));

        List<InvestorStake> stakes = cashLedger.stakes(ctx, AS_OF);

        assertThat(stakes).extracting(InvestorStake::investorId).containsExactly("alice", "bob");
        assertThat(stakes.get(0).stakePct()).isEqualByComparingTo("66.666667");
        assertThat(stakes.get(1).stakePct()).isEqualByComparingTo("33.333333");
        assertThat(stakes.get(1).netContribution()).isEqualByComparingTo("300000");
        assertThat(stakes.get(1).firstInvestmentDate()).isEqualTo(D1);
        assertThat(cashLedger.stakePct(ctx, "carol", AS_OF)).isEqualByComparingTo("0");
    }

    @Test
    void stakes_nonPositiveTotal_isZero() {
        identityFx();
        when(cashFlowRepository.findByPortfolioIdAndDateLessThanEqualOrderByDateAsc("fund-1", AS_OF)).thenReturn(List.of(
                flow("alice", D1, CashFlowType.DEPOSIT, "100"),
                flow("alice", D2, CashFlowType.WITHDRAWAL, "100")));

        assertThat(cashLedger.stakes(ctx, AS_OF)).singleElement()
                .satisfies(s -> assertThat(s.stakePct()).isEqualByComparingTo("0"));
    }

    @Test
    void cashPosition_convertsForeignFlows() {
        CashFlow usd = flow("bob", D2, CashFlowType.DEPOSIT, "1000");
        usd.setCurrency("USD");
        when(cashFlowRepository.findByPortfolioIdAndDateLessThanEqualOrderByDateAsc("fund-1", AS_OF)).thenReturn(List.of(
                flow("alice", D1, CashFlowType.DEPOSIT, "600000"),
                flow("alice", D2, CashFlowType.WITHDRAWAL, "50000"),
                usd));
        identityFx();
        when(fxRateService.rate("USD", "BRL", AS_OF)).thenReturn(new FxRate("USD", "BRL", new BigDecimal("5"), false));

        Money cash = cashLedger.cashPosition(ctx, AS_OF);

        assertThat(cash.amount()).isEqualByComparingTo("555000.00");
        assertThat(cash.currency()).isEqualTo("BRL");
    }

    @Test
    @DisplayName("investor history has one cumulative point per date")
    void investorHistory() {
        identityFx();
        when(cashFlowRepository.findByPortfolioIdAndInvestorIdOrderByDateAsc("fund-1", "bob")).thenReturn(List.of(
                flow("bob", D1, CashFlowType.DEPOSIT, "400000"),
                flow("bob", D1, CashFlowType.DEPOSIT, "100000"),
                flow("bob", D2, CashFlowType.WITHDRAWAL, "100000"),
                flow("bob", AS_OF.plusDays(1), CashFlowType.DEPOSIT, "1")));

        List<ContributionPoint> history = cashLedger.investorHistory(ctx, "bob", AS_OF);

        assertThat(history).hasSize(2);
        assertThat(history.get(0).deposits()).isEqualByComparingTo("500000");
        assertThat(history.get(1).netContribution()).isEqualByComparingTo("400000");
        assertThat(history.get(1).withdrawals()).isEqualByComparingTo("100000");
    }
}
