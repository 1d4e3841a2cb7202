package com.fundradar.fund;

import com.fundradar.context.PortfolioContext;
import com.fundradar.domain.InvestorAccount;
import com.fundradar.domain.InvestorAccountRepository;
import com.fundradar.domain.InvestorStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InvestorRegistryTest {

    @Mock
    private InvestorAccountRepository investorAccountRepository;

    @InjectMocks
    private InvestorRegistry investorRegistry;

    private final PortfolioContext ctx = new PortfolioContext("fund-1", "BRL");

    private static InvestorAccount existing(String name) {
        InvestorAccount a = new InvestorAccount();
        a.setId("fund-1:alice");
        a.setPortfolioId("fund-1");
        a.setInvestorId("alice");
        a.setName(name);
        return a;
    }

    @Test
    void register_newInvestor_isActive() {
        when(investorAccountRepository.findByPortfolioIdAndInvestorId("fund-1", "alice")).thenReturn(Optional.empty());
        when(investorAccountRepository.save(any(InvestorAccount.class))).thenAnswer(inv -> inv.getArgument(0));

        InvestorAccount account = investorRegistry.register(ctx, "alice", " ");

        assertThat(account.getId()).isEqualTo("fund-1:alice");
        assertThat(account.getName()).isEqualTo("alice");
        assertThat(account.getStatus()).isEqualTo(InvestorStatus.ACTIVE);
        assertThat(account.getCreatedAt()).isNotNull();
    }

    @Test
    void register_existing_refreshesNameOnlyWhenChanged() {
        when(investorAccountRepository.findByPortfolioIdAndInvestorId("fund-1", "alice"))
                .thenReturn(Optional.of(existing("Alice")));

        assertThat(investorRegistry.register(ctx, "alice", "Alice").getName()).isEqualTo("Alice");
        assertThat(investorRegistry.register(ctx, "alice", null).getName()).isEqualTo("Alice");
        verify(investorAccountRepository, never()).save(any());
    }

    @Test
    void register_blankId_isInvalid() {
        assertThatThrownBy(() -> investorRegistry.register(ctx, "", "Nobody"))
                .isInstanceOf(FundAccountingException.class)
                .extracting(e -> ((FundAccountingException) e).getErrorCode())
                .isEqualTo(CashLedger.INVALID_CASH_FLOW);
    }

    @Test
    void deactivate() {
        when(investorAccountRepository.findByPortfolioIdAndInvestorId("fund-1", "alice"))
                .thenReturn(Optional.of(existing("Alice")));
        when(investorAccountRepository.save(any(InvestorAccount.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThat(investorRegistry.deactivate(ctx, "alice").isActive()).isFalse();
    }

    @Test
    void deactivate_unknown_isNotFound() {
        when(investorAccountRepository.findByPortfolioIdAndInvestorId("fund-1", "ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> investorRegistry.deactivate(ctx, "ghost"))
                .extracting(e -> ((FundAccountingException) e).getErrorCode())
                .isEqualTo(InvestorRegistry.INVESTOR_NOT_FOUND);
    }
}
