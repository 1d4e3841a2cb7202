package com.fundradar.fund;

import com.fundradar.context.PortfolioContext;
import com.fundradar.domain.InvestorAccount;
import com.fundradar.domain.InvestorAccountRepository;
import com.fundradar.domain.InvestorStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Investor accounts of a portfolio.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InvestorRegistry {

    public static final String INVESTOR_NOT_FOUND = "INVESTOR_NOT_FOUND";

    private final InvestorAccountRepository investorAccountRepository;

    /**
     * Registers the investor, or returns the existing account (its name is refreshed when a new one is given).
     */
    public InvestorAccount register(PortfolioContext ctx, String investorId, String name) {
        return ctx.write(() -> ensureRegistered(ctx, investorId, name));
    }

    /** Caller holds the write lock. */
    InvestorAccount ensureRegistered(PortfolioContext ctx, String investorId, String name) {
        if (investorId == null || investorId.isBlank()) {
            throw new FundAccountingException(CashLedger.INVALID_CASH_FLOW, "investorId is required");
        }
        Optional<InvestorAccount> existing = investorAccountRepository.findByPortfolioIdAndInvestorId(ctx.portfolioId(), investorId);
        if (existing.isPresent()) {
            InvestorAccount account = existing.get();
            if (name != null && !name.isBlank() && !name.equals(account.getName())) {
                account.setName(name);
                return investorAccountRepository.save(account);
            }
            return account;
        }
        InvestorAccount account = new InvestorAccount();
        account.setId(InvestorAccount.idFor(ctx.portfolioId(), investorId));
        account.setPortfolioId(ctx.portfolioId());
        account.setInvestorId(investorId);
        account.setName(name != null && !name.isBlank() ? name : investorId);
        account.setStatus(InvestorStatus.ACTIVE);
        account.setCreatedAt(Instant.now());
        log.info("Portfolio {}: registered investor {}", ctx.portfolioId(), investorId);
        return investorAccountRepository.save(account);
    }

    public InvestorAccount deactivate(PortfolioContext ctx, String investorId) {
        return ctx.write(() -> {
            InvestorAccount account = investorAccountRepository.findByPortfolioIdAndInvestorId(ctx.portfolioId(), investorId)
                    .orElseThrow(() -> new FundAccountingException(INVESTOR_NOT_FOUND, "Unknown investor " + investorId));
            account.setStatus(InvestorStatus.INACTIVE);
            log.info("Portfolio {}: deactivated investor {}", ctx.portfolioId(), investorId);
            return investorAccountRepository.save(account);
        });
    }

    public Optional<InvestorAccount> find(PortfolioContext ctx, String investorId) {
        return ctx.read(() -> investorAccountRepository.findByPortfolioIdAndInvestorId(ctx.portfolioId(), investorId));
    }

    public List<InvestorAccount> investors(PortfolioContext ctx) {
        return ctx.read(() -> investorAccountRepository.findByPortfolioId(ctx.portfolioId()));
    }
}
