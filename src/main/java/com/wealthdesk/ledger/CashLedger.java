package com.wealthdesk.ledger;

import com.wealthdesk.domain.enums.OrderSide;
import com.wealthdesk.domain.model.Portfolio;
import com.wealthdesk.exception.LedgerException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cash side of the ledger.
 *
 * <p>Fills go through {@link #prepare} then {@link #commit}. Prepare validates and
 * computes the new balance without touching the portfolio; commit only writes. The
 * {@link LedgerService} prepares both cash and holdings before committing either,
 * so a refused fill leaves everything untouched. Cash never goes negative.
 */
@Component
public class CashLedger {

    private static final Logger log = LoggerFactory.getLogger(CashLedger.class);

    public CashSufficiency checkSufficiency(Portfolio portfolio, BigDecimal estimatedCost) {
        BigDecimal available = portfolio.getCash();
        return CashSufficiency.builder()
                .sufficient(available.compareTo(estimatedCost) >= 0)
                .available(available)
                .required(estimatedCost)
                .build();
    }

    public CashMutation prepare(Portfolio portfolio, OrderSide side, int quantity, BigDecimal price) {
        BigDecimal amount = price.multiply(BigDecimal.valueOf(quantity));
        BigDecimal delta = side == OrderSide.BUY ? amount.negate() : amount;
        BigDecimal previousCash = portfolio.getCash();
        BigDecimal newCash = previousCash.add(delta);

        if (newCash.signum() < 0) {
            throw new LedgerException(
                    String.format("Insufficient cash: required %s, available %s", amount, previousCash),
                    Map.of("portfolioId", portfolio.getId(), "required", amount, "available", previousCash));
        }

        return CashMutation.builder()
                .portfolio(portfolio)
                .previousCash(previousCash)
                .newCash(newCash)
                .delta(delta)
                .build();
    }

    /** Restores the balance a committed mutation replaced. */
    public void revert(CashMutation mutation) {
        Portfolio portfolio = mutation.getPortfolio();
        portfolio.setCash(mutation.getPreviousCash());
        log.warn(
                "Reverted cash for portfolio {}: {} -> {}",
                portfolio.getId(),
                mutation.getNewCash(),
                mutation.getPreviousCash());
    }

    public void commit(CashMutation mutation, LocalDateTime at) {
        Portfolio portfolio = mutation.getPortfolio();
        portfolio.setCash(mutation.getNewCash());
        portfolio.setLastUpdated(at);
        log.debug(
                "Cash {} for portfolio {}: {} -> {}",
                mutation.getDelta().signum() < 0 ? "debited" : "credited",
                portfolio.getId(),
                mutation.getPreviousCash(),
                mutation.getNewCash());
    }
}
