package com.wealthdesk.ledger;

import com.wealthdesk.domain.enums.OrderSide;
import com.wealthdesk.domain.model.Portfolio;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies fills to cash and holdings as one unit.
 *
 * <p>Each portfolio has its own {@link ReentrantLock}. The executor runs its whole
 * status-check-and-fill step inside {@link #withPortfolioLock}, so two triggers for
 * the same order serialize and the second sees a terminal status. Fills on different
 * portfolios never contend.
 *
 * <p>{@link #applyFill} prepares both sides first. If either refuses, a
 * {@link com.wealthdesk.exception.LedgerException} propagates and neither side
 * has been written. A failure while writing the holding puts back both the holding
 * and the cash before the exception propagates.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private final CashLedger cashLedger;
    private final HoldingsBook holdingsBook;
    private final Map<String, ReentrantLock> portfolioLocks = new ConcurrentHashMap<>();

    public LedgerService(CashLedger cashLedger, HoldingsBook holdingsBook) {
        this.cashLedger = cashLedger;
        this.holdingsBook = holdingsBook;
    }

    public <T> T withPortfolioLock(String portfolioId, Supplier<T> action) {
        ReentrantLock lock = portfolioLocks.computeIfAbsent(portfolioId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public FillResult applyFill(
            Portfolio portfolio,
            String instrumentId,
            OrderSide side,
            int quantity,
            BigDecimal price,
            LocalDateTime at) {
        return withPortfolioLock(portfolio.getId(), () -> {
            CashMutation cashMutation = cashLedger.prepare(portfolio, side, quantity, price);
            HoldingMutation holdingMutation =
                    holdingsBook.prepare(portfolio.getId(), instrumentId, side, quantity, price, at);

            cashLedger.commit(cashMutation, at);
            try {
                holdingsBook.commit(holdingMutation);
            } catch (RuntimeException e) {
                log.error(
                        "Holding write failed for {} in portfolio {}, reverting fill",
                        instrumentId,
                        portfolio.getId(),
                        e);
                holdingsBook.revert(holdingMutation);
                cashLedger.revert(cashMutation);
                throw e;
            }

            log.debug(
                    "Applied {} fill of {} x {} @ {} to portfolio {}",
                    side,
                    quantity,
                    instrumentId,
                    price,
                    portfolio.getId());

            return FillResult.builder()
                    .amount(cashMutation.getDelta().abs())
                    .cashAfter(cashMutation.getNewCash())
                    .holdingAfter(holdingMutation.getNext())
                    .realizedGain(holdingMutation.getRealizedGain())
                    .build();
        });
    }
}
