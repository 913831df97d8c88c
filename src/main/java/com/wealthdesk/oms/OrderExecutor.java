package com.wealthdesk.oms;

import com.wealthdesk.catalog.InstrumentCatalog;
import com.wealthdesk.domain.enums.AuditEventType;
import com.wealthdesk.domain.enums.TransactionType;
import com.wealthdesk.domain.model.Instrument;
import com.wealthdesk.domain.model.Order;
import com.wealthdesk.domain.model.Portfolio;
import com.wealthdesk.domain.model.Transaction;
import com.wealthdesk.event.EventPublisherHelper;
import com.wealthdesk.exception.LedgerException;
import com.wealthdesk.ledger.FillResult;
import com.wealthdesk.ledger.LedgerService;
import com.wealthdesk.repository.memory.OrderMemoryRepository;
import com.wealthdesk.repository.memory.PortfolioMemoryRepository;
import com.wealthdesk.service.AuditService;
import com.wealthdesk.service.TransactionRecorder;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fills one accepted order.
 *
 * <p>The status guard, price resolution, ledger mutation and terminal transition all
 * run under the portfolio's ledger lock, so a second trigger for the same order
 * finds it terminal and does nothing. The transaction, audit entry and order event
 * are written after the lock is released.
 *
 * <p>Fill price is the limit price for LIMIT orders and the instrument's price at
 * execution time otherwise. A ledger refusal (nothing to sell, oversell, cash would
 * go negative) marks the order FAILED with the refusal message and leaves cash and
 * holdings untouched.
 *
 * <p>The ledger is the record of truth once the fill is applied: a failed transaction
 * or audit append is logged with the order id and the remaining steps still run.
 */
@Service
public class OrderExecutor {

    private static final Logger log = LoggerFactory.getLogger(OrderExecutor.class);

    static final String INSTRUMENT_NOT_FOUND = "Instrument not found";
    static final String PORTFOLIO_NOT_FOUND = "Portfolio not found";
    static final String FILL_NOT_APPLIED = "Fill could not be applied";

    private final OrderMemoryRepository orderMemoryRepository;
    private final PortfolioMemoryRepository portfolioMemoryRepository;
    private final InstrumentCatalog instrumentCatalog;
    private final LedgerService ledgerService;
    private final TransactionRecorder transactionRecorder;
    private final AuditService auditService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public OrderExecutor(
            OrderMemoryRepository orderMemoryRepository,
            PortfolioMemoryRepository portfolioMemoryRepository,
            InstrumentCatalog instrumentCatalog,
            LedgerService ledgerService,
            TransactionRecorder transactionRecorder,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.orderMemoryRepository = orderMemoryRepository;
        this.portfolioMemoryRepository = portfolioMemoryRepository;
        this.instrumentCatalog = instrumentCatalog;
        this.ledgerService = ledgerService;
        this.transactionRecorder = transactionRecorder;
        this.auditService = auditService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public ExecutionOutcome execute(String orderId) {
        Order order = orderMemoryRepository.findById(orderId).orElse(null);
        if (order == null) {
            log.warn("Execution requested for unknown order {}", orderId);
            return ExecutionOutcome.skipped(null);
        }

        ExecutionOutcome outcome = ledgerService.withPortfolioLock(order.getPortfolioId(), () -> fillLocked(order));
        if (outcome.isSkipped()) {
            log.debug("Order {} already {}, execution skipped", orderId, order.getStatus());
            return outcome;
        }

        if (outcome.isExecuted()) {
            recordExecuted(outcome);
        } else {
            recordFailed(outcome);
        }
        return outcome;
    }

    private ExecutionOutcome fillLocked(Order order) {
        if (!order.isPending()) {
            return ExecutionOutcome.skipped(order);
        }

        Portfolio portfolio =
                portfolioMemoryRepository.findById(order.getPortfolioId()).orElse(null);
        if (portfolio == null) {
            order.markFailed(PORTFOLIO_NOT_FOUND);
            return failed(order, null, order.getInstrumentId());
        }

        Instrument instrument = instrumentCatalog.find(order.getInstrumentId()).orElse(null);
        if (instrument == null) {
            order.markFailed(INSTRUMENT_NOT_FOUND);
            return failed(order, portfolio.getClientId(), order.getInstrumentId());
        }

        BigDecimal price = order.resolveExecutionPrice(instrument.getCurrentPrice());
        LocalDateTime now = LocalDateTime.now(clock);

        FillResult fill;
        try {
            fill = ledgerService.applyFill(
                    portfolio, instrument.getId(), order.getSide(), order.getQuantity(), price, now);
        } catch (LedgerException e) {
            order.markFailed(e.getMessage());
            return failed(order, portfolio.getClientId(), instrument.getSymbol());
        } catch (RuntimeException e) {
            log.error("Fill of order {} could not be applied", order.getId(), e);
            order.markFailed(FILL_NOT_APPLIED + ": " + e.getMessage());
            return failed(order, portfolio.getClientId(), instrument.getSymbol());
        }

        order.markExecuted(price, now);

        Transaction transaction = Transaction.builder()
                .id(UUID.randomUUID().toString())
                .orderId(order.getId())
                .portfolioId(portfolio.getId())
                .instrumentId(instrument.getId())
                .type(TransactionType.of(order.getSide()))
                .quantity(order.getQuantity())
                .price(price)
                .amount(fill.getAmount())
                .realizedGain(fill.getRealizedGain())
                .timestamp(now)
                .build();

        return ExecutionOutcome.builder()
                .order(order)
                .transaction(transaction)
                .clientId(portfolio.getClientId())
                .instrumentSymbol(instrument.getSymbol())
                .build();
    }

    private static ExecutionOutcome failed(Order order, String clientId, String instrumentSymbol) {
        return ExecutionOutcome.builder()
                .order(order)
                .clientId(clientId)
                .instrumentSymbol(instrumentSymbol)
                .build();
    }

    private void recordExecuted(ExecutionOutcome outcome) {
        Order order = outcome.getOrder();
        try {
            transactionRecorder.append(outcome.getTransaction());
        } catch (RuntimeException e) {
            log.error(
                    "Transaction append failed for executed order {}, needs reconciliation: {}",
                    order.getId(),
                    outcome.getTransaction(),
                    e);
        }
        recordAudit(
                AuditEventType.ORDER_EXECUTED,
                outcome,
                Map.of(
                        "executedPrice", order.getExecutedPrice(),
                        "amount", outcome.getTransaction().getAmount()));
        eventPublisherHelper.publishOrderExecuted(this, order);

        log.info(
                "Order executed: id={}, {} {} x {} @ {}",
                order.getId(),
                order.getSide(),
                order.getQuantity(),
                outcome.getInstrumentSymbol(),
                order.getExecutedPrice());
    }

    private void recordFailed(ExecutionOutcome outcome) {
        Order order = outcome.getOrder();
        recordAudit(AuditEventType.ORDER_FAILED, outcome, Map.of("reason", order.getFailureReason()));
        eventPublisherHelper.publishOrderFailed(this, order);

        log.warn("Order failed: id={}, reason={}", order.getId(), order.getFailureReason());
    }

    private void recordAudit(AuditEventType type, ExecutionOutcome outcome, Map<String, Object> extra) {
        try {
            auditService.recordOrderEvent(
                    type, outcome.getOrder(), outcome.getClientId(), outcome.getInstrumentSymbol(), extra);
        } catch (RuntimeException e) {
            log.error("Audit append {} failed for order {}", type, outcome.getOrder().getId(), e);
        }
    }
}
