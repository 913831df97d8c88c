package com.wealthdesk.domain.model;

import com.wealthdesk.domain.enums.OrderSide;
import com.wealthdesk.domain.enums.OrderStatus;
import com.wealthdesk.domain.enums.OrderType;
import com.wealthdesk.exception.InvalidOrderStateException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;

/**
 * An order accepted by the engine.
 *
 * <p>Orders exist only for submissions that passed pre-trade validation. The status
 * moves PENDING to EXECUTED or FAILED exactly once; the transition methods throw
 * {@link InvalidOrderStateException} on any second attempt. The executor calls them
 * while holding the portfolio's ledger lock, and status fields are volatile so
 * history reads from request threads see the latest state.
 */
@Getter
@Builder
public class Order {

    private final String id;
    private final String portfolioId;
    private final String instrumentId;
    private final OrderSide side;
    private final OrderType orderType;
    private final int quantity;

    /** Only set for LIMIT orders. */
    private final BigDecimal limitPrice;

    private final String createdBy;
    private final LocalDateTime createdAt;
    private final String idempotencyKey;

    @Builder.Default
    private volatile OrderStatus status = OrderStatus.PENDING;

    private volatile LocalDateTime executedAt;
    private volatile BigDecimal executedPrice;
    private volatile String failureReason;

    public boolean isPending() {
        return status == OrderStatus.PENDING;
    }

    /**
     * Price the order fills at: the limit price for LIMIT orders that carry one,
     * otherwise the given market price.
     */
    public BigDecimal resolveExecutionPrice(BigDecimal marketPrice) {
        if (orderType == OrderType.LIMIT && limitPrice != null) {
            return limitPrice;
        }
        return marketPrice;
    }

    public synchronized void markExecuted(BigDecimal price, LocalDateTime at) {
        requirePending(OrderStatus.EXECUTED);
        this.executedPrice = price;
        this.executedAt = at;
        this.status = OrderStatus.EXECUTED;
    }

    public synchronized void markFailed(String reason) {
        requirePending(OrderStatus.FAILED);
        this.failureReason = reason;
        this.status = OrderStatus.FAILED;
    }

    private void requirePending(OrderStatus requested) {
        if (status != OrderStatus.PENDING) {
            throw new InvalidOrderStateException(id, status, requested);
        }
    }
}
