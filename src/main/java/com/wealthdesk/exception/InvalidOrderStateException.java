package com.wealthdesk.exception;

import com.wealthdesk.domain.enums.OrderStatus;
import java.util.Map;

/**
 * Thrown when an order is asked to leave a terminal state. Orders move
 * PENDING to EXECUTED or FAILED exactly once.
 */
public class InvalidOrderStateException extends BaseException {

    public InvalidOrderStateException(String orderId, OrderStatus current, OrderStatus requested) {
        super(
                ErrorCode.INVALID_STATE,
                String.format("Order %s cannot transition from %s to %s", orderId, current, requested),
                Map.of("orderId", orderId, "currentStatus", current.name(), "requestedStatus", requested.name()));
    }
}
