package com.wealthdesk.domain.enums;

/**
 * Lifecycle status of an accepted order.
 * PENDING is the only non-terminal state; an order leaves it exactly once.
 */
public enum OrderStatus {
    PENDING,
    EXECUTED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
